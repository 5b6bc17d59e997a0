package nlfsm;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replaces every {@code delay} action with a synthetic timer state. For {@code A --> B} with
 * actions {@code x, delay 30s, y}: {@code A --> A_wait} keeps the trigger, guard and {@code x};
 * {@code A_wait --> B} fires {@code after 30s} and runs {@code y}.
 */
final class TimerDesugarer {

  static final String TIMER_SUFFIX = "_wait";

  private TimerDesugarer() {}

  static StateMachine desugar(StateMachine ir) {
    Set<String> used = new LinkedHashSet<>(ir.aliases());
    Map<String, Integer> minted = new HashMap<>();
    List<StateMachine.State> states = new ArrayList<>(ir.states());
    List<StateMachine.Transition> out = new ArrayList<>();

    for (StateMachine.Transition t : ir.transitions()) {
      if (t.actions().stream().noneMatch(a -> a instanceof Action.Delay)) {
        out.add(t);
        continue;
      }
      String current = t.source();
      Trigger trigger = t.trigger();
      GuardExpr guard = t.guard();
      List<Action> segment = new ArrayList<>();
      for (Action a : t.actions()) {
        if (a instanceof Action.Delay d) {
          String timer = mint(t.source(), used, minted);
          states.add(new StateMachine.State(timer, timer, true));
          out.add(new StateMachine.Transition(current, timer, trigger, guard, segment));
          current = timer;
          trigger = Trigger.after(d.seconds());
          guard = null;
          segment = new ArrayList<>();
        } else {
          segment.add(a);
        }
      }
      out.add(new StateMachine.Transition(current, t.target(), trigger, guard, segment));
    }
    return ir.withContent(states, out);
  }

  /** {@code S_wait} for the first timer from {@code S}, then {@code S_wait_2}, {@code S_wait_3}, ... */
  private static String mint(String source, Set<String> used, Map<String, Integer> minted) {
    int n = minted.getOrDefault(source, 0);
    String candidate;
    do {
      n++;
      candidate = n == 1 ? source + TIMER_SUFFIX : source + TIMER_SUFFIX + "_" + n;
    } while (used.contains(candidate));
    minted.put(source, n);
    used.add(candidate);
    return candidate;
  }
}

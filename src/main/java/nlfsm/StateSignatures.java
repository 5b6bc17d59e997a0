package nlfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Alias-independent description of a state: its incoming and outgoing transitions with the
 * state itself written as {@code SELF} and timer neighbours as {@code ~timer}. Two states with
 * the same signature play the same role in their machines.
 */
final class StateSignatures {

  static final String SELF = "SELF";
  static final String TIMER = "~timer";
  /** Stands for a neighbour whose identity is still being matched. */
  static final String PENDING = "~pending";

  private StateSignatures() {}

  static Map<String, List<String>> of(StateMachine machine) {
    Map<String, List<String>> out = new LinkedHashMap<>();
    for (StateMachine.State s : machine.states()) {
      out.put(s.alias(), of(machine, s.alias()));
    }
    return out;
  }

  static List<String> of(StateMachine machine, String alias) {
    return of(machine, alias, UnaryOperator.identity());
  }

  /**
   * @param naming maps a neighbour alias to the token written for it; timers and the state
   *     itself are named before it applies
   */
  static List<String> of(StateMachine machine, String alias, UnaryOperator<String> naming) {
    Map<String, StateMachine.State> states = machine.statesByAlias();
    List<String> edges = new ArrayList<>();
    for (StateMachine.Transition t : machine.transitions()) {
      String label = DiagramGrammar.formatLabel(t);
      if (t.source().equals(alias)) {
        edges.add("out|" + name(states, alias, t.target(), naming) + "|" + label);
      }
      if (t.target().equals(alias)) {
        edges.add("in|" + name(states, alias, t.source(), naming) + "|" + label);
      }
    }
    Collections.sort(edges);
    if (alias.equals(machine.initial())) edges.add(0, "initial");
    StateMachine.State self = states.get(alias);
    if (self != null && self.synthetic()) edges.add(0, "synthetic");
    return List.copyOf(edges);
  }

  /** True when the state takes part in no transition and is not initial. */
  static boolean isIsolated(List<String> signature) {
    for (String s : signature) {
      if (!s.equals("synthetic")) return false;
    }
    return true;
  }

  private static String name(
      Map<String, StateMachine.State> states, String self, String other, UnaryOperator<String> naming) {
    if (other.equals(self)) return SELF;
    StateMachine.State s = states.get(other);
    return s != null && s.synthetic() ? TIMER : naming.apply(other);
  }
}

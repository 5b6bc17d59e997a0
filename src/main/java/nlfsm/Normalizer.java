package nlfsm;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Puts IR into canonical form: explicit guard grouping, sorted states and transitions, delays
 * desugared into timer states. {@code normalize(normalize(x)) == normalize(x)}.
 */
public class Normalizer {

  private static final Comparator<StateMachine.State> STATE_ORDER =
      Comparator.comparing(StateMachine.State::alias);

  private static final Comparator<StateMachine.Transition> TRANSITION_ORDER =
      Comparator.comparing(StateMachine.Transition::source)
          .thenComparing(StateMachine.Transition::target)
          .thenComparing(DiagramGrammar::formatLabel);

  public StateMachine normalize(StateMachine ir) {
    return normalize(ir, null);
  }

  /** When {@code baseline} is given, new timer states reuse the baseline's alias for the same role. */
  public StateMachine normalize(StateMachine ir, StateMachine baseline) {
    StateMachine m = canonicalOrder(explicitGroups(ir));
    Set<String> existing = m.aliases();
    m = TimerDesugarer.desugar(m);
    if (baseline != null) {
      m = adoptBaselineTimers(m, existing, baseline);
    }
    return canonicalOrder(m);
  }

  static StateMachine canonicalOrder(StateMachine m) {
    List<StateMachine.State> states = new ArrayList<>(m.states());
    states.sort(STATE_ORDER);
    List<StateMachine.Transition> transitions = new ArrayList<>(m.transitions());
    transitions.sort(TRANSITION_ORDER);
    return m.withContent(states, transitions);
  }

  // ---------------------------------------------------------------- guards

  private static StateMachine explicitGroups(StateMachine m) {
    List<StateMachine.State> states = new ArrayList<>();
    for (StateMachine.State s : m.states()) {
      if (s.invariants().isEmpty()) {
        states.add(s);
        continue;
      }
      List<GuardExpr> invariants = new ArrayList<>();
      for (GuardExpr g : s.invariants()) invariants.add(regroup(g));
      states.add(s.withInvariants(invariants));
    }
    List<StateMachine.Transition> out = new ArrayList<>();
    for (StateMachine.Transition t : m.transitions()) {
      out.add(t.guard() == null ? t
          : new StateMachine.Transition(t.source(), t.target(), t.trigger(), regroup(t.guard()), t.actions()));
    }
    return m.withContent(states, out);
  }

  /**
   * Adds the parentheses the text form needs to read back as the same tree and flattens
   * ungrouped nesting of the same operator.
   */
  static GuardExpr regroup(GuardExpr e) {
    if (e instanceof GuardExpr.And a) {
      List<GuardExpr> ops = new ArrayList<>();
      for (GuardExpr child : a.operands()) {
        GuardExpr c = regroup(child);
        if (c instanceof GuardExpr.And inner) ops.addAll(inner.operands());
        else ops.add(c instanceof GuardExpr.Or ? new GuardExpr.Group(c) : c);
      }
      return new GuardExpr.And(ops);
    }
    if (e instanceof GuardExpr.Or o) {
      List<GuardExpr> ops = new ArrayList<>();
      for (GuardExpr child : o.operands()) {
        GuardExpr c = regroup(child);
        if (c instanceof GuardExpr.Or inner) ops.addAll(inner.operands());
        else ops.add(c);
      }
      return new GuardExpr.Or(ops);
    }
    if (e instanceof GuardExpr.Not n) {
      GuardExpr c = regroup(n.operand());
      return new GuardExpr.Not(c instanceof GuardExpr.And || c instanceof GuardExpr.Or
          ? new GuardExpr.Group(c) : c);
    }
    if (e instanceof GuardExpr.Compare c) {
      return new GuardExpr.Compare(c.op(), operand(regroup(c.left())), operand(regroup(c.right())));
    }
    if (e instanceof GuardExpr.Group g) {
      return new GuardExpr.Group(regroup(g.inner()));
    }
    return e;
  }

  private static GuardExpr operand(GuardExpr e) {
    return e instanceof GuardExpr.Ref || e instanceof GuardExpr.Lit || e instanceof GuardExpr.Group
        ? e : new GuardExpr.Group(e);
  }

  // ---------------------------------------------------------------- timers

  private static StateMachine adoptBaselineTimers(
      StateMachine m, Set<String> existing, StateMachine baseline) {
    Map<String, List<String>> baselineSigs = StateSignatures.of(baseline);
    Set<String> taken = new LinkedHashSet<>(m.aliases());
    List<String> minted = new ArrayList<>();
    for (String alias : m.aliases()) {
      if (!existing.contains(alias)) minted.add(alias);
    }
    for (String timer : minted) {
      List<String> sig = StateSignatures.of(m, timer);
      for (StateMachine.State candidate : baseline.states()) {
        if (!candidate.synthetic() || taken.contains(candidate.alias())) continue;
        if (sig.equals(baselineSigs.get(candidate.alias()))) {
          m = rename(m, timer, candidate.alias());
          taken.remove(timer);
          taken.add(candidate.alias());
          break;
        }
      }
    }
    return m;
  }

  static StateMachine rename(StateMachine m, String from, String to) {
    List<StateMachine.State> states = new ArrayList<>();
    for (StateMachine.State s : m.states()) {
      states.add(s.alias().equals(from) ? s.withAlias(to) : s);
    }
    List<StateMachine.Transition> transitions = new ArrayList<>();
    for (StateMachine.Transition t : m.transitions()) {
      transitions.add(t.withEndpoints(
          t.source().equals(from) ? to : t.source(), t.target().equals(from) ? to : t.target()));
    }
    String initial = m.initial().equals(from) ? to : m.initial();
    return new StateMachine(m.name(), states, transitions, initial, m.catalogVersion());
  }
}

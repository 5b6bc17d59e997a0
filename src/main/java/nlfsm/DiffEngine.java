package nlfsm;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares two machines: states by alias, transitions as multisets of values, initial state by
 * alias. Label and invariant edits are reported separately from state changes.
 */
public class DiffEngine {

  public SemanticDiff diff(StateMachine before, StateMachine after) {
    Map<String, StateMachine.State> b = before.statesByAlias();
    Map<String, StateMachine.State> a = after.statesByAlias();

    List<String> added = new ArrayList<>();
    List<SemanticDiff.LabelChange> labels = new ArrayList<>();
    List<SemanticDiff.InvariantChange> invariants = new ArrayList<>();
    for (StateMachine.State s : after.states()) {
      StateMachine.State old = b.get(s.alias());
      if (old == null) {
        added.add(s.alias());
      } else {
        if (!old.label().equals(s.label())) {
          labels.add(new SemanticDiff.LabelChange(s.alias(), old.label(), s.label()));
        }
        if (!old.invariants().equals(s.invariants())) {
          invariants.add(new SemanticDiff.InvariantChange(s.alias(), old.invariants(), s.invariants()));
        }
      }
    }
    List<String> removed = new ArrayList<>();
    for (StateMachine.State s : before.states()) {
      if (!a.containsKey(s.alias())) removed.add(s.alias());
    }

    return new SemanticDiff(
        before.initial(),
        after.initial(),
        added,
        removed,
        subtract(after.transitions(), before.transitions()),
        subtract(before.transitions(), after.transitions()),
        labels,
        invariants);
  }

  /** Multiset difference {@code left - right}, keeping the order of {@code left}. */
  private static List<StateMachine.Transition> subtract(
      List<StateMachine.Transition> left, List<StateMachine.Transition> right) {
    Map<StateMachine.Transition, Integer> counts = new HashMap<>();
    for (StateMachine.Transition t : right) counts.merge(t, 1, Integer::sum);
    List<StateMachine.Transition> out = new ArrayList<>();
    for (StateMachine.Transition t : left) {
      Integer n = counts.get(t);
      if (n == null || n == 0) {
        out.add(t);
      } else {
        counts.put(t, n - 1);
      }
    }
    return out;
  }
}

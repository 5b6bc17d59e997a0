package nlfsm;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Structural differences between two canonical machines. */
public record SemanticDiff(
    String initialBefore,
    String initialAfter,
    List<String> addedStates,
    List<String> removedStates,
    List<StateMachine.Transition> addedTransitions,
    List<StateMachine.Transition> removedTransitions,
    List<LabelChange> labelChanges,
    List<InvariantChange> invariantChanges) {

  public SemanticDiff {
    addedStates = List.copyOf(addedStates);
    removedStates = List.copyOf(removedStates);
    addedTransitions = List.copyOf(addedTransitions);
    removedTransitions = List.copyOf(removedTransitions);
    labelChanges = List.copyOf(labelChanges);
    invariantChanges = List.copyOf(invariantChanges);
  }

  /** Display label of a state that kept its alias. */
  public record LabelChange(String alias, String before, String after) {}

  /** Invariant list of a state that kept its alias. */
  public record InvariantChange(String alias, List<GuardExpr> before, List<GuardExpr> after) {
    public InvariantChange {
      before = List.copyOf(before);
      after = List.copyOf(after);
    }
  }

  public boolean initialChanged() {
    return !Objects.equals(initialBefore, initialAfter);
  }

  public boolean isEmpty() {
    return !initialChanged() && addedStates.isEmpty() && removedStates.isEmpty()
        && addedTransitions.isEmpty() && removedTransitions.isEmpty() && labelChanges.isEmpty()
        && invariantChanges.isEmpty();
  }

  public List<String> summary() {
    List<String> lines = new ArrayList<>();
    if (isEmpty()) {
      lines.add("No semantic changes.");
      return lines;
    }
    if (initialChanged()) {
      lines.add("initial: " + initialBefore + " -> " + initialAfter);
    }
    for (String s : addedStates) lines.add("+ state " + s);
    for (String s : removedStates) lines.add("- state " + s);
    for (LabelChange c : labelChanges) {
      lines.add("~ state " + c.alias() + " label " + DiagramGrammar.quote(c.before())
          + " -> " + DiagramGrammar.quote(c.after()));
    }
    for (InvariantChange c : invariantChanges) {
      lines.add("~ state " + c.alias() + " invariants " + describe(c.before()) + " -> " + describe(c.after()));
    }
    for (StateMachine.Transition t : addedTransitions) lines.add("+ " + describe(t));
    for (StateMachine.Transition t : removedTransitions) lines.add("- " + describe(t));
    return lines;
  }

  private static String describe(List<GuardExpr> invariants) {
    List<String> parts = new ArrayList<>();
    for (GuardExpr g : invariants) parts.add(DiagramGrammar.GUARD.format(g));
    return "[" + String.join("; ", parts) + "]";
  }

  private static String describe(StateMachine.Transition t) {
    String label = DiagramGrammar.formatLabel(t);
    return t.source() + " --> " + t.target() + (label.isEmpty() ? "" : " : " + label);
  }
}

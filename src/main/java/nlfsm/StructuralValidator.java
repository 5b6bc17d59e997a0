package nlfsm;

import java.util.ArrayList;
import java.util.List;

/** Shape checks against a {@link ShapeSchema}; needs no catalog. */
public class StructuralValidator {

  private final ShapeSchema schema;

  public StructuralValidator(ShapeSchema schema) {
    this.schema = schema;
  }

  public ValidationReport validate(StateMachine ir) {
    List<Diagnostic> out = new ArrayList<>();
    if (schema.requireCatalogVersion() && ir.catalogVersion().isEmpty()) {
      out.add(error("E101", "$.catalogVersion", "Catalog version is required"));
    }

    if (hasLineBreak(ir.name())) {
      out.add(error("E113", "$.name", "Machine name must be one line without control characters"));
    } else if (ir.name().startsWith(DiagramParser.ARROW)) {
      out.add(error("E113", "$.name", "Machine name must not start with '" + DiagramParser.ARROW + "'"));
    }
    if (hasLineBreak(ir.catalogVersion())) {
      out.add(error("E113", "$.catalogVersion",
          "Catalog version must be one line without control characters"));
    }

    int count = ir.states().size();
    if (count < schema.minStates() || count > schema.maxStates()) {
      out.add(error("E104", "$.states", "State count " + count + " outside ["
          + schema.minStates() + ", " + schema.maxStates() + "]"));
    }
    for (int i = 0; i < ir.states().size(); i++) {
      requireShape(out, ir.states().get(i).alias(), "$.states[" + i + "].id", "State alias");
      List<GuardExpr> invariants = ir.states().get(i).invariants();
      for (int j = 0; j < invariants.size(); j++) {
        guardShape(out, invariants.get(j), "$.states[" + i + "].invariants[" + j + "]");
      }
    }

    for (int i = 0; i < ir.transitions().size(); i++) {
      validateTransition(out, ir, ir.transitions().get(i), "$.transitions[" + i + "]");
    }
    return ValidationReport.of(out);
  }

  private void guardShape(List<Diagnostic> out, GuardExpr guard, String loc) {
    if (isLeaf(GuardExpr.unwrap(guard))) {
      out.add(error("E120", loc, "Guard must be a comparison or a boolean combination of comparisons"));
    } else {
      validateGuard(out, guard, loc);
    }
  }

  private void validateTransition(
      List<Diagnostic> out, StateMachine ir, StateMachine.Transition t, String path) {
    if (t.isImmediate()) {
      boolean synthetic = ir.findState(t.source()).map(StateMachine.State::synthetic).orElse(false);
      if (!synthetic) {
        out.add(error("E112", path, "Transition from '" + t.source()
            + "' needs a trigger or guard; only timer states may continue immediately"));
      }
    }

    if (t.trigger() != null) {
      List<Trigger.Condition> conditions = t.trigger().conditions();
      for (int j = 0; j < conditions.size(); j++) {
        validateCondition(out, conditions.get(j), path + ".triggers[" + j + "]");
      }
    }

    if (t.guard() != null) {
      guardShape(out, t.guard(), path + ".guard");
    }

    if (t.actions().size() > schema.maxActionsPerTransition()) {
      out.add(error("E105", path + ".actions", "Too many actions: " + t.actions().size()
          + " > " + schema.maxActionsPerTransition()));
    }
    for (int j = 0; j < t.actions().size(); j++) {
      Action a = t.actions().get(j);
      String loc = path + ".actions[" + j + "]";
      if (a instanceof Action.Delay d) {
        out.add(error("E107", loc, "Delay of " + d.seconds()
            + "s must be desugared into a timer state"));
      } else if (a instanceof Action.Command c) {
        requireShape(out, c.device(), loc + ".device", "Device id");
        requireShape(out, c.command(), loc + ".command", "Command name");
      }
    }
  }

  private void validateCondition(List<Diagnostic> out, Trigger.Condition c, String loc) {
    if (!schema.triggerKinds().contains(c.kind())) {
      out.add(error("E109", loc, "Trigger kind '" + c.kind() + "' is not allowed"));
    }
    if (c instanceof Trigger.After a) {
      checkDuration(out, a.seconds(), loc);
    } else if (c instanceof Trigger.Schedule s) {
      String expr = s.expression();
      if (expr.contains(DiagramGrammar.TRIGGER_SEPARATOR) || expr.contains(DiagramGrammar.LABEL_BREAK)
          || expr.indexOf('"') >= 0 || hasLineBreak(expr)) {
        out.add(error("E108", loc,
            "Schedule expression must not contain ' AND ', quotes, '\\n' or line breaks"));
      }
    } else if (c instanceof Trigger.Becomes b) {
      requireShape(out, b.ref().device(), loc + ".ref.device", "Device id");
    } else if (c instanceof Trigger.Changes ch) {
      requireShape(out, ch.ref().device(), loc + ".ref.device", "Device id");
    }
  }

  private void checkDuration(List<Diagnostic> out, long seconds, String loc) {
    if (seconds <= 0 || seconds > schema.maxDurationSeconds()) {
      out.add(error("E106", loc, "Duration " + seconds + "s outside (0, "
          + schema.maxDurationSeconds() + "]"));
    }
  }

  private void validateGuard(List<Diagnostic> out, GuardExpr expr, String loc) {
    if (expr instanceof GuardExpr.Compare c) {
      for (GuardExpr side : c.children()) {
        if (!isLeaf(GuardExpr.unwrap(side))) {
          out.add(error("E120", loc, "Operands of '" + c.op().symbol()
              + "' must be attribute references or literals"));
          return;
        }
      }
      return;
    }
    if (expr instanceof GuardExpr.And || expr instanceof GuardExpr.Or
        || expr instanceof GuardExpr.Not) {
      for (GuardExpr child : expr.children()) {
        if (isLeaf(GuardExpr.unwrap(child))) {
          out.add(error("E120", loc, "Bare value cannot be an operand of a boolean operator"));
          return;
        }
      }
    }
    for (GuardExpr child : expr.children()) {
      validateGuard(out, child, loc);
    }
  }

  private static boolean hasLineBreak(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (DiagramGrammar.breaksLine(s.charAt(i))) return true;
    }
    return false;
  }

  private static boolean isLeaf(GuardExpr e) {
    return e instanceof GuardExpr.Ref || e instanceof GuardExpr.Lit;
  }

  private void requireShape(List<Diagnostic> out, String value, String loc, String what) {
    if (!schema.identifier().matcher(value).matches()) {
      out.add(error("E103", loc, what + " '" + value + "' does not match "
          + schema.identifier().pattern()));
    }
  }

  private static Diagnostic error(String code, String location, String message) {
    return Diagnostic.error(Diagnostic.Kind.STRUCTURAL, code, location, message);
  }
}

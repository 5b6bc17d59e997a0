package nlfsm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks device, attribute and command references against the catalog. Every finding is
 * accumulated; nothing here stops early.
 */
public class DomainValidator {

  private static final Map<String, String> OPPOSITES = Map.of(
      "on", "off", "off", "on",
      "lock", "unlock", "unlock", "lock",
      "open", "close", "close", "open");

  private final Catalog catalog;

  public DomainValidator(Catalog catalog) {
    this.catalog = catalog;
  }

  public ValidationReport validate(StateMachine ir) {
    Check check = new Check();
    for (int i = 0; i < ir.states().size(); i++) {
      List<GuardExpr> invariants = ir.states().get(i).invariants();
      for (int j = 0; j < invariants.size(); j++) {
        check.guard(invariants.get(j), "$.states[" + i + "].invariants[" + j + "]");
      }
    }
    for (int i = 0; i < ir.transitions().size(); i++) {
      check.transition(ir.transitions().get(i), "$.transitions[" + i + "]");
    }
    check.reachability(ir);
    return ValidationReport.of(check.out);
  }

  private final class Check {
    private final List<Diagnostic> out = new ArrayList<>();
    private final Set<String> missingCapabilityReported = new HashSet<>();

    void transition(StateMachine.Transition t, String path) {
      if (t.trigger() != null) {
        List<Trigger.Condition> conditions = t.trigger().conditions();
        for (int j = 0; j < conditions.size(); j++) {
          String loc = path + ".triggers[" + j + "]";
          Trigger.Condition c = conditions.get(j);
          if (c instanceof Trigger.Becomes b) {
            Catalog.AttributeSpec spec = attribute(b.ref(), loc + ".ref");
            if (spec != null) literal(b.ref(), spec, b.value(), loc + ".value");
          } else if (c instanceof Trigger.Changes ch) {
            attribute(ch.ref(), loc + ".ref");
          }
        }
      }
      if (t.guard() != null) {
        guard(t.guard(), path + ".guard");
      }
      for (int j = 0; j < t.actions().size(); j++) {
        if (t.actions().get(j) instanceof Action.Command c) {
          command(c, path + ".actions[" + j + "]");
        }
      }
      contradictions(t, path);
    }

    void guard(GuardExpr expr, String loc) {
      if (expr instanceof GuardExpr.Compare c) {
        GuardExpr left = GuardExpr.unwrap(c.left());
        GuardExpr right = GuardExpr.unwrap(c.right());
        if (left instanceof GuardExpr.Ref r && right instanceof GuardExpr.Lit l) {
          comparison(r.ref(), c.op(), l.value(), loc);
        } else if (right instanceof GuardExpr.Ref r && left instanceof GuardExpr.Lit l) {
          comparison(r.ref(), c.op(), l.value(), loc);
        } else {
          if (left instanceof GuardExpr.Ref r) attribute(r.ref(), loc);
          if (right instanceof GuardExpr.Ref r) attribute(r.ref(), loc);
        }
        return;
      }
      if (expr instanceof GuardExpr.Ref r) {
        attribute(r.ref(), loc);
        return;
      }
      for (GuardExpr child : expr.children()) guard(child, loc);
    }

    private void comparison(AttributeRef ref, GuardExpr.Operator op, Literal value, String loc) {
      Catalog.AttributeSpec spec = attribute(ref, loc);
      if (spec == null) return;
      if (op.isOrdering() && !spec.isNumeric()) {
        out.add(error("E400", loc, "Operator '" + op.symbol() + "' needs a numeric attribute but '"
            + ref.text() + "' is " + spec.type().jsonName()));
        return;
      }
      literal(ref, spec, value, loc);
    }

    private void literal(AttributeRef ref, Catalog.AttributeSpec spec, Literal value, String loc) {
      if (!spec.type().accepts(value)) {
        out.add(error("E210", loc, "Attribute '" + ref.text() + "' is " + spec.type().jsonName()
            + " but the value is " + value.typeName()));
        return;
      }
      if (spec.type() == Catalog.ValueType.ENUM && value instanceof Literal.Text t
          && !spec.values().isEmpty() && !spec.values().contains(t.value())) {
        out.add(error("E220", loc, "Value '" + t.value() + "' is not one of the values of '"
            + ref.text() + "'").withSuggestions(spec.values()));
      }
    }

    private Catalog.AttributeSpec attribute(AttributeRef ref, String loc) {
      Catalog.Device device = device(ref.device(), loc);
      if (device == null) return null;
      Catalog.AttributeSpec spec = catalog.attribute(device, ref.attribute());
      if (spec == null) {
        out.add(error("E200", loc, "Unknown attribute '" + ref.attribute() + "' for device '"
            + ref.device() + "'").withSuggestions(catalog.attributeNames(device)));
      }
      return spec;
    }

    private void command(Action.Command c, String loc) {
      Catalog.Device device = device(c.device(), loc);
      if (device == null) return;
      List<Catalog.ValueType> params = catalog.command(device, c.command());
      if (params == null) {
        out.add(error("E300", loc, "Unknown command '" + c.command() + "' for device '"
            + c.device() + "'").withSuggestions(catalog.commandNames(device)));
        return;
      }
      if (params.size() != c.args().size()) {
        out.add(error("E310", loc, "Command '" + c.device() + "." + c.command() + "' expects "
            + params.size() + " argument(s) but got " + c.args().size()));
        return;
      }
      for (int k = 0; k < params.size(); k++) {
        Literal arg = c.args().get(k);
        if (!params.get(k).accepts(arg)) {
          out.add(error("E320", loc + ".args[" + k + "]", "Argument " + (k + 1) + " of '"
              + c.device() + "." + c.command() + "' must be " + params.get(k).jsonName()
              + " but is " + arg.typeName()));
        }
      }
    }

    private Catalog.Device device(String id, String loc) {
      Catalog.Device device = catalog.device(id).orElse(null);
      if (device == null) {
        out.add(error("E110", loc, "Unknown device '" + id + "'")
            .withSuggestions(catalog.deviceIds()));
        return null;
      }
      for (String cap : device.capabilities()) {
        if (!catalog.capabilities().containsKey(cap)
            && missingCapabilityReported.add(id + "/" + cap)) {
          out.add(error("E205", loc, "Device '" + id + "' declares capability '" + cap
              + "' which the catalog does not define"));
        }
      }
      return device;
    }

    private void contradictions(StateMachine.Transition t, String path) {
      Set<String> seen = new LinkedHashSet<>();
      for (Action a : t.actions()) {
        if (!(a instanceof Action.Command c)) continue;
        String opposite = OPPOSITES.get(c.command());
        if (opposite != null && seen.contains(c.device() + "." + opposite)) {
          out.add(error("E530", path + ".actions", "Contradictory commands '" + opposite
              + "' and '" + c.command() + "' on device '" + c.device() + "'"));
        }
        seen.add(c.device() + "." + c.command());
      }
    }

    void reachability(StateMachine ir) {
      Set<String> reached = new HashSet<>();
      Deque<String> queue = new ArrayDeque<>();
      queue.add(ir.initial());
      reached.add(ir.initial());
      while (!queue.isEmpty()) {
        for (StateMachine.Transition t : ir.outgoing(queue.poll())) {
          if (reached.add(t.target())) queue.add(t.target());
        }
      }
      for (int i = 0; i < ir.states().size(); i++) {
        String alias = ir.states().get(i).alias();
        if (!reached.contains(alias)) {
          out.add(Diagnostic.warning(Diagnostic.Kind.DOMAIN, "W500", "$.states[" + i + "]",
              "State '" + alias + "' is unreachable from '" + ir.initial() + "'"));
        }
      }
    }
  }

  private static Diagnostic error(String code, String location, String message) {
    return Diagnostic.error(Diagnostic.Kind.DOMAIN, code, location, message);
  }
}

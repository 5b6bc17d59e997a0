package nlfsm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * JSON form of the IR, validation reports and diffs. Reading never throws on bad input: every
 * problem becomes a structural diagnostic anchored at its JSON path.
 */
public final class IrJson {

  private IrJson() {}

  /** Reader outcome; {@code machine} is null when any error was found. */
  public record ReadResult(StateMachine machine, List<Diagnostic> diagnostics) {
    public ReadResult {
      diagnostics = List.copyOf(diagnostics);
    }

    public boolean ok() {
      return machine != null;
    }

    public ValidationReport report() {
      return ValidationReport.of(diagnostics);
    }
  }

  public static ReadResult read(JsonNode root) {
    return new Reader().readMachine(root);
  }

  /** Reads trusted JSON (a stored baseline); any diagnostic is an error. */
  public static StateMachine readStrict(JsonNode root) {
    ReadResult result = read(root);
    if (!result.ok()) {
      throw new IllegalArgumentException(
          "Invalid IR JSON: " + String.join("; ", result.report().summary(5)));
    }
    return result.machine();
  }

  // ---------------------------------------------------------------- reading

  /** Collects diagnostics across reads; also used for the IR fragments inside patches. */
  static final class Reader {
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    List<Diagnostic> diagnostics() {
      return diagnostics;
    }

    ReadResult readMachine(JsonNode root) {
      if (root == null || !root.isObject()) {
        fail("$", "IR must be a JSON object");
        return new ReadResult(null, diagnostics);
      }
      String name = root.path("name").asText("");
      if (name.isBlank()) {
        fail("$.name", "Missing machine name");
      }
      String initial = text(root, "initial", "$.initial");

      List<StateMachine.State> states = new ArrayList<>();
      JsonNode statesNode = root.path("states");
      if (!statesNode.isArray() || statesNode.isEmpty()) {
        fail("$.states", "Expected a non-empty array of states");
      } else {
        for (int i = 0; i < statesNode.size(); i++) {
          StateMachine.State s = readState(statesNode.get(i), "$.states[" + i + "]");
          if (s != null) states.add(s);
        }
      }

      List<StateMachine.Transition> transitions = new ArrayList<>();
      JsonNode transitionsNode = root.path("transitions");
      if (!transitionsNode.isMissingNode() && !transitionsNode.isNull()) {
        if (!transitionsNode.isArray()) {
          fail("$.transitions", "Expected an array of transitions");
        } else {
          for (int i = 0; i < transitionsNode.size(); i++) {
            StateMachine.Transition t =
                readTransition(transitionsNode.get(i), "$.transitions[" + i + "]");
            if (t != null) transitions.add(t);
          }
        }
      }

      checkReferences(states, transitions, initial);
      if (hasErrors()) {
        return new ReadResult(null, diagnostics);
      }
      try {
        StateMachine machine = new StateMachine(
            name, states, transitions, initial, root.path("catalogVersion").asText(""));
        return new ReadResult(machine, diagnostics);
      } catch (IllegalArgumentException e) {
        fail("$", e.getMessage());
        return new ReadResult(null, diagnostics);
      }
    }

    private void checkReferences(
        List<StateMachine.State> states, List<StateMachine.Transition> transitions, String initial) {
      Set<String> aliases = new HashSet<>();
      for (int i = 0; i < states.size(); i++) {
        String alias = states.get(i).alias();
        if (!aliases.add(alias)) {
          diagnostics.add(Diagnostic.error(Diagnostic.Kind.STRUCTURAL, "E102",
              "$.states[" + i + "].id", "Duplicate state alias '" + alias + "'"));
        }
      }
      if (initial != null && !aliases.isEmpty() && !aliases.contains(initial)) {
        diagnostics.add(Diagnostic.error(Diagnostic.Kind.STRUCTURAL, "E111", "$.initial",
            "Unknown initial state '" + initial + "'")
            .withSuggestions(List.copyOf(aliases)));
      }
      for (int i = 0; i < transitions.size(); i++) {
        StateMachine.Transition t = transitions.get(i);
        if (!aliases.contains(t.source())) {
          unknownEndpoint("$.transitions[" + i + "].from", t.source());
        }
        if (!aliases.contains(t.target())) {
          unknownEndpoint("$.transitions[" + i + "].to", t.target());
        }
      }
    }

    private void unknownEndpoint(String location, String alias) {
      diagnostics.add(Diagnostic.error(Diagnostic.Kind.STRUCTURAL, "E111", location,
          "Unknown state '" + alias + "'"));
    }

    private StateMachine.State readState(JsonNode node, String path) {
      if (!node.isObject()) {
        fail(path, "Expected a state object");
        return null;
      }
      String alias = node.has("id") ? node.path("id").asText() : node.path("alias").asText("");
      if (!Names.isIdentifier(alias)) {
        fail(path + ".id", "Invalid state alias '" + alias + "'");
        return null;
      }
      List<GuardExpr> invariants = new ArrayList<>();
      JsonNode invariantsNode = node.path("invariants");
      if (!invariantsNode.isMissingNode() && !invariantsNode.isNull() && !invariantsNode.isArray()) {
        fail(path + ".invariants", "Expected an array of guards");
      }
      for (int i = 0; i < invariantsNode.size(); i++) {
        GuardExpr g = readGuard(invariantsNode.get(i), path + ".invariants[" + i + "]");
        if (g != null) invariants.add(g);
      }
      return new StateMachine.State(
          alias, node.path("label").asText(alias), node.path("synthetic").asBoolean(false), invariants);
    }

    private StateMachine.Transition readTransition(JsonNode node, String path) {
      if (!node.isObject()) {
        fail(path, "Expected a transition object");
        return null;
      }
      int before = diagnostics.size();
      String from = identifier(node, "from", path + ".from");
      String to = identifier(node, "to", path + ".to");

      Trigger trigger = null;
      JsonNode triggersNode = node.path("triggers");
      if (triggersNode.isArray() && !triggersNode.isEmpty()) {
        List<Trigger.Condition> conditions = new ArrayList<>();
        for (int i = 0; i < triggersNode.size(); i++) {
          Trigger.Condition c = readCondition(triggersNode.get(i), path + ".triggers[" + i + "]");
          if (c != null) conditions.add(c);
        }
        if (!conditions.isEmpty()) trigger = new Trigger(conditions);
      } else if (!triggersNode.isMissingNode() && !triggersNode.isNull() && !triggersNode.isArray()) {
        fail(path + ".triggers", "Expected an array of triggers");
      }

      GuardExpr guard = null;
      JsonNode guardNode = node.path("guard");
      if (!guardNode.isMissingNode() && !guardNode.isNull()) {
        guard = readGuard(guardNode, path + ".guard");
      }

      List<Action> actions = new ArrayList<>();
      JsonNode actionsNode = node.path("actions");
      if (actionsNode.isArray()) {
        for (int i = 0; i < actionsNode.size(); i++) {
          Action a = readAction(actionsNode.get(i), path + ".actions[" + i + "]");
          if (a != null) actions.add(a);
        }
      } else if (!actionsNode.isMissingNode() && !actionsNode.isNull()) {
        fail(path + ".actions", "Expected an array of actions");
      }

      if (diagnostics.size() > before) return null;
      return new StateMachine.Transition(from, to, trigger, guard, actions);
    }

    Trigger.Condition readCondition(JsonNode node, String path) {
      String type = node.path("type").asText("");
      try {
        return switch (type) {
          case "becomes" -> {
            AttributeRef ref = readRef(node.path("ref"), path + ".ref");
            Literal value = readLiteral(node.path("value"), path + ".value");
            yield ref == null || value == null ? null : new Trigger.Becomes(ref, value);
          }
          case "changes" -> {
            AttributeRef ref = readRef(node.path("ref"), path + ".ref");
            yield ref == null ? null : new Trigger.Changes(ref);
          }
          case "after" -> new Trigger.After(seconds(node, path));
          case "schedule" -> new Trigger.Schedule(
              node.has("expression") ? node.path("expression").asText() : node.path("cron").asText(""));
          default -> {
            fail(path + ".type", "Unknown trigger type '" + type + "'");
            yield null;
          }
        };
      } catch (IllegalArgumentException e) {
        fail(path, e.getMessage());
        return null;
      }
    }

    Action readAction(JsonNode node, String path) {
      String type = node.path("type").asText("");
      try {
        return switch (type) {
          case "command" -> {
            List<Literal> args = new ArrayList<>();
            JsonNode argsNode = node.path("args");
            for (int i = 0; i < argsNode.size(); i++) {
              Literal lit = readLiteral(argsNode.get(i), path + ".args[" + i + "]");
              if (lit != null) args.add(lit);
            }
            yield new Action.Command(
                node.path("device").asText(""), node.path("command").asText(""), args);
          }
          case "delay" -> new Action.Delay(seconds(node, path));
          case "notify" -> new Action.Notify(node.path("message").asText(""));
          default -> {
            fail(path + ".type", "Unknown action type '" + type + "'");
            yield null;
          }
        };
      } catch (IllegalArgumentException e) {
        fail(path, e.getMessage());
        return null;
      }
    }

    GuardExpr readGuard(JsonNode node, String path) {
      if (node.has("ref")) {
        AttributeRef ref = readRef(node.path("ref"), path + ".ref");
        return ref == null ? null : new GuardExpr.Ref(ref);
      }
      if (node.has("lit")) {
        Literal lit = readLiteral(node.path("lit"), path + ".lit");
        return lit == null ? null : new GuardExpr.Lit(lit);
      }
      String op = node.path("op").asText("");
      JsonNode argsNode = node.path("args");
      List<GuardExpr> args = new ArrayList<>();
      boolean broken = false;
      for (int i = 0; i < argsNode.size(); i++) {
        GuardExpr arg = readGuard(argsNode.get(i), path + ".args[" + i + "]");
        if (arg == null) broken = true;
        else args.add(arg);
      }
      if (broken) return null;
      try {
        switch (op) {
          case "and":
            return new GuardExpr.And(args);
          case "or":
            return new GuardExpr.Or(args);
          case "not":
            requireArity(args, 1, op);
            return new GuardExpr.Not(args.get(0));
          case "group":
            requireArity(args, 1, op);
            return new GuardExpr.Group(args.get(0));
          default:
            GuardExpr.Operator cmp = GuardExpr.Operator.fromJsonName(op);
            if (cmp == null) {
              fail(path + ".op", "Unknown guard operator '" + op + "'");
              return null;
            }
            requireArity(args, 2, op);
            return new GuardExpr.Compare(cmp, args.get(0), args.get(1));
        }
      } catch (IllegalArgumentException e) {
        fail(path, e.getMessage());
        return null;
      }
    }

    private void requireArity(List<GuardExpr> args, int expected, String op) {
      if (args.size() != expected) {
        throw new IllegalArgumentException(
            "'" + op + "' expects " + expected + " operand(s) but found " + args.size());
      }
    }

    private AttributeRef readRef(JsonNode node, String path) {
      if (!node.isObject()) {
        fail(path, "Expected {device, attribute}");
        return null;
      }
      try {
        return new AttributeRef(node.path("device").asText(""), node.path("attribute").asText(""));
      } catch (IllegalArgumentException e) {
        fail(path, e.getMessage());
        return null;
      }
    }

    private Literal readLiteral(JsonNode node, String path) {
      if (node.isObject()) {
        if (node.has("string")) return Literal.text(node.path("string").asText());
        if (node.has("bool")) return Literal.bool(node.path("bool").asBoolean());
        if (node.has("number")) return number(node.path("number"), path + ".number");
      } else if (node.isTextual()) {
        return Literal.text(node.asText());
      } else if (node.isBoolean()) {
        return Literal.bool(node.asBoolean());
      } else if (node.isNumber()) {
        return number(node, path);
      }
      fail(path, "Expected a literal ({string}, {number} or {bool})");
      return null;
    }

    private Literal number(JsonNode node, String path) {
      if (!node.isNumber()) {
        fail(path, "Expected a number");
        return null;
      }
      if (node.isIntegralNumber()) {
        if (!node.canConvertToLong()) {
          fail(path, "Integer out of range: " + node.asText());
          return null;
        }
        return Literal.integer(node.longValue());
      }
      return new Literal.Decimal(node.decimalValue());
    }

    private long seconds(JsonNode node, String path) {
      JsonNode s = node.path("seconds");
      if (!s.isIntegralNumber()) {
        throw new IllegalArgumentException("Expected integral 'seconds' at " + path);
      }
      return s.longValue();
    }

    private String text(JsonNode node, String field, String path) {
      JsonNode v = node.path(field);
      if (!v.isTextual() || v.asText().isBlank()) {
        fail(path, "Missing '" + field + "'");
        return null;
      }
      return v.asText();
    }

    private String identifier(JsonNode node, String field, String path) {
      String v = text(node, field, path);
      if (v != null && !Names.isIdentifier(v)) {
        fail(path, "Invalid identifier '" + v + "'");
        return null;
      }
      return v;
    }

    private boolean hasErrors() {
      return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    private void fail(String location, String message) {
      diagnostics.add(Diagnostic.error(Diagnostic.Kind.STRUCTURAL, "E100", location, message));
    }
  }

  // ---------------------------------------------------------------- writing

  public static ObjectNode write(StateMachine machine) {
    ObjectNode root = Json.MAPPER.createObjectNode();
    root.put("name", machine.name());
    root.put("catalogVersion", machine.catalogVersion());
    root.put("initial", machine.initial());
    ArrayNode states = root.putArray("states");
    for (StateMachine.State s : machine.states()) {
      ObjectNode n = states.addObject();
      n.put("id", s.alias());
      n.put("label", s.label());
      n.put("synthetic", s.synthetic());
      if (!s.invariants().isEmpty()) {
        ArrayNode invariants = n.putArray("invariants");
        for (GuardExpr g : s.invariants()) invariants.add(writeGuard(g));
      }
    }
    ArrayNode transitions = root.putArray("transitions");
    for (StateMachine.Transition t : machine.transitions()) {
      transitions.add(writeTransition(t));
    }
    return root;
  }

  public static ObjectNode writeTransition(StateMachine.Transition t) {
    ObjectNode n = Json.MAPPER.createObjectNode();
    n.put("from", t.source());
    n.put("to", t.target());
    ArrayNode triggers = n.putArray("triggers");
    if (t.trigger() != null) {
      for (Trigger.Condition c : t.trigger().conditions()) triggers.add(writeCondition(c));
    }
    if (t.guard() != null) {
      n.set("guard", writeGuard(t.guard()));
    }
    ArrayNode actions = n.putArray("actions");
    for (Action a : t.actions()) actions.add(writeAction(a));
    return n;
  }

  private static ObjectNode writeCondition(Trigger.Condition c) {
    ObjectNode n = Json.MAPPER.createObjectNode();
    n.put("type", c.kind());
    if (c instanceof Trigger.Becomes b) {
      n.set("ref", writeRef(b.ref()));
      n.set("value", writeLiteral(b.value()));
    } else if (c instanceof Trigger.Changes ch) {
      n.set("ref", writeRef(ch.ref()));
    } else if (c instanceof Trigger.After a) {
      n.put("seconds", a.seconds());
    } else if (c instanceof Trigger.Schedule s) {
      n.put("expression", s.expression());
    }
    return n;
  }

  private static ObjectNode writeAction(Action a) {
    ObjectNode n = Json.MAPPER.createObjectNode();
    n.put("type", a.kind());
    if (a instanceof Action.Command c) {
      n.put("device", c.device());
      n.put("command", c.command());
      ArrayNode args = n.putArray("args");
      for (Literal lit : c.args()) args.add(writeLiteral(lit));
    } else if (a instanceof Action.Delay d) {
      n.put("seconds", d.seconds());
    } else if (a instanceof Action.Notify nt) {
      n.put("message", nt.message());
    }
    return n;
  }

  private static ObjectNode writeGuard(GuardExpr expr) {
    ObjectNode n = Json.MAPPER.createObjectNode();
    if (expr instanceof GuardExpr.Ref r) {
      n.set("ref", writeRef(r.ref()));
      return n;
    }
    if (expr instanceof GuardExpr.Lit l) {
      n.set("lit", writeLiteral(l.value()));
      return n;
    }
    String op;
    if (expr instanceof GuardExpr.Compare c) op = c.op().jsonName();
    else if (expr instanceof GuardExpr.And) op = "and";
    else if (expr instanceof GuardExpr.Or) op = "or";
    else if (expr instanceof GuardExpr.Not) op = "not";
    else op = "group";
    n.put("op", op);
    ArrayNode args = n.putArray("args");
    for (GuardExpr child : expr.children()) args.add(writeGuard(child));
    return n;
  }

  private static ObjectNode writeRef(AttributeRef ref) {
    ObjectNode n = Json.MAPPER.createObjectNode();
    n.put("device", ref.device());
    n.put("attribute", ref.attribute());
    return n;
  }

  private static ObjectNode writeLiteral(Literal lit) {
    ObjectNode n = Json.MAPPER.createObjectNode();
    if (lit instanceof Literal.Text t) n.put("string", t.value());
    else if (lit instanceof Literal.Int i) n.put("number", i.value());
    else if (lit instanceof Literal.Decimal d) n.put("number", d.value());
    else if (lit instanceof Literal.Bool b) n.put("bool", b.value());
    return n;
  }

  public static ObjectNode write(ValidationReport report) {
    ObjectNode root = Json.MAPPER.createObjectNode();
    root.put("ok", report.ok());
    ArrayNode list = root.putArray("diagnostics");
    for (Diagnostic d : report.diagnostics()) {
      ObjectNode n = list.addObject();
      n.put("severity", d.severity().name());
      n.put("kind", d.kind().name());
      n.put("code", d.code());
      n.put("location", d.location());
      n.put("message", d.message());
      ArrayNode suggestions = n.putArray("suggestions");
      d.suggestions().forEach(suggestions::add);
    }
    return root;
  }

  public static ObjectNode write(SemanticDiff diff) {
    ObjectNode root = Json.MAPPER.createObjectNode();
    ObjectNode initial = root.putObject("initial");
    initial.put("before", diff.initialBefore());
    initial.put("after", diff.initialAfter());
    ArrayNode added = root.putArray("addedStates");
    diff.addedStates().forEach(added::add);
    ArrayNode removed = root.putArray("removedStates");
    diff.removedStates().forEach(removed::add);
    ArrayNode addedT = root.putArray("addedTransitions");
    diff.addedTransitions().forEach(t -> addedT.add(writeTransition(t)));
    ArrayNode removedT = root.putArray("removedTransitions");
    diff.removedTransitions().forEach(t -> removedT.add(writeTransition(t)));
    ArrayNode labels = root.putArray("labelChanges");
    for (SemanticDiff.LabelChange c : diff.labelChanges()) {
      ObjectNode n = labels.addObject();
      n.put("alias", c.alias());
      n.put("before", c.before());
      n.put("after", c.after());
    }
    ArrayNode invariants = root.putArray("invariantChanges");
    for (SemanticDiff.InvariantChange c : diff.invariantChanges()) {
      ObjectNode n = invariants.addObject();
      n.put("alias", c.alias());
      ArrayNode before = n.putArray("before");
      c.before().forEach(g -> before.add(writeGuard(g)));
      ArrayNode after = n.putArray("after");
      c.after().forEach(g -> after.add(writeGuard(g)));
    }
    ArrayNode summary = root.putArray("summary");
    diff.summary().forEach(summary::add);
    return root;
  }
}

package nlfsm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A constrained edit of a canonical machine: an ordered list of edits applied to a parent IR.
 *
 * <pre>
 * { "summary": "...", "edits": [ { "op": "set_state_label", "state_id": "Idle", "label": "Off" }, ... ] }
 * </pre>
 *
 * Transitions are addressed by their endpoints; {@code index} picks the Nth transition among
 * those sharing the same pair, not a position in the whole list.
 */
public record IrPatch(String summary, List<Edit> edits) {

  public IrPatch {
    summary = summary == null ? "" : summary.trim();
    edits = List.copyOf(edits);
  }

  public sealed interface Edit
      permits SetLabel, SetInitial, AddState, RemoveState, AddTransition, RemoveTransition, UpdateTransition {}

  public record SetLabel(String state, String label) implements Edit {}

  public record SetInitial(String state) implements Edit {}

  public record AddState(String state, String label) implements Edit {}

  /** Also drops every transition into or out of the state. */
  public record RemoveState(String state) implements Edit {}

  public record AddTransition(StateMachine.Transition transition) implements Edit {}

  public record RemoveTransition(String from, String to, Integer index) implements Edit {}

  /**
   * Null {@code newFrom}, {@code newTo}, {@code triggers} and {@code actions} leave the field as it
   * is; an empty list clears it. The guard is replaced only when {@code replaceGuard} is set.
   */
  public record UpdateTransition(
      String from,
      String to,
      Integer index,
      String newFrom,
      String newTo,
      List<Trigger.Condition> triggers,
      boolean replaceGuard,
      GuardExpr guard,
      List<Action> actions) implements Edit {

    public UpdateTransition {
      triggers = triggers == null ? null : List.copyOf(triggers);
      actions = actions == null ? null : List.copyOf(actions);
    }
  }

  /** An edit that does not fit the machine it is applied to. */
  public static final class EditFailure extends IllegalArgumentException {
    private final int index;

    EditFailure(int index, String message) {
      super(message);
      this.index = index;
    }

    /** Position of the failing edit in {@code edits}. */
    public int index() {
      return index;
    }
  }

  /** Reader outcome; {@code patch} is null when any error was found. */
  public record ReadResult(IrPatch patch, List<Diagnostic> diagnostics) {
    public ReadResult {
      diagnostics = List.copyOf(diagnostics);
    }

    public boolean ok() {
      return patch != null;
    }

    public ValidationReport report() {
      return ValidationReport.of(diagnostics);
    }
  }

  // ---------------------------------------------------------------- applying

  public StateMachine apply(StateMachine parent) {
    Map<String, StateMachine.State> states = new LinkedHashMap<>(parent.statesByAlias());
    List<StateMachine.Transition> transitions = new ArrayList<>(parent.transitions());
    String initial = parent.initial();

    for (int i = 0; i < edits.size(); i++) {
      Edit edit = edits.get(i);
      if (edit instanceof SetLabel e) {
        states.put(e.state(), ensure(states, e.state()).withLabel(e.label()));
      } else if (edit instanceof SetInitial e) {
        ensure(states, e.state());
        initial = e.state();
      } else if (edit instanceof AddState e) {
        StateMachine.State s = ensure(states, e.state());
        if (e.label() != null && !e.label().isBlank()) states.put(e.state(), s.withLabel(e.label()));
      } else if (edit instanceof RemoveState e) {
        if (e.state().equals(initial)) {
          throw new EditFailure(i, "Cannot remove the initial state '" + e.state() + "'; set another initial first");
        }
        states.remove(e.state());
        transitions.removeIf(t -> t.source().equals(e.state()) || t.target().equals(e.state()));
      } else if (edit instanceof AddTransition e) {
        ensure(states, e.transition().source());
        ensure(states, e.transition().target());
        transitions.add(e.transition());
      } else if (edit instanceof RemoveTransition e) {
        List<Integer> matches = matching(transitions, e.from(), e.to());
        if (matches.isEmpty()) continue;
        int pick = e.index() == null ? 0 : e.index();
        if (pick < 0 || pick >= matches.size()) {
          throw new EditFailure(i, outOfRange(e.from(), e.to(), pick, matches.size()));
        }
        transitions.remove((int) matches.get(pick));
      } else if (edit instanceof UpdateTransition e) {
        int at = pickForUpdate(i, transitions, e);
        StateMachine.Transition t = transitions.get(at);
        String source = e.newFrom() == null ? t.source() : e.newFrom();
        String target = e.newTo() == null ? t.target() : e.newTo();
        ensure(states, source);
        ensure(states, target);
        Trigger trigger = e.triggers() == null ? t.trigger()
            : e.triggers().isEmpty() ? null : new Trigger(e.triggers());
        GuardExpr guard = e.replaceGuard() ? e.guard() : t.guard();
        List<Action> actions = e.actions() == null ? t.actions() : e.actions();
        transitions.set(at, new StateMachine.Transition(source, target, trigger, guard, actions));
      }
    }
    return new StateMachine(
        parent.name(), new ArrayList<>(states.values()), transitions, initial, parent.catalogVersion());
  }

  private static StateMachine.State ensure(Map<String, StateMachine.State> states, String alias) {
    return states.computeIfAbsent(alias, StateMachine.State::new);
  }

  private static List<Integer> matching(List<StateMachine.Transition> transitions, String from, String to) {
    List<Integer> out = new ArrayList<>();
    for (int i = 0; i < transitions.size(); i++) {
      StateMachine.Transition t = transitions.get(i);
      if (t.source().equals(from) && t.target().equals(to)) out.add(i);
    }
    return out;
  }

  private static int pickForUpdate(int editIndex, List<StateMachine.Transition> transitions, UpdateTransition e) {
    List<Integer> matches = matching(transitions, e.from(), e.to());
    if (matches.isEmpty()) {
      throw new EditFailure(editIndex, "No transition from '" + e.from() + "' to '" + e.to() + "'");
    }
    if (e.index() == null) {
      if (matches.size() > 1) {
        throw new EditFailure(editIndex, "Several transitions from '" + e.from() + "' to '" + e.to()
            + "'; give an index in 0.." + (matches.size() - 1));
      }
      return matches.get(0);
    }
    if (e.index() < 0 || e.index() >= matches.size()) {
      throw new EditFailure(editIndex, outOfRange(e.from(), e.to(), e.index(), matches.size()));
    }
    return matches.get(e.index());
  }

  private static String outOfRange(String from, String to, int index, int count) {
    return "Transition index " + index + " out of range for " + from + " -> " + to + " (" + count + " match(es))";
  }

  // ---------------------------------------------------------------- JSON

  /** Reads patch JSON; op-level problems are E900, malformed IR fragments E100. */
  public static ReadResult read(JsonNode root) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    if (root == null || !root.isObject()) {
      diagnostics.add(invalid("$", "Patch must be a JSON object"));
      return new ReadResult(null, diagnostics);
    }
    JsonNode editsNode = root.path("edits");
    if (!editsNode.isArray()) {
      diagnostics.add(invalid("$.edits", "Patch must contain an edits array"));
      return new ReadResult(null, diagnostics);
    }
    IrJson.Reader fragments = new IrJson.Reader();
    List<Edit> edits = new ArrayList<>();
    for (int i = 0; i < editsNode.size(); i++) {
      String path = "$.edits[" + i + "]";
      try {
        Edit e = readEdit(editsNode.get(i), path, fragments);
        if (e != null) edits.add(e);
      } catch (IllegalArgumentException e) {
        diagnostics.add(invalid(path, e.getMessage()));
      }
    }
    diagnostics.addAll(fragments.diagnostics());
    boolean ok = ValidationReport.of(diagnostics).ok();
    return new ReadResult(ok ? new IrPatch(root.path("summary").asText(""), edits) : null, diagnostics);
  }

  private static Edit readEdit(JsonNode node, String path, IrJson.Reader fragments) {
    if (!node.isObject()) {
      throw new IllegalArgumentException("Expected an edit object");
    }
    String op = node.path("op").asText("");
    switch (op) {
      case "set_state_label": {
        String label = node.path("label").asText("");
        if (!node.path("label").isTextual() || label.isBlank()) {
          throw new IllegalArgumentException("set_state_label needs a non-empty label");
        }
        return new SetLabel(stateId(node, op), label);
      }
      case "set_initial":
        return new SetInitial(stateId(node, op));
      case "add_state":
        return new AddState(stateId(node, op), node.path("label").asText(null));
      case "remove_state":
        return new RemoveState(stateId(node, op));
      case "add_transition": {
        String from = endpoint(node, "from", op);
        String to = endpoint(node, "to", op);
        int before = fragments.diagnostics().size();
        List<Trigger.Condition> triggers = conditions(node, path, fragments);
        GuardExpr guard = guard(node, path, fragments);
        List<Action> actions = actions(node, path, fragments);
        if (fragments.diagnostics().size() > before) return null;
        Trigger trigger = triggers == null || triggers.isEmpty() ? null : new Trigger(triggers);
        return new AddTransition(new StateMachine.Transition(from, to, trigger, guard, actions));
      }
      case "remove_transition":
        return new RemoveTransition(endpoint(node, "from", op), endpoint(node, "to", op), index(node, op));
      case "update_transition": {
        String from = endpoint(node, "from", op);
        String to = endpoint(node, "to", op);
        Integer index = index(node, op);
        String newFrom = optionalEndpoint(node, "new_from", op);
        String newTo = optionalEndpoint(node, "new_to", op);
        int before = fragments.diagnostics().size();
        List<Trigger.Condition> triggers = conditions(node, path, fragments);
        GuardExpr guard = guard(node, path, fragments);
        List<Action> actions = actions(node, path, fragments);
        if (fragments.diagnostics().size() > before) return null;
        return new UpdateTransition(from, to, index, newFrom, newTo, triggers, node.has("guard"), guard, actions);
      }
      default:
        throw new IllegalArgumentException("Unsupported patch op '" + op + "'");
    }
  }

  private static String stateId(JsonNode node, String op) {
    String id = node.path("state_id").asText("");
    if (!Names.isIdentifier(id)) {
      throw new IllegalArgumentException(op + " needs state_id to be an identifier, got '" + id + "'");
    }
    return id;
  }

  private static String endpoint(JsonNode node, String field, String op) {
    String id = node.path(field).asText("");
    if (!Names.isIdentifier(id)) {
      throw new IllegalArgumentException(op + " needs '" + field + "' to be a state alias, got '" + id + "'");
    }
    return id;
  }

  private static String optionalEndpoint(JsonNode node, String field, String op) {
    JsonNode v = node.path(field);
    if (v.isMissingNode() || v.isNull() || v.asText("").isEmpty()) return null;
    return endpoint(node, field, op);
  }

  private static Integer index(JsonNode node, String op) {
    JsonNode v = node.path("index");
    if (v.isMissingNode() || v.isNull()) return null;
    if (!v.canConvertToInt() || !v.isIntegralNumber()) {
      throw new IllegalArgumentException(op + " index must be an integer");
    }
    return v.intValue();
  }

  private static List<Trigger.Condition> conditions(JsonNode node, String path, IrJson.Reader fragments) {
    JsonNode list = node.path("triggers");
    if (list.isMissingNode()) return null;
    if (list.isNull()) return List.of();
    if (!list.isArray()) throw new IllegalArgumentException("triggers must be an array");
    List<Trigger.Condition> out = new ArrayList<>();
    for (int j = 0; j < list.size(); j++) {
      Trigger.Condition c = fragments.readCondition(list.get(j), path + ".triggers[" + j + "]");
      if (c != null) out.add(c);
    }
    return out;
  }

  private static GuardExpr guard(JsonNode node, String path, IrJson.Reader fragments) {
    JsonNode g = node.path("guard");
    return g.isMissingNode() || g.isNull() ? null : fragments.readGuard(g, path + ".guard");
  }

  private static List<Action> actions(JsonNode node, String path, IrJson.Reader fragments) {
    JsonNode list = node.path("actions");
    if (list.isMissingNode()) return null;
    if (list.isNull()) return List.of();
    if (!list.isArray()) throw new IllegalArgumentException("actions must be an array");
    List<Action> out = new ArrayList<>();
    for (int j = 0; j < list.size(); j++) {
      Action a = fragments.readAction(list.get(j), path + ".actions[" + j + "]");
      if (a != null) out.add(a);
    }
    return out;
  }

  private static Diagnostic invalid(String location, String message) {
    return Diagnostic.error(Diagnostic.Kind.STRUCTURAL, "E900", location, message);
  }

  /** Patch JSON with just the summary and an empty edit list, to be filled by the caller. */
  static ObjectNode newPatch(String summary) {
    ObjectNode root = Json.MAPPER.createObjectNode();
    root.put("summary", summary);
    root.putArray("edits");
    return root;
  }

  static ObjectNode addEdit(ObjectNode patch, String op) {
    return ((ArrayNode) patch.get("edits")).addObject().put("op", op);
  }
}

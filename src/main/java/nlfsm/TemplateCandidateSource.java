package nlfsm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic candidate source for "turn the light on when motion is detected, off N minutes
 * later" requests. Verb phrases are copied as written ({@code turn_on}); the repair step maps them
 * to catalog commands using the E300 feedback. Change requests are answered with small patches:
 * a relabel, a new timer duration, or a notification on the way in.
 */
public class TemplateCandidateSource implements CandidateSource, PatchSource {

  private static final Logger log = LoggerFactory.getLogger(TemplateCandidateSource.class);

  static final long DEFAULT_DELAY_SECONDS = 300;

  private static final Pattern DURATION =
      Pattern.compile("(\\d+)\\s*(seconds?|secs?|minutes?|mins?|hours?)\\b");
  private static final Pattern RELABEL =
      Pattern.compile("label\\s+(" + Names.IDENT_SRC + ")\\s+(?:as|to)\\s+\"([^\"]+)\"", Pattern.CASE_INSENSITIVE);
  static final String NOTIFY_MESSAGE = "Motion detected";
  private static final Pattern UNKNOWN_COMMAND =
      Pattern.compile("Unknown command '([A-Za-z0-9_]+)' for device '([A-Za-z0-9_]+)'");
  private static final Map<String, String> SYNONYMS = Map.of(
      "turn_on", "on",
      "turn_off", "off",
      "switch_on", "on",
      "switch_off", "off",
      "activate", "on",
      "deactivate", "off");

  @Override
  public JsonNode generate(String request) {
    String text = request == null ? "" : request.toLowerCase(Locale.ROOT);
    long delay = delaySeconds(text);
    String light = text.contains("hallway light") ? "hallway_light" : "light_hall";
    String onCommand = text.contains("turn on") || text.contains("turns on") ? "turn_on" : "on";
    String offCommand = text.contains("turn off") || text.contains("turns off") ? "turn_off" : "off";
    log.debug("Template candidate: light={}, delay={}s, commands={}/{}", light, delay, onCommand, offCommand);

    ObjectNode root = Json.MAPPER.createObjectNode();
    root.put("name", "MotionLight");
    root.put("initial", "Idle");
    ArrayNode states = root.putArray("states");
    states.addObject().put("id", "Idle").put("label", "Idle");
    states.addObject().put("id", "Lit").put("label", "Light on");

    ArrayNode transitions = root.putArray("transitions");
    ObjectNode on = transitions.addObject().put("from", "Idle").put("to", "Lit");
    motion(on.putArray("triggers"), "active");
    command(on.putArray("actions"), light, onCommand);

    ObjectNode off = transitions.addObject().put("from", "Lit").put("to", "Idle");
    motion(off.putArray("triggers"), "inactive");
    ArrayNode offActions = off.putArray("actions");
    offActions.addObject().put("type", "delay").put("seconds", delay);
    command(offActions, light, offCommand);
    return root;
  }

  @Override
  public JsonNode repair(JsonNode candidate, ValidationReport report, int attempt) {
    JsonNode copy = candidate.deepCopy();
    int fixed = 0;
    for (Diagnostic d : report.withCode("E300")) {
      Matcher m = UNKNOWN_COMMAND.matcher(d.message());
      if (!m.find()) continue;
      String replacement = SYNONYMS.get(m.group(1));
      if (replacement == null || !d.suggestions().isEmpty() && !d.suggestions().contains(replacement)) {
        continue;
      }
      for (JsonNode t : copy.path("transitions")) {
        for (JsonNode a : t.path("actions")) {
          if (a instanceof ObjectNode action
              && "command".equals(action.path("type").asText())
              && m.group(2).equals(action.path("device").asText())
              && m.group(1).equals(action.path("command").asText())) {
            action.put("command", replacement);
            fixed++;
          }
        }
      }
    }
    log.debug("Repair attempt {}: {} command(s) rewritten", attempt, fixed);
    return copy;
  }

  @Override
  public JsonNode patch(String request, StateMachine current) {
    String text = request == null ? "" : request;
    String lower = text.toLowerCase(Locale.ROOT);
    ObjectNode patch = IrPatch.newPatch("Applied requested changes (template).");

    Matcher relabel = RELABEL.matcher(text);
    while (relabel.find()) {
      IrPatch.addEdit(patch, "set_state_label")
          .put("state_id", relabel.group(1))
          .put("label", relabel.group(2));
    }

    if (DURATION.matcher(lower).find()) {
      for (StateMachine.State s : current.states()) {
        if (!s.synthetic() || current.outgoing(s.alias()).isEmpty()) continue;
        StateMachine.Transition expiry = current.outgoing(s.alias()).get(0);
        ObjectNode edit = IrPatch.addEdit(patch, "update_transition")
            .put("from", expiry.source())
            .put("to", expiry.target())
            .put("index", 0);
        edit.putArray("triggers").addObject().put("type", "after").put("seconds", delaySeconds(lower));
        break;
      }
    }

    if (lower.contains("notify")) {
      List<StateMachine.Transition> out = current.outgoing(current.initial());
      if (!out.isEmpty()) {
        StateMachine.Transition first = out.get(0);
        ObjectNode edit = IrPatch.addEdit(patch, "update_transition")
            .put("from", first.source())
            .put("to", first.target())
            .put("index", 0);
        ArrayNode actions = (ArrayNode) IrJson.writeTransition(first).get("actions");
        actions.addObject().put("type", "notify").put("message", NOTIFY_MESSAGE);
        edit.set("actions", actions);
      }
    }
    log.debug("Template patch for '{}': {} edit(s)", current.name(), patch.path("edits").size());
    return patch;
  }

  static long delaySeconds(String text) {
    Matcher m = DURATION.matcher(text);
    if (!m.find()) return DEFAULT_DELAY_SECONDS;
    String unit = m.group(2);
    long seconds;
    try {
      long n = Long.parseLong(m.group(1));
      seconds = unit.startsWith("h") ? Math.multiplyExact(n, 3600L)
          : unit.startsWith("m") ? Math.multiplyExact(n, 60L) : n;
    } catch (NumberFormatException | ArithmeticException e) {
      log.debug("Duration '{}' out of range; using {}s", m.group(), DEFAULT_DELAY_SECONDS);
      return DEFAULT_DELAY_SECONDS;
    }
    return seconds > 0 ? seconds : DEFAULT_DELAY_SECONDS;
  }

  private static void motion(ArrayNode triggers, String value) {
    ObjectNode t = triggers.addObject().put("type", "becomes");
    t.putObject("ref").put("device", "motion_hall").put("attribute", "motion");
    t.putObject("value").put("string", value);
  }

  private static void command(ArrayNode actions, String device, String command) {
    actions.addObject()
        .put("type", "command")
        .put("device", device)
        .put("command", command)
        .putArray("args");
  }
}

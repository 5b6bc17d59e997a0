package nlfsm;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/** Structural limits applied before any catalog lookup. */
public record ShapeSchema(
    Pattern identifier,
    int minStates,
    int maxStates,
    int maxActionsPerTransition,
    long maxDurationSeconds,
    Set<String> triggerKinds,
    boolean requireCatalogVersion) {

  public static final Set<String> ALL_TRIGGER_KINDS =
      Set.of("becomes", "changes", "after", "schedule");

  public ShapeSchema {
    if (minStates < 1 || maxStates < minStates) {
      throw new IllegalArgumentException(
          "Invalid state bounds: min=" + minStates + ", max=" + maxStates);
    }
    if (maxDurationSeconds <= 0) {
      throw new IllegalArgumentException("maxDurationSeconds must be positive");
    }
    triggerKinds = Set.copyOf(triggerKinds);
    for (String kind : triggerKinds) {
      if (!ALL_TRIGGER_KINDS.contains(kind)) {
        throw new IllegalArgumentException("Unknown trigger kind '" + kind + "'");
      }
    }
  }

  public static ShapeSchema defaults() {
    return new ShapeSchema(
        Pattern.compile(Names.IDENT_SRC), 1, 200, 32, 7 * 24 * 3600L, ALL_TRIGGER_KINDS, false);
  }

  public static ShapeSchema load(String location) throws IOException {
    return fromJson(Json.load(location));
  }

  public static ShapeSchema fromJson(JsonNode root) {
    ShapeSchema d = defaults();
    Set<String> kinds = new LinkedHashSet<>();
    for (JsonNode k : root.path("triggerKinds")) kinds.add(k.asText());
    return new ShapeSchema(
        Pattern.compile(root.path("identifierPattern").asText(d.identifier().pattern())),
        root.path("minStates").asInt(d.minStates()),
        root.path("maxStates").asInt(d.maxStates()),
        root.path("maxActionsPerTransition").asInt(d.maxActionsPerTransition()),
        root.path("maxDurationSeconds").asLong(d.maxDurationSeconds()),
        kinds.isEmpty() ? d.triggerKinds() : kinds,
        root.path("requireCatalogVersion").asBoolean(d.requireCatalogVersion()));
  }
}

package nlfsm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Directory of one automation's revisions.
 *
 * <pre>
 * bundle/
 *   baseline/            first compile
 *   edits/edit_NNN/      one per round-trip or patch edit
 *   current/             copy of the latest passing revision
 *   manifest.json
 * </pre>
 *
 * {@code current} is swapped in whole and only for a revision whose report passes.
 */
public class BundleStore {

  private static final Logger log = LoggerFactory.getLogger(BundleStore.class);

  public static final String BASELINE = "baseline";
  public static final String EDITS = "edits";
  public static final String CURRENT = "current";
  public static final String MANIFEST = "manifest.json";

  public static final String IR_FILE = "final.ir.json";
  public static final String REPORT_FILE = "validation_report.json";
  public static final String DIAGRAM_FILE = "final.puml";
  public static final String SOURCE_FILE = "source.puml";
  public static final String DIFF_FILE = "diff.json";
  public static final String REQUEST_FILE = "request.txt";
  public static final String PATCH_FILE = "patch.json";
  public static final String SUMMARY_FILE = "summary.md";

  private static final int SUMMARY_LIMIT = 8;

  private static final List<String> PROMOTED_FILES = List.of(IR_FILE, DIAGRAM_FILE, REPORT_FILE);
  private static final Pattern EDIT_DIR = Pattern.compile("edit_(\\d{3,})");

  /** A written revision; {@code promoted} tells whether {@code current} now points at it. */
  public record Revision(String kind, Path dir, boolean promoted) {}

  private final Path root;
  private final Clock clock;

  public BundleStore(Path root) {
    this(root, Clock.systemUTC());
  }

  public BundleStore(Path root, Clock clock) {
    this.root = root;
    this.clock = clock;
  }

  public Path root() {
    return root;
  }

  public Path currentDir() {
    return root.resolve(CURRENT);
  }

  public Revision writeBaseline(PipelineResult result) throws IOException {
    Path dir = root.resolve(BASELINE);
    deleteRecursively(dir);
    return writeRevision("baseline", dir, Map.of(), result);
  }

  public Revision writeEdit(String sourceText, PipelineResult result) throws IOException {
    Path dir = root.resolve(EDITS).resolve(nextEditName());
    Files.createDirectories(dir);
    Files.writeString(dir.resolve(SOURCE_FILE), sourceText, StandardCharsets.UTF_8);
    return writeRevision("edit", dir, Map.of("sourcePuml", SOURCE_FILE), result);
  }

  /** An edit made by applying a patch to the current revision, kept with its request. */
  public Revision writePatchEdit(String request, JsonNode patch, PipelineResult result) throws IOException {
    Path dir = root.resolve(EDITS).resolve(nextEditName());
    Files.createDirectories(dir);
    Files.writeString(dir.resolve(REQUEST_FILE), request == null ? "" : request, StandardCharsets.UTF_8);
    Json.write(dir.resolve(PATCH_FILE), patch);
    Files.writeString(dir.resolve(SUMMARY_FILE), editSummary(request, patch, result), StandardCharsets.UTF_8);
    Map<String, String> inputs = new LinkedHashMap<>();
    inputs.put("request", REQUEST_FILE);
    inputs.put("patch", PATCH_FILE);
    return writeRevision("patch", dir, inputs, result);
  }

  private static String editSummary(String request, JsonNode patch, PipelineResult result) {
    String summary = patch.path("summary").asText("");
    StringBuilder sb = new StringBuilder();
    sb.append("# Edit summary\n\n");
    sb.append("Request: ").append(request == null ? "" : request.strip()).append("\n\n");
    sb.append("Patch: ").append(summary.isBlank() ? "Applied requested changes." : summary.strip()).append("\n\n");
    sb.append("## Changes\n");
    List<String> lines = result.diff() == null ? List.of("(patch not applied)") : result.diff().summary();
    for (String line : lines) sb.append("- ").append(line).append("\n");
    sb.append("\n## Validation\n");
    for (String line : result.report().summary(SUMMARY_LIMIT)) sb.append("- ").append(line).append("\n");
    return sb.toString();
  }

  /** The canonical IR of {@code current}, falling back to the baseline. */
  public Optional<StateMachine> loadCurrent() throws IOException {
    Optional<StateMachine> current = load(currentDir().resolve(IR_FILE));
    return current.isPresent() ? current : loadBaseline();
  }

  public Optional<StateMachine> loadBaseline() throws IOException {
    return load(root.resolve(BASELINE).resolve(IR_FILE));
  }

  public JsonNode manifest() throws IOException {
    Path path = root.resolve(MANIFEST);
    return Files.exists(path) ? Json.read(path) : Json.MAPPER.createObjectNode();
  }

  private Optional<StateMachine> load(Path irFile) throws IOException {
    if (!Files.isRegularFile(irFile)) return Optional.empty();
    try {
      return Optional.of(IrJson.readStrict(Json.read(irFile)));
    } catch (IllegalArgumentException e) {
      throw new IOException("Corrupt IR in " + irFile + ": " + e.getMessage(), e);
    }
  }

  /**
   * @param inputs manifest key to file name of each input already written into {@code dir}
   */
  private Revision writeRevision(String kind, Path dir, Map<String, String> inputs, PipelineResult result)
      throws IOException {
    Files.createDirectories(dir);
    if (result.ir() != null) {
      Json.write(dir.resolve(IR_FILE), IrJson.write(result.ir()));
    }
    Json.write(dir.resolve(REPORT_FILE), IrJson.write(result.report()));
    if (result.diagram() != null) {
      Files.writeString(dir.resolve(DIAGRAM_FILE), result.diagram(), StandardCharsets.UTF_8);
    }
    if (result.diff() != null) {
      Json.write(dir.resolve(DIFF_FILE), IrJson.write(result.diff()));
    }

    boolean promote = result.ok();
    if (promote) {
      promote(dir);
      log.info("Promoted {} to {}", relative(dir), CURRENT);
    } else {
      log.warn("Revision {} failed validation ({} error(s)); {} unchanged",
          relative(dir), result.report().errors().size(), CURRENT);
    }
    appendToManifest(kind, dir, inputs, result, promote);
    return new Revision(kind, dir, promote);
  }

  private void promote(Path revisionDir) throws IOException {
    Path current = currentDir();
    Path staging = root.resolve("." + CURRENT + ".staging");
    Path retired = root.resolve("." + CURRENT + ".retired");
    deleteRecursively(staging);
    deleteRecursively(retired);
    Files.createDirectories(staging);
    for (String name : PROMOTED_FILES) {
      Path src = revisionDir.resolve(name);
      if (Files.exists(src)) {
        Files.copy(src, staging.resolve(name), StandardCopyOption.REPLACE_EXISTING);
      }
    }
    if (Files.exists(current)) {
      move(current, retired);
    }
    move(staging, current);
    deleteRecursively(retired);
  }

  private void appendToManifest(
      String kind, Path dir, Map<String, String> inputs, PipelineResult result, boolean promoted)
      throws IOException {
    JsonNode existing = manifest();
    ObjectNode m = existing instanceof ObjectNode o ? o : Json.MAPPER.createObjectNode();
    String now = clock.instant().toString();
    if (!m.has("schemaVersion")) m.put("schemaVersion", "1");
    m.put("bundle", root.getFileName() == null ? "" : root.getFileName().toString());
    ArrayNode revisions = m.has("revisions") && m.get("revisions").isArray()
        ? (ArrayNode) m.get("revisions") : m.putArray("revisions");

    ObjectNode record = revisions.addObject();
    record.put("kind", kind);
    record.put("dir", relative(dir));
    record.put("createdAt", now);
    record.put("ok", result.report().ok());
    record.put("promoted", promoted);
    inputs.forEach((key, file) -> record.put(key, relative(dir.resolve(file))));
    if (result.diff() != null) record.put("diff", relative(dir.resolve(DIFF_FILE)));

    if ("baseline".equals(kind)) {
      ObjectNode baseline = m.putObject("baseline");
      baseline.put("dir", BASELINE);
      baseline.put("updatedAt", now);
    }
    if (promoted) {
      ObjectNode current = m.putObject("current");
      current.put("pointsTo", relative(dir));
      current.put("updatedAt", now);
    }
    m.put("updatedAt", now);

    Path target = root.resolve(MANIFEST);
    Path tmp = root.resolve(MANIFEST + ".tmp");
    Json.write(tmp, m);
    move(tmp, target);
  }

  private String nextEditName() throws IOException {
    Path edits = root.resolve(EDITS);
    int max = 0;
    if (Files.isDirectory(edits)) {
      try (DirectoryStream<Path> children = Files.newDirectoryStream(edits)) {
        for (Path child : children) {
          Matcher m = EDIT_DIR.matcher(child.getFileName().toString());
          if (Files.isDirectory(child) && m.matches()) {
            max = Math.max(max, Integer.parseInt(m.group(1)));
          }
        }
      }
    }
    return String.format("edit_%03d", max + 1);
  }

  private String relative(Path p) {
    return root.relativize(p).toString().replace('\\', '/');
  }

  private static void move(Path from, Path to) throws IOException {
    try {
      Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteRecursively(Path dir) throws IOException {
    if (!Files.exists(dir)) return;
    try (Stream<Path> walk = Files.walk(dir)) {
      for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
        Files.delete(p);
      }
    }
  }
}

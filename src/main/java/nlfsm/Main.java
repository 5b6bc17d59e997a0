package nlfsm;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class Main {

  static final int OK = 0;
  static final int VALIDATION_FAILED = 1;
  static final int ERROR = 2;

  private static final int SUMMARY_LIMIT = 8;

  public static void main(String[] args) {
    int code = run(args, System.out, System.err);
    if (code != OK) System.exit(code);
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    if (args.length == 0) {
      usage(out);
      return ERROR;
    }
    String command = args[0];
    Map<String, String> options = new HashMap<>();
    for (int i = 1; i < args.length; i++) {
      switch (args[i]) {
        case "--text", "--bundle", "--ir", "--puml", "--baseline", "--before", "--after",
            "--out", "--settings", "--catalog", "--schema", "--patch", "--scenarios", "--limit" -> {
          if (i + 1 >= args.length) {
            err.println("Missing value for " + args[i]);
            usage(out);
            return ERROR;
          }
          options.put(args[i].substring(2), args[++i]);
        }
        default -> {
          err.println("Unknown option: " + args[i]);
          usage(out);
          return ERROR;
        }
      }
    }
    try {
      Settings settings = Settings.load(path(options.get("settings")));
      if (options.containsKey("catalog")) settings = settings.withCatalog(options.get("catalog"));
      if (options.containsKey("schema")) settings = settings.withSchema(options.get("schema"));
      return switch (command) {
        case "generate" -> generate(options, settings, out);
        case "compile" -> compile(options, settings, out);
        case "roundtrip" -> roundTrip(options, settings, out);
        case "validate" -> validate(options, settings, out);
        case "diff" -> diff(options, out);
        case "edit" -> edit(options, settings, out);
        case "metrics" -> metrics(options, settings, out);
        default -> {
          err.println("Unknown command: " + command);
          usage(out);
          yield ERROR;
        }
      };
    } catch (IOException | RuntimeException e) {
      err.println("Failed: " + e.getMessage());
      return ERROR;
    }
  }

  private static int generate(Map<String, String> options, Settings settings, PrintStream out)
      throws IOException {
    String text = require(options, "text");
    Path bundle = bundlePath(options, settings, "MotionLight");
    RepairLoop loop = new RepairLoop(
        new TemplateCandidateSource(), pipeline(settings), settings.maxRepairs());
    RepairLoop.Outcome outcome = loop.run(text);
    BundleStore store = new BundleStore(bundle);
    BundleStore.Revision revision = store.writeBaseline(outcome.result());
    out.println("Baseline written to: " + revision.dir());
    out.println("Repairs: " + outcome.repairs());
    return report(outcome.result().report(), out);
  }

  private static int compile(Map<String, String> options, Settings settings, PrintStream out)
      throws IOException {
    JsonNode candidate = Json.read(Paths.get(require(options, "ir")));
    PipelineResult result = pipeline(settings).compileJson(candidate);
    if (options.containsKey("bundle")) {
      BundleStore.Revision revision = new BundleStore(Paths.get(options.get("bundle"))).writeBaseline(result);
      out.println("Baseline written to: " + revision.dir());
    } else if (options.containsKey("out") && result.diagram() != null) {
      Files.writeString(Paths.get(options.get("out")), result.diagram(), StandardCharsets.UTF_8);
      out.println("Diagram written to: " + options.get("out"));
    } else if (result.diagram() != null) {
      out.print(result.diagram());
    }
    return report(result.report(), out);
  }

  private static int roundTrip(Map<String, String> options, Settings settings, PrintStream out)
      throws IOException {
    Path puml = Paths.get(require(options, "puml"));
    String text = Files.readString(puml, StandardCharsets.UTF_8);
    Path bundle = options.containsKey("bundle")
        ? Paths.get(options.get("bundle"))
        : findBundleRoot(puml);
    BundleStore store = new BundleStore(bundle);
    Optional<StateMachine> baseline = options.containsKey("baseline")
        ? Optional.of(IrJson.readStrict(Json.read(Paths.get(options.get("baseline")))))
        : store.loadCurrent();

    PipelineResult result = pipeline(settings).roundTrip(text, baseline.orElse(null));
    BundleStore.Revision revision = store.writeEdit(text, result);
    out.println("Revision written to: " + revision.dir());
    if (result.diff() != null) {
      result.diff().summary().forEach(line -> out.println("  " + line));
    }
    out.println(revision.promoted() ? "current updated" : "current unchanged");
    return report(result.report(), out);
  }

  private static int edit(Map<String, String> options, Settings settings, PrintStream out)
      throws IOException {
    Path bundle = Paths.get(require(options, "bundle"));
    BundleStore store = new BundleStore(bundle);
    StateMachine parent = store.loadCurrent().orElseThrow(() -> new IllegalArgumentException(
        "Nothing to edit in " + bundle + "; run generate or compile with --bundle first"));
    String request;
    JsonNode patch;
    if (options.containsKey("patch")) {
      patch = Json.read(Paths.get(options.get("patch")));
      request = options.getOrDefault("text", "patch " + options.get("patch"));
    } else {
      request = require(options, "text");
      patch = new TemplateCandidateSource().patch(request, parent);
    }

    PipelineResult result = pipeline(settings).edit(parent, patch);
    BundleStore.Revision revision = store.writePatchEdit(request, patch, result);
    out.println("Revision written to: " + revision.dir());
    if (result.diff() != null) {
      result.diff().summary().forEach(line -> out.println("  " + line));
    }
    out.println(revision.promoted() ? "current updated" : "current unchanged");
    return report(result.report(), out);
  }

  private static int metrics(Map<String, String> options, Settings settings, PrintStream out)
      throws IOException {
    Path scenarios = Paths.get(require(options, "scenarios"));
    Path outDir = options.containsKey("out")
        ? Paths.get(options.get("out"))
        : Paths.get(settings.outputDir()).resolve("metrics");
    Integer limit = options.containsKey("limit") ? Integer.valueOf(options.get("limit")) : null;
    MetricsRunner runner = new MetricsRunner(
        new TemplateCandidateSource(), pipeline(settings), settings.maxRepairs());
    MetricsRunner.Summary summary = runner.run(scenarios, outDir, limit).summary();
    out.println("Scenarios: " + summary.totalScenarios());
    out.println("First-try validation ok rate: " + summary.validationOkRate());
    out.println("Schema valid rate: " + summary.schemaValidRate());
    out.println("Repaired ok rate: " + summary.repairedOkRate());
    out.println("Average constraint coverage: " + summary.avgCoverage());
    out.println("Results written to: " + outDir.resolve(MetricsRunner.PER_SCENARIO_FILE));
    return OK;
  }

  private static int validate(Map<String, String> options, Settings settings, PrintStream out)
      throws IOException {
    JsonNode candidate = Json.read(Paths.get(require(options, "ir")));
    PipelineResult result = pipeline(settings).compileJson(candidate);
    out.println(Json.pretty(IrJson.write(result.report())));
    return result.report().ok() ? OK : VALIDATION_FAILED;
  }

  private static int diff(Map<String, String> options, PrintStream out) throws IOException {
    StateMachine before = IrJson.readStrict(Json.read(Paths.get(require(options, "before"))));
    StateMachine after = IrJson.readStrict(Json.read(Paths.get(require(options, "after"))));
    SemanticDiff diff = new DiffEngine().diff(before, after);
    diff.summary().forEach(out::println);
    return OK;
  }

  private static CompilerPipeline pipeline(Settings settings) throws IOException {
    return new CompilerPipeline(
        settings.loadSchema(), settings.loadCatalog(), new DiagramGenerator(settings.diagramGuide()));
  }

  private static int report(ValidationReport report, PrintStream out) {
    List<String> lines = report.summary(SUMMARY_LIMIT);
    lines.forEach(out::println);
    return report.ok() ? OK : VALIDATION_FAILED;
  }

  /** Walks up from the edited file to the nearest directory holding a manifest or a baseline. */
  static Path findBundleRoot(Path puml) {
    Path start = puml.toAbsolutePath().getParent();
    Path cur = start;
    for (int i = 0; i < 4 && cur != null; i++) {
      if (Files.exists(cur.resolve(BundleStore.MANIFEST))
          || Files.isDirectory(cur.resolve(BundleStore.BASELINE))) {
        return cur;
      }
      cur = cur.getParent();
    }
    return start;
  }

  private static Path bundlePath(Map<String, String> options, Settings settings, String name) {
    return options.containsKey("bundle")
        ? Paths.get(options.get("bundle"))
        : Paths.get(settings.outputDir()).resolve(name);
  }

  private static String require(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing --" + key);
    }
    return value;
  }

  private static Path path(String value) {
    return value == null ? null : Paths.get(value);
  }

  private static void usage(PrintStream out) {
    out.println("Usage:");
    out.println("  generate  --text <request> [--bundle <dir>]");
    out.println("  compile   --ir <candidate.json> [--bundle <dir> | --out <file.puml>]");
    out.println("  roundtrip --puml <edited.puml> [--bundle <dir>] [--baseline <ir.json>]");
    out.println("  validate  --ir <candidate.json>");
    out.println("  diff      --before <ir.json> --after <ir.json>");
    out.println("  edit      --bundle <dir> (--text <change request> | --patch <patch.json>)");
    out.println("  metrics   --scenarios <scenarios.csv> [--out <dir>] [--limit <n>]");
    out.println("Common: [--settings <file.yml>] [--catalog <catalog.json>] [--schema <schema.json>]");
  }
}

package nlfsm;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs every scenario of a CSV file through generation twice, once without repairs and once with
 * the repair budget, and scores how many required tokens the first-try machine contains.
 *
 * <p>Scenario columns: {@code scenario_id}, {@code nl_prompt} (required), {@code original_prompt},
 * and pipe-separated {@code req_devices}, {@code req_triggers}, {@code req_actions},
 * {@code req_conditions}. Tokens read {@code becomes(dev.attr,value)}, {@code changes(dev.attr)},
 * {@code after(N)}, {@code schedule(expr)}, {@code command(dev,cmd)}, {@code delay(N)} and
 * {@code notify()}. Conditions are carried through but not scored.
 */
public class MetricsRunner {

  private static final Logger log = LoggerFactory.getLogger(MetricsRunner.class);

  public static final String PER_SCENARIO_FILE = "per_scenario_results.csv";
  public static final String SUMMARY_CSV_FILE = "metrics_summary.csv";
  public static final String SUMMARY_JSON_FILE = "metrics_summary.json";
  static final String FIRST_TRY_DIR = "first_try";
  static final String REPAIRED_DIR = "repaired";

  private static final List<String> REQUIRED_COLUMNS = List.of("scenario_id", "nl_prompt");

  private static final CsvMapper CSV_MAPPER = new CsvMapper();

  static {
    CSV_MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    CSV_MAPPER.enable(CsvParser.Feature.TRIM_SPACES);
  }

  public record Scenario(
      String id,
      String prompt,
      String originalPrompt,
      List<String> devices,
      List<String> triggers,
      List<String> actions,
      List<String> conditions) {

    public Scenario {
      devices = List.copyOf(devices);
      triggers = List.copyOf(triggers);
      actions = List.copyOf(actions);
      conditions = List.copyOf(conditions);
    }
  }

  /** Tokens found in one machine, grouped like the scenario columns. */
  public record Tokens(Set<String> devices, Set<String> triggers, Set<String> actions) {}

  @JsonPropertyOrder({
      "scenario_id", "nl_prompt", "original_prompt",
      "req_devices", "req_triggers", "req_actions", "req_conditions",
      "first_try_completed", "first_try_ok", "first_try_error_count", "first_try_warning_count",
      "first_try_schema_error_count", "first_try_bundle", "first_try_exception",
      "devices_required", "devices_present", "devices_coverage", "missing_devices",
      "triggers_required", "triggers_present", "triggers_coverage", "missing_triggers",
      "actions_required", "actions_present", "actions_coverage", "missing_actions",
      "overall_coverage",
      "repaired_completed", "repaired_ok", "repaired_error_count", "repaired_repairs",
      "repaired_bundle", "repaired_exception"})
  public record ScenarioResult(
      @JsonProperty("scenario_id") String scenarioId,
      @JsonProperty("nl_prompt") String prompt,
      @JsonProperty("original_prompt") String originalPrompt,
      @JsonProperty("req_devices") String requiredDevices,
      @JsonProperty("req_triggers") String requiredTriggers,
      @JsonProperty("req_actions") String requiredActions,
      @JsonProperty("req_conditions") String requiredConditions,
      @JsonProperty("first_try_completed") boolean firstTryCompleted,
      @JsonProperty("first_try_ok") boolean firstTryOk,
      @JsonProperty("first_try_error_count") int firstTryErrors,
      @JsonProperty("first_try_warning_count") int firstTryWarnings,
      @JsonProperty("first_try_schema_error_count") int firstTrySchemaErrors,
      @JsonProperty("first_try_bundle") String firstTryBundle,
      @JsonProperty("first_try_exception") String firstTryException,
      @JsonProperty("devices_required") int devicesRequired,
      @JsonProperty("devices_present") int devicesPresent,
      @JsonProperty("devices_coverage") double devicesCoverage,
      @JsonProperty("missing_devices") String missingDevices,
      @JsonProperty("triggers_required") int triggersRequired,
      @JsonProperty("triggers_present") int triggersPresent,
      @JsonProperty("triggers_coverage") double triggersCoverage,
      @JsonProperty("missing_triggers") String missingTriggers,
      @JsonProperty("actions_required") int actionsRequired,
      @JsonProperty("actions_present") int actionsPresent,
      @JsonProperty("actions_coverage") double actionsCoverage,
      @JsonProperty("missing_actions") String missingActions,
      @JsonProperty("overall_coverage") double overallCoverage,
      @JsonProperty("repaired_completed") boolean repairedCompleted,
      @JsonProperty("repaired_ok") boolean repairedOk,
      @JsonProperty("repaired_error_count") int repairedErrors,
      @JsonProperty("repaired_repairs") int repairs,
      @JsonProperty("repaired_bundle") String repairedBundle,
      @JsonProperty("repaired_exception") String repairedException) {}

  @JsonPropertyOrder({
      "total_scenarios", "first_try_completed", "schema_valid_irs", "schema_valid_rate",
      "validation_ok_irs", "validation_ok_rate", "avg_schema_errors_per_schema_failed_ir",
      "avg_constraint_coverage", "repaired_completed", "repaired_ok_irs", "repaired_ok_rate",
      "max_repairs"})
  public record Summary(
      @JsonProperty("total_scenarios") int totalScenarios,
      @JsonProperty("first_try_completed") int firstTryCompleted,
      @JsonProperty("schema_valid_irs") int schemaValid,
      @JsonProperty("schema_valid_rate") double schemaValidRate,
      @JsonProperty("validation_ok_irs") int validationOk,
      @JsonProperty("validation_ok_rate") double validationOkRate,
      @JsonProperty("avg_schema_errors_per_schema_failed_ir") double avgSchemaErrors,
      @JsonProperty("avg_constraint_coverage") double avgCoverage,
      @JsonProperty("repaired_completed") int repairedCompleted,
      @JsonProperty("repaired_ok_irs") int repairedOk,
      @JsonProperty("repaired_ok_rate") double repairedOkRate,
      @JsonProperty("max_repairs") int maxRepairs) {}

  public record Report(List<ScenarioResult> results, Summary summary) {
    public Report {
      results = List.copyOf(results);
    }
  }

  private final CandidateSource source;
  private final CompilerPipeline pipeline;
  private final int maxRepairs;

  public MetricsRunner(CandidateSource source, CompilerPipeline pipeline, int maxRepairs) {
    if (maxRepairs < 0) {
      throw new IllegalArgumentException("maxRepairs must not be negative: " + maxRepairs);
    }
    this.source = source;
    this.pipeline = pipeline;
    this.maxRepairs = maxRepairs;
  }

  /**
   * @param limit stop after this many scenarios; null for all
   */
  public Report run(Path scenariosFile, Path outDir, Integer limit) throws IOException {
    List<Scenario> scenarios = loadScenarios(scenariosFile, limit);
    Path runs = outDir.resolve("runs");
    Files.createDirectories(runs.resolve(FIRST_TRY_DIR));
    Files.createDirectories(runs.resolve(REPAIRED_DIR));

    List<ScenarioResult> results = new ArrayList<>();
    for (Scenario sc : scenarios) {
      results.add(score(sc, runs));
    }
    Summary summary = summarize(results);

    write(outDir.resolve(PER_SCENARIO_FILE), ScenarioResult.class, results);
    write(outDir.resolve(SUMMARY_CSV_FILE), Summary.class, List.of(summary));
    Json.write(outDir.resolve(SUMMARY_JSON_FILE), summary);
    log.info("Scored {} scenario(s): first-try ok {}, repaired ok {}, coverage {}",
        summary.totalScenarios(), summary.validationOkRate(), summary.repairedOkRate(), summary.avgCoverage());
    return new Report(results, summary);
  }

  static List<Scenario> loadScenarios(Path file, Integer limit) throws IOException {
    List<Map<String, String>> rows;
    Set<String> columns = new HashSet<>();
    try (MappingIterator<Map<String, String>> it = CSV_MAPPER.readerForMapOf(String.class)
        .with(CsvSchema.emptySchema().withHeader())
        .readValues(file.toFile())) {
      rows = it.readAll();
      if (it.getParserSchema() instanceof CsvSchema header) {
        header.forEach(c -> columns.add(c.getName()));
      }
    }
    List<String> missing = new ArrayList<>();
    for (String c : REQUIRED_COLUMNS) {
      if (!columns.contains(c)) missing.add(c);
    }
    if (!missing.isEmpty()) {
      throw new IllegalArgumentException("Scenario file " + file + " is missing columns " + missing);
    }

    List<Scenario> out = new ArrayList<>();
    for (Map<String, String> row : rows) {
      String id = cell(row, "scenario_id");
      if (id.isEmpty()) continue;
      out.add(new Scenario(
          id,
          cell(row, "nl_prompt"),
          cell(row, "original_prompt"),
          splitPipe(row.get("req_devices")),
          splitPipe(row.get("req_triggers")),
          splitPipe(row.get("req_actions")),
          splitPipe(row.get("req_conditions"))));
      if (limit != null && out.size() >= limit) break;
    }
    return out;
  }

  static List<String> splitPipe(String cell) {
    List<String> out = new ArrayList<>();
    if (cell == null || cell.isBlank() || cell.trim().equalsIgnoreCase("nan")) return out;
    for (String part : cell.split("\\|")) {
      if (!part.isBlank()) out.add(part.trim());
    }
    return out;
  }

  private static String cell(Map<String, String> row, String column) {
    String v = row.get(column);
    return v == null ? "" : v.trim();
  }

  // ---------------------------------------------------------------- scoring

  private ScenarioResult score(Scenario sc, Path runs) {
    Run first = attempt(sc, runs.resolve(FIRST_TRY_DIR), 0);
    Run repaired = maxRepairs == 0 ? first : attempt(sc, runs.resolve(REPAIRED_DIR), maxRepairs);

    Tokens present = first.result() == null || first.result().ir() == null
        ? new Tokens(Set.of(), Set.of(), Set.of())
        : extractTokens(first.result().ir());
    Coverage devices = Coverage.of(sc.devices(), present.devices());
    Coverage triggers = Coverage.of(sc.triggers(), present.triggers());
    Coverage actions = Coverage.of(sc.actions(), present.actions());
    int required = devices.required() + triggers.required() + actions.required();
    int found = devices.found() + triggers.found() + actions.found();
    double overall = required == 0 ? 1.0 : (double) found / required;

    ValidationReport firstReport = first.report();
    return new ScenarioResult(
        sc.id(), sc.prompt(), sc.originalPrompt(),
        String.join("|", sc.devices()), String.join("|", sc.triggers()),
        String.join("|", sc.actions()), String.join("|", sc.conditions()),
        first.completed(), first.ok(),
        firstReport.errors().size(), firstReport.warnings().size(), schemaErrors(firstReport),
        first.bundle(), first.exception(),
        devices.required(), devices.found(), round(devices.ratio()), String.join("|", devices.missing()),
        triggers.required(), triggers.found(), round(triggers.ratio()), String.join("|", triggers.missing()),
        actions.required(), actions.found(), round(actions.ratio()), String.join("|", actions.missing()),
        round(overall),
        repaired.completed(), repaired.ok(), repaired.report().errors().size(), repaired.repairs(),
        repaired.bundle(), repaired.exception());
  }

  /** One generation run; {@code completed} is false when it threw. */
  private record Run(PipelineResult result, int repairs, String bundle, String exception) {
    boolean completed() {
      return result != null;
    }

    boolean ok() {
      return result != null && result.ok();
    }

    ValidationReport report() {
      return result == null ? ValidationReport.empty() : result.report();
    }
  }

  private Run attempt(Scenario sc, Path runsDir, int repairBudget) {
    Path bundle = runsDir.resolve(sc.id());
    try {
      RepairLoop.Outcome outcome = new RepairLoop(source, pipeline, repairBudget).run(sc.prompt());
      new BundleStore(bundle).writeBaseline(outcome.result());
      return new Run(outcome.result(), outcome.repairs(), bundle.toString(), "");
    } catch (IOException | RuntimeException e) {
      log.warn("Scenario {} failed with {} repair(s) allowed: {}", sc.id(), repairBudget, e.getMessage());
      return new Run(null, 0, "", String.valueOf(e.getMessage()));
    }
  }

  private static int schemaErrors(ValidationReport report) {
    int n = 0;
    for (Diagnostic d : report.errors()) {
      if (d.kind() == Diagnostic.Kind.STRUCTURAL) n++;
    }
    return n;
  }

  private record Coverage(int required, int found, List<String> missing) {
    static Coverage of(Collection<String> required, Set<String> present) {
      List<String> missing = new ArrayList<>();
      int found = 0;
      for (String r : required) {
        if (present.contains(r)) found++;
        else missing.add(r);
      }
      return new Coverage(required.size(), found, missing);
    }

    double ratio() {
      return required == 0 ? 1.0 : (double) found / required;
    }
  }

  static Tokens extractTokens(StateMachine ir) {
    Set<String> devices = new LinkedHashSet<>();
    Set<String> triggers = new LinkedHashSet<>();
    Set<String> actions = new LinkedHashSet<>();
    for (StateMachine.Transition t : ir.transitions()) {
      if (t.trigger() != null) {
        for (Trigger.Condition c : t.trigger().conditions()) {
          if (c instanceof Trigger.Becomes b) {
            devices.add(b.ref().device());
            triggers.add("becomes(" + b.ref().text() + "," + literal(b.value()) + ")");
          } else if (c instanceof Trigger.Changes ch) {
            devices.add(ch.ref().device());
            triggers.add("changes(" + ch.ref().text() + ")");
          } else if (c instanceof Trigger.After a) {
            triggers.add("after(" + a.seconds() + ")");
          } else if (c instanceof Trigger.Schedule s) {
            triggers.add("schedule(" + s.expression() + ")");
          }
        }
      }
      if (t.guard() != null) guardDevices(t.guard(), devices);
      for (Action a : t.actions()) {
        if (a instanceof Action.Command cmd) {
          devices.add(cmd.device());
          actions.add("command(" + cmd.device() + "," + cmd.command() + ")");
        } else if (a instanceof Action.Delay d) {
          actions.add("delay(" + d.seconds() + ")");
        } else {
          actions.add("notify()");
        }
      }
    }
    return new Tokens(devices, triggers, actions);
  }

  private static void guardDevices(GuardExpr expr, Set<String> devices) {
    if (expr instanceof GuardExpr.Ref r) {
      devices.add(r.ref().device());
    }
    for (GuardExpr child : expr.children()) guardDevices(child, devices);
  }

  private static String literal(Literal lit) {
    if (lit instanceof Literal.Text t) return t.value();
    if (lit instanceof Literal.Int i) return Long.toString(i.value());
    if (lit instanceof Literal.Decimal d) return d.value().stripTrailingZeros().toPlainString();
    return Boolean.toString(((Literal.Bool) lit).value());
  }

  // ---------------------------------------------------------------- summary

  private Summary summarize(List<ScenarioResult> results) {
    int total = results.size();
    int completed = 0;
    int schemaValid = 0;
    int validationOk = 0;
    int repairedCompleted = 0;
    int repairedOk = 0;
    int schemaFailed = 0;
    int schemaErrorSum = 0;
    double coverageSum = 0;
    for (ScenarioResult r : results) {
      if (r.repairedCompleted()) repairedCompleted++;
      if (r.repairedOk()) repairedOk++;
      if (!r.firstTryCompleted()) continue;
      completed++;
      coverageSum += r.overallCoverage();
      if (r.firstTryOk()) validationOk++;
      if (r.firstTrySchemaErrors() == 0) {
        schemaValid++;
      } else {
        schemaFailed++;
        schemaErrorSum += r.firstTrySchemaErrors();
      }
    }
    return new Summary(
        total,
        completed,
        schemaValid,
        rate(schemaValid, completed),
        validationOk,
        rate(validationOk, completed),
        schemaFailed == 0 ? 0.0 : round((double) schemaErrorSum / schemaFailed),
        completed == 0 ? 0.0 : round(coverageSum / completed),
        repairedCompleted,
        repairedOk,
        rate(repairedOk, total),
        maxRepairs);
  }

  private static double rate(int part, int whole) {
    return whole == 0 ? 0.0 : round((double) part / whole);
  }

  static double round(double value) {
    return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
  }

  private static <T> void write(Path file, Class<T> type, List<T> rows) throws IOException {
    CsvSchema schema = CSV_MAPPER.schemaFor(type).withHeader();
    CSV_MAPPER.writer(schema).writeValue(file.toFile(), rows);
  }
}

package nlfsm;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Forward flow: candidate IR, normalize, validate, render. Round-trip flow: diagram text, parse,
 * normalize, validate, render, diff against the previous canonical IR. Edit flow: patch JSON,
 * apply to the previous canonical IR, then as the round-trip.
 */
public class CompilerPipeline {

  private static final Logger log = LoggerFactory.getLogger(CompilerPipeline.class);

  private final ShapeSchema schema;
  private final Catalog catalog;
  private final DiagramGenerator generator;
  private final DiagramParser parser = new DiagramParser();
  private final Normalizer normalizer = new Normalizer();
  private final DiffEngine diffEngine = new DiffEngine();

  public CompilerPipeline(ShapeSchema schema, Catalog catalog, DiagramGenerator generator) {
    this.schema = schema;
    this.catalog = catalog;
    this.generator = generator;
  }

  public CompilerPipeline(ShapeSchema schema, Catalog catalog) {
    this(schema, catalog, new DiagramGenerator());
  }

  public PipelineResult compile(StateMachine candidate) {
    return compile(candidate, null);
  }

  public PipelineResult compile(StateMachine candidate, StateMachine baseline) {
    return finish(candidate, baseline, ValidationReport.empty());
  }

  public PipelineResult compileJson(JsonNode candidate) {
    return compileJson(candidate, null);
  }

  public PipelineResult compileJson(JsonNode candidate, StateMachine baseline) {
    IrJson.ReadResult read = IrJson.read(candidate);
    if (!read.ok()) {
      log.debug("Candidate IR unreadable: {} diagnostic(s)", read.diagnostics().size());
      return PipelineResult.unreadable(read.report());
    }
    return finish(read.machine(), baseline, read.report());
  }

  public PipelineResult roundTrip(String diagramText, StateMachine baseline) {
    ParseResult parsed = parser.parse(diagramText, baseline);
    if (parsed.machine() == null) {
      log.debug("Diagram unreadable: {} diagnostic(s)", parsed.diagnostics().size());
      return PipelineResult.unreadable(parsed.report());
    }
    return finish(parsed.machine(), baseline, parsed.report());
  }

  /**
   * Applies a patch to {@code parent} and compiles the result; the diff is taken against the
   * parent. A patch that cannot be read or applied yields an unreadable result.
   */
  public PipelineResult edit(StateMachine parent, JsonNode patchJson) {
    IrPatch.ReadResult read = IrPatch.read(patchJson);
    if (!read.ok()) {
      log.debug("Patch unreadable: {} diagnostic(s)", read.diagnostics().size());
      return PipelineResult.unreadable(read.report());
    }
    StateMachine raw;
    try {
      raw = read.patch().apply(parent);
    } catch (IrPatch.EditFailure e) {
      log.debug("Patch edit {} failed: {}", e.index(), e.getMessage());
      return PipelineResult.unreadable(read.report().plus(ValidationReport.of(List.of(
          Diagnostic.error(Diagnostic.Kind.STRUCTURAL, "E900", "$.edits[" + e.index() + "]",
              "Failed to apply patch: " + e.getMessage())))));
    }
    return finish(raw, parent, read.report());
  }

  private PipelineResult finish(StateMachine raw, StateMachine baseline, ValidationReport prior) {
    StateMachine ir = normalizer.normalize(raw, baseline);
    log.debug("Normalized '{}': {} state(s), {} transition(s)",
        ir.name(), ir.states().size(), ir.transitions().size());
    ValidationReport report = prior.plus(IrValidator.validate(ir, schema, catalog));
    String diagram = report.ok() ? generator.render(ir) : null;
    SemanticDiff diff = baseline == null ? null : diffEngine.diff(baseline, ir);
    log.debug("Compiled '{}': ok={}, {} error(s), {} warning(s)",
        ir.name(), report.ok(), report.errors().size(), report.warnings().size());
    return new PipelineResult(ir, diagram, report, diff);
  }
}

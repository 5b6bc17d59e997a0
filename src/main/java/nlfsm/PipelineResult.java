package nlfsm;

/**
 * Outcome of one compile or round-trip. {@code diagram} is set only when the report passes;
 * {@code ir} is null when nothing could be read; {@code diff} is null without a baseline.
 */
public record PipelineResult(StateMachine ir, String diagram, ValidationReport report, SemanticDiff diff) {

  public boolean ok() {
    return ir != null && report.ok();
  }

  static PipelineResult unreadable(ValidationReport report) {
    return new PipelineResult(null, null, report, null);
  }
}

package nlfsm;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Draft, then validate; while errors remain and attempts are left, feed the report back to the
 * candidate source and validate again. Ends in {@link Accepted} or {@link Rejected}.
 */
public class RepairLoop {

  private static final Logger log = LoggerFactory.getLogger(RepairLoop.class);

  public sealed interface Phase permits Draft, Validating, Repairing, Accepted, Rejected {}

  public record Draft(String request) implements Phase {}

  public record Validating(int attempt) implements Phase {}

  public record Repairing(int attempt) implements Phase {}

  public record Accepted(int repairs) implements Phase {}

  public record Rejected(int repairs, int errors) implements Phase {}

  public record Outcome(PipelineResult result, List<Phase> history, int repairs) {
    public Outcome {
      history = List.copyOf(history);
    }

    public boolean accepted() {
      return !history.isEmpty() && history.get(history.size() - 1) instanceof Accepted;
    }
  }

  private final CandidateSource source;
  private final CompilerPipeline pipeline;
  private final int maxRepairs;

  public RepairLoop(CandidateSource source, CompilerPipeline pipeline, int maxRepairs) {
    if (maxRepairs < 0) {
      throw new IllegalArgumentException("maxRepairs must not be negative: " + maxRepairs);
    }
    this.source = source;
    this.pipeline = pipeline;
    this.maxRepairs = maxRepairs;
  }

  public Outcome run(String request) {
    List<Phase> history = new ArrayList<>();
    Phase phase = new Draft(request);
    JsonNode candidate = null;
    PipelineResult result = null;
    int repairs = 0;
    while (true) {
      history.add(phase);
      log.debug("Phase {}", phase);
      if (phase instanceof Draft d) {
        candidate = source.generate(d.request());
        phase = new Validating(0);
      } else if (phase instanceof Validating) {
        result = pipeline.compileJson(candidate);
        if (result.ok()) {
          phase = new Accepted(repairs);
        } else if (repairs >= maxRepairs) {
          phase = new Rejected(repairs, result.report().errors().size());
        } else {
          phase = new Repairing(repairs + 1);
        }
      } else if (phase instanceof Repairing r) {
        candidate = source.repair(candidate, result.report(), r.attempt());
        repairs = r.attempt();
        phase = new Validating(repairs);
      } else {
        if (phase instanceof Rejected rejected) {
          log.warn("Candidate rejected after {} repair(s) with {} error(s)",
              rejected.repairs(), rejected.errors());
        } else {
          log.info("Candidate accepted after {} repair(s)", repairs);
        }
        return new Outcome(result, history, repairs);
      }
    }
  }
}

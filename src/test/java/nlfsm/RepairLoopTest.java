package nlfsm;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RepairLoopTest {

  private static final String VERB_REQUEST =
      "Turn on the hallway light when motion is detected and turn off 2 minutes after motion stops";

  private TemplateCandidateSource source;
  private CompilerPipeline pipeline;

  @BeforeEach
  void setUp() {
    source = new TemplateCandidateSource();
    pipeline = Fixtures.pipeline();
  }

  @Test
  void verbCommandsAreRepairedFromFeedback() {
    RepairLoop.Outcome outcome = new RepairLoop(source, pipeline, 2).run(VERB_REQUEST);

    assertTrue(outcome.accepted());
    assertEquals(1, outcome.repairs());
    assertEquals(List.of(
        new RepairLoop.Draft(VERB_REQUEST),
        new RepairLoop.Validating(0),
        new RepairLoop.Repairing(1),
        new RepairLoop.Validating(1),
        new RepairLoop.Accepted(1)), outcome.history());
    StateMachine ir = outcome.result().ir();
    assertEquals(List.of(Fixtures.cmd("hallway_light", "on")), ir.outgoing("Idle").get(0).actions());
    assertEquals(Trigger.after(120), ir.outgoing("Lit_wait").get(0).trigger());
  }

  @Test
  void noRepairBudgetRejects() {
    RepairLoop.Outcome outcome = new RepairLoop(source, pipeline, 0).run(VERB_REQUEST);

    assertFalse(outcome.accepted());
    assertEquals(List.of(
        new RepairLoop.Draft(VERB_REQUEST),
        new RepairLoop.Validating(0),
        new RepairLoop.Rejected(0, 2)), outcome.history());
    assertEquals(List.of("E300", "E300"), Fixtures.codes(outcome.result().report()));
    assertNull(outcome.result().diagram());
  }

  @Test
  void validDraftNeedsNoRepair() {
    RepairLoop.Outcome outcome =
        new RepairLoop(source, pipeline, 2).run("When motion is detected light the hall for 30 seconds");

    assertTrue(outcome.accepted());
    assertEquals(0, outcome.repairs());
    assertEquals(3, outcome.history().size());
    assertTrue(outcome.result().diagram().contains("TRIGGER: after 30s\\nACTION: light_hall.off()"));
  }

  @Test
  void unrepairableCandidateUsesAllAttempts() {
    CandidateSource stubborn = new CandidateSource() {
      @Override
      public JsonNode generate(String request) {
        return source.generate("Turn on the hallway light");
      }

      @Override
      public JsonNode repair(JsonNode candidate, ValidationReport report, int attempt) {
        return candidate;
      }
    };

    RepairLoop.Outcome outcome = new RepairLoop(stubborn, pipeline, 3).run("anything");

    assertFalse(outcome.accepted());
    assertEquals(3, outcome.repairs());
    assertEquals(new RepairLoop.Rejected(3, 1), outcome.history().get(outcome.history().size() - 1));
  }

  @Test
  void negativeBudgetIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new RepairLoop(source, pipeline, -1));
  }

  @Test
  void delayParsing() {
    assertEquals(45, TemplateCandidateSource.delaySeconds("off after 45 seconds"));
    assertEquals(600, TemplateCandidateSource.delaySeconds("off after 10 min"));
    assertEquals(7200, TemplateCandidateSource.delaySeconds("2 hours later"));
    assertEquals(TemplateCandidateSource.DEFAULT_DELAY_SECONDS, TemplateCandidateSource.delaySeconds("later"));
    assertEquals(TemplateCandidateSource.DEFAULT_DELAY_SECONDS,
        TemplateCandidateSource.delaySeconds("off after 99999999999999999999 seconds"));
    assertEquals(TemplateCandidateSource.DEFAULT_DELAY_SECONDS,
        TemplateCandidateSource.delaySeconds("off after 9999999999999999 hours"));
  }
}

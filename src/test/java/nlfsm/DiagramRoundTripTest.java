package nlfsm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DiagramRoundTripTest {

  private Normalizer normalizer;
  private DiagramGenerator generator;
  private DiagramParser parser;

  @BeforeEach
  void setUp() {
    normalizer = new Normalizer();
    generator = new DiagramGenerator(false);
    parser = new DiagramParser();
  }

  @Test
  @DisplayName("rendering then parsing a canonical machine gives the same machine")
  void roundTripClosure() {
    for (StateMachine candidate : List.of(Fixtures.motionLight(), Fixtures.everything())) {
      StateMachine ir = normalizer.normalize(candidate);
      ParseResult parsed = parser.parse(generator.render(ir));

      assertTrue(parsed.diagnostics().isEmpty(), "no diagnostics: " + parsed.diagnostics());
      assertEquals(ir, parsed.machine(), "round-trip of " + ir.name());
    }
  }

  @Test
  void roundTripKeepsGuideAndCatalogVersion() {
    StateMachine ir = normalizer.normalize(Fixtures.everything());
    String text = new DiagramGenerator(true).render(ir);

    assertTrue(text.contains("' catalog-version: 2024.1\n"));
    ParseResult parsed = parser.parse(text);
    assertEquals(ir, parsed.machine());
    assertEquals("2024.1", parsed.machine().catalogVersion());
  }

  @Test
  @DisplayName("the same input always renders byte-identical text")
  void renderingIsDeterministic() {
    StateMachine candidate = Fixtures.everything();
    String first = generator.render(normalizer.normalize(candidate));
    String second = generator.render(normalizer.normalize(candidate));
    String shuffled = generator.render(normalizer.normalize(Fixtures.reversed(candidate)));

    assertEquals(first, second);
    assertEquals(first, shuffled, "listing order of the candidate must not matter");
  }

  @Test
  void rendersMotionLightLayout() {
    String text = generator.render(normalizer.normalize(Fixtures.motionLight()));

    String expected = String.join("\n",
        "@startuml",
        "title MotionLight",
        "",
        "state \"Idle\" as Idle",
        "state \"Light on\" as Lit",
        "state \"Lit_wait\" as Lit_wait <<timer>>",
        "",
        "[*] --> Idle",
        "",
        "Idle --> Lit : TRIGGER: motion_hall.motion becomes \"active\"\\nACTION: light_hall.on()",
        "Lit --> Lit_wait : TRIGGER: motion_hall.motion becomes \"inactive\"",
        "Lit_wait --> Idle : TRIGGER: after 300s\\nACTION: light_hall.off()",
        "@enduml",
        "");
    assertEquals(expected, text);
  }

  /** Parentheses typed by the author survive parse, normalize and render unchanged. */
  @Test
  void authoredGroupingSurvivesRoundTrip() {
    String guard = "(front_door.lock == \"locked\") and not (location_mode.mode != \"home\")";
    String text = String.join("\n",
        "@startuml",
        "title Door",
        "state \"Idle\" as Idle",
        "state \"Armed\" as Armed",
        "[*] --> Idle",
        "Idle --> Armed : TRIGGER: presence_phone.presence becomes \"not present\"\\nGUARD: " + guard,
        "Armed --> Idle : TRIGGER: presence_phone.presence becomes \"present\"",
        "@enduml");

    PipelineResult result = Fixtures.pipeline().roundTrip(text, null);

    assertTrue(result.ok(), () -> result.report().diagnostics().toString());
    assertTrue(result.diagram().contains("GUARD: " + guard + "\n"), result.diagram());
    GuardExpr expected = GuardExpr.and(
        GuardExpr.group(GuardExpr.compare(
            Fixtures.ref("front_door.lock"), GuardExpr.Operator.EQ, Literal.text("locked"))),
        GuardExpr.not(GuardExpr.group(GuardExpr.compare(
            Fixtures.ref("location_mode.mode"), GuardExpr.Operator.NEQ, Literal.text("home")))));
    StateMachine.Transition arming = result.ir().outgoing("Idle").get(0);
    assertEquals(expected, arming.guard());
  }

  @ParameterizedTest
  @ValueSource(strings = {"title", "state", "skinparam", "hide", "note"})
  void aliasesNamedLikeDirectivesRoundTrip(String alias) {
    StateMachine ir = normalizer.normalize(new StateMachine(
        "Keywords",
        List.of(new StateMachine.State(alias), new StateMachine.State("Lit")),
        List.of(
            Fixtures.transition(alias, "Lit", Fixtures.becomes("motion_hall.motion", "active")),
            Fixtures.transition("Lit", alias, Fixtures.becomes("motion_hall.motion", "inactive"))),
        alias,
        ""));

    ParseResult parsed = parser.parse(generator.render(ir));

    assertTrue(parsed.diagnostics().isEmpty(), "no diagnostics: " + parsed.diagnostics());
    assertEquals(ir, parsed.machine());
  }

  @Test
  void labelsWithLineSeparatorsRoundTrip() {
    StateMachine candidate = Fixtures.motionLight();
    StateMachine ir = normalizer.normalize(candidate.withStates(List.of(
        candidate.state("Idle").withLabel("Hall\u2028idle\u0085now"),
        candidate.state("Lit").withLabel("Lamp\013on\fpage\u2029"))));

    String text = generator.render(ir);
    ParseResult parsed = parser.parse(text);

    assertTrue(parsed.diagnostics().isEmpty(), "no diagnostics: " + parsed.diagnostics());
    assertEquals(ir, parsed.machine());
    assertTrue(text.contains("\"Hall\\u2028idle\\u0085now\""), text);
  }

  @Test
  void invariantsRenderAsNotesAndRoundTrip() {
    StateMachine candidate = Fixtures.motionLight();
    GuardExpr lightOn = GuardExpr.compare(
        Fixtures.ref("light_hall.switch"), GuardExpr.Operator.EQ, Literal.text("on"));
    GuardExpr dimOrHome = GuardExpr.or(
        GuardExpr.compare(Fixtures.ref("hallway_light.level"), GuardExpr.Operator.LT, Literal.integer(50)),
        GuardExpr.compare(Fixtures.ref("location_mode.away"), GuardExpr.Operator.EQ, Literal.bool(false)));
    StateMachine ir = normalizer.normalize(candidate.withStates(List.of(
        candidate.state("Idle"),
        candidate.state("Lit").withInvariants(List.of(lightOn, dimOrHome)))));

    String text = generator.render(ir);

    assertTrue(text.contains(String.join("\n",
        "note right of Lit",
        "- light_hall.switch == \"on\"",
        "- hallway_light.level < 50 or location_mode.away == false",
        "end note",
        "")), text);
    ParseResult parsed = parser.parse(text);
    assertTrue(parsed.diagnostics().isEmpty(), "no diagnostics: " + parsed.diagnostics());
    assertEquals(ir, parsed.machine());
  }

  @Test
  void regeneratedDiagramIsStable() {
    CompilerPipeline pipeline = Fixtures.pipeline();
    PipelineResult compiled = pipeline.compile(Fixtures.everything());
    PipelineResult again = pipeline.roundTrip(compiled.diagram(), compiled.ir());

    assertTrue(again.ok(), () -> again.report().diagnostics().toString());
    assertEquals(compiled.diagram(), again.diagram());
    assertTrue(again.diff().isEmpty(), () -> again.diff().summary().toString());
  }
}

package nlfsm;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IrJsonTest {

  @Test
  void readsCandidateFixture() throws IOException {
    IrJson.ReadResult result = IrJson.read(Json.load("classpath:candidates/motion-light.json"));

    assertTrue(result.ok(), result.diagnostics().toString());
    StateMachine m = result.machine();
    assertEquals("MotionLight", m.name());
    assertEquals("2024.1", m.catalogVersion());
    assertEquals("Light on", m.state("Lit").label());
    StateMachine.Transition off = m.outgoing("Lit").get(0);
    assertEquals(List.of(new Action.Delay(300), Fixtures.cmd("light_hall", "off")), off.actions());
    assertEquals(GuardExpr.and(
        GuardExpr.group(GuardExpr.compare(
            Fixtures.ref("front_door.contact"), GuardExpr.Operator.EQ, Literal.text("closed"))),
        GuardExpr.not(GuardExpr.group(GuardExpr.compare(
            Fixtures.ref("location_mode.mode"), GuardExpr.Operator.NEQ, Literal.text("home"))))),
        off.guard());
  }

  @Test
  void fixtureCompilesToValidIr() throws IOException {
    PipelineResult result = Fixtures.pipeline().compileJson(Json.load("classpath:candidates/motion-light.json"));

    assertTrue(result.ok(), result.report().diagnostics().toString());
    assertTrue(result.ir().state("Lit_wait").synthetic());
    assertTrue(result.diagram().contains(
        "GUARD: (front_door.contact == \"closed\") and not (location_mode.mode != \"home\")"));
  }

  @Test
  void reportsEveryProblemWithItsPath() throws IOException {
    IrJson.ReadResult result = IrJson.read(Json.load("classpath:candidates/broken.json"));

    assertFalse(result.ok());
    assertNull(result.machine());
    List<String> found = result.diagnostics().stream().map(d -> d.code() + "@" + d.location()).toList();
    assertTrue(found.containsAll(List.of(
        "E100@$.states[2].id",
        "E100@$.transitions[0].from",
        "E100@$.transitions[1].triggers[0].type",
        "E102@$.states[1].id",
        "E111@$.initial")), found.toString());
    assertTrue(result.diagnostics().stream().allMatch(d -> d.kind() == Diagnostic.Kind.STRUCTURAL));
  }

  @Test
  void missingNameAndNonObjectInput() {
    IrJson.ReadResult noName = IrJson.read(Json.parse(
        "{\"initial\":\"A\",\"states\":[{\"id\":\"A\"}],\"transitions\":[]}"));
    assertEquals(List.of("E100"), Fixtures.codes(noName.diagnostics()));
    assertEquals("$.name", noName.diagnostics().get(0).location());

    IrJson.ReadResult array = IrJson.read(Json.parse("[]"));
    assertEquals("$", array.diagnostics().get(0).location());
  }

  @Test
  void unknownTransitionEndpoint() {
    IrJson.ReadResult result = IrJson.read(Json.parse("{\"name\":\"X\",\"initial\":\"A\","
        + "\"states\":[{\"id\":\"A\"}],\"transitions\":[{\"from\":\"A\",\"to\":\"B\","
        + "\"triggers\":[{\"type\":\"after\",\"seconds\":5}]}]}"));

    assertEquals(List.of("E111"), Fixtures.codes(result.diagnostics()));
    assertEquals("$.transitions[0].to", result.diagnostics().get(0).location());
  }

  @Test
  void lenientFieldSpellings() {
    IrJson.ReadResult result = IrJson.read(Json.parse("{\"name\":\"X\",\"initial\":\"A\","
        + "\"states\":[{\"alias\":\"A\"},{\"id\":\"B\"}],\"transitions\":[{\"from\":\"A\",\"to\":\"B\","
        + "\"triggers\":[{\"type\":\"schedule\",\"cron\":\"0 7 * * *\"}],"
        + "\"actions\":[{\"type\":\"command\",\"device\":\"thermostat\",\"command\":\"setSetpoint\",\"args\":[20.5]}]}]}"));

    assertTrue(result.ok(), result.diagnostics().toString());
    StateMachine.Transition t = result.machine().transitions().get(0);
    assertEquals(Trigger.of(new Trigger.Schedule("0 7 * * *")), t.trigger());
    assertEquals(List.of(Fixtures.cmd("thermostat", "setSetpoint", Literal.decimal("20.5"))), t.actions());
  }

  @Test
  void writtenIrReadsBackEqual() {
    StateMachine ir = new Normalizer().normalize(Fixtures.everything());

    JsonNode reparsed = Json.parse(Json.pretty(IrJson.write(ir)));

    assertEquals(ir, IrJson.readStrict(reparsed));
  }

  @Test
  void stateInvariantsAreWrittenOnlyWhenPresent() {
    StateMachine base = new Normalizer().normalize(Fixtures.motionLight());
    GuardExpr lightOn = GuardExpr.compare(
        Fixtures.ref("light_hall.switch"), GuardExpr.Operator.EQ, Literal.text("on"));
    StateMachine ir = base.withStates(List.of(
        base.state("Idle"), base.state("Lit").withInvariants(List.of(lightOn)), base.state("Lit_wait")));

    JsonNode written = IrJson.write(ir);

    assertFalse(written.path("states").get(0).has("invariants"));
    assertEquals("eq", written.path("states").get(1).path("invariants").get(0).path("op").asText());
    assertEquals(ir, IrJson.readStrict(Json.parse(Json.pretty(written))));
  }

  @Test
  void badInvariantIsReportedWithItsPath() {
    IrJson.ReadResult result = IrJson.read(Json.parse("{\"name\":\"X\",\"initial\":\"A\","
        + "\"states\":[{\"id\":\"A\",\"invariants\":[{\"op\":\"approx\",\"args\":[]}]}],\"transitions\":[]}"));

    assertEquals(List.of("E100"), Fixtures.codes(result.diagnostics()));
    assertEquals("$.states[0].invariants[0].op", result.diagnostics().get(0).location());
  }

  @Test
  void readStrictRejectsBrokenIr() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> IrJson.readStrict(Json.parse("{\"name\":\"X\"}")));
    assertTrue(e.getMessage().contains("E100"), e.getMessage());
  }

  @Test
  void reportJsonShape() {
    ValidationReport report = ValidationReport.of(List.of(
        Diagnostic.error(Diagnostic.Kind.DOMAIN, "E300", "$.transitions[0].actions[0]", "Unknown command")
            .withSuggestions(List.of("on", "off"))));

    JsonNode json = IrJson.write(report);

    assertFalse(json.path("ok").asBoolean());
    JsonNode d = json.path("diagnostics").get(0);
    assertEquals("ERROR", d.path("severity").asText());
    assertEquals("DOMAIN", d.path("kind").asText());
    assertEquals("E300", d.path("code").asText());
    assertEquals("on", d.path("suggestions").get(0).asText());
  }
}

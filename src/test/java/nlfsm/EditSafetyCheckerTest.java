package nlfsm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

public class EditSafetyCheckerTest {

  private CompilerPipeline pipeline;
  private StateMachine baseline;
  private String diagram;

  @BeforeEach
  void setUp() {
    pipeline = Fixtures.pipeline();
    PipelineResult compiled = pipeline.compile(Fixtures.motionLight());
    baseline = compiled.ir();
    diagram = compiled.diagram();
  }

  @Test
  void renamingAnAliasIsRejected() {
    String edited = diagram.replace("Idle", "LightOff");

    PipelineResult result = pipeline.roundTrip(edited, baseline);

    assertFalse(result.ok());
    assertNull(result.diagram());
    List<Diagnostic> identity = result.report().ofKind(Diagnostic.Kind.IDENTITY);
    assertEquals(1, identity.size(), result.report().diagnostics().toString());
    Diagnostic d = identity.get(0);
    assertEquals("E600", d.code());
    assertEquals("state:LightOff", d.location());
    assertEquals(List.of("Idle"), d.suggestions());
  }

  @Test
  void renamingConnectedStatesTogetherIsRejected() {
    String edited = diagram.replace("Idle", "Off").replace("Lit", "On");

    PipelineResult result = pipeline.roundTrip(edited, baseline);

    assertFalse(result.ok());
    Map<String, List<String>> renames = new TreeMap<>();
    for (Diagnostic d : result.report().withCode("E600")) {
      renames.put(d.location(), d.suggestions());
    }
    assertEquals(Map.of(
        "state:Off", List.of("Idle"),
        "state:On", List.of("Lit"),
        "state:On_wait", List.of("Lit_wait")), renames, result.report().diagnostics().toString());
  }

  @Test
  void swappedRenamesKeepTheirRoles() {
    StateMachine edited = Normalizer.rename(Normalizer.rename(baseline, "Idle", "Rest"), "Lit", "Glow");

    List<Diagnostic> found = new EditSafetyChecker().check(edited, baseline);

    assertEquals(2, found.size(), found.toString());
    assertTrue(found.stream().allMatch(d -> d.code().equals("E600")));
    for (Diagnostic d : found) {
      String expected = d.location().equals("state:Rest") ? "Idle" : "Lit";
      assertEquals(List.of(expected), d.suggestions(), d.toString());
    }
  }

  @Test
  void renamedDeclarationWithOldAliasStillInUseIsRejected() {
    String edited = diagram.replace("state \"Light on\" as Lit", "state \"Light on\" as Bright");

    PipelineResult result = pipeline.roundTrip(edited, baseline);

    assertFalse(result.ok());
    List<Diagnostic> identity = result.report().withCode("E600");
    assertEquals(1, identity.size(), result.report().diagnostics().toString());
    assertEquals("state:Bright", identity.get(0).location());
    assertEquals(List.of("Lit"), identity.get(0).suggestions());
  }

  @Test
  void relabellingKeepsIdentity() {
    String edited = diagram.replace("state \"Light on\" as Lit", "state \"Lamp lit\" as Lit");

    PipelineResult result = pipeline.roundTrip(edited, baseline);

    assertTrue(result.ok(), result.report().diagnostics().toString());
    assertEquals(List.of(new SemanticDiff.LabelChange("Lit", "Light on", "Lamp lit")),
        result.diff().labelChanges());
    assertTrue(result.diff().addedStates().isEmpty());
  }

  @Test
  void newStatesAreNotRenames() {
    StateMachine edited = baseline.withStates(List.of(
        baseline.state("Idle"), baseline.state("Lit"), baseline.state("Lit_wait"), new StateMachine.State("Night")));

    assertTrue(new EditSafetyChecker().check(edited, baseline).isEmpty());
  }

  @Test
  void removedStateIsNotARename() {
    StateMachine edited = new StateMachine(
        baseline.name(),
        List.of(baseline.state("Idle"), baseline.state("Lit")),
        List.of(baseline.outgoing("Idle").get(0)),
        "Idle",
        "");

    assertTrue(new EditSafetyChecker().check(edited, baseline).isEmpty());
  }
}

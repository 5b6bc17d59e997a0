package nlfsm;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class BundleStoreTest {

  @TempDir
  Path root;

  private BundleStore store;
  private CompilerPipeline pipeline;
  private PipelineResult baseline;

  @BeforeEach
  void setUp() {
    store = new BundleStore(root, Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    pipeline = Fixtures.pipeline();
    baseline = pipeline.compile(Fixtures.motionLight());
  }

  @Test
  void baselineIsPromotedToCurrent() throws IOException {
    BundleStore.Revision revision = store.writeBaseline(baseline);

    assertTrue(revision.promoted());
    assertEquals(root.resolve(BundleStore.BASELINE), revision.dir());
    for (String file : new String[] {BundleStore.IR_FILE, BundleStore.DIAGRAM_FILE, BundleStore.REPORT_FILE}) {
      assertTrue(Files.exists(store.currentDir().resolve(file)), file);
    }
    assertEquals(baseline.ir(), store.loadCurrent().orElseThrow());
    assertEquals(baseline.diagram(),
        Files.readString(store.currentDir().resolve(BundleStore.DIAGRAM_FILE), StandardCharsets.UTF_8));

    JsonNode manifest = store.manifest();
    assertEquals("baseline", manifest.path("current").path("pointsTo").asText());
    assertEquals(1, manifest.path("revisions").size());
    assertEquals("2024-05-01T10:00:00Z", manifest.path("updatedAt").asText());
    assertFalse(Files.exists(root.resolve(".current.staging")));
  }

  /** A rejected rename is stored for inspection but never becomes current. */
  @Test
  void failedEditLeavesCurrentUntouched() throws IOException {
    store.writeBaseline(baseline);
    String edited = baseline.diagram().replace("Idle", "LightOff");

    PipelineResult result = pipeline.roundTrip(edited, store.loadCurrent().orElseThrow());
    BundleStore.Revision revision = store.writeEdit(edited, result);

    assertFalse(revision.promoted());
    assertEquals(root.resolve("edits").resolve("edit_001"), revision.dir());
    assertTrue(Files.exists(revision.dir().resolve(BundleStore.SOURCE_FILE)));
    assertTrue(Files.exists(revision.dir().resolve(BundleStore.REPORT_FILE)));
    assertFalse(Files.exists(revision.dir().resolve(BundleStore.DIAGRAM_FILE)));
    assertEquals(baseline.ir(), store.loadCurrent().orElseThrow());
    assertTrue(store.loadCurrent().orElseThrow().findState("Idle").isPresent());

    JsonNode manifest = store.manifest();
    assertEquals("baseline", manifest.path("current").path("pointsTo").asText());
    JsonNode record = manifest.path("revisions").get(1);
    assertFalse(record.path("ok").asBoolean());
    assertFalse(record.path("promoted").asBoolean());
    assertEquals("edits/edit_001/source.puml", record.path("sourcePuml").asText());
  }

  @Test
  void passingEditBecomesCurrent() throws IOException {
    store.writeBaseline(baseline);
    String edited = baseline.diagram().replace("state \"Light on\" as Lit", "state \"Lamp lit\" as Lit");

    PipelineResult result = pipeline.roundTrip(edited, store.loadCurrent().orElseThrow());
    BundleStore.Revision revision = store.writeEdit(edited, result);

    assertTrue(revision.promoted());
    assertEquals("Lamp lit", store.loadCurrent().orElseThrow().state("Lit").label());
    assertTrue(Files.exists(revision.dir().resolve(BundleStore.DIFF_FILE)));
    assertEquals("edits/edit_001", store.manifest().path("current").path("pointsTo").asText());
    assertEquals(baseline.ir(), store.loadBaseline().orElseThrow());
  }

  @Test
  void patchEditKeepsRequestAndSummary() throws IOException {
    store.writeBaseline(baseline);
    JsonNode patch = Json.parse("{\"summary\":\"Rename the lit state\",\"edits\":["
        + "{\"op\":\"set_state_label\",\"state_id\":\"Lit\",\"label\":\"Lamp lit\"}]}");

    PipelineResult result = pipeline.edit(store.loadCurrent().orElseThrow(), patch);
    BundleStore.Revision revision = store.writePatchEdit("call it lamp lit", patch, result);

    assertTrue(revision.promoted());
    assertEquals("patch", revision.kind());
    assertEquals("Lamp lit", store.loadCurrent().orElseThrow().state("Lit").label());
    assertEquals("call it lamp lit",
        Files.readString(revision.dir().resolve(BundleStore.REQUEST_FILE), StandardCharsets.UTF_8));
    assertEquals(patch, Json.read(revision.dir().resolve(BundleStore.PATCH_FILE)));
    String summary = Files.readString(revision.dir().resolve(BundleStore.SUMMARY_FILE), StandardCharsets.UTF_8);
    assertTrue(summary.startsWith("# Edit summary\n"), summary);
    assertTrue(summary.contains("Patch: Rename the lit state"), summary);
    assertTrue(summary.contains("- ~ state Lit label \"Light on\" -> \"Lamp lit\""), summary);

    JsonNode record = store.manifest().path("revisions").get(1);
    assertEquals("patch", record.path("kind").asText());
    assertEquals("edits/edit_001/request.txt", record.path("request").asText());
    assertEquals("edits/edit_001/patch.json", record.path("patch").asText());
    assertFalse(record.has("sourcePuml"));
  }

  @Test
  void unappliedPatchIsRecordedButNotPromoted() throws IOException {
    store.writeBaseline(baseline);
    JsonNode patch = Json.parse("{\"edits\":[{\"op\":\"remove_state\",\"state_id\":\"Idle\"}]}");

    PipelineResult result = pipeline.edit(store.loadCurrent().orElseThrow(), patch);
    BundleStore.Revision revision = store.writePatchEdit("drop idle", patch, result);

    assertFalse(revision.promoted());
    assertFalse(Files.exists(revision.dir().resolve(BundleStore.IR_FILE)));
    String summary = Files.readString(revision.dir().resolve(BundleStore.SUMMARY_FILE), StandardCharsets.UTF_8);
    assertTrue(summary.contains("(patch not applied)"), summary);
    assertTrue(summary.contains("E900"), summary);
    assertEquals(baseline.ir(), store.loadCurrent().orElseThrow());
  }

  @Test
  void editsAreNumberedInOrder() throws IOException {
    store.writeBaseline(baseline);

    store.writeEdit(baseline.diagram(), pipeline.roundTrip(baseline.diagram(), baseline.ir()));
    BundleStore.Revision second =
        store.writeEdit(baseline.diagram(), pipeline.roundTrip(baseline.diagram(), baseline.ir()));

    assertEquals("edit_002", second.dir().getFileName().toString());
    assertEquals(3, store.manifest().path("revisions").size());
  }

  @Test
  void emptyBundleHasNothingToLoad() throws IOException {
    assertTrue(store.loadCurrent().isEmpty());
    assertTrue(store.manifest().isEmpty());
  }

  @Test
  void corruptIrIsReported() throws IOException {
    Files.createDirectories(store.currentDir());
    Files.writeString(store.currentDir().resolve(BundleStore.IR_FILE), "{\"name\":\"X\"}");

    assertThrows(IOException.class, () -> store.loadCurrent());
  }
}

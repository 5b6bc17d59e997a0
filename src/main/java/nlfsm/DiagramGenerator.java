package nlfsm;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/** Renders canonical IR as the PlantUML subset read back by {@link DiagramParser}. */
public class DiagramGenerator {

  static final String GUIDE_RESOURCE = "/diagram-guide.txt";
  static final String CATALOG_VERSION_PREFIX = "' catalog-version:";

  private static volatile List<String> guide;

  private final boolean includeGuide;

  public DiagramGenerator() {
    this(true);
  }

  public DiagramGenerator(boolean includeGuide) {
    this.includeGuide = includeGuide;
  }

  public String render(StateMachine ir) {
    StringBuilder sb = new StringBuilder();
    sb.append("@startuml\n");
    sb.append("title ").append(ir.name()).append("\n");
    if (!ir.catalogVersion().isEmpty()) {
      sb.append(CATALOG_VERSION_PREFIX).append(' ').append(ir.catalogVersion()).append("\n");
    }
    if (includeGuide) {
      sb.append("\n");
      for (String line : guideLines()) {
        sb.append(line.isEmpty() ? "'" : "' " + line).append("\n");
      }
    }
    sb.append("\n");

    for (StateMachine.State s : ir.states()) {
      sb.append(DiagramGrammar.STATE.format(s)).append("\n");
    }
    sb.append("\n");
    sb.append("[*] --> ").append(ir.initial()).append("\n");
    sb.append("\n");

    for (StateMachine.State s : ir.states()) {
      List<String> note = DiagramGrammar.formatInvariantNote(s);
      if (note.isEmpty()) continue;
      for (String line : note) {
        sb.append(line).append("\n");
      }
      sb.append("\n");
    }

    for (StateMachine.Transition t : ir.transitions()) {
      sb.append(t.source()).append(" --> ").append(t.target());
      String label = DiagramGrammar.formatLabel(t);
      if (!label.isEmpty()) {
        sb.append(" : ").append(label);
      }
      sb.append("\n");
    }
    sb.append("@enduml\n");
    return sb.toString();
  }

  static List<String> guideLines() {
    List<String> lines = guide;
    if (lines == null) {
      lines = loadGuide();
      guide = lines;
    }
    return lines;
  }

  private static List<String> loadGuide() {
    try (InputStream in = DiagramGenerator.class.getResourceAsStream(GUIDE_RESOURCE)) {
      if (in == null) {
        throw new IOException("Missing guide resource: " + GUIDE_RESOURCE);
      }
      List<String> lines = new ArrayList<>();
      BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
      String line;
      while ((line = reader.readLine()) != null) {
        lines.add(line.stripTrailing());
      }
      while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
        lines.remove(lines.size() - 1);
      }
      return List.copyOf(lines);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}

package nlfsm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

/**
 * Runtime configuration. Layers, later wins: {@code settings.yml} on the class path, an optional
 * YAML file, then {@code nlfsm.*} system properties.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Settings(
    String catalog, String schema, String outputDir, int maxRepairs, boolean diagramGuide) {

  static final String RESOURCE = "settings.yml";
  static final String PROPERTY_PREFIX = "nlfsm.";

  private static final YAMLMapper YAML = new YAMLMapper();
  private static final Map<String, String> PROPERTY_KEYS = Map.of(
      "nlfsm.catalog", "catalog",
      "nlfsm.schema", "schema",
      "nlfsm.outputDir", "outputDir",
      "nlfsm.maxRepairs", "maxRepairs",
      "nlfsm.diagramGuide", "diagramGuide");

  public Settings {
    Names.requireNonBlank(catalog, "catalog");
    Names.requireNonBlank(schema, "schema");
    Names.requireNonBlank(outputDir, "outputDir");
    if (maxRepairs < 0) {
      throw new IllegalArgumentException("maxRepairs must not be negative: " + maxRepairs);
    }
  }

  public static Settings load() throws IOException {
    return load(null, System.getProperties());
  }

  public static Settings load(Path overrideFile) throws IOException {
    return load(overrideFile, System.getProperties());
  }

  public static Settings load(Path overrideFile, Properties properties) throws IOException {
    ObjectNode merged = YAML.createObjectNode();
    try (InputStream in = Settings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in == null) {
        throw new IOException("Missing resource: " + RESOURCE);
      }
      merge(merged, YAML.readTree(in), RESOURCE);
    }
    if (overrideFile != null) {
      try (InputStream in = Files.newInputStream(overrideFile)) {
        merge(merged, YAML.readTree(in), overrideFile.toString());
      }
    }
    for (Map.Entry<String, String> e : PROPERTY_KEYS.entrySet()) {
      String value = properties.getProperty(e.getKey());
      if (value != null) merged.put(e.getValue(), value.trim());
    }
    return YAML.treeToValue(merged, Settings.class);
  }

  private static void merge(ObjectNode target, JsonNode layer, String source) throws IOException {
    if (layer == null || layer.isNull() || layer.isMissingNode()) return;
    if (!layer.isObject()) {
      throw new IOException("Settings in " + source + " must be a mapping");
    }
    target.setAll((ObjectNode) layer);
  }

  public Catalog loadCatalog() throws IOException {
    return Catalog.load(catalog);
  }

  public ShapeSchema loadSchema() throws IOException {
    return ShapeSchema.load(schema);
  }

  public Settings withCatalog(String location) {
    return new Settings(location, schema, outputDir, maxRepairs, diagramGuide);
  }

  public Settings withSchema(String location) {
    return new Settings(catalog, location, outputDir, maxRepairs, diagramGuide);
  }
}

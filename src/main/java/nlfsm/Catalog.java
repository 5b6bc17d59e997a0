package nlfsm;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Read-only device/capability catalog. Devices declare capabilities; capabilities declare typed
 * attributes and commands with ordered argument types.
 */
public record Catalog(
    String version, Map<String, Device> devices, Map<String, Capability> capabilities) {

  public Catalog {
    version = version == null ? "" : version;
    devices = Collections.unmodifiableMap(new LinkedHashMap<>(devices));
    capabilities = Collections.unmodifiableMap(new LinkedHashMap<>(capabilities));
  }

  public record Device(String id, List<String> capabilities) {
    public Device {
      Names.requireIdentifier(id, "Device id");
      capabilities = List.copyOf(capabilities);
    }
  }

  public record Capability(
      String name, Map<String, AttributeSpec> attributes, Map<String, List<ValueType>> commands) {
    public Capability {
      Names.requireNonBlank(name, "Capability name");
      attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
      commands = Collections.unmodifiableMap(new LinkedHashMap<>(commands));
    }
  }

  /** Attribute type; {@code values} lists the members when the type is an enum. */
  public record AttributeSpec(ValueType type, List<String> values) {
    public AttributeSpec {
      values = values == null ? List.of() : List.copyOf(values);
    }

    public boolean isNumeric() {
      return type == ValueType.INTEGER || type == ValueType.NUMBER;
    }
  }

  public enum ValueType {
    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    ENUM("enum");

    private final String jsonName;

    ValueType(String jsonName) {
      this.jsonName = jsonName;
    }

    public String jsonName() {
      return jsonName;
    }

    public static ValueType fromJsonName(String name) {
      for (ValueType t : values()) {
        if (t.jsonName.equalsIgnoreCase(name)) return t;
      }
      throw new IllegalArgumentException("Unknown value type '" + name + "'");
    }

    /** Type compatibility only; enum membership is checked against the attribute's values. */
    public boolean accepts(Literal literal) {
      return switch (this) {
        case STRING, ENUM -> literal instanceof Literal.Text;
        case INTEGER -> literal instanceof Literal.Int;
        case NUMBER -> literal instanceof Literal.Int || literal instanceof Literal.Decimal;
        case BOOLEAN -> literal instanceof Literal.Bool;
      };
    }
  }

  public Optional<Device> device(String id) {
    return Optional.ofNullable(devices.get(id));
  }

  public List<String> deviceIds() {
    return new ArrayList<>(new TreeSet<>(devices.keySet()));
  }

  /** Capabilities of the device that the catalog declares; unknown names are skipped. */
  public List<Capability> capabilitiesOf(Device device) {
    List<Capability> out = new ArrayList<>();
    for (String name : device.capabilities()) {
      Capability cap = capabilities.get(name);
      if (cap != null) out.add(cap);
    }
    return out;
  }

  public AttributeSpec attribute(Device device, String attribute) {
    for (Capability cap : capabilitiesOf(device)) {
      AttributeSpec spec = cap.attributes().get(attribute);
      if (spec != null) return spec;
    }
    return null;
  }

  public List<ValueType> command(Device device, String command) {
    for (Capability cap : capabilitiesOf(device)) {
      List<ValueType> args = cap.commands().get(command);
      if (args != null) return args;
    }
    return null;
  }

  public List<String> attributeNames(Device device) {
    TreeSet<String> names = new TreeSet<>();
    for (Capability cap : capabilitiesOf(device)) names.addAll(cap.attributes().keySet());
    return new ArrayList<>(names);
  }

  public List<String> commandNames(Device device) {
    TreeSet<String> names = new TreeSet<>();
    for (Capability cap : capabilitiesOf(device)) names.addAll(cap.commands().keySet());
    return new ArrayList<>(names);
  }

  public static Catalog load(String location) throws IOException {
    return fromJson(Json.load(location));
  }

  public static Catalog fromJson(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("Catalog must be a JSON object");
    }
    Map<String, Device> devices = new LinkedHashMap<>();
    JsonNode devicesNode = root.path("devices");
    for (Iterator<Map.Entry<String, JsonNode>> it = devicesNode.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> e = it.next();
      List<String> caps = new ArrayList<>();
      for (JsonNode c : e.getValue().path("capabilities")) caps.add(c.asText());
      devices.put(e.getKey(), new Device(e.getKey(), caps));
    }

    Map<String, Capability> capabilities = new LinkedHashMap<>();
    JsonNode capsNode = root.path("capabilities");
    for (Iterator<Map.Entry<String, JsonNode>> it = capsNode.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> e = it.next();
      capabilities.put(e.getKey(), readCapability(e.getKey(), e.getValue()));
    }
    return new Catalog(root.path("version").asText(""), devices, capabilities);
  }

  private static Capability readCapability(String name, JsonNode node) {
    Map<String, AttributeSpec> attributes = new LinkedHashMap<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = node.path("attributes").fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> a = it.next();
      JsonNode spec = a.getValue();
      String typeName = spec.isTextual() ? spec.asText() : spec.path("type").asText("string");
      List<String> values = new ArrayList<>();
      for (JsonNode v : spec.path("values")) values.add(v.asText());
      attributes.put(a.getKey(), new AttributeSpec(ValueType.fromJsonName(typeName), values));
    }
    Map<String, List<ValueType>> commands = new LinkedHashMap<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = node.path("commands").fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> c = it.next();
      List<ValueType> args = new ArrayList<>();
      for (JsonNode t : c.getValue()) args.add(ValueType.fromJsonName(t.asText()));
      commands.put(c.getKey(), List.copyOf(args));
    }
    return new Capability(name, attributes, commands);
  }
}

package nlfsm;

/** Reference to a device attribute, written {@code device.attribute} in the diagram. */
public record AttributeRef(String device, String attribute) {

  public AttributeRef {
    Names.requireIdentifier(device, "Device reference");
    Names.requirePath(attribute, "Attribute reference");
  }

  /** Splits {@code device.attr[.sub]} at the first dot. */
  public static AttributeRef parse(String chain) {
    int dot = chain == null ? -1 : chain.indexOf('.');
    if (dot <= 0 || dot == chain.length() - 1) {
      throw new IllegalArgumentException("Expected <device>.<attribute> but found '" + chain + "'");
    }
    return new AttributeRef(chain.substring(0, dot), chain.substring(dot + 1));
  }

  public String text() {
    return device + "." + attribute;
  }
}

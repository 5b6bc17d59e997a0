package nlfsm;

import java.util.regex.Pattern;

/** Identifier rules shared by the IR, the diagram grammar and the validators. */
public final class Names {

  static final String IDENT_SRC = "[A-Za-z_][A-Za-z0-9_]*";
  static final String PATH_SRC = IDENT_SRC + "(?:\\." + IDENT_SRC + ")*";

  private static final Pattern IDENT = Pattern.compile(IDENT_SRC);
  private static final Pattern PATH = Pattern.compile(PATH_SRC);

  private Names() {}

  public static boolean isIdentifier(String value) {
    return value != null && IDENT.matcher(value).matches();
  }

  public static boolean isPath(String value) {
    return value != null && PATH.matcher(value).matches();
  }

  public static String requireIdentifier(String value, String description) {
    if (!isIdentifier(value)) {
      throw new IllegalArgumentException(
          description + " contains an invalid identifier: '" + value + "'");
    }
    return value;
  }

  public static String requirePath(String value, String description) {
    if (!isPath(value)) {
      throw new IllegalArgumentException(
          description + " contains an invalid attribute path: '" + value + "'");
    }
    return value;
  }

  public static String requireNonBlank(String value, String description) {
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalArgumentException(description + " must not be blank");
    }
    return value;
  }

  /** Turns free text into an identifier, e.g. a quoted label used as a transition endpoint. */
  public static String sanitize(String text) {
    String out = text == null ? "" : text.trim().replaceAll("[^A-Za-z0-9_]", "_");
    if (out.isEmpty()) return "State";
    if (Character.isDigit(out.charAt(0))) out = "S_" + out;
    return out;
  }
}

package nlfsm;

import java.util.List;
import java.util.Objects;

/**
 * A single finding. Locations are JSON-path style for IR ({@code $.transitions[2].actions[0]})
 * and line anchors for diagram text ({@code L12}).
 */
public record Diagnostic(
    Severity severity,
    Kind kind,
    String code,
    String location,
    String message,
    List<String> suggestions) {

  public enum Severity {
    ERROR,
    WARNING
  }

  public enum Kind {
    /** Shape violation; blocks the domain pass. */
    STRUCTURAL,
    /** Catalog mismatch. */
    DOMAIN,
    /** Diagram syntax problem anchored at a source line. */
    PARSE,
    /** Alias rename or collision; an edit carrying one is never accepted. */
    IDENTITY
  }

  public Diagnostic {
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(code, "code");
    location = location == null ? "$" : location;
    message = message == null ? "" : message;
    suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
  }

  public static Diagnostic error(Kind kind, String code, String location, String message) {
    return new Diagnostic(Severity.ERROR, kind, code, location, message, List.of());
  }

  public static Diagnostic warning(Kind kind, String code, String location, String message) {
    return new Diagnostic(Severity.WARNING, kind, code, location, message, List.of());
  }

  public static String line(int lineNo) {
    return "L" + lineNo;
  }

  public Diagnostic withSuggestions(List<String> values) {
    return new Diagnostic(severity, kind, code, location, message, values);
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    return severity + " " + code + " " + location + ": " + message;
  }
}

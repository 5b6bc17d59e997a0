package nlfsm;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Ordered diagnostics; passing iff there are no error-severity entries. */
public record ValidationReport(List<Diagnostic> diagnostics) {

  private static final ValidationReport EMPTY = new ValidationReport(List.of());

  public ValidationReport {
    Objects.requireNonNull(diagnostics, "diagnostics");
    diagnostics = List.copyOf(diagnostics);
  }

  public static ValidationReport empty() {
    return EMPTY;
  }

  public static ValidationReport of(List<Diagnostic> diagnostics) {
    return new ValidationReport(diagnostics);
  }

  public boolean ok() {
    return diagnostics.stream().noneMatch(Diagnostic::isError);
  }

  public List<Diagnostic> errors() {
    return diagnostics.stream().filter(Diagnostic::isError).toList();
  }

  public List<Diagnostic> warnings() {
    return diagnostics.stream().filter(d -> !d.isError()).toList();
  }

  public List<Diagnostic> ofKind(Diagnostic.Kind kind) {
    return diagnostics.stream().filter(d -> d.kind() == kind).toList();
  }

  public List<Diagnostic> withCode(String code) {
    return diagnostics.stream().filter(d -> d.code().equals(code)).toList();
  }

  public boolean hasErrorsOfKind(Diagnostic.Kind kind) {
    return diagnostics.stream().anyMatch(d -> d.isError() && d.kind() == kind);
  }

  public ValidationReport plus(ValidationReport other) {
    if (other == null || other.diagnostics.isEmpty()) return this;
    List<Diagnostic> all = new ArrayList<>(diagnostics);
    all.addAll(other.diagnostics);
    return new ValidationReport(all);
  }

  /** First lines of a CLI summary; at most {@code limit} errors are listed. */
  public List<String> summary(int limit) {
    List<String> lines = new ArrayList<>();
    List<Diagnostic> errors = errors();
    if (errors.isEmpty()) {
      lines.add("OK (" + warnings().size() + " warning(s))");
      return lines;
    }
    lines.add("Failed with " + errors.size() + " error(s).");
    for (int i = 0; i < Math.min(limit, errors.size()); i++) {
      Diagnostic d = errors.get(i);
      lines.add("  " + d.location() + ": " + d.code() + " " + d.message());
    }
    if (errors.size() > limit) {
      lines.add("  ... and " + (errors.size() - limit) + " more");
    }
    return lines;
  }
}

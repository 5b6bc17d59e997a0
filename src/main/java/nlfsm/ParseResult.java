package nlfsm;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parser outcome. {@code machine} is a best-effort reading even when errors were found, and is
 * null only when the text holds no state at all. {@code undeclared} lists aliases that were
 * referenced without a {@code state} line.
 */
public record ParseResult(StateMachine machine, List<Diagnostic> diagnostics, Set<String> undeclared) {

  public ParseResult {
    diagnostics = List.copyOf(diagnostics);
    undeclared = Set.copyOf(undeclared);
  }

  public ValidationReport report() {
    return ValidationReport.of(diagnostics);
  }

  public boolean ok() {
    return machine != null && report().ok();
  }

  ParseResult plus(List<Diagnostic> more) {
    if (more.isEmpty()) return this;
    List<Diagnostic> all = new ArrayList<>(diagnostics);
    all.addAll(more);
    return new ParseResult(machine, all, undeclared);
  }
}

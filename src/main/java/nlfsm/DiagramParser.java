package nlfsm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Line-oriented reader for the PlantUML subset written by {@link DiagramGenerator}. Parsing is
 * best effort: problems become diagnostics anchored at their line and reading continues.
 */
public class DiagramParser {

  private static final Logger log = LoggerFactory.getLogger(DiagramParser.class);

  static final String DEFAULT_NAME = "Automation";
  static final String ARROW = "-->";
  private static final String PSEUDO_STATE = "[*]";

  public ParseResult parse(String text) {
    return new Run(text).execute();
  }

  /** Parses and checks the result against the previous canonical IR for alias renames. */
  public ParseResult parse(String text, StateMachine baseline) {
    ParseResult result = parse(text);
    if (baseline == null || result.machine() == null) {
      return result;
    }
    return result.plus(new EditSafetyChecker().check(result.machine(), baseline, result.undeclared()));
  }

  private static final class Run {
    private final String[] lines;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Map<String, StateMachine.State> declared = new LinkedHashMap<>();
    private final Map<String, String> labelToAlias = new LinkedHashMap<>();
    private final Map<String, Integer> referenced = new LinkedHashMap<>();
    private final List<StateMachine.Transition> transitions = new ArrayList<>();
    private final Map<String, List<GuardExpr>> invariants = new LinkedHashMap<>();
    private final Map<String, Integer> noteLines = new LinkedHashMap<>();
    private String noteState;
    private int noteOpenedAt;
    private String name;
    private String catalogVersion = "";
    private String initial;

    Run(String text) {
      this.lines = (text == null ? "" : text).split("\\R", -1);
    }

    ParseResult execute() {
      boolean inNote = false;
      for (int i = 0; i < lines.length; i++) {
        String line = lines[i].strip();
        if (inNote) {
          inNote = !DiagramGrammar.isNoteEnd(line);
        } else if (DiagramGrammar.noteTarget(line) != null) {
          inNote = true;
        } else if (line.startsWith("state ") && !isTransition(line)) {
          declare(line, i + 1);
        }
      }
      for (int i = 0; i < lines.length; i++) {
        readLine(lines[i].strip(), i + 1);
      }
      if (noteState != null) {
        error("E430", noteOpenedAt, "Note for '" + noteState + "' is missing '" + DiagramGrammar.NOTE_CLOSE + "'");
      }
      return build();
    }

    /**
     * An arrow outside quotes with an endpoint on its left. Checked before the directive
     * keywords, so states may be called {@code title} or {@code state}.
     */
    private static boolean isTransition(String line) {
      int arrow = DiagramGrammar.indexOutsideQuotes(line, ARROW, 0);
      if (arrow < 0) return false;
      String left = line.substring(0, arrow).trim();
      return left.equals(PSEUDO_STATE) || Names.isIdentifier(left)
          || left.length() >= 2 && left.startsWith("\"") && DiagramGrammar.endOfQuoted(left, 0) == left.length() - 1;
    }

    private void declare(String line, int lineNo) {
      StateMachine.State state;
      try {
        state = DiagramGrammar.STATE.parse(line);
      } catch (GrammarException e) {
        error(e.code(), lineNo, e.describe());
        return;
      } catch (IllegalArgumentException e) {
        error("E490", lineNo, e.getMessage());
        return;
      }
      StateMachine.State previous = declared.get(state.alias());
      if (previous == null) {
        declared.put(state.alias(), state);
        labelToAlias.putIfAbsent(state.label(), state.alias());
      } else if (!previous.equals(state)) {
        diagnostics.add(Diagnostic.error(Diagnostic.Kind.IDENTITY, "E610", Diagnostic.line(lineNo),
            "Alias '" + state.alias() + "' is already declared as \"" + previous.label() + "\""
                + (previous.synthetic() ? " " + DiagramGrammar.TIMER_STEREOTYPE : "")));
      }
    }

    private void readLine(String line, int lineNo) {
      if (line.isEmpty()) return;
      if (line.startsWith(DiagramGenerator.CATALOG_VERSION_PREFIX)) {
        catalogVersion = line.substring(DiagramGenerator.CATALOG_VERSION_PREFIX.length()).trim();
        return;
      }
      if (line.startsWith("'") || line.startsWith("//")) return;
      if (noteState != null) {
        readNoteLine(line, lineNo);
        return;
      }
      if (line.startsWith("@startuml") || line.startsWith("@enduml")) return;
      if (isTransition(line)) {
        readTransition(line, lineNo);
        return;
      }
      String target = DiagramGrammar.noteTarget(line);
      if (target != null) {
        noteState = target;
        noteOpenedAt = lineNo;
        noteLines.putIfAbsent(target, lineNo);
        invariants.computeIfAbsent(target, k -> new ArrayList<>());
        return;
      }
      if (line.startsWith("skinparam ") || line.startsWith("hide ")) return;
      if (line.equals("title") || line.startsWith("title ")) {
        String value = line.substring("title".length()).trim();
        if (!value.isEmpty()) name = value;
        return;
      }
      if (line.startsWith("state ")) return;
      if (DiagramGrammar.indexOutsideQuotes(line, ARROW, 0) < 0) {
        error("E490", lineNo, "Unrecognized line: " + line);
        return;
      }
      readTransition(line, lineNo);
    }

    private void readNoteLine(String line, int lineNo) {
      if (DiagramGrammar.isNoteEnd(line)) {
        noteState = null;
        return;
      }
      if (!line.startsWith("-")) return;
      try {
        invariants.get(noteState).add(DiagramGrammar.parseInvariant(line));
      } catch (GrammarException e) {
        recover(e, lineNo);
      }
    }

    private void readTransition(String line, int lineNo) {
      int arrow = DiagramGrammar.indexOutsideQuotes(line, ARROW, 0);
      String left = line.substring(0, arrow).trim();
      String rest = line.substring(arrow + ARROW.length());
      int colon = DiagramGrammar.indexOutsideQuotes(rest, ":", 0);
      String right = (colon < 0 ? rest : rest.substring(0, colon)).trim();
      String label = colon < 0 ? null : rest.substring(colon + 1).trim();

      if (left.isEmpty() || right.isEmpty()) {
        error("E490", lineNo, "Transition needs two endpoints: " + line);
        return;
      }
      if (right.equals(PSEUDO_STATE)) {
        warning("W403", lineNo, "Final-state marker ignored: " + line);
        return;
      }
      if (left.equals(PSEUDO_STATE)) {
        String target = resolve(right, lineNo);
        if (initial != null) {
          error("E402", lineNo, "Second initial state '" + target + "'; keeping '" + initial + "'");
        } else {
          initial = target;
        }
        return;
      }
      String source = resolve(left, lineNo);
      String target = resolve(right, lineNo);
      transitions.add(readLabel(source, target, label, lineNo));
    }

    private StateMachine.Transition readLabel(String source, String target, String label, int lineNo) {
      List<Trigger.Condition> conditions = new ArrayList<>();
      GuardExpr guard = null;
      List<Action> actions = new ArrayList<>();
      if (label != null) {
        for (String part : DiagramGrammar.splitOutsideQuotes(label, DiagramGrammar.LABEL_BREAK)) {
          String p = part.trim();
          if (p.isEmpty()) continue;
          try {
            if (p.startsWith(DiagramGrammar.TRIGGER_PREFIX)) {
              Trigger t = DiagramGrammar.TRIGGER.parse(
                  p.substring(DiagramGrammar.TRIGGER_PREFIX.length()), e -> recover(e, lineNo));
              conditions.addAll(t.conditions());
            } else if (p.startsWith(DiagramGrammar.GUARD_PREFIX)) {
              GuardExpr g = DiagramGrammar.GUARD.parse(p.substring(DiagramGrammar.GUARD_PREFIX.length()));
              if (guard != null) {
                error("E422", lineNo, "Only one GUARD line per transition");
              } else {
                guard = g;
              }
            } else if (p.startsWith(DiagramGrammar.ACTION_PREFIX)) {
              actions.add(DiagramGrammar.ACTION.parse(
                  p.substring(DiagramGrammar.ACTION_PREFIX.length()), e -> recover(e, lineNo)));
            } else {
              warning("W410", lineNo, "Ignoring unknown label line: " + p);
            }
          } catch (GrammarException e) {
            recover(e, lineNo);
          } catch (IllegalArgumentException e) {
            error(codeFor(p), lineNo, e.getMessage());
          }
        }
      }
      Trigger trigger = conditions.isEmpty() ? null : new Trigger(conditions);
      return new StateMachine.Transition(source, target, trigger, guard, actions);
    }

    private String codeFor(String part) {
      if (part.startsWith(DiagramGrammar.TRIGGER_PREFIX)) return "E410";
      if (part.startsWith(DiagramGrammar.GUARD_PREFIX)) return "E420";
      return "E440";
    }

    private String resolve(String token, int lineNo) {
      String alias;
      if (token.length() >= 2 && token.startsWith("\"") && token.endsWith("\"")) {
        String label = DiagramGrammar.unquote(token);
        alias = labelToAlias.getOrDefault(label, Names.sanitize(label));
      } else if (Names.isIdentifier(token)) {
        alias = token;
      } else {
        alias = labelToAlias.getOrDefault(token, Names.sanitize(token));
      }
      referenced.putIfAbsent(alias, lineNo);
      return alias;
    }

    private ParseResult build() {
      List<StateMachine.State> states = new ArrayList<>(declared.values());
      Set<String> undeclared = new LinkedHashSet<>();
      for (Map.Entry<String, Integer> e : referenced.entrySet()) {
        if (declared.containsKey(e.getKey())) continue;
        undeclared.add(e.getKey());
        states.add(new StateMachine.State(e.getKey()));
        warning("W405", e.getValue(), "State '" + e.getKey() + "' is not declared; creating it");
      }
      for (int i = 0; i < states.size(); i++) {
        List<GuardExpr> list = invariants.remove(states.get(i).alias());
        if (list != null && !list.isEmpty()) {
          states.set(i, states.get(i).withInvariants(list));
        }
      }
      for (String alias : invariants.keySet()) {
        warning("W431", noteLines.get(alias), "Note for unknown state '" + alias + "' ignored");
      }
      if (name == null) {
        warning("W404", 1, "Missing title; using '" + DEFAULT_NAME + "'");
        name = DEFAULT_NAME;
      }
      if (states.isEmpty()) {
        error("E401", 1, "Missing initial state line: [*] --> <State>");
        return new ParseResult(null, diagnostics, undeclared);
      }
      if (initial == null) {
        initial = states.get(0).alias();
        error("E401", 1, "Missing initial state line: [*] --> <State>; assuming '" + initial + "'");
      }
      StateMachine machine;
      try {
        machine = new StateMachine(name, states, transitions, initial, catalogVersion);
      } catch (IllegalArgumentException e) {
        error("E490", 1, e.getMessage());
        return new ParseResult(null, diagnostics, undeclared);
      }
      log.debug("Parsed diagram '{}': {} state(s), {} transition(s), {} diagnostic(s)",
          name, states.size(), transitions.size(), diagnostics.size());
      return new ParseResult(machine, diagnostics, undeclared);
    }

    private void recover(GrammarException e, int lineNo) {
      error(e.code(), lineNo, e.describe());
    }

    private void error(String code, int lineNo, String message) {
      diagnostics.add(Diagnostic.error(Diagnostic.Kind.PARSE, code, Diagnostic.line(lineNo), message));
    }

    private void warning(String code, int lineNo, String message) {
      diagnostics.add(Diagnostic.warning(Diagnostic.Kind.PARSE, code, Diagnostic.line(lineNo), message));
    }
  }
}

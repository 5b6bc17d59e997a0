package nlfsm;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text forms of the transition-label fragments. Generator and parser share these codecs, so a
 * fragment always reads back as the value it was written from.
 */
public final class DiagramGrammar {

  public static final String TRIGGER_PREFIX = "TRIGGER:";
  public static final String GUARD_PREFIX = "GUARD:";
  public static final String ACTION_PREFIX = "ACTION:";
  public static final String TRIGGER_SEPARATOR = " AND ";
  /** Two-character sequence PlantUML renders as a line break inside a label. */
  public static final String LABEL_BREAK = "\\n";
  public static final String TIMER_STEREOTYPE = "<<timer>>";
  public static final String NOTE_OPEN = "note right of ";
  public static final String NOTE_CLOSE = "end note";
  public static final String INVARIANT_PREFIX = "- ";

  private static final Pattern INTEGER = Pattern.compile("-?\\d+");
  private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+");
  private static final Pattern DURATION =
      Pattern.compile("(\\d+)\\s*([smh])", Pattern.CASE_INSENSITIVE);
  private static final Pattern CHAIN = Pattern.compile(Names.IDENT_SRC + "(?:\\." + Names.IDENT_SRC + ")+");
  private static final Pattern CHANGES = Pattern.compile("(" + CHAIN.pattern() + ")\\s+changes");
  private static final Pattern BECOMES = Pattern.compile("(" + CHAIN.pattern() + ")\\s+becomes\\s+(.+)");
  private static final Pattern AFTER = Pattern.compile("after\\s+(.+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern SCHEDULE = Pattern.compile("schedule\\s+(.+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern DELAY = Pattern.compile("delay\\s+(.+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern NOTIFY = Pattern.compile("notify\\s+(.+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern CALL =
      Pattern.compile("(" + Names.IDENT_SRC + ")\\.(" + Names.IDENT_SRC + ")\\s*\\((.*)\\)");
  private static final Pattern BARE_CALL =
      Pattern.compile("(" + Names.IDENT_SRC + ")\\.(" + Names.IDENT_SRC + ")");
  private static final Pattern STATE_TAIL = Pattern.compile(
      "\\s+as\\s+(" + Names.IDENT_SRC + ")(\\s+" + TIMER_STEREOTYPE + ")?\\s*");
  private static final Pattern NOTE = Pattern.compile(
      "note\\s+right\\s+of\\s+(" + Names.IDENT_SRC + ")", Pattern.CASE_INSENSITIVE);
  private static final Pattern STATE_BARE = Pattern.compile(
      "(" + Names.IDENT_SRC + ")(\\s+" + TIMER_STEREOTYPE + ")?\\s*");

  private DiagramGrammar() {}

  /** Formatter and parser for one kind of fragment. */
  public interface Codec<T> {
    String format(T value);

    /**
     * Parses a fragment. Problems that still leave a usable value are handed to {@code
     * recoverable}; anything else is thrown.
     */
    T parse(String text, Consumer<GrammarException> recoverable);

    default T parse(String text) {
      return parse(text, e -> {
        throw e;
      });
    }

    static <T> Codec<T> of(
        Function<T, String> formatter, BiFunction<String, Consumer<GrammarException>, T> parser) {
      return new Codec<>() {
        @Override
        public String format(T value) {
          return formatter.apply(value);
        }

        @Override
        public T parse(String text, Consumer<GrammarException> recoverable) {
          return parser.apply(text, recoverable);
        }
      };
    }
  }

  public static final Codec<Literal> LITERAL =
      Codec.of(DiagramGrammar::formatLiteral, (text, r) -> parseLiteral(text));

  public static final Codec<Trigger.Condition> CONDITION =
      Codec.of(DiagramGrammar::formatCondition, (text, r) -> parseCondition(text));

  public static final Codec<Trigger> TRIGGER = Codec.of(
      t -> {
        List<String> parts = new ArrayList<>();
        for (Trigger.Condition c : t.conditions()) parts.add(CONDITION.format(c));
        return String.join(TRIGGER_SEPARATOR, parts);
      },
      (text, recoverable) -> {
        List<Trigger.Condition> conditions = new ArrayList<>();
        List<GrammarException> failures = new ArrayList<>();
        for (String chunk : splitOutsideQuotes(text, TRIGGER_SEPARATOR)) {
          if (chunk.isBlank()) continue;
          try {
            conditions.add(CONDITION.parse(chunk.trim()));
          } catch (GrammarException e) {
            failures.add(e);
          }
        }
        if (conditions.isEmpty()) {
          if (failures.isEmpty()) {
            throw new GrammarException("E410", "No trigger condition in '" + text.trim() + "'");
          }
          failures.subList(1, failures.size()).forEach(recoverable);
          throw failures.get(0);
        }
        failures.forEach(recoverable);
        return new Trigger(conditions);
      });

  public static final Codec<GuardExpr> GUARD = Codec.of(
      DiagramGrammar::formatGuard,
      (text, r) -> {
        try {
          return GuardExpressionParser.parse(text);
        } catch (GrammarException e) {
          throw e;
        } catch (IllegalArgumentException e) {
          throw new GrammarException("E420", e.getMessage());
        }
      });

  public static final Codec<Action> ACTION =
      Codec.of(DiagramGrammar::formatAction, DiagramGrammar::parseAction);

  public static final Codec<StateMachine.State> STATE =
      Codec.of(DiagramGrammar::formatState, (text, r) -> parseState(text));

  // ---------------------------------------------------------------- literals

  private static String formatLiteral(Literal lit) {
    if (lit instanceof Literal.Text t) return quote(t.value());
    if (lit instanceof Literal.Int i) return Long.toString(i.value());
    if (lit instanceof Literal.Decimal d) return d.value().toPlainString();
    return Boolean.toString(((Literal.Bool) lit).value());
  }

  private static Literal parseLiteral(String text) {
    String t = text.trim();
    if (t.equalsIgnoreCase("true") || t.equalsIgnoreCase("false")) {
      return Literal.bool(t.equalsIgnoreCase("true"));
    }
    if (INTEGER.matcher(t).matches()) {
      try {
        return Literal.integer(Long.parseLong(t));
      } catch (NumberFormatException e) {
        throw new GrammarException("E441", "Integer out of range: " + t);
      }
    }
    if (DECIMAL.matcher(t).matches()) {
      return new Literal.Decimal(new BigDecimal(t));
    }
    if (t.length() >= 2 && t.charAt(0) == '"' && endOfQuoted(t, 0) == t.length() - 1) {
      return Literal.text(unquote(t));
    }
    throw new GrammarException("E441", "Not a literal: " + t);
  }

  // ---------------------------------------------------------------- triggers

  private static String formatCondition(Trigger.Condition c) {
    if (c instanceof Trigger.Becomes b) {
      return b.ref().text() + " becomes " + formatLiteral(b.value());
    }
    if (c instanceof Trigger.Changes ch) {
      return ch.ref().text() + " changes";
    }
    if (c instanceof Trigger.After a) {
      return "after " + formatDuration(a.seconds());
    }
    return "schedule " + ((Trigger.Schedule) c).expression();
  }

  private static Trigger.Condition parseCondition(String text) {
    String t = text.trim();
    Matcher m = SCHEDULE.matcher(t);
    if (m.matches()) {
      return new Trigger.Schedule(m.group(1));
    }
    m = AFTER.matcher(t);
    if (m.matches()) {
      return new Trigger.After(parseDuration(m.group(1), "E410"));
    }
    m = CHANGES.matcher(t);
    if (m.matches()) {
      return new Trigger.Changes(AttributeRef.parse(m.group(1)));
    }
    m = BECOMES.matcher(t);
    if (m.matches()) {
      Literal value;
      try {
        value = parseLiteral(m.group(2));
      } catch (GrammarException e) {
        throw new GrammarException("E410", "Bad value in trigger '" + t + "': " + e.getMessage());
      }
      return new Trigger.Becomes(AttributeRef.parse(m.group(1)), value);
    }
    throw new GrammarException("E410", "Could not parse trigger: " + t);
  }

  // ---------------------------------------------------------------- guards

  private static String formatGuard(GuardExpr e) {
    if (e instanceof GuardExpr.Compare c) {
      return formatGuard(c.left()) + " " + c.op().symbol() + " " + formatGuard(c.right());
    }
    if (e instanceof GuardExpr.And a) return joinGuards(a.operands(), " and ");
    if (e instanceof GuardExpr.Or o) return joinGuards(o.operands(), " or ");
    if (e instanceof GuardExpr.Not n) return "not " + formatGuard(n.operand());
    if (e instanceof GuardExpr.Group g) return "(" + formatGuard(g.inner()) + ")";
    if (e instanceof GuardExpr.Ref r) return r.ref().text();
    return formatLiteral(((GuardExpr.Lit) e).value());
  }

  private static String joinGuards(List<GuardExpr> operands, String separator) {
    List<String> parts = new ArrayList<>();
    for (GuardExpr op : operands) parts.add(formatGuard(op));
    return String.join(separator, parts);
  }

  // ---------------------------------------------------------------- actions

  private static String formatAction(Action a) {
    if (a instanceof Action.Command c) {
      List<String> args = new ArrayList<>();
      for (Literal lit : c.args()) args.add(formatLiteral(lit));
      return c.device() + "." + c.command() + "(" + String.join(", ", args) + ")";
    }
    if (a instanceof Action.Delay d) {
      return "delay " + formatDuration(d.seconds());
    }
    return "notify " + quote(((Action.Notify) a).message());
  }

  private static Action parseAction(String text, Consumer<GrammarException> recoverable) {
    String t = text.trim();
    Matcher m = DELAY.matcher(t);
    if (m.matches()) {
      return new Action.Delay(parseDuration(m.group(1), "E440"));
    }
    m = NOTIFY.matcher(t);
    if (m.matches()) {
      String rest = m.group(1).trim();
      if (rest.startsWith("\"") && endOfQuoted(rest, 0) == rest.length() - 1) {
        return new Action.Notify(unquote(rest));
      }
      return new Action.Notify(rest);
    }
    m = CALL.matcher(t);
    if (m.matches()) {
      List<Literal> args = new ArrayList<>();
      String argText = m.group(3).trim();
      if (!argText.isEmpty()) {
        for (String raw : splitOutsideQuotes(argText, ",")) {
          try {
            args.add(parseLiteral(raw));
          } catch (GrammarException e) {
            recoverable.accept(new GrammarException("E441",
                "Bad argument '" + raw.trim() + "' to " + m.group(1) + "." + m.group(2)));
          }
        }
      }
      return new Action.Command(m.group(1), m.group(2), args);
    }
    m = BARE_CALL.matcher(t);
    if (m.matches()) {
      return new Action.Command(m.group(1), m.group(2));
    }
    throw new GrammarException("E440", "Could not parse action: " + t);
  }

  // ---------------------------------------------------------------- states

  private static String formatState(StateMachine.State s) {
    String line = "state " + quote(s.label()) + " as " + s.alias();
    return s.synthetic() ? line + " " + TIMER_STEREOTYPE : line;
  }

  /** Accepts {@code state "Label" as Alias [<<timer>>]} and {@code state Alias [<<timer>>]}. */
  private static StateMachine.State parseState(String text) {
    String t = text.trim();
    if (!t.startsWith("state ")) {
      throw new GrammarException("E490", "Not a state declaration: " + t);
    }
    String rest = t.substring("state ".length()).trim();
    if (rest.startsWith("\"")) {
      int end = endOfQuoted(rest, 0);
      if (end < 0) {
        throw new GrammarException("E490", "Unterminated state label: " + t);
      }
      Matcher m = STATE_TAIL.matcher(rest.substring(end + 1));
      if (!m.matches()) {
        throw new GrammarException("E490", "Expected 'as <Alias>' in: " + t);
      }
      return new StateMachine.State(m.group(1), unquote(rest.substring(0, end + 1)), m.group(2) != null);
    }
    Matcher m = STATE_BARE.matcher(rest);
    if (!m.matches()) {
      throw new GrammarException("E490", "Bad state declaration: " + t);
    }
    return new StateMachine.State(m.group(1), m.group(1), m.group(2) != null);
  }

  // ---------------------------------------------------------------- invariants

  /** The note listing a state's invariants, one line each; empty when there are none. */
  public static List<String> formatInvariantNote(StateMachine.State s) {
    List<String> lines = new ArrayList<>();
    if (s.invariants().isEmpty()) return lines;
    lines.add(NOTE_OPEN + s.alias());
    for (GuardExpr e : s.invariants()) {
      lines.add(INVARIANT_PREFIX + GUARD.format(e));
    }
    lines.add(NOTE_CLOSE);
    return lines;
  }

  /** Alias named by a {@code note right of <Alias>} line, or null for any other line. */
  static String noteTarget(String line) {
    Matcher m = NOTE.matcher(line.trim());
    return m.matches() ? m.group(1) : null;
  }

  static boolean isNoteEnd(String line) {
    return line.trim().replaceAll("\\s+", " ").equalsIgnoreCase(NOTE_CLOSE);
  }

  /** Reads one {@code - <guard>} line of an invariant note. */
  static GuardExpr parseInvariant(String line) {
    String t = line.trim();
    if (!t.startsWith("-")) {
      throw new GrammarException("E430", "Invariant lines start with '-': " + t);
    }
    try {
      return GUARD.parse(t.substring(1).trim());
    } catch (GrammarException e) {
      throw new GrammarException("E430", "Bad invariant: " + e.getMessage(), e.column());
    }
  }

  // ---------------------------------------------------------------- labels

  /** Transition label text, or the empty string when the transition carries nothing. */
  public static String formatLabel(StateMachine.Transition t) {
    List<String> lines = new ArrayList<>();
    if (t.trigger() != null) {
      lines.add(TRIGGER_PREFIX + " " + TRIGGER.format(t.trigger()));
    }
    if (t.guard() != null) {
      lines.add(GUARD_PREFIX + " " + GUARD.format(t.guard()));
    }
    for (Action a : t.actions()) {
      lines.add(ACTION_PREFIX + " " + ACTION.format(a));
    }
    return String.join(LABEL_BREAK, lines);
  }

  // ---------------------------------------------------------------- helpers

  public static String formatDuration(long seconds) {
    return seconds + "s";
  }

  static long parseDuration(String text, String code) {
    Matcher m = DURATION.matcher(text.trim());
    if (!m.matches()) {
      throw new GrammarException(code, "Bad duration '" + text.trim() + "'; expected e.g. 30s, 5m, 1h");
    }
    long n;
    try {
      n = Long.parseLong(m.group(1));
    } catch (NumberFormatException e) {
      throw new GrammarException(code, "Duration out of range: " + text.trim());
    }
    try {
      return switch (m.group(2).toLowerCase(Locale.ROOT)) {
        case "h" -> Math.multiplyExact(n, 3600L);
        case "m" -> Math.multiplyExact(n, 60L);
        default -> n;
      };
    } catch (ArithmeticException e) {
      throw new GrammarException(code, "Duration out of range: " + text.trim());
    }
  }

  public static String quote(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '"' -> sb.append("\\\"");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (breaksLine(c)) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.append('"').toString();
  }

  /** Control characters and the Unicode line and paragraph separators. */
  static boolean breaksLine(char c) {
    return Character.isISOControl(c) || c == '\u2028' || c == '\u2029';
  }

  /** Inverse of {@link #quote}; the argument includes the surrounding quotes. */
  public static String unquote(String quoted) {
    StringBuilder sb = new StringBuilder();
    for (int i = 1; i < quoted.length() - 1; i++) {
      char c = quoted.charAt(i);
      if (c == '\\' && i + 1 < quoted.length() - 1) {
        char n = quoted.charAt(++i);
        switch (n) {
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (i + 4 < quoted.length() - 1 && isHex(quoted, i + 1, i + 5)) {
              sb.append((char) Integer.parseInt(quoted.substring(i + 1, i + 5), 16));
              i += 4;
            } else {
              sb.append(n);
            }
          }
          default -> sb.append(n);
        }
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  private static boolean isHex(String s, int from, int to) {
    for (int i = from; i < to; i++) {
      if (Character.digit(s.charAt(i), 16) < 0) return false;
    }
    return true;
  }

  /** Index of the quote closing the string that opens at {@code start}, or -1. */
  static int endOfQuoted(String s, int start) {
    for (int i = start + 1; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\\') {
        i++;
      } else if (c == '"') {
        return i;
      }
    }
    return -1;
  }

  /** Splits on {@code separator} wherever it occurs outside a quoted string. */
  static List<String> splitOutsideQuotes(String text, String separator) {
    List<String> out = new ArrayList<>();
    int start = 0;
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '"') {
        int end = endOfQuoted(text, i);
        i = end < 0 ? text.length() : end + 1;
        continue;
      }
      if (text.startsWith(separator, i)) {
        out.add(text.substring(start, i));
        i += separator.length();
        start = i;
        continue;
      }
      i++;
    }
    out.add(text.substring(start));
    return out;
  }

  /** Index of {@code token} outside quoted strings at or after {@code from}, or -1. */
  static int indexOutsideQuotes(String text, String token, int from) {
    int i = from;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '"') {
        int end = endOfQuoted(text, i);
        if (end < 0) return -1;
        i = end + 1;
        continue;
      }
      if (text.startsWith(token, i)) return i;
      i++;
    }
    return -1;
  }
}

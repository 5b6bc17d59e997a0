package nlfsm;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DiagramGrammarTest {

  @Test
  void quoteEscapesAndUnquoteRestores() {
    String raw = "say \"hi\"\\ then\nleave\t.";
    String quoted = DiagramGrammar.quote(raw);

    assertEquals("\"say \\\"hi\\\"\\\\ then\\nleave\\t.\"", quoted);
    assertEquals(raw, DiagramGrammar.unquote(quoted));
    assertFalse(quoted.contains("\n"), "quoted text stays on one line");
  }

  @Test
  void lineBreakingCharactersAreEscaped() {
    String raw = "a\013b\fc\u0085d\u2028e\u2029f";
    String quoted = DiagramGrammar.quote(raw);

    assertEquals("\"a\\u000bb\\u000cc\\u0085d\\u2028e\\u2029f\"", quoted);
    assertEquals(1, quoted.split("\\R", -1).length, "quoted text stays on one line");
    assertEquals(raw, DiagramGrammar.unquote(quoted));
  }

  @Test
  void unicodeEscapeNeedsFourHexDigits() {
    assertEquals("u12x", DiagramGrammar.unquote("\"\\u12x\""));
    assertEquals("\u00e9", DiagramGrammar.unquote("\"\\u00e9\""));
  }

  @Test
  void literals() {
    assertEquals(Literal.integer(-3), DiagramGrammar.LITERAL.parse("-3"));
    assertEquals(Literal.decimal("1.50"), DiagramGrammar.LITERAL.parse("1.50"));
    assertEquals("1.50", DiagramGrammar.LITERAL.format(Literal.decimal("1.50")));
    assertEquals("2.0", DiagramGrammar.LITERAL.format(Literal.decimal("2")));
    assertEquals(Literal.bool(true), DiagramGrammar.LITERAL.parse("TRUE"));
    assertEquals(Literal.text("a,b"), DiagramGrammar.LITERAL.parse("\"a,b\""));

    GrammarException e = assertThrows(GrammarException.class, () -> DiagramGrammar.LITERAL.parse("bare"));
    assertEquals("E441", e.code());
  }

  @ParameterizedTest
  @CsvSource({"30s, 30", "2M, 120", "1 h, 3600", "0s, 0"})
  void durationsAreStoredInSeconds(String text, long seconds) {
    assertEquals(seconds, DiagramGrammar.parseDuration(text, "E410"));
  }

  @Test
  void badDurationUsesCallerCode() {
    assertEquals("90s", DiagramGrammar.formatDuration(90));
    GrammarException e = assertThrows(GrammarException.class, () -> DiagramGrammar.parseDuration("5d", "E440"));
    assertEquals("E440", e.code());
  }

  @Test
  void oversizedDurationIsASyntaxError() {
    GrammarException e = assertThrows(GrammarException.class,
        () -> DiagramGrammar.parseDuration("9999999999999999h", "E410"));
    assertEquals("E410", e.code());
    assertTrue(e.getMessage().contains("out of range"), e.getMessage());
  }

  @Test
  void splittingIgnoresSeparatorsInsideQuotes() {
    assertEquals(List.of("a", "\"x AND y\"", "b"),
        DiagramGrammar.splitOutsideQuotes("a AND \"x AND y\" AND b", " AND "));
    assertEquals(List.of("TRIGGER: x.y becomes \"a\\nb\"", "ACTION: z.w()"),
        DiagramGrammar.splitOutsideQuotes("TRIGGER: x.y becomes \"a\\nb\"\\nACTION: z.w()", DiagramGrammar.LABEL_BREAK));
    assertEquals(-1, DiagramGrammar.indexOutsideQuotes("\"a --> b\"", "-->", 0));
  }

  @Test
  void guardPrecedence() {
    GuardExpr a = GuardExpr.compare(Fixtures.ref("d.a"), GuardExpr.Operator.EQ, Literal.integer(1));
    GuardExpr b = GuardExpr.compare(Fixtures.ref("d.b"), GuardExpr.Operator.EQ, Literal.integer(2));
    GuardExpr c = GuardExpr.compare(Fixtures.ref("d.c"), GuardExpr.Operator.EQ, Literal.integer(3));

    assertEquals(GuardExpr.or(a, GuardExpr.and(b, GuardExpr.not(c))),
        DiagramGrammar.GUARD.parse("d.a == 1 or d.b == 2 and not d.c == 3"));
    assertEquals(GuardExpr.and(GuardExpr.group(GuardExpr.or(a, b)), c),
        DiagramGrammar.GUARD.parse("(d.a == 1 or d.b == 2) AND d.c == 3"));
  }

  @Test
  void guardErrorsCarryCodeAndColumn() {
    GrammarException chained = assertThrows(GrammarException.class,
        () -> DiagramGrammar.GUARD.parse("d.a < d.b < 3"));
    assertEquals("E420", chained.code());
    assertEquals(10, chained.column());

    GrammarException noDot = assertThrows(GrammarException.class,
        () -> DiagramGrammar.GUARD.parse("level > 3"));
    assertEquals("E420", noDot.code());

    GrammarException diamond = assertThrows(GrammarException.class,
        () -> DiagramGrammar.GUARD.parse("d.a <> 3"));
    assertEquals("E421", diamond.code());
    assertTrue(diamond.describe().endsWith("(col 5)"), diamond.describe());
  }

  @Test
  void stateDeclarations() {
    StateMachine.State timer = new StateMachine.State("A_wait", "A_wait", true);
    assertEquals("state \"A_wait\" as A_wait <<timer>>", DiagramGrammar.STATE.format(timer));
    assertEquals(timer, DiagramGrammar.STATE.parse(DiagramGrammar.STATE.format(timer)));
    assertEquals(new StateMachine.State("Plain"), DiagramGrammar.STATE.parse("state Plain"));

    GrammarException e = assertThrows(GrammarException.class,
        () -> DiagramGrammar.STATE.parse("state \"Label\" Alias"));
    assertEquals("E490", e.code());
  }

  @Test
  void commandsAlwaysRenderParentheses() {
    assertEquals("light.on()", DiagramGrammar.ACTION.format(new Action.Command("light", "on")));
    assertEquals(new Action.Command("light", "on"), DiagramGrammar.ACTION.parse("light.on"));
    assertEquals("notify \"a \\\"b\\\"\"", DiagramGrammar.ACTION.format(new Action.Notify("a \"b\"")));
  }
}

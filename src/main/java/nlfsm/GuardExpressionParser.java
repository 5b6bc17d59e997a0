package nlfsm;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for guard text.
 *
 * <pre>
 * or      := and ("or" and)*
 * and     := not ("and" not)*
 * not     := "not" not | compare
 * compare := primary (("==" | "!=" | "&lt;" | "&lt;=" | "&gt;" | "&gt;=") primary)?
 * primary := "(" or ")" | device.attribute | literal
 * </pre>
 *
 * Every parenthesised sub-expression becomes a {@link GuardExpr.Group}.
 */
final class GuardExpressionParser {

  private enum Kind { LPAREN, RPAREN, OP, KEYWORD, LITERAL, REF, EOF }

  private record Token(Kind kind, String text, int column) {}

  private final String source;
  private final List<Token> tokens;
  private int pos;

  private GuardExpressionParser(String source) {
    this.source = source;
    this.tokens = tokenize(source);
  }

  static GuardExpr parse(String text) {
    String trimmed = text == null ? "" : text.trim();
    if (trimmed.isEmpty()) {
      throw new GrammarException("E420", "Empty guard expression", 0);
    }
    GuardExpressionParser p = new GuardExpressionParser(trimmed);
    GuardExpr expr = p.parseOr();
    Token rest = p.peek();
    if (rest.kind() != Kind.EOF) {
      throw new GrammarException("E420", "Unexpected '" + rest.text() + "' in guard '"
          + p.source + "'", rest.column());
    }
    return expr;
  }

  private GuardExpr parseOr() {
    List<GuardExpr> operands = new ArrayList<>();
    operands.add(parseAnd());
    while (isKeyword("or")) {
      pos++;
      operands.add(parseAnd());
    }
    return operands.size() == 1 ? operands.get(0) : new GuardExpr.Or(operands);
  }

  private GuardExpr parseAnd() {
    List<GuardExpr> operands = new ArrayList<>();
    operands.add(parseNot());
    while (isKeyword("and")) {
      pos++;
      operands.add(parseNot());
    }
    return operands.size() == 1 ? operands.get(0) : new GuardExpr.And(operands);
  }

  private GuardExpr parseNot() {
    if (isKeyword("not")) {
      pos++;
      return new GuardExpr.Not(parseNot());
    }
    return parseCompare();
  }

  private GuardExpr parseCompare() {
    GuardExpr left = parsePrimary();
    Token t = peek();
    if (t.kind() != Kind.OP) {
      return left;
    }
    pos++;
    GuardExpr right = parsePrimary();
    if (peek().kind() == Kind.OP) {
      throw new GrammarException("E420", "Chained comparison; add parentheses", peek().column());
    }
    return new GuardExpr.Compare(GuardExpr.Operator.fromSymbol(t.text()), left, right);
  }

  private GuardExpr parsePrimary() {
    Token t = next();
    switch (t.kind()) {
      case LPAREN -> {
        GuardExpr inner = parseOr();
        Token close = next();
        if (close.kind() != Kind.RPAREN) {
          throw new GrammarException("E420", "Missing ')'", close.column());
        }
        return new GuardExpr.Group(inner);
      }
      case REF -> {
        if (t.text().indexOf('.') < 0) {
          throw new GrammarException("E420",
              "Expected <device>.<attribute> but found '" + t.text() + "'", t.column());
        }
        return new GuardExpr.Ref(AttributeRef.parse(t.text()));
      }
      case LITERAL -> {
        return new GuardExpr.Lit(DiagramGrammar.LITERAL.parse(t.text()));
      }
      case EOF -> throw new GrammarException("E420", "Unexpected end of guard", t.column());
      default -> throw new GrammarException("E420", "Unexpected '" + t.text() + "'", t.column());
    }
  }

  private boolean isKeyword(String word) {
    Token t = peek();
    return t.kind() == Kind.KEYWORD && t.text().equals(word);
  }

  private Token peek() {
    return tokens.get(pos);
  }

  private Token next() {
    Token t = tokens.get(pos);
    if (t.kind() != Kind.EOF) pos++;
    return t;
  }

  private static List<Token> tokenize(String s) {
    List<Token> out = new ArrayList<>();
    int i = 0;
    while (i < s.length()) {
      char c = s.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
        continue;
      }
      if (c == '(') {
        out.add(new Token(Kind.LPAREN, "(", i++));
        continue;
      }
      if (c == ')') {
        out.add(new Token(Kind.RPAREN, ")", i++));
        continue;
      }
      String two = i + 1 < s.length() ? s.substring(i, i + 2) : "";
      if (two.equals("<>") || two.equals("&&") || two.equals("||")) {
        throw unsupported(two, i);
      }
      if (two.equals("==") || two.equals("!=") || two.equals("<=") || two.equals(">=")) {
        out.add(new Token(Kind.OP, two, i));
        i += 2;
        continue;
      }
      if (c == '<' || c == '>') {
        out.add(new Token(Kind.OP, String.valueOf(c), i++));
        continue;
      }
      if (c == '=' || c == '!' || c == '&' || c == '|') {
        throw unsupported(String.valueOf(c), i);
      }
      if (c == '"') {
        int end = DiagramGrammar.endOfQuoted(s, i);
        if (end < 0) {
          throw new GrammarException("E420", "Unterminated string", i);
        }
        out.add(new Token(Kind.LITERAL, s.substring(i, end + 1), i));
        i = end + 1;
        continue;
      }
      if (Character.isDigit(c) || (c == '-' && i + 1 < s.length() && Character.isDigit(s.charAt(i + 1)))) {
        int j = i + 1;
        while (j < s.length() && Character.isDigit(s.charAt(j))) j++;
        if (j + 1 < s.length() && s.charAt(j) == '.' && Character.isDigit(s.charAt(j + 1))) {
          j++;
          while (j < s.length() && Character.isDigit(s.charAt(j))) j++;
        }
        out.add(new Token(Kind.LITERAL, s.substring(i, j), i));
        i = j;
        continue;
      }
      if (Character.isLetter(c) || c == '_') {
        int j = i + 1;
        while (j < s.length()) {
          char d = s.charAt(j);
          if (Character.isLetterOrDigit(d) || d == '_') {
            j++;
          } else if (d == '.' && j + 1 < s.length()
              && (Character.isLetter(s.charAt(j + 1)) || s.charAt(j + 1) == '_')) {
            j++;
          } else {
            break;
          }
        }
        String word = s.substring(i, j);
        String lower = word.toLowerCase();
        if (lower.equals("and") || lower.equals("or") || lower.equals("not")) {
          out.add(new Token(Kind.KEYWORD, lower, i));
        } else if (lower.equals("true") || lower.equals("false")) {
          out.add(new Token(Kind.LITERAL, lower, i));
        } else {
          out.add(new Token(Kind.REF, word, i));
        }
        i = j;
        continue;
      }
      throw new GrammarException("E420", "Unexpected character '" + c + "'", i);
    }
    out.add(new Token(Kind.EOF, "", s.length()));
    return out;
  }

  private static GrammarException unsupported(String op, int column) {
    String hint = switch (op) {
      case "=" -> "use '=='";
      case "<>" -> "use '!='";
      case "&&", "&" -> "use 'and'";
      case "||", "|" -> "use 'or'";
      default -> "use 'not'";
    };
    return new GrammarException("E421", "Unsupported operator '" + op + "'; " + hint, column);
  }
}

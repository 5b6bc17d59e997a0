package nlfsm;

import java.util.List;
import java.util.Objects;

/**
 * Boolean guard expression tree. Parentheses written by the author are kept as {@link Group}
 * nodes so the diagram shows the same grouping after a round-trip.
 */
public sealed interface GuardExpr
    permits GuardExpr.Compare, GuardExpr.And, GuardExpr.Or, GuardExpr.Not, GuardExpr.Group,
        GuardExpr.Ref, GuardExpr.Lit {

  List<GuardExpr> children();

  enum Operator {
    EQ("==", "eq"),
    NEQ("!=", "neq"),
    LT("<", "lt"),
    LTE("<=", "lte"),
    GT(">", "gt"),
    GTE(">=", "gte");

    private final String symbol;
    private final String jsonName;

    Operator(String symbol, String jsonName) {
      this.symbol = symbol;
      this.jsonName = jsonName;
    }

    public String symbol() {
      return symbol;
    }

    public String jsonName() {
      return jsonName;
    }

    public boolean isOrdering() {
      return this != EQ && this != NEQ;
    }

    public static Operator fromSymbol(String symbol) {
      for (Operator op : values()) {
        if (op.symbol.equals(symbol)) return op;
      }
      return null;
    }

    public static Operator fromJsonName(String name) {
      for (Operator op : values()) {
        if (op.jsonName.equals(name)) return op;
      }
      return null;
    }
  }

  record Compare(Operator op, GuardExpr left, GuardExpr right) implements GuardExpr {
    public Compare {
      Objects.requireNonNull(op, "op");
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public List<GuardExpr> children() {
      return List.of(left, right);
    }
  }

  record And(List<GuardExpr> operands) implements GuardExpr {
    public And {
      operands = requireOperands(operands, "and");
    }

    @Override
    public List<GuardExpr> children() {
      return operands;
    }
  }

  record Or(List<GuardExpr> operands) implements GuardExpr {
    public Or {
      operands = requireOperands(operands, "or");
    }

    @Override
    public List<GuardExpr> children() {
      return operands;
    }
  }

  record Not(GuardExpr operand) implements GuardExpr {
    public Not {
      Objects.requireNonNull(operand, "operand");
    }

    @Override
    public List<GuardExpr> children() {
      return List.of(operand);
    }
  }

  /** Explicit parentheses. */
  record Group(GuardExpr inner) implements GuardExpr {
    public Group {
      Objects.requireNonNull(inner, "inner");
    }

    @Override
    public List<GuardExpr> children() {
      return List.of(inner);
    }
  }

  record Ref(AttributeRef ref) implements GuardExpr {
    public Ref {
      Objects.requireNonNull(ref, "ref");
    }

    @Override
    public List<GuardExpr> children() {
      return List.of();
    }
  }

  record Lit(Literal value) implements GuardExpr {
    public Lit {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public List<GuardExpr> children() {
      return List.of();
    }
  }

  static GuardExpr compare(AttributeRef ref, Operator op, Literal value) {
    return new Compare(op, new Ref(ref), new Lit(value));
  }

  static GuardExpr and(GuardExpr... operands) {
    return new And(List.of(operands));
  }

  static GuardExpr or(GuardExpr... operands) {
    return new Or(List.of(operands));
  }

  static GuardExpr not(GuardExpr operand) {
    return new Not(operand);
  }

  static GuardExpr group(GuardExpr inner) {
    return new Group(inner);
  }

  /** Strips enclosing groups. */
  static GuardExpr unwrap(GuardExpr expr) {
    GuardExpr cur = expr;
    while (cur instanceof Group g) cur = g.inner();
    return cur;
  }

  private static List<GuardExpr> requireOperands(List<GuardExpr> operands, String op) {
    Objects.requireNonNull(operands, "operands");
    if (operands.size() < 2) {
      throw new IllegalArgumentException("'" + op + "' must have 2+ operands");
    }
    return List.copyOf(operands);
  }
}

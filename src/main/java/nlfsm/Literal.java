package nlfsm;

import java.math.BigDecimal;
import java.util.Objects;

/** Literal values appearing in triggers, guards and command arguments. */
public sealed interface Literal permits Literal.Text, Literal.Int, Literal.Decimal, Literal.Bool {

  /** Catalog type name of the literal: string, integer, number or boolean. */
  String typeName();

  static Literal text(String value) {
    return new Text(value);
  }

  static Literal integer(long value) {
    return new Int(value);
  }

  static Literal decimal(String value) {
    return new Decimal(new BigDecimal(value));
  }

  static Literal bool(boolean value) {
    return new Bool(value);
  }

  record Text(String value) implements Literal {
    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String typeName() {
      return "string";
    }
  }

  record Int(long value) implements Literal {
    @Override
    public String typeName() {
      return "integer";
    }
  }

  /** Keeps the written scale, so {@code 1.50} stays {@code 1.50}; always has a fractional part. */
  record Decimal(BigDecimal value) implements Literal {
    public Decimal {
      Objects.requireNonNull(value, "value");
      if (value.scale() <= 0) {
        value = value.setScale(1);
      }
    }

    @Override
    public String typeName() {
      return "number";
    }
  }

  record Bool(boolean value) implements Literal {
    @Override
    public String typeName() {
      return "boolean";
    }
  }
}

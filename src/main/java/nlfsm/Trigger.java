package nlfsm;

import java.util.List;
import java.util.Objects;

/** Conjunction of trigger conditions; there is no OR at this level. */
public record Trigger(List<Condition> conditions) {

  public Trigger {
    Objects.requireNonNull(conditions, "conditions");
    if (conditions.isEmpty()) {
      throw new IllegalArgumentException("Trigger must contain at least one condition");
    }
    conditions = List.copyOf(conditions);
  }

  public static Trigger of(Condition... conditions) {
    return new Trigger(List.of(conditions));
  }

  public static Trigger after(long seconds) {
    return of(new After(seconds));
  }

  public sealed interface Condition permits Becomes, Changes, After, Schedule {
    /** Kind name used in JSON and in the shape schema's allowed trigger list. */
    String kind();
  }

  /** Attribute takes the given value. */
  public record Becomes(AttributeRef ref, Literal value) implements Condition {
    public Becomes {
      Objects.requireNonNull(ref, "ref");
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String kind() {
      return "becomes";
    }
  }

  /** Attribute changes to any value. */
  public record Changes(AttributeRef ref) implements Condition {
    public Changes {
      Objects.requireNonNull(ref, "ref");
    }

    @Override
    public String kind() {
      return "changes";
    }
  }

  /** Fires after the source state has been active for the given number of seconds. */
  public record After(long seconds) implements Condition {
    public After {
      if (seconds < 0) {
        throw new IllegalArgumentException("after duration must not be negative: " + seconds);
      }
    }

    @Override
    public String kind() {
      return "after";
    }
  }

  /** Schedule expression, typically cron text. */
  public record Schedule(String expression) implements Condition {
    public Schedule {
      Names.requireNonBlank(expression, "Schedule expression");
      expression = expression.trim();
    }

    @Override
    public String kind() {
      return "schedule";
    }
  }
}

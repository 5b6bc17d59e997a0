package nlfsm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical IR of a device-driven automation. States form an arena keyed by alias; transitions
 * refer to states by alias only.
 */
public record StateMachine(
    String name,
    List<State> states,
    List<Transition> transitions,
    String initial,
    String catalogVersion) {

  public StateMachine {
    Names.requireNonBlank(name, "State machine name");
    name = name.trim();
    Objects.requireNonNull(states, "states");
    Objects.requireNonNull(transitions, "transitions");
    states = List.copyOf(states);
    transitions = List.copyOf(transitions);
    catalogVersion = catalogVersion == null ? "" : catalogVersion.trim();

    Set<String> aliases = new LinkedHashSet<>();
    for (State s : states) {
      if (!aliases.add(s.alias())) {
        throw new IllegalArgumentException("Duplicate state alias '" + s.alias() + "'");
      }
    }
    if (initial == null || !aliases.contains(initial)) {
      throw new IllegalArgumentException("Initial state '" + initial + "' not found in states");
    }
    for (Transition t : transitions) {
      if (!aliases.contains(t.source())) {
        throw new IllegalArgumentException("Transition source '" + t.source() + "' is not a state");
      }
      if (!aliases.contains(t.target())) {
        throw new IllegalArgumentException("Transition target '" + t.target() + "' is not a state");
      }
    }
  }

  /**
   * A state; the alias is its identity, the label is free text for humans. Invariants are
   * conditions expected to hold while the state is active.
   */
  public record State(String alias, String label, boolean synthetic, List<GuardExpr> invariants) {
    public State {
      Names.requireIdentifier(alias, "State alias");
      label = (label == null || label.isBlank()) ? alias : label;
      invariants = invariants == null ? List.of() : List.copyOf(invariants);
    }

    public State(String alias, String label, boolean synthetic) {
      this(alias, label, synthetic, List.of());
    }

    public State(String alias) {
      this(alias, alias, false);
    }

    public State withLabel(String newLabel) {
      return new State(alias, newLabel, synthetic, invariants);
    }

    public State withAlias(String newAlias) {
      return new State(newAlias, label.equals(alias) ? newAlias : label, synthetic, invariants);
    }

    public State withInvariants(List<GuardExpr> newInvariants) {
      return new State(alias, label, synthetic, newInvariants);
    }
  }

  /** Trigger and guard are optional (null); actions run in order. */
  public record Transition(
      String source, String target, Trigger trigger, GuardExpr guard, List<Action> actions) {
    public Transition {
      Names.requireIdentifier(source, "Transition source");
      Names.requireIdentifier(target, "Transition target");
      actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public Transition(String source, String target, Trigger trigger, List<Action> actions) {
      this(source, target, trigger, null, actions);
    }

    public boolean isImmediate() {
      return trigger == null && guard == null;
    }

    public Transition withEndpoints(String newSource, String newTarget) {
      return new Transition(newSource, newTarget, trigger, guard, actions);
    }
  }

  /** The state with this alias; throws when there is none. */
  public State state(String alias) {
    return findState(alias)
        .orElseThrow(() -> new IllegalArgumentException("Unknown state '" + alias + "'"));
  }

  public Optional<State> findState(String alias) {
    for (State s : states) {
      if (s.alias().equals(alias)) return Optional.of(s);
    }
    return Optional.empty();
  }

  public Set<String> aliases() {
    Set<String> out = new LinkedHashSet<>();
    for (State s : states) out.add(s.alias());
    return out;
  }

  public Map<String, State> statesByAlias() {
    Map<String, State> out = new LinkedHashMap<>();
    for (State s : states) out.put(s.alias(), s);
    return out;
  }

  public List<Transition> outgoing(String alias) {
    List<Transition> out = new ArrayList<>();
    for (Transition t : transitions) {
      if (t.source().equals(alias)) out.add(t);
    }
    return out;
  }

  public StateMachine withStates(List<State> newStates) {
    return new StateMachine(name, newStates, transitions, initial, catalogVersion);
  }

  public StateMachine withTransitions(List<Transition> newTransitions) {
    return new StateMachine(name, states, newTransitions, initial, catalogVersion);
  }

  public StateMachine withContent(List<State> newStates, List<Transition> newTransitions) {
    return new StateMachine(name, newStates, newTransitions, initial, catalogVersion);
  }

  /** Returns a copy where the state's display label is replaced; identity is untouched. */
  public StateMachine relabel(String alias, String label) {
    List<State> out = new ArrayList<>();
    boolean found = false;
    for (State s : states) {
      if (s.alias().equals(alias)) {
        out.add(s.withLabel(label));
        found = true;
      } else {
        out.add(s);
      }
    }
    if (!found) {
      throw new IllegalArgumentException("Unknown state '" + alias + "'");
    }
    return withStates(out);
  }
}

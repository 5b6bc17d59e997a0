package nlfsm;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Flags alias renames in an edited machine. Aliases are identity: a state may get a new label,
 * and new states may appear, but an existing state may not reappear under another alias.
 */
public class EditSafetyChecker {

  public List<Diagnostic> check(StateMachine edited, StateMachine baseline) {
    return check(edited, baseline, Set.of());
  }

  /**
   * @param undeclared aliases the edited text referenced without declaring them
   */
  public List<Diagnostic> check(StateMachine edited, StateMachine baseline, Set<String> undeclared) {
    List<Diagnostic> out = new ArrayList<>();
    Set<String> before = baseline.aliases();
    Set<String> after = edited.aliases();

    List<String> vanished = new ArrayList<>();
    for (String alias : before) {
      if (!after.contains(alias)) vanished.add(alias);
    }
    List<String> fresh = new ArrayList<>();
    for (String alias : after) {
      if (!before.contains(alias)) fresh.add(alias);
    }

    // Same role, new alias. Neighbours still unmatched are written as PENDING on both sides and
    // matched ones under their baseline alias, so states renamed together are found one by one.
    Map<String, String> renamed = new HashMap<>();
    boolean progress = true;
    while (progress) {
      progress = false;
      UnaryOperator<String> baselineNaming =
          a -> vanished.contains(a) ? StateSignatures.PENDING : a;
      UnaryOperator<String> editedNaming =
          a -> fresh.contains(a) ? StateSignatures.PENDING : renamed.getOrDefault(a, a);
      search:
      for (String alias : fresh) {
        List<String> sig = StateSignatures.of(edited, alias, editedNaming);
        if (StateSignatures.isIsolated(sig)) continue;
        for (String old : vanished) {
          if (sig.equals(StateSignatures.of(baseline, old, baselineNaming))) {
            out.add(rename(old, alias));
            renamed.put(alias, old);
            vanished.remove(old);
            fresh.remove(alias);
            progress = true;
            break search;
          }
        }
      }
    }

    // Declaration renamed while transitions still use the old alias.
    List<String> orphaned = new ArrayList<>();
    for (String alias : undeclared) {
      if (before.contains(alias)) orphaned.add(alias);
    }
    List<String> isolated = new ArrayList<>();
    for (String alias : fresh) {
      if (!undeclared.contains(alias) && StateSignatures.isIsolated(StateSignatures.of(edited, alias))) {
        isolated.add(alias);
      }
    }
    for (int i = 0; i < Math.min(orphaned.size(), isolated.size()); i++) {
      out.add(rename(orphaned.get(i), isolated.get(i)));
    }
    return out;
  }

  private static Diagnostic rename(String oldAlias, String newAlias) {
    return Diagnostic.error(Diagnostic.Kind.IDENTITY, "E600", "state:" + newAlias,
        "State '" + oldAlias + "' appears to be renamed to '" + newAlias
            + "'; aliases are identity. Keep the alias and change the label instead: state \"<label>\" as "
            + oldAlias)
        .withSuggestions(List.of(oldAlias));
  }
}

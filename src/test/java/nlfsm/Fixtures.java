package nlfsm;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Shared machines and collaborators for the tests. */
final class Fixtures {

  private static Catalog catalog;

  private Fixtures() {}

  static Catalog catalog() {
    if (catalog == null) {
      try {
        catalog = Catalog.load("classpath:catalog.json");
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
    return catalog;
  }

  static ShapeSchema schema() {
    return ShapeSchema.defaults();
  }

  static CompilerPipeline pipeline() {
    return new CompilerPipeline(schema(), catalog(), new DiagramGenerator(false));
  }

  static AttributeRef ref(String chain) {
    return AttributeRef.parse(chain);
  }

  static Trigger becomes(String chain, String value) {
    return Trigger.of(new Trigger.Becomes(ref(chain), Literal.text(value)));
  }

  static Action.Command cmd(String device, String command, Literal... args) {
    return new Action.Command(device, command, List.of(args));
  }

  static StateMachine.Transition transition(
      String source, String target, Trigger trigger, Action... actions) {
    return new StateMachine.Transition(source, target, trigger, List.of(actions));
  }

  /** Motion light as a candidate would write it: the delay is still an action. */
  static StateMachine motionLight() {
    return new StateMachine(
        "MotionLight",
        List.of(new StateMachine.State("Idle"), new StateMachine.State("Lit", "Light on", false)),
        List.of(
            transition("Idle", "Lit", becomes("motion_hall.motion", "active"), cmd("light_hall", "on")),
            transition("Lit", "Idle", becomes("motion_hall.motion", "inactive"),
                new Action.Delay(300), cmd("light_hall", "off"))),
        "Idle",
        "");
  }

  /** Two states toggled by motion; {@code onActions} run on the way in. */
  static StateMachine twoStates(GuardExpr guard, Action... onActions) {
    return new StateMachine(
        "Check",
        List.of(new StateMachine.State("S1"), new StateMachine.State("S2")),
        List.of(
            new StateMachine.Transition(
                "S1", "S2", becomes("motion_hall.motion", "active"), guard, List.of(onActions)),
            transition("S2", "S1", becomes("motion_hall.motion", "inactive"))),
        "S1",
        "");
  }

  /** Uses every trigger kind, a grouped guard, typed arguments and escaped text. */
  static StateMachine everything() {
    GuardExpr leaving = GuardExpr.and(
        GuardExpr.group(GuardExpr.compare(
            ref("front_door.lock"), GuardExpr.Operator.EQ, Literal.text("locked"))),
        GuardExpr.not(GuardExpr.group(GuardExpr.compare(
            ref("location_mode.away"), GuardExpr.Operator.NEQ, Literal.bool(false)))));
    GuardExpr cold = GuardExpr.or(
        GuardExpr.compare(ref("thermostat.temperature"), GuardExpr.Operator.LT, Literal.decimal("18.5")),
        GuardExpr.compare(ref("thermostat.temperature"), GuardExpr.Operator.GTE, Literal.integer(25)));
    return new StateMachine(
        "Everything",
        List.of(
            new StateMachine.State("Home"),
            new StateMachine.State("Away", "Away from home", false),
            new StateMachine.State("Night", "Night \"quiet\" mode", false)),
        List.of(
            new StateMachine.Transition("Home", "Away",
                Trigger.of(
                    new Trigger.Becomes(ref("presence_phone.presence"), Literal.text("not present")),
                    new Trigger.Changes(ref("location_mode.mode"))),
                leaving,
                List.of(
                    cmd("hallway_light", "setLevel", Literal.integer(40)),
                    cmd("notifier", "send", Literal.text("Left \"home\"\n")),
                    cmd("thermostat", "setSetpoint", Literal.decimal("16.50")))),
            new StateMachine.Transition("Away", "Home",
                becomes("presence_phone.presence", "present"),
                cold,
                List.of(cmd("thermostat", "setMode", Literal.text("heat")), new Action.Notify("Welcome back"))),
            transition("Home", "Night", Trigger.of(new Trigger.Schedule("0 22 * * *")),
                cmd("alarm", "strobe"), new Action.Delay(90), cmd("hallway_light", "off")),
            transition("Night", "Home", Trigger.after(8 * 3600))),
        "Home",
        "2024.1");
  }

  /** Same content with states and transitions listed in reverse. */
  static StateMachine reversed(StateMachine m) {
    List<StateMachine.State> states = new ArrayList<>(m.states());
    Collections.reverse(states);
    List<StateMachine.Transition> transitions = new ArrayList<>(m.transitions());
    Collections.reverse(transitions);
    return m.withContent(states, transitions);
  }

  static List<String> codes(ValidationReport report) {
    return report.diagnostics().stream().map(Diagnostic::code).toList();
  }

  static List<String> codes(List<Diagnostic> diagnostics) {
    return diagnostics.stream().map(Diagnostic::code).toList();
  }
}

package nlfsm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NormalizerTest {

  private Normalizer normalizer;

  @BeforeEach
  void setUp() {
    normalizer = new Normalizer();
  }

  @Test
  void normalizeIsIdempotent() {
    for (StateMachine candidate : List.of(Fixtures.motionLight(), Fixtures.everything())) {
      StateMachine once = normalizer.normalize(candidate);
      assertEquals(once, normalizer.normalize(once), candidate.name());
    }
  }

  /** A delay splits the transition at a synthetic timer state named after the source. */
  @Test
  void delayBecomesTimerState() {
    GuardExpr closed = GuardExpr.compare(
        Fixtures.ref("front_door.contact"), GuardExpr.Operator.EQ, Literal.text("closed"));
    StateMachine candidate = Fixtures.twoStates(closed,
        Fixtures.cmd("hallway_light", "on"), new Action.Delay(30), Fixtures.cmd("hallway_light", "off"));

    StateMachine ir = normalizer.normalize(candidate);

    assertEquals(List.of("S1", "S1_wait", "S2"), List.copyOf(ir.aliases()));
    StateMachine.State timer = ir.state("S1_wait");
    assertTrue(timer.synthetic());
    assertEquals("S1_wait", timer.label());

    StateMachine.Transition enter = ir.outgoing("S1").get(0);
    assertEquals("S1_wait", enter.target());
    assertEquals(Fixtures.becomes("motion_hall.motion", "active"), enter.trigger());
    assertEquals(closed, enter.guard());
    assertEquals(List.of(Fixtures.cmd("hallway_light", "on")), enter.actions());

    StateMachine.Transition leave = ir.outgoing("S1_wait").get(0);
    assertEquals("S2", leave.target());
    assertEquals(Trigger.after(30), leave.trigger());
    assertNull(leave.guard());
    assertEquals(List.of(Fixtures.cmd("hallway_light", "off")), leave.actions());
  }

  @Test
  void secondDelayFromSameSourceGetsNumberedSuffix() {
    StateMachine candidate = Fixtures.twoStates(null,
        new Action.Delay(10), Fixtures.cmd("hallway_light", "on"), new Action.Delay(20));

    StateMachine ir = normalizer.normalize(candidate);

    assertEquals(List.of("S1", "S1_wait", "S1_wait_2", "S2"), List.copyOf(ir.aliases()));
    assertEquals("S1_wait_2", ir.outgoing("S1_wait").get(0).target());
    assertEquals(Trigger.after(10), ir.outgoing("S1_wait").get(0).trigger());
    StateMachine.Transition last = ir.outgoing("S1_wait_2").get(0);
    assertEquals("S2", last.target());
    assertEquals(Trigger.after(20), last.trigger());
    assertTrue(last.actions().isEmpty());
  }

  @Test
  void timerNameSkipsAliasAlreadyInUse() {
    StateMachine candidate = new StateMachine(
        "Taken",
        List.of(new StateMachine.State("A"), new StateMachine.State("A_wait"), new StateMachine.State("B")),
        List.of(
            Fixtures.transition("A", "B", Fixtures.becomes("motion_hall.motion", "active"), new Action.Delay(5)),
            Fixtures.transition("B", "A_wait", Fixtures.becomes("motion_hall.motion", "inactive"))),
        "A",
        "");

    StateMachine ir = normalizer.normalize(candidate);

    assertFalse(ir.state("A_wait").synthetic());
    assertTrue(ir.state("A_wait_2").synthetic());
  }

  @Test
  void transitionsAreSortedBySourceThenTarget() {
    StateMachine ir = normalizer.normalize(Fixtures.reversed(Fixtures.everything()));

    List<String> order = ir.transitions().stream().map(t -> t.source() + ">" + t.target()).toList();
    assertEquals(List.of("Away>Home", "Home>Away", "Home>Home_wait", "Home_wait>Night", "Night>Home"), order);
    assertEquals(List.of("Away", "Home", "Home_wait", "Night"), List.copyOf(ir.aliases()));
  }

  @Test
  void regroupAddsParenthesesTheTextNeeds() {
    GuardExpr a = GuardExpr.compare(Fixtures.ref("x.a"), GuardExpr.Operator.EQ, Literal.integer(1));
    GuardExpr b = GuardExpr.compare(Fixtures.ref("x.b"), GuardExpr.Operator.EQ, Literal.integer(2));
    GuardExpr c = GuardExpr.compare(Fixtures.ref("x.c"), GuardExpr.Operator.EQ, Literal.integer(3));

    assertEquals(GuardExpr.and(a, GuardExpr.group(GuardExpr.or(b, c))),
        Normalizer.regroup(GuardExpr.and(a, GuardExpr.or(b, c))));
    assertEquals(GuardExpr.not(GuardExpr.group(GuardExpr.and(a, b))),
        Normalizer.regroup(GuardExpr.not(GuardExpr.and(a, b))));
    assertEquals(GuardExpr.and(a, b, c),
        Normalizer.regroup(GuardExpr.and(a, GuardExpr.and(b, c))));
    assertEquals(GuardExpr.and(a, GuardExpr.group(GuardExpr.and(b, c))),
        Normalizer.regroup(GuardExpr.and(a, GuardExpr.group(GuardExpr.and(b, c)))),
        "authored groups are kept");
  }

  @Test
  void regroupedGuardReadsBackAsSameTree() {
    GuardExpr a = GuardExpr.compare(Fixtures.ref("x.a"), GuardExpr.Operator.EQ, Literal.integer(1));
    GuardExpr b = GuardExpr.compare(Fixtures.ref("x.b"), GuardExpr.Operator.LT, Literal.decimal("2.0"));
    GuardExpr c = GuardExpr.compare(Fixtures.ref("x.c"), GuardExpr.Operator.NEQ, Literal.bool(true));
    GuardExpr guard = Normalizer.regroup(GuardExpr.or(GuardExpr.and(a, GuardExpr.or(b, c)), GuardExpr.not(a)));

    assertEquals(guard, DiagramGrammar.GUARD.parse(DiagramGrammar.GUARD.format(guard)));
  }

  /** A re-minted timer keeps the alias the baseline gave the same timer. */
  @Test
  void baselineTimerAliasIsReused() {
    StateMachine baseline = new StateMachine(
        "MotionLight",
        List.of(new StateMachine.State("Hold", "Hold", true), new StateMachine.State("Idle"),
            new StateMachine.State("Lit", "Light on", false)),
        List.of(
            Fixtures.transition("Hold", "Idle", Trigger.after(300), Fixtures.cmd("light_hall", "off")),
            Fixtures.transition("Idle", "Lit", Fixtures.becomes("motion_hall.motion", "active"),
                Fixtures.cmd("light_hall", "on")),
            Fixtures.transition("Lit", "Hold", Fixtures.becomes("motion_hall.motion", "inactive"))),
        "Idle",
        "");

    StateMachine ir = normalizer.normalize(Fixtures.motionLight(), baseline);

    assertEquals(baseline, ir);
    assertFalse(ir.findState("Lit_wait").isPresent());
  }
}

package io.lacuna.fsm.convert;

import io.lacuna.fsm.Automaton;
import io.lacuna.fsm.AutomatonBuilder;
import io.lacuna.fsm.Kind;
import io.lacuna.fsm.regex.ThompsonBuilder;
import io.lacuna.fsm.sim.SimulationEngine;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class DfaMinimizerTest {

  private final SimulationEngine engine = new SimulationEngine();

  // accepts strings with an odd number of 'a's, with each parity state split in two
  private static Automaton redundant() {
    return new AutomatonBuilder(Kind.DFA)
            .states("e1", "o1", "e2", "o2", "unreachable")
            .alphabet("a", "b")
            .start("e1")
            .accept("o1", "o2")
            .transition("e1", "a", "o1")
            .transition("e1", "b", "e2")
            .transition("e2", "a", "o2")
            .transition("e2", "b", "e1")
            .transition("o1", "a", "e2")
            .transition("o1", "b", "o2")
            .transition("o2", "a", "e1")
            .transition("o2", "b", "o1")
            .transition("unreachable", "a", "e1")
            .build();
  }

  @Test
  public void testMergesEquivalentStates() {
    Automaton minimal = DfaMinimizer.minimize(redundant());

    Assert.assertEquals(minimal.stateCount(), 2);
    Assert.assertEquals(minimal.name(minimal.start()), "q0");
    Assert.assertFalse(minimal.isAccepting(minimal.start()));
    Assert.assertTrue(minimal.isAccepting(minimal.state("q1").get()));

    for (String s : new String[] {"a", "ab", "bab", "aaa"}) {
      Assert.assertTrue(engine.accepts(minimal, s), s);
    }
    for (String s : new String[] {"", "aa", "bb", "abba"}) {
      Assert.assertFalse(engine.accepts(minimal, s), s);
    }
  }

  @Test
  public void testMissingTransitionsActAsDeadState() {
    // 'p' and 'q' differ only in that 'q' has no transition on 'b'
    Automaton dfa = new AutomatonBuilder(Kind.DFA)
            .states("p", "q", "f")
            .alphabet("a", "b")
            .start("p")
            .accept("f")
            .transition("p", "a", "f")
            .transition("p", "b", "p")
            .transition("q", "a", "f")
            .transition("f", "b", "q")
            .build();

    Automaton minimal = DfaMinimizer.minimize(dfa);

    Assert.assertEquals(minimal.stateCount(), 3);
    Assert.assertFalse(minimal.isComplete());
  }

  @DataProvider(name = "regexes")
  public Object[][] regexes() {
    return new Object[][] {
            {"(a|b)*abb", 4},
            {"a*b+", 2},
            {"(ab)*", 2},
            {"a|b", 2},
            {"(a|b)*", 1},
    };
  }

  @Test(dataProvider = "regexes")
  public void testMinimalSize(String regex, int states) {
    Automaton minimal = DfaMinimizer.minimize(SubsetConstructor.determinize(ThompsonBuilder.build(regex)));

    Assert.assertEquals(minimal.stateCount(), states);
  }

  @Test(dataProvider = "regexes")
  public void testIdempotent(String regex, int states) {
    Automaton once = DfaMinimizer.minimize(SubsetConstructor.determinize(ThompsonBuilder.build(regex)));
    Automaton twice = DfaMinimizer.minimize(once);

    Assert.assertTrue(once.isomorphic(twice));
    Assert.assertEquals(twice, once);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testRequiresDfa() {
    DfaMinimizer.minimize(ThompsonBuilder.build("a"));
  }
}

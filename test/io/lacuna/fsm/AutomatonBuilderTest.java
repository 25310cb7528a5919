package io.lacuna.fsm;

import org.testng.Assert;
import org.testng.annotations.Test;

public class AutomatonBuilderTest {

  private static AutomatonBuilder evenZeros() {
    return new AutomatonBuilder(Kind.DFA)
            .states("even", "odd")
            .alphabet("0", "1")
            .start("even")
            .accept("even")
            .transition("even", "0", "odd")
            .transition("even", "1", "even")
            .transition("odd", "0", "even")
            .transition("odd", "1", "odd");
  }

  @Test
  public void testQueries() {
    Automaton a = evenZeros().build();

    Assert.assertEquals(a.kind(), Kind.DFA);
    Assert.assertEquals(a.stateCount(), 2);
    Assert.assertEquals(a.name(a.start()), "even");
    State odd = a.state("odd").get();
    Assert.assertFalse(a.isAccepting(odd));
    Assert.assertEquals(a.next(a.start(), "0").get(), odd);
    Assert.assertEquals(a.transitions(odd).size(), 2);
    Assert.assertFalse(a.state("missing").isPresent());
    Assert.assertTrue(a.isComplete());
    Assert.assertEquals(a.reachableStates().size(), 2);
    Assert.assertEquals(a.toString(), "DFA[->even*, odd]");
  }

  @Test
  public void testIsomorphismIgnoresNames() {
    Automaton a = evenZeros().build();
    Automaton b = new AutomatonBuilder(Kind.DFA)
            .states("x", "y")
            .alphabet("1", "0")
            .start("x")
            .accept("x")
            .transition("y", "1", "y")
            .transition("x", "0", "y")
            .transition("y", "0", "x")
            .transition("x", "1", "x")
            .build();

    Assert.assertTrue(a.isomorphic(b));
    Assert.assertTrue(b.isomorphic(a));
    Assert.assertEquals(a, b);

    Automaton c = evenZeros().accept("odd").build();
    Assert.assertFalse(a.isomorphic(c));
  }

  @Test
  public void testUnreachableStatesAreKept() {
    Automaton a = evenZeros().state("lost").build();

    Assert.assertEquals(a.stateCount(), 3);
    Assert.assertEquals(a.reachableStates().size(), 2);
    Assert.assertFalse(a.isComplete());
  }

  @Test(expectedExceptions = MalformedAutomatonException.class)
  public void testDuplicateState() {
    new AutomatonBuilder(Kind.NFA).states("q0", "q0");
  }

  @Test
  public void testMissingStart() {
    try {
      new AutomatonBuilder(Kind.NFA).state("q0").build();
      Assert.fail();
    } catch (MalformedAutomatonException e) {
      Assert.assertEquals(e.kind(), ErrorKind.MALFORMED_AUTOMATON);
      Assert.assertTrue(e.getMessage().contains("start"), e.getMessage());
    }
  }

  @Test(expectedExceptions = MalformedAutomatonException.class)
  public void testMultipleStarts() {
    evenZeros().start("odd").build();
  }

  @Test(expectedExceptions = MalformedAutomatonException.class, expectedExceptionsMessageRegExp = ".*'nowhere'.*")
  public void testUndeclaredTarget() {
    evenZeros().transition("odd", "1", "nowhere").build();
  }

  @Test(expectedExceptions = MalformedAutomatonException.class, expectedExceptionsMessageRegExp = ".*'2'.*")
  public void testUndeclaredSymbol() {
    evenZeros().transition("odd", "2", "odd").build();
  }

  @Test(expectedExceptions = MalformedAutomatonException.class)
  public void testAmbiguousDfa() {
    evenZeros().transition("even", "0", "even").build();
  }

  @Test
  public void testNondeterminismAllowedForNfa() {
    Automaton a = new AutomatonBuilder(Kind.NFA)
            .states("p", "q")
            .alphabet("a")
            .start("p")
            .transition("p", "a", "p")
            .transition("p", "a", "q")
            .build();

    Assert.assertEquals(a.targets(a.start(), "a").size(), 2);
  }

  @Test(expectedExceptions = MalformedAutomatonException.class)
  public void testEpsilonRejectedForDfa() {
    evenZeros().epsilon("even", "odd").build();
  }

  @Test(expectedExceptions = MalformedAutomatonException.class)
  public void testEpsilonNotInAlphabet() {
    new AutomatonBuilder(Kind.ENFA).state("q").start("q").alphabet(Symbols.EPSILON).build();
  }

  @Test
  public void testEpsilonForEnfa() {
    Automaton a = new AutomatonBuilder(Kind.ENFA)
            .states("p", "q")
            .start("p")
            .accept("q")
            .epsilon("p", "q")
            .build();

    Transition t = a.transitions(a.start()).nth(0);
    Assert.assertTrue(t.isEpsilon());
    Assert.assertEquals(t.label(), "ε");
  }

  @Test(expectedExceptions = MalformedAutomatonException.class, expectedExceptionsMessageRegExp = ".*no output.*")
  public void testMooreStateWithoutOutput() {
    new AutomatonBuilder(Kind.MOORE)
            .states("p", "q")
            .alphabet("a")
            .start("p")
            .output("p", "0")
            .transition("p", "a", "q")
            .build();
  }

  @Test(expectedExceptions = MalformedAutomatonException.class)
  public void testMealyTransitionWithoutOutput() {
    new AutomatonBuilder(Kind.MEALY)
            .state("p")
            .alphabet("a")
            .start("p")
            .transition("p", "a", "p")
            .build();
  }

  @Test(expectedExceptions = MalformedAutomatonException.class, expectedExceptionsMessageRegExp = ".*'X'.*")
  public void testUnknownStackSymbol() {
    new AutomatonBuilder(Kind.PDA)
            .state("p")
            .alphabet("a")
            .stackAlphabet("Z", "A")
            .start("p")
            .pushdown("p", "a", "Z", "p", "Z", "X")
            .build();
  }

  @Test(expectedExceptions = MalformedAutomatonException.class)
  public void testInitialStackSymbolOutsideStackAlphabet() {
    new AutomatonBuilder(Kind.PDA)
            .state("p")
            .stackAlphabet("A")
            .start("p")
            .build();
  }

  @Test
  public void testPushdownLabel() {
    Automaton a = new AutomatonBuilder(Kind.PDA)
            .state("p")
            .alphabet("a")
            .stackAlphabet("Z", "A")
            .start("p")
            .pushdown("p", "a", "Z", "p", "Z", "A")
            .pushdown("p", Symbols.EPSILON, "A", "p")
            .build();

    Assert.assertEquals(a.initialStackSymbol(), "Z");
    Assert.assertEquals(a.acceptance(), AcceptanceMode.FINAL_STATE);
    Assert.assertEquals(a.transitions().nth(0).label(), "a,Z/AZ");
    Assert.assertEquals(a.transitions().nth(1).label(), "ε,A/ε");
  }

  @Test
  public void testBuiltAutomatonUnaffectedByLaterBuilderUse() {
    AutomatonBuilder b = new AutomatonBuilder(Kind.DFA)
            .state("p")
            .alphabet("a")
            .start("p")
            .transition("p", "a", "p");
    Automaton first = b.build();

    b.state("q").symbol("b").transition("p", "b", "q");
    Automaton second = b.build();

    Assert.assertEquals(first.stateCount(), 1);
    Assert.assertEquals(first.alphabet().size(), 1);
    Assert.assertFalse(first.state("q").isPresent());
    Assert.assertEquals(first.transitions().size(), 1);
    Assert.assertEquals(first.toString(), "DFA[->p]");
    Assert.assertEquals(second.stateCount(), 2);
    Assert.assertEquals(second.alphabet().size(), 2);
  }

  @Test
  public void testDuplicateTransitionsHashAlike() {
    Automaton once = new AutomatonBuilder(Kind.NFA)
            .state("p")
            .alphabet("a")
            .start("p")
            .transition("p", "a", "p")
            .build();
    Automaton twice = new AutomatonBuilder(Kind.NFA)
            .state("p")
            .alphabet("a")
            .start("p")
            .transition("p", "a", "p")
            .transition("p", "a", "p")
            .build();

    Assert.assertEquals(twice, once);
    Assert.assertEquals(twice.hashCode(), once.hashCode());
  }

  @Test
  public void testTotal() {
    Automaton a = evenZeros().total().build();

    Assert.assertTrue(a.isTotal());
    Assert.assertFalse(evenZeros().build().isTotal());
    Assert.assertNotEquals(evenZeros().build(), a);
  }

  @Test(expectedExceptions = MalformedAutomatonException.class,
          expectedExceptionsMessageRegExp = "total DFA has no transition from 'stuck' on '0'")
  public void testTotalRequiresEveryTransition() {
    evenZeros().state("stuck").transition("stuck", "1", "even").total().build();
  }

  @Test(expectedExceptions = MalformedAutomatonException.class)
  public void testOnlyDfaCanBeTotal() {
    new AutomatonBuilder(Kind.NFA).state("p").start("p").total().build();
  }

  @Test
  public void testFreshName() {
    AutomatonBuilder b = new AutomatonBuilder(Kind.NFA).states("x", "x#2");

    Assert.assertEquals(b.freshName("y"), "y");
    Assert.assertEquals(b.freshName("x"), "x#3");
  }
}

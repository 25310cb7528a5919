package io.lacuna.fsm.convert;

import io.lacuna.bifurcan.IList;
import io.lacuna.fsm.Automaton;
import io.lacuna.fsm.AutomatonBuilder;
import io.lacuna.fsm.Kind;
import io.lacuna.fsm.Symbols;
import io.lacuna.fsm.sim.SimulationEngine;
import org.testng.Assert;
import org.testng.annotations.Test;

public class MealyMooreConverterTest {

  private final SimulationEngine engine = new SimulationEngine();

  // emits 1 whenever the current bit equals the previous one
  private static Automaton repeatDetector() {
    return new AutomatonBuilder(Kind.MEALY)
            .states("s", "last0", "last1")
            .alphabet("0", "1")
            .start("s")
            .transition("s", "0", "last0", "0")
            .transition("s", "1", "last1", "0")
            .transition("last0", "0", "last0", "1")
            .transition("last0", "1", "last1", "0")
            .transition("last1", "0", "last0", "0")
            .transition("last1", "1", "last1", "1")
            .build();
  }

  // emits the parity of the 'a's seen so far
  private static Automaton parity() {
    return new AutomatonBuilder(Kind.MOORE)
            .states("even", "odd")
            .alphabet("a", "b")
            .start("even")
            .output("even", "0")
            .output("odd", "1")
            .transition("even", "a", "odd")
            .transition("even", "b", "even")
            .transition("odd", "a", "even")
            .transition("odd", "b", "odd")
            .build();
  }

  private static String[] inputs() {
    return new String[] {"", "0", "1", "00", "0110", "1110001", "010101"};
  }

  @Test
  public void testMealyToMoore() {
    Automaton mealy = repeatDetector();
    Automaton moore = MealyMooreConverter.mealyToMoore(mealy);

    Assert.assertEquals(moore.kind(), Kind.MOORE);
    Assert.assertEquals(moore.name(moore.start()), "s");
    Assert.assertEquals(moore.output(moore.start()).get(), MealyMooreConverter.BLANK);
    Assert.assertTrue(moore.state("last0/1").isPresent());
    Assert.assertEquals(moore.output(moore.state("last1/0").get()).get(), "0");
    Assert.assertEquals(moore.stateCount(), 5);

    for (String input : inputs()) {
      Assert.assertEquals(
              Symbols.join(engine.transduce(moore, input)),
              Symbols.join(engine.transduce(mealy, input)),
              input);
    }
  }

  @Test
  public void testMooreToMealy() {
    Automaton moore = parity();
    Automaton mealy = MealyMooreConverter.mooreToMealy(moore);

    Assert.assertEquals(mealy.kind(), Kind.MEALY);
    Assert.assertEquals(mealy.stateCount(), moore.stateCount());
    Assert.assertEquals(mealy.transition(mealy.start(), "a").get().output(), "1");

    IList<String> outputs = engine.transduce(mealy, "aab");
    Assert.assertEquals(Symbols.join(outputs), "100");
    Assert.assertEquals(Symbols.join(engine.transduce(moore, "aab")), "100");
  }

  @Test
  public void testRoundTrips() {
    Automaton mealy = repeatDetector();
    Automaton mealyAgain = MealyMooreConverter.mooreToMealy(MealyMooreConverter.mealyToMoore(mealy));

    Automaton moore = parity();
    Automaton mooreAgain = MealyMooreConverter.mealyToMoore(MealyMooreConverter.mooreToMealy(moore));

    for (String input : inputs()) {
      Assert.assertEquals(engine.transduce(mealyAgain, input).size(), input.length());
      Assert.assertEquals(
              Symbols.join(engine.transduce(mealyAgain, input)),
              Symbols.join(engine.transduce(mealy, input)));

      String word = input.replace('0', 'a').replace('1', 'b');
      Assert.assertEquals(
              Symbols.join(engine.transduce(mooreAgain, word)),
              Symbols.join(engine.transduce(moore, word)));
    }
  }

  @Test
  public void testPairNamesStayDistinct() {
    // entering "a" with output "b/c" and "a/b" with output "c" both read a/b/c
    Automaton mealy = new AutomatonBuilder(Kind.MEALY)
            .states("s", "a", "a/b")
            .alphabet("x", "y")
            .start("s")
            .transition("s", "x", "a", "b/c")
            .transition("s", "y", "a/b", "c")
            .build();

    Automaton moore = MealyMooreConverter.mealyToMoore(mealy);

    Assert.assertEquals(moore.stateCount(), 3);
    Assert.assertEquals(moore.output(moore.state("a/b/c").get()).get(), "b/c");
    Assert.assertEquals(moore.output(moore.state("a/b/c#2").get()).get(), "c");
    Assert.assertEquals(Symbols.join(engine.transduce(moore, "y")), "c");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testWrongKind() {
    MealyMooreConverter.mealyToMoore(parity());
  }
}

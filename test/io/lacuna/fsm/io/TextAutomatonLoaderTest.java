package io.lacuna.fsm.io;

import io.lacuna.fsm.*;
import io.lacuna.fsm.sim.SimulationEngine;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;

public class TextAutomatonLoaderTest {

  private final SimulationEngine engine = new SimulationEngine();

  @Test
  public void testEnfa() throws IOException {
    Automaton enfa = TextAutomatonLoader.load(JsonAutomatonLoaderTest.resource("enfa.txt"));

    Assert.assertEquals(enfa.kind(), Kind.ENFA);
    Assert.assertEquals(enfa.stateCount(), 4);
    Assert.assertTrue(engine.accepts(enfa, "aab"));
    Assert.assertTrue(engine.accepts(enfa, "b"));
    Assert.assertFalse(engine.accepts(enfa, "ba"));
  }

  @Test
  public void testDfa() {
    Automaton dfa = TextAutomatonLoader.load(String.join("\n",
            "TYPE: dfa",
            "states: q0, q1",
            "alphabet: x",
            "start: q0",
            "accept: q1",
            "transitions:",
            "  q0, x -> q1",
            "  q1, x -> q0"));

    Assert.assertEquals(dfa.kind(), Kind.DFA);
    Assert.assertTrue(engine.accepts(dfa, "xxx"));
    Assert.assertFalse(engine.accepts(dfa, "xx"));
  }

  @Test(expectedExceptions = MalformedAutomatonException.class, expectedExceptionsMessageRegExp = ".*type.*")
  public void testMissingType() {
    TextAutomatonLoader.load("states: q0\nstart: q0\n");
  }

  @Test(expectedExceptions = MalformedAutomatonException.class, expectedExceptionsMessageRegExp = "line 5.*")
  public void testBadTransition() {
    TextAutomatonLoader.load("type: NFA\nstates: q0\nstart: q0\ntransitions:\nq0 -> q0\n");
  }

  @Test(expectedExceptions = MalformedAutomatonException.class)
  public void testPushdownUnsupported() {
    TextAutomatonLoader.load("type: PDA\nstates: q0\nstart: q0\n");
  }

  @Test(expectedExceptions = MalformedAutomatonException.class, expectedExceptionsMessageRegExp = ".*unrecognized.*")
  public void testUnrecognizedLine() {
    TextAutomatonLoader.load("type: DFA\nbogus\n");
  }
}

package io.lacuna.fsm.io;

import io.lacuna.fsm.*;
import io.lacuna.fsm.sim.SimulationEngine;
import io.lacuna.fsm.sim.SimulationResult;
import io.lacuna.fsm.sim.Verdict;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

public class JsonAutomatonLoaderTest {

  private final SimulationEngine engine = new SimulationEngine();

  static String resource(String name) throws IOException {
    try (InputStream in = JsonAutomatonLoaderTest.class.getResourceAsStream("/automata/" + name)) {
      Assert.assertNotNull(in, name);
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  @Test
  public void testDfa() throws IOException {
    Automaton dfa = JsonAutomatonLoader.load(resource("dfa.json"));

    Assert.assertEquals(dfa.kind(), Kind.DFA);
    Assert.assertEquals(dfa.stateCount(), 3);
    Assert.assertTrue(engine.accepts(dfa, "001"));
    Assert.assertTrue(engine.accepts(dfa, "1101"));
    Assert.assertFalse(engine.accepts(dfa, "010"));
  }

  @Test
  public void testPda() throws IOException {
    Automaton pda = JsonAutomatonLoader.load(resource("pda.json"));

    Assert.assertEquals(pda.kind(), Kind.PDA);
    Assert.assertEquals(pda.initialStackSymbol(), "Z");
    Assert.assertEquals(pda.acceptance(), AcceptanceMode.FINAL_STATE);
    Assert.assertTrue(engine.accepts(pda, "aabb"));
    Assert.assertFalse(engine.accepts(pda, "aab"));
  }

  @Test
  public void testMealy() throws IOException {
    Automaton mealy = JsonAutomatonLoader.load(resource("mealy.json"));
    SimulationResult result = engine.run(mealy, "01");

    Assert.assertEquals(result.verdict(), Verdict.TRANSDUCED);
    Assert.assertEquals(result.outputs().size(), 2);
    Assert.assertEquals(Symbols.join(result.outputs()), "ab");
  }

  @Test
  public void testMoore() throws IOException {
    Automaton moore = JsonAutomatonLoader.load(resource("moore.json"));

    Assert.assertEquals(moore.output(moore.start()).get(), "0");
    Assert.assertEquals(Symbols.join(engine.transduce(moore, "ttt")), "101");
  }

  @Test
  public void testTypeDefaultsToDfa() {
    Automaton dfa = JsonAutomatonLoader.load("{\"states\": [\"q\"], \"alphabet\": [\"a\"], \"start_state\": \"q\","
            + " \"accept_states\": [\"q\"], \"transitions\": [{\"from\": \"q\", \"symbol\": \"a\", \"to\": \"q\"}]}");

    Assert.assertEquals(dfa.kind(), Kind.DFA);
    Assert.assertTrue(engine.accepts(dfa, "aaa"));
  }

  @Test
  public void testMissingSymbolIsEpsilonForEnfa() {
    Automaton enfa = JsonAutomatonLoader.load("{\"type\": \"epsilon-nfa\", \"states\": [\"p\", \"q\"],"
            + " \"alphabet\": [], \"start_state\": \"p\", \"accept_states\": [\"q\"],"
            + " \"transitions\": [{\"from\": \"p\", \"to\": \"q\"}]}");

    Assert.assertEquals(enfa.kind(), Kind.ENFA);
    Assert.assertTrue(enfa.transitions().nth(0).isEpsilon());
    Assert.assertTrue(engine.accepts(enfa, ""));
  }

  @Test
  public void testTotalFlag() throws IOException {
    String json = resource("dfa.json").replaceFirst("\\{", "{\"total\": true,");
    Automaton dfa = JsonAutomatonLoader.load(json);

    Assert.assertTrue(dfa.isTotal());
    Assert.assertFalse(JsonAutomatonLoader.load(resource("dfa.json")).isTotal());
    Assert.assertEquals(Automata.tryLoadJson(json).map(Automaton::isTotal).get(), Boolean.TRUE);

    try {
      engine.run(dfa, "012");
      Assert.fail();
    } catch (NoTransitionDefinedException e) {
      Assert.assertEquals(e.state(), "q2");
      Assert.assertEquals(e.symbol(), "2");
    }
  }

  @Test(expectedExceptions = MalformedAutomatonException.class, expectedExceptionsMessageRegExp = "total DFA.*")
  public void testTotalFlagOnPartialDfa() {
    JsonAutomatonLoader.load("{\"total\": true, \"states\": [\"q\"], \"alphabet\": [\"a\", \"b\"],"
            + " \"start_state\": \"q\", \"transitions\": [{\"from\": \"q\", \"symbol\": \"a\", \"to\": \"q\"}]}");
  }

  @Test
  public void testSyntaxError() {
    Result<Automaton> result = Automata.tryLoadJson("{\"states\": [");

    Assert.assertFalse(result.isSuccess());
    Assert.assertEquals(result.kind(), ErrorKind.MALFORMED_AUTOMATON);
    Assert.assertTrue(result.message().startsWith("invalid JSON"), result.message());
  }

  @Test(expectedExceptions = MalformedAutomatonException.class, expectedExceptionsMessageRegExp = ".*'transitions'.*")
  public void testMissingField() {
    JsonAutomatonLoader.load("{\"states\": [\"q\"], \"alphabet\": [], \"start_state\": \"q\"}");
  }

  @Test(expectedExceptions = MalformedAutomatonException.class)
  public void testWrongShape() {
    JsonAutomatonLoader.load("{\"states\": \"q\", \"alphabet\": [], \"start_state\": \"q\", \"transitions\": []}");
  }

  @Test(expectedExceptions = MalformedAutomatonException.class, expectedExceptionsMessageRegExp = ".*'TM'.*")
  public void testUnknownType() {
    JsonAutomatonLoader.load("{\"type\": \"TM\"}");
  }

  @Test(expectedExceptions = MalformedAutomatonException.class)
  public void testNotAnObject() {
    JsonAutomatonLoader.load("[1, 2]");
  }
}

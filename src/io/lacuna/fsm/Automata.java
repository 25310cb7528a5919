package io.lacuna.fsm;

import io.lacuna.fsm.convert.DfaMinimizer;
import io.lacuna.fsm.convert.EpsilonEliminator;
import io.lacuna.fsm.convert.MealyMooreConverter;
import io.lacuna.fsm.convert.SubsetConstructor;
import io.lacuna.fsm.io.JsonAutomatonLoader;
import io.lacuna.fsm.io.TextAutomatonLoader;
import io.lacuna.fsm.regex.RegexNode;
import io.lacuna.fsm.regex.RegexParser;
import io.lacuna.fsm.regex.ThompsonBuilder;
import io.lacuna.fsm.sim.SimulationEngine;
import io.lacuna.fsm.sim.SimulationResult;

import java.util.function.Supplier;

/**
 * Entry points for every operation. Each throwing method has a {@code try} twin that returns a {@link Result}
 * instead, for callers that report errors rather than propagate them.
 */
public class Automata {

  private Automata() {
  }

  /// regular expressions

  public static RegexNode parseRegex(String regex) {
    return RegexParser.parse(regex);
  }

  /**
   * @return the ε-NFA built from {@code regex} by Thompson's construction
   */
  public static Automaton thompson(String regex) {
    return ThompsonBuilder.build(regex);
  }

  /**
   * @return the minimal DFA for {@code regex}
   */
  public static Automaton fromRegex(String regex) {
    return minimize(determinize(thompson(regex)));
  }

  /// conversions

  public static Automaton determinize(Automaton nfa) {
    return SubsetConstructor.determinize(nfa);
  }

  public static Automaton eliminateEpsilon(Automaton enfa) {
    return EpsilonEliminator.eliminate(enfa);
  }

  public static Automaton minimize(Automaton dfa) {
    return DfaMinimizer.minimize(dfa);
  }

  public static Automaton mealyToMoore(Automaton mealy) {
    return MealyMooreConverter.mealyToMoore(mealy);
  }

  public static Automaton mooreToMealy(Automaton moore) {
    return MealyMooreConverter.mooreToMealy(moore);
  }

  /// loading

  public static Automaton loadJson(String json) {
    return JsonAutomatonLoader.load(json);
  }

  public static Automaton loadText(String text) {
    return TextAutomatonLoader.load(text);
  }

  /// simulation

  public static SimulationResult simulate(Automaton automaton, String input) {
    return new SimulationEngine().run(automaton, input);
  }

  ///

  public static Result<RegexNode> tryParseRegex(String regex) {
    return attempt(() -> parseRegex(regex));
  }

  public static Result<Automaton> tryThompson(String regex) {
    return attempt(() -> thompson(regex));
  }

  public static Result<Automaton> tryFromRegex(String regex) {
    return attempt(() -> fromRegex(regex));
  }

  public static Result<Automaton> tryLoadJson(String json) {
    return attempt(() -> loadJson(json));
  }

  public static Result<Automaton> tryLoadText(String text) {
    return attempt(() -> loadText(text));
  }

  public static Result<SimulationResult> trySimulate(Automaton automaton, String input) {
    return attempt(() -> simulate(automaton, input));
  }

  private static <T> Result<T> attempt(Supplier<T> operation) {
    try {
      return Result.success(operation.get());
    } catch (AutomatonException e) {
      return Result.failure(e);
    }
  }
}

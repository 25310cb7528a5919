package io.lacuna.fsm.sim;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;
import io.lacuna.fsm.*;
import io.lacuna.fsm.convert.SubsetConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Runs any kind of automaton over an input sequence, recording a configuration snapshot per step.
 * <p>
 * Deterministic and nondeterministic finite automata, as well as transducers, advance one symbol per step and can be
 * driven stepwise through {@link #start(Automaton, IList)} and {@link #step(Automaton, Configuration)}. Pushdown
 * automata branch on ε-moves and stack contents, so they are explored breadth-first; {@link #successors(Automaton,
 * Configuration)} exposes a single expansion.
 */
public class SimulationEngine {

  private static final Logger LOG = LoggerFactory.getLogger(SimulationEngine.class);

  private final SimulationOptions options;

  public SimulationEngine() {
    this(SimulationOptions.defaults());
  }

  public SimulationEngine(SimulationOptions options) {
    if (options == null) {
      throw new IllegalArgumentException("options must be non-null");
    }
    this.options = options;
  }

  public SimulationOptions options() {
    return options;
  }

  /// whole runs

  /**
   * @return the result of running {@code automaton} over {@code input}, read one code point per symbol
   */
  public SimulationResult run(Automaton automaton, String input) {
    return run(automaton, Symbols.of(input));
  }

  /**
   * @throws NoTransitionDefinedException if a transducer, or a DFA that is {@link Automaton#isTotal() total} or run
   * with {@link SimulationOptions#requireTotal()}, has no transition for the next symbol
   * @throws StepLimitExceededException if a pushdown run expands more than {@link SimulationOptions#maxSteps()}
   * configurations
   */
  public SimulationResult run(Automaton automaton, IList<String> input) {
    if (automaton.kind() == Kind.PDA) {
      return new PdaExecutor(automaton, options.maxSteps()).run(input);
    }

    LinearList<Configuration> trace = new LinearList<>();
    Configuration config = start(automaton, input);
    trace.addLast(config);
    long steps = 0;

    while (!config.isInputExhausted() && !config.isStuck()) {
      config = step(automaton, config);
      trace.addLast(config);
      steps++;
    }

    Verdict verdict = verdict(automaton, config);
    LOG.debug("{} on '{}': {} after {} steps", automaton.kind(), Symbols.join(input), verdict, steps);
    return new SimulationResult(verdict, trace, steps);
  }

  public boolean accepts(Automaton automaton, String input) {
    return run(automaton, input).accepted();
  }

  /**
   * @return the outputs a Mealy or Moore machine emits for {@code input}
   */
  public IList<String> transduce(Automaton automaton, String input) {
    if (!automaton.kind().isTransducer()) {
      throw new IllegalArgumentException("cannot transduce with a " + automaton.kind());
    }
    return run(automaton, input).outputs();
  }

  /// stepwise

  /**
   * @return the initial configuration, which for ε-NFAs already holds the ε-closure of the start state
   */
  public Configuration start(Automaton automaton, IList<String> input) {
    switch (automaton.kind()) {
      case ENFA:
        return Configuration.initial(SubsetConstructor.epsilonClosure(automaton, automaton.start()), input, null);
      case PDA:
        return new PdaExecutor(automaton, options.maxSteps()).initial(input);
      default:
        return Configuration.initial(StateSet.of(automaton.start()), input, null);
    }
  }

  /**
   * Consumes the next input symbol. A DFA or NFA with nowhere to go yields a stuck configuration with no active
   * states.
   *
   * @throws IllegalArgumentException for pushdown automata, see {@link #successors(Automaton, Configuration)}
   * @throws IllegalStateException if the input is already exhausted
   */
  public Configuration step(Automaton automaton, Configuration config) {
    if (automaton.kind() == Kind.PDA) {
      throw new IllegalArgumentException("pushdown runs branch, use successors()");
    }

    String symbol = config.nextSymbol();
    int position = config.position() + 1;

    switch (automaton.kind()) {
      case NFA:
      case ENFA: {
        LinearList<Transition> taken = new LinearList<>();
        LinearSet<State> targets = new LinearSet<>();
        for (State s : config.activeStates()) {
          for (Transition t : automaton.transitions(s, symbol)) {
            taken.addLast(t);
            targets.add(t.to());
          }
        }
        StateSet next = automaton.kind() == Kind.ENFA
                ? SubsetConstructor.epsilonClosure(automaton, targets)
                : StateSet.of(targets);
        return new Configuration(next, config.input(), position, null, config.outputs(), taken);
      }

      case DFA: {
        State state = config.state();
        Optional<Transition> t = automaton.transition(state, symbol);
        if (!t.isPresent()) {
          if (automaton.isTotal() || options.requireTotal()) {
            throw new NoTransitionDefinedException(automaton.name(state), symbol);
          }
          return new Configuration(StateSet.EMPTY, config.input(), position, null, config.outputs(),
                  new LinearList<>());
        }
        return advance(config, t.get(), null);
      }

      case MEALY: {
        Transition t = required(automaton, config.state(), symbol);
        return advance(config, t, t.output());
      }

      case MOORE: {
        Transition t = required(automaton, config.state(), symbol);
        return advance(config, t, automaton.output(t.to()).orElse(""));
      }

      default:
        throw new IllegalStateException("unexpected kind " + automaton.kind());
    }
  }

  /**
   * @return every configuration a pushdown run can move to from {@code config} in one transition
   */
  public IList<Configuration> successors(Automaton automaton, Configuration config) {
    return new PdaExecutor(automaton, options.maxSteps()).successors(config);
  }

  /**
   * @return whether {@code config} is accepting, given that the run has consumed all of its input
   */
  public boolean isAccepting(Automaton automaton, Configuration config) {
    if (automaton.kind() == Kind.PDA) {
      return new PdaExecutor(automaton, options.maxSteps()).isAccepting(config);
    }
    if (!config.isInputExhausted()) {
      return false;
    }
    for (State s : config.activeStates()) {
      if (automaton.isAccepting(s)) {
        return true;
      }
    }
    return false;
  }

  ///

  private Verdict verdict(Automaton automaton, Configuration config) {
    if (automaton.kind().isTransducer()) {
      return Verdict.TRANSDUCED;
    }
    return isAccepting(automaton, config) ? Verdict.ACCEPT : Verdict.REJECT;
  }

  private static Transition required(Automaton automaton, State state, String symbol) {
    return automaton.transition(state, symbol)
            .orElseThrow(() -> new NoTransitionDefinedException(automaton.name(state), symbol));
  }

  private static Configuration advance(Configuration config, Transition t, String output) {
    IList<String> outputs = output == null ? config.outputs() : Utils.append(config.outputs(), output);
    return new Configuration(
            StateSet.of(t.to()),
            config.input(),
            config.position() + 1,
            null,
            outputs,
            LinearList.of(t));
  }
}

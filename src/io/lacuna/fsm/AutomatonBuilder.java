package io.lacuna.fsm;

import io.lacuna.bifurcan.*;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Assembles an {@link Automaton} by state name. Nothing is checked until {@link #build()}, except duplicate state
 * declarations, so the order in which states, symbols and transitions are declared does not matter.
 */
public class AutomatonBuilder {

  public static final String DEFAULT_STACK_SYMBOL = "Z";

  private final Kind kind;

  private final LinearList<String> names = new LinearList<>();
  private final LinearSet<String> declared = new LinearSet<>();
  private final LinearSet<String> alphabet = new LinearSet<>();
  private final LinearSet<String> accepting = new LinearSet<>();
  private final LinearList<String> starts = new LinearList<>();
  private final LinearList<Edge> edges = new LinearList<>();
  private final LinearMap<String, String> outputs = new LinearMap<>();

  private final LinearSet<String> stackAlphabet = new LinearSet<>();
  private String initialStackSymbol = DEFAULT_STACK_SYMBOL;
  private AcceptanceMode acceptance = AcceptanceMode.FINAL_STATE;
  private boolean total = false;

  // a transition by name, resolved against the declared states in build()
  private static class Edge {
    final String from, input, to, pop, output;
    final IList<String> push;

    Edge(String from, String input, String to, String pop, IList<String> push, String output) {
      this.from = from;
      this.input = Symbols.isEpsilon(input) ? Symbols.EPSILON : input;
      this.to = to;
      this.pop = pop;
      this.push = push;
      this.output = output;
    }

    @Override
    public String toString() {
      return from + " --" + input + "--> " + to;
    }
  }

  public AutomatonBuilder(Kind kind) {
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public Kind kind() {
    return kind;
  }

  /// states

  /**
   * @return the current builder, with a new state named {@code name}
   * @throws MalformedAutomatonException if a state with that name was already declared
   */
  public AutomatonBuilder state(String name) {
    if (name == null || name.isEmpty()) {
      throw new MalformedAutomatonException("state names must be non-empty");
    }
    if (declared.contains(name)) {
      throw new MalformedAutomatonException("duplicate state '" + name + "'");
    }
    declared.add(name);
    names.addLast(name);
    return this;
  }

  public AutomatonBuilder states(String... names) {
    Arrays.stream(names).forEach(this::state);
    return this;
  }

  public boolean hasState(String name) {
    return declared.contains(name);
  }

  /**
   * @return {@code name} if no state has it yet, otherwise the first of {@code name#2, name#3, ...} that is free
   */
  public String freshName(String name) {
    String candidate = name;
    for (int i = 2; declared.contains(candidate); i++) {
      candidate = name + "#" + i;
    }
    return candidate;
  }

  /**
   * @return the current builder, with {@code name} marked as the start state
   */
  public AutomatonBuilder start(String name) {
    starts.addLast(name);
    return this;
  }

  public AutomatonBuilder accept(String... names) {
    Arrays.stream(names).forEach(accepting::add);
    return this;
  }

  /**
   * @return the current builder, with {@code output} attached to the Moore state {@code state}
   */
  public AutomatonBuilder output(String state, String output) {
    outputs.put(state, output == null ? "" : output);
    return this;
  }

  /**
   * @return the current builder, declaring that the DFA defines a transition for every state and symbol
   */
  public AutomatonBuilder total() {
    return total(true);
  }

  public AutomatonBuilder total(boolean total) {
    this.total = total;
    return this;
  }

  /// alphabets

  public AutomatonBuilder symbol(String symbol) {
    alphabet.add(symbol);
    return this;
  }

  public AutomatonBuilder alphabet(Iterable<String> symbols) {
    symbols.forEach(alphabet::add);
    return this;
  }

  public AutomatonBuilder alphabet(String... symbols) {
    return alphabet(Arrays.asList(symbols));
  }

  public AutomatonBuilder stackAlphabet(Iterable<String> symbols) {
    symbols.forEach(stackAlphabet::add);
    return this;
  }

  public AutomatonBuilder stackAlphabet(String... symbols) {
    return stackAlphabet(Arrays.asList(symbols));
  }

  public AutomatonBuilder initialStackSymbol(String symbol) {
    this.initialStackSymbol = symbol;
    return this;
  }

  public AutomatonBuilder acceptance(AcceptanceMode mode) {
    this.acceptance = Objects.requireNonNull(mode, "mode");
    return this;
  }

  /// transitions

  /**
   * @return the current builder, extended with {@code from --symbol--> to}
   */
  public AutomatonBuilder transition(String from, String symbol, String to) {
    edges.addLast(new Edge(from, symbol, to, null, new LinearList<>(), null));
    return this;
  }

  public AutomatonBuilder epsilon(String from, String to) {
    return transition(from, Symbols.EPSILON, to);
  }

  /**
   * @return the current builder, extended with the Mealy transition {@code from --symbol/output--> to}
   */
  public AutomatonBuilder transition(String from, String symbol, String to, String output) {
    edges.addLast(new Edge(from, symbol, to, null, new LinearList<>(), output));
    return this;
  }

  /**
   * @param push pushed in order, so the last symbol becomes the new top of the stack
   * @return the current builder, extended with a pushdown transition
   */
  public AutomatonBuilder pushdown(String from, String input, String pop, String to, Iterable<String> push) {
    LinearList<String> symbols = new LinearList<>();
    push.forEach(symbols::addLast);
    edges.addLast(new Edge(from, input, to, pop == null ? Symbols.EPSILON : pop, symbols, null));
    return this;
  }

  public AutomatonBuilder pushdown(String from, String input, String pop, String to, String... push) {
    return pushdown(from, input, pop, to, Arrays.asList(push));
  }

  ///

  /**
   * @return a validated, immutable automaton
   * @throws MalformedAutomatonException naming the first offending state or symbol
   */
  public Automaton build() {
    if (names.size() == 0) {
      throw new MalformedAutomatonException("no states defined");
    }
    if (alphabet.contains(Symbols.EPSILON)) {
      throw new MalformedAutomatonException("the alphabet may not contain '" + Symbols.EPSILON + "'");
    }

    LinearMap<String, State> states = new LinearMap<>();
    for (int i = 0; i < names.size(); i++) {
      states.put(names.nth(i), State.of(i));
    }

    State start = resolveStart(states);

    LinearSet<State> accept = new LinearSet<>();
    for (String name : accepting) {
      accept.add(resolve(states, name, "accepting state"));
    }

    if (kind == Kind.PDA) {
      validateStack();
    }

    LinearList<Transition> transitions = new LinearList<>();
    LinearSet<String> seen = new LinearSet<>();
    for (Edge e : edges) {
      Transition t = resolve(states, e);
      if (kind.isDeterministic()) {
        String key = t.from().id() + "\u0000" + t.input();
        if (seen.contains(key)) {
          throw new MalformedAutomatonException(
                  "ambiguous transition from '" + e.from + "' on '" + e.input + "'");
        }
        seen.add(key);
      }
      transitions.addLast(t);
    }

    LinearMap<State, String> stateOutputs = new LinearMap<>();
    if (kind == Kind.MOORE) {
      for (IEntry<String, String> e : outputs) {
        stateOutputs.put(resolve(states, e.key(), "output state"), e.value());
      }
      for (String name : names) {
        if (!outputs.contains(name)) {
          throw new MalformedAutomatonException("state '" + name + "' has no output defined");
        }
      }
    } else if (outputs.size() > 0) {
      throw new MalformedAutomatonException("only Moore machines attach outputs to states");
    }

    if (total && kind != Kind.DFA) {
      throw new MalformedAutomatonException("only a DFA can be declared total, not a " + kind);
    }

    Automaton automaton = new Automaton(
            kind,
            names,
            alphabet,
            start,
            accept,
            transitions,
            kind == Kind.PDA ? stackAlphabet : new LinearSet<>(),
            kind == Kind.PDA ? initialStackSymbol : null,
            kind == Kind.PDA ? acceptance : null,
            total,
            stateOutputs);

    if (total) {
      for (State s : automaton.states()) {
        for (String symbol : alphabet) {
          if (automaton.transitions(s, symbol).size() == 0) {
            throw new MalformedAutomatonException(
                    "total DFA has no transition from '" + automaton.name(s) + "' on '" + symbol + "'");
          }
        }
      }
    }
    return automaton;
  }

  private State resolveStart(IMap<String, State> states) {
    if (starts.size() == 0) {
      throw new MalformedAutomatonException("no start state defined");
    }
    String start = starts.nth(0);
    for (String s : starts) {
      if (!s.equals(start)) {
        throw new MalformedAutomatonException("multiple start states: '" + start + "' and '" + s + "'");
      }
    }
    return resolve(states, start, "start state");
  }

  private void validateStack() {
    if (stackAlphabet.contains(Symbols.EPSILON)) {
      throw new MalformedAutomatonException("the stack alphabet may not contain '" + Symbols.EPSILON + "'");
    }
    if (initialStackSymbol == null || !stackAlphabet.contains(initialStackSymbol)) {
      throw new MalformedAutomatonException(
              "initial stack symbol '" + initialStackSymbol + "' is not in the stack alphabet");
    }
  }

  private static State resolve(IMap<String, State> states, String name, String role) {
    Optional<State> state = name == null ? Optional.empty() : states.get(name);
    return state.orElseThrow(() -> new MalformedAutomatonException(role + " '" + name + "' is not a declared state"));
  }

  private Transition resolve(IMap<String, State> states, Edge e) {
    State from = resolve(states, e.from, "transition source");
    State to = resolve(states, e.to, "transition target");

    if (Symbols.EPSILON.equals(e.input)) {
      if (!kind.allowsEpsilon()) {
        throw new MalformedAutomatonException(kind + " may not have ε-transitions: " + e);
      }
    } else if (!alphabet.contains(e.input)) {
      throw new MalformedAutomatonException("symbol '" + e.input + "' is not in the alphabet: " + e);
    }

    switch (kind) {
      case MEALY:
        if (e.output == null) {
          throw new MalformedAutomatonException("Mealy transition has no output: " + e);
        }
        return Transition.mealy(from, e.input, to, e.output);
      case PDA:
        String pop = e.pop == null ? Symbols.EPSILON : e.pop;
        if (!Symbols.isEpsilon(pop) && !stackAlphabet.contains(pop)) {
          throw new MalformedAutomatonException("stack symbol '" + pop + "' is not in the stack alphabet: " + e);
        }
        for (String s : e.push) {
          if (!Symbols.isEpsilon(s) && !stackAlphabet.contains(s)) {
            throw new MalformedAutomatonException("stack symbol '" + s + "' is not in the stack alphabet: " + e);
          }
        }
        return Transition.pushdown(from, e.input, pop, to, e.push);
      default:
        if (e.output != null || e.pop != null) {
          throw new MalformedAutomatonException(kind + " transitions carry neither output nor stack operations: " + e);
        }
        return Transition.of(from, e.input, to);
    }
  }
}

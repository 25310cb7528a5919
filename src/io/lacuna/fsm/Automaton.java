package io.lacuna.fsm;

import io.lacuna.bifurcan.*;

import java.util.Objects;
import java.util.Optional;

/**
 * An immutable automaton of any {@link Kind}. Instances are produced by {@link AutomatonBuilder}, which validates the
 * structural invariants, and every conversion returns a new instance rather than touching its input.
 * <p>
 * States are indexed {@code 0 .. stateCount() - 1}; names are a display-only side table.
 */
public final class Automaton {

  private static final IList<Transition> NONE = new LinearList<Transition>().forked();

  private final Kind kind;
  private final IList<String> names;
  private final IMap<String, State> byName;
  private final ISet<String> alphabet;
  private final State start;
  private final ISet<State> accepting;
  private final IList<Transition> transitions;
  private final IMap<State, IList<Transition>> outgoing;
  private final IMap<State, IMap<String, IList<Transition>>> index;

  // pushdown automata
  private final ISet<String> stackAlphabet;
  private final String initialStackSymbol;
  private final AcceptanceMode acceptance;

  // Moore machines
  private final IMap<State, String> outputs;

  private final boolean total;

  Automaton(Kind kind,
            IList<String> names,
            ISet<String> alphabet,
            State start,
            ISet<State> accepting,
            IList<Transition> transitions,
            ISet<String> stackAlphabet,
            String initialStackSymbol,
            AcceptanceMode acceptance,
            boolean total,
            IMap<State, String> outputs) {
    // forked() on a linear collection is only a view, so everything is copied first
    this.kind = kind;
    this.names = copy(names);
    this.alphabet = LinearSet.from(alphabet).forked();
    this.start = start;
    this.accepting = LinearSet.from(accepting).forked();
    this.transitions = copy(transitions);
    this.stackAlphabet = LinearSet.from(stackAlphabet).forked();
    this.initialStackSymbol = initialStackSymbol;
    this.acceptance = acceptance;
    this.total = total;

    LinearMap<State, String> outputsCopy = new LinearMap<>();
    outputs.forEach(e -> outputsCopy.put(e.key(), e.value()));
    this.outputs = outputsCopy.forked();

    LinearMap<String, State> byName = new LinearMap<>();
    for (int i = 0; i < this.names.size(); i++) {
      byName.put(this.names.nth(i), State.of(i));
    }
    this.byName = byName.forked();

    LinearMap<State, LinearList<Transition>> outgoing = new LinearMap<>();
    LinearMap<State, LinearMap<String, LinearList<Transition>>> index = new LinearMap<>();
    for (Transition t : this.transitions) {
      outgoing.getOrCreate(t.from(), LinearList::new).addLast(t);
      index.getOrCreate(t.from(), LinearMap::new).getOrCreate(t.input(), LinearList::new).addLast(t);
    }

    LinearMap<State, IList<Transition>> frozenOutgoing = new LinearMap<>();
    outgoing.forEach(e -> frozenOutgoing.put(e.key(), e.value().forked()));
    this.outgoing = frozenOutgoing.forked();

    LinearMap<State, IMap<String, IList<Transition>>> frozenIndex = new LinearMap<>();
    for (IEntry<State, LinearMap<String, LinearList<Transition>>> e : index) {
      LinearMap<String, IList<Transition>> bySymbol = new LinearMap<>();
      e.value().forEach(s -> bySymbol.put(s.key(), s.value().forked()));
      frozenIndex.put(e.key(), bySymbol.forked());
    }
    this.index = frozenIndex.forked();
  }

  ///

  public Kind kind() {
    return kind;
  }

  public int stateCount() {
    return (int) names.size();
  }

  /**
   * @return every state, in index order
   */
  public IList<State> states() {
    LinearList<State> states = new LinearList<>();
    for (int i = 0; i < stateCount(); i++) {
      states.addLast(State.of(i));
    }
    return states;
  }

  public State start() {
    return start;
  }

  public String name(State state) {
    checkState(state);
    return names.nth(state.id());
  }

  public Optional<State> state(String name) {
    return byName.get(name);
  }

  /**
   * @return the input alphabet, which never contains {@link Symbols#EPSILON}
   */
  public ISet<String> alphabet() {
    return alphabet;
  }

  public boolean isAccepting(State state) {
    return accepting.contains(state);
  }

  public ISet<State> accepting() {
    return accepting;
  }

  public IList<Transition> transitions() {
    return transitions;
  }

  /**
   * @return every transition leaving {@code state}
   */
  public IList<Transition> transitions(State state) {
    checkState(state);
    return outgoing.get(state, NONE);
  }

  /**
   * @return the transitions leaving {@code state} on {@code symbol}, which may be {@link Symbols#EPSILON}
   */
  public IList<Transition> transitions(State state, String symbol) {
    checkState(state);
    String key = Symbols.isEpsilon(symbol) ? Symbols.EPSILON : symbol;
    return index.get(state)
            .flatMap(m -> m.get(key))
            .orElse(NONE);
  }

  public ISet<State> targets(State state, String symbol) {
    return Utils.toSet(transitions(state, symbol).stream().map(Transition::to));
  }

  /**
   * @return the unique transition from {@code state} on {@code symbol}, for deterministic kinds
   */
  public Optional<Transition> transition(State state, String symbol) {
    IList<Transition> ts = transitions(state, symbol);
    return ts.size() == 0 ? Optional.empty() : Optional.of(ts.nth(0));
  }

  public Optional<State> next(State state, String symbol) {
    return transition(state, symbol).map(Transition::to);
  }

  /**
   * @return the states reachable from the start state by following any transition, including ε-transitions
   */
  public ISet<State> reachableStates() {
    LinearSet<State> visited = new LinearSet<>();
    LinearList<State> queue = LinearList.of(start);
    visited.add(start);

    while (queue.size() > 0) {
      State s = queue.popFirst();
      for (Transition t : transitions(s)) {
        if (!visited.contains(t.to())) {
          visited.add(t.to());
          queue.addLast(t.to());
        }
      }
    }

    return visited;
  }

  /**
   * @return true if every state has a transition on every symbol of the alphabet
   */
  public boolean isComplete() {
    for (State s : states()) {
      for (String symbol : alphabet) {
        if (transitions(s, symbol).size() == 0) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * @return whether this DFA declares itself total, so that a missing transition is an error rather than a rejection
   */
  public boolean isTotal() {
    return total;
  }

  /// pushdown

  public ISet<String> stackAlphabet() {
    return stackAlphabet;
  }

  public String initialStackSymbol() {
    return initialStackSymbol;
  }

  public AcceptanceMode acceptance() {
    return acceptance;
  }

  /// Moore

  public Optional<String> output(State state) {
    checkState(state);
    return outputs.get(state);
  }

  /**
   * @return the outputs emitted by a Mealy machine's transitions or attached to a Moore machine's states
   */
  public ISet<String> outputAlphabet() {
    LinearSet<String> result = new LinearSet<>();
    if (kind == Kind.MOORE) {
      outputs.values().forEach(result::add);
    } else {
      transitions.stream()
              .map(Transition::output)
              .filter(Objects::nonNull)
              .forEach(result::add);
    }
    return result;
  }

  ///

  /**
   * Compares two deterministic automata up to state renaming: both must have the same shape when explored in lockstep
   * from their start states.
   */
  public boolean isomorphic(Automaton other) {
    if (!kind.isDeterministic() || kind != other.kind) {
      return kind == other.kind && equals(other);
    }

    if (!Utils.sameMembers(alphabet, other.alphabet)) {
      return false;
    }

    LinearMap<State, State> forward = new LinearMap<>();
    LinearMap<State, State> backward = new LinearMap<>();
    LinearList<State> queue = LinearList.of(start);
    forward.put(start, other.start);
    backward.put(other.start, start);

    while (queue.size() > 0) {
      State a = queue.popFirst();
      State b = forward.get(a).get();

      if (isAccepting(a) != other.isAccepting(b) || !output(a).equals(other.output(b))) {
        return false;
      }

      for (String symbol : alphabet) {
        Optional<Transition> ta = transition(a, symbol);
        Optional<Transition> tb = other.transition(b, symbol);
        if (ta.isPresent() != tb.isPresent()) {
          return false;
        }
        if (!ta.isPresent()) {
          continue;
        }
        if (!Objects.equals(ta.get().output(), tb.get().output())) {
          return false;
        }

        State na = ta.get().to();
        State nb = tb.get().to();
        Optional<State> mapped = forward.get(na);
        if (mapped.isPresent()) {
          if (!mapped.get().equals(nb)) {
            return false;
          }
        } else {
          if (backward.contains(nb)) {
            return false;
          }
          forward.put(na, nb);
          backward.put(nb, na);
          queue.addLast(na);
        }
      }
    }

    return forward.size() == reachableStates().size()
            && backward.size() == other.reachableStates().size();
  }

  /**
   * Structural equality: kind, state indices, start state, accepting states, alphabets, transitions and outputs must
   * all match. State names are not compared.
   */
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Automaton)) {
      return false;
    }
    Automaton a = (Automaton) obj;
    return kind == a.kind
            && stateCount() == a.stateCount()
            && start.equals(a.start)
            && Utils.sameMembers(accepting, a.accepting)
            && Utils.sameMembers(alphabet, a.alphabet)
            && Utils.sameMembers(transitionSet(), a.transitionSet())
            && Utils.sameMembers(stackAlphabet, a.stackAlphabet)
            && Objects.equals(initialStackSymbol, a.initialStackSymbol)
            && acceptance == a.acceptance
            && total == a.total
            && sameOutputs(a);
  }

  @Override
  public int hashCode() {
    int hash = Objects.hash(kind, stateCount(), start);
    for (Transition t : transitionSet()) {
      hash += t.hashCode();
    }
    return hash;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(kind.name()).append("[");
    for (State s : states()) {
      sb.append(s.equals(start) ? "->" : "")
              .append(name(s))
              .append(isAccepting(s) ? "*" : "")
              .append(outputs.get(s).map(o -> "/" + o).orElse(""))
              .append(", ");
    }
    if (stateCount() > 0) {
      sb.delete(sb.length() - 2, sb.length());
    }
    return sb.append("]").toString();
  }

  private ISet<Transition> transitionSet() {
    return Utils.toSet(transitions.stream());
  }

  private boolean sameOutputs(Automaton a) {
    if (outputs.size() != a.outputs.size()) {
      return false;
    }
    for (IEntry<State, String> e : outputs) {
      if (!a.outputs.get(e.key()).map(e.value()::equals).orElse(false)) {
        return false;
      }
    }
    return true;
  }

  private static <V> IList<V> copy(IList<V> list) {
    LinearList<V> result = new LinearList<>();
    list.forEach(result::addLast);
    return result.forked();
  }

  private void checkState(State state) {
    if (state.id() >= names.size()) {
      throw new IllegalArgumentException(state + " does not belong to this automaton");
    }
  }
}

package io.lacuna.fsm.convert;

import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.fsm.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Converts between Mealy machines, which emit on transitions, and Moore machines, which emit on states. Both
 * directions preserve the output produced for every input.
 */
public class MealyMooreConverter {

  private static final Logger LOG = LoggerFactory.getLogger(MealyMooreConverter.class);

  /**
   * the output of the Moore state standing in for the Mealy start state, which nothing has been emitted into yet
   */
  public static final String BLANK = "";

  private MealyMooreConverter() {
  }

  // a Mealy state paired with the output of a transition entering it, or BLANK for the initial entry
  private static final class Entry {
    final State state;
    final String output;
    final boolean initial;

    Entry(State state, String output, boolean initial) {
      this.state = state;
      this.output = output;
      this.initial = initial;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Entry)) {
        return false;
      }
      Entry e = (Entry) obj;
      return state.equals(e.state) && output.equals(e.output) && initial == e.initial;
    }

    @Override
    public int hashCode() {
      return Objects.hash(state, output, initial);
    }
  }

  /**
   * @return a Moore machine with one state per (Mealy state, entering output) pair, named {@code q/o} (or {@code q/o#n}
   * if that name is taken), plus a start
   * state named after the Mealy start state with a {@link #BLANK} output
   */
  public static Automaton mealyToMoore(Automaton mealy) {
    if (mealy.kind() != Kind.MEALY) {
      throw new IllegalArgumentException("expected a Mealy machine, got a " + mealy.kind());
    }

    LinearMap<Entry, String> names = new LinearMap<>();
    LinearList<Entry> order = new LinearList<>();

    Entry start = new Entry(mealy.start(), BLANK, true);
    names.put(start, mealy.name(mealy.start()));
    order.addLast(start);

    AutomatonBuilder builder = new AutomatonBuilder(Kind.MOORE)
            .alphabet(SubsetConstructor.sorted(mealy.alphabet()))
            .start(names.get(start).get());
    builder.state(names.get(start).get());

    for (Transition t : mealy.transitions()) {
      Entry e = new Entry(t.to(), t.output(), false);
      if (!names.contains(e)) {
        // "a" + "b/c" and "a/b" + "c" both read "a/b/c"
        String name = builder.freshName(mealy.name(t.to()) + "/" + t.output());
        builder.state(name);
        names.put(e, name);
        order.addLast(e);
      }
    }

    for (Entry e : order) {
      String name = names.get(e).get();
      builder.output(name, e.output);
      for (Transition t : mealy.transitions(e.state)) {
        builder.transition(name, t.input(), names.get(new Entry(t.to(), t.output(), false)).get());
      }
    }

    Automaton moore = builder.build();
    LOG.debug("converted a {}-state Mealy machine into a {}-state Moore machine",
            mealy.stateCount(), moore.stateCount());
    return moore;
  }

  /**
   * @return a Mealy machine with the same states, whose transitions emit the output of the Moore state they enter
   */
  public static Automaton mooreToMealy(Automaton moore) {
    if (moore.kind() != Kind.MOORE) {
      throw new IllegalArgumentException("expected a Moore machine, got a " + moore.kind());
    }

    AutomatonBuilder builder = new AutomatonBuilder(Kind.MEALY)
            .alphabet(SubsetConstructor.sorted(moore.alphabet()))
            .start(moore.name(moore.start()));

    for (State s : moore.states()) {
      builder.state(moore.name(s));
    }
    for (Transition t : moore.transitions()) {
      builder.transition(moore.name(t.from()), t.input(), moore.name(t.to()), moore.output(t.to()).orElse(BLANK));
    }

    Automaton mealy = builder.build();
    LOG.debug("converted a {}-state Moore machine into a Mealy machine", moore.stateCount());
    return mealy;
  }
}

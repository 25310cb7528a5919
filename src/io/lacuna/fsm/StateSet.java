package io.lacuna.fsm;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearSet;

import java.util.Arrays;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * A canonical, hashable set of states, stored as a sorted array of state indices. Two sets with the same members are
 * equal regardless of how they were assembled.
 */
public final class StateSet {

  public static final StateSet EMPTY = new StateSet(new int[0]);

  private final int[] ids;

  private StateSet(int[] ids) {
    this.ids = ids;
  }

  public static StateSet of(Iterable<State> states) {
    return new StateSet(sortedDistinct(ids(states)));
  }

  public static StateSet of(State... states) {
    return new StateSet(sortedDistinct(Arrays.stream(states).mapToInt(State::id)));
  }

  private static int[] sortedDistinct(IntStream ids) {
    return ids.sorted().distinct().toArray();
  }

  public int size() {
    return ids.length;
  }

  public boolean isEmpty() {
    return ids.length == 0;
  }

  public boolean contains(State state) {
    return Arrays.binarySearch(ids, state.id()) >= 0;
  }

  public boolean containsAny(ISet<State> states) {
    for (int id : ids) {
      if (states.contains(State.of(id))) {
        return true;
      }
    }
    return false;
  }

  public ISet<State> states() {
    LinearSet<State> states = new LinearSet<>();
    for (int id : ids) {
      states.add(State.of(id));
    }
    return states;
  }

  /**
   * @return the members rendered as {@code {a,b,c}}, in index order
   */
  public String describe(Function<State, String> names) {
    return Arrays.stream(ids)
            .mapToObj(id -> names.apply(State.of(id)))
            .collect(Collectors.joining(",", "{", "}"));
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof StateSet && Arrays.equals(ids, ((StateSet) obj).ids);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(ids);
  }

  @Override
  public String toString() {
    return describe(State::toString);
  }

  private static IntStream ids(Iterable<State> states) {
    IntStream.Builder builder = IntStream.builder();
    states.forEach(s -> builder.add(s.id()));
    return builder.build();
  }
}

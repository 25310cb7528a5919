package io.lacuna.fsm;

/**
 * An interned state index. Display names are held by the owning {@link Automaton}, so two states are equal exactly
 * when their indices are.
 */
public final class State implements Comparable<State> {

  private final int id;

  private State(int id) {
    this.id = id;
  }

  public static State of(int id) {
    if (id < 0) {
      throw new IllegalArgumentException("negative state index: " + id);
    }
    return new State(id);
  }

  public int id() {
    return id;
  }

  @Override
  public int compareTo(State o) {
    return Integer.compare(id, o.id);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof State && ((State) obj).id == id;
  }

  @Override
  public int hashCode() {
    return id;
  }

  @Override
  public String toString() {
    return "state(" + id + ")";
  }
}

package io.lacuna.fsm.sim;

import io.lacuna.bifurcan.IList;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * A persistent stack of pushdown symbols. Pushing and popping return new stacks which share structure with the
 * original, so configurations on different branches never see each other's changes.
 */
public final class PdaStack implements Iterable<String> {

  public static final PdaStack EMPTY = new PdaStack(null, null);

  private final String top;
  private final PdaStack rest;
  private final int size;
  private final int hash;

  private PdaStack(String top, PdaStack rest) {
    this.top = top;
    this.rest = rest;
    this.size = rest == null ? 0 : rest.size + 1;
    this.hash = rest == null ? 1 : 31 * rest.hash + top.hashCode();
  }

  /**
   * @return a stack holding {@code symbols}, the last of which is on top
   */
  public static PdaStack of(String... symbols) {
    PdaStack stack = EMPTY;
    for (String s : symbols) {
      stack = stack.push(s);
    }
    return stack;
  }

  public PdaStack push(String symbol) {
    if (symbol == null) {
      throw new IllegalArgumentException("cannot push null");
    }
    return new PdaStack(symbol, this);
  }

  /**
   * @return the stack with every symbol of {@code symbols} pushed in order, so the first ends up deepest
   */
  public PdaStack pushAll(IList<String> symbols) {
    PdaStack stack = this;
    for (String s : symbols) {
      stack = stack.push(s);
    }
    return stack;
  }

  /**
   * @return the stack without its top symbol
   * @throws IllegalStateException if the stack is empty
   */
  public PdaStack pop() {
    if (isEmpty()) {
      throw new IllegalStateException("pop on an empty stack");
    }
    return rest;
  }

  public Optional<String> peek() {
    return Optional.ofNullable(top);
  }

  public boolean isEmpty() {
    return size == 0;
  }

  public int size() {
    return size;
  }

  /**
   * iterates from the top of the stack downwards
   */
  @Override
  public Iterator<String> iterator() {
    return new Iterator<String>() {
      PdaStack current = PdaStack.this;

      @Override
      public boolean hasNext() {
        return !current.isEmpty();
      }

      @Override
      public String next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        String s = current.top;
        current = current.rest;
        return s;
      }
    };
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof PdaStack)) {
      return false;
    }
    PdaStack a = this;
    PdaStack b = (PdaStack) obj;
    if (a.size != b.size || a.hash != b.hash) {
      return false;
    }
    while (a != b && !a.isEmpty()) {
      if (!a.top.equals(b.top)) {
        return false;
      }
      a = a.rest;
      b = b.rest;
    }
    return true;
  }

  @Override
  public int hashCode() {
    return hash;
  }

  /**
   * @return the symbols top first, or {@code ⊥} for the empty stack
   */
  @Override
  public String toString() {
    if (isEmpty()) {
      return "⊥";
    }
    StringBuilder sb = new StringBuilder();
    forEach(sb::append);
    return sb.toString();
  }
}

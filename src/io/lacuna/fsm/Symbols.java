package io.lacuna.fsm;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;

/**
 * Helpers for input symbols, which are atomic strings.
 */
public class Symbols {

  /**
   * the empty-string symbol, used to label transitions that consume no input
   */
  public static final String EPSILON = "ε";

  private Symbols() {
  }

  public static boolean isEpsilon(String symbol) {
    return symbol == null || symbol.isEmpty() || EPSILON.equals(symbol);
  }

  /**
   * @return the input split into one symbol per code point
   */
  public static IList<String> of(String input) {
    LinearList<String> symbols = new LinearList<>();
    input.codePoints().forEach(cp -> symbols.addLast(new String(Character.toChars(cp))));
    return symbols;
  }

  public static String join(Iterable<String> symbols) {
    StringBuilder sb = new StringBuilder();
    symbols.forEach(sb::append);
    return sb.toString();
  }
}

package io.lacuna.fsm.regex;

import java.util.Objects;

/**
 * A node of a parsed regular expression. Literals carry a symbol, {@link Type#STAR} and {@link Type#PLUS} carry one
 * operand in {@link #left()}, and the binary nodes carry two.
 */
public final class RegexNode {

  public enum Type {
    LITERAL,
    EPSILON,
    CONCATENATION,
    UNION,
    STAR,
    PLUS
  }

  private static final RegexNode EPSILON = new RegexNode(Type.EPSILON, null, null, null);

  private final Type type;
  private final String symbol;
  private final RegexNode left, right;

  private RegexNode(Type type, String symbol, RegexNode left, RegexNode right) {
    this.type = type;
    this.symbol = symbol;
    this.left = left;
    this.right = right;
  }

  public static RegexNode literal(String symbol) {
    return new RegexNode(Type.LITERAL, Objects.requireNonNull(symbol), null, null);
  }

  public static RegexNode epsilon() {
    return EPSILON;
  }

  public static RegexNode concat(RegexNode left, RegexNode right) {
    return new RegexNode(Type.CONCATENATION, null, left, right);
  }

  public static RegexNode union(RegexNode left, RegexNode right) {
    return new RegexNode(Type.UNION, null, left, right);
  }

  public static RegexNode star(RegexNode operand) {
    return new RegexNode(Type.STAR, null, operand, null);
  }

  public static RegexNode plus(RegexNode operand) {
    return new RegexNode(Type.PLUS, null, operand, null);
  }

  public Type type() {
    return type;
  }

  public String symbol() {
    return symbol;
  }

  public RegexNode left() {
    return left;
  }

  public RegexNode right() {
    return right;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof RegexNode)) {
      return false;
    }
    RegexNode n = (RegexNode) obj;
    return type == n.type
            && Objects.equals(symbol, n.symbol)
            && Objects.equals(left, n.left)
            && Objects.equals(right, n.right);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, symbol, left, right);
  }

  /**
   * @return a fully parenthesized rendering, e.g. {@code ((a)*.(b)+)}
   */
  @Override
  public String toString() {
    switch (type) {
      case LITERAL:
        return symbol;
      case EPSILON:
        return "ε";
      case CONCATENATION:
        return "(" + left + "." + right + ")";
      case UNION:
        return "(" + left + "|" + right + ")";
      case STAR:
        return "(" + left + ")*";
      case PLUS:
        return "(" + left + ")+";
      default:
        throw new IllegalStateException();
    }
  }
}

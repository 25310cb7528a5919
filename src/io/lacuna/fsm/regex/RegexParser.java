package io.lacuna.fsm.regex;

import io.lacuna.fsm.RegexSyntaxException;

/**
 * A recursive-descent parser for regular expressions over single-character literals.
 * <p>
 * From lowest to highest precedence: alternation with {@code |}, implicit concatenation, the postfix operators
 * {@code *} and {@code +}, and grouping with parentheses. {@code ε} or {@code \e} denotes the empty string, a
 * backslash escapes any other character, and whitespace is ignored.
 */
public class RegexParser {

  private final String regex;
  private int pos = 0;

  private RegexParser(String regex) {
    this.regex = regex;
  }

  /**
   * @return the syntax tree for {@code regex}; the empty expression parses to {@link RegexNode#epsilon()}
   * @throws RegexSyntaxException with the offending position
   */
  public static RegexNode parse(String regex) {
    RegexParser parser = new RegexParser(regex == null ? "" : regex);
    RegexNode node = parser.union();
    if (parser.peek() != -1) {
      // union() only stops early on a closing parenthesis
      throw new RegexSyntaxException("unmatched ')'", parser.pos);
    }
    return node;
  }

  ///

  private RegexNode union() {
    RegexNode node = concat();

    while (peek() == '|') {
      consume();
      RegexNode right = concat();
      if (right == null && peek() == '|') {
        throw new RegexSyntaxException("empty alternative", pos);
      }
      node = RegexNode.union(orEpsilon(node), orEpsilon(right));
    }

    return orEpsilon(node);
  }

  // returns null for an empty sequence
  private RegexNode concat() {
    RegexNode node = null;

    for (int c = peek(); c != -1 && c != '|' && c != ')'; c = peek()) {
      RegexNode next = postfix();
      node = node == null ? next : RegexNode.concat(node, next);
    }

    return node;
  }

  private RegexNode postfix() {
    if (peek() == '*' || peek() == '+') {
      throw new RegexSyntaxException("'" + literal(peek()) + "' has no operand", pos);
    }

    RegexNode node = atom();

    for (int c = peek(); c == '*' || c == '+'; c = peek()) {
      consume();
      node = c == '*' ? RegexNode.star(node) : RegexNode.plus(node);
    }

    return node;
  }

  private RegexNode atom() {
    int start = pos;
    int c = consume();

    switch (c) {
      case '(':
        RegexNode node = union();
        if (peek() != ')') {
          throw new RegexSyntaxException("unmatched '('", start);
        }
        consume();
        return node;
      case 'ε':
        return RegexNode.epsilon();
      case '\\':
        // the escaped character is taken verbatim, whitespace included
        int escaped = raw();
        if (escaped == -1) {
          throw new RegexSyntaxException("dangling '\\'", start);
        }
        return escaped == 'e' ? RegexNode.epsilon() : RegexNode.literal(literal(escaped));
      default:
        return RegexNode.literal(literal(c));
    }
  }

  private static RegexNode orEpsilon(RegexNode node) {
    return node == null ? RegexNode.epsilon() : node;
  }

  ///

  private void skipWhitespace() {
    while (pos < regex.length() && Character.isWhitespace(regex.charAt(pos))) {
      pos++;
    }
  }

  // code points, so that literals split the same way as Symbols.of() splits input
  private int peek() {
    skipWhitespace();
    return pos < regex.length() ? regex.codePointAt(pos) : -1;
  }

  private int consume() {
    skipWhitespace();
    return raw();
  }

  private int raw() {
    if (pos >= regex.length()) {
      return -1;
    }
    int c = regex.codePointAt(pos);
    pos += Character.charCount(c);
    return c;
  }

  private static String literal(int codePoint) {
    return new String(Character.toChars(codePoint));
  }
}

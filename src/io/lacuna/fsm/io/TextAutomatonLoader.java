package io.lacuna.fsm.io;

import io.lacuna.bifurcan.LinearList;
import io.lacuna.fsm.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Reads a finite automaton from a line-oriented description:
 *
 * <pre>
 * type: DFA
 * states: q0, q1, q2
 * alphabet: a, b
 * start: q0
 * accept: q2
 * transitions:
 * q0, a -> q1
 * q1, b -> q2
 * </pre>
 *
 * Blank lines and lines starting with {@code #} are ignored. Only DFAs, NFAs and ε-NFAs can be described this way.
 */
public class TextAutomatonLoader {

  private static final Logger LOG = LoggerFactory.getLogger(TextAutomatonLoader.class);

  private TextAutomatonLoader() {
  }

  /**
   * @throws MalformedAutomatonException naming the offending line, or the first validation failure
   */
  public static Automaton load(String text) {
    String type = null;
    String[] states = new String[0];
    String[] alphabet = new String[0];
    String[] accept = new String[0];
    String start = null;
    LinearList<String[]> transitions = new LinearList<>();
    boolean inTransitions = false;

    String[] lines = text.split("\\R");
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i].trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }

      String header = line.toLowerCase(Locale.ROOT);
      if (header.startsWith("type:")) {
        type = value(line);
      } else if (header.startsWith("states:")) {
        states = list(value(line));
      } else if (header.startsWith("alphabet:")) {
        alphabet = list(value(line));
      } else if (header.startsWith("start:")) {
        start = value(line);
      } else if (header.startsWith("accept:")) {
        accept = list(value(line));
      } else if (header.startsWith("transitions:")) {
        inTransitions = true;
      } else if (inTransitions && line.contains("->")) {
        transitions.addLast(transition(line, i + 1));
      } else {
        throw new MalformedAutomatonException("line " + (i + 1) + ": unrecognized '" + line + "'");
      }
    }

    if (type == null) {
      throw new MalformedAutomatonException("automaton type not specified");
    }
    Kind kind = JsonAutomatonLoader.kind(type);
    if (kind != Kind.DFA && kind != Kind.NFA && kind != Kind.ENFA) {
      throw new MalformedAutomatonException("text descriptions support DFA, NFA and ENFA, not " + kind);
    }

    AutomatonBuilder builder = new AutomatonBuilder(kind);
    for (String s : states) {
      if (!builder.hasState(s)) {
        builder.state(s);
      }
    }
    for (String symbol : alphabet) {
      if (!Symbols.isEpsilon(symbol)) {
        builder.symbol(symbol);
      }
    }
    if (start != null) {
      builder.start(start);
    }
    builder.accept(accept);
    for (String[] t : transitions) {
      builder.transition(t[0], t[1], t[2]);
    }

    Automaton automaton = builder.build();
    LOG.debug("loaded {}", automaton);
    return automaton;
  }

  ///

  private static String value(String line) {
    return line.substring(line.indexOf(':') + 1).trim();
  }

  private static String[] list(String value) {
    if (value.isEmpty()) {
      return new String[0];
    }
    String[] items = value.split(",");
    for (int i = 0; i < items.length; i++) {
      items[i] = items[i].trim();
    }
    return items;
  }

  // "from, symbol -> to"
  private static String[] transition(String line, int lineNumber) {
    int arrow = line.indexOf("->");
    String source = line.substring(0, arrow).trim();
    String to = line.substring(arrow + 2).trim();
    int comma = source.indexOf(',');
    if (comma < 0 || to.isEmpty()) {
      throw new MalformedAutomatonException("line " + lineNumber + ": invalid transition '" + line + "'");
    }
    return new String[] {source.substring(0, comma).trim(), source.substring(comma + 1).trim(), to};
  }
}

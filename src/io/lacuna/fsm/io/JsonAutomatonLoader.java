package io.lacuna.fsm.io;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.fsm.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Reads an automaton from its JSON description:
 *
 * <pre>
 * { "type": "DFA", "states": ["q0", "q1"], "alphabet": ["0", "1"],
 *   "start_state": "q0", "accept_states": ["q1"],
 *   "transitions": [ {"from": "q0", "symbol": "0", "to": "q1"} ] }
 * </pre>
 *
 * Pushdown transitions use {@code input}, {@code pop} and {@code push} in place of {@code symbol}, and Mealy
 * transitions carry an {@code output}. A missing {@code type} means DFA, and an ε-NFA transition without a
 * {@code symbol} is an ε-transition. A DFA with {@code "total": true} must define every transition, and running it on a
 * symbol it has no transition for is an error rather than a rejection.
 */
public class JsonAutomatonLoader {

  private static final Logger LOG = LoggerFactory.getLogger(JsonAutomatonLoader.class);

  private JsonAutomatonLoader() {
  }

  /**
   * @throws MalformedAutomatonException if {@code json} is not valid JSON, lacks a required field, or describes an
   * automaton that fails validation
   */
  public static Automaton load(String json) {
    JsonObject root;
    try {
      root = JsonParser.parseString(json).getAsJsonObject();
    } catch (JsonParseException | IllegalStateException e) {
      throw new MalformedAutomatonException("invalid JSON: " + e.getMessage(), e);
    }

    try {
      Automaton automaton = load(root);
      LOG.debug("loaded {}", automaton);
      return automaton;
    } catch (JsonParseException | IllegalStateException | UnsupportedOperationException | ClassCastException e) {
      throw new MalformedAutomatonException("invalid automaton description: " + e.getMessage(), e);
    }
  }

  static Kind kind(String type) {
    switch (type.toUpperCase(Locale.ROOT)) {
      case "DFA":
        return Kind.DFA;
      case "NFA":
        return Kind.NFA;
      case "ENFA":
      case "EPSILON-NFA":
        return Kind.ENFA;
      case "PDA":
        return Kind.PDA;
      case "MEALY":
        return Kind.MEALY;
      case "MOORE":
        return Kind.MOORE;
      default:
        throw new MalformedAutomatonException("unknown automaton type '" + type + "'");
    }
  }

  private static Automaton load(JsonObject root) {
    Kind kind = root.has("type") ? kind(root.get("type").getAsString()) : Kind.DFA;
    AutomatonBuilder builder = new AutomatonBuilder(kind);

    for (JsonElement state : array(root, "states")) {
      if (!builder.hasState(state.getAsString())) {
        builder.state(state.getAsString());
      }
    }
    for (JsonElement symbol : array(root, "alphabet")) {
      if (!Symbols.isEpsilon(symbol.getAsString())) {
        builder.symbol(symbol.getAsString());
      }
    }
    builder.start(string(root, "start_state"));
    if (root.has("accept_states")) {
      for (JsonElement state : root.getAsJsonArray("accept_states")) {
        builder.accept(state.getAsString());
      }
    }

    if (root.has("total")) {
      builder.total(root.get("total").getAsBoolean());
    }
    if (kind == Kind.PDA) {
      pushdown(root, builder);
    }
    if (kind == Kind.MOORE && root.has("outputs")) {
      for (Map.Entry<String, JsonElement> e : root.getAsJsonObject("outputs").entrySet()) {
        builder.output(e.getKey(), e.getValue().getAsString());
      }
    }

    for (JsonElement element : array(root, "transitions")) {
      JsonObject t = element.getAsJsonObject();
      String from = string(t, "from");
      String to = string(t, "to");
      switch (kind) {
        case PDA:
          builder.pushdown(from, optional(t, "input"), optional(t, "pop"), to, strings(t, "push"));
          break;
        case MEALY:
          builder.transition(from, string(t, "symbol"), to, string(t, "output"));
          break;
        case ENFA:
          builder.transition(from, optional(t, "symbol"), to);
          break;
        default:
          builder.transition(from, string(t, "symbol"), to);
      }
    }

    return builder.build();
  }

  private static void pushdown(JsonObject root, AutomatonBuilder builder) {
    if (root.has("stack_alphabet")) {
      builder.stackAlphabet(strings(root, "stack_alphabet"));
    }
    if (root.has("start_stack_symbol")) {
      builder.initialStackSymbol(string(root, "start_stack_symbol"));
    }
    if (root.has("acceptance")) {
      String mode = string(root, "acceptance");
      switch (mode.toLowerCase(Locale.ROOT)) {
        case "final_state":
          builder.acceptance(AcceptanceMode.FINAL_STATE);
          break;
        case "empty_stack":
          builder.acceptance(AcceptanceMode.EMPTY_STACK);
          break;
        default:
          throw new MalformedAutomatonException("unknown acceptance mode '" + mode + "'");
      }
    }
  }

  ///

  private static JsonArray array(JsonObject obj, String field) {
    if (!obj.has(field)) {
      throw new MalformedAutomatonException("missing field '" + field + "'");
    }
    return obj.getAsJsonArray(field);
  }

  private static String string(JsonObject obj, String field) {
    if (!obj.has(field) || obj.get(field).isJsonNull()) {
      throw new MalformedAutomatonException("missing field '" + field + "'");
    }
    return obj.get(field).getAsString();
  }

  private static String optional(JsonObject obj, String field) {
    return obj.has(field) && !obj.get(field).isJsonNull() ? obj.get(field).getAsString() : Symbols.EPSILON;
  }

  private static Iterable<String> strings(JsonObject obj, String field) {
    LinearList<String> result = new LinearList<>();
    if (obj.has(field)) {
      obj.getAsJsonArray(field).forEach(e -> result.addLast(e.getAsString()));
    }
    return result;
  }
}

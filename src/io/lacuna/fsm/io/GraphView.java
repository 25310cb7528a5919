package io.lacuna.fsm.io;

import io.lacuna.bifurcan.*;
import io.lacuna.fsm.Automaton;
import io.lacuna.fsm.State;
import io.lacuna.fsm.Transition;
import io.lacuna.fsm.sim.Configuration;

import java.util.Optional;

/**
 * A renderer-independent picture of an automaton: one node per state and one edge per connected pair of states, with
 * the labels of every transition between them. Given a configuration, the active states and the transitions taken to
 * reach it are highlighted.
 */
public final class GraphView {

  public static final class Node {
    private final String name;
    private final boolean start, accepting, highlighted;
    private final String output;

    Node(String name, boolean start, boolean accepting, String output, boolean highlighted) {
      this.name = name;
      this.start = start;
      this.accepting = accepting;
      this.output = output;
      this.highlighted = highlighted;
    }

    public String name() {
      return name;
    }

    public boolean isStart() {
      return start;
    }

    public boolean isAccepting() {
      return accepting;
    }

    /**
     * @return the output of a Moore state
     */
    public Optional<String> output() {
      return Optional.ofNullable(output);
    }

    public boolean isHighlighted() {
      return highlighted;
    }

    @Override
    public String toString() {
      return (start ? "->" : "") + name + (accepting ? "*" : "") + (highlighted ? "!" : "");
    }
  }

  public static final class Edge {
    private final String from, to;
    private final IList<String> labels;
    private final boolean highlighted;

    Edge(String from, String to, IList<String> labels, boolean highlighted) {
      this.from = from;
      this.to = to;
      this.labels = labels;
      this.highlighted = highlighted;
    }

    public String from() {
      return from;
    }

    public String to() {
      return to;
    }

    public IList<String> labels() {
      return labels;
    }

    /**
     * @return the transition labels joined by {@code ", "}
     */
    public String label() {
      return String.join(", ", labels);
    }

    public boolean isHighlighted() {
      return highlighted;
    }

    @Override
    public String toString() {
      return from + " --" + label() + "--> " + to;
    }
  }

  private final IList<Node> nodes;
  private final IList<Edge> edges;

  private GraphView(IList<Node> nodes, IList<Edge> edges) {
    this.nodes = nodes;
    this.edges = edges;
  }

  public static GraphView of(Automaton automaton) {
    return build(automaton, new LinearSet<>(), new LinearSet<>());
  }

  /**
   * @return a view highlighting the states active in {@code config} and the transitions that led to it
   */
  public static GraphView of(Automaton automaton, Configuration config) {
    LinearSet<Transition> taken = new LinearSet<>();
    config.taken().forEach(taken::add);
    LinearSet<State> active = new LinearSet<>();
    config.activeStates().forEach(active::add);
    return build(automaton, active, taken);
  }

  private static GraphView build(Automaton automaton, ISet<State> active, ISet<Transition> taken) {
    LinearList<Node> nodes = new LinearList<>();
    for (State s : automaton.states()) {
      nodes.addLast(new Node(
              automaton.name(s),
              s.equals(automaton.start()),
              automaton.isAccepting(s),
              automaton.output(s).orElse(null),
              active.contains(s)));
    }

    // edges appear in order of their first transition
    LinearList<String> order = new LinearList<>();
    LinearMap<String, LinearList<Transition>> groups = new LinearMap<>();
    for (Transition t : automaton.transitions()) {
      String key = t.from().id() + "->" + t.to().id();
      if (!groups.contains(key)) {
        order.addLast(key);
      }
      groups.getOrCreate(key, LinearList::new).addLast(t);
    }

    LinearList<Edge> edges = new LinearList<>();
    for (String key : order) {
      IList<Transition> group = groups.get(key).get();
      LinearList<String> labels = new LinearList<>();
      boolean highlighted = false;
      for (Transition t : group) {
        labels.addLast(t.label());
        highlighted |= taken.contains(t);
      }
      edges.addLast(new Edge(
              automaton.name(group.nth(0).from()),
              automaton.name(group.nth(0).to()),
              labels.forked(),
              highlighted));
    }

    return new GraphView(nodes.forked(), edges.forked());
  }

  public IList<Node> nodes() {
    return nodes;
  }

  public IList<Edge> edges() {
    return edges;
  }

  public Optional<Node> node(String name) {
    return nodes.stream().filter(n -> n.name.equals(name)).findFirst();
  }

  public Optional<Edge> edge(String from, String to) {
    return edges.stream().filter(e -> e.from.equals(from) && e.to.equals(to)).findFirst();
  }
}

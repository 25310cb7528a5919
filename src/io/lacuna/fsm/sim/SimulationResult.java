package io.lacuna.fsm.sim;

import io.lacuna.bifurcan.IList;

/**
 * The outcome of a complete run, with one configuration snapshot per step starting from the initial configuration.
 */
public final class SimulationResult {

  private final Verdict verdict;
  private final IList<Configuration> trace;
  private final long steps;

  SimulationResult(Verdict verdict, IList<Configuration> trace, long steps) {
    this.verdict = verdict;
    this.trace = trace;
    this.steps = steps;
  }

  public Verdict verdict() {
    return verdict;
  }

  public boolean accepted() {
    return verdict == Verdict.ACCEPT;
  }

  /**
   * @return the outputs emitted by a transducer, one per consumed symbol; empty for acceptors
   */
  public IList<String> outputs() {
    return last().outputs();
  }

  public IList<Configuration> trace() {
    return trace;
  }

  public Configuration last() {
    return trace.nth(trace.size() - 1);
  }

  /**
   * @return how many configurations were expanded; for deterministic runs, the number of consumed symbols
   */
  public long steps() {
    return steps;
  }

  @Override
  public String toString() {
    return verdict + " after " + steps + " steps: " + last();
  }
}

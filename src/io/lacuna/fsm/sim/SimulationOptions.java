package io.lacuna.fsm.sim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Tunables for {@link SimulationEngine}. Defaults come from the classpath resource {@code fsm.properties}, and any
 * JVM system property with the same key takes precedence.
 */
public final class SimulationOptions {

  private static final Logger LOG = LoggerFactory.getLogger(SimulationOptions.class);

  public static final String RESOURCE = "fsm.properties";
  public static final String MAX_STEPS = "fsm.simulation.max-steps";
  public static final String REQUIRE_TOTAL = "fsm.simulation.require-total";

  static final long FALLBACK_MAX_STEPS = 10_000;

  private static final SimulationOptions DEFAULTS = load();

  private final long maxSteps;
  private final boolean requireTotal;

  private SimulationOptions(long maxSteps, boolean requireTotal) {
    if (maxSteps <= 0) {
      throw new IllegalArgumentException("maxSteps must be positive, was " + maxSteps);
    }
    this.maxSteps = maxSteps;
    this.requireTotal = requireTotal;
  }

  public static SimulationOptions defaults() {
    return DEFAULTS;
  }

  /**
   * @return the maximum number of configurations a pushdown run may expand before giving up
   */
  public long maxSteps() {
    return maxSteps;
  }

  /**
   * @return whether a missing DFA transition is an error rather than a rejection, even for DFAs not declared total
   */
  public boolean requireTotal() {
    return requireTotal;
  }

  public SimulationOptions withMaxSteps(long maxSteps) {
    return new SimulationOptions(maxSteps, requireTotal);
  }

  public SimulationOptions withRequireTotal(boolean requireTotal) {
    return new SimulationOptions(maxSteps, requireTotal);
  }

  @Override
  public String toString() {
    return "SimulationOptions[maxSteps=" + maxSteps + ", requireTotal=" + requireTotal + "]";
  }

  ///

  static SimulationOptions load() {
    Properties properties = new Properties();
    try (InputStream in = SimulationOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in != null) {
        properties.load(in);
      } else {
        LOG.debug("no {} on the classpath, using built-in defaults", RESOURCE);
      }
    } catch (IOException e) {
      LOG.warn("could not read {}, using built-in defaults", RESOURCE, e);
    }
    return fromProperties(properties, System.getProperties());
  }

  static SimulationOptions fromProperties(Properties resource, Properties overrides) {
    String maxSteps = overrides.getProperty(MAX_STEPS, resource.getProperty(MAX_STEPS));
    String requireTotal = overrides.getProperty(REQUIRE_TOTAL, resource.getProperty(REQUIRE_TOTAL));

    SimulationOptions options = new SimulationOptions(
            maxSteps == null ? FALLBACK_MAX_STEPS : parseLong(MAX_STEPS, maxSteps.trim()),
            requireTotal != null && Boolean.parseBoolean(requireTotal.trim()));
    LOG.debug("loaded {}", options);
    return options;
  }

  private static long parseLong(String key, String value) {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("'" + key + "' must be an integer, was '" + value + "'", e);
    }
  }
}

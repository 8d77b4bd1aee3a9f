package hdlopt.ui;

import java.io.InputStream;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;

/**
 * Data-Class to hold optimizer options.
 */
public class OptimizerConfig {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Cap on the rounds of every fixpoint loop; exceeding it is a NonConvergenceError. */
  public int max_iterations = 1000;
  /** Inline all instances into the top module before the final optimization rounds. */
  public boolean flatten = false;
  public boolean inline_wires = true;

  /** Report AmbiguousCaseOverlap as error instead of warning. */
  public boolean strict_case_overlap = false;
  public boolean warnings_as_errors = false;

  /** Modules optimized concurrently before flattening; 1 optimizes them one after the other. */
  public int worker_threads = 1;
  public int max_paths_per_signal = 4096;

  /**
   * Reads options from a YAML mapping. Keys not listed are ignored with a warning, missing keys keep their defaults.
   * @throws IllegalArgumentException if the document is not a mapping or a value has the wrong type
   */
  public static OptimizerConfig load(InputStream yamlStream) {
    Object document = new Yaml().load(yamlStream);
    OptimizerConfig config = new OptimizerConfig();
    if (document == null)
      return config;
    if (!(document instanceof Map))
      throw new IllegalArgumentException("optimizer configuration must be a YAML mapping");
    for (Map.Entry<?, ?> setting : ((Map<?, ?>)document).entrySet()) {
      String key = setting.getKey().toString();
      Object value = setting.getValue();
      switch (key) {
      case "max_iterations":
        config.max_iterations = positiveInt(key, value);
        break;
      case "flatten":
        config.flatten = bool(key, value);
        break;
      case "inline_wires":
        config.inline_wires = bool(key, value);
        break;
      case "strict_case_overlap":
        config.strict_case_overlap = bool(key, value);
        break;
      case "warnings_as_errors":
        config.warnings_as_errors = bool(key, value);
        break;
      case "worker_threads":
        config.worker_threads = positiveInt(key, value);
        break;
      case "max_paths_per_signal":
        config.max_paths_per_signal = positiveInt(key, value);
        break;
      default:
        logger.warn("Ignoring unknown optimizer option {}", key);
      }
    }
    return config;
  }

  private static int positiveInt(String key, Object value) {
    if (!(value instanceof Integer) || (Integer)value < 1)
      throw new IllegalArgumentException("option " + key + " must be a positive integer, got " + value);
    return (Integer)value;
  }

  private static boolean bool(String key, Object value) {
    if (!(value instanceof Boolean))
      throw new IllegalArgumentException("option " + key + " must be true or false, got " + value);
    return (Boolean)value;
  }
}

package ca.gc.cra.tide.config;

import ca.gc.cra.tide.validation.Numbers;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Cadence and run settings for the ingestion loop.
 * <p><strong>Why:</strong> Keeps CLI parsing separate from the loop so tests can drive it with tiny intervals.</p>
 *
 * @param configPath connection configuration file
 * @param batchSize readings per append
 * @param readingInterval pause between readings inside a batch
 * @param batchInterval pause after each batch
 * @param maxBatches successful batches before stopping; {@code 0} runs until cancelled
 * @param statsEvery successful batches between statistics summaries; {@code 0} disables periodic summaries
 * @param waitForCommit whether to wait for the final offset to commit before exiting
 * @param commitTimeout bound on the final commit wait
 * @param simulate whether to use the simulated sensor
 * @since 0.1.0
 */
public record LoopConfig(
    Path configPath,
    int batchSize,
    Duration readingInterval,
    Duration batchInterval,
    long maxBatches,
    int statsEvery,
    boolean waitForCommit,
    Duration commitTimeout,
    boolean simulate) {

  public static final Path DEFAULT_CONFIG_PATH = Path.of("snowflake_config.json");
  public static final int DEFAULT_BATCH_SIZE = 10;
  public static final double DEFAULT_BATCH_INTERVAL_SECONDS = 5.0d;
  public static final double DEFAULT_READING_INTERVAL_SECONDS = 0.5d;
  public static final int DEFAULT_STATS_EVERY = 10;
  public static final double DEFAULT_COMMIT_TIMEOUT_SECONDS = 60d;

  private static final int MAX_BATCH_SIZE = 10_000;
  private static final double MAX_INTERVAL_SECONDS = 86_400d;

  public LoopConfig {
    Objects.requireNonNull(configPath, "configPath");
    Objects.requireNonNull(readingInterval, "readingInterval");
    Objects.requireNonNull(batchInterval, "batchInterval");
    Objects.requireNonNull(commitTimeout, "commitTimeout");
    Numbers.requireRange("batchSize", batchSize, 1, MAX_BATCH_SIZE);
    Numbers.requireRange("maxBatches", maxBatches, 0, Long.MAX_VALUE);
    Numbers.requireRange("statsEvery", statsEvery, 0, Integer.MAX_VALUE);
    if (readingInterval.isNegative() || batchInterval.isNegative() || commitTimeout.isNegative()) {
      throw new IllegalArgumentException("intervals must not be negative");
    }
  }

  /**
   * Settings used when no arguments are given.
   *
   * @return default loop configuration
   */
  public static LoopConfig defaults() {
    return fromMap(Map.of(), true);
  }

  /**
   * Builds loop settings from CLI {@code key=value} pairs.
   *
   * @param args argument map; must not be {@code null}
   * @param simulate whether the simulated sensor was requested
   * @return validated settings
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static LoopConfig fromMap(Map<String, String> args, boolean simulate) {
    Objects.requireNonNull(args, "args");
    Path configPath = args.containsKey("config") ? Path.of(args.get("config")) : DEFAULT_CONFIG_PATH;
    int batchSize = (int) Numbers.requireRange(
        "batchSize", parseLong(args, "batchSize", DEFAULT_BATCH_SIZE), 1, MAX_BATCH_SIZE);
    Duration readingInterval = seconds(args, "readingInterval", DEFAULT_READING_INTERVAL_SECONDS);
    Duration batchInterval = seconds(args, "batchInterval", DEFAULT_BATCH_INTERVAL_SECONDS);
    long maxBatches = parseLong(args, "maxBatches", 0);
    int statsEvery = (int) Numbers.requireRange(
        "statsEvery", parseLong(args, "statsEvery", DEFAULT_STATS_EVERY), 0, Integer.MAX_VALUE);
    boolean waitForCommit = Boolean.parseBoolean(args.getOrDefault("waitForCommit", "false"));
    Duration commitTimeout = seconds(args, "commitTimeout", DEFAULT_COMMIT_TIMEOUT_SECONDS);
    return new LoopConfig(configPath, batchSize, readingInterval, batchInterval, maxBatches,
        statsEvery, waitForCommit, commitTimeout, simulate);
  }

  private static long parseLong(Map<String, String> args, String key, long defaultValue) {
    String raw = args.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static Duration seconds(Map<String, String> args, String key, double defaultSeconds) {
    String raw = args.get(key);
    double value = defaultSeconds;
    if (raw != null && !raw.isBlank()) {
      try {
        value = Double.parseDouble(raw.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(key + " must be a number of seconds (was " + raw + ")", ex);
      }
    }
    Numbers.requireRange(key, value, 0d, MAX_INTERVAL_SECONDS);
    return Duration.ofNanos(Math.round(value * 1_000_000_000d));
  }
}

package ca.gc.cra.vantage.config;

import ca.gc.cra.vantage.validation.Numbers;
import ca.gc.cra.vantage.validation.Paths;
import ca.gc.cra.vantage.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed settings shared by the {@code resolve} and {@code watch} commands.
 * <p><strong>Role:</strong> Built from the merged map produced by {@link ConfigMerger}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param topology readable topology snapshot file
 * @param agents readable agent registry file
 * @param out plan output file, or {@code "-"} for stdout
 * @param refreshInterval delay between watch cycles
 * @param cycles watch cycles to run before exiting; {@code 0} runs until interrupted
 * @param metricsExporter {@code otlp} or {@code none}
 * @param otelEndpoint OTLP endpoint override; empty when unset
 * @param otelResourceAttributes extra resource attributes; empty when unset
 * @param verbose whether DEBUG logging was requested
 * @since 0.1.0
 */
public record ResolverConfig(
    Path topology,
    Path agents,
    String out,
    Duration refreshInterval,
    long cycles,
    String metricsExporter,
    String otelEndpoint,
    String otelResourceAttributes,
    boolean verbose) {
  /** Default watch cadence in seconds. */
  public static final long DEFAULT_REFRESH_SECONDS = 60;
  /** Longest accepted watch cadence in seconds (one day). */
  public static final long MAX_REFRESH_SECONDS = 86_400;

  public ResolverConfig {
    Objects.requireNonNull(topology, "topology");
    Objects.requireNonNull(agents, "agents");
    out = out == null || out.isBlank() ? "-" : out.trim();
    Objects.requireNonNull(refreshInterval, "refreshInterval");
    metricsExporter = metricsExporter == null ? "none" : metricsExporter;
    otelEndpoint = otelEndpoint == null ? "" : otelEndpoint;
    otelResourceAttributes = otelResourceAttributes == null ? "" : otelResourceAttributes;
  }

  /**
   * Parses and validates flattened settings.
   *
   * @param options merged settings
   * @return typed configuration
   * @throws IllegalArgumentException when a value is missing, malformed, or out of range, or an input file is
   *     not readable
   */
  public static ResolverConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path topology = Paths.requireReadableFile("topology", options.get("topology"));
    Path agents = Paths.requireReadableFile("agents", options.get("agents"));
    long intervalSeconds = Numbers.requireRange(
        "refreshIntervalSeconds",
        Numbers.parseLong("refreshIntervalSeconds", options.get("refreshIntervalSeconds"), DEFAULT_REFRESH_SECONDS),
        1,
        MAX_REFRESH_SECONDS);
    long cycles = Numbers.requireRange(
        "cycles", Numbers.parseLong("cycles", options.get("cycles"), 0), 0, Long.MAX_VALUE);
    String exporter = blankToDefault(options.get("metricsExporter"), "none").toLowerCase(Locale.ROOT);
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    String out = blankToDefault(options.get("out"), "-");
    if (!out.equals("-")) {
      Strings.requireNonBlank("out", out);
    }
    return new ResolverConfig(
        topology,
        agents,
        out,
        Duration.ofSeconds(intervalSeconds),
        cycles,
        exporter,
        blankToDefault(options.get("otelEndpoint"), ""),
        blankToDefault(options.get("otelResourceAttributes"), ""),
        Strings.parseBoolean("verbose", options.get("verbose"), false));
  }

  /** @return {@code true} when plans go to standard output */
  public boolean writesToStdout() {
    return "-".equals(out);
  }

  private static String blankToDefault(String value, String defaultValue) {
    return value == null || value.isBlank() ? defaultValue : value.trim();
  }
}

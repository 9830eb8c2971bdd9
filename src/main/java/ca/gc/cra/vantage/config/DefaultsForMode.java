package ca.gc.cra.vantage.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Embedded defaults for each CLI mode, flattened like {@link YamlConfigLoader} output.
 */
public final class DefaultsForMode {
  /** Mode running a single resolution cycle. */
  public static final String RESOLVE = "resolve";
  /** Mode running the periodic refresh driver. */
  public static final String WATCH = "watch";

  private DefaultsForMode() {}

  /**
   * Returns the defaults of {@code mode} merged over the common defaults.
   *
   * @param mode {@code resolve} or {@code watch}
   * @return unmodifiable default key/value pairs
   * @throws IllegalArgumentException for unknown modes
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("topology", "");
    defaults.put("agents", "");
    defaults.put("out", "-");
    defaults.put("metricsExporter", "none");
    defaults.put("otelEndpoint", "");
    defaults.put("otelResourceAttributes", "");
    defaults.put("verbose", "false");
    switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case RESOLVE -> {
        // single cycle; no scheduling keys
      }
      case WATCH -> {
        defaults.put("refreshIntervalSeconds", Long.toString(ResolverConfig.DEFAULT_REFRESH_SECONDS));
        defaults.put("cycles", "0");
      }
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    return Map.copyOf(defaults);
  }
}

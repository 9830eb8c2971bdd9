package ca.gc.cra.vantage.api;

import java.util.Map;

/**
 * Helpers shared by the commands for mixing CLI flags with map-based configuration.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} (or {@code --config}) entry.
   *
   * @param args mutable CLI map
   * @return trimmed path, or {@code null} when absent or blank
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String found = null;
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (found == null && value != null && !value.isBlank()) {
        found = value.trim();
      }
    }
    return found;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}

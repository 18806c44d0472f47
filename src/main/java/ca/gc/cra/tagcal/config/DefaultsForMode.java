package ca.gc.cra.tagcal.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each TAGCAL CLI mode.
 *
 * <p>The defaults are the single source of truth for optional keys; required keys ({@code in}, {@code refs})
 * are deliberately absent.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = Map.of(
      "metricsExporter", "otlp",
      "otelEndpoint", "",
      "otelResourceAttributes", "",
      "verbose", "false");

  private DefaultsForMode() {}

  /**
   * Returns the defaults of one mode merged with the common defaults.
   *
   * @param mode {@code calibrate} or {@code refcheck}
   * @return unmodifiable map of defaults
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "calibrate" -> {
        defaults.put("out", ".");
        defaults.put("stimLog", "");
        defaults.put("livetimeLog", "");
        defaults.put("csum", "false");
        defaults.put("randSeed", "");
        defaults.put("allowOverwrite", "false");
        defaults.put("dryRun", "false");
      }
      case "refcheck" -> defaults.put("metricsExporter", "none");
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    return Map.copyOf(defaults);
  }
}

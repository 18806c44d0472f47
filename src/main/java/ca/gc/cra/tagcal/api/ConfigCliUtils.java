package ca.gc.cra.tagcal.api;

import ca.gc.cra.tagcal.config.ConfigMerger;
import ca.gc.cra.tagcal.config.DefaultsForMode;
import ca.gc.cra.tagcal.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Shared steps of the commands: locating the YAML file and merging it with defaults and CLI arguments.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} argument.
   *
   * @param args mutable CLI map
   * @return trimmed path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Builds the effective settings of a mode.
   *
   * @param mode CLI mode
   * @param configPath YAML path, or {@code null}
   * @param cli CLI overrides
   * @param warn receives CLI-over-YAML override notices
   * @return merged flat map
   * @throws IOException when the YAML file cannot be read
   * @throws IllegalArgumentException when the YAML file is missing or invalid, or the merge fails validation
   */
  static Map<String, String> effectiveConfig(
      String mode, String configPath, Map<String, String> cli, Consumer<String> warn) throws IOException {
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), warn);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    String value = map == null ? null : map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}

package ca.gc.cra.tagcal.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads TAGCAL configuration from YAML, merging the {@code common} section with the section of the active mode.
 *
 * <p>Nested mappings flatten to dotted keys, so
 * <pre>
 * calibrate:
 *   switch:
 *     doppcorr: OMIT
 * </pre>
 * becomes {@code switch.doppcorr=OMIT}.</p>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads the flattened settings of one mode.
   *
   * @param path location of the YAML configuration
   * @param mode CLI mode ({@code calibrate}, {@code refcheck})
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      if (!(document instanceof Map<?, ?> root)) {
        throw new IllegalArgumentException("configuration root must be a mapping");
      }
      Map<String, String> flattened = new LinkedHashMap<>();
      Object common = section(root, "common");
      if (common != null) {
        flatten(common, "common", "", flattened);
      }
      Object modeSection = section(root, normalizedMode);
      if (modeSection != null) {
        flatten(modeSection, normalizedMode, "", flattened);
      }
      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Object section(Map<?, ?> root, String name) {
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      if (entry.getKey() instanceof String key && key.trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Object node, String context, String prefix, Map<String, String> target) {
    if (!(node instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?>) {
        flatten(value, composite, composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}

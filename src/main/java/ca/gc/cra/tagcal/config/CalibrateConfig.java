package ca.gc.cra.tagcal.config;

import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Settings of one {@code calibrate} invocation.
 * <p><strong>Why:</strong> Collects the flat CLI/YAML/default map into typed values once, so the composition root and
 * the pipeline never parse strings.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param input exposure JSON document
 * @param references reference-table YAML document
 * @param outputDirectory product directory
 * @param stimLog stim diagnostic log destination, when requested
 * @param livetimeLog livetime diagnostic log destination, when requested
 * @param csum whether to write the cumulative-sum image
 * @param randomSeed randomization seed overriding the exposure header
 * @param switchOverrides switch requests overriding the exposure's own ({@code switch.<correction>} keys)
 * @param allowOverwrite whether a non-empty output directory may be reused
 * @param dryRun print the plan without calibrating
 * @since 0.1.0
 */
public record CalibrateConfig(
    Path input,
    Path references,
    Path outputDirectory,
    Optional<Path> stimLog,
    Optional<Path> livetimeLog,
    boolean csum,
    OptionalLong randomSeed,
    Map<Correction, SwitchState> switchOverrides,
    boolean allowOverwrite,
    boolean dryRun) {

  private static final String SWITCH_PREFIX = "switch.";

  public CalibrateConfig {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(references, "references");
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    stimLog = Objects.requireNonNullElse(stimLog, Optional.empty());
    livetimeLog = Objects.requireNonNullElse(livetimeLog, Optional.empty());
    randomSeed = Objects.requireNonNullElse(randomSeed, OptionalLong.empty());
    switchOverrides = switchOverrides == null ? Map.of() : Map.copyOf(switchOverrides);
  }

  /**
   * Creates a configuration from flat key/value pairs.
   *
   * @param options merged options; keys as documented on the record components
   * @return populated configuration
   * @throws IllegalArgumentException when a required key is missing or a value cannot be parsed
   */
  public static CalibrateConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path input = parsePath("in", required(options, "in"));
    Path references = parsePath("refs", required(options, "refs"));
    Path out = parsePath("out", firstNonBlank(options.get("out"), "."));
    Optional<Path> stimLog = optionalPath("stimLog", options.get("stimLog"));
    Optional<Path> livetimeLog = optionalPath("livetimeLog", options.get("livetimeLog"));
    OptionalLong seed = OptionalLong.empty();
    String rawSeed = options.get("randSeed");
    if (rawSeed != null && !rawSeed.isBlank()) {
      try {
        seed = OptionalLong.of(Long.parseLong(rawSeed.trim()));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("randSeed must be an integer (was " + rawSeed + ")", ex);
      }
    }
    return new CalibrateConfig(
        input,
        references,
        out,
        stimLog,
        livetimeLog,
        parseBoolean(options.get("csum")),
        seed,
        parseSwitchOverrides(options),
        parseBoolean(options.get("allowOverwrite")),
        parseBoolean(options.get("dryRun")));
  }

  /**
   * Extracts {@code switch.<correction>=OMIT|PERFORM} entries.
   *
   * @param options flat options
   * @return overrides keyed by correction
   * @throws IllegalArgumentException for an unknown correction or a state other than OMIT/PERFORM
   */
  static Map<Correction, SwitchState> parseSwitchOverrides(Map<String, String> options) {
    Map<Correction, SwitchState> overrides = new EnumMap<>(Correction.class);
    for (Map.Entry<String, String> entry : options.entrySet()) {
      String key = entry.getKey();
      if (key == null || !key.startsWith(SWITCH_PREFIX)) {
        continue;
      }
      Correction correction = Correction.parse(key.substring(SWITCH_PREFIX.length()));
      SwitchState state = SwitchState.parse(Strings.requireNonBlank(key, entry.getValue()));
      if (state != SwitchState.OMIT && state != SwitchState.PERFORM) {
        throw new IllegalArgumentException(key + " must be OMIT or PERFORM (was " + entry.getValue() + ")");
      }
      overrides.put(correction, state);
    }
    return overrides;
  }

  private static String required(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value;
  }

  private static Optional<Path> optionalPath(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(parsePath(name, raw));
  }

  private static Path parsePath(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(trimmed).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + raw, ex);
    }
  }

  private static boolean parseBoolean(String raw) {
    if (raw == null || raw.isBlank()) {
      return false;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals("true")) {
      return true;
    }
    if (normalized.equals("false")) {
      return false;
    }
    throw new IllegalArgumentException("expected true or false but was " + raw);
  }

  private static String firstNonBlank(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }
}

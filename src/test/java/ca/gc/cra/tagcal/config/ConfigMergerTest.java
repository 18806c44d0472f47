package ca.gc.cra.tagcal.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlOverridesDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "calibrate",
        Optional.of(Map.of("out", "/yaml/out", "csum", "true")),
        Map.of("out", "/cli/out"),
        DefaultsForMode.asFlatMap("calibrate"),
        warnings::add);

    assertEquals("/cli/out", merged.get("out"));
    assertEquals("true", merged.get("csum"));
    assertEquals("false", merged.get("dryRun"));
    assertEquals(List.of("CLI overrides YAML for key: out"), warnings);
  }

  @Test
  void cliWithoutYamlDoesNotWarn() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "calibrate", Optional.empty(), Map.of("csum", "true"), DefaultsForMode.asFlatMap("calibrate"),
        warnings::add);

    assertEquals("true", merged.get("csum"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void sharedDiagnosticLogIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "calibrate",
            Optional.of(Map.of("stimLog", "diag.txt")),
            Map.of("livetimeLog", " diag.txt "),
            Map.of(),
            null));

    assertTrue(ex.getMessage().contains("stimLog and livetimeLog"));
  }

  @Test
  void refcheckSkipsCalibrateValidation() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "refcheck", Optional.empty(), Map.of("stimLog", "x", "livetimeLog", "x"), Map.of(), null);

    assertEquals("x", merged.get("stimLog"));
  }
}

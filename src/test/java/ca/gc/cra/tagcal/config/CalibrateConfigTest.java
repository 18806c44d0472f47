package ca.gc.cra.tagcal.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CalibrateConfigTest {

  private static Map<String, String> required() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("calibrate"));
    options.put("in", "data/lexp01abq_rawtag.json");
    options.put("refs", "refs.yaml");
    return options;
  }

  @Test
  void defaultsProduceMinimalConfig() {
    CalibrateConfig config = CalibrateConfig.fromMap(required());

    assertTrue(config.input().isAbsolute());
    assertTrue(config.input().endsWith(Path.of("data", "lexp01abq_rawtag.json")));
    assertEquals(Path.of(".").toAbsolutePath().normalize(), config.outputDirectory());
    assertTrue(config.stimLog().isEmpty());
    assertTrue(config.randomSeed().isEmpty());
    assertFalse(config.csum());
    assertTrue(config.switchOverrides().isEmpty());
  }

  @Test
  void optionalValuesAreParsed() {
    Map<String, String> options = required();
    options.put("csum", "TRUE");
    options.put("randSeed", " 42 ");
    options.put("stimLog", "stim.txt");
    options.put("switch.DOPPCORR", "omit");
    options.put("switch.deadcorr", "PERFORM");

    CalibrateConfig config = CalibrateConfig.fromMap(options);

    assertTrue(config.csum());
    assertEquals(42L, config.randomSeed().getAsLong());
    assertTrue(config.stimLog().orElseThrow().endsWith("stim.txt"));
    assertEquals(SwitchState.OMIT, config.switchOverrides().get(Correction.DOPPCORR));
    assertEquals(SwitchState.PERFORM, config.switchOverrides().get(Correction.DEADCORR));
  }

  @Test
  void missingInputIsRejected() {
    Map<String, String> options = required();
    options.remove("in");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> CalibrateConfig.fromMap(options));
    assertEquals("in is required", ex.getMessage());
  }

  @Test
  void badValuesAreRejected() {
    Map<String, String> seed = required();
    seed.put("randSeed", "abc");
    Map<String, String> bool = required();
    bool.put("csum", "yes");
    Map<String, String> unknownSwitch = required();
    unknownSwitch.put("switch.fastcorr", "PERFORM");
    Map<String, String> completed = required();
    completed.put("switch.flatcorr", "COMPLETE");

    assertThrows(IllegalArgumentException.class, () -> CalibrateConfig.fromMap(seed));
    assertThrows(IllegalArgumentException.class, () -> CalibrateConfig.fromMap(bool));
    assertThrows(IllegalArgumentException.class, () -> CalibrateConfig.fromMap(unknownSwitch));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> CalibrateConfig.fromMap(completed));
    assertTrue(ex.getMessage().contains("must be OMIT or PERFORM"));
  }
}

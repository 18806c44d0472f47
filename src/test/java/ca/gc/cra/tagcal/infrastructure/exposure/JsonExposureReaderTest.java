package ca.gc.cra.tagcal.infrastructure.exposure;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.exposure.Exposure;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.exposure.ObsMode;
import ca.gc.cra.tagcal.domain.exposure.Segment;
import ca.gc.cra.tagcal.domain.time.Interval;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonExposureReaderTest {
  private static final String HEADER = """
      "header": {"DETECTOR": "FUV", "SEGMENT": "FUVA", "OBSMODE": "TIME-TAG", "OPT_ELEM": "G130M",
                 "CENWAVE": 1309, "EXPTIME": 3.0, "EXPSTART": 55000.5, "NPIX": [64, 256], "SUBARRAY": true}
      """;

  private static Path write(Path dir, String json) throws IOException {
    Path file = dir.resolve("exposure.json");
    Files.writeString(file, json, StandardCharsets.UTF_8);
    return file;
  }

  @Test
  void readsHeaderSwitchesIntervalsAndColumns(@TempDir Path dir) throws Exception {
    Path file = write(dir, "{\"rootname\": \"lexp01abq\"," + HEADER + """
        , "switches": {"doppcorr": "PERFORM", "DEADCORR": "omit"},
          "gti": [[2.0, 3.0], [0.0, 1.5]],
          "bursts": [[0.5, 0.6]],
          "wavecal": {"a": {"shift1": 1.5, "slope2": 0.01}},
          "extra": {"ignored": [1, 2, 3]},
          "events": {"TIME": [0, 1, 2], "XRAW": [10, 11, 12], "YRAW": [20, 21, 22],
                     "PHA": [3, 4, 5], "EPSILON": [1, 1, 0.5]}}
        """);

    Exposure exposure = new JsonExposureReader(file).read();

    ExposureInfo info = exposure.info();
    assertEquals("lexp01abq", info.rootname());
    assertEquals(Segment.FUVA, info.segment());
    assertEquals(ObsMode.TIME_TAG, info.obsMode());
    assertEquals(1309, info.cenwave());
    assertEquals(64, info.npixY());
    assertTrue(info.subarray());
    assertEquals(SwitchState.PERFORM, exposure.switchRequests().get(Correction.DOPPCORR));
    assertEquals(SwitchState.OMIT, exposure.switchRequests().get(Correction.DEADCORR));
    assertEquals(List.of(new Interval(0.0, 1.5), new Interval(2.0, 3.0)), exposure.gti().intervals());
    assertEquals(List.of(new Interval(0.5, 0.6)), exposure.bursts());
    assertEquals(1.5, exposure.wavecalShift(Segment.FUVA).orElseThrow().shift1());
    assertFalse(exposure.wavecalShift(Segment.FUVB).isPresent());
    assertArrayEquals(new double[] {10, 11, 12}, exposure.events().column(EventColumn.XCORR));
    assertEquals(5, exposure.events().pha(2));
    assertEquals(0.5, exposure.events().epsilon()[2]);
  }

  @Test
  void missingTimeColumnIsFatal(@TempDir Path dir) throws IOException {
    Path file = write(dir, "{" + HEADER + ", \"events\": {\"XRAW\": [1], \"YRAW\": [1]}}");

    CalibrationException ex = assertThrows(CalibrationException.class, () -> new JsonExposureReader(file).read());

    assertEquals("event column time is required", ex.getMessage());
  }

  @Test
  void decreasingTimeIsFatal(@TempDir Path dir) throws IOException {
    Path file = write(dir, "{" + HEADER + ", \"events\": {\"TIME\": [1, 0], \"XRAW\": [1, 2], \"YRAW\": [1, 2]}}");

    CalibrationException ex = assertThrows(CalibrationException.class, () -> new JsonExposureReader(file).read());

    assertTrue(ex.getMessage().startsWith("invalid exposure document"));
  }

  @Test
  void completedSwitchStateIsRejected(@TempDir Path dir) throws IOException {
    Path file = write(dir, "{" + HEADER + ", \"switches\": {\"flatcorr\": \"COMPLETE\"},"
        + " \"events\": {\"TIME\": [], \"XRAW\": [], \"YRAW\": []}}");

    CalibrationException ex = assertThrows(CalibrationException.class, () -> new JsonExposureReader(file).read());

    assertTrue(ex.getMessage().contains("must be OMIT or PERFORM"));
  }

  @Test
  void malformedJsonIsCalibrationFailure(@TempDir Path dir) throws IOException {
    Path file = write(dir, "{\"header\": {");

    assertThrows(CalibrationException.class, () -> new JsonExposureReader(file).read());
    assertThrows(IOException.class, () -> new JsonExposureReader(dir.resolve("absent.json")).read());
  }

  @Test
  void headerRequiresDetectorAndSegment() {
    CalibrationException ex = assertThrows(CalibrationException.class,
        () -> JsonExposureReader.parseHeader("x", Map.of("detector", "FUV")));

    assertEquals("header keyword segment is required", ex.getMessage());
  }

  @Test
  void segmentMustMatchDetector() {
    CalibrationException ex = assertThrows(CalibrationException.class, () -> JsonExposureReader.parseHeader(
        "x", Map.of("detector", "NUV", "segment", "FUVA", "obsmode", "ACCUM")));

    assertTrue(ex.getMessage().contains("does not belong"));
  }
}

package ca.gc.cra.tagcal.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.InMemoryReferenceTables;
import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.application.port.ReferenceLookupException;
import ca.gc.cra.tagcal.domain.calibration.CalibrationResult;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

class CalibrateUseCaseTest {
  private static final Logger USE_CASE_LOGGER = (Logger) LoggerFactory.getLogger(CalibrateUseCase.class);
  private static Level originalLevel;

  @BeforeAll
  static void quietFailureLogs() {
    originalLevel = USE_CASE_LOGGER.getLevel();
    USE_CASE_LOGGER.setLevel(Level.OFF);
  }

  @AfterAll
  static void restoreLogs() {
    USE_CASE_LOGGER.setLevel(originalLevel);
  }

  @Test
  void successfulRunWritesProductsAndRecordsMetrics() throws Exception {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    List<CalibrationResult> written = new ArrayList<>();
    TimeTagCalibrationPipeline pipeline =
        new TimeTagCalibrationPipeline(new InMemoryReferenceTables(), PipelineOptions.defaults());
    CalibrateUseCase useCase = new CalibrateUseCase(
        () -> PipelineFixtures.exposure(Correction.DEADCORR, Correction.WAVECORR), pipeline, written::add, metrics);

    CalibrationResult result = useCase.run();

    assertEquals(1, written.size());
    assertSame(result, written.get(0));
    assertEquals(1, metrics.count("calibrate.runs.success"));
    assertEquals(List.of(20L), metrics.observed("calibrate.events"));
    assertEquals(1, metrics.count("calibrate.stage.deadcorr.complete"));
    assertEquals(1, metrics.count("calibrate.stage.wavecorr.skipped"));
    assertEquals(result.metadata().warnings().size(), metrics.count("calibrate.warnings"));
    assertEquals(1, metrics.observed("calibrate.durationMillis").size());
    assertNull(MDC.get(CalibrateUseCase.MDC_EXPOSURE));
  }

  @Test
  void failedRunWritesNothing() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    List<CalibrationResult> written = new ArrayList<>();
    InMemoryReferenceTables references = new InMemoryReferenceTables();
    references.livetime = null;
    TimeTagCalibrationPipeline pipeline = new TimeTagCalibrationPipeline(references, PipelineOptions.defaults());
    CalibrateUseCase useCase = new CalibrateUseCase(
        () -> PipelineFixtures.exposure(Correction.DEADCORR), pipeline, written::add, metrics);

    assertThrows(ReferenceLookupException.class, useCase::run);

    assertTrue(written.isEmpty());
    assertEquals(1, metrics.count("calibrate.runs.failed"));
    assertTrue(!metrics.hasCounter("calibrate.runs.success"));
    assertNull(MDC.get(CalibrateUseCase.MDC_EXPOSURE));
  }

  @Test
  void sourceFailureIsPropagated() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    TimeTagCalibrationPipeline pipeline =
        new TimeTagCalibrationPipeline(new InMemoryReferenceTables(), PipelineOptions.defaults());
    CalibrateUseCase useCase = new CalibrateUseCase(() -> {
      throw new IOException("disk gone");
    }, pipeline, result -> {}, metrics);

    IOException ex = assertThrows(IOException.class, useCase::run);

    assertEquals("disk gone", ex.getMessage());
    assertEquals(1, metrics.count("calibrate.runs.failed"));
  }

  @Test
  void calibrationExceptionCarriesCorrection() {
    TimeTagCalibrationPipeline pipeline =
        new TimeTagCalibrationPipeline(new InMemoryReferenceTables(), PipelineOptions.defaults());
    CalibrateUseCase useCase = new CalibrateUseCase(() -> {
      throw new CalibrationException("bad header", Correction.DOPPCORR);
    }, pipeline, result -> {}, new RecordingMetricsPort());

    CalibrationException ex = assertThrows(CalibrationException.class, useCase::run);

    assertEquals(Correction.DOPPCORR, ex.correction().orElseThrow());
  }
}

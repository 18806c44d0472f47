package ca.gc.cra.tagcal.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.InMemoryReferenceTables;
import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.calibration.CalibrationMetadata;
import ca.gc.cra.tagcal.domain.calibration.CalibrationResult;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.Exposure;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class TimeTagCalibrationPipelineTest {

  @Test
  void emptyExposureProducesNullProducts() throws CalibrationException {
    PipelineOptions options = new PipelineOptions(true, false, false, OptionalLong.empty(), Map.of());
    TimeTagCalibrationPipeline pipeline = new TimeTagCalibrationPipeline(new InMemoryReferenceTables(), options);

    CalibrationResult result = pipeline.calibrate(PipelineFixtures.empty(Correction.DOPPCORR, Correction.DEADCORR));

    CalibrationMetadata metadata = result.metadata();
    assertTrue(metadata.nullData());
    assertEquals(0.0, result.counts().science().sum());
    assertEquals(1024, result.flatfielded().science().rows());
    assertEquals(0.0, result.csum().orElseThrow().total());
    assertEquals(SwitchState.SKIPPED, metadata.state(Correction.DOPPCORR));
    assertEquals(SwitchState.SKIPPED, metadata.state(Correction.DEADCORR));
    assertTrue(metadata.warnings().get(0).contains("contains no events"));
  }

  @Test
  void calibratesEventsAndBinsThemIntoImages() throws CalibrationException {
    TimeTagCalibrationPipeline pipeline =
        new TimeTagCalibrationPipeline(new InMemoryReferenceTables(), PipelineOptions.defaults());
    Exposure exposure = PipelineFixtures.exposure(
        Correction.DOPPCORR, Correction.DEADCORR, Correction.DQICORR, Correction.WAVECORR,
        Correction.PHOTCORR, Correction.STATFLAG);
    double[] timeBefore = exposure.events().timeSnapshot();

    CalibrationResult result = pipeline.calibrate(exposure);

    CalibrationMetadata metadata = result.metadata();
    assertFalse(metadata.nullData());
    assertArrayEquals(timeBefore, result.events().timeSnapshot());
    assertEquals(SwitchState.COMPLETE, metadata.state(Correction.DOPPCORR));
    assertEquals(SwitchState.COMPLETE, metadata.state(Correction.DEADCORR));
    assertEquals(SwitchState.COMPLETE, metadata.state(Correction.DQICORR));
    assertEquals(SwitchState.COMPLETE, metadata.state(Correction.STATFLAG));
    assertEquals(SwitchState.SKIPPED, metadata.state(Correction.WAVECORR));
    assertEquals(SwitchState.SKIPPED, metadata.state(Correction.PHOTCORR));
    assertEquals(SwitchState.OMIT, metadata.state(Correction.FLATCORR));
    assertEquals(20.0, metadata.exptime(), 1e-12);
    assertEquals(1.0, result.counts().science().sum(), 1e-5);
    assertEquals(1.0f, result.counts().science().get(500, 100), 1e-5f);
    assertTrue(metadata.deadtimeResult().isPresent());
    assertTrue(metadata.statistics().containsKey("counts"));

    EventTable events = result.events();
    assertArrayEquals(events.column(EventColumn.XDOPP), events.column(EventColumn.XFULL));
    assertArrayEquals(events.column(EventColumn.YCORR), events.column(EventColumn.YFULL));
  }

  @Test
  void switchOverridesReplaceExposureRequests() throws CalibrationException {
    Map<Correction, SwitchState> overrides = new EnumMap<>(Correction.class);
    overrides.put(Correction.DEADCORR, SwitchState.OMIT);
    PipelineOptions options = new PipelineOptions(false, false, false, OptionalLong.empty(), overrides);
    TimeTagCalibrationPipeline pipeline = new TimeTagCalibrationPipeline(new InMemoryReferenceTables(), options);

    CalibrationResult result = pipeline.calibrate(PipelineFixtures.exposure(Correction.DEADCORR));

    assertEquals(SwitchState.OMIT, result.metadata().state(Correction.DEADCORR));
    assertFalse(result.metadata().deadtimeResult().isPresent());
    assertTrue(result.csum().isEmpty());
  }

  @Test
  void eachCalibrationGetsItsOwnReferenceView() throws CalibrationException {
    List<InMemoryReferenceTables> views = new ArrayList<>();
    TimeTagCalibrationPipeline pipeline = new TimeTagCalibrationPipeline(() -> {
      InMemoryReferenceTables view = new InMemoryReferenceTables();
      views.add(view);
      return view;
    }, PipelineOptions.defaults());

    pipeline.calibrate(PipelineFixtures.exposure(Correction.DEADCORR));
    pipeline.calibrate(PipelineFixtures.exposure(Correction.DEADCORR));

    assertEquals(2, views.size());
    assertEquals(1, views.get(0).calls("deadtab"));
    assertEquals(1, views.get(1).calls("deadtab"));
  }

  @Test
  void copyColumnsSeedsEveryDerivedCoordinate() {
    EventTable events = EventTable.builder(new double[] {0}, new double[] {10}, new double[] {20}).build();
    events.column(EventColumn.XCORR)[0] = 11;
    events.column(EventColumn.YCORR)[0] = 21;

    TimeTagCalibrationPipeline.copyColumns(events);

    assertEquals(11.0, events.column(EventColumn.XDOPP)[0]);
    assertEquals(11.0, events.column(EventColumn.XFULL)[0]);
    assertEquals(21.0, events.column(EventColumn.YDOPP)[0]);
    assertEquals(21.0, events.column(EventColumn.YFULL)[0]);
  }
}

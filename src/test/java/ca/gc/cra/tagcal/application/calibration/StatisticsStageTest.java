package ca.gc.cra.tagcal.application.calibration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.domain.image.DqPlane;
import ca.gc.cra.tagcal.domain.image.ImageStatistics;
import ca.gc.cra.tagcal.domain.image.RateImage;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StatisticsStageTest {

  @Test
  void recordsStatisticsOfBothImages() {
    RunContext context = CalibrationFixtures.context(CalibrationFixtures.fuvInfo().build(),
        CalibrationFixtures.uniformEvents(4, 0.0, 1.0, 5000, 500),
        new CalibrationFixtures.InMemoryReferenceTables(), Correction.STATFLAG);
    RateImage counts = RateImage.zeros(DqPlane.zeros(2, 2));
    counts.science().set(0, 0, 4.0f);
    RateImage flt = RateImage.zeros(DqPlane.zeros(2, 2));
    flt.science().set(1, 1, 8.0f);
    flt.quality().or(0, 0, 4);

    StatisticsStage.run(context, new ImageBinner.Images(counts, flt));

    Map<String, ImageStatistics> statistics = context.metadata().build().statistics();
    assertEquals(new ImageStatistics(4, 1.0, 4.0), statistics.get(StatisticsStage.COUNTS));
    assertEquals(3, statistics.get(StatisticsStage.FLT).goodPixels());
    assertEquals(8.0 / 3.0, statistics.get(StatisticsStage.FLT).mean(), 1e-6);
    assertEquals(SwitchState.COMPLETE, context.switches().state(Correction.STATFLAG));
  }

  @Test
  void omittedSwitchRecordsNothing() {
    RunContext context = CalibrationFixtures.context(CalibrationFixtures.fuvInfo().build(),
        CalibrationFixtures.uniformEvents(4, 0.0, 1.0, 5000, 500),
        new CalibrationFixtures.InMemoryReferenceTables());
    RateImage image = RateImage.zeros(DqPlane.zeros(2, 2));

    StatisticsStage.run(context, new ImageBinner.Images(image, image));

    assertTrue(context.metadata().build().statistics().isEmpty());
  }
}

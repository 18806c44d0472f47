package ca.gc.cra.tagcal.application.port;

import ca.gc.cra.tagcal.domain.exposure.Exposure;
import java.io.IOException;

/**
 * Input port delivering one exposure (header, switches, time intervals and events) to the pipeline.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ExposureSource {
  /**
   * Reads the exposure.
   *
   * @return parsed exposure
   * @throws IOException when the input cannot be read
   * @throws CalibrationException when the input structure is malformed
   */
  Exposure read() throws IOException, CalibrationException;
}

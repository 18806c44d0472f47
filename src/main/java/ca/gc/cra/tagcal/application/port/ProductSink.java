package ca.gc.cra.tagcal.application.port;

import ca.gc.cra.tagcal.domain.calibration.CalibrationResult;
import java.io.IOException;

/**
 * <strong>What:</strong> Output port persisting the products of one completed calibration run.
 * <p><strong>Why:</strong> Keeps file naming and encoding out of the pipeline.</p>
 * <p><strong>Thread-safety:</strong> Implementations are used by one run at a time.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ProductSink {
  /**
   * Writes every product of a run; only called once the pipeline finished.
   *
   * @param result corrected events, images, metadata and diagnostic logs
   * @throws IOException when writing fails
   */
  void write(CalibrationResult result) throws IOException;
}

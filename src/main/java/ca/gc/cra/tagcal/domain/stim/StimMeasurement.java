package ca.gc.cra.tagcal.domain.stim;

import java.util.Objects;

/**
 * Centroid of one stim inside one time window.
 *
 * @param position measured centroid; {@code null} when the stim was not found
 * @param count events inside the search box
 * @param sumSquaresX sum of squared x deviations from the centroid
 * @param sumSquaresY sum of squared y deviations from the centroid
 * @since 0.1.0
 */
public record StimMeasurement(StimPosition position, int count, double sumSquaresX, double sumSquaresY) {
  private static final StimMeasurement NOT_FOUND = new StimMeasurement(null, 0, 0.0, 0.0);

  public StimMeasurement {
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative");
    }
    if ((position == null) != (count == 0)) {
      throw new IllegalArgumentException("a stim is found exactly when its count is positive");
    }
  }

  public static StimMeasurement notFound() {
    return NOT_FOUND;
  }

  public static StimMeasurement found(StimPosition position, int count, double sumSquaresX, double sumSquaresY) {
    return new StimMeasurement(Objects.requireNonNull(position, "position"), count, sumSquaresX, sumSquaresY);
  }

  public boolean isFound() {
    return position != null;
  }
}

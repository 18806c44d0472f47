package ca.gc.cra.tagcal.domain.time;

/**
 * Half-open time range {@code [start, stop)} in seconds since exposure start.
 *
 * @param start first instant covered
 * @param stop first instant not covered
 * @since 0.1.0
 */
public record Interval(double start, double stop) {

  /**
   * Validates the bounds.
   *
   * @throws IllegalArgumentException when a bound is NaN or {@code stop < start}
   */
  public Interval {
    if (Double.isNaN(start) || Double.isNaN(stop)) {
      throw new IllegalArgumentException("interval bounds must not be NaN");
    }
    if (stop < start) {
      throw new IllegalArgumentException("interval stop " + stop + " precedes start " + start);
    }
  }

  public double duration() {
    return stop - start;
  }
}

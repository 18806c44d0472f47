package ca.gc.cra.tagcal.domain.time;

/**
 * Half-open range of row indices {@code [from, to)} into an event table.
 *
 * <p>An empty range ({@code from == to}) is a normal result, not an error.</p>
 *
 * @param from first index included
 * @param to first index excluded
 * @since 0.1.0
 */
public record IndexRange(int from, int to) {

  /**
   * Validates index ordering.
   *
   * @throws IllegalArgumentException when {@code from} is negative or greater than {@code to}
   */
  public IndexRange {
    if (from < 0 || to < from) {
      throw new IllegalArgumentException("invalid index range [" + from + ", " + to + ")");
    }
  }

  /**
   * Returns the number of rows covered.
   *
   * @return {@code to - from}
   */
  public int size() {
    return to - from;
  }

  /**
   * Indicates whether the range selects no rows.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return from == to;
  }
}

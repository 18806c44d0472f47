package ca.gc.cra.tagcal.domain.event;

import ca.gc.cra.tagcal.domain.time.IndexRange;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Column store for the photon events of one exposure.
 * <p><strong>Why:</strong> Corrections run as vectorised passes over whole columns, so events are stored
 * column-wise rather than as one object per photon.</p>
 * <p><strong>Role:</strong> Domain aggregate exclusively owned by one calibration run.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold the read-only time, raw coordinate and pulse-height columns.</li>
 *   <li>Lend the writable coordinate, DQ and weight columns to stages that are allowed to mutate them.</li>
 *   <li>Map time windows to row ranges by binary search.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Writable columns are handed out as live arrays.</p>
 * <p><strong>Performance:</strong> Primitive arrays only; no boxing on the per-event path.</p>
 *
 * @since 0.1.0
 */
public final class EventTable {
  private final double[] time;
  private final double[] xraw;
  private final double[] yraw;
  private final int[] pha;
  private final Map<EventColumn, double[]> coordinates;
  private final int[] dq;
  private final double[] epsilon;

  private EventTable(Builder builder) {
    int n = builder.time.length;
    this.time = builder.time.clone();
    this.xraw = builder.xraw.clone();
    this.yraw = builder.yraw.clone();
    this.pha = builder.pha == null ? null : builder.pha.clone();
    this.coordinates = new EnumMap<>(EventColumn.class);
    coordinates.put(EventColumn.XCORR, copyOrDefault(builder.columns.get(EventColumn.XCORR), xraw, n));
    coordinates.put(EventColumn.YCORR, copyOrDefault(builder.columns.get(EventColumn.YCORR), yraw, n));
    double[] xcorr = coordinates.get(EventColumn.XCORR);
    double[] ycorr = coordinates.get(EventColumn.YCORR);
    coordinates.put(EventColumn.XDOPP, copyOrDefault(builder.columns.get(EventColumn.XDOPP), xcorr, n));
    coordinates.put(EventColumn.YDOPP, copyOrDefault(builder.columns.get(EventColumn.YDOPP), ycorr, n));
    coordinates.put(EventColumn.XFULL, copyOrDefault(builder.columns.get(EventColumn.XFULL), xcorr, n));
    coordinates.put(EventColumn.YFULL, copyOrDefault(builder.columns.get(EventColumn.YFULL), ycorr, n));
    if (builder.dq == null) {
      this.dq = new int[n];
    } else {
      this.dq = builder.dq.clone();
    }
    if (builder.epsilon == null) {
      this.epsilon = new double[n];
      Arrays.fill(this.epsilon, 1.0);
    } else {
      this.epsilon = builder.epsilon.clone();
    }
  }

  /**
   * Starts a table from its three mandatory columns.
   *
   * @param time arrival times in seconds since exposure start; non-decreasing
   * @param xraw raw dispersion-axis coordinates
   * @param yraw raw cross-dispersion coordinates
   * @return builder for optional columns
   */
  public static Builder builder(double[] time, double[] xraw, double[] yraw) {
    return new Builder(time, xraw, yraw);
  }

  /**
   * Returns an empty table.
   *
   * @return table with zero rows
   */
  public static EventTable empty() {
    return builder(new double[0], new double[0], new double[0]).build();
  }

  public int size() {
    return time.length;
  }

  public boolean isEmpty() {
    return time.length == 0;
  }

  public double time(int row) {
    return time[row];
  }

  public double firstTime() {
    return time[0];
  }

  public double lastTime() {
    return time[time.length - 1];
  }

  /**
   * Returns a copy of the time column.
   *
   * @return independent copy; changes do not affect the table
   */
  public double[] timeSnapshot() {
    return time.clone();
  }

  public double xraw(int row) {
    return xraw[row];
  }

  public double yraw(int row) {
    return yraw[row];
  }

  public boolean hasPha() {
    return pha != null;
  }

  /**
   * Returns the pulse height of one event.
   *
   * @param row event index
   * @return pulse-height amplitude
   * @throws IllegalStateException when the table has no pulse-height column
   */
  public int pha(int row) {
    if (pha == null) {
      throw new IllegalStateException("event table has no PHA column");
    }
    return pha[row];
  }

  /**
   * Lends a writable coordinate column.
   *
   * <p>The returned array is the table's own storage. Only the stage that owns the column for the
   * current step may write to it.</p>
   *
   * @param column column to borrow
   * @return live column array
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Stages mutate columns in place by contract.")
  public double[] column(EventColumn column) {
    return coordinates.get(Objects.requireNonNull(column, "column"));
  }

  /**
   * Lends the data-quality column.
   *
   * @return live DQ array
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Stages OR flags into the column in place.")
  public int[] dq() {
    return dq;
  }

  /**
   * Lends the per-event weight column.
   *
   * @return live epsilon array
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Deadtime and flat-field stages divide weights in place.")
  public double[] epsilon() {
    return epsilon;
  }

  /**
   * Copies one coordinate column onto another, e.g. XCORR onto XDOPP before Doppler correction.
   *
   * @param source column to read
   * @param target column to overwrite
   */
  public void copyColumn(EventColumn source, EventColumn target) {
    double[] from = column(source);
    System.arraycopy(from, 0, column(target), 0, from.length);
  }

  /**
   * Finds the rows whose time lies in {@code [t0, t1)}.
   *
   * @param t0 window start (inclusive)
   * @param t1 window end (exclusive)
   * @return row range, possibly empty; never {@code null}
   */
  public IndexRange indexRange(double t0, double t1) {
    int from = lowerBound(t0);
    int to = Math.max(from, lowerBound(t1));
    return new IndexRange(from, to);
  }

  private int lowerBound(double value) {
    int lo = 0;
    int hi = time.length;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (time[mid] < value) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }

  private static double[] copyOrDefault(double[] supplied, double[] fallback, int n) {
    double[] source = supplied == null ? fallback : supplied;
    return Arrays.copyOf(source, n);
  }

  /**
   * Builder validating column lengths and time ordering.
   */
  public static final class Builder {
    private final double[] time;
    private final double[] xraw;
    private final double[] yraw;
    private final Map<EventColumn, double[]> columns = new EnumMap<>(EventColumn.class);
    private int[] pha;
    private int[] dq;
    private double[] epsilon;

    private Builder(double[] time, double[] xraw, double[] yraw) {
      this.time = Objects.requireNonNull(time, "time");
      this.xraw = Objects.requireNonNull(xraw, "xraw");
      this.yraw = Objects.requireNonNull(yraw, "yraw");
    }

    public Builder column(EventColumn column, double[] values) {
      columns.put(Objects.requireNonNull(column, "column"), values);
      return this;
    }

    public Builder pha(int[] values) {
      this.pha = values;
      return this;
    }

    public Builder dq(int[] values) {
      this.dq = values;
      return this;
    }

    public Builder epsilon(double[] values) {
      this.epsilon = values;
      return this;
    }

    /**
     * Validates and freezes the columns into a table.
     *
     * @return new event table
     * @throws IllegalArgumentException when a column length differs from the time column or time decreases
     */
    public EventTable build() {
      int n = time.length;
      requireLength("XRAW", xraw.length, n);
      requireLength("YRAW", yraw.length, n);
      for (Map.Entry<EventColumn, double[]> entry : columns.entrySet()) {
        if (entry.getValue() != null) {
          requireLength(entry.getKey().name(), entry.getValue().length, n);
        }
      }
      if (pha != null) {
        requireLength("PHA", pha.length, n);
      }
      if (dq != null) {
        requireLength("DQ", dq.length, n);
      }
      if (epsilon != null) {
        requireLength("EPSILON", epsilon.length, n);
      }
      for (int i = 1; i < n; i++) {
        if (time[i] < time[i - 1]) {
          throw new IllegalArgumentException(
              "TIME column decreases at row " + i + " (" + time[i - 1] + " > " + time[i] + ")");
        }
      }
      return new EventTable(this);
    }

    private static void requireLength(String name, int actual, int expected) {
      if (actual != expected) {
        throw new IllegalArgumentException(
            name + " column has " + actual + " rows but TIME has " + expected);
      }
    }
  }
}

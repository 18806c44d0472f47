package ca.gc.cra.tagcal.domain.time;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Sorted, pairwise-disjoint list of good-time intervals.
 * <p><strong>Why:</strong> Exposure-time bookkeeping needs the total good duration after bursts and bad
 * times have been removed.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class IntervalSet {
  private static final IntervalSet EMPTY = new IntervalSet(List.of());

  private final List<Interval> intervals;

  private IntervalSet(List<Interval> intervals) {
    this.intervals = List.copyOf(intervals);
  }

  public static IntervalSet empty() {
    return EMPTY;
  }

  /**
   * Builds a set from possibly unsorted input, rejecting overlapping members.
   *
   * @param intervals good intervals; zero-length members are dropped
   * @return normalised set
   * @throws IllegalArgumentException when two intervals overlap
   */
  public static IntervalSet of(Collection<Interval> intervals) {
    Objects.requireNonNull(intervals, "intervals");
    List<Interval> sorted = new ArrayList<>();
    for (Interval interval : intervals) {
      if (interval.duration() > 0) {
        sorted.add(interval);
      }
    }
    sorted.sort(Comparator.comparingDouble(Interval::start));
    for (int i = 1; i < sorted.size(); i++) {
      if (sorted.get(i).start() < sorted.get(i - 1).stop()) {
        throw new IllegalArgumentException(
            "good time intervals overlap: " + sorted.get(i - 1) + " and " + sorted.get(i));
      }
    }
    return new IntervalSet(sorted);
  }

  public static IntervalSet single(double start, double stop) {
    return of(List.of(new Interval(start, stop)));
  }

  public List<Interval> intervals() {
    return intervals;
  }

  public int size() {
    return intervals.size();
  }

  public boolean isEmpty() {
    return intervals.isEmpty();
  }

  /**
   * Sum of the interval durations.
   *
   * @return total good time in seconds
   */
  public double duration() {
    double total = 0.0;
    for (Interval interval : intervals) {
      total += interval.duration();
    }
    return total;
  }

  /**
   * Removes one bad interval from every good interval it overlaps.
   *
   * <p>An overlapping good interval {@code [s, e)} keeps {@code [s, bs)} when {@code bs > s} and
   * {@code [be, e)} when {@code be < e}; non-overlapping intervals pass through unchanged.</p>
   *
   * @param bad interval to remove
   * @return narrowed set
   */
  public IntervalSet subtract(Interval bad) {
    Objects.requireNonNull(bad, "bad");
    List<Interval> result = new ArrayList<>(intervals.size() + 1);
    for (Interval good : intervals) {
      if (bad.start() >= good.stop() || bad.stop() <= good.start()) {
        result.add(good);
        continue;
      }
      if (bad.start() > good.start()) {
        result.add(new Interval(good.start(), bad.start()));
      }
      if (bad.stop() < good.stop()) {
        result.add(new Interval(bad.stop(), good.stop()));
      }
    }
    return new IntervalSet(result);
  }

  /**
   * Removes every bad interval in order.
   *
   * @param bad intervals to remove; may be empty
   * @return narrowed set
   */
  public IntervalSet subtractAll(Collection<Interval> bad) {
    IntervalSet current = this;
    for (Interval interval : Objects.requireNonNull(bad, "bad")) {
      current = current.subtract(interval);
    }
    return current;
  }

  /**
   * Tests whether a time falls in a member interval whose stop is extended by {@code stopSlack}.
   *
   * @param t time in seconds since exposure start
   * @param stopSlack extra seconds accepted past each stop
   * @return {@code true} when covered
   */
  public boolean covers(double t, double stopSlack) {
    for (Interval interval : intervals) {
      if (t >= interval.start() && t < interval.stop() + stopSlack) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof IntervalSet other && intervals.equals(other.intervals);
  }

  @Override
  public int hashCode() {
    return intervals.hashCode();
  }

  @Override
  public String toString() {
    return "IntervalSet" + intervals;
  }
}

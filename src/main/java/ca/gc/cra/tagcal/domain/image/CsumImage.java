package ca.gc.cra.tagcal.domain.image;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Cumulative-sum image, 2-D or 3-D when split by pulse height.
 * <p><strong>Why:</strong> The 3-D FUV shape holds half a billion cells of which only event-bearing ones are
 * non-zero, so the image is accumulated sparsely by linear index.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CsumImage {
  private final int planes;
  private final int rows;
  private final int columns;
  private final Map<Long, Double> cells = new HashMap<>();

  /**
   * Creates an empty image.
   *
   * @param planes pulse-height planes, {@code 1} for a 2-D image
   * @param rows rows (y)
   * @param columns columns (x)
   */
  public CsumImage(int planes, int rows, int columns) {
    if (planes <= 0 || rows <= 0 || columns <= 0) {
      throw new IllegalArgumentException("csum shape must be positive");
    }
    this.planes = planes;
    this.rows = rows;
    this.columns = columns;
  }

  public int planes() {
    return planes;
  }

  public int rows() {
    return rows;
  }

  public int columns() {
    return columns;
  }

  public boolean isThreeDimensional() {
    return planes > 1;
  }

  /**
   * Adds a weight at a cell; positions outside the image are ignored.
   *
   * @param plane pulse-height plane, {@code 0} for 2-D images
   * @param row row index
   * @param column column index
   * @param weight value to add
   * @return {@code true} when the cell was inside the image
   */
  public boolean add(int plane, int row, int column, double weight) {
    if (plane < 0 || plane >= planes || row < 0 || row >= rows || column < 0 || column >= columns) {
      return false;
    }
    long index = ((long) plane * rows + row) * columns + column;
    cells.merge(index, weight, Double::sum);
    return true;
  }

  public double get(int plane, int row, int column) {
    long index = ((long) plane * rows + row) * columns + column;
    return cells.getOrDefault(index, 0.0);
  }

  /** Sum over every cell. */
  public double total() {
    double sum = 0.0;
    for (double value : cells.values()) {
      sum += value;
    }
    return sum;
  }

  /**
   * Non-zero cells in ascending linear-index order.
   *
   * @return sorted copy keyed by {@code (plane * rows + row) * columns + column}
   */
  public TreeMap<Long, Double> nonZeroCells() {
    TreeMap<Long, Double> sorted = new TreeMap<>();
    for (Map.Entry<Long, Double> entry : cells.entrySet()) {
      if (entry.getValue() != 0.0) {
        sorted.put(entry.getKey(), entry.getValue());
      }
    }
    return sorted;
  }
}

package ca.gc.cra.tagcal.domain.image;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * <strong>What:</strong> Dense single-precision 2-D image stored row-major.
 * <p><strong>Why:</strong> Full-detector planes hold tens of millions of pixels, so values are kept as a
 * flat {@code float[]} rather than nested arrays or boxed numbers.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; filled by one binning pass.</p>
 *
 * @since 0.1.0
 */
public final class ImagePlane {
  private final int rows;
  private final int columns;
  private final float[] data;

  private ImagePlane(int rows, int columns) {
    if (rows <= 0 || columns <= 0) {
      throw new IllegalArgumentException("image shape must be positive (was " + rows + "x" + columns + ")");
    }
    this.rows = rows;
    this.columns = columns;
    this.data = new float[Math.multiplyExact(rows, columns)];
  }

  /**
   * Allocates a zero-valued plane.
   *
   * @param rows number of rows (y)
   * @param columns number of columns (x)
   * @return new plane
   */
  public static ImagePlane zeros(int rows, int columns) {
    return new ImagePlane(rows, columns);
  }

  public int rows() {
    return rows;
  }

  public int columns() {
    return columns;
  }

  public boolean contains(int row, int column) {
    return row >= 0 && row < rows && column >= 0 && column < columns;
  }

  public float get(int row, int column) {
    return data[row * columns + column];
  }

  public void set(int row, int column, float value) {
    data[row * columns + column] = value;
  }

  public void add(int row, int column, double value) {
    data[row * columns + column] += (float) value;
  }

  /**
   * Lends the backing array for bulk transforms and serialization.
   *
   * @return live row-major data
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Binning and writers stream the plane without copying.")
  public float[] data() {
    return data;
  }

  /** Sum of every pixel, accumulated in double precision. */
  public double sum() {
    double total = 0.0;
    for (float value : data) {
      total += value;
    }
    return total;
  }
}

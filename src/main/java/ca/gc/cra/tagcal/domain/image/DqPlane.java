package ca.gc.cra.tagcal.domain.image;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Row-major data-quality image; flags accumulate by bitwise OR.
 *
 * @since 0.1.0
 */
public final class DqPlane {
  private final int rows;
  private final int columns;
  private final int[] flags;

  private DqPlane(int rows, int columns) {
    if (rows <= 0 || columns <= 0) {
      throw new IllegalArgumentException("image shape must be positive (was " + rows + "x" + columns + ")");
    }
    this.rows = rows;
    this.columns = columns;
    this.flags = new int[Math.multiplyExact(rows, columns)];
  }

  public static DqPlane zeros(int rows, int columns) {
    return new DqPlane(rows, columns);
  }

  public int rows() {
    return rows;
  }

  public int columns() {
    return columns;
  }

  public int get(int row, int column) {
    return flags[row * columns + column];
  }

  public void or(int row, int column, int flag) {
    flags[row * columns + column] |= flag;
  }

  /**
   * ORs a flag into every pixel of a rectangle, clipped to the plane.
   *
   * @param rowFrom first row (inclusive)
   * @param rowTo last row (exclusive)
   * @param columnFrom first column (inclusive)
   * @param columnTo last column (exclusive)
   * @param flag bits to set
   */
  public void orRegion(int rowFrom, int rowTo, int columnFrom, int columnTo, int flag) {
    int r0 = Math.max(0, rowFrom);
    int r1 = Math.min(rows, rowTo);
    int c0 = Math.max(0, columnFrom);
    int c1 = Math.min(columns, columnTo);
    for (int r = r0; r < r1; r++) {
      int base = r * columns;
      for (int c = c0; c < c1; c++) {
        flags[base + c] |= flag;
      }
    }
  }

  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Writers stream the plane without copying.")
  public int[] data() {
    return flags;
  }
}

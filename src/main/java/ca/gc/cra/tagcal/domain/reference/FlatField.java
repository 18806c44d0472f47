package ca.gc.cra.tagcal.domain.reference;

/**
 * Pixel-to-pixel sensitivity map placed at a detector origin.
 *
 * @since 0.1.0
 */
public final class FlatField {
  private final int originX;
  private final int originY;
  private final double[][] data;

  /**
   * Creates a flat field.
   *
   * @param originX detector x of column 0
   * @param originY detector y of row 0
   * @param data relative sensitivity indexed {@code [row][column]}
   */
  public FlatField(int originX, int originY, double[][] data) {
    if (data == null || data.length == 0) {
      throw new IllegalArgumentException("flat field must not be empty");
    }
    this.originX = originX;
    this.originY = originY;
    this.data = new double[data.length][];
    for (int r = 0; r < data.length; r++) {
      this.data[r] = data[r].clone();
    }
  }

  /**
   * Sensitivity at a detector pixel.
   *
   * @param x detector column
   * @param y detector row
   * @return flat value, or {@code 0} outside the map
   */
  public double valueAt(int x, int y) {
    int row = y - originY;
    int col = x - originX;
    if (row < 0 || row >= data.length || col < 0 || col >= data[row].length) {
      return 0.0;
    }
    return data[row][col];
  }
}

package ca.gc.cra.tagcal.domain.reference;

/**
 * <strong>What:</strong> Binned geometric distortion offsets for one segment.
 * <p><strong>Why:</strong> Detector non-linearity is stored at reduced resolution; offsets at arbitrary
 * pixel positions are looked up from the nearest bin or interpolated between bins.</p>
 * <p><strong>Thread-safety:</strong> Immutable; arrays are copied on construction.</p>
 *
 * @since 0.1.0
 */
public final class GeometricDistortionMap {
  private final double originX;
  private final double originY;
  private final double binX;
  private final double binY;
  private final double[][] dx;
  private final double[][] dy;

  /**
   * Creates a map.
   *
   * @param originX detector x of the first map column
   * @param originY detector y of the first map row
   * @param binX detector pixels per map column
   * @param binY detector pixels per map row
   * @param dx dispersion-axis offsets indexed {@code [row][column]}
   * @param dy cross-dispersion offsets, same shape as {@code dx}
   */
  public GeometricDistortionMap(
      double originX, double originY, double binX, double binY, double[][] dx, double[][] dy) {
    if (binX <= 0 || binY <= 0) {
      throw new IllegalArgumentException("distortion map bin sizes must be positive");
    }
    this.originX = originX;
    this.originY = originY;
    this.binX = binX;
    this.binY = binY;
    this.dx = copy(dx, "dx");
    this.dy = copy(dy, "dy");
    if (this.dy.length != this.dx.length || this.dy[0].length != this.dx[0].length) {
      throw new IllegalArgumentException("dx and dy distortion maps differ in shape");
    }
  }

  public int rows() {
    return dx.length;
  }

  public int columns() {
    return dx[0].length;
  }

  /**
   * Offset to subtract from the dispersion-axis coordinate.
   *
   * @param x detector x
   * @param y detector y
   * @param interpolate bilinear interpolation when {@code true}, nearest bin otherwise
   * @return offset in pixels
   */
  public double deltaX(double x, double y, boolean interpolate) {
    return sample(dx, x, y, interpolate);
  }

  /**
   * Offset to subtract from the cross-dispersion coordinate.
   *
   * @param x detector x
   * @param y detector y
   * @param interpolate bilinear interpolation when {@code true}, nearest bin otherwise
   * @return offset in pixels
   */
  public double deltaY(double x, double y, boolean interpolate) {
    return sample(dy, x, y, interpolate);
  }

  private double sample(double[][] map, double x, double y, boolean interpolate) {
    double col = clamp((x - originX) / binX, columns() - 1);
    double row = clamp((y - originY) / binY, rows() - 1);
    if (!interpolate) {
      return map[(int) Math.round(row)][(int) Math.round(col)];
    }
    int c0 = (int) Math.floor(col);
    int r0 = (int) Math.floor(row);
    int c1 = Math.min(c0 + 1, columns() - 1);
    int r1 = Math.min(r0 + 1, rows() - 1);
    double fc = col - c0;
    double fr = row - r0;
    double top = map[r0][c0] * (1.0 - fc) + map[r0][c1] * fc;
    double bottom = map[r1][c0] * (1.0 - fc) + map[r1][c1] * fc;
    return top * (1.0 - fr) + bottom * fr;
  }

  private static double clamp(double value, int max) {
    if (value < 0) {
      return 0;
    }
    return Math.min(value, max);
  }

  private static double[][] copy(double[][] source, String name) {
    if (source == null || source.length == 0 || source[0] == null || source[0].length == 0) {
      throw new IllegalArgumentException(name + " distortion map must not be empty");
    }
    int width = source[0].length;
    double[][] result = new double[source.length][];
    for (int r = 0; r < source.length; r++) {
      if (source[r] == null || source[r].length != width) {
        throw new IllegalArgumentException(name + " distortion map is not rectangular");
      }
      result[r] = source[r].clone();
    }
    return result;
  }
}

package ca.gc.cra.tagcal.domain.event;

/**
 * Data-quality bit assignments shared by the event DQ column and the image DQ planes.
 *
 * <p>Flags accumulate by bitwise OR; no correction clears a bit once it has been set.</p>
 *
 * @since 0.1.0
 */
public final class DataQuality {
  /** No known defect. */
  public static final int OK = 0;
  /** Event falls in an interval where the detector was bursting. */
  public static final int BURST = 64;
  /** Pixel lies outside the region that can receive calibrated events. */
  public static final int OUT_OF_BOUNDS = 128;
  /** Pulse height below the lower screening threshold. */
  public static final int PH_LOW = 512;
  /** Pulse height above the upper screening threshold. */
  public static final int PH_HIGH = 1024;
  /** Event arrived outside a good time interval. */
  public static final int BAD_TIME = 2048;

  private DataQuality() {
    // Utility
  }

  /**
   * Tests whether {@code dq} shares any bit with {@code mask}.
   *
   * @param dq event or pixel flags
   * @param mask flags of interest
   * @return {@code true} when at least one bit of {@code mask} is set in {@code dq}
   */
  public static boolean intersects(int dq, int mask) {
    return (dq & mask) != 0;
  }
}

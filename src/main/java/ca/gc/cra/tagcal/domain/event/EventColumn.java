package ca.gc.cra.tagcal.domain.event;

/**
 * Writable coordinate columns of an {@link EventTable}.
 *
 * <p>The raw coordinates and the time column are not listed: they are fixed at ingestion.</p>
 *
 * @since 0.1.0
 */
public enum EventColumn {
  /** Dispersion-axis coordinate after thermal, random and geometric corrections. */
  XCORR,
  /** Cross-dispersion coordinate after thermal, random and geometric corrections. */
  YCORR,
  /** Dispersion-axis coordinate after orbital Doppler correction. */
  XDOPP,
  /** Cross-dispersion coordinate paired with {@link #XDOPP}. */
  YDOPP,
  /** Dispersion-axis coordinate after wavecal shift. */
  XFULL,
  /** Cross-dispersion coordinate after wavecal shift. */
  YFULL
}

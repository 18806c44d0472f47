package ca.gc.cra.tagcal.domain.livetime;

/**
 * Source of the count rate that determined the livetime correction.
 *
 * @since 0.1.0
 */
public enum DeadtimeMethod {
  /** Rate measured from the events themselves. */
  DATA,
  /** FUV hardware digital event counter. */
  DEVENT,
  /** NUV hardware event counter. */
  MEVENTS,
  /** No correction was possible because the exposure time was not positive. */
  SKIPPED
}

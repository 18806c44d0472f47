package ca.gc.cra.tagcal.domain.livetime;

/**
 * Local count rate and livetime factor for one deadtime window.
 *
 * @param start window start in seconds
 * @param stop window end in seconds, clipped to the last event time
 * @param countRate observed local rate; the previous window's rate when the factor was reused
 * @param livetime factor applied to the window's events
 * @param reusedPrevious {@code true} when the final short window reused the preceding factor
 * @since 0.1.0
 */
public record LivetimeWindow(double start, double stop, double countRate, double livetime, boolean reusedPrevious) {}

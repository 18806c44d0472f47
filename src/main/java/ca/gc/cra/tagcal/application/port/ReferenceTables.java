package ca.gc.cra.tagcal.application.port;

import ca.gc.cra.tagcal.domain.exposure.Segment;
import ca.gc.cra.tagcal.domain.livetime.LivetimeTable;
import ca.gc.cra.tagcal.domain.reference.BadPixelRegion;
import ca.gc.cra.tagcal.domain.reference.BadTimeWindow;
import ca.gc.cra.tagcal.domain.reference.BaselineReference;
import ca.gc.cra.tagcal.domain.reference.DispersionRelation;
import ca.gc.cra.tagcal.domain.reference.FlatField;
import ca.gc.cra.tagcal.domain.reference.GeometricDistortionMap;
import ca.gc.cra.tagcal.domain.reference.OpticalKey;
import ca.gc.cra.tagcal.domain.reference.PhotometryParameters;
import ca.gc.cra.tagcal.domain.reference.PulseHeightLimits;
import ca.gc.cra.tagcal.domain.reference.SpectralTrace;
import java.util.List;

/**
 * <strong>What:</strong> Domain port answering typed queries against the static calibration reference tables.
 * <p><strong>Why:</strong> Corrections consume reference parameters without knowing how the tables are stored.</p>
 * <p><strong>Role:</strong> Query service implemented by {@code TableBackedReferenceTables} and decorated by
 * {@code CachingReferenceTables}.</p>
 * <p><strong>Thread-safety:</strong> Implementations are read-only after construction; caching decorators are
 * confined to one run.</p>
 *
 * <p>Every exactly-one query throws {@link ReferenceLookupException} when zero or several rows match, and when the
 * table itself is absent.</p>
 *
 * @since 0.1.0
 */
public interface ReferenceTables {

  /** Stim reference positions, search box and active-area bounds ({@code brftab}). */
  BaselineReference baseline(Segment segment) throws CalibrationException;

  /**
   * Bad-time windows for a segment ({@code badttab}); zero rows is valid.
   *
   * @param segment detector segment
   * @return windows in MJD, possibly empty
   * @throws CalibrationException when the table is missing
   */
  List<BadTimeWindow> badTimes(Segment segment) throws CalibrationException;

  /** Pulse-height thresholds ({@code phatab}). */
  PulseHeightLimits pulseHeightLimits(Segment segment) throws CalibrationException;

  /**
   * Count-rate to livetime mapping for a segment ({@code deadtab}).
   *
   * @param segment detector segment
   * @return table with its window width
   * @throws CalibrationException when no rows match or the rate axis is not increasing
   */
  LivetimeTable livetime(Segment segment) throws CalibrationException;

  /** Indicates whether {@code disptab} rows carry an {@code fpoffset} key column. */
  boolean dispersionKeyedByFpoffset() throws CalibrationException;

  /**
   * Dispersion relation for an optical configuration ({@code disptab}).
   *
   * @param key optical configuration; the segment is {@code FUVA}, {@code FUVB} or an NUV stripe
   * @param fpoffset focal-plane offset, used as a key only when the table has that column
   * @return dispersion relation
   * @throws CalibrationException when the lookup is not unique
   */
  DispersionRelation dispersion(OpticalKey key, int fpoffset) throws CalibrationException;

  /** Spectral-trace position for an optical configuration ({@code xtractab}). */
  SpectralTrace trace(OpticalKey key) throws CalibrationException;

  /** Pixel step per focal-plane offset position ({@code wcptab}). */
  double fpoffsetStepsize(String optElem) throws CalibrationException;

  /** Binned geometric distortion map ({@code geofile}). */
  GeometricDistortionMap geometricDistortion(Segment segment) throws CalibrationException;

  /** Flat-field map ({@code flatfile}). */
  FlatField flatField(Segment segment) throws CalibrationException;

  /**
   * Bad-pixel regions for a segment ({@code bpixtab}); zero rows is valid.
   *
   * @param segment detector segment
   * @return regions, possibly empty
   * @throws CalibrationException when the table is missing
   */
  List<BadPixelRegion> badPixels(Segment segment) throws CalibrationException;

  /** Photometric keywords for an observing mode string ({@code imphttab}). */
  PhotometryParameters photometry(String obsmode) throws CalibrationException;
}

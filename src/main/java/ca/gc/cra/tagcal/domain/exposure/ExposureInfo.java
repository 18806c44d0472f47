package ca.gc.cra.tagcal.domain.exposure;

import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed view of the exposure header keywords the corrections read.
 * <p><strong>Why:</strong> Replaces free-form keyword dictionaries with named, validated fields.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; exposure time changes produce a new instance via
 * {@link #withExptime(double)}.</p>
 *
 * @param rootname exposure identifier used to name products
 * @param detector detector family
 * @param segment FUV segment, or {@link Segment#NUV}
 * @param obsMode TIME-TAG or ACCUM
 * @param obsType spectroscopic or imaging
 * @param exptype exposure type (e.g. {@code EXTERNAL/SCI}, {@code WAVECAL})
 * @param optElem grating or mirror name
 * @param cenwave central wavelength setting in Angstroms
 * @param aperture aperture name ({@code PSA}, {@code BOA}, {@code WCA})
 * @param fpoffset focal-plane offset position
 * @param expstart exposure start, MJD
 * @param exptime exposure time in seconds
 * @param raTarg target right ascension, degrees
 * @param decTarg target declination, degrees
 * @param doppmagv orbital Doppler velocity amplitude, km/s
 * @param doppzero MJD when the orbital Doppler shift is zero and increasing
 * @param orbitper orbital period in seconds
 * @param countrate hardware event-counter rate, counts/s
 * @param subarray whether the exposure used detector sub-regions
 * @param nsubarray number of sub-regions
 * @param stimrate commanded stim count rate, counts/s
 * @param randseed seed for coordinate randomization; {@code -1} requests a time-based seed
 * @param npixY output image rows
 * @param npixX output image columns
 * @param xOffset detector-to-image offset along the dispersion axis
 * @param sdqflags data-quality bits treated as serious before any correction adds to the set
 * @since 0.1.0
 */
public record ExposureInfo(
    String rootname,
    Detector detector,
    Segment segment,
    ObsMode obsMode,
    ObsType obsType,
    String exptype,
    String optElem,
    int cenwave,
    String aperture,
    int fpoffset,
    double expstart,
    double exptime,
    double raTarg,
    double decTarg,
    double doppmagv,
    double doppzero,
    double orbitper,
    double countrate,
    boolean subarray,
    int nsubarray,
    double stimrate,
    long randseed,
    int npixY,
    int npixX,
    int xOffset,
    int sdqflags) {

  /**
   * Validates identity fields and image shape.
   *
   * @throws IllegalArgumentException when the segment does not belong to the detector or the image shape is not positive
   */
  public ExposureInfo {
    rootname = Objects.requireNonNullElse(rootname, "exposure");
    Objects.requireNonNull(detector, "detector");
    Objects.requireNonNull(segment, "segment");
    Objects.requireNonNull(obsMode, "obsMode");
    Objects.requireNonNull(obsType, "obsType");
    exptype = Objects.requireNonNullElse(exptype, "EXTERNAL/SCI").toUpperCase(Locale.ROOT);
    optElem = Objects.requireNonNullElse(optElem, "").toUpperCase(Locale.ROOT);
    aperture = Objects.requireNonNullElse(aperture, "PSA").toUpperCase(Locale.ROOT);
    if (segment.detector() != detector) {
      throw new IllegalArgumentException("segment " + segment + " does not belong to detector " + detector);
    }
    if (npixY <= 0 || npixX <= 0) {
      throw new IllegalArgumentException("npix must be positive (was " + npixY + "x" + npixX + ")");
    }
  }

  /**
   * Returns a copy with a recomputed exposure time.
   *
   * @param newExptime exposure time in seconds
   * @return updated header view
   */
  public ExposureInfo withExptime(double newExptime) {
    return toBuilder().exptime(newExptime).build();
  }

  public boolean isFuv() {
    return detector == Detector.FUV;
  }

  public boolean isTimeTag() {
    return obsMode == ObsMode.TIME_TAG;
  }

  public boolean isSpectroscopic() {
    return obsType == ObsType.SPECTROSCOPIC;
  }

  /** Indicates a wavelength-calibration exposure, which is never shifted by wavecal results. */
  public boolean isWavecal() {
    return exptype.contains("WAVE");
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .rootname(rootname)
        .detector(detector)
        .segment(segment)
        .obsMode(obsMode)
        .obsType(obsType)
        .exptype(exptype)
        .optElem(optElem)
        .cenwave(cenwave)
        .aperture(aperture)
        .fpoffset(fpoffset)
        .expstart(expstart)
        .exptime(exptime)
        .raTarg(raTarg)
        .decTarg(decTarg)
        .doppmagv(doppmagv)
        .doppzero(doppzero)
        .orbitper(orbitper)
        .countrate(countrate)
        .subarray(subarray)
        .nsubarray(nsubarray)
        .stimrate(stimrate)
        .randseed(randseed)
        .npix(npixY, npixX)
        .xOffset(xOffset)
        .sdqflags(sdqflags);
  }

  /**
   * Mutable builder with FUVA TIME-TAG spectroscopic defaults.
   */
  public static final class Builder {
    private String rootname = "exposure";
    private Detector detector = Detector.FUV;
    private Segment segment = Segment.FUVA;
    private ObsMode obsMode = ObsMode.TIME_TAG;
    private ObsType obsType = ObsType.SPECTROSCOPIC;
    private String exptype = "EXTERNAL/SCI";
    private String optElem = "";
    private int cenwave;
    private String aperture = "PSA";
    private int fpoffset;
    private double expstart;
    private double exptime;
    private double raTarg;
    private double decTarg;
    private double doppmagv;
    private double doppzero;
    private double orbitper = 5760.0;
    private double countrate;
    private boolean subarray;
    private int nsubarray;
    private double stimrate;
    private long randseed = -1L;
    private int npixY = Detector.FUV.height();
    private int npixX = Detector.FUV.width();
    private int xOffset;
    private int sdqflags;

    private Builder() {}

    public Builder rootname(String value) {
      this.rootname = value;
      return this;
    }

    public Builder detector(Detector value) {
      this.detector = value;
      return this;
    }

    public Builder segment(Segment value) {
      this.segment = value;
      return this;
    }

    public Builder obsMode(ObsMode value) {
      this.obsMode = value;
      return this;
    }

    public Builder obsType(ObsType value) {
      this.obsType = value;
      return this;
    }

    public Builder exptype(String value) {
      this.exptype = value;
      return this;
    }

    public Builder optElem(String value) {
      this.optElem = value;
      return this;
    }

    public Builder cenwave(int value) {
      this.cenwave = value;
      return this;
    }

    public Builder aperture(String value) {
      this.aperture = value;
      return this;
    }

    public Builder fpoffset(int value) {
      this.fpoffset = value;
      return this;
    }

    public Builder expstart(double value) {
      this.expstart = value;
      return this;
    }

    public Builder exptime(double value) {
      this.exptime = value;
      return this;
    }

    public Builder raTarg(double value) {
      this.raTarg = value;
      return this;
    }

    public Builder decTarg(double value) {
      this.decTarg = value;
      return this;
    }

    public Builder doppmagv(double value) {
      this.doppmagv = value;
      return this;
    }

    public Builder doppzero(double value) {
      this.doppzero = value;
      return this;
    }

    public Builder orbitper(double value) {
      this.orbitper = value;
      return this;
    }

    public Builder countrate(double value) {
      this.countrate = value;
      return this;
    }

    public Builder subarray(boolean value) {
      this.subarray = value;
      return this;
    }

    public Builder nsubarray(int value) {
      this.nsubarray = value;
      return this;
    }

    public Builder stimrate(double value) {
      this.stimrate = value;
      return this;
    }

    public Builder randseed(long value) {
      this.randseed = value;
      return this;
    }

    public Builder npix(int rows, int columns) {
      this.npixY = rows;
      this.npixX = columns;
      return this;
    }

    public Builder xOffset(int value) {
      this.xOffset = value;
      return this;
    }

    public Builder sdqflags(int value) {
      this.sdqflags = value;
      return this;
    }

    public ExposureInfo build() {
      return new ExposureInfo(
          rootname, detector, segment, obsMode, obsType, exptype, optElem, cenwave, aperture,
          fpoffset, expstart, exptime, raTarg, decTarg, doppmagv, doppzero, orbitper, countrate,
          subarray, nsubarray, stimrate, randseed, npixY, npixX, xOffset, sdqflags);
    }
  }
}

package ca.gc.cra.tagcal.domain.calibration;

import ca.gc.cra.tagcal.domain.image.ImageStatistics;
import ca.gc.cra.tagcal.domain.livetime.DeadtimeResult;
import ca.gc.cra.tagcal.domain.reference.PhotometryParameters;
import ca.gc.cra.tagcal.domain.stim.StimStatistics;
import ca.gc.cra.tagcal.domain.time.IntervalSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Audit record of one calibration run.
 * <p><strong>Why:</strong> Every final switch state, fallback decision and derived scalar is published next to the
 * products so downstream consumers can tell how each value was obtained.</p>
 * <p><strong>Thread-safety:</strong> Immutable once built; the {@link Builder} is confined to the run.</p>
 *
 * @param rootname exposure identifier
 * @param switches final state of every correction
 * @param nullData {@code true} when the exposure had no events
 * @param exptime exposure time after good-time recomputation
 * @param globrate global count rate over the active area
 * @param gti good-time intervals after burst and bad-time removal
 * @param referenceKeys reference rows consulted, keyed by table name
 * @param randomSeed seed used for coordinate randomization, when it ran
 * @param pulseHeight pulse-height filtering summary, or {@code null}
 * @param stim1 first stim statistics, or {@code null} when stims were not tracked
 * @param stim2 second stim statistics, or {@code null}
 * @param deadtime deadtime decision, or {@code null}
 * @param doppler orbital Doppler parameters, or {@code null}
 * @param heliocentricVelocity target radial velocity from Earth's orbital motion, km/s
 * @param wavecal applied wavecal shifts, or {@code null}
 * @param wavecalOffsets range of applied wavecal shifts, or {@code null}
 * @param statistics good-pixel statistics keyed by image name
 * @param photometry photometric keywords, or {@code null}
 * @param warnings non-fatal consistency warnings in the order they were raised
 * @since 0.1.0
 */
public record CalibrationMetadata(
    String rootname,
    Map<Correction, SwitchState> switches,
    boolean nullData,
    double exptime,
    double globrate,
    IntervalSet gti,
    Map<String, String> referenceKeys,
    OptionalLong randomSeed,
    PulseHeightSummary pulseHeight,
    StimStatistics stim1,
    StimStatistics stim2,
    DeadtimeResult deadtime,
    DopplerParameters doppler,
    OptionalDouble heliocentricVelocity,
    WavecalSummary wavecal,
    WavecalOffsets wavecalOffsets,
    Map<String, ImageStatistics> statistics,
    PhotometryParameters photometry,
    List<String> warnings) {

  public CalibrationMetadata {
    Objects.requireNonNull(rootname, "rootname");
    switches = Map.copyOf(Objects.requireNonNull(switches, "switches"));
    gti = Objects.requireNonNullElse(gti, IntervalSet.empty());
    referenceKeys = Map.copyOf(Objects.requireNonNull(referenceKeys, "referenceKeys"));
    Objects.requireNonNull(randomSeed, "randomSeed");
    Objects.requireNonNull(heliocentricVelocity, "heliocentricVelocity");
    statistics = Map.copyOf(Objects.requireNonNull(statistics, "statistics"));
    warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
  }

  public SwitchState state(Correction correction) {
    return switches.getOrDefault(correction, SwitchState.OMIT);
  }

  public Optional<DeadtimeResult> deadtimeResult() {
    return Optional.ofNullable(deadtime);
  }

  public static Builder builder(String rootname) {
    return new Builder(rootname);
  }

  /**
   * Accumulates metadata while the stages run.
   */
  public static final class Builder {
    private final String rootname;
    private Map<Correction, SwitchState> switches = Map.of();
    private boolean nullData;
    private double exptime;
    private double globrate;
    private IntervalSet gti = IntervalSet.empty();
    private final Map<String, String> referenceKeys = new LinkedHashMap<>();
    private OptionalLong randomSeed = OptionalLong.empty();
    private PulseHeightSummary pulseHeight;
    private StimStatistics stim1;
    private StimStatistics stim2;
    private DeadtimeResult deadtime;
    private DopplerParameters doppler;
    private OptionalDouble heliocentricVelocity = OptionalDouble.empty();
    private WavecalSummary wavecal;
    private WavecalOffsets wavecalOffsets;
    private final Map<String, ImageStatistics> statistics = new LinkedHashMap<>();
    private PhotometryParameters photometry;
    private final List<String> warnings = new ArrayList<>();

    private Builder(String rootname) {
      this.rootname = Objects.requireNonNull(rootname, "rootname");
    }

    public Builder switches(Map<Correction, SwitchState> value) {
      this.switches = value;
      return this;
    }

    public Builder nullData(boolean value) {
      this.nullData = value;
      return this;
    }

    public Builder exptime(double value) {
      this.exptime = value;
      return this;
    }

    public Builder globrate(double value) {
      this.globrate = value;
      return this;
    }

    public Builder gti(IntervalSet value) {
      this.gti = value;
      return this;
    }

    public Builder referenceKey(String table, String key) {
      referenceKeys.put(table, key);
      return this;
    }

    public Builder randomSeed(long value) {
      this.randomSeed = OptionalLong.of(value);
      return this;
    }

    public Builder pulseHeight(PulseHeightSummary value) {
      this.pulseHeight = value;
      return this;
    }

    public Builder stims(StimStatistics first, StimStatistics second) {
      this.stim1 = first;
      this.stim2 = second;
      return this;
    }

    public Builder deadtime(DeadtimeResult value) {
      this.deadtime = value;
      return this;
    }

    public Builder doppler(DopplerParameters value) {
      this.doppler = value;
      return this;
    }

    public Builder heliocentricVelocity(double value) {
      this.heliocentricVelocity = OptionalDouble.of(value);
      return this;
    }

    public Builder wavecal(WavecalSummary value) {
      this.wavecal = value;
      return this;
    }

    public Builder wavecalOffsets(WavecalOffsets value) {
      this.wavecalOffsets = value;
      return this;
    }

    public Builder statistics(String image, ImageStatistics value) {
      statistics.put(image, value);
      return this;
    }

    public Builder photometry(PhotometryParameters value) {
      this.photometry = value;
      return this;
    }

    public Builder warning(String message) {
      warnings.add(message);
      return this;
    }

    public List<String> warnings() {
      return List.copyOf(warnings);
    }

    public CalibrationMetadata build() {
      return new CalibrationMetadata(
          rootname, switches, nullData, exptime, globrate, gti, referenceKeys, randomSeed, pulseHeight,
          stim1, stim2, deadtime, doppler, heliocentricVelocity, wavecal, wavecalOffsets, statistics,
          photometry, warnings);
    }
  }
}

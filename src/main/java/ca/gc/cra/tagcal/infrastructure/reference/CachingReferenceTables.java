package ca.gc.cra.tagcal.infrastructure.reference;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.application.port.ReferenceTables;
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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decorator caching every typed lookup by its query key.
 *
 * <p>Stages query the same rows repeatedly (the NUV stripe traces, the Doppler dispersion row); the cache keeps
 * those to one table scan each. Failed lookups are not cached.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; create one instance per run.</p>
 *
 * @since 0.1.0
 */
public final class CachingReferenceTables implements ReferenceTables {
  private final ReferenceTables delegate;
  private final Memo<Segment, BaselineReference> baselines = new Memo<>();
  private final Memo<Segment, List<BadTimeWindow>> badTimes = new Memo<>();
  private final Memo<Segment, PulseHeightLimits> pulseHeightLimits = new Memo<>();
  private final Memo<Segment, LivetimeTable> livetimes = new Memo<>();
  private final Memo<Boolean, Boolean> dispersionKeying = new Memo<>();
  private final Memo<List<Object>, DispersionRelation> dispersions = new Memo<>();
  private final Memo<OpticalKey, SpectralTrace> traces = new Memo<>();
  private final Memo<String, Double> stepsizes = new Memo<>();
  private final Memo<Segment, GeometricDistortionMap> distortions = new Memo<>();
  private final Memo<Segment, FlatField> flatFields = new Memo<>();
  private final Memo<Segment, List<BadPixelRegion>> badPixels = new Memo<>();
  private final Memo<String, PhotometryParameters> photometry = new Memo<>();

  public CachingReferenceTables(ReferenceTables delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  @Override
  public BaselineReference baseline(Segment segment) throws CalibrationException {
    return baselines.get(segment, () -> delegate.baseline(segment));
  }

  @Override
  public List<BadTimeWindow> badTimes(Segment segment) throws CalibrationException {
    return badTimes.get(segment, () -> List.copyOf(delegate.badTimes(segment)));
  }

  @Override
  public PulseHeightLimits pulseHeightLimits(Segment segment) throws CalibrationException {
    return pulseHeightLimits.get(segment, () -> delegate.pulseHeightLimits(segment));
  }

  @Override
  public LivetimeTable livetime(Segment segment) throws CalibrationException {
    return livetimes.get(segment, () -> delegate.livetime(segment));
  }

  @Override
  public boolean dispersionKeyedByFpoffset() throws CalibrationException {
    return dispersionKeying.get(Boolean.TRUE, delegate::dispersionKeyedByFpoffset);
  }

  @Override
  public DispersionRelation dispersion(OpticalKey key, int fpoffset) throws CalibrationException {
    return dispersions.get(List.of(key, fpoffset), () -> delegate.dispersion(key, fpoffset));
  }

  @Override
  public SpectralTrace trace(OpticalKey key) throws CalibrationException {
    return traces.get(key, () -> delegate.trace(key));
  }

  @Override
  public double fpoffsetStepsize(String optElem) throws CalibrationException {
    return stepsizes.get(optElem, () -> delegate.fpoffsetStepsize(optElem));
  }

  @Override
  public GeometricDistortionMap geometricDistortion(Segment segment) throws CalibrationException {
    return distortions.get(segment, () -> delegate.geometricDistortion(segment));
  }

  @Override
  public FlatField flatField(Segment segment) throws CalibrationException {
    return flatFields.get(segment, () -> delegate.flatField(segment));
  }

  @Override
  public List<BadPixelRegion> badPixels(Segment segment) throws CalibrationException {
    return badPixels.get(segment, () -> List.copyOf(delegate.badPixels(segment)));
  }

  @Override
  public PhotometryParameters photometry(String obsmode) throws CalibrationException {
    return photometry.get(obsmode, () -> delegate.photometry(obsmode));
  }

  @FunctionalInterface
  private interface Query<T> {
    T get() throws CalibrationException;
  }

  /** Results of one query kind, keyed by its arguments. */
  private static final class Memo<K, V> {
    private final Map<K, V> values = new HashMap<>();

    V get(K key, Query<V> query) throws CalibrationException {
      V hit = values.get(key);
      if (hit != null) {
        return hit;
      }
      V value = query.get();
      values.put(key, value);
      return value;
    }
  }
}

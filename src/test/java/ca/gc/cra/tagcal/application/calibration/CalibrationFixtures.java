package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.application.port.ReferenceLookupException;
import ca.gc.cra.tagcal.application.port.ReferenceTables;
import ca.gc.cra.tagcal.domain.calibration.CalibrationSwitches;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.exposure.Segment;
import ca.gc.cra.tagcal.domain.livetime.LivetimeTable;
import ca.gc.cra.tagcal.domain.reference.ActiveArea;
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
import ca.gc.cra.tagcal.domain.stim.StimPosition;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared builders for calibration stage tests.
 */
public final class CalibrationFixtures {
  public static final ActiveArea AREA = new ActiveArea(100, 900, 1000, 15000);
  public static final StimPosition STIM1 = new StimPosition(400, 950);
  public static final StimPosition STIM2 = new StimPosition(15800, 50);

  private CalibrationFixtures() {}

  /** FUVA TIME-TAG header with a small output image so binning tests stay light. */
  public static ExposureInfo.Builder fuvInfo() {
    return ExposureInfo.builder()
        .rootname("lexp01abq")
        .optElem("G130M")
        .cenwave(1309)
        .expstart(55000.0)
        .exptime(100.0)
        .randseed(42L)
        .npix(64, 256);
  }

  public static CalibrationSwitches switches(Correction... perform) {
    Map<Correction, SwitchState> requested = new EnumMap<>(Correction.class);
    for (Correction correction : perform) {
      requested.put(correction, SwitchState.PERFORM);
    }
    return CalibrationSwitches.of(requested);
  }

  public static RunContext context(ExposureInfo info, EventTable events, ReferenceTables references,
      Correction... perform) {
    RunContext context = new RunContext(info, events, switches(perform), references, true, true);
    boolean[] all = new boolean[events.size()];
    Arrays.fill(all, true);
    context.setActiveArea(all);
    return context;
  }

  /** Events evenly spaced in time, all at one position. */
  public static EventTable uniformEvents(int n, double start, double step, double x, double y) {
    double[] time = new double[n];
    double[] xs = new double[n];
    double[] ys = new double[n];
    for (int i = 0; i < n; i++) {
      time[i] = start + i * step;
      xs[i] = x;
      ys[i] = y;
    }
    return EventTable.builder(time, xs, ys).build();
  }

  /**
   * Reference tables held in fields; tests replace only what they exercise.
   * Lookups of anything left {@code null} fail the way a missing table does.
   */
  public static final class InMemoryReferenceTables implements ReferenceTables {
    public BaselineReference baseline = new BaselineReference(AREA, STIM1, STIM2, 20, 20, 10.0);
    public List<BadTimeWindow> badTimes = new ArrayList<>();
    public PulseHeightLimits pulseHeight = new PulseHeightLimits(2, 23);
    public LivetimeTable livetime = new LivetimeTable(new double[] {0, 100, 200}, new double[] {1.0, 0.9, 0.7}, 10.0);
    public boolean keyedByFpoffset = true;
    public DispersionRelation dispersion = new DispersionRelation(new double[] {1200.0, 0.01}, 0.0);
    public Map<String, SpectralTrace> traces = new HashMap<>();
    public double stepsize = 0.0;
    public GeometricDistortionMap geometric;
    public FlatField flat;
    public List<BadPixelRegion> badPixels = new ArrayList<>();
    public PhotometryParameters photometry;
    private final Map<String, Integer> calls = new HashMap<>();

    public InMemoryReferenceTables() {
      traces.put("PSA", new SpectralTrace(480, 0));
      traces.put("WCA", new SpectralTrace(780, 0));
    }

    public int calls(String table) {
      return calls.getOrDefault(table, 0);
    }

    @Override
    public BaselineReference baseline(Segment segment) throws CalibrationException {
      return require("brftab", baseline);
    }

    @Override
    public List<BadTimeWindow> badTimes(Segment segment) throws CalibrationException {
      return require("badttab", badTimes);
    }

    @Override
    public PulseHeightLimits pulseHeightLimits(Segment segment) throws CalibrationException {
      return require("phatab", pulseHeight);
    }

    @Override
    public LivetimeTable livetime(Segment segment) throws CalibrationException {
      return require("deadtab", livetime);
    }

    @Override
    public boolean dispersionKeyedByFpoffset() {
      return keyedByFpoffset;
    }

    @Override
    public DispersionRelation dispersion(OpticalKey key, int fpoffset) throws CalibrationException {
      return require("disptab", dispersion);
    }

    @Override
    public SpectralTrace trace(OpticalKey key) throws CalibrationException {
      return require("xtractab", traces.get(key.aperture()));
    }

    @Override
    public double fpoffsetStepsize(String optElem) {
      calls.merge("wcptab", 1, Integer::sum);
      return stepsize;
    }

    @Override
    public GeometricDistortionMap geometricDistortion(Segment segment) throws CalibrationException {
      return require("geofile", geometric);
    }

    @Override
    public FlatField flatField(Segment segment) throws CalibrationException {
      return require("flatfile", flat);
    }

    @Override
    public List<BadPixelRegion> badPixels(Segment segment) throws CalibrationException {
      return require("bpixtab", badPixels);
    }

    @Override
    public PhotometryParameters photometry(String obsmode) throws CalibrationException {
      return require("imphttab", photometry);
    }

    private <T> T require(String table, T value) throws CalibrationException {
      calls.merge(table, 1, Integer::sum);
      if (value == null) {
        throw new ReferenceLookupException(table);
      }
      return value;
    }
  }
}

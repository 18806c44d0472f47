package ca.gc.cra.tagcal.infrastructure.reference;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.application.port.ReferenceTables;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> {@link ReferenceTables} implementation over a loaded {@link ReferenceTableSet}.
 * <p><strong>Why:</strong> Translates table rows into the typed domain values the corrections consume, so that the
 * column layout of the reference document stays out of the application layer.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class TableBackedReferenceTables implements ReferenceTables {
  private final ReferenceTableSet tables;

  public TableBackedReferenceTables(ReferenceTableSet tables) {
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  @Override
  public BaselineReference baseline(Segment segment) throws CalibrationException {
    ReferenceTable table = tables.require("brftab");
    ReferenceRow row = table.exactlyOne(bySegment(segment));
    ActiveArea area = new ActiveArea(
        row.number("a_low"), row.number("a_high"), row.number("a_left"), row.number("a_right"));
    return wrap("brftab", () -> new BaselineReference(
        area,
        new StimPosition(row.number("sx1"), row.number("sy1")),
        new StimPosition(row.number("sx2"), row.number("sy2")),
        row.number("xwidth"),
        row.number("ywidth"),
        table.headerNumber("timestep", 0.0)));
  }

  @Override
  public List<BadTimeWindow> badTimes(Segment segment) throws CalibrationException {
    List<BadTimeWindow> windows = new ArrayList<>();
    for (ReferenceRow row : tables.require("badttab").select(bySegment(segment))) {
      windows.add(new BadTimeWindow(row.number("start"), row.number("stop")));
    }
    return windows;
  }

  @Override
  public PulseHeightLimits pulseHeightLimits(Segment segment) throws CalibrationException {
    ReferenceRow row = tables.require("phatab").exactlyOne(bySegment(segment));
    return wrap("phatab", () -> new PulseHeightLimits(row.integer("llt"), row.integer("ult")));
  }

  @Override
  public LivetimeTable livetime(Segment segment) throws CalibrationException {
    ReferenceTable table = tables.require("deadtab");
    List<ReferenceRow> rows = table.atLeastOne(bySegment(segment));
    double[] rates = new double[rows.size()];
    double[] factors = new double[rows.size()];
    for (int i = 0; i < rows.size(); i++) {
      rates[i] = rows.get(i).number("obs_rate");
      factors[i] = rows.get(i).number("livetime");
    }
    double timestep = table.headerNumber("timestep", 0.0);
    return wrap("deadtab", () -> new LivetimeTable(rates, factors, timestep));
  }

  @Override
  public boolean dispersionKeyedByFpoffset() throws CalibrationException {
    return tables.require("disptab").hasColumn("fpoffset");
  }

  @Override
  public DispersionRelation dispersion(OpticalKey key, int fpoffset) throws CalibrationException {
    ReferenceTable table = tables.require("disptab");
    Map<String, Object> filter = byOpticalKey(key);
    if (table.hasColumn("fpoffset")) {
      filter.put("fpoffset", fpoffset);
    }
    // Several rows may differ only in columns not filtered on; the first one wins.
    ReferenceRow row = table.atLeastOne(filter).get(0);
    double[] coefficients = row.numbers("coeff");
    double delta = row.number("delta", 0.0);
    return wrap("disptab", () -> new DispersionRelation(coefficients, delta));
  }

  @Override
  public SpectralTrace trace(OpticalKey key) throws CalibrationException {
    ReferenceRow row = tables.require("xtractab").exactlyOne(byOpticalKey(key));
    return new SpectralTrace(row.number("b_spec"), row.number("slope"));
  }

  @Override
  public double fpoffsetStepsize(String optElem) throws CalibrationException {
    Map<String, Object> filter = new LinkedHashMap<>();
    filter.put("opt_elem", optElem);
    return tables.require("wcptab").exactlyOne(filter).number("stepsize");
  }

  @Override
  public GeometricDistortionMap geometricDistortion(Segment segment) throws CalibrationException {
    ReferenceRow row = tables.require("geofile").exactlyOne(bySegment(segment));
    double originX = row.number("origin_x");
    double originY = row.number("origin_y");
    double binX = row.number("bin_x");
    double binY = row.number("bin_y");
    double[][] dx = row.matrix("dx");
    double[][] dy = row.matrix("dy");
    return wrap("geofile", () -> new GeometricDistortionMap(originX, originY, binX, binY, dx, dy));
  }

  @Override
  public FlatField flatField(Segment segment) throws CalibrationException {
    ReferenceRow row = tables.require("flatfile").exactlyOne(bySegment(segment));
    int originX = row.integer("origin_x");
    int originY = row.integer("origin_y");
    double[][] data = row.matrix("data");
    return wrap("flatfile", () -> new FlatField(originX, originY, data));
  }

  @Override
  public List<BadPixelRegion> badPixels(Segment segment) throws CalibrationException {
    List<BadPixelRegion> regions = new ArrayList<>();
    for (ReferenceRow row : tables.require("bpixtab").select(bySegment(segment))) {
      regions.add(new BadPixelRegion(
          row.integer("lx"), row.integer("ly"), row.integer("dx"), row.integer("dy"), row.integer("dq")));
    }
    return regions;
  }

  @Override
  public PhotometryParameters photometry(String obsmode) throws CalibrationException {
    Map<String, Object> filter = new LinkedHashMap<>();
    filter.put("obsmode", obsmode);
    ReferenceRow row = tables.require("imphttab").exactlyOne(filter);
    return new PhotometryParameters(
        row.number("photflam"), row.number("photfnu"), row.number("photplam"), row.number("photbw"));
  }

  private static Map<String, Object> bySegment(Segment segment) {
    Map<String, Object> filter = new LinkedHashMap<>();
    filter.put("segment", segment.name());
    return filter;
  }

  private static Map<String, Object> byOpticalKey(OpticalKey key) {
    Map<String, Object> filter = new LinkedHashMap<>();
    filter.put("opt_elem", key.optElem());
    filter.put("cenwave", key.cenwave());
    filter.put("aperture", key.aperture());
    filter.put("segment", key.segment());
    return filter;
  }

  /** Turns domain validation failures into calibration errors naming the table. */
  private static <T> T wrap(String table, RowMapper<T> mapper) throws CalibrationException {
    try {
      return mapper.map();
    } catch (IllegalArgumentException ex) {
      throw new CalibrationException("invalid " + table + " row: " + ex.getMessage(), null, ex);
    }
  }

  @FunctionalInterface
  private interface RowMapper<T> {
    T map() throws CalibrationException;
  }
}

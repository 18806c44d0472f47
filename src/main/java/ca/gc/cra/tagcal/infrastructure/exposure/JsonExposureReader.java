package ca.gc.cra.tagcal.infrastructure.exposure;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.application.port.ExposureSource;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.Detector;
import ca.gc.cra.tagcal.domain.exposure.Exposure;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.exposure.ObsMode;
import ca.gc.cra.tagcal.domain.exposure.ObsType;
import ca.gc.cra.tagcal.domain.exposure.Segment;
import ca.gc.cra.tagcal.domain.exposure.WavecalShift;
import ca.gc.cra.tagcal.domain.time.Interval;
import ca.gc.cra.tagcal.domain.time.IntervalSet;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads an exposure document (header, switches, time intervals, wavecal shifts and event
 * columns) from JSON.
 * <p><strong>Why:</strong> Event columns can hold millions of values, so they are streamed straight into primitive
 * arrays with the Jackson streaming parser instead of going through an object tree.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link ExposureSource}.</p>
 * <p><strong>Thread-safety:</strong> Each {@link #read()} opens its own parser; instances may be reused
 * sequentially.</p>
 *
 * @since 0.1.0
 */
public final class JsonExposureReader implements ExposureSource {
  private static final Logger log = LoggerFactory.getLogger(JsonExposureReader.class);

  private final JsonFactory factory = new JsonFactory();
  private final Path path;

  public JsonExposureReader(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  @Override
  public Exposure read() throws IOException, CalibrationException {
    if (!Files.exists(path)) {
      throw new IOException("Exposure document not found: " + path);
    }
    try (InputStream in = Files.newInputStream(path);
         JsonParser parser = factory.createParser(in)) {
      Exposure exposure = parse(parser);
      log.info("Read exposure {} with {} events from {}",
          exposure.info().rootname(), exposure.events().size(), path);
      return exposure;
    } catch (JsonProcessingException ex) {
      throw new CalibrationException("Malformed exposure document " + path + ": " + ex.getOriginalMessage(), null, ex);
    }
  }

  private Exposure parse(JsonParser parser) throws IOException, CalibrationException {
    if (parser.nextToken() != JsonToken.START_OBJECT) {
      throw new CalibrationException("exposure document must be a JSON object");
    }
    String rootname = null;
    Map<String, Object> header = null;
    Map<Correction, SwitchState> switches = new EnumMap<>(Correction.class);
    List<Interval> gti = List.of();
    List<Interval> bursts = List.of();
    Map<String, WavecalShift> wavecal = Map.of();
    Columns columns = null;
    JsonToken token;
    while ((token = parser.nextToken()) == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      switch (field) {
        case "rootname":
          rootname = parser.getValueAsString();
          break;
        case "header":
          header = asMap(readValue(parser, value), "header");
          break;
        case "switches":
          switches = parseSwitches(asMap(readValue(parser, value), "switches"));
          break;
        case "gti":
          gti = parseIntervals(readValue(parser, value), "gti");
          break;
        case "bursts":
          bursts = parseIntervals(readValue(parser, value), "bursts");
          break;
        case "wavecal":
          wavecal = parseWavecal(asMap(readValue(parser, value), "wavecal"));
          break;
        case "events":
          columns = readColumns(parser, value);
          break;
        default:
          log.debug("Ignoring unknown exposure field {}", field);
          parser.skipChildren();
          break;
      }
    }
    if (token != JsonToken.END_OBJECT) {
      throw new CalibrationException("unexpected " + token + " in exposure document");
    }
    if (header == null) {
      throw new CalibrationException("exposure document has no header");
    }
    if (columns == null) {
      throw new CalibrationException("exposure document has no events");
    }
    try {
      ExposureInfo info = parseHeader(rootname, header);
      return new Exposure(info, switches, IntervalSet.of(gti), bursts, wavecal, columns.toTable());
    } catch (IllegalArgumentException ex) {
      throw new CalibrationException("invalid exposure document: " + ex.getMessage(), null, ex);
    }
  }

  /**
   * Builds the exposure header from its keyword map; keyword names are case-insensitive.
   *
   * @param rootname exposure root name; may be {@code null}
   * @param header keyword values
   * @return header view
   * @throws CalibrationException when a required keyword is missing or a value is invalid
   */
  static ExposureInfo parseHeader(String rootname, Map<String, Object> header) throws CalibrationException {
    try {
      return buildHeader(rootname, header);
    } catch (IllegalArgumentException ex) {
      throw new CalibrationException("invalid exposure header: " + ex.getMessage(), null, ex);
    }
  }

  private static ExposureInfo buildHeader(String rootname, Map<String, Object> header) throws CalibrationException {
    Map<String, Object> h = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : header.entrySet()) {
      h.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue());
    }
    Detector detector = Detector.valueOf(requireString(h, "detector").trim().toUpperCase(Locale.ROOT));
    ExposureInfo.Builder builder = ExposureInfo.builder()
        .rootname(rootname)
        .detector(detector)
        .segment(Segment.parse(requireString(h, "segment")))
        .obsMode(ObsMode.parse(requireString(h, "obsmode")))
        .obsType(ObsType.parse(String.valueOf(h.getOrDefault("obstype", "SPECTROSCOPIC"))))
        .exptype(stringOr(h, "exptype", "EXTERNAL/SCI"))
        .optElem(stringOr(h, "opt_elem", ""))
        .cenwave((int) number(h, "cenwave", 0))
        .aperture(stringOr(h, "aperture", "PSA"))
        .fpoffset((int) number(h, "fpoffset", 0))
        .expstart(number(h, "expstart", 0))
        .exptime(number(h, "exptime", 0))
        .raTarg(number(h, "ra_targ", 0))
        .decTarg(number(h, "dec_targ", 0))
        .doppmagv(number(h, "doppmagv", 0))
        .doppzero(number(h, "doppzero", 0))
        .orbitper(number(h, "orbitper", 5760.0))
        .countrate(number(h, "countrate", 0))
        .subarray(Boolean.parseBoolean(String.valueOf(h.getOrDefault("subarray", "false"))))
        .nsubarray((int) number(h, "nsubarray", 0))
        .stimrate(number(h, "stimrate", 0))
        .randseed((long) number(h, "randseed", -1))
        .xOffset((int) number(h, "x_offset", 0))
        .sdqflags((int) number(h, "sdqflags", 0))
        .npix(detector.height(), detector.width());
    Object npix = h.get("npix");
    if (npix != null) {
      if (!(npix instanceof List<?> shape) || shape.size() != 2
          || !(shape.get(0) instanceof Number rows) || !(shape.get(1) instanceof Number cols)) {
        throw new CalibrationException("header npix must be [ny, nx] (was " + npix + ")");
      }
      builder.npix(rows.intValue(), cols.intValue());
    }
    return builder.build();
  }

  private static Map<Correction, SwitchState> parseSwitches(Map<String, Object> raw) throws CalibrationException {
    Map<Correction, SwitchState> switches = new EnumMap<>(Correction.class);
    for (Map.Entry<String, Object> entry : raw.entrySet()) {
      SwitchState state;
      try {
        state = SwitchState.parse(String.valueOf(entry.getValue()));
        switches.put(Correction.parse(entry.getKey()), state);
      } catch (IllegalArgumentException ex) {
        throw new CalibrationException("invalid switch " + entry.getKey() + ": " + ex.getMessage(), null, ex);
      }
      if (state != SwitchState.OMIT && state != SwitchState.PERFORM) {
        throw new CalibrationException("switch " + entry.getKey() + " must be OMIT or PERFORM (was " + state + ")");
      }
    }
    return switches;
  }

  private static List<Interval> parseIntervals(Object node, String field) throws CalibrationException {
    if (node == null) {
      return List.of();
    }
    if (!(node instanceof List<?> list)) {
      throw new CalibrationException(field + " must be a list of [start, stop] pairs");
    }
    List<Interval> intervals = new ArrayList<>(list.size());
    for (Object item : list) {
      if (!(item instanceof List<?> pair) || pair.size() != 2
          || !(pair.get(0) instanceof Number start) || !(pair.get(1) instanceof Number stop)) {
        throw new CalibrationException(field + " entry must be [start, stop] (was " + item + ")");
      }
      try {
        intervals.add(new Interval(start.doubleValue(), stop.doubleValue()));
      } catch (IllegalArgumentException ex) {
        throw new CalibrationException(field + " entry " + item + ": " + ex.getMessage(), null, ex);
      }
    }
    return intervals;
  }

  private static Map<String, WavecalShift> parseWavecal(Map<String, Object> raw) throws CalibrationException {
    Map<String, WavecalShift> shifts = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : raw.entrySet()) {
      Map<String, Object> s = asMap(entry.getValue(), "wavecal." + entry.getKey());
      shifts.put(entry.getKey().trim().toUpperCase(Locale.ROOT), new WavecalShift(
          number(s, "shift1", 0), number(s, "slope1", 0), number(s, "shift2", 0), number(s, "slope2", 0)));
    }
    return shifts;
  }

  private Columns readColumns(JsonParser parser, JsonToken start) throws IOException, CalibrationException {
    if (start != JsonToken.START_OBJECT) {
      throw new CalibrationException("events must be an object of columns");
    }
    Columns columns = new Columns();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String name = parser.getCurrentName().toLowerCase(Locale.ROOT);
      if (parser.nextToken() != JsonToken.START_ARRAY) {
        throw new CalibrationException("event column " + name + " must be an array");
      }
      DoubleColumn values = new DoubleColumn();
      JsonToken item;
      while ((item = parser.nextToken()) != JsonToken.END_ARRAY) {
        if (item != JsonToken.VALUE_NUMBER_INT && item != JsonToken.VALUE_NUMBER_FLOAT) {
          throw new CalibrationException("event column " + name + " holds non-numeric " + item);
        }
        values.add(parser.getDoubleValue());
      }
      columns.put(name, values.toArray());
    }
    return columns;
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException, CalibrationException {
    switch (token) {
      case START_OBJECT: {
        Map<String, Object> map = new LinkedHashMap<>();
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
          String name = parser.getCurrentName();
          map.put(name, readValue(parser, parser.nextToken()));
        }
        return map;
      }
      case START_ARRAY: {
        List<Object> list = new ArrayList<>();
        JsonToken item;
        while ((item = parser.nextToken()) != JsonToken.END_ARRAY) {
          list.add(readValue(parser, item));
        }
        return list;
      }
      case VALUE_STRING:
        return parser.getText();
      case VALUE_NUMBER_INT:
      case VALUE_NUMBER_FLOAT:
        return parser.getNumberValue();
      case VALUE_TRUE:
        return Boolean.TRUE;
      case VALUE_FALSE:
        return Boolean.FALSE;
      case VALUE_NULL:
        return null;
      default:
        throw new CalibrationException("unsupported JSON token " + token);
    }
  }

  private static Map<String, Object> asMap(Object node, String field) throws CalibrationException {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new CalibrationException(field + " must be an object");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      map.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return map;
  }

  private static String requireString(Map<String, Object> header, String key) throws CalibrationException {
    Object value = header.get(key);
    if (value == null) {
      throw new CalibrationException("header keyword " + key + " is required");
    }
    return String.valueOf(value);
  }

  private static String stringOr(Map<String, Object> header, String key, String fallback) {
    Object value = header.get(key);
    return value == null ? fallback : String.valueOf(value);
  }

  private static double number(Map<String, Object> map, String key, double fallback) throws CalibrationException {
    Object value = map.get(key);
    if (value == null) {
      return fallback;
    }
    if (!(value instanceof Number number)) {
      throw new CalibrationException(key + " must be a number (was " + value + ")");
    }
    return number.doubleValue();
  }

  /** Event columns as read, keyed by lower-case name. */
  private static final class Columns {
    private final Map<String, double[]> values = new LinkedHashMap<>();

    void put(String name, double[] column) {
      values.put(name, column);
    }

    EventTable toTable() throws CalibrationException {
      double[] time = require("time");
      EventTable.Builder builder = EventTable.builder(time, require("xraw"), require("yraw"));
      for (EventColumn column : EventColumn.values()) {
        double[] supplied = values.get(column.name().toLowerCase(Locale.ROOT));
        if (supplied != null) {
          builder.column(column, supplied);
        }
      }
      if (values.containsKey("pha")) {
        builder.pha(toInts(values.get("pha")));
      }
      if (values.containsKey("dq")) {
        builder.dq(toInts(values.get("dq")));
      }
      if (values.containsKey("epsilon")) {
        builder.epsilon(values.get("epsilon"));
      }
      return builder.build();
    }

    private double[] require(String name) throws CalibrationException {
      double[] column = values.get(name);
      if (column == null) {
        throw new CalibrationException("event column " + name + " is required");
      }
      return column;
    }

    private static int[] toInts(double[] column) {
      int[] ints = new int[column.length];
      for (int i = 0; i < column.length; i++) {
        ints[i] = (int) column[i];
      }
      return ints;
    }
  }

  /** Growable primitive buffer for one streamed column. */
  private static final class DoubleColumn {
    private double[] data = new double[1024];
    private int size;

    void add(double value) {
      if (size == data.length) {
        data = Arrays.copyOf(data, data.length * 2);
      }
      data[size++] = value;
    }

    double[] toArray() {
      return Arrays.copyOf(data, size);
    }
  }
}

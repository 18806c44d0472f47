package ca.gc.cra.tagcal.infrastructure.reference;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a {@link ReferenceTable} with typed column accessors.
 *
 * <p>Accessors fail with {@link CalibrationException} when a column is absent or holds the wrong type, naming the
 * table, the row index and the column.</p>
 *
 * @since 0.1.0
 */
public final class ReferenceRow {
  private final String table;
  private final int index;
  private final Map<String, Object> values;

  ReferenceRow(String table, int index, Map<String, Object> values) {
    this.table = Objects.requireNonNull(table, "table");
    this.index = index;
    Map<String, Object> present = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      if (entry.getValue() != null) {
        present.put(entry.getKey(), entry.getValue());
      }
    }
    this.values = Collections.unmodifiableMap(present);
  }

  public boolean has(String column) {
    return values.containsKey(column);
  }

  /** Raw column value, or {@code null} when absent. */
  public Object raw(String column) {
    return values.get(column);
  }

  public String string(String column) throws CalibrationException {
    return String.valueOf(require(column));
  }

  public double number(String column) throws CalibrationException {
    return toDouble(require(column), column);
  }

  /**
   * Numeric column with a fallback for absent values.
   *
   * @param column column name
   * @param fallback value returned when the column is absent
   * @return column value
   * @throws CalibrationException when the value is present but not numeric
   */
  public double number(String column, double fallback) throws CalibrationException {
    Object value = values.get(column);
    return value == null ? fallback : toDouble(value, column);
  }

  public int integer(String column) throws CalibrationException {
    Object value = require(column);
    double number = toDouble(value, column);
    if (number != Math.rint(number)) {
      throw malformed(column, "integer", value);
    }
    return (int) number;
  }

  /**
   * List column as a primitive array.
   *
   * @param column column name
   * @return numeric values in order
   * @throws CalibrationException when the column is absent, not a list or holds non-numeric items
   */
  public double[] numbers(String column) throws CalibrationException {
    Object value = require(column);
    if (!(value instanceof List<?> list)) {
      throw malformed(column, "list", value);
    }
    double[] result = new double[list.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = toDouble(list.get(i), column);
    }
    return result;
  }

  /**
   * Matrix column given as a list of rows.
   *
   * @param column column name
   * @return rectangular matrix indexed {@code [row][column]}
   * @throws CalibrationException when the value is not a non-empty rectangular list of numeric lists
   */
  public double[][] matrix(String column) throws CalibrationException {
    Object value = require(column);
    if (!(value instanceof List<?> outer) || outer.isEmpty()) {
      throw malformed(column, "non-empty matrix", value);
    }
    double[][] result = new double[outer.size()][];
    for (int r = 0; r < result.length; r++) {
      if (!(outer.get(r) instanceof List<?> inner)) {
        throw malformed(column, "matrix row", outer.get(r));
      }
      result[r] = new double[inner.size()];
      for (int c = 0; c < inner.size(); c++) {
        result[r][c] = toDouble(inner.get(c), column);
      }
      if (result[r].length != result[0].length) {
        throw new CalibrationException(
            table + " row " + index + ": column " + column + " is not rectangular");
      }
    }
    return result;
  }

  /**
   * Tests whether this row equals every filter value. Strings compare case-insensitively and numbers numerically.
   *
   * @param filter column to expected value
   * @return {@code true} when every filter column matches
   */
  boolean matches(Map<String, Object> filter) {
    for (Map.Entry<String, Object> entry : filter.entrySet()) {
      Object actual = values.get(entry.getKey());
      if (actual == null || !sameValue(actual, entry.getValue())) {
        return false;
      }
    }
    return true;
  }

  private static boolean sameValue(Object actual, Object expected) {
    if (actual instanceof Number a && expected instanceof Number e) {
      return Double.compare(a.doubleValue(), e.doubleValue()) == 0;
    }
    return String.valueOf(actual).trim().toUpperCase(Locale.ROOT)
        .equals(String.valueOf(expected).trim().toUpperCase(Locale.ROOT));
  }

  private Object require(String column) throws CalibrationException {
    Object value = values.get(column);
    if (value == null) {
      throw new CalibrationException(table + " row " + index + ": column " + column + " is missing");
    }
    return value;
  }

  private double toDouble(Object value, String column) throws CalibrationException {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    throw malformed(column, "number", value);
  }

  private CalibrationException malformed(String column, String expected, Object value) {
    return new CalibrationException(
        table + " row " + index + ": column " + column + " must be a " + expected + " (was " + value + ")");
  }

  @Override
  public String toString() {
    return table + "[" + index + "]" + values;
  }
}

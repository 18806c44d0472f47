package ca.gc.cra.tagcal.infrastructure.reference;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.application.port.ReferenceLookupException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Named, read-only calibration table: an optional header mapping plus a list of rows.
 * <p><strong>Why:</strong> Every correction queries its parameters by column equality; this class centralises the
 * matching rules and the exactly-one / at-least-one contracts.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class ReferenceTable {
  private final String name;
  private final Map<String, Object> header;
  private final List<ReferenceRow> rows;

  /**
   * Creates a table.
   *
   * @param name table name, e.g. {@code deadtab}
   * @param header header keywords; may be empty
   * @param rows row mappings in document order
   */
  public ReferenceTable(String name, Map<String, Object> header, List<Map<String, Object>> rows) {
    this.name = Objects.requireNonNull(name, "name");
    this.header = Map.copyOf(Objects.requireNonNull(header, "header"));
    List<ReferenceRow> parsed = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      parsed.add(new ReferenceRow(name, i, rows.get(i)));
    }
    this.rows = List.copyOf(parsed);
  }

  public String name() {
    return name;
  }

  public List<ReferenceRow> rows() {
    return rows;
  }

  public Set<String> headerKeys() {
    return header.keySet();
  }

  /**
   * Numeric header keyword.
   *
   * @param key keyword name
   * @param fallback value returned when the keyword is absent
   * @return keyword value
   * @throws CalibrationException when the keyword is present but not numeric
   */
  public double headerNumber(String key, double fallback) throws CalibrationException {
    Object value = header.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    throw new CalibrationException(name + " header " + key + " must be a number (was " + value + ")");
  }

  /** Indicates whether any row carries the column. */
  public boolean hasColumn(String column) {
    for (ReferenceRow row : rows) {
      if (row.has(column)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Rows matching every filter entry, possibly none.
   *
   * @param filter column to expected value
   * @return matching rows in document order
   */
  public List<ReferenceRow> select(Map<String, Object> filter) {
    List<ReferenceRow> matches = new ArrayList<>();
    for (ReferenceRow row : rows) {
      if (row.matches(filter)) {
        matches.add(row);
      }
    }
    return matches;
  }

  /**
   * The single row matching the filter.
   *
   * @param filter column to expected value
   * @return matching row
   * @throws ReferenceLookupException when zero or several rows match
   */
  public ReferenceRow exactlyOne(Map<String, Object> filter) throws ReferenceLookupException {
    List<ReferenceRow> matches = select(filter);
    if (matches.size() != 1) {
      throw new ReferenceLookupException(name, filter.toString(), matches.size());
    }
    return matches.get(0);
  }

  /**
   * Rows matching the filter, requiring at least one.
   *
   * @param filter column to expected value
   * @return matching rows in document order
   * @throws ReferenceLookupException when no row matches
   */
  public List<ReferenceRow> atLeastOne(Map<String, Object> filter) throws ReferenceLookupException {
    List<ReferenceRow> matches = select(filter);
    if (matches.isEmpty()) {
      throw new ReferenceLookupException(name, filter.toString(), 0);
    }
    return matches;
  }
}

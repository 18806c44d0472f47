package ca.gc.cra.tagcal.application.port;

/**
 * Raised when a reference-table query that must match exactly one (or at least one) row does not.
 *
 * @since 0.1.0
 */
public final class ReferenceLookupException extends CalibrationException {
  private static final long serialVersionUID = 1L;

  private final String table;

  /**
   * Creates an exception naming the table and the filter that failed.
   *
   * @param table reference table name, e.g. {@code disptab}
   * @param filter human-readable filter description
   * @param matches number of rows the filter matched
   */
  public ReferenceLookupException(String table, String filter, int matches) {
    super(describe(table, filter, matches));
    this.table = table;
  }

  /**
   * Creates an exception for a table absent from the reference document.
   *
   * @param table missing table name
   */
  public ReferenceLookupException(String table) {
    super("reference table " + table + " is missing");
    this.table = table;
  }

  public String table() {
    return table;
  }

  private static String describe(String table, String filter, int matches) {
    if (matches == 0) {
      return "no row in " + table + " matches " + filter;
    }
    return matches + " rows in " + table + " match " + filter + " but exactly one is required";
  }
}

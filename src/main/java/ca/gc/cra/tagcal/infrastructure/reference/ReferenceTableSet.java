package ca.gc.cra.tagcal.infrastructure.reference;

import ca.gc.cra.tagcal.application.port.ReferenceLookupException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reference tables of one document, keyed by lower-case table name.
 *
 * @since 0.1.0
 */
public final class ReferenceTableSet {
  private final Map<String, ReferenceTable> tables;

  public ReferenceTableSet(List<ReferenceTable> tables) {
    Map<String, ReferenceTable> byName = new LinkedHashMap<>();
    for (ReferenceTable table : tables) {
      if (byName.put(table.name(), table) != null) {
        throw new IllegalArgumentException("duplicate reference table " + table.name());
      }
    }
    this.tables = byName;
  }

  public List<ReferenceTable> tables() {
    return List.copyOf(tables.values());
  }

  public Optional<ReferenceTable> find(String name) {
    return Optional.ofNullable(tables.get(name));
  }

  /**
   * Returns a table a requested correction depends on.
   *
   * @param name table name
   * @return table
   * @throws ReferenceLookupException when the document has no such table
   */
  public ReferenceTable require(String name) throws ReferenceLookupException {
    ReferenceTable table = tables.get(name);
    if (table == null) {
      throw new ReferenceLookupException(name);
    }
    return table;
  }
}

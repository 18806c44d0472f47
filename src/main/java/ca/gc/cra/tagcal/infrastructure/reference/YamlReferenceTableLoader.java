package ca.gc.cra.tagcal.infrastructure.reference;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a reference-table document from YAML.
 *
 * <p>The document root maps table names to sections with an optional {@code header} mapping and a {@code rows}
 * list of mappings.</p>
 *
 * @since 0.1.0
 */
public final class YamlReferenceTableLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlReferenceTableLoader.class);

  private YamlReferenceTableLoader() {}

  /**
   * Reads and validates the structure of a reference document.
   *
   * @param path YAML document
   * @return tables in document order
   * @throws IOException when the file cannot be read
   * @throws CalibrationException when the YAML is invalid or a section is malformed
   */
  public static ReferenceTableSet load(Path path) throws IOException, CalibrationException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new IOException("Reference table document not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      ReferenceTableSet tables = parse(document, path.toString());
      log.info("Loaded {} reference tables from {}", tables.tables().size(), path);
      return tables;
    } catch (YAMLException ex) {
      throw new CalibrationException("Failed to parse reference tables at " + path, null, ex);
    }
  }

  /**
   * Builds tables from an already parsed YAML tree.
   *
   * @param document YAML root; {@code null} yields an empty set
   * @param source description of the document for error messages
   * @return tables in document order
   * @throws CalibrationException when a section is malformed
   */
  static ReferenceTableSet parse(Object document, String source) throws CalibrationException {
    if (document == null) {
      return new ReferenceTableSet(List.of());
    }
    Map<String, Object> root = asMap(document, source);
    List<ReferenceTable> tables = new ArrayList<>();
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      String name = entry.getKey().trim().toLowerCase(Locale.ROOT);
      Map<String, Object> section = asMap(entry.getValue(), name);
      Map<String, Object> header = section.get("header") == null
          ? Map.of()
          : asMap(section.get("header"), name + ".header");
      List<Map<String, Object>> rows = new ArrayList<>();
      Object rowsNode = section.get("rows");
      if (rowsNode != null) {
        if (!(rowsNode instanceof Iterable<?> iterable)) {
          throw new CalibrationException(name + ".rows must be a list");
        }
        for (Object row : iterable) {
          rows.add(lowerCaseKeys(asMap(row, name + " row")));
        }
      }
      tables.add(new ReferenceTable(name, lowerCaseKeys(header), rows));
    }
    return new ReferenceTableSet(tables);
  }

  private static Map<String, Object> asMap(Object node, String context) throws CalibrationException {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new CalibrationException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new CalibrationException(context + " contains non-string key " + entry.getKey());
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Map<String, Object> lowerCaseKeys(Map<String, Object> source) {
    Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      result.put(entry.getKey().trim().toLowerCase(Locale.ROOT), entry.getValue());
    }
    return result;
  }
}

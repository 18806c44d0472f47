package ca.gc.cra.tagcal.api;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.exposure.Segment;
import ca.gc.cra.tagcal.infrastructure.reference.ReferenceRow;
import ca.gc.cra.tagcal.infrastructure.reference.ReferenceTable;
import ca.gc.cra.tagcal.infrastructure.reference.ReferenceTableSet;
import ca.gc.cra.tagcal.infrastructure.reference.TableBackedReferenceTables;
import ca.gc.cra.tagcal.infrastructure.reference.YamlReferenceTableLoader;
import ca.gc.cra.tagcal.logging.LoggingConfigurator;
import ca.gc.cra.tagcal.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a reference-table document, prints its inventory and checks the livetime tables.
 *
 * @since 0.1.0
 */
public final class RefCheckCli {
  private static final Logger log = LoggerFactory.getLogger(RefCheckCli.class);
  private static final String SUMMARY_USAGE = "usage: refcheck refs=REFS.yaml [config=PATH]";
  private static final String HELP_TEXT = """
      TAGCAL refcheck

      Usage:
        refcheck refs=./refs.yaml

      Prints every table with its row count and header keys, then checks that the
      livetime rate axis of each deadtab segment is strictly increasing.
      Exits 4 when the document is invalid.
      """;

  private RefCheckCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Path refs;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      String configPath = ConfigCliUtils.extractConfigPath(kv);
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("refcheck", configPath, kv, log::warn);
      String raw = effective.get("refs");
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("refs is required");
      }
      refs = Paths.requireReadableFile("refs", Path.of(raw.trim()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid refcheck arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    try {
      ReferenceTableSet tables = YamlReferenceTableLoader.load(refs);
      CliPrinter.println("Reference tables in " + refs + ":");
      for (ReferenceTable table : tables.tables()) {
        CliPrinter.printf(" %-10s rows=%-6d header=%s", table.name(), table.rows().size(), table.headerKeys());
      }
      int checked = checkLivetimeAxes(tables);
      CliPrinter.printf("Livetime tables OK for %d segment(s).", checked);
      return ExitCode.SUCCESS;
    } catch (CalibrationException ex) {
      log.error("Invalid reference document {}: {}", refs, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read reference document {}", refs, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while checking {}", refs, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  /**
   * Builds every deadtab segment's livetime table, which rejects a rate axis that is not strictly increasing.
   *
   * @param tables loaded document
   * @return number of segments checked
   * @throws CalibrationException when a segment name is unknown or a rate axis is invalid
   */
  static int checkLivetimeAxes(ReferenceTableSet tables) throws CalibrationException {
    Optional<ReferenceTable> deadtab = tables.find("deadtab");
    if (deadtab.isEmpty()) {
      return 0;
    }
    Set<Segment> segments = EnumSet.noneOf(Segment.class);
    for (ReferenceRow row : deadtab.get().rows()) {
      String name = row.string("segment");
      try {
        segments.add(Segment.parse(name));
      } catch (IllegalArgumentException ex) {
        throw new CalibrationException("deadtab row names unknown segment " + name, null, ex);
      }
    }
    TableBackedReferenceTables references = new TableBackedReferenceTables(tables);
    for (Segment segment : segments) {
      references.livetime(segment);
    }
    return segments.size();
  }
}

package ca.gc.cra.tagcal.infrastructure.product;

import ca.gc.cra.tagcal.application.port.ProductSink;
import ca.gc.cra.tagcal.domain.calibration.CalibrationResult;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ProductSink} writing the products of one run into an output directory.
 * <p><strong>Why:</strong> Products are only materialised once the pipeline finished, so a failed calibration leaves
 * the directory untouched.</p>
 * <p><strong>Role:</strong> Infrastructure adapter behind the product output port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@code <rootname>_corrtag.json}: corrected event columns, streamed with Jackson.</li>
 *   <li>{@code <rootname>_counts.tci} and {@code <rootname>_flt.tci}: SCI, ERR and DQ planes.</li>
 *   <li>{@code <rootname>_csum.tci}: sparse cumulative-sum image when one was produced.</li>
 *   <li>{@code <rootname>_meta.json}: run metadata.</li>
 *   <li>Stim and livetime diagnostic logs at their configured paths.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one run at a time.</p>
 *
 * @since 0.1.0
 */
public final class FileProductSink implements ProductSink {
  private static final Logger log = LoggerFactory.getLogger(FileProductSink.class);

  private final Path outDir;
  private final Optional<Path> stimLog;
  private final Optional<Path> livetimeLog;
  private final JsonFactory factory = new JsonFactory();

  /**
   * Creates a sink.
   *
   * @param outDir product directory; created when missing
   * @param stimLog destination of the stim log, if requested
   * @param livetimeLog destination of the livetime log, if requested
   */
  public FileProductSink(Path outDir, Optional<Path> stimLog, Optional<Path> livetimeLog) {
    this.outDir = Objects.requireNonNull(outDir, "outDir");
    this.stimLog = Objects.requireNonNull(stimLog, "stimLog");
    this.livetimeLog = Objects.requireNonNull(livetimeLog, "livetimeLog");
  }

  @Override
  public void write(CalibrationResult result) throws IOException {
    Objects.requireNonNull(result, "result");
    Files.createDirectories(outDir);
    String rootname = result.info().rootname().toLowerCase(Locale.ROOT);

    Path corrtag = outDir.resolve(rootname + "_corrtag.json");
    writeEvents(result, corrtag);
    ImageContainerIO.writeRateImage(outDir.resolve(rootname + "_counts.tci"), result.counts());
    ImageContainerIO.writeRateImage(outDir.resolve(rootname + "_flt.tci"), result.flatfielded());
    if (result.csum().isPresent()) {
      ImageContainerIO.writeCsum(outDir.resolve(rootname + "_csum.tci"), result.csum().get());
    }
    try (Writer out = Files.newBufferedWriter(outDir.resolve(rootname + "_meta.json"), StandardCharsets.UTF_8)) {
      new MetadataJsonWriter(factory).write(result.metadata(), out);
    }
    if (stimLog.isPresent()) {
      writeLines(stimLog.get(), result.stimLog());
    }
    if (livetimeLog.isPresent()) {
      writeLines(livetimeLog.get(), result.livetimeLog());
    }
    log.info("Wrote products for {} to {}", result.info().rootname(), outDir);
  }

  private void writeEvents(CalibrationResult result, Path path) throws IOException {
    EventTable events = result.events();
    try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("rootname", result.info().rootname());
      gen.writeNumberField("exptime", result.info().exptime());
      gen.writeObjectFieldStart("events");
      gen.writeFieldName("time");
      gen.writeArray(events.timeSnapshot(), 0, events.size());
      gen.writeArrayFieldStart("xraw");
      for (int i = 0; i < events.size(); i++) {
        gen.writeNumber(events.xraw(i));
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("yraw");
      for (int i = 0; i < events.size(); i++) {
        gen.writeNumber(events.yraw(i));
      }
      gen.writeEndArray();
      for (EventColumn column : EventColumn.values()) {
        gen.writeFieldName(column.name().toLowerCase(Locale.ROOT));
        gen.writeArray(events.column(column), 0, events.size());
      }
      if (events.hasPha()) {
        gen.writeArrayFieldStart("pha");
        for (int i = 0; i < events.size(); i++) {
          gen.writeNumber(events.pha(i));
        }
        gen.writeEndArray();
      }
      gen.writeFieldName("dq");
      gen.writeArray(events.dq(), 0, events.size());
      gen.writeFieldName("epsilon");
      gen.writeArray(events.epsilon(), 0, events.size());
      gen.writeEndObject();
      gen.writeEndObject();
    }
  }

  private static void writeLines(Path path, List<String> lines) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.write(path, lines, StandardCharsets.UTF_8);
  }
}

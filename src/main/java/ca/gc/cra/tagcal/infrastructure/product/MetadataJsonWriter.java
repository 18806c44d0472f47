package ca.gc.cra.tagcal.infrastructure.product;

import ca.gc.cra.tagcal.domain.calibration.CalibrationMetadata;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.DopplerParameters;
import ca.gc.cra.tagcal.domain.calibration.PulseHeightSummary;
import ca.gc.cra.tagcal.domain.calibration.WavecalOffsets;
import ca.gc.cra.tagcal.domain.calibration.WavecalSummary;
import ca.gc.cra.tagcal.domain.image.ImageStatistics;
import ca.gc.cra.tagcal.domain.livetime.DeadtimeResult;
import ca.gc.cra.tagcal.domain.reference.PhotometryParameters;
import ca.gc.cra.tagcal.domain.stim.StimPosition;
import ca.gc.cra.tagcal.domain.stim.StimStatistics;
import ca.gc.cra.tagcal.domain.time.Interval;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.Writer;
import java.util.Map;
import java.util.TreeMap;

/**
 * Streams {@link CalibrationMetadata} as a pretty-printed JSON document.
 *
 * <p>Maps are written in a stable order: switches in pipeline order, reference keys and statistics by name. Absent
 * optional sections are omitted rather than written as {@code null}.</p>
 *
 * @since 0.1.0
 */
final class MetadataJsonWriter {
  private final JsonFactory factory;

  MetadataJsonWriter(JsonFactory factory) {
    this.factory = factory;
  }

  void write(CalibrationMetadata metadata, Writer out) throws IOException {
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeStringField("rootname", metadata.rootname());
      gen.writeBooleanField("nullData", metadata.nullData());
      gen.writeNumberField("exptime", metadata.exptime());
      gen.writeNumberField("globrate", metadata.globrate());

      gen.writeObjectFieldStart("switches");
      for (Correction correction : Correction.values()) {
        gen.writeStringField(correction.keyword(), metadata.state(correction).name());
      }
      gen.writeEndObject();

      gen.writeObjectFieldStart("referenceKeys");
      for (Map.Entry<String, String> entry : new TreeMap<>(metadata.referenceKeys()).entrySet()) {
        gen.writeStringField(entry.getKey(), entry.getValue());
      }
      gen.writeEndObject();

      if (metadata.randomSeed().isPresent()) {
        gen.writeNumberField("randomSeed", metadata.randomSeed().getAsLong());
      }

      gen.writeArrayFieldStart("gti");
      for (Interval interval : metadata.gti().intervals()) {
        gen.writeStartArray();
        gen.writeNumber(interval.start());
        gen.writeNumber(interval.stop());
        gen.writeEndArray();
      }
      gen.writeEndArray();

      if (metadata.pulseHeight() != null) {
        writePulseHeight(gen, metadata.pulseHeight());
      }
      if (metadata.stim1() != null && metadata.stim2() != null) {
        gen.writeObjectFieldStart("stims");
        writeStim(gen, "stim1", metadata.stim1());
        writeStim(gen, "stim2", metadata.stim2());
        gen.writeEndObject();
      }
      if (metadata.deadtime() != null) {
        writeDeadtime(gen, metadata.deadtime());
      }
      if (metadata.doppler() != null) {
        DopplerParameters doppler = metadata.doppler();
        gen.writeObjectFieldStart("doppler");
        gen.writeNumberField("magnitudePixels", doppler.magnitudePixels());
        gen.writeNumberField("zeroMjd", doppler.zeroMjd());
        gen.writeNumberField("periodSeconds", doppler.periodSeconds());
        gen.writeEndObject();
      }
      if (metadata.heliocentricVelocity().isPresent()) {
        gen.writeNumberField("heliocentricVelocity", metadata.heliocentricVelocity().getAsDouble());
      }
      if (metadata.wavecal() != null) {
        WavecalSummary wavecal = metadata.wavecal();
        gen.writeObjectFieldStart("wavecal");
        gen.writeNumberField("shift1", wavecal.averageShift1());
        gen.writeNumberField("shift2", wavecal.averageShift2());
        gen.writeNumberField("dpixel1", wavecal.dpixel1());
        gen.writeEndObject();
      }
      if (metadata.wavecalOffsets() != null) {
        WavecalOffsets offsets = metadata.wavecalOffsets();
        gen.writeObjectFieldStart("wavecalOffsets");
        gen.writeNumberField("minShift1", offsets.minShift1());
        gen.writeNumberField("maxShift1", offsets.maxShift1());
        gen.writeNumberField("minShift2", offsets.minShift2());
        gen.writeNumberField("maxShift2", offsets.maxShift2());
        gen.writeEndObject();
      }

      gen.writeObjectFieldStart("statistics");
      for (Map.Entry<String, ImageStatistics> entry : new TreeMap<>(metadata.statistics()).entrySet()) {
        gen.writeObjectFieldStart(entry.getKey());
        gen.writeNumberField("goodPixels", entry.getValue().goodPixels());
        gen.writeNumberField("mean", entry.getValue().mean());
        gen.writeNumberField("max", entry.getValue().max());
        gen.writeEndObject();
      }
      gen.writeEndObject();

      if (metadata.photometry() != null) {
        PhotometryParameters photometry = metadata.photometry();
        gen.writeObjectFieldStart("photometry");
        gen.writeNumberField("photflam", photometry.photflam());
        gen.writeNumberField("photfnu", photometry.photfnu());
        gen.writeNumberField("photplam", photometry.photplam());
        gen.writeNumberField("photbw", photometry.photbw());
        gen.writeEndObject();
      }

      gen.writeArrayFieldStart("warnings");
      for (String warning : metadata.warnings()) {
        gen.writeString(warning);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
  }

  private static void writePulseHeight(JsonGenerator gen, PulseHeightSummary summary) throws IOException {
    gen.writeObjectFieldStart("pulseHeight");
    gen.writeNumberField("lowerThreshold", summary.lowerThreshold());
    gen.writeNumberField("upperThreshold", summary.upperThreshold());
    gen.writeNumberField("rejectedLow", summary.rejectedLow());
    gen.writeNumberField("rejectedHigh", summary.rejectedHigh());
    gen.writeEndObject();
  }

  private static void writeStim(JsonGenerator gen, String name, StimStatistics stats) throws IOException {
    gen.writeObjectFieldStart(name);
    writePosition(gen, "reference", stats.reference());
    writePosition(gen, "mean", stats.mean());
    writePosition(gen, "rms", stats.rms());
    gen.writeNumberField("count", stats.totalCount());
    gen.writeEndObject();
  }

  private static void writePosition(JsonGenerator gen, String name, StimPosition position) throws IOException {
    gen.writeArrayFieldStart(name);
    gen.writeNumber(position.x());
    gen.writeNumber(position.y());
    gen.writeEndArray();
  }

  private static void writeDeadtime(JsonGenerator gen, DeadtimeResult dead) throws IOException {
    gen.writeObjectFieldStart("deadtime");
    gen.writeStringField("method", dead.method().name());
    gen.writeNumberField("rate", dead.rate());
    gen.writeNumberField("actualRate", dead.actualRate());
    gen.writeNumberField("actualLivetime", dead.actualLivetime());
    gen.writeNumberField("counterRate", dead.counterRate());
    gen.writeNumberField("counterLivetime", dead.counterLivetime());
    if (dead.stimRate().isPresent()) {
      gen.writeNumberField("stimRate", dead.stimRate().getAsDouble());
    }
    gen.writeNumberField("stimLivetime", dead.stimLivetime());
    gen.writeBooleanField("estimatesDisagree", dead.estimatesDisagree());
    gen.writeNumberField("windows", dead.windows().size());
    gen.writeEndObject();
  }
}

package ca.gc.cra.tagcal.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.List;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts TAGCAL runtime logging from CLI flags.
 * <p><strong>Why:</strong> Per-window stim and livetime detail is logged at DEBUG; {@code --verbose} exposes it
 * without editing {@code logback.xml}. Only the calibration packages are raised, so the OTLP exporter and its gRPC
 * transport do not flood the console with their own DEBUG output.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  /** Logger that receives DEBUG when verbose output is requested. */
  public static final String CALIBRATION_LOGGER = "ca.gc.cra.tagcal";

  /** Third-party loggers pinned to INFO while the calibration packages run at DEBUG. */
  static final List<String> LIBRARY_LOGGERS = List.of("io.opentelemetry", "io.grpc", "okhttp3");

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the calibration packages to DEBUG and pins exporter libraries to INFO.
   *
   * @return {@code true} when the Logback levels were applied
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
          factory.getClass().getName());
      return false;
    }
    context.getLogger(CALIBRATION_LOGGER).setLevel(Level.DEBUG);
    for (String name : LIBRARY_LOGGERS) {
      Logger library = context.getLogger(name);
      if (library.getLevel() == null) {
        library.setLevel(Level.INFO);
      }
    }
    return true;
  }
}

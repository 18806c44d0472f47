package ca.gc.cra.tagcal.api;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.config.CalibrateConfig;
import ca.gc.cra.tagcal.config.CompositionRoot;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.tagcal.logging.LoggingConfigurator;
import ca.gc.cra.tagcal.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point calibrating one exposure document.
 *
 * @since 0.1.0
 */
public final class CalibrateCli {
  private static final Logger log = LoggerFactory.getLogger(CalibrateCli.class);
  private static final String SUMMARY_USAGE =
      "usage: calibrate in=EXPOSURE.json refs=REFS.yaml [out=DIR] [csum=true|false] [randSeed=N] "
          + "[stimLog=PATH] [livetimeLog=PATH] [switch.<correction>=OMIT|PERFORM] [config=PATH] "
          + "[--dry-run] [--allow-overwrite] [metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      TAGCAL calibrate

      Usage:
        calibrate in=./lb4a01_rawtag_a.json refs=./refs.yaml out=./products [options]

      Required:
        in=PATH                    Exposure document (JSON)
        refs=PATH                  Reference tables (YAML)

      Optional:
        out=PATH                   Product directory (default current directory)
        csum=true|false            Also write the cumulative-sum image
        randSeed=N                 Override the exposure's randomization seed
        stimLog=PATH               Write per-window stim positions
        livetimeLog=PATH           Write per-window livetime factors
        switch.<name>=OMIT|PERFORM Override a correction request, e.g. switch.doppcorr=OMIT
        config=PATH                YAML file with common: and calibrate: sections
        --dry-run                  Validate inputs and print the plan without calibrating
        --allow-overwrite          Permit writing into a non-empty product directory
        metricsExporter=otlp|none  Configure metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private CalibrateCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the command without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    Map<String, String> effective;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      if (input.hasFlag("--dry-run")) {
        kv.put("dryRun", "true");
      }
      if (input.hasFlag("--allow-overwrite")) {
        kv.put("allowOverwrite", "true");
      }
      String configPath = ConfigCliUtils.extractConfigPath(kv);
      effective = ConfigCliUtils.effectiveConfig("calibrate", configPath, kv, log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid calibrate arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    if (input.verbose() || ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for calibrate CLI");
    }

    CalibrateConfig config;
    Path outDir;
    try {
      Map<String, String> configInputs = new LinkedHashMap<>(effective);
      TelemetryConfigurator.configureMetrics(configInputs);
      config = CalibrateConfig.fromMap(configInputs);
      Paths.requireReadableFile("in", config.input());
      Paths.requireReadableFile("refs", config.references());
      outDir = Paths.validateWritableDir(config.outputDirectory(), !config.dryRun(), config.allowOverwrite());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid calibrate configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (config.dryRun()) {
      printDryRunPlan(config, outDir);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      log.info("Calibrating {} with references {} into {}", config.input(), config.references(), outDir);
      new CompositionRoot(config, metrics).calibrateUseCase().run();
      return ExitCode.SUCCESS;
    } catch (CalibrationException ex) {
      log.error("Calibration inputs are inconsistent: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Calibration I/O failure for {}", config.input(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while calibrating {}", config.input(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(CalibrateConfig config, Path outDir) {
    CliPrinter.printLines(
        "Calibrate dry-run: no products will be written.",
        " Exposure          : " + config.input(),
        " Reference tables  : " + config.references(),
        " Product directory : " + outDir,
        " Cumulative sum    : " + config.csum(),
        " Random seed       : " + (config.randomSeed().isPresent()
            ? Long.toString(config.randomSeed().getAsLong()) : "<header>"),
        " Stim log          : " + config.stimLog().map(Path::toString).orElse("<none>"),
        " Livetime log      : " + config.livetimeLog().map(Path::toString).orElse("<none>"),
        " Allow overwrite   : " + config.allowOverwrite());
    for (Map.Entry<Correction, SwitchState> entry : config.switchOverrides().entrySet()) {
      CliPrinter.printf(" Override %-8s : %s", entry.getKey().keyword(), entry.getValue());
    }
    CliPrinter.println(" Re-run without --dry-run to calibrate.");
  }
}

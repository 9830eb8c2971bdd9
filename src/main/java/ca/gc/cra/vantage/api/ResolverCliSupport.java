package ca.gc.cra.vantage.api;

import ca.gc.cra.vantage.application.pipeline.SegmentRefreshUseCase;
import ca.gc.cra.vantage.application.port.ClockPort;
import ca.gc.cra.vantage.application.port.MetricsPort;
import ca.gc.cra.vantage.application.port.SegmentPlanSink;
import ca.gc.cra.vantage.application.segment.SegmentEngine;
import ca.gc.cra.vantage.config.ConfigMerger;
import ca.gc.cra.vantage.config.DefaultsForMode;
import ca.gc.cra.vantage.config.ResolverConfig;
import ca.gc.cra.vantage.config.YamlConfigLoader;
import ca.gc.cra.vantage.infrastructure.topology.JsonAgentRegistry;
import ca.gc.cra.vantage.infrastructure.topology.JsonTopologySource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration loading, wiring, and failure mapping shared by {@link ResolveCli} and {@link WatchCli}.
 */
final class ResolverCliSupport {
  private static final Logger log = LoggerFactory.getLogger(ResolverCliSupport.class);

  private ResolverCliSupport() {}

  /**
   * Parses CLI pairs, merges the optional YAML file and defaults, and builds a typed configuration.
   *
   * @param mode {@code resolve} or {@code watch}
   * @param input parsed CLI input
   * @param usage one-line usage printed on argument errors
   * @return loaded configuration, or the exit code to return
   */
  static Loaded loadConfig(String mode, CliInput input, String usage) {
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return Loaded.failed(ExitCode.INVALID_ARGS);
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return Loaded.failed(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return Loaded.failed(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Loaded.failed(ExitCode.IO_ERROR);
      }
    }

    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return Loaded.failed(ExitCode.INVALID_ARGS);
    }

    ResolverConfig config;
    try {
      config = ResolverConfig.fromMap(effective);
      TelemetryConfigurator.configureMetrics(config);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      return Loaded.failed(ExitCode.CONFIG_ERROR);
    }
    return new Loaded(config, null);
  }

  static SegmentRefreshUseCase newUseCase(ResolverConfig config, MetricsPort metrics, SegmentPlanSink sink) {
    return new SegmentRefreshUseCase(
        new JsonTopologySource(config.topology()),
        new JsonAgentRegistry(config.agents()),
        sink,
        new SegmentEngine(metrics),
        metrics,
        ClockPort.SYSTEM);
  }

  static void printDryRunPlan(String mode, ResolverConfig config) {
    CliPrinter.printLines(
        "Segment " + mode + " dry-run: no plan will be written.",
        " Topology          : " + config.topology(),
        " Agents            : " + config.agents(),
        " Output            : " + (config.writesToStdout() ? "<stdout>" : config.out()),
        " Refresh interval  : " + config.refreshInterval().toSeconds() + "s",
        " Cycles            : " + (config.cycles() == 0 ? "until interrupted" : config.cycles()),
        " Metrics exporter  : " + config.metricsExporter(),
        " Re-run without --dry-run to resolve segments.");
  }

  /**
   * Maps a failure escaping a use case to an exit code, logging it.
   *
   * @param mode command name for log messages
   * @param ex failure
   * @return exit code to return
   */
  static ExitCode mapFailure(String mode, Exception ex) {
    if (ex instanceof InterruptedException) {
      Thread.currentThread().interrupt();
      log.error("Segment {} interrupted; shutting down", mode);
      return ExitCode.INTERRUPTED;
    }
    if (ex instanceof IllegalArgumentException) {
      log.error("Segment {} configuration error: {}", mode, ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    }
    if (ex instanceof IOException) {
      log.error("Segment {} I/O failure", mode, ex);
      return ExitCode.IO_ERROR;
    }
    log.error("Unexpected failure in segment {}", mode, ex);
    return ExitCode.RUNTIME_FAILURE;
  }

  /** Outcome of {@link #loadConfig}: exactly one of the fields is non-null. */
  record Loaded(ResolverConfig config, ExitCode failure) {
    static Loaded failed(ExitCode failure) {
      return new Loaded(null, failure);
    }
  }
}

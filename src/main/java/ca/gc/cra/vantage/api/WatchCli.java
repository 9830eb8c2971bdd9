package ca.gc.cra.vantage.api;

import ca.gc.cra.vantage.application.pipeline.SegmentRefreshUseCase;
import ca.gc.cra.vantage.config.DefaultsForMode;
import ca.gc.cra.vantage.config.ResolverConfig;
import ca.gc.cra.vantage.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.vantage.infrastructure.persistence.JsonSegmentPlanWriter;
import ca.gc.cra.vantage.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs segment resolution periodically, re-reading topology and agents every cycle.
 *
 * @since 0.1.0
 */
public final class WatchCli {
  private static final Logger log = LoggerFactory.getLogger(WatchCli.class);
  private static final String SUMMARY_USAGE =
      "usage: watch topology=PATH agents=PATH [out=PATH|-] [refreshIntervalSeconds=N] [cycles=N] "
          + "[config=PATH] [--dry-run] [metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      Segment watch

      Usage:
        watch topology=./topology.json agents=./agents.json refreshIntervalSeconds=30 [options]

      Required:
        topology=PATH              Topology snapshot JSON, re-read every cycle
        agents=PATH                Agent registry JSON, re-read every cycle

      Optional:
        out=PATH|-                 Plan output; a file is replaced each cycle, '-' appends one line per cycle
        refreshIntervalSeconds=N   Delay between cycles, 1..86400 (default 60)
        cycles=N                   Stop after N cycles; 0 runs until interrupted (default 0)
        config=PATH                YAML file with 'common' and 'watch' sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                  Validate configuration and print it without resolving
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Notes:
        A failed cycle is logged and counted; the previous plan stays in place and the schedule continues.
      """;

  private WatchCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the command without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for watch CLI");
    }

    ResolverCliSupport.Loaded loaded =
        ResolverCliSupport.loadConfig(DefaultsForMode.WATCH, input, SUMMARY_USAGE);
    if (loaded.failure() != null) {
      return loaded.failure();
    }
    ResolverConfig config = loaded.config();
    if (config.verbose() && !input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    if (input.hasFlag("--dry-run")) {
      ResolverCliSupport.printDryRunPlan(DefaultsForMode.WATCH, config);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
        JsonSegmentPlanWriter sink = JsonSegmentPlanWriter.forTarget(config.out())) {
      SegmentRefreshUseCase useCase = ResolverCliSupport.newUseCase(config, metrics, sink);
      log.info(
          "Watching topology {} every {}s ({})",
          config.topology(),
          config.refreshInterval().toSeconds(),
          config.cycles() == 0 ? "until interrupted" : config.cycles() + " cycles");
      long published = useCase.runPeriodically(config.refreshInterval(), config.cycles());
      log.info("Segment watch finished after {} published cycles", published);
      if (config.cycles() > 0 && published == 0) {
        log.error("No segment cycle succeeded");
        return ExitCode.RUNTIME_FAILURE;
      }
      return ExitCode.SUCCESS;
    } catch (Exception ex) {
      return ResolverCliSupport.mapFailure(DefaultsForMode.WATCH, ex);
    }
  }
}

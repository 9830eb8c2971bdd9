package ca.gc.cra.vantage.api;

import ca.gc.cra.vantage.application.pipeline.SegmentRefreshUseCase;
import ca.gc.cra.vantage.config.DefaultsForMode;
import ca.gc.cra.vantage.config.ResolverConfig;
import ca.gc.cra.vantage.domain.agent.SegmentPlan;
import ca.gc.cra.vantage.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.vantage.infrastructure.persistence.JsonSegmentPlanWriter;
import ca.gc.cra.vantage.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one segment resolution cycle and writes the resulting plan.
 *
 * @since 0.1.0
 */
public final class ResolveCli {
  private static final Logger log = LoggerFactory.getLogger(ResolveCli.class);
  private static final String SUMMARY_USAGE =
      "usage: resolve topology=PATH agents=PATH [out=PATH|-] [config=PATH] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      Segment resolve

      Usage:
        resolve topology=./topology.json agents=./agents.json [options]

      Required:
        topology=PATH              Topology snapshot JSON
        agents=PATH                Agent registry JSON

      Optional:
        out=PATH|-                 Plan output file; '-' writes to stdout (default)
        config=PATH                YAML file with 'common' and 'resolve' sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                  Validate configuration and print it without resolving
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private ResolveCli() {}

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
      log.debug("Verbose logging enabled for resolve CLI");
    }

    ResolverCliSupport.Loaded loaded =
        ResolverCliSupport.loadConfig(DefaultsForMode.RESOLVE, input, SUMMARY_USAGE);
    if (loaded.failure() != null) {
      return loaded.failure();
    }
    ResolverConfig config = loaded.config();
    if (config.verbose() && !input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    if (input.hasFlag("--dry-run")) {
      ResolverCliSupport.printDryRunPlan(DefaultsForMode.RESOLVE, config);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
        JsonSegmentPlanWriter sink = JsonSegmentPlanWriter.forTarget(config.out())) {
      SegmentRefreshUseCase useCase = ResolverCliSupport.newUseCase(config, metrics, sink);
      SegmentPlan plan = useCase.runCycle();
      log.info(
          "Resolved segments for {} agents; {} interfaces left unclaimed",
          plan.agents().size(),
          plan.notYetClaimed().isEmpty() ? 0 : plan.notYetClaimed().get(0).size());
      return ExitCode.SUCCESS;
    } catch (Exception ex) {
      return ResolverCliSupport.mapFailure(DefaultsForMode.RESOLVE, ex);
    }
  }
}

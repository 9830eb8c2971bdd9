/**
 * CLI entry points for the segment controller.
 * <p><strong>Role:</strong> Driving adapters; parse {@code key=value} arguments, merge YAML configuration,
 * configure logging and metrics, then run {@link ca.gc.cra.vantage.application.pipeline.SegmentRefreshUseCase}.</p>
 * <p><strong>Exit codes:</strong> See {@link ca.gc.cra.vantage.api.ExitCode}.</p>
 */
package ca.gc.cra.vantage.api;

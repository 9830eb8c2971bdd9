/**
 * Logging utilities that tune Logback verbosity for CLI runs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vantage.logging;

/**
 * Configuration loading for the segment controller CLI.
 * <p><strong>Precedence:</strong> CLI {@code key=value} pairs override the YAML file, which overrides
 * {@link ca.gc.cra.vantage.config.DefaultsForMode}.</p>
 * <p><strong>Concurrency:</strong> Loaders are stateless; {@link ca.gc.cra.vantage.config.ResolverConfig} is
 * immutable.</p>
 */
package ca.gc.cra.vantage.config;

/**
 * Jackson streaming helpers shared by the JSON file adapters.
 * <p><strong>Concurrency:</strong> Helpers are stateless apart from a thread-safe {@code JsonFactory}.</p>
 */
package ca.gc.cra.vantage.infrastructure.json;

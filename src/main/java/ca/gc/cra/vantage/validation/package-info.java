/**
 * Validation helpers shared by the configuration and CLI layers.
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 * <p><strong>Observability:</strong> No logging; violations surface as {@link java.lang.IllegalArgumentException}.</p>
 */
package ca.gc.cra.vantage.validation;

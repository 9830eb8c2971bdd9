/**
 * Executor factories for the refresh driver.
 * <p><strong>Concurrency:</strong> Produces named, non-daemon scheduler threads with explicit exception handlers.</p>
 */
package ca.gc.cra.vantage.infrastructure.exec;

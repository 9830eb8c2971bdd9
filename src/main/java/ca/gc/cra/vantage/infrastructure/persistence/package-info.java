/**
 * Output adapters that serialize segment plans.
 */
package ca.gc.cra.vantage.infrastructure.persistence;

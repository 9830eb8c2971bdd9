/**
 * File-backed adapters for the topology and agent-registry input ports.
 * <p><strong>Concurrency:</strong> Each call re-reads its file and returns fresh immutable values.</p>
 * <p><strong>Security:</strong> Paths come from operator configuration; files are read as UTF-8.</p>
 */
package ca.gc.cra.vantage.infrastructure.topology;

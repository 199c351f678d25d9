/**
 * File-system adapters for plan artifacts, the PR report and the run summary.
 * <p><strong>Concurrency:</strong> Each account class writes its own file; directory creation is synchronized.</p>
 */
package ca.gc.cra.prplan.infrastructure.persistence;

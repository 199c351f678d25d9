/**
 * Plan targets, account-class partitioning, and execution outcomes.
 * <p><strong>Role:</strong> Shared vocabulary between discovery, group execution, and reporting.</p>
 * <p><strong>Errors:</strong> Checked exceptions model module validation, discovery, and executor failures.</p>
 */
package ca.gc.cra.prplan.domain.plan;

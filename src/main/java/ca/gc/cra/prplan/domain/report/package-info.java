/**
 * Folding of action records into environment/region groups and Markdown rendering for pull requests.
 * <p><strong>Determinism:</strong> Environments and regions render in ascending order; identical input renders identical bytes.</p>
 */
package ca.gc.cra.prplan.domain.report;

/**
 * Core domain model for PR plan generation: account classes, group outcomes, plan text scanning, and report folding.
 * <p><strong>Role:</strong> Domain layer without process or filesystem dependencies.</p>
 * <p><strong>Concurrency:</strong> Values are immutable; scanners are single-threaded and created per group text.</p>
 */
package ca.gc.cra.prplan.domain;

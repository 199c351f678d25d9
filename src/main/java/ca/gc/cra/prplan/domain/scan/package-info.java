/**
 * Line-oriented scanning of captured plan output into action records.
 */
package ca.gc.cra.prplan.domain.scan;

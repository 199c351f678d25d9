/**
 * Module existence checks run before any plan is started.
 */
package ca.gc.cra.prplan.infrastructure.module;

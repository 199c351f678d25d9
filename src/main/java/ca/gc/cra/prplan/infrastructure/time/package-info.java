/**
 * Time sources implementing {@link ca.gc.cra.prplan.application.port.ClockPort}.
 */
package ca.gc.cra.prplan.infrastructure.time;

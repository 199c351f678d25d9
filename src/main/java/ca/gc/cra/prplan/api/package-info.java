/**
 * Command-line entry points. {@link ca.gc.cra.prplan.api.Main} dispatches to the {@code generate} and
 * {@code report} subcommands, which map failures onto {@link ca.gc.cra.prplan.api.ExitCode}.
 * <p>User-facing text goes to stdout via {@link ca.gc.cra.prplan.api.CliPrinter}; diagnostics go to SLF4J.</p>
 */
package ca.gc.cra.prplan.api;

/**
 * Configuration loading and wiring for the {@code generate} and {@code report} subcommands.
 * <p>Precedence is CLI over YAML over {@link ca.gc.cra.prplan.config.DefaultsForMode}. Config records are
 * immutable and passed explicitly to {@link ca.gc.cra.prplan.config.CompositionRoot}.</p>
 */
package ca.gc.cra.prplan.config;

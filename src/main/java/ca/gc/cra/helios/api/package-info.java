/**
 * CLI entry points for the HELIOS scheduler, backfill, locate, and quality commands.
 * <p><strong>Role:</strong> Driving adapters; parse arguments, configure logging, and invoke use cases through
 * {@link ca.gc.cra.helios.config.CompositionRoot}.</p>
 */
package ca.gc.cra.helios.api;

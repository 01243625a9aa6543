/**
 * Executor factories for the file lookup pool.
 */
package ca.gc.cra.helios.infrastructure.exec;

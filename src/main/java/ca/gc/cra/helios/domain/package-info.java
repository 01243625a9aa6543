/**
 * Core domain model for HELIOS: quality masks, locator keys, job specs, tick outcomes, and scheduler state.
 * <p><strong>Role:</strong> Domain layer values with no infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe to share across lookup workers and the scheduler
 * thread.</p>
 */
package ca.gc.cra.helios.domain;

/**
 * Tick processing: the step chain, the cadence scheduler, and backfill.
 * <p><strong>Role:</strong> Application layer orchestrating {@link ca.gc.cra.helios.application.locate.FileLocator}
 * and {@link ca.gc.cra.helios.application.job.ExternalJob} per tick.</p>
 * <p><strong>Concurrency:</strong> The scheduler and backfill run on the calling thread; only input lookups fan out
 * to the lookup pool.</p>
 * <p><strong>Metrics:</strong> Emits {@code scheduler.*} counters and the {@code scheduler.failureCount}
 * observation.</p>
 */
package ca.gc.cra.helios.application.pipeline;

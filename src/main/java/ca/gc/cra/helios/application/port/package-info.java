/**
 * Ports between the HELIOS use cases and the outside world.
 * <p><strong>Role:</strong> Interfaces implemented by {@code infrastructure} and {@code adapter} packages so the
 * locator, job runner, and scheduler can be tested without files, processes, or brokers.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.helios.application.port.QualityReaderPort},
 * {@link ca.gc.cra.helios.application.port.FileMatcherPort}, and
 * {@link ca.gc.cra.helios.application.port.MetricsPort} are called from lookup workers and must be thread-safe.</p>
 */
package ca.gc.cra.helios.application.port;

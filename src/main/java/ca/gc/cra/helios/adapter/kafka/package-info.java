/**
 * Kafka adapter that publishes operator alerts.
 * <p><strong>Role:</strong> Adapter layer implementing {@link ca.gc.cra.helios.application.port.NotificationPort}
 * when {@code notify.mode=KAFKA}.</p>
 * <p><strong>Security:</strong> Broker credentials come from the environment; alert bodies carry tick diagnostics
 * only.</p>
 */
package ca.gc.cra.helios.adapter.kafka;

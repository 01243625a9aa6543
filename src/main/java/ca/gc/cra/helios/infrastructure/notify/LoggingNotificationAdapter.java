package ca.gc.cra.helios.infrastructure.notify;

import ca.gc.cra.helios.application.port.NotificationPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default alert transport: writes the alert to the {@code helios.alerts} logger at ERROR so log shipping picks it up.
 *
 * @since 0.1.0
 */
public final class LoggingNotificationAdapter implements NotificationPort {
  private static final Logger log = LoggerFactory.getLogger("helios.alerts");

  @Override
  public void send(Alert alert) {
    log.error("ALERT from {} to {}: {}\n{}", alert.sender(), alert.recipients(), alert.subject(), alert.body());
  }
}

package ca.gc.cra.helios.application.port;

import java.util.List;
import java.util.Objects;

/**
 * Delivers operator alerts.
 *
 * @since 0.1.0
 */
public interface NotificationPort {
  /**
   * Sends an alert.
   *
   * @param alert alert to deliver
   * @throws Exception if delivery fails; the scheduler logs and continues
   */
  void send(Alert alert) throws Exception;

  /**
   * Operator alert.
   *
   * @param sender sender name
   * @param recipients recipient addresses, possibly empty
   * @param subject short subject line
   * @param body alert body
   */
  record Alert(String sender, List<String> recipients, String subject, String body) {
    /**
     * Validates components.
     */
    public Alert {
      Objects.requireNonNull(sender, "sender");
      recipients = List.copyOf(recipients);
      Objects.requireNonNull(subject, "subject");
      Objects.requireNonNull(body, "body");
    }
  }
}

package ca.gc.cra.helios.config;

import ca.gc.cra.helios.validation.Strings;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Alert delivery settings.
 *
 * @param mode transport
 * @param recipients recipient addresses
 * @param sender sender name
 * @param kafkaBootstrap Kafka bootstrap servers when {@code mode=KAFKA}
 * @param kafkaTopic Kafka topic when {@code mode=KAFKA}
 * @since 0.1.0
 */
public record NotifyConfig(
    NotifyMode mode, List<String> recipients, String sender, String kafkaBootstrap, String kafkaTopic) {
  static final String DEFAULT_SENDER = "helios";
  static final String DEFAULT_TOPIC = "helios.alerts";

  /** Alert transports. */
  public enum NotifyMode {
    /** Write alerts to the log. */
    LOG,
    /** Publish alerts to a Kafka topic. */
    KAFKA
  }

  public NotifyConfig {
    Objects.requireNonNull(mode, "mode");
    recipients = List.copyOf(recipients);
    Objects.requireNonNull(sender, "sender");
    Objects.requireNonNull(kafkaBootstrap, "kafkaBootstrap");
    Objects.requireNonNull(kafkaTopic, "kafkaTopic");
  }

  /**
   * Builds notification settings from flattened configuration.
   *
   * @param map effective configuration
   * @return parsed settings
   * @throws IllegalArgumentException if the mode is unknown or Kafka settings are incomplete
   */
  public static NotifyConfig fromMap(Map<String, String> map) {
    String rawMode = Strings.trimToEmpty(map.getOrDefault("notify.mode", "LOG"));
    NotifyMode mode;
    try {
      mode = rawMode.isEmpty() ? NotifyMode.LOG : NotifyMode.valueOf(rawMode.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("notify.mode must be LOG or KAFKA (was " + rawMode + ")", ex);
    }
    String sender = Strings.trimToEmpty(map.get("notify.sender"));
    String bootstrap = Strings.trimToEmpty(map.get("notify.kafkaBootstrap"));
    String topic = Strings.trimToEmpty(map.get("notify.kafkaTopic"));
    if (mode == NotifyMode.KAFKA) {
      Strings.requireNonBlank("notify.kafkaBootstrap", bootstrap);
      topic = Strings.sanitizeTopic("notify.kafkaTopic", topic.isEmpty() ? DEFAULT_TOPIC : topic);
    }
    return new NotifyConfig(
        mode,
        Strings.splitList(map.get("notify.recipients")),
        sender.isEmpty() ? DEFAULT_SENDER : sender,
        bootstrap,
        topic.isEmpty() ? DEFAULT_TOPIC : topic);
  }
}

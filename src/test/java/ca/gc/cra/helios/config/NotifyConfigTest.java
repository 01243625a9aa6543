package ca.gc.cra.helios.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NotifyConfigTest {

  @Test
  void defaultsToLoggingWithDefaultSender() {
    NotifyConfig config = NotifyConfig.fromMap(Map.of("notify.recipients", "ops@example.org, ,oncall@example.org"));

    assertEquals(NotifyConfig.NotifyMode.LOG, config.mode());
    assertEquals(List.of("ops@example.org", "oncall@example.org"), config.recipients());
    assertEquals("helios", config.sender());
    assertEquals("helios.alerts", config.kafkaTopic());
  }

  @Test
  void kafkaModeValidatesBootstrapAndTopic() {
    NotifyConfig config = NotifyConfig.fromMap(
        Map.of("notify.mode", "kafka", "notify.kafkaBootstrap", "broker:9092", "notify.kafkaTopic", "solar.alerts"));
    assertEquals(NotifyConfig.NotifyMode.KAFKA, config.mode());
    assertEquals("solar.alerts", config.kafkaTopic());

    assertThrows(IllegalArgumentException.class, () -> NotifyConfig.fromMap(Map.of("notify.mode", "KAFKA")));
    assertThrows(IllegalArgumentException.class, () -> NotifyConfig.fromMap(
        Map.of("notify.mode", "KAFKA", "notify.kafkaBootstrap", "broker:9092", "notify.kafkaTopic", "bad topic")));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> NotifyConfig.fromMap(Map.of("notify.mode", "smtp")));
  }
}

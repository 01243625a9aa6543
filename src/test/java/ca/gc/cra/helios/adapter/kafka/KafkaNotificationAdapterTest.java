package ca.gc.cra.helios.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.helios.application.port.NotificationPort.Alert;
import java.io.IOException;
import java.util.List;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

class KafkaNotificationAdapterTest {
  private static final Alert ALERT = new Alert(
      "helios", List.of("ops@example.org", "oncall@example.org"), "HELIOS: \"stack\" failing", "tick 2024-01-01");

  @Test
  void publishesJsonKeyedBySender() throws Exception {
    MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
    KafkaNotificationAdapter adapter = new KafkaNotificationAdapter(producer, " helios.alerts ");

    adapter.send(ALERT);

    assertEquals(1, producer.history().size());
    ProducerRecord<String, String> record = producer.history().get(0);
    assertEquals("helios.alerts", record.topic());
    assertEquals("helios", record.key());
    assertEquals(
        "{\"sender\":\"helios\",\"recipients\":[\"ops@example.org\",\"oncall@example.org\"],"
            + "\"subject\":\"HELIOS: \\\"stack\\\" failing\",\"body\":\"tick 2024-01-01\"}",
        record.value());
  }

  @Test
  void brokerFailureSurfacesAsIOException() {
    MockProducer<String, String> producer = new MockProducer<>(false, new StringSerializer(), new StringSerializer());
    KafkaNotificationAdapter adapter = new KafkaNotificationAdapter(producer, "helios.alerts");
    Thread failer = new Thread(() -> {
      while (!producer.errorNext(new RuntimeException("broker down"))) {
        Thread.onSpinWait();
      }
    });
    failer.start();

    IOException ex = assertThrows(IOException.class, () -> adapter.send(ALERT));

    assertTrue(ex.getMessage().contains("helios.alerts"));
  }

  @Test
  void closeFlushesAndClosesProducer() {
    MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());

    new KafkaNotificationAdapter(producer, "helios.alerts").close();

    assertTrue(producer.closed());
  }

  @Test
  void blankTopicIsRejected() {
    MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());

    assertThrows(IllegalArgumentException.class, () -> new KafkaNotificationAdapter(producer, " "));
    assertThrows(IllegalArgumentException.class, () -> new KafkaNotificationAdapter(" ", "helios.alerts"));
  }
}

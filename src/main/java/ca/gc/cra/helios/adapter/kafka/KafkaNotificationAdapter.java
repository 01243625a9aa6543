package ca.gc.cra.helios.adapter.kafka;

import ca.gc.cra.helios.application.port.NotificationPort;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Publishes operator alerts as JSON records to a Kafka topic, for relaying to mail or paging systems.
 * <p>Record key is the sender; the value is {@code {"sender":..,"recipients":[..],"subject":..,"body":..}}.
 * Each send waits for broker acknowledgement so delivery failures reach the scheduler's log.</p>
 *
 * @implNote Invoke {@link #close()} on shutdown to flush and release the producer.
 * @since 0.1.0
 */
public final class KafkaNotificationAdapter implements NotificationPort, AutoCloseable {
  private static final Duration SEND_TIMEOUT = Duration.ofSeconds(10);

  private final Producer<String, String> producer;
  private final String topic;
  private final JsonFactory json = new JsonFactory();

  /**
   * Creates an adapter backed by a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   * @param topic alert topic
   * @throws IllegalArgumentException if either argument is blank
   */
  public KafkaNotificationAdapter(String bootstrapServers, String topic) {
    this(createProducer(bootstrapServers), topic);
  }

  KafkaNotificationAdapter(Producer<String, String> producer, String topic) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = sanitizeTopic(topic);
  }

  @Override
  public void send(Alert alert) throws IOException, InterruptedException {
    Objects.requireNonNull(alert, "alert");
    ProducerRecord<String, String> record = new ProducerRecord<>(topic, alert.sender(), toJson(alert));
    try {
      producer.send(record).get(SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException ex) {
      throw new IOException("Kafka rejected alert for topic " + topic, ex.getCause());
    } catch (TimeoutException ex) {
      throw new IOException("Timed out publishing alert to topic " + topic, ex);
    }
  }

  /**
   * Flushes pending records and closes the producer.
   */
  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  String toJson(Alert alert) throws IOException {
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = json.createGenerator(out)) {
      generator.writeStartObject();
      generator.writeStringField("sender", alert.sender());
      generator.writeArrayFieldStart("recipients");
      for (String recipient : alert.recipients()) {
        generator.writeString(recipient);
      }
      generator.writeEndArray();
      generator.writeStringField("subject", alert.subject());
      generator.writeStringField("body", alert.body());
      generator.writeEndObject();
    }
    return out.toString();
  }

  private static Producer<String, String> createProducer(String bootstrapServers) {
    Objects.requireNonNull(bootstrapServers, "bootstrapServers");
    String trimmed = bootstrapServers.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("notify.kafkaBootstrap must not be blank");
    }
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, trimmed);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, 10_000);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return new KafkaProducer<>(props);
  }

  private static String sanitizeTopic(String topic) {
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("notify.kafkaTopic must not be blank");
    }
    return topic.trim();
  }
}

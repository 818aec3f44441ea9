package com.indicatorsentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.indicatorsentinel.core.notification.AlertResolvedNotification;
import com.indicatorsentinel.core.notification.AlertTriggeredNotification;
import com.indicatorsentinel.core.notification.Notifier;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Properties;

/**
 * {@link Notifier} that publishes alert transitions to a Kafka topic as JSON.
 *
 * <h3>Message Format</h3>
 * <p>
 * Key: the indicator id, so all events of one indicator land on the same
 * partition in order. Value: the notification fields plus an {@code event}
 * discriminator, {@value #ALERT_TRIGGERED} or {@value #ALERT_RESOLVED}.
 * Timestamps are ISO-8601 strings.
 * </p>
 *
 * <p>
 * Sends are asynchronous; delivery failures are logged by the send callback.
 * Retries are left to the producer's own configuration.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaAlertNotifier implements Notifier, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaAlertNotifier.class);

    static final String ALERT_TRIGGERED = "ALERT_TRIGGERED";
    static final String ALERT_RESOLVED = "ALERT_RESOLVED";

    private final Producer<String, String> producer;
    private final String topic;
    private final ObjectMapper mapper;

    /**
     * @param producer Kafka producer with String key and value serializers
     * @param topic    destination topic
     */
    public KafkaAlertNotifier(Producer<String, String> producer, String topic) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Create a notifier backed by a real {@link KafkaProducer}.
     */
    public static KafkaAlertNotifier create(ServiceConfig config) {
        Properties props = config.kafkaProducerProperties();
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        LOG.info("Publishing alert notifications to topic '{}' on {}",
                config.getKafkaNotificationTopic(), config.getKafkaBootstrapServers());
        return new KafkaAlertNotifier(new KafkaProducer<>(props), config.getKafkaNotificationTopic());
    }

    @Override
    public void alertTriggered(AlertTriggeredNotification notification) {
        send(notification.getIndicatorId(), ALERT_TRIGGERED, notification);
    }

    @Override
    public void alertResolved(AlertResolvedNotification notification) {
        send(notification.getIndicatorId(), ALERT_RESOLVED, notification);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void send(int indicatorId, String event, Object payload) {
        String key = Integer.toString(indicatorId);
        String value = toJson(event, payload);
        producer.send(new ProducerRecord<>(topic, key, value), (metadata, exception) -> {
            if (exception != null) {
                LOG.error("Failed to publish {} for indicator {}", event, indicatorId, exception);
            } else {
                LOG.debug("Published {} for indicator {} to partition {} offset {}",
                        event, indicatorId, metadata.partition(), metadata.offset());
            }
        });
        LOG.info("{} queued for indicator {}", event, indicatorId);
    }

    String toJson(String event, Object payload) {
        ObjectNode message = mapper.createObjectNode();
        message.put("event", event);
        message.setAll((ObjectNode) mapper.valueToTree(payload));
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + event + " notification", e);
        }
    }

    @Override
    public void close() {
        producer.flush();
        producer.close();
        LOG.info("Alert notifier closed");
    }
}

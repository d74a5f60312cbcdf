package com.odin.call_signaling_service.config;

import com.odin.call_signaling_service.dto.NotificationMessage;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Producer for incoming-call and missed-call push notifications. Records are keyed
 * by the receiving user id, so one user's notifications stay in order.
 */
@Slf4j
@Configuration
public class KafkaProducerConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${spring.kafka.producer.acks:all}")
    private String acks;

    @Value("${spring.kafka.producer.retries:3}")
    private int retries;

    // A push for a ringing call is useless once the ring is over.
    @Value("${kafka.notification.delivery-timeout-ms:30000}")
    private int deliveryTimeoutMs;

    @Value("${kafka.notification.topic:notification-events}")
    private String notificationTopic;

    @Value("${pod.name:dev}")
    private String podName;

    @Bean
    public ProducerFactory<String, NotificationMessage> callNotificationProducerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.CLIENT_ID_CONFIG, "call-signaling-" + podName);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, acks);
        props.put(ProducerConfig.RETRIES_CONFIG, retries);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "all".equals(acks));
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, deliveryTimeoutMs);
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, Math.min(deliveryTimeoutMs, 15000));
        props.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

        log.info("Call notification producer: bootstrapServers={}, acks={}, deliveryTimeoutMs={}",
                bootstrapServers, acks, deliveryTimeoutMs);
        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, NotificationMessage> callNotificationKafkaTemplate(
            ProducerFactory<String, NotificationMessage> callNotificationProducerFactory) {
        KafkaTemplate<String, NotificationMessage> template = new KafkaTemplate<>(callNotificationProducerFactory);
        template.setDefaultTopic(notificationTopic);
        log.info("Call notifications go to topic {}", notificationTopic);
        return template;
    }
}

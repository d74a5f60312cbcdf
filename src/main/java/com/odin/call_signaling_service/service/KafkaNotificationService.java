package com.odin.call_signaling_service.service;

import java.util.HashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.NotificationMessage;
import com.odin.call_signaling_service.entity.Call;
import com.odin.call_signaling_service.enums.NotificationChannel;

import lombok.extern.slf4j.Slf4j;

/**
 * Publishes push notifications for users that have no open signaling connection.
 * Publishing is best effort: failures are logged and never fail the call operation.
 */
@Slf4j
@Service
public class KafkaNotificationService {

    private final KafkaTemplate<String, NotificationMessage> kafkaTemplate;
    private final String notificationTopic;
    private final String notificationChannel;
    private final boolean notificationEnabled;

    public KafkaNotificationService(KafkaTemplate<String, NotificationMessage> kafkaTemplate,
                                    @Value("${kafka.notification.topic:notification-events}") String notificationTopic,
                                    @Value("${offline.notification.channel:PUSH}") String notificationChannel,
                                    @Value("${offline.notification.enabled:true}") boolean notificationEnabled) {
        this.kafkaTemplate = kafkaTemplate;
        this.notificationTopic = notificationTopic;
        this.notificationChannel = notificationChannel;
        this.notificationEnabled = notificationEnabled;
    }

    public void publishIncomingCall(String receiverId, Call call) {
        publish(receiverId, ApplicationConstants.INCOMING_CALL_NOTIFICATION_ID, call);
    }

    public void publishMissedCall(String receiverId, Call call) {
        publish(receiverId, ApplicationConstants.MISSED_CALL_NOTIFICATION_ID, call);
    }

    private void publish(String receiverId, Long notificationId, Call call) {
        if (!notificationEnabled) {
            log.debug("Notification publishing is disabled via configuration");
            return;
        }
        if (receiverId == null || receiverId.isEmpty()) {
            log.warn("publish: missing receiverId for call {}", call.getId());
            return;
        }

        Map<String, String> notificationMap = new HashMap<>();
        notificationMap.put("callId", call.getId().toString());
        notificationMap.put("callerId", call.getInitiatorId());
        notificationMap.put("callType", call.getCallType().getValue());
        notificationMap.put("callMode", call.getCallMode().getValue());

        NotificationMessage notification = NotificationMessage.builder()
                .customerId(receiverId)
                .notificationId(notificationId)
                .channel(NotificationChannel.valueOf(notificationChannel))
                .map(notificationMap)
                .build();
        try {
            kafkaTemplate.send(notificationTopic, receiverId, notification);
            log.info("Published notification {} to Kafka - topic={}, customerId={}, callId={}",
                    notificationId, notificationTopic, receiverId, call.getId());
        } catch (Exception e) {
            log.error("Failed to publish notification to Kafka for receiver={}: {}",
                    receiverId, e.getMessage(), e);
        }
    }
}

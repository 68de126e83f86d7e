package com.intermission.platform.service;

import com.intermission.common.model.EventKind;
import com.intermission.common.model.NotificationType;
import com.intermission.common.model.PlatformNotification;
import com.intermission.common.model.ShowRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Slf4j
@Service
public class PlatformService {

    private final DisplayStrategy strategy;
    private final DisplayStateStore store;
    private final KafkaTemplate<String, PlatformNotification> notificationKafkaTemplate;
    private final String notificationTopic;

    public PlatformService(DisplayStrategy strategy,
                           DisplayStateStore store,
                           KafkaTemplate<String, PlatformNotification> notificationKafkaTemplate,
                           @Value("${intermission.topics.notification:intermission.platform.notification}") String notificationTopic) {
        this.strategy = strategy;
        this.store = store;
        this.notificationKafkaTemplate = notificationKafkaTemplate;
        this.notificationTopic = notificationTopic;
    }

    public void handle(ShowRequest request) {
        if (request.getRequestId() == null || !store.markProcessed(request.getRequestId())) {
            log.info("⏸ Ignoring duplicate or unidentified requestId={}", request.getRequestId());
            return;
        }

        EventKind kind = request.getKind() == null ? EventKind.INTERSTITIAL : request.getKind();
        if (!store.begin(request.getRequestId(), kind)) {
            log.warn("🚫 Already displaying, rejecting requestId={}", request.getRequestId());
            return;
        }

        String requestId = request.getRequestId();
        try {
            strategy.display(request, new DisplayCallbacks() {
                @Override
                public void opened() {
                    store.opened();
                    publish(requestId, NotificationType.OPENED, null);
                }

                @Override
                public void rewardGranted() {
                    store.rewarded();
                    publish(requestId, NotificationType.REWARD_GRANTED, request.getRewardId());
                }

                @Override
                public void closed() {
                    publish(requestId, NotificationType.CLOSED, null);
                }
            });
        } finally {
            store.end();
        }
        // the game resumes once the interruption is gone
        publish(requestId, NotificationType.PAUSE_RELEASED, null);
    }

    private void publish(String requestId, NotificationType type, String rewardId) {
        PlatformNotification notification = PlatformNotification.builder()
                .requestId(requestId)
                .type(type)
                .rewardId(rewardId)
                .timestamp(Instant.now())
                .build();

        notificationKafkaTemplate.send(notificationTopic, requestId, notification)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish {} for requestId={}", type, requestId, ex);
                    } else {
                        log.info("⬆️ {} published requestId={}", type, requestId);
                    }
                });
    }
}

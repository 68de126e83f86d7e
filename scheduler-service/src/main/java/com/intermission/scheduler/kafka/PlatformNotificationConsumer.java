package com.intermission.scheduler.kafka;

import com.intermission.common.model.PlatformNotification;
import com.intermission.scheduler.service.AdmissionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Consumes platform notifications and hands them to the admission loop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlatformNotificationConsumer {

    private final AdmissionService admissionService;

    @KafkaListener(
            topics = "${intermission.topics.notification:intermission.platform.notification}",
            containerFactory = "platformNotificationListenerFactory"
    )
    public void onNotification(PlatformNotification notification) {
        log.info("⬇️ Received PlatformNotification: {}", notification);
        admissionService.onPlatformNotification(notification);
    }
}

package com.intermission.scheduler.kafka;

import com.intermission.common.model.ZoneChange;
import com.intermission.scheduler.service.AdmissionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ZoneChangeConsumer {

    private final AdmissionService admissionService;

    @KafkaListener(
            topics = "${intermission.topics.zone:intermission.zone.change}",
            containerFactory = "zoneChangeListenerFactory"
    )
    public void onZoneChange(ZoneChange change) {
        if (change.getZoneId() == null || change.getZoneId().isBlank()) {
            log.warn("Ignoring zone change without zoneId: {}", change);
            return;
        }
        log.info("⬇️ Received ZoneChange: {}", change.getZoneId());
        admissionService.changeZone(change.getZoneId());
    }
}

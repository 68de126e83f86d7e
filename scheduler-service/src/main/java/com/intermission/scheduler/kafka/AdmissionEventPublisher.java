package com.intermission.scheduler.kafka;

import com.intermission.common.model.AdmissionEvent;
import com.intermission.common.model.AdmissionEventType;
import com.intermission.common.model.TriggerSource;
import com.intermission.scheduler.core.AdmissionListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Publishes countdown progress and shown/reward events for external displays.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdmissionEventPublisher implements AdmissionListener {

    private final KafkaTemplate<String, AdmissionEvent> admissionEventKafkaTemplate;
    private final Clock clock;

    @Value("${intermission.topics.events:intermission.scheduler.events}")
    private String topic;

    @Override
    public void onCountdownStarted() {
        publish(AdmissionEvent.builder().type(AdmissionEventType.COUNTDOWN_STARTED));
    }

    @Override
    public void onCountdownTick(int remainingSeconds) {
        publish(AdmissionEvent.builder().type(AdmissionEventType.COUNTDOWN_TICK).remainingSeconds(remainingSeconds));
    }

    @Override
    public void onCountdownEnded() {
        publish(AdmissionEvent.builder().type(AdmissionEventType.COUNTDOWN_ENDED));
    }

    @Override
    public void onEventShown(TriggerSource trigger) {
        publish(AdmissionEvent.builder().type(AdmissionEventType.EVENT_SHOWN).trigger(trigger));
    }

    @Override
    public void onRewardGranted(String rewardId) {
        publish(AdmissionEvent.builder().type(AdmissionEventType.REWARD_GRANTED).rewardId(rewardId));
    }

    private void publish(AdmissionEvent.AdmissionEventBuilder builder) {
        AdmissionEvent event = builder.timestamp(clock.instant()).build();
        admissionEventKafkaTemplate.send(topic, event.getType().name(), event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to publish {}: {}", event.getType(), ex.getMessage());
                    }
                });
        log.debug("Published admission event {}", event);
    }
}

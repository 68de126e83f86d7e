package com.intermission.scheduler.platform;

import com.intermission.common.model.EventKind;
import com.intermission.common.model.PlatformNotification;
import com.intermission.common.model.ShowRequest;
import com.intermission.common.model.TriggerSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Platform reached over Kafka: show requests go out on the command topic and
 * notifications come back through {@link #dispatch(PlatformNotification)}.
 * The natural timer is kept locally and restarts whenever an interruption closes.
 */
@Slf4j
public class KafkaPlatformAdapter implements PlatformAdapter {

    private final KafkaTemplate<String, ShowRequest> showRequestKafkaTemplate;
    private final String commandTopic;
    private final NaturalTimer naturalTimer;
    private final Clock clock;
    private final List<PlatformListener> listeners = new CopyOnWriteArrayList<>();

    public KafkaPlatformAdapter(KafkaTemplate<String, ShowRequest> showRequestKafkaTemplate,
                                String commandTopic,
                                NaturalTimer naturalTimer,
                                Clock clock) {
        this.showRequestKafkaTemplate = showRequestKafkaTemplate;
        this.commandTopic = commandTopic;
        this.naturalTimer = naturalTimer;
        this.clock = clock;
    }

    @Override
    public boolean isNaturalTimerReady() {
        return naturalTimer.isReady();
    }

    @Override
    public double secondsUntilNaturalTimer() {
        return naturalTimer.secondsUntilReady();
    }

    @Override
    public void show(TriggerSource trigger) {
        publish(ShowRequest.builder()
                .requestId(UUID.randomUUID().toString())
                .kind(EventKind.INTERSTITIAL)
                .trigger(trigger)
                .timestamp(clock.instant())
                .build());
    }

    @Override
    public void showRewarded(String rewardId) {
        publish(ShowRequest.builder()
                .requestId(UUID.randomUUID().toString())
                .kind(EventKind.REWARDED)
                .trigger(TriggerSource.REWARDED)
                .rewardId(rewardId)
                .timestamp(clock.instant())
                .build());
    }

    @Override
    public void forceNaturalTimerReady() {
        naturalTimer.forceReady();
        log.info("Natural timer forced ready");
    }

    @Override
    public void resetNaturalTimerToFullInterval() {
        naturalTimer.resetToFullInterval();
    }

    @Override
    public void subscribe(PlatformListener listener) {
        listeners.add(listener);
    }

    /**
     * Translates a platform notification into listener callbacks.
     * Must run on the admission loop thread.
     */
    public void dispatch(PlatformNotification notification) {
        if (notification == null || notification.getType() == null) {
            log.warn("Dropping malformed platform notification: {}", notification);
            return;
        }
        switch (notification.getType()) {
            case OPENED:
                listeners.forEach(PlatformListener::onOpened);
                break;
            case CLOSED:
                naturalTimer.resetToFullInterval();
                listeners.forEach(PlatformListener::onClosed);
                break;
            case REWARD_GRANTED:
                listeners.forEach(l -> l.onRewardGranted(notification.getRewardId()));
                break;
            case PAUSE_RELEASED:
                listeners.forEach(PlatformListener::onPauseReleased);
                break;
            default:
                log.warn("Unhandled platform notification type {}", notification.getType());
        }
    }

    private void publish(ShowRequest request) {
        showRequestKafkaTemplate.send(commandTopic, request.getRequestId(), request)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to publish ShowRequest {}: {}", request.getRequestId(), ex.getMessage());
                    }
                });
        log.info("⬆️ ShowRequest published requestId={} kind={} trigger={}",
                request.getRequestId(), request.getKind(), request.getTrigger());
    }
}

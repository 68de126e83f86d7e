package com.intermission.scheduler.kafka;

import com.intermission.common.model.AdmissionEvent;
import com.intermission.common.model.AdmissionEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AdmissionEventPublisherTest {

    private KafkaTemplate<String, AdmissionEvent> template;
    private AdmissionEventPublisher publisher;
    private final Instant now = Instant.parse("2024-01-01T00:00:05Z");

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        template = mock(KafkaTemplate.class);
        when(template.send(anyString(), anyString(), any(AdmissionEvent.class)))
                .thenReturn(CompletableFuture.completedFuture(null));
        publisher = new AdmissionEventPublisher(template, Clock.fixed(now, ZoneOffset.UTC));
        ReflectionTestUtils.setField(publisher, "topic", "events");
    }

    @Test
    void tickCarriesRemainingSeconds() {
        publisher.onCountdownTick(2);

        ArgumentCaptor<AdmissionEvent> captor = ArgumentCaptor.forClass(AdmissionEvent.class);
        verify(template).send(eq("events"), eq("COUNTDOWN_TICK"), captor.capture());
        assertThat(captor.getValue().getType()).isEqualTo(AdmissionEventType.COUNTDOWN_TICK);
        assertThat(captor.getValue().getRemainingSeconds()).isEqualTo(2);
        assertThat(captor.getValue().getTimestamp()).isEqualTo(now);
    }

    @Test
    void rewardCarriesRewardId() {
        publisher.onRewardGranted("gems");

        ArgumentCaptor<AdmissionEvent> captor = ArgumentCaptor.forClass(AdmissionEvent.class);
        verify(template).send(eq("events"), eq("REWARD_GRANTED"), captor.capture());
        assertThat(captor.getValue().getRewardId()).isEqualTo("gems");
    }
}

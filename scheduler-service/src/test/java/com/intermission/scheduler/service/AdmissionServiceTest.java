package com.intermission.scheduler.service;

import com.intermission.common.model.NotificationType;
import com.intermission.common.model.PlatformNotification;
import com.intermission.scheduler.control.ControllerRegistry;
import com.intermission.scheduler.control.InputChannel;
import com.intermission.scheduler.core.AdmissionScheduler;
import com.intermission.scheduler.core.TriggerResult;
import com.intermission.scheduler.platform.KafkaPlatformAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AdmissionServiceTest {

    private ThreadPoolTaskScheduler taskScheduler;
    private AdmissionScheduler scheduler;
    private KafkaPlatformAdapter adapter;
    private ControllerRegistry registry;
    private InputChannel movement;

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.initialize();
        scheduler = mock(AdmissionScheduler.class);
        adapter = mock(KafkaPlatformAdapter.class);
        registry = new ControllerRegistry();
        movement = new InputChannel("player-movement", true);
        registry.register(movement);
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    @SuppressWarnings("unchecked")
    private AdmissionService service(KafkaPlatformAdapter platformAdapter) {
        ObjectProvider<KafkaPlatformAdapter> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(platformAdapter);
        return new AdmissionService(scheduler, new AdmissionLoop(taskScheduler, 1000), registry, provider);
    }

    @Test
    void callsAreForwardedThroughTheLoop() {
        when(scheduler.block()).thenReturn(2);
        when(scheduler.requestManualTrigger()).thenReturn(TriggerResult.SKIPPED_BY_FREQUENCY);
        AdmissionService service = service(adapter);

        assertThat(service.block()).isEqualTo(2);
        assertThat(service.requestManualTrigger()).isEqualTo(TriggerResult.SKIPPED_BY_FREQUENCY);
    }

    @Test
    void blankZoneIsRejected() {
        AdmissionService service = service(adapter);

        assertThatThrownBy(() -> service.changeZone(" ")).isInstanceOf(IllegalArgumentException.class);
        verify(scheduler, never()).onZoneChanged(any());
    }

    @Test
    void zoneChangeIsApplied() {
        service(adapter).changeZone("WORKSHOP");

        verify(scheduler, timeout(1000)).onZoneChanged("WORKSHOP");
    }

    @Test
    void notificationsAreDispatchedToAdapter() {
        PlatformNotification closed = PlatformNotification.builder().type(NotificationType.CLOSED).build();

        service(adapter).onPlatformNotification(closed);

        verify(adapter, timeout(1000)).dispatch(closed);
    }

    @Test
    void notificationsWithoutAdapterAreDropped() {
        AdmissionService service = service(null);

        service.onPlatformNotification(PlatformNotification.builder().type(NotificationType.OPENED).build());

        verify(scheduler, never()).onOpened();
    }

    @Test
    void controllerHoldsGoThroughRegistry() {
        AdmissionService service = service(adapter);

        service.holdController("player-movement", "inventory");
        assertThat(movement.isEnabled()).isFalse();
        assertThat(service.releaseController("player-movement", "inventory")).isTrue();
        assertThat(movement.isEnabled()).isTrue();
    }
}

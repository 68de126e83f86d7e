package com.intermission.scheduler.config;

import com.intermission.scheduler.control.ControllerRegistry;
import com.intermission.scheduler.control.InputChannel;
import com.intermission.scheduler.core.AdmissionListener;
import com.intermission.scheduler.core.AdmissionListeners;
import com.intermission.scheduler.core.AdmissionScheduler;
import com.intermission.scheduler.core.AdmissionSettings;
import com.intermission.scheduler.core.ZoneGate;
import com.intermission.scheduler.platform.PlatformAdapter;
import com.intermission.scheduler.store.CounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AdmissionSettings admissionSettings(
            @Value("${intermission.countdown.enabled:true}") boolean countdownEnabled,
            @Value("${intermission.countdown.duration:3s}") Duration countdownDuration,
            @Value("${intermission.cooldown:3s}") Duration cooldown,
            @Value("${intermission.manual-trigger.frequency:2}") int manualFrequency,
            @Value("${intermission.manual-trigger.counter-key:manualTriggerCounter}") String counterKey,
            @Value("${intermission.manual-trigger.use-countdown:false}") boolean manualUsesCountdown,
            @Value("${intermission.show-request-timeout:10s}") Duration showRequestTimeout,
            @Value("${intermission.startup-hold:true}") boolean startupHold,
            @Value("${intermission.zone.reset-blocks-on-return:true}") boolean resetBlocksOnReturn,
            @Value("${intermission.zone.only-allowed-zones:true}") boolean onlyAllowedZones,
            @Value("${intermission.zone.allowed:WORKSHOP}") List<String> allowedZones) {

        AdmissionSettings settings = AdmissionSettings.builder()
                .countdownEnabled(countdownEnabled)
                .countdownDuration(countdownDuration)
                .cooldownWindow(cooldown)
                .manualTriggerFrequency(manualFrequency)
                .manualTriggerCounterKey(counterKey)
                .manualTriggerUsesCountdown(manualUsesCountdown)
                .showRequestTimeout(showRequestTimeout)
                .startupHold(startupHold)
                .resetBlocksOnZoneReturn(resetBlocksOnReturn)
                .onlyAllowedZones(onlyAllowedZones)
                .allowedZones(allowedZones.stream().map(String::trim).collect(Collectors.toSet()))
                .build();
        log.info("Admission settings: {}", settings);
        return settings;
    }

    @Bean
    public ZoneGate zoneGate(AdmissionSettings settings,
                             @Value("${intermission.zone.initial:}") String initialZone) {
        return new ZoneGate(settings.getAllowedZones(), settings.isOnlyAllowedZones(),
                initialZone.isBlank() ? null : initialZone);
    }

    @Bean
    public ControllerRegistry controllerRegistry(
            @Value("${intermission.controllers:player-movement,interaction}") List<String> names) {
        ControllerRegistry registry = new ControllerRegistry();
        Set.copyOf(names).stream()
                .map(String::trim)
                .filter(n -> !n.isEmpty())
                .sorted()
                .forEach(n -> registry.register(new InputChannel(n, true)));
        return registry;
    }

    @Bean
    public AdmissionScheduler admissionScheduler(AdmissionSettings settings,
                                                 ObjectProvider<PlatformAdapter> platformAdapter,
                                                 ZoneGate zoneGate,
                                                 ControllerRegistry controllerRegistry,
                                                 CounterStore counterStore,
                                                 ObjectProvider<AdmissionListener> listeners,
                                                 Clock clock) {
        return new AdmissionScheduler(settings,
                platformAdapter.getIfAvailable(),
                zoneGate,
                controllerRegistry,
                counterStore,
                new AdmissionListeners(listeners.orderedStream().collect(Collectors.toList())),
                clock);
    }
}

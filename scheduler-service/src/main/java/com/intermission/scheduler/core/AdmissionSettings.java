package com.intermission.scheduler.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdmissionSettings {

    @Builder.Default
    private boolean countdownEnabled = true;

    @Builder.Default
    private Duration countdownDuration = Duration.ofSeconds(3);

    @Builder.Default
    private Duration cooldownWindow = Duration.ofSeconds(3);

    @Builder.Default
    private int manualTriggerFrequency = 2;

    @Builder.Default
    private String manualTriggerCounterKey = "manualTriggerCounter";

    // false: manual triggers skip the warning and show at once
    @Builder.Default
    private boolean manualTriggerUsesCountdown = false;

    @Builder.Default
    private Duration showRequestTimeout = Duration.ofSeconds(10);

    @Builder.Default
    private boolean startupHold = true;

    @Builder.Default
    private boolean resetBlocksOnZoneReturn = true;

    @Builder.Default
    private boolean onlyAllowedZones = true;

    @Builder.Default
    private Set<String> allowedZones = Set.of("WORKSHOP");
}

package com.intermission.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Read model for queries / dashboard.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdmissionStatus {
    private String phase;
    private String currentZone;
    private boolean zoneAllowed;
    private int blockCount;
    private boolean waiting;
    private boolean eventShowing;
    private Integer countdownRemaining;
    private Instant lastEventCloseTime;
    private long cooldownRemainingMs;
    private boolean platformAvailable;
    private double secondsUntilNaturalTimer;
    private int manualTriggerCounter;
    private int manualTriggerFrequency;
    private int nextManualTriggerAt;
    private long totalShown;
    private long totalRewards;
    private Map<String, Boolean> controllers;   // controller name -> enabled
}

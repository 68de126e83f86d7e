package com.intermission.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/** Published by scheduler-service for countdown displays and dashboards. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdmissionEvent implements Serializable {
    private AdmissionEventType type;
    private Integer remainingSeconds;   // COUNTDOWN_TICK only
    private TriggerSource trigger;      // EVENT_SHOWN only
    private String rewardId;            // REWARD_GRANTED only
    private Instant timestamp;
}

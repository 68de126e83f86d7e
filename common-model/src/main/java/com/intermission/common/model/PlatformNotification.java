package com.intermission.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Notification published by the interruption platform whenever the display
 * state changes. Delivery is at-least-once; consumers must tolerate duplicates.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlatformNotification implements Serializable {
    private String requestId;       // id of the ShowRequest this answers, may be null
    private NotificationType type;
    private String rewardId;        // only for REWARD_GRANTED
    private Instant timestamp;
}

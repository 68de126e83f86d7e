package com.intermission.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Fire-and-forget request asking the platform to display an interruption.
 * The outcome is reported later through {@link PlatformNotification}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ShowRequest implements Serializable {
    private String requestId;
    private EventKind kind;
    private TriggerSource trigger;
    private String rewardId;    // REWARDED only
    private Instant timestamp;
}

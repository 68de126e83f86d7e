package com.intermission.platform.model;

import com.intermission.common.model.EventKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DisplayState {
    private boolean displaying;
    private String currentRequestId;
    private EventKind currentKind;
    private long totalShown;
    private long totalRewarded;
    private long totalRejected;
    private Instant lastUpdatedAt;
}

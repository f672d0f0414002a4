package io.kartlink.uplink;

import io.kartlink.model.UplinkState;

public record UplinkStatus(
        UplinkState state,
        int pendingAcks,
        double averageLatencyMs,
        int latencySamples,
        long batchesSent,
        long recordsSent,
        long recordsResent,
        long recordsAcknowledged,
        long unknownAcks,
        long rejectedAcks,
        long connectAttempts,
        long lastConnectedAtMs,
        String lastError
) {
}

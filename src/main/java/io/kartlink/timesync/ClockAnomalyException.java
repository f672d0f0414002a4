package io.kartlink.timesync;

/**
 * A round trip measured negative, meaning the local clock stepped backwards
 * between the PING and its PONG.
 */
public class ClockAnomalyException extends Exception {
    private final int nodeId;
    private final long rttMs;

    public ClockAnomalyException(int nodeId, long rttMs) {
        super("Negative round trip of " + rttMs + " ms for node " + nodeId);
        this.nodeId = nodeId;
        this.rttMs = rttMs;
    }

    public int nodeId() {
        return nodeId;
    }

    public long rttMs() {
        return rttMs;
    }
}

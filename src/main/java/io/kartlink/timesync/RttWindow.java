package io.kartlink.timesync;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding window of the most recent round-trip samples of one node.
 * Not thread-safe.
 */
public final class RttWindow {
    private final int capacity;
    private final Deque<Long> samples = new ArrayDeque<>();
    private long sum;

    public RttWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public void add(long rttMs) {
        if (rttMs < 0) {
            throw new IllegalArgumentException("rtt must not be negative");
        }
        samples.addLast(rttMs);
        sum += rttMs;
        while (samples.size() > capacity) {
            sum -= samples.removeFirst();
        }
    }

    public double average() {
        return samples.isEmpty() ? 0.0d : (double) sum / samples.size();
    }

    public int size() {
        return samples.size();
    }

    public long last() {
        return samples.isEmpty() ? 0L : samples.peekLast();
    }
}

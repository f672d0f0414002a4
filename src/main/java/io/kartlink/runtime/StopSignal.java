package io.kartlink.runtime;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide shutdown flag. Loops sleep through {@link #await(long)} so a
 * stop request wakes every one of them at once.
 */
public final class StopSignal {
    private final CountDownLatch latch = new CountDownLatch(1);

    public void fire() {
        latch.countDown();
    }

    public boolean isStopped() {
        return latch.getCount() == 0;
    }

    /**
     * Sleeps up to {@code millis}.
     *
     * @return true if the signal fired before or during the wait
     */
    public boolean await(long millis) throws InterruptedException {
        if (millis <= 0) {
            return isStopped();
        }
        return latch.await(millis, TimeUnit.MILLISECONDS);
    }

    public void awaitStop() throws InterruptedException {
        latch.await();
    }
}

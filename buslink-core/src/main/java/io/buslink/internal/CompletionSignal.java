package io.buslink.internal;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Single-shot notification that a command has finished executing.
 *
 * <p>The signal can be set once (further calls are no-ops) and awaited by any number of
 * threads, any number of times. It is never reset.
 */
public final class CompletionSignal {
    private final CountDownLatch latch = new CountDownLatch(1);

    public void set() {
        latch.countDown();
    }

    public boolean isSet() {
        return latch.getCount() == 0;
    }

    /**
     * Blocks until the signal is set.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void await() throws InterruptedException {
        latch.await();
    }

    /**
     * Blocks until the signal is set or the timeout elapses.
     *
     * @param timeout maximum time to wait
     * @param unit    unit of {@code timeout}
     * @return {@code true} if the signal was set
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return latch.await(timeout, unit);
    }

    @Override
    public String toString() {
        return "CompletionSignal{set=" + isSet() + '}';
    }
}

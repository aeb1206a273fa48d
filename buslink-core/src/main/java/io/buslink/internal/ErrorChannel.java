package io.buslink.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Queue that receives every uncaught failure from a background task.
 *
 * <p>Monitor loops, command handlers and listener invocations never throw at a caller;
 * they {@link #report} here exactly once per failure. Whoever supervises the client drains
 * the channel and decides whether to shut down.
 *
 * <p>This class is thread-safe.
 */
public final class ErrorChannel {
    private static final Logger logger = Logger.getLogger(ErrorChannel.class.getName());

    private final BlockingQueue<Throwable> errors = new LinkedBlockingQueue<>();

    public void report(Throwable error) {
        Objects.requireNonNull(error, "error");
        logger.log(Level.SEVERE, "Background task failed", error);
        errors.add(error);
    }

    public Throwable poll() {
        return errors.poll();
    }

    public Throwable poll(long timeout, TimeUnit unit) throws InterruptedException {
        return errors.poll(timeout, unit);
    }

    public Throwable take() throws InterruptedException {
        return errors.take();
    }

    public List<Throwable> drain() {
        List<Throwable> drained = new ArrayList<>();
        errors.drainTo(drained);
        return drained;
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }
}

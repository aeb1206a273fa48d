package io.buslink.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory that creates named daemon threads with a sequential suffix.
 *
 * <p>Threads are named {@code <prefix>1}, {@code <prefix>2}, etc. All threads
 * are daemon threads so a client that is never closed does not keep the JVM alive.
 * When a failure handler is given, anything a thread's task lets escape is passed to it
 * instead of being printed to stderr.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private final String prefix;
    private final Thread.UncaughtExceptionHandler failureHandler;
    private final AtomicInteger counter = new AtomicInteger(1);

    public DaemonThreadFactory(String prefix) {
        this(prefix, null);
    }

    /**
     * @param prefix         thread name prefix
     * @param failureHandler receives uncaught failures; {@code null} keeps the JVM default
     */
    public DaemonThreadFactory(String prefix, Thread.UncaughtExceptionHandler failureHandler) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.failureHandler = failureHandler;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
        thread.setDaemon(true);
        if (failureHandler != null) {
            thread.setUncaughtExceptionHandler(failureHandler);
        }
        return thread;
    }
}

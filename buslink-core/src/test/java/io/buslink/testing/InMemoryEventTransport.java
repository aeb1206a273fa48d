package io.buslink.testing;

import io.buslink.TransportClosedException;
import io.buslink.message.EventKey;
import io.buslink.message.EventMessage;
import io.buslink.transport.EventTransport;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Event transport that keeps everything in memory. Each listener gets its own queue and
 * receives every event it subscribed to.
 */
public final class InMemoryEventTransport implements EventTransport {

    /**
     * @param pollTimeoutMs how long a consumer waits before re-checking whether the
     *                      transport was closed
     * @param maxBatchSize  upper bound on the messages returned per batch
     * @param clock         clock used to timestamp sent events for history
     */
    public record Config(long pollTimeoutMs, int maxBatchSize, Clock clock) {
        public Config {
            if (pollTimeoutMs <= 0) {
                throw new IllegalArgumentException("pollTimeoutMs must be > 0");
            }
            if (maxBatchSize < 1) {
                throw new IllegalArgumentException("maxBatchSize must be >= 1");
            }
        }

        public static Config defaults() {
            return new Config(20, 10, Clock.systemUTC());
        }
    }

    private record Sent(EventMessage message, Instant at) {
    }

    private final Config config;
    private final Map<String, BlockingQueue<EventMessage>> queues = new ConcurrentHashMap<>();
    private final Map<String, Set<EventKey>> subscriptions = new ConcurrentHashMap<>();
    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private final BlockingQueue<EventMessage> acknowledged = new LinkedBlockingQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger openCount = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    public InMemoryEventTransport() {
        this(Config.defaults());
    }

    public InMemoryEventTransport(Config config) {
        this.config = config;
    }

    @Override
    public void open() {
        openCount.incrementAndGet();
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
        closed.set(true);
    }

    @Override
    public void sendEvent(EventMessage message, Map<String, Object> options) {
        if (closed.get()) {
            throw new TransportClosedException("Transport is closed");
        }
        sent.add(new Sent(message, config.clock().instant()));
        subscriptions.forEach((listenerName, keys) -> {
            if (keys.contains(message.key())) {
                deliver(listenerName, message);
            }
        });
    }

    @Override
    public Stream<List<EventMessage>> consume(List<EventKey> listenFor, String listenerName,
                                              Map<String, Object> options) {
        EventTransport.checkListenFor(listenFor);
        subscriptions.put(listenerName, Set.copyOf(listenFor));
        BlockingQueue<EventMessage> queue = queueFor(listenerName);
        return Stream.generate(() -> nextBatch(queue));
    }

    @Override
    public void acknowledge(EventMessage... messages) {
        Collections.addAll(acknowledged, messages);
    }

    @Override
    public Stream<EventMessage> history(String apiName, String eventName, Instant start, Instant stop,
                                        boolean startInclusive) {
        List<EventMessage> matches = new ArrayList<>();
        for (Sent entry : sent) {
            EventMessage message = entry.message();
            if (!message.apiName().equals(apiName) || !message.eventName().equals(eventName)) {
                continue;
            }
            if (start != null && (startInclusive ? entry.at().isBefore(start) : !entry.at().isAfter(start))) {
                continue;
            }
            if (stop != null && entry.at().isAfter(stop)) {
                continue;
            }
            matches.add(message);
        }
        Collections.reverse(matches);
        return matches.stream();
    }

    /**
     * Puts a message straight onto a listener's queue, bypassing subscriptions.
     */
    public void deliver(String listenerName, EventMessage message) {
        queueFor(listenerName).add(message.withNativeId(String.valueOf(sequence.incrementAndGet())));
    }

    public List<EventMessage> sent() {
        List<EventMessage> messages = new ArrayList<>();
        sent.forEach(entry -> messages.add(entry.message()));
        return messages;
    }

    public BlockingQueue<EventMessage> acknowledged() {
        return acknowledged;
    }

    public boolean isSubscribed(String listenerName) {
        return subscriptions.containsKey(listenerName);
    }

    public int openCount() {
        return openCount.get();
    }

    public int closeCount() {
        return closeCount.get();
    }

    private BlockingQueue<EventMessage> queueFor(String listenerName) {
        return queues.computeIfAbsent(listenerName, name -> new LinkedBlockingQueue<>());
    }

    private List<EventMessage> nextBatch(BlockingQueue<EventMessage> queue) {
        try {
            while (!closed.get()) {
                EventMessage first = queue.poll(config.pollTimeoutMs(), TimeUnit.MILLISECONDS);
                if (first != null) {
                    List<EventMessage> batch = new ArrayList<>();
                    batch.add(first);
                    queue.drainTo(batch, config.maxBatchSize() - 1);
                    return batch;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportClosedException("Consumer interrupted", e);
        }
        throw new TransportClosedException("Transport is closed");
    }
}

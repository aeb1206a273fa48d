package io.buslink.internal;

import io.buslink.command.Command;
import io.buslink.spi.MetricsExporter;
import io.buslink.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Places commands onto a shared {@link CommandQueue} and watches the queue's depth.
 *
 * <p>{@link #send} never blocks beyond the enqueue itself: the queue is unbounded, so
 * callers that want backpressure must throttle themselves, typically by awaiting the
 * returned {@link CompletionSignal} before sending more.
 *
 * <p>{@link #start()} schedules a monitor that samples the queue every
 * {@code monitorIntervalMs}. It logs a warning each time the size changes while at or
 * above {@code sizeWarning}, and a recovery notice once the size falls back below it.
 * The monitor never throws; failures go to the {@link ErrorChannel}.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe. The
 * {@link #start()} and {@link #stop()} methods are synchronized.
 *
 * @see CommandConsumer
 */
public final class CommandProducer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CommandProducer.class.getName());

  private final String name;
  private final CommandQueue queue;
  private final ErrorChannel errorChannel;
  private final MetricsExporter metrics;
  private final long monitorIntervalMs;
  private final QueueSizeMonitor sizeMonitor;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> monitorTask;
  private volatile CompletionSignal monitorReady = new CompletionSignal();

  private CommandProducer(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.errorChannel = Objects.requireNonNull(builder.errorChannel, "errorChannel");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.monitorIntervalMs <= 0) {
      throw new IllegalArgumentException("monitorIntervalMs must be > 0");
    }
    this.monitorIntervalMs = builder.monitorIntervalMs;
    this.sizeMonitor = new QueueSizeMonitor(builder.sizeWarning);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Enqueues a command and returns immediately.
   *
   * @param command the command to execute
   * @return a signal that is set once the command's handler has finished
   */
  public CompletionSignal send(Command command) {
    Objects.requireNonNull(command, "command");
    CompletionSignal signal = new CompletionSignal();
    queue.put(new QueuedCommand(command, signal));
    metrics.incrementCommandsSent();
    logger.finest(() -> "Queued " + command.getClass().getSimpleName() + " on " + name);
    return signal;
  }

  /**
   * Starts the queue monitor. Subsequent calls are no-ops while it is running.
   */
  public synchronized void start() {
    if (monitorTask != null) {
      return;
    }
    sizeMonitor.reset();
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("buslink-" + name + "-monitor-"));
    monitorTask = scheduler.scheduleWithFixedDelay(
        this::monitorQueue, 0, monitorIntervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Cancels the queue monitor. Idempotent.
   */
  public synchronized void stop() {
    ScheduledFuture<?> task = monitorTask;
    if (task == null) {
      return;
    }
    task.cancel(true);
    scheduler.shutdownNow();
    scheduler = null;
    monitorTask = null;
    monitorReady = new CompletionSignal();
  }

  @Override
  public void close() {
    stop();
  }

  /**
   * Blocks until the monitor has run at least once since the last {@link #start()}.
   *
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public void waitUntilReady() throws InterruptedException {
    monitorReady.await();
  }

  public boolean waitUntilReady(long timeout, TimeUnit unit) throws InterruptedException {
    return monitorReady.await(timeout, unit);
  }

  public boolean isRunning() {
    return monitorTask != null;
  }

  public String name() {
    return name;
  }

  public CommandQueue queue() {
    return queue;
  }

  void monitorQueue() {
    try {
      monitorReady.set();
      int size = queue.size();
      metrics.recordQueueDepth(name, size);
      switch (sizeMonitor.sample(size)) {
        case GROWN -> logger.warning("Queue in " + name + " producer now has " + size + " commands.");
        case SHRUNK -> logger.warning("Queue in " + name + " producer has shrunk back down to "
            + size + " commands.");
        case RECOVERED -> logger.warning("Queue in " + name + " producer has shrunk back down to "
            + size + " commands. Queue is now at an OK size again.");
        case NONE -> { }
      }
    } catch (Throwable t) {
      errorChannel.report(t);
    }
  }

  /** Builder for {@link CommandProducer}. */
  public static final class Builder {
    private String name = "internal";
    private CommandQueue queue;
    private ErrorChannel errorChannel;
    private MetricsExporter metrics;
    private int sizeWarning = 5;
    private long monitorIntervalMs = 100;

    private Builder() {}

    /**
     * Sets the channel name used in thread names, log lines and metrics.
     *
     * <p>Optional. Defaults to {@code "internal"}.
     *
     * @param name the channel name
     * @return this builder
     */
    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /**
     * Sets the queue shared with the consumer.
     *
     * <p><b>Required.</b>
     *
     * @param queue the command queue
     * @return this builder
     */
    public Builder queue(CommandQueue queue) {
      this.queue = queue;
      return this;
    }

    /**
     * Sets the channel that receives monitor failures.
     *
     * <p><b>Required.</b>
     *
     * @param errorChannel the shared error channel
     * @return this builder
     */
    public Builder errorChannel(ErrorChannel errorChannel) {
      this.errorChannel = errorChannel;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the queue size at or above which the monitor logs warnings.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param sizeWarning warning threshold
     * @return this builder
     */
    public Builder sizeWarning(int sizeWarning) {
      this.sizeWarning = sizeWarning;
      return this;
    }

    /**
     * Sets how often the monitor samples the queue.
     *
     * <p>Optional. Defaults to {@code 100} ms. Must be &gt; 0.
     *
     * @param monitorIntervalMs poll interval in milliseconds
     * @return this builder
     */
    public Builder monitorIntervalMs(long monitorIntervalMs) {
      this.monitorIntervalMs = monitorIntervalMs;
      return this;
    }

    public CommandProducer build() {
      return new CommandProducer(this);
    }
  }
}

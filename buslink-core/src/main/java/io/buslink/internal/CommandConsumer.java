package io.buslink.internal;

import io.buslink.command.Command;
import io.buslink.command.CommandHandler;
import io.buslink.spi.MetricsExporter;
import io.buslink.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains a {@link CommandQueue} and runs each command's handler on its own background
 * thread.
 *
 * <p>Commands are picked up in FIFO order; their handlers run concurrently and may finish
 * in any order. When a handler terminates (normally, by throwing, or by cancellation) the
 * command is removed from the running set, marked done on the queue and its
 * {@link CompletionSignal} is set, in that order. Handler exceptions are reported on the
 * {@link ErrorChannel}; they are not visible through the signal.
 *
 * <h2>Shutdown</h2>
 * <p>{@link #stop(long)} first stops the consumption loop, so no new handler can start,
 * then gives running handlers up to {@code waitMs} to finish and finally interrupts
 * whatever is still running. Commands still on the queue stay there unprocessed.
 * Interruption is cooperative: a handler that never blocks and never checks its interrupt
 * flag is abandoned rather than stopped.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see CommandProducer
 */
public final class CommandConsumer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CommandConsumer.class.getName());

  static final long DEFAULT_STOP_WAIT_MS = 1000;
  private static final int STOP_POLL_STEPS = 100;
  private static final long CANCEL_GRACE_MS = 1000;

  private final String name;
  private final CommandQueue queue;
  private final ErrorChannel errorChannel;
  private final MetricsExporter metrics;
  private final long defaultStopWaitMs;
  private final DaemonThreadFactory loopThreads;
  private final ExecutorService workers;
  private final Set<RunningCommand> running = ConcurrentHashMap.newKeySet();

  private Thread consumerThread;
  private volatile CompletionSignal ready = new CompletionSignal();

  private CommandConsumer(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.errorChannel = Objects.requireNonNull(builder.errorChannel, "errorChannel");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.stopWaitMs < 0) {
      throw new IllegalArgumentException("stopWaitMs must be >= 0");
    }
    this.defaultStopWaitMs = builder.stopWaitMs;
    this.loopThreads = new DaemonThreadFactory("buslink-" + name + "-consumer-");
    this.workers = Executors.newCachedThreadPool(
        new DaemonThreadFactory("buslink-" + name + "-handler-", (thread, error) -> errorChannel.report(error)));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the consumption loop, handing every command to {@code handler}.
   *
   * @param handler executes one command
   * @throws IllegalStateException if the consumer is already running
   */
  public synchronized void start(CommandHandler handler) {
    Objects.requireNonNull(handler, "handler");
    if (consumerThread != null) {
      throw new IllegalStateException("Consumer " + name + " is already running");
    }
    Thread thread = loopThreads.newThread(() -> consumeLoop(handler));
    consumerThread = thread;
    thread.start();
  }

  private void consumeLoop(CommandHandler handler) {
    ready.set();
    try {
      while (!Thread.currentThread().isInterrupted()) {
        QueuedCommand next = queue.take();
        handleInBackground(handler, next.command(), next.signal());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (Throwable t) {
      errorChannel.report(t);
    }
  }

  /**
   * Runs {@code handler} for one command on a background thread and tracks it until it
   * terminates.
   *
   * @param handler the handler to run
   * @param command the command to handle
   * @param signal  set once the handler has terminated
   */
  public void handleInBackground(CommandHandler handler, Command command, CompletionSignal signal) {
    RunningCommand task = new RunningCommand(command, signal);
    running.add(task);
    metrics.recordRunningCommands(name, running.size());
    try {
      workers.execute(() -> task.run(handler));
    } catch (RejectedExecutionException e) {
      errorChannel.report(e);
      task.finish();
    }
  }

  /**
   * Stops with the configured default wait.
   */
  public void stop() {
    stop(defaultStopWaitMs);
  }

  /**
   * Two-phase shutdown: stop picking up commands, then drain running handlers for up to
   * {@code waitMs} before interrupting the rest. On return the running set is empty.
   *
   * @param waitMs how long running handlers may take to finish on their own
   */
  public void stop(long waitMs) {
    if (waitMs < 0) {
      throw new IllegalArgumentException("waitMs must be >= 0");
    }
    try {
      stopConsuming();
      drainRunning(waitMs);
      cancelRunning();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      running.forEach(RunningCommand::cancel);
      running.clear();
    }
  }

  private void stopConsuming() throws InterruptedException {
    Thread thread;
    synchronized (this) {
      thread = consumerThread;
      consumerThread = null;
    }
    if (thread == null) {
      return;
    }
    thread.interrupt();
    thread.join();
    ready = new CompletionSignal();
  }

  private void drainRunning(long waitMs) throws InterruptedException {
    long step = Math.max(1, waitMs / STOP_POLL_STEPS);
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(waitMs);
    while (!running.isEmpty() && System.nanoTime() < deadline) {
      Thread.sleep(step);
    }
  }

  private void cancelRunning() throws InterruptedException {
    List<RunningCommand> remaining = new ArrayList<>(running);
    if (remaining.isEmpty()) {
      return;
    }
    logger.warning("Cancelling " + remaining.size() + " command(s) still running in " + name
        + " consumer after the shutdown wait");
    remaining.forEach(RunningCommand::cancel);
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(CANCEL_GRACE_MS);
    for (RunningCommand task : remaining) {
      long remainingNanos = Math.max(0, deadline - System.nanoTime());
      if (!task.signal.await(remainingNanos, TimeUnit.NANOSECONDS)) {
        logger.warning("Command " + task.command.getClass().getSimpleName()
            + " ignored cancellation in " + name + " consumer; abandoning it");
      }
    }
    running.clear();
    metrics.recordRunningCommands(name, 0);
  }

  /**
   * Stops the consumer and releases its worker threads.
   */
  @Override
  public void close() {
    stop();
    workers.shutdownNow();
  }

  /**
   * Blocks until the consumption loop has started.
   *
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public void waitUntilReady() throws InterruptedException {
    ready.await();
  }

  public boolean waitUntilReady(long timeout, TimeUnit unit) throws InterruptedException {
    return ready.await(timeout, unit);
  }

  public synchronized boolean isRunning() {
    return consumerThread != null;
  }

  public int runningCount() {
    return running.size();
  }

  public String name() {
    return name;
  }

  private final class RunningCommand {
    private final Command command;
    private final CompletionSignal signal;
    private final AtomicBoolean finished = new AtomicBoolean();
    private Thread runner;
    private boolean cancelled;

    private RunningCommand(Command command, CompletionSignal signal) {
      this.command = command;
      this.signal = signal;
    }

    void run(CommandHandler handler) {
      synchronized (this) {
        runner = Thread.currentThread();
        if (cancelled) {
          runner = null;
          metrics.incrementCommandsCancelled();
          finish();
          return;
        }
      }
      try {
        handler.handle(command);
        metrics.incrementCommandsCompleted();
      } catch (Throwable t) {
        if (isCancelled()) {
          metrics.incrementCommandsCancelled();
          logger.log(Level.FINE, "Command " + command.getClass().getSimpleName() + " cancelled", t);
        } else {
          metrics.incrementCommandsFailed();
          errorChannel.report(t);
        }
      } finally {
        synchronized (this) {
          runner = null;
          // clear a pending cancellation so it cannot leak into the next pooled task
          Thread.interrupted();
        }
        finish();
      }
    }

    synchronized void cancel() {
      cancelled = true;
      if (runner != null) {
        runner.interrupt();
      }
    }

    private synchronized boolean isCancelled() {
      return cancelled;
    }

    void finish() {
      if (finished.compareAndSet(false, true)) {
        running.remove(this);
        queue.taskDone();
        signal.set();
        metrics.recordRunningCommands(name, running.size());
      }
    }
  }

  /** Builder for {@link CommandConsumer}. */
  public static final class Builder {
    private String name = "internal";
    private CommandQueue queue;
    private ErrorChannel errorChannel;
    private MetricsExporter metrics;
    private long stopWaitMs = DEFAULT_STOP_WAIT_MS;

    private Builder() {}

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /**
     * Sets the queue to drain.
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
     * Sets the channel that receives handler failures.
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

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the wait used by {@link CommandConsumer#stop()}.
     *
     * <p>Optional. Defaults to {@code 1000} ms.
     *
     * @param stopWaitMs graceful drain window in milliseconds
     * @return this builder
     */
    public Builder stopWaitMs(long stopWaitMs) {
      this.stopWaitMs = stopWaitMs;
      return this;
    }

    public CommandConsumer build() {
      return new CommandConsumer(this);
    }
  }
}

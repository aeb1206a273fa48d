package io.buslink.internal;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded FIFO queue of {@link QueuedCommand}s shared by a producer and a consumer.
 *
 * <p>Besides the queued items the queue counts <em>unfinished</em> commands: a command
 * counts from {@link #put} until the consumer calls {@link #taskDone()} for it, so
 * {@link #awaitProcessed} waits for handlers to finish, not just for the queue to empty.
 *
 * <p>This class is thread-safe.
 */
public final class CommandQueue {
  private final BlockingQueue<QueuedCommand> items = new LinkedBlockingQueue<>();
  private final Object lock = new Object();
  private int unfinished;

  public void put(QueuedCommand command) {
    synchronized (lock) {
      unfinished++;
    }
    items.add(command);
  }

  public QueuedCommand take() throws InterruptedException {
    return items.take();
  }

  public QueuedCommand poll(long timeout, TimeUnit unit) throws InterruptedException {
    return items.poll(timeout, unit);
  }

  /** Number of commands waiting to be picked up. */
  public int size() {
    return items.size();
  }

  public int unfinishedCount() {
    synchronized (lock) {
      return unfinished;
    }
  }

  /**
   * Marks one previously taken command as fully processed.
   *
   * @throws IllegalStateException if called more times than commands were put
   */
  public void taskDone() {
    synchronized (lock) {
      if (unfinished <= 0) {
        throw new IllegalStateException("taskDone() called more times than there were commands");
      }
      unfinished--;
      if (unfinished == 0) {
        lock.notifyAll();
      }
    }
  }

  /**
   * Waits until every command put so far has been marked done.
   *
   * @param timeout maximum time to wait
   * @param unit    unit of {@code timeout}
   * @return {@code true} if all commands were processed in time
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean awaitProcessed(long timeout, TimeUnit unit) throws InterruptedException {
    long deadline = System.nanoTime() + unit.toNanos(timeout);
    synchronized (lock) {
      while (unfinished > 0) {
        long remainingNanos = deadline - System.nanoTime();
        if (remainingNanos <= 0) {
          return false;
        }
        TimeUnit.NANOSECONDS.timedWait(lock, remainingNanos);
      }
      return true;
    }
  }
}

package io.buslink.internal;

/**
 * Tracks successive queue-size samples and reports when the size crosses or moves
 * around the warning threshold. Not thread-safe; driven by a single monitor thread.
 */
final class QueueSizeMonitor {

  enum Change {
    /** Nothing worth reporting. */
    NONE,
    /** At or above the threshold and larger than the previous sample. */
    GROWN,
    /** Still at or above the threshold but smaller than the previous sample. */
    SHRUNK,
    /** Dropped below the threshold after having been at or above it. */
    RECOVERED
  }

  private static final int NO_SAMPLE = -1;

  private final int warningThreshold;
  private int previous = NO_SAMPLE;

  QueueSizeMonitor(int warningThreshold) {
    if (warningThreshold < 1) {
      throw new IllegalArgumentException("warningThreshold must be >= 1");
    }
    this.warningThreshold = warningThreshold;
  }

  Change sample(int current) {
    int last = previous;
    previous = current;
    if (current >= warningThreshold && current != last) {
      return last != NO_SAMPLE && current < last ? Change.SHRUNK : Change.GROWN;
    }
    if (last >= warningThreshold && current < last) {
      return Change.RECOVERED;
    }
    return Change.NONE;
  }

  void reset() {
    previous = NO_SAMPLE;
  }

  int warningThreshold() {
    return warningThreshold;
  }
}

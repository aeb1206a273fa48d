package io.buslink.internal;

import io.buslink.command.CloseTransportCommand;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandQueueTest {

    private static QueuedCommand queued() {
        return new QueuedCommand(new CloseTransportCommand(), new CompletionSignal());
    }

    @Test
    void takesInFifoOrder() throws Exception {
        CommandQueue queue = new CommandQueue();
        QueuedCommand first = queued();
        QueuedCommand second = queued();
        queue.put(first);
        queue.put(second);

        assertSame(first, queue.take());
        assertSame(second, queue.take());
    }

    @Test
    void unfinishedCountsUntilTaskDone() throws Exception {
        CommandQueue queue = new CommandQueue();
        queue.put(queued());
        queue.take();

        assertEquals(0, queue.size());
        assertEquals(1, queue.unfinishedCount());
        assertFalse(queue.awaitProcessed(20, TimeUnit.MILLISECONDS));

        queue.taskDone();

        assertEquals(0, queue.unfinishedCount());
        assertTrue(queue.awaitProcessed(0, TimeUnit.MILLISECONDS));
    }

    @Test
    void awaitProcessedWakesWhenLastTaskDone() throws Exception {
        CommandQueue queue = new CommandQueue();
        queue.put(queued());
        queue.put(queued());

        Thread worker = new Thread(() -> {
            try {
                queue.take();
                queue.taskDone();
                queue.take();
                queue.taskDone();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        worker.start();

        assertTrue(queue.awaitProcessed(2, TimeUnit.SECONDS));
        worker.join();
    }

    @Test
    void taskDoneWithoutCommandsThrows() {
        assertThrows(IllegalStateException.class, () -> new CommandQueue().taskDone());
    }
}

package io.buslink.transport;

import io.buslink.TransportClosedException;
import io.buslink.command.AcknowledgeEventCommand;
import io.buslink.command.CloseTransportCommand;
import io.buslink.command.Command;
import io.buslink.command.CommandHandler;
import io.buslink.command.CommandRouter;
import io.buslink.command.ConsumeEventsCommand;
import io.buslink.command.ReceiveEventCommand;
import io.buslink.command.SendEventCommand;
import io.buslink.internal.CommandProducer;
import io.buslink.internal.ErrorChannel;
import io.buslink.message.EventMessage;
import io.buslink.util.DaemonThreadFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Executes outbound event commands against an {@link EventTransport}.
 *
 * <ul>
 *   <li>{@link SendEventCommand} publishes the message.</li>
 *   <li>{@link AcknowledgeEventCommand} acknowledges the message.</li>
 *   <li>{@link ConsumeEventsCommand} opens a consumption stream and starts a background
 *       thread that routes every received message back to the client, as a
 *       {@link ReceiveEventCommand} through the inbound producer or, when none is
 *       configured, straight onto the command's destination queue.</li>
 *   <li>{@link CloseTransportCommand} stops all consumers and closes the transport once.</li>
 * </ul>
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class EventTransportHandler implements CommandHandler, AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventTransportHandler.class.getName());

  private static final long CONSUMER_STOP_TIMEOUT_MS = 1000;

  private final EventTransport transport;
  private final CommandProducer inbound;
  private final ErrorChannel errorChannel;
  private final CommandRouter router;
  private final ExecutorService consumers;
  private final AtomicBoolean closed = new AtomicBoolean();

  private EventTransportHandler(Builder builder) {
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.errorChannel = Objects.requireNonNull(builder.errorChannel, "errorChannel");
    this.inbound = builder.inbound;
    this.consumers = Executors.newCachedThreadPool(
        new DaemonThreadFactory("buslink-event-consumer-", (thread, error) -> errorChannel.report(error)));
    this.router = CommandRouter.builder()
        .route(SendEventCommand.class, this::handleSendEvent)
        .route(AcknowledgeEventCommand.class, this::handleAcknowledgeEvent)
        .route(ConsumeEventsCommand.class, this::handleConsumeEvents)
        .route(CloseTransportCommand.class, command -> close())
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void handle(Command command) throws Exception {
    router.handle(command);
  }

  private void handleSendEvent(SendEventCommand command) throws Exception {
    transport.sendEvent(command.message(), command.options());
  }

  private void handleAcknowledgeEvent(AcknowledgeEventCommand command) throws Exception {
    transport.acknowledge(command.message());
  }

  private void handleConsumeEvents(ConsumeEventsCommand command) throws Exception {
    if (closed.get()) {
      throw new TransportClosedException("Cannot consume events for listener "
          + command.listenerName() + ": transport is closed");
    }
    Stream<List<EventMessage>> batches = transport.consume(
        command.events(), command.listenerName(), command.options());
    consumers.execute(() -> consumeLoop(command, batches));
  }

  private void consumeLoop(ConsumeEventsCommand command, Stream<List<EventMessage>> batches) {
    try (batches) {
      Iterator<List<EventMessage>> iterator = batches.iterator();
      while (!Thread.currentThread().isInterrupted() && iterator.hasNext()) {
        for (EventMessage message : iterator.next()) {
          deliver(command, message);
        }
      }
    } catch (TransportClosedException e) {
      logger.fine(() -> "Consumer for listener " + command.listenerName() + " stopped: " + e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (Throwable t) {
      if (closed.get()) {
        logger.log(Level.FINE, "Consumer for listener " + command.listenerName() + " failed during close", t);
      } else {
        errorChannel.report(t);
      }
    }
  }

  private void deliver(ConsumeEventsCommand command, EventMessage message) throws InterruptedException {
    if (inbound != null) {
      // one at a time, so the listener's intake queue sees the transport's order
      inbound.send(new ReceiveEventCommand(message, command.listenerName())).await();
    } else {
      command.destinationQueue().put(message);
    }
  }

  /**
   * Stops all consumers and closes the transport. Only the first call has an effect.
   *
   * @throws Exception if the transport fails to close
   */
  @Override
  public void close() throws Exception {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    consumers.shutdownNow();
    if (!consumers.awaitTermination(CONSUMER_STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
      logger.warning("Event consumers did not stop within " + CONSUMER_STOP_TIMEOUT_MS + " ms");
    }
    transport.close();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /** Builder for {@link EventTransportHandler}. */
  public static final class Builder {
    private EventTransport transport;
    private CommandProducer inbound;
    private ErrorChannel errorChannel;

    private Builder() {}

    /**
     * Sets the transport commands are executed against.
     *
     * <p><b>Required.</b>
     *
     * @param transport the event transport
     * @return this builder
     */
    public Builder transport(EventTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the producer that carries received events back to the client.
     *
     * <p>Optional. Without it, received events go directly onto each listener's
     * destination queue.
     *
     * @param inbound the inbound producer
     * @return this builder
     */
    public Builder inbound(CommandProducer inbound) {
      this.inbound = inbound;
      return this;
    }

    /**
     * Sets the channel that receives consumer failures.
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

    public EventTransportHandler build() {
      return new EventTransportHandler(this);
    }
  }
}

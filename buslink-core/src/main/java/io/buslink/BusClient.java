package io.buslink;

import io.buslink.api.ApiRegistry;
import io.buslink.client.EventClient;
import io.buslink.client.EventListener;
import io.buslink.client.ListenerRegistration;
import io.buslink.client.ListenerSignature;
import io.buslink.command.CloseTransportCommand;
import io.buslink.internal.CommandConsumer;
import io.buslink.internal.CommandProducer;
import io.buslink.internal.CommandQueue;
import io.buslink.internal.CompletionSignal;
import io.buslink.internal.ErrorChannel;
import io.buslink.message.EventKey;
import io.buslink.message.EventMessage;
import io.buslink.plugin.BusPlugin;
import io.buslink.plugin.PluginRegistry;
import io.buslink.schema.Schema;
import io.buslink.schema.SchemaValidator;
import io.buslink.spi.MetricsExporter;
import io.buslink.transport.EventTransport;
import io.buslink.transport.EventTransportHandler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Composite entry point that wires an {@link EventClient} to an {@link EventTransport}
 * through two internal command channels.
 *
 * <ul>
 *   <li><b>outbound</b>: the event client sends {@code SendEvent}, {@code AcknowledgeEvent}
 *       and {@code ConsumeEvents} commands, executed by an {@link EventTransportHandler}.</li>
 *   <li><b>inbound</b>: the transport handler sends a {@code ReceiveEvent} command per
 *       consumed message, executed by the event client.</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (BusClient bus = BusClient.builder()
 *     .transport(transport)
 *     .apis(new ApiRegistry().add(shopApi))
 *     .build()) {
 *   bus.open();
 *   bus.listen(List.of(EventKey.of("shop", "order_placed")),
 *       (message, kwargs) -> ship(kwargs.get("order_id")), "shipping");
 *   bus.fireEvent("shop", "order_placed", Map.of("order_id", 42));
 * }
 * }</pre>
 *
 * <p>The transport's {@code open()} is called exactly once by {@link #open()}, and its
 * {@code close()} exactly once by {@link #close()} if the client was opened. A closed
 * client cannot be reopened.
 *
 * @see EventClient
 * @see EventTransportHandler
 */
public final class BusClient implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BusClient.class.getName());

  private enum State { NEW, OPEN, CLOSED }

  private final BusConfig config;
  private final EventTransport transport;
  private final ErrorChannel errorChannel;
  private final PluginRegistry plugins;
  private final MetricsExporter metrics;
  private final CommandProducer outboundProducer;
  private final CommandConsumer outboundConsumer;
  private final CommandProducer inboundProducer;
  private final CommandConsumer inboundConsumer;
  private final EventTransportHandler transportHandler;
  private final EventClient events;

  private State state = State.NEW;

  private BusClient(Builder builder) {
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    ApiRegistry apis = Objects.requireNonNull(builder.apis, "apis");
    this.config = builder.config != null ? builder.config : new BusConfig();
    this.errorChannel = builder.errorChannel != null ? builder.errorChannel : new ErrorChannel();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.plugins = new PluginRegistry();
    builder.plugins.forEach(plugins::register);

    CommandQueue outbound = new CommandQueue();
    CommandQueue inbound = new CommandQueue();
    this.outboundProducer = producer("outbound", outbound);
    this.outboundConsumer = consumer("outbound", outbound);
    this.inboundProducer = producer("inbound", inbound);
    this.inboundConsumer = consumer("inbound", inbound);

    this.transportHandler = EventTransportHandler.builder()
        .transport(transport)
        .inbound(inboundProducer)
        .errorChannel(errorChannel)
        .build();
    this.events = EventClient.builder()
        .apis(apis)
        .producer(outboundProducer)
        .errorChannel(errorChannel)
        .config(config)
        .plugins(plugins)
        .schema(builder.schema)
        .validator(builder.validator)
        .metrics(metrics)
        .build();
  }

  private CommandProducer producer(String name, CommandQueue queue) {
    return CommandProducer.builder()
        .name(name)
        .queue(queue)
        .errorChannel(errorChannel)
        .metrics(metrics)
        .sizeWarning(config.getQueueSizeWarning())
        .monitorIntervalMs(config.getMonitorIntervalMs())
        .build();
  }

  private CommandConsumer consumer(String name, CommandQueue queue) {
    return CommandConsumer.builder()
        .name(name)
        .queue(queue)
        .errorChannel(errorChannel)
        .metrics(metrics)
        .stopWaitMs(config.getConsumerStopWaitMs())
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Opens the transport, initializes plugins and starts both command channels.
   *
   * <p>Returns once every producer monitor and consumer loop is running. Subsequent calls
   * are no-ops.
   *
   * @throws IllegalStateException if the client was closed
   * @throws Exception             if the transport or a plugin fails to start
   */
  public synchronized void open() throws Exception {
    if (state == State.OPEN) {
      return;
    }
    if (state == State.CLOSED) {
      throw new IllegalStateException("BusClient is closed");
    }
    transport.open();
    plugins.init(config);

    outboundProducer.start();
    inboundProducer.start();
    outboundProducer.waitUntilReady();
    inboundProducer.waitUntilReady();

    outboundConsumer.start(transportHandler);
    inboundConsumer.start(events);
    outboundConsumer.waitUntilReady();
    inboundConsumer.waitUntilReady();

    state = State.OPEN;
    logger.info("BusClient opened with transport " + transport.getClass().getSimpleName());
  }

  /**
   * @see EventClient#fireEvent(String, String, Map)
   */
  public EventMessage fireEvent(String apiName, String eventName, Map<String, ?> kwargs)
      throws InterruptedException {
    return events.fireEvent(apiName, eventName, kwargs);
  }

  /**
   * @see EventClient#fireEvent(String, String, Map, Map)
   */
  public EventMessage fireEvent(String apiName, String eventName, Map<String, ?> kwargs,
                                Map<String, Object> options) throws InterruptedException {
    return events.fireEvent(apiName, eventName, kwargs, options);
  }

  /**
   * @see EventClient#listen(List, EventListener, String)
   */
  public ListenerRegistration listen(List<EventKey> listenFor, EventListener listener, String listenerName)
      throws InterruptedException {
    return events.listen(listenFor, listener, listenerName);
  }

  /**
   * @see EventClient#listen(List, EventListener, String, ListenerSignature, Map)
   */
  public ListenerRegistration listen(List<EventKey> listenFor, EventListener listener, String listenerName,
                                     ListenerSignature signature, Map<String, Object> options)
      throws InterruptedException {
    return events.listen(listenFor, listener, listenerName, signature, options);
  }

  /**
   * Reads past messages of one event from the transport, newest first.
   *
   * @throws UnsupportedTransportOperationException if the transport keeps no history
   * @throws Exception                              if history cannot be read
   */
  public Stream<EventMessage> history(String apiName, String eventName, Instant start, Instant stop,
                                      boolean startInclusive) throws Exception {
    return transport.history(apiName, eventName, start, stop, startInclusive);
  }

  public EventClient events() {
    return events;
  }

  /**
   * Returns the channel every background failure is reported on. Supervisors drain it
   * and decide whether to close the client.
   */
  public ErrorChannel errors() {
    return errorChannel;
  }

  public BusConfig config() {
    return config;
  }

  public synchronized boolean isOpen() {
    return state == State.OPEN;
  }

  /**
   * Shuts down in order: transport (via a {@code CloseTransport} command), listeners,
   * consumers, producers, plugins. Idempotent.
   */
  @Override
  public synchronized void close() {
    if (state == State.CLOSED) {
      return;
    }
    boolean wasOpen = state == State.OPEN;
    state = State.CLOSED;
    RuntimeException first = null;

    if (wasOpen) {
      CompletionSignal closedSignal = outboundProducer.send(new CloseTransportCommand());
      try {
        if (!closedSignal.await(config.getConsumerStopWaitMs() + 1000, TimeUnit.MILLISECONDS)) {
          logger.warning("Transport did not close in time, continuing shutdown");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    if (wasOpen) {
      try {
        transportHandler.close();
      } catch (Exception e) {
        first = new BusException("Failed to close transport", e);
      }
    }

    List<AutoCloseable> components = new ArrayList<>(List.of(
        events, outboundConsumer, inboundConsumer, outboundProducer, inboundProducer, plugins));
    if (metrics instanceof AutoCloseable closeable) {
      components.add(closeable);
    }
    for (AutoCloseable component : components) {
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new BusException("Failed to close " + component, e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link BusClient}. */
  public static final class Builder {
    private EventTransport transport;
    private ApiRegistry apis;
    private BusConfig config;
    private ErrorChannel errorChannel;
    private MetricsExporter metrics;
    private Schema schema;
    private SchemaValidator validator;
    private final List<BusPlugin> plugins = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the event transport.
     *
     * <p><b>Required.</b>
     */
    public Builder transport(EventTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the APIs this process is authoritative for.
     *
     * <p><b>Required.</b>
     */
    public Builder apis(ApiRegistry apis) {
      this.apis = apis;
      return this;
    }

    /** <p>Optional. Defaults to a {@link BusConfig} with default settings. */
    public Builder config(BusConfig config) {
      this.config = config;
      return this;
    }

    /** <p>Optional. Defaults to a new, private channel available via {@link BusClient#errors()}. */
    public Builder errorChannel(ErrorChannel errorChannel) {
      this.errorChannel = errorChannel;
      return this;
    }

    /** <p>Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with the client when closeable. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder schema(Schema schema) {
      this.schema = schema;
      return this;
    }

    public Builder validator(SchemaValidator validator) {
      this.validator = validator;
      return this;
    }

    /**
     * Adds a plugin. Plugins run in the order they were added.
     */
    public Builder plugin(BusPlugin plugin) {
      this.plugins.add(Objects.requireNonNull(plugin, "plugin"));
      return this;
    }

    public BusClient build() {
      return new BusClient(this);
    }
  }
}

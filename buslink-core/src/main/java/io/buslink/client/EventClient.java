package io.buslink.client;

import io.buslink.BusConfig;
import io.buslink.BusException;
import io.buslink.DuplicateListenerException;
import io.buslink.InvalidEventArgumentsException;
import io.buslink.InvalidEventListenerException;
import io.buslink.InvalidNameException;
import io.buslink.api.Api;
import io.buslink.api.ApiRegistry;
import io.buslink.api.Event;
import io.buslink.command.AcknowledgeEventCommand;
import io.buslink.command.Command;
import io.buslink.command.CommandHandler;
import io.buslink.command.CommandRouter;
import io.buslink.command.ConsumeEventsCommand;
import io.buslink.command.ReceiveEventCommand;
import io.buslink.command.SendEventCommand;
import io.buslink.internal.CommandProducer;
import io.buslink.internal.ErrorChannel;
import io.buslink.message.EventKey;
import io.buslink.message.EventMessage;
import io.buslink.plugin.HookPoint;
import io.buslink.plugin.PluginRegistry;
import io.buslink.schema.Schema;
import io.buslink.schema.SchemaValidator;
import io.buslink.spi.MetricsExporter;
import io.buslink.transport.EventTransport;
import io.buslink.util.DaemonThreadFactory;
import io.buslink.util.Names;
import io.buslink.util.ValueCaster;
import io.buslink.util.ValueDeformer;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Fires events for locally registered APIs and runs listeners for received events.
 *
 * <h2>Firing</h2>
 * <p>{@link #fireEvent} checks the API and event exist locally and that the supplied
 * keyword arguments match the declared parameters exactly, converts the values to
 * wire-safe form, validates the message against the schema, then sends a
 * {@link SendEventCommand} through the outbound producer and waits until the transport
 * has handled it.
 *
 * <h2>Listening</h2>
 * <p>{@link #listen} registers a uniquely named listener, asks the transport to start
 * consuming via a {@link ConsumeEventsCommand} and starts a dedicated thread that feeds
 * the listener from its intake queue. A message is acknowledged only after the listener
 * returned normally. Listener failures are reported on the {@link ErrorChannel} and the
 * thread moves on to the next message.
 *
 * <h2>Receiving</h2>
 * <p>As a {@link CommandHandler} this client accepts {@link ReceiveEventCommand}s and puts
 * each message on the named listener's intake queue. Messages for unknown listeners are
 * logged and dropped.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class EventClient implements CommandHandler, AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventClient.class.getName());

  private static final long LISTENER_STOP_TIMEOUT_MS = 1000;

  private final ApiRegistry apis;
  private final CommandProducer producer;
  private final ErrorChannel errorChannel;
  private final BusConfig config;
  private final PluginRegistry plugins;
  private final Schema schema;
  private final SchemaValidator validator;
  private final MetricsExporter metrics;
  private final DefaultListenerRegistry listeners = new DefaultListenerRegistry();
  private final CommandRouter router;
  private final ExecutorService listenerThreads;
  private final AtomicBoolean closed = new AtomicBoolean();

  private EventClient(Builder builder) {
    this.apis = Objects.requireNonNull(builder.apis, "apis");
    this.producer = Objects.requireNonNull(builder.producer, "producer");
    this.errorChannel = Objects.requireNonNull(builder.errorChannel, "errorChannel");
    this.config = builder.config != null ? builder.config : new BusConfig();
    this.plugins = builder.plugins != null ? builder.plugins : new PluginRegistry();
    this.schema = builder.schema != null ? builder.schema : Schema.EMPTY;
    this.validator = builder.validator != null ? builder.validator : SchemaValidator.NOOP;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.listenerThreads = Executors.newCachedThreadPool(
        new DaemonThreadFactory("buslink-listener-", (thread, error) -> errorChannel.report(error)));
    this.router = CommandRouter.builder()
        .route(ReceiveEventCommand.class, this::handleReceiveEvent)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Fires an event without transport options.
   *
   * @see #fireEvent(String, String, Map, Map)
   */
  public EventMessage fireEvent(String apiName, String eventName, Map<String, ?> kwargs)
      throws InterruptedException {
    return fireEvent(apiName, eventName, kwargs, Map.of());
  }

  /**
   * Fires an event and waits until the transport has handled the send.
   *
   * @param apiName   a locally registered API
   * @param eventName an event declared on that API
   * @param kwargs    keyword arguments; their names must equal the event's parameter names
   * @param options   transport-specific options
   * @return the message that was sent
   * @throws io.buslink.UnknownApiException     if the API is not registered locally
   * @throws io.buslink.EventNotFoundException  if the API has no such event
   * @throws InvalidEventArgumentsException     if the argument names do not match
   * @throws io.buslink.SchemaValidationException if outgoing validation fails
   * @throws InterruptedException               if interrupted while waiting for the send
   */
  public EventMessage fireEvent(String apiName, String eventName, Map<String, ?> kwargs,
                                Map<String, Object> options) throws InterruptedException {
    Api api = apis.get(apiName);
    Names.validateEventOrRpcName(apiName, "event", eventName);
    Event event = api.event(eventName);
    Map<String, ?> supplied = kwargs != null ? kwargs : Map.of();
    if (!supplied.keySet().equals(event.parameterNames())) {
      throw new InvalidEventArgumentsException(supplied.keySet(), event.parameterNames());
    }

    EventMessage message = EventMessage.builder(apiName, eventName)
        .version(api.version())
        .kwargs(ValueDeformer.deformKwargs(supplied))
        .build();
    if (config.api(apiName).isValidateOutgoing()) {
      validator.validateOutgoing(config, schema, message);
    }
    runHook(HookPoint.BEFORE_EVENT_SENT, message);

    logger.fine(() -> "Firing " + message);
    producer.send(new SendEventCommand(message, options)).await();
    metrics.incrementEventsFired();

    runHook(HookPoint.AFTER_EVENT_SENT, message);
    return message;
  }

  /**
   * Registers a listener without casting or transport options.
   *
   * @see #listen(List, EventListener, String, ListenerSignature, Map)
   */
  public ListenerRegistration listen(List<EventKey> events, EventListener listener, String listenerName)
      throws InterruptedException {
    return listen(events, listener, listenerName, null, Map.of());
  }

  /**
   * Registers a listener and starts consuming its events.
   *
   * <p>Returns once the transport has handled the {@link ConsumeEventsCommand}.
   *
   * @param events       the {@code (api, event)} pairs to listen for; must not be empty
   * @param listener     the callback
   * @param listenerName a name unique within this client; transports use it to track
   *                     what each listener has consumed
   * @param signature    declared parameter types for casting, or {@code null}
   * @param options      transport-specific options
   * @return the registration
   * @throws InvalidEventListenerException       if {@code listener} is null
   * @throws DuplicateListenerException          if the name is already taken
   * @throws io.buslink.NothingToListenForException if {@code events} is empty
   * @throws InvalidNameException                if a name is malformed
   * @throws InterruptedException                if interrupted while waiting for the transport
   */
  public ListenerRegistration listen(List<EventKey> events, EventListener listener, String listenerName,
                                     ListenerSignature signature, Map<String, Object> options)
      throws InterruptedException {
    if (listener == null) {
      throw new InvalidEventListenerException("Listener '" + listenerName + "' has no callback. "
          + "A listener must accept the received event message.");
    }
    if (listenerName == null || listenerName.isEmpty()) {
      throw new InvalidNameException("Empty listener name specified");
    }
    if (listeners.contains(listenerName)) {
      throw DuplicateListenerException.named(listenerName);
    }
    EventTransport.checkListenFor(events);
    for (EventKey key : events) {
      Names.validateEventOrRpcName(key.apiName(), "event", key.eventName());
    }

    BlockingQueue<EventMessage> intake = new LinkedBlockingQueue<>();
    ListenerRegistration registration =
        new ListenerRegistration(listenerName, events, listener, signature, options, intake);
    // Registered before consuming so that early deliveries find their listener.
    listeners.register(registration);

    try {
      producer.send(new ConsumeEventsCommand(events, intake, listenerName, options)).await();
    } catch (InterruptedException e) {
      listeners.unregister(listenerName);
      throw e;
    }
    listenerThreads.execute(() -> listenerLoop(registration));
    logger.fine(() -> "Listening for " + events + " as " + listenerName);
    return registration;
  }

  @Override
  public void handle(Command command) throws Exception {
    router.handle(command);
  }

  /**
   * Puts the received message on the named listener's intake queue.
   *
   * <p>Transports cannot always scope delivery to a single listener, so a message for an
   * unknown listener is logged and dropped rather than failing.
   *
   * @param command the received event
   * @throws InterruptedException if interrupted while enqueueing
   */
  public void handleReceiveEvent(ReceiveEventCommand command) throws InterruptedException {
    Optional<ListenerRegistration> registration = listeners.get(command.listenerName());
    if (registration.isEmpty()) {
      logger.fine(() -> "Received " + command.message() + " for unknown listener "
          + command.listenerName() + ", dropping");
      metrics.incrementEventsDropped();
      return;
    }
    registration.get().intake().put(command.message());
    metrics.incrementEventsReceived();
  }

  private void listenerLoop(ListenerRegistration registration) {
    try {
      while (!closed.get() && !Thread.currentThread().isInterrupted()) {
        EventMessage message = registration.intake().take();
        try {
          processMessage(registration, message);
        } catch (RuntimeException e) {
          errorChannel.report(e);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void processMessage(ListenerRegistration registration, EventMessage message)
      throws InterruptedException {
    try {
      BusConfig.ApiConfig apiConfig = config.api(message.apiName());
      if (apiConfig.isValidateIncoming()) {
        validator.validateIncoming(config, schema, message);
      }
      plugins.execute(HookPoint.BEFORE_EVENT_EXECUTION, message);
      Map<String, Object> kwargs = message.kwargs();
      Optional<ListenerSignature> signature = registration.signature();
      if (apiConfig.isCastValues() && signature.isPresent()) {
        kwargs = ValueCaster.castAll(kwargs, signature.get().types());
      }
      registration.listener().onEvent(message, kwargs);
    } catch (InterruptedException e) {
      throw e;
    } catch (Throwable e) {
      metrics.incrementListenerFailures();
      errorChannel.report(e);
      return;
    }

    producer.send(new AcknowledgeEventCommand(message, registration.options())).await();
    metrics.incrementEventsAcknowledged();
    runHook(HookPoint.AFTER_EVENT_EXECUTION, message);
  }

  private void runHook(HookPoint point, EventMessage message) throws InterruptedException {
    try {
      plugins.execute(point, message);
    } catch (RuntimeException | InterruptedException e) {
      throw e;
    } catch (Exception e) {
      throw new BusException("Plugin hook " + point + " failed for " + message, e);
    }
  }

  public ListenerRegistry listeners() {
    return listeners;
  }

  public ApiRegistry apis() {
    return apis;
  }

  /**
   * Stops every listener thread. Messages left on intake queues are not processed.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    listenerThreads.shutdownNow();
    try {
      if (!listenerThreads.awaitTermination(LISTENER_STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        logger.warning("Listener threads did not stop within " + LISTENER_STOP_TIMEOUT_MS + " ms");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link EventClient}. */
  public static final class Builder {
    private ApiRegistry apis;
    private CommandProducer producer;
    private ErrorChannel errorChannel;
    private BusConfig config;
    private PluginRegistry plugins;
    private Schema schema;
    private SchemaValidator validator;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the locally authoritative APIs. Only their events can be fired.
     *
     * <p><b>Required.</b>
     */
    public Builder apis(ApiRegistry apis) {
      this.apis = apis;
      return this;
    }

    /**
     * Sets the producer outbound commands are sent through.
     *
     * <p><b>Required.</b>
     */
    public Builder producer(CommandProducer producer) {
      this.producer = producer;
      return this;
    }

    /**
     * Sets the channel listener failures are reported on.
     *
     * <p><b>Required.</b>
     */
    public Builder errorChannel(ErrorChannel errorChannel) {
      this.errorChannel = errorChannel;
      return this;
    }

    /** <p>Optional. Defaults to a {@link BusConfig} with default settings. */
    public Builder config(BusConfig config) {
      this.config = config;
      return this;
    }

    /** <p>Optional. Defaults to an empty registry. */
    public Builder plugins(PluginRegistry plugins) {
      this.plugins = plugins;
      return this;
    }

    /** <p>Optional. Defaults to {@link Schema#EMPTY}. */
    public Builder schema(Schema schema) {
      this.schema = schema;
      return this;
    }

    /** <p>Optional. Defaults to {@link SchemaValidator#NOOP}. */
    public Builder validator(SchemaValidator validator) {
      this.validator = validator;
      return this;
    }

    /** <p>Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public EventClient build() {
      return new EventClient(this);
    }
  }
}

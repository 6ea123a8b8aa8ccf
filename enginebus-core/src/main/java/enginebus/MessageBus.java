package enginebus;

import enginebus.dispatch.EventDispatcher;
import enginebus.dispatch.HandlerInvoker;
import enginebus.registry.DefaultHandlerRegistry;
import enginebus.registry.HandlerRegistry;
import enginebus.registry.Registration;
import enginebus.schedule.EventScheduler;
import enginebus.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process message bus: single-handler commands, fan-out events, session-scoped
 * handlers and delayed delivery.
 *
 * <p>{@link #execute(Command)} runs the command's handler and always returns a
 * {@link CommandResult}; it publishes {@link BusEventType#COMMAND_STARTED} before and
 * {@link BusEventType#COMMAND_RESULT} after the handler. {@link #publish(Event)} only
 * enqueues; a single dispatch thread delivers events in FIFO order, while scheduled events
 * wait in the {@link EventScheduler} and are merged in chronological order once due.
 *
 * <p>The bus is explicitly constructed and owned by the application; there is no global
 * instance. Create instances via {@link #builder()}, then call {@link #start()}.
 *
 * <pre>{@code
 * try (MessageBus bus = MessageBus.builder()
 *     .handlerTimeout(Duration.ofSeconds(10))
 *     .build()) {
 *   bus.start();
 *   bus.registerCommandHandler(EngineCommands.RUN_TURN, engine::runTurn);
 *   bus.registerEventHandler(EngineEvents.STATUS, event -> log(event));
 *
 *   CommandResult result = bus.execute(Command.of(EngineCommands.RUN_TURN, request));
 *   bus.ensureEventsProcessed();
 * }
 * }</pre>
 *
 * @see MessageBus.Builder
 * @see BusSession
 */
public final class MessageBus implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MessageBus.class.getName());

  private final HandlerRegistry registry;
  private final HandlerInvoker invoker;
  private final EventDispatcher dispatcher;
  private final EventScheduler scheduler;
  private final MetricsExporter metrics;
  private final Duration drainTimeout;
  private final int queueCapacity;

  private volatile boolean closed;

  private MessageBus(Builder builder) {
    Duration handlerTimeout = builder.handlerTimeout != null ? builder.handlerTimeout : Duration.ofSeconds(30);
    Duration drainTimeout = builder.drainTimeout != null ? builder.drainTimeout : Duration.ofSeconds(10);
    Duration schedulerTick = builder.schedulerTick != null ? builder.schedulerTick : Duration.ofMillis(10);

    if (handlerTimeout.isNegative()) {
      throw new IllegalArgumentException("handlerTimeout must be >= 0");
    }
    if (drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }
    if (schedulerTick.isZero() || schedulerTick.isNegative()) {
      throw new IllegalArgumentException("schedulerTick must be > 0");
    }
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (builder.maxRecordedErrors < 0) {
      throw new IllegalArgumentException("maxRecordedErrors must be >= 0");
    }

    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.drainTimeout = drainTimeout;
    this.queueCapacity = builder.queueCapacity;
    this.registry = new DefaultHandlerRegistry();
    this.invoker = new HandlerInvoker(handlerTimeout);

    this.scheduler = EventScheduler.builder()
        .sink(this::releaseScheduled)
        .clock(builder.clock != null ? builder.clock : Clock.systemUTC())
        .tick(schedulerTick)
        .build();
    this.dispatcher = EventDispatcher.builder()
        .registry(registry)
        .invoker(invoker)
        .metrics(metrics)
        .unhandledEventHandler(builder.unhandledEventHandler)
        .scheduledDepth(scheduler::size)
        .queueCapacity(builder.queueCapacity)
        .maxRecordedErrors(builder.maxRecordedErrors)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the dispatch loop and the scheduler. Subsequent calls are no-ops while running.
   *
   * @throws IllegalStateException if the bus has been closed, or when called from a handler
   */
  public synchronized void start() {
    ensureNotDispatching("start");
    if (closed) {
      throw new IllegalStateException("MessageBus has been closed");
    }
    dispatcher.start();
    scheduler.start();
    logger.log(Level.FINE, "MessageBus started");
  }

  /**
   * Stops the dispatch loop and the scheduler. The event being dispatched completes;
   * queued and scheduled events are kept and resume after {@link #start()}.
   *
   * @throws IllegalStateException when called from a handler
   */
  public synchronized void stop() {
    ensureNotDispatching("stop");
    scheduler.stop();
    dispatcher.stop();
    logger.log(Level.FINE, "MessageBus stopped");
  }

  public boolean isRunning() {
    return dispatcher.isRunning();
  }

  /**
   * Returns the bus to a pristine state: removes every handler, observability handlers
   * included, and drops queued events, scheduled events and recorded errors. A running bus
   * is restarted afterwards.
   *
   * <p>Meant for test harnesses and for separating independent workflows.
   *
   * @throws IllegalStateException when called from a handler
   */
  public synchronized void reset() {
    ensureNotDispatching("reset");
    boolean wasRunning = isRunning();
    stop();
    registry.clear();
    dispatcher.clear();
    scheduler.clear();
    if (wasRunning && !closed) {
      start();
    }
    logger.info("MessageBus reset");
  }

  /**
   * Executes a command on its registered handler.
   *
   * <p>The handler is resolved in the command's session first, then in
   * {@link BusSession#GLOBAL}. Without a handler, the result is a failure describing a
   * {@link NoHandlerRegisteredException} and only {@link BusEventType#COMMAND_RESULT} is
   * published. Exceptions thrown by the handler, a timeout, or a {@code null} return also
   * produce failure results; none of them propagate to the caller.
   *
   * <p>The handler runs on the calling thread, or on the handler pool when a handler
   * timeout is configured. Both lifecycle events carry the command's session id.
   *
   * @param command the command
   * @return the result, never null
   * @throws IllegalStateException if the bus has been closed
   */
  public CommandResult execute(Command command) {
    Objects.requireNonNull(command, "command");
    ensureOpen();
    CommandHandler handler = registry.commandHandlerFor(command.type(), command.sessionId());
    if (handler == null) {
      CommandResult result = CommandResult.failure(command.id(), new NoHandlerRegisteredException(command.type()));
      logger.log(Level.WARNING, "No handler registered for command {0}", command.type());
      metrics.incrementCommandFailure();
      publishInternal(BusEvents.commandResult(command, result));
      return result;
    }

    publishInternal(BusEvents.commandStarted(command));
    CommandResult result;
    long start = System.nanoTime();
    try {
      result = invoker.invoke(command.type(), () -> handler.handle(command));
      if (result == null) {
        result = CommandResult.failure(command, "Command handler for " + command.type() + " returned no result");
      }
    } catch (HandlerTimeoutException e) {
      dispatcher.recordError(e);
      result = CommandResult.failure(command.id(), CommandResult.describe(e),
          Map.of("exceptionType", e.getClass().getName(), "timeout", Boolean.TRUE));
    } catch (VirtualMachineError e) {
      throw e;
    } catch (Throwable e) {
      dispatcher.recordError(e);
      logger.log(Level.SEVERE, "Command handler failed for " + command, e);
      result = CommandResult.failure(command.id(), e);
    } finally {
      metrics.recordCommandDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }

    if (result.success()) {
      metrics.incrementCommandSuccess();
    } else {
      metrics.incrementCommandFailure();
    }
    publishInternal(BusEvents.commandResult(command, result));
    return result;
  }

  /**
   * Publishes an event and returns immediately.
   *
   * <p>Scheduled events are held until their {@link Event#scheduledAt()}; all others are
   * queued for dispatch. Events with no handler are accepted and dropped at dispatch.
   *
   * @param event the event
   * @throws IllegalStateException if the bus has been closed or the queue is at capacity
   */
  public void publish(Event event) {
    Objects.requireNonNull(event, "event");
    ensureOpen();
    if (event.isScheduled()) {
      scheduler.schedule(event);
      metrics.incrementScheduled();
      return;
    }
    if (!dispatcher.enqueue(event)) {
      metrics.incrementRejected();
      throw new IllegalStateException("Event queue is full (capacity " + queueCapacity + "): " + event);
    }
    metrics.incrementPublished();
  }

  /**
   * Publishes a bus-internal event. Never throws; events that cannot be queued are logged
   * and dropped.
   */
  void publishInternal(Event event) {
    if (closed) {
      logger.log(Level.FINE, "Bus closed; dropping {0}", event);
      return;
    }
    if (dispatcher.enqueue(event)) {
      metrics.incrementPublished();
    } else {
      metrics.incrementRejected();
      logger.log(Level.WARNING, "Queue full; dropped {0}", event);
    }
  }

  private boolean releaseScheduled(Event event) {
    boolean accepted = dispatcher.enqueue(event);
    if (accepted) {
      metrics.incrementPublished();
    }
    return accepted;
  }

  public Registration registerCommandHandler(MessageType commandType, CommandHandler handler) {
    Objects.requireNonNull(commandType, "commandType");
    return registerCommandHandler(commandType.name(), handler, BusSession.GLOBAL);
  }

  /**
   * Registers the global handler for a command type.
   *
   * @param commandType the command type
   * @param handler the handler
   * @return the registration
   * @throws DuplicateHandlerException if a global handler is already registered for the type
   */
  public Registration registerCommandHandler(String commandType, CommandHandler handler) {
    return registerCommandHandler(commandType, handler, BusSession.GLOBAL);
  }

  /**
   * Registers a command handler in a scope. A session-scoped handler takes precedence over
   * the global one for commands of that session.
   *
   * @param commandType the command type
   * @param handler the handler
   * @param scope a session id or {@link BusSession#GLOBAL}
   * @return the registration
   * @throws DuplicateHandlerException if the scope already has a handler for the type
   */
  public Registration registerCommandHandler(String commandType, CommandHandler handler, String scope) {
    return registry.registerCommandHandler(MessageSupport.requireType(commandType), requireScope(scope), handler);
  }

  public Registration registerEventHandler(MessageType eventType, EventHandler handler) {
    Objects.requireNonNull(eventType, "eventType");
    return registerEventHandler(eventType.name(), handler, BusSession.GLOBAL);
  }

  public Registration registerEventHandler(String eventType, EventHandler handler) {
    return registerEventHandler(eventType, handler, BusSession.GLOBAL);
  }

  public Registration registerEventHandler(MessageType eventType, EventHandler handler, String sessionId) {
    Objects.requireNonNull(eventType, "eventType");
    return registerEventHandler(eventType.name(), handler, sessionId);
  }

  /**
   * Appends an event handler for a type in a scope. Handlers of the same type and scope run
   * in registration order.
   *
   * @param eventType the event type
   * @param handler the handler
   * @param sessionId a session id, or {@link BusSession#GLOBAL} to see events of all sessions
   * @return the registration
   */
  public Registration registerEventHandler(String eventType, EventHandler handler, String sessionId) {
    return registry.registerEventHandler(MessageSupport.requireType(eventType), requireScope(sessionId), handler);
  }

  public Registration registerAllEventsHandler(EventHandler handler) {
    return registerAllEventsHandler(handler, BusSession.GLOBAL);
  }

  /**
   * Registers a handler for every event type in a scope.
   *
   * @param handler the handler
   * @param sessionId a session id or {@link BusSession#GLOBAL}
   * @return the registration
   */
  public Registration registerAllEventsHandler(EventHandler handler, String sessionId) {
    return registry.registerEventHandler(DefaultHandlerRegistry.ALL_EVENTS, requireScope(sessionId), handler);
  }

  /**
   * Registers a tap that sees every dispatched event regardless of session, before the
   * functional handlers run.
   *
   * @param handler the observability handler
   * @return the registration
   */
  public Registration registerObservabilityHandler(ObservabilityHandler handler) {
    return registry.registerObservabilityHandler(handler);
  }

  public boolean unregisterCommandHandler(MessageType commandType) {
    Objects.requireNonNull(commandType, "commandType");
    return unregisterCommandHandler(commandType.name(), BusSession.GLOBAL);
  }

  public boolean unregisterCommandHandler(String commandType) {
    return unregisterCommandHandler(commandType, BusSession.GLOBAL);
  }

  /**
   * @return {@code true} if a handler was removed
   */
  public boolean unregisterCommandHandler(String commandType, String scope) {
    return registry.unregisterCommandHandler(commandType, requireScope(scope));
  }

  /**
   * Removes every event handler of a type in a scope.
   *
   * @return the number of removed handlers
   */
  public int unregisterEventHandlers(String eventType, String scope) {
    return registry.unregisterEventHandlers(eventType, requireScope(scope));
  }

  /**
   * Removes every command and event handler of a session, whoever registered it.
   *
   * @param sessionId the session id
   * @return the number of removed handlers
   */
  public int unregisterSessionHandlers(String sessionId) {
    return registry.unregisterScope(requireScope(sessionId));
  }

  /**
   * Opens a session with a generated id and publishes {@link BusEventType#SESSION_STARTED}.
   *
   * @return the session; close it to remove its handlers
   */
  public BusSession createSession() {
    return openSession(MessageSupport.newId(), null);
  }

  /**
   * Opens a session with the given id and publishes {@link BusEventType#SESSION_STARTED}.
   *
   * @param sessionId the session id, neither empty nor {@link BusSession#GLOBAL}
   * @return the session; close it to remove its handlers
   */
  public BusSession createSession(String sessionId) {
    return openSession(sessionId, null);
  }

  BusSession openSession(String sessionId, BusSession parent) {
    ensureOpen();
    BusSession session = new BusSession(this, sessionId, parent);
    publishInternal(BusEvents.sessionStarted(session.id(), parent == null ? null : parent.id()));
    logger.log(Level.FINE, "Opened {0}", session);
    return session;
  }

  /**
   * Waits up to the drain timeout for queued events to be dispatched.
   *
   * @return {@code true} if drained
   * @see #ensureEventsProcessed(Duration)
   */
  public boolean ensureEventsProcessed() {
    return ensureEventsProcessed(drainTimeout);
  }

  /**
   * Blocks until every event published before this call has been delivered to all of its
   * handlers, including events those handlers published in turn. Scheduled events that are
   * not yet due are not waited for.
   *
   * <p>Returns {@code false} immediately when called from inside an event handler, and when
   * the bus is not running while events are still queued.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if drained, {@code false} otherwise
   */
  public boolean ensureEventsProcessed(Duration timeout) {
    return dispatcher.awaitDrained(timeout);
  }

  /**
   * Returns the events of a session that are queued or scheduled but not yet dispatched:
   * queued events in dispatch order, followed by scheduled events in release order.
   *
   * @param sessionId a session id, or {@code null} for {@link BusSession#GLOBAL}
   * @return a snapshot
   */
  public List<Event> pendingEvents(String sessionId) {
    String scope = MessageSupport.normalizeSession(sessionId);
    List<Event> result = new ArrayList<>(dispatcher.pending(scope));
    result.addAll(scheduler.pending(scope));
    return result;
  }

  /**
   * Returns the most recent errors thrown by event and command handlers, oldest first.
   *
   * @return a snapshot bounded by {@link Builder#maxRecordedErrors(int)}
   */
  public List<Throwable> handlerErrors() {
    return dispatcher.recordedErrors();
  }

  /**
   * Stops accepting messages, waits up to the drain timeout for queued events, then
   * releases all threads. Scheduled events that are not yet due are discarded.
   *
   * @throws IllegalStateException when called from a handler
   */
  @Override
  public synchronized void close() {
    ensureNotDispatching("close");
    if (closed) {
      return;
    }
    closed = true;
    if (isRunning() && !dispatcher.awaitDrained(drainTimeout)) {
      logger.log(Level.WARNING, "Drain timeout exceeded; {0} events not dispatched", dispatcher.queueSize());
    }
    scheduler.close();
    dispatcher.close();
    invoker.close();
  }

  private static void ensureNotDispatching(String operation) {
    if (HandlerInvoker.inDispatchContext()) {
      throw new IllegalStateException("Cannot " + operation + " the bus from an event handler");
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("MessageBus has been closed");
    }
  }

  private static String requireScope(String scope) {
    Objects.requireNonNull(scope, "scope");
    if (scope.isEmpty()) {
      throw new IllegalArgumentException("scope cannot be empty");
    }
    return scope;
  }

  /** Builder for {@link MessageBus}. */
  public static final class Builder {
    private Duration handlerTimeout;
    private Duration drainTimeout;
    private Duration schedulerTick;
    private int queueCapacity = 10_000;
    private int maxRecordedErrors = 100;
    private Clock clock;
    private MetricsExporter metrics;
    private UnhandledEventHandler unhandledEventHandler;

    private Builder() {}

    /**
     * Sets the maximum time a single command or event handler may run.
     *
     * <p>Optional. Defaults to {@code 30s}. {@link Duration#ZERO} disables the timeout and
     * runs handlers on the calling or dispatch thread.
     *
     * @param handlerTimeout per-invocation timeout
     * @return this builder
     */
    public Builder handlerTimeout(Duration handlerTimeout) {
      this.handlerTimeout = handlerTimeout;
      return this;
    }

    /**
     * Sets how long {@link MessageBus#close()} and {@link MessageBus#ensureEventsProcessed()}
     * wait for queued events.
     *
     * <p>Optional. Defaults to {@code 10s}.
     *
     * @param drainTimeout the drain timeout
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Sets the interval at which due scheduled events are released.
     *
     * <p>Optional. Defaults to {@code 10ms}. Must be &gt; 0.
     *
     * @param schedulerTick the tick interval
     * @return this builder
     */
    public Builder schedulerTick(Duration schedulerTick) {
      this.schedulerTick = schedulerTick;
      return this;
    }

    /**
     * Sets the maximum number of queued, not yet dispatched events.
     *
     * <p>Optional. Defaults to {@code 10000}. Must be &gt; 0.
     *
     * @param queueCapacity queue capacity
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Optional. Defaults to {@code 100}. {@code 0} disables error recording.
     *
     * @param maxRecordedErrors number of recent handler errors kept
     * @return this builder
     */
    public Builder maxRecordedErrors(int maxRecordedErrors) {
      this.maxRecordedErrors = maxRecordedErrors;
      return this;
    }

    /**
     * Sets the clock scheduled events are released by.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the callback for events that match no functional handler.
     *
     * <p>Optional. Defaults to {@link UnhandledEventHandler#LOGGING}.
     *
     * @param unhandledEventHandler the callback
     * @return this builder
     */
    public Builder unhandledEventHandler(UnhandledEventHandler unhandledEventHandler) {
      this.unhandledEventHandler = unhandledEventHandler;
      return this;
    }

    /**
     * Builds the bus. Call {@link MessageBus#start()} to begin dispatching.
     *
     * @return a new {@link MessageBus}
     * @throws IllegalArgumentException if a duration or capacity is out of range
     */
    public MessageBus build() {
      return new MessageBus(this);
    }
  }
}

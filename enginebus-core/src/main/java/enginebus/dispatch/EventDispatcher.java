package enginebus.dispatch;

import enginebus.BusEventType;
import enginebus.BusEvents;
import enginebus.Event;
import enginebus.ObservabilityHandler;
import enginebus.UnhandledEventHandler;
import enginebus.registry.EventHandlerRegistration;
import enginebus.registry.HandlerRegistry;
import enginebus.spi.MetricsExporter;
import enginebus.util.BusThreadFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.IntSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded event loop that delivers queued events to their handlers.
 *
 * <p>Per event, observability handlers run first, then the functional handlers returned
 * by the {@link HandlerRegistry}, one at a time and in registration order. A failing
 * handler does not stop the others: the failure is logged, recorded, and published back
 * into the same queue as an {@link BusEventType#EVENT_HANDLER_FAILED} event. A handler
 * failing on such a failure event is only logged, so failures never cascade.
 *
 * <p>Every accepted event gets a sequence number under the same lock as the enqueue, so
 * queue order and sequence order agree. {@link #awaitDrained(Duration)} waits until the
 * loop has completed the sequence that was current when it was called.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see EventDispatcher.Builder
 * @see HandlerInvoker
 */
public final class EventDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventDispatcher.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final HandlerRegistry registry;
  private final HandlerInvoker invoker;
  private final MetricsExporter metrics;
  private final UnhandledEventHandler unhandledEventHandler;
  private final IntSupplier scheduledDepth;
  private final int maxRecordedErrors;
  private final BlockingQueue<QueuedEvent> queue;
  private final BusThreadFactory threadFactory = BusThreadFactory.forComponent("dispatcher");

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition progressed = lock.newCondition();
  private long enqueuedSeq;
  private long completedSeq;
  private long derivedSeq;

  private final Deque<Throwable> recordedErrors = new ArrayDeque<>();

  private volatile boolean running;
  private volatile Thread loopThread;

  private EventDispatcher(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.invoker = Objects.requireNonNull(builder.invoker, "invoker");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.unhandledEventHandler = builder.unhandledEventHandler != null
        ? builder.unhandledEventHandler : UnhandledEventHandler.LOGGING;
    this.scheduledDepth = builder.scheduledDepth != null ? builder.scheduledDepth : () -> 0;

    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (builder.maxRecordedErrors < 0) {
      throw new IllegalArgumentException("maxRecordedErrors must be >= 0");
    }
    this.maxRecordedErrors = builder.maxRecordedErrors;
    this.queue = new LinkedBlockingQueue<>(builder.queueCapacity);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the dispatch loop. Subsequent calls are no-ops while it is running.
   */
  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    loopThread = threadFactory.newThread(this::loop);
    loopThread.start();
  }

  /**
   * Stops the dispatch loop after the in-flight event completes. Events still queued
   * stay queued and are dispatched after the next {@link #start()}.
   */
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    Thread thread = loopThread;
    loopThread = null;
    if (thread != null && thread != Thread.currentThread()) {
      try {
        thread.join();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    signalProgress();
  }

  public boolean isRunning() {
    return running;
  }

  /**
   * Offers an event to the queue.
   *
   * @param event the event
   * @return {@code false} if the queue is at capacity
   */
  public boolean enqueue(Event event) {
    Objects.requireNonNull(event, "event");
    boolean accepted;
    lock.lock();
    try {
      long seq = enqueuedSeq + 1;
      accepted = queue.offer(new QueuedEvent(event, seq));
      if (accepted) {
        enqueuedSeq = seq;
        if (HandlerInvoker.inDispatchContext()) {
          derivedSeq = seq;
        }
      }
    } finally {
      lock.unlock();
    }
    metrics.recordQueueDepths(queue.size(), scheduledDepth.getAsInt());
    return accepted;
  }

  /**
   * Blocks until every event enqueued before this call, and every event that handlers
   * published while those events were dispatched, has been delivered to all its handlers.
   *
   * <p>Returns {@code false} without waiting when called from a handler or from the
   * dispatch loop, and as soon as the loop is found stopped with events pending.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if drained, {@code false} on timeout or when draining is impossible
   */
  public boolean awaitDrained(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (HandlerInvoker.inDispatchContext()) {
      logger.warning("awaitDrained called from dispatch context; returning without waiting");
      return false;
    }
    long nanos = timeout.toNanos();
    lock.lock();
    try {
      long target = enqueuedSeq;
      while (true) {
        while (completedSeq < target) {
          if (!running) {
            return false;
          }
          if (nanos <= 0L) {
            return false;
          }
          nanos = progressed.awaitNanos(nanos);
        }
        if (derivedSeq <= target) {
          return true;
        }
        target = derivedSeq;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the queued events of one session in dispatch order, without removing them.
   *
   * @param sessionId the session id
   * @return a snapshot
   */
  public List<Event> pending(String sessionId) {
    List<Event> result = new ArrayList<>();
    for (QueuedEvent queued : queue) {
      if (queued.event().sessionId().equals(sessionId)) {
        result.add(queued.event());
      }
    }
    return result;
  }

  public int queueSize() {
    return queue.size();
  }

  /**
   * Returns the most recent handler errors, oldest first.
   *
   * @return a snapshot of at most {@code maxRecordedErrors} errors
   */
  public List<Throwable> recordedErrors() {
    synchronized (recordedErrors) {
      return List.copyOf(recordedErrors);
    }
  }

  /**
   * Records a handler error for {@link #recordedErrors()}, evicting the oldest one when full.
   *
   * @param error the error
   */
  public void recordError(Throwable error) {
    if (maxRecordedErrors == 0) {
      return;
    }
    synchronized (recordedErrors) {
      if (recordedErrors.size() == maxRecordedErrors) {
        recordedErrors.removeFirst();
      }
      recordedErrors.addLast(error);
    }
  }

  /**
   * Drops every queued event and recorded error. Waiters on {@link #awaitDrained} are
   * released as if the dropped events had been dispatched.
   */
  public void clear() {
    lock.lock();
    try {
      queue.clear();
      completedSeq = enqueuedSeq;
      derivedSeq = enqueuedSeq;
      progressed.signalAll();
    } finally {
      lock.unlock();
    }
    synchronized (recordedErrors) {
      recordedErrors.clear();
    }
  }

  private void loop() {
    HandlerInvoker.enterDispatchContext();
    try {
      // A loop replaced by stop() and start() from its own thread exits here
      while (running && loopThread == Thread.currentThread()) {
        QueuedEvent next;
        try {
          next = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          break;
        }
        if (next == null) {
          continue;
        }
        try {
          dispatch(next.event());
        } catch (Throwable t) {
          logger.log(Level.SEVERE, "Dispatcher loop error", t);
        } finally {
          markCompleted(next.sequence());
        }
      }
    } finally {
      HandlerInvoker.exitDispatchContext();
    }
  }

  private void markCompleted(long sequence) {
    lock.lock();
    try {
      if (sequence > completedSeq) {
        completedSeq = sequence;
      }
      progressed.signalAll();
    } finally {
      lock.unlock();
    }
    metrics.recordQueueDepths(queue.size(), scheduledDepth.getAsInt());
  }

  private void signalProgress() {
    lock.lock();
    try {
      progressed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  private void dispatch(Event event) {
    metrics.incrementDispatched();
    for (ObservabilityHandler observer : registry.observabilityHandlers()) {
      try {
        observer.observe(event);
      } catch (VirtualMachineError e) {
        throw e;
      } catch (Throwable e) {
        metrics.incrementObservabilityFailure();
        logger.log(Level.WARNING, "Observability handler failed for " + event, e);
      }
    }

    List<EventHandlerRegistration> handlers = registry.eventHandlersFor(event.type(), event.sessionId());
    if (handlers.isEmpty()) {
      try {
        unhandledEventHandler.onUnhandled(event);
      } catch (VirtualMachineError e) {
        throw e;
      } catch (Throwable e) {
        logger.log(Level.WARNING, "Unhandled-event callback failed for " + event, e);
      }
      return;
    }
    for (EventHandlerRegistration registration : handlers) {
      long start = System.nanoTime();
      try {
        invoker.invoke(registration.describe(), () -> {
          registration.handler().onEvent(event);
          return null;
        });
      } catch (VirtualMachineError e) {
        throw e;
      } catch (Throwable t) {
        handleFailure(event, registration, t);
      } finally {
        metrics.recordHandlerDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
      }
    }
  }

  private void handleFailure(Event event, EventHandlerRegistration registration, Throwable failure) {
    metrics.incrementHandlerFailure();
    recordError(failure);
    logger.log(Level.SEVERE, "Event handler " + registration.describe() + " failed for " + event, failure);
    if (BusEventType.EVENT_HANDLER_FAILED.name().equals(event.type())) {
      logger.log(Level.WARNING, "Not publishing failure of a handler for {0}", event.type());
      return;
    }
    if (!enqueue(BusEvents.handlerFailed(event, registration.describe(), failure))) {
      metrics.incrementRejected();
      logger.log(Level.WARNING, "Queue full; dropped failure event for {0}", event);
    }
  }

  /**
   * Stops the loop after the in-flight event. Queued events are kept; call
   * {@link #awaitDrained(Duration)} first to deliver them.
   */
  @Override
  public void close() {
    stop();
  }

  /** Builder for {@link EventDispatcher}. */
  public static final class Builder {
    private HandlerRegistry registry;
    private HandlerInvoker invoker;
    private MetricsExporter metrics;
    private UnhandledEventHandler unhandledEventHandler;
    private IntSupplier scheduledDepth;
    private int queueCapacity = 10_000;
    private int maxRecordedErrors = 100;

    private Builder() {}

    /**
     * Sets the registry handlers are looked up in.
     *
     * <p><b>Required.</b>
     *
     * @param registry the handler registry
     * @return this builder
     */
    public Builder registry(HandlerRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the invoker that runs each handler.
     *
     * <p><b>Required.</b>
     *
     * @param invoker the handler invoker
     * @return this builder
     */
    public Builder invoker(HandlerInvoker invoker) {
      this.invoker = invoker;
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
     * Optional. Defaults to {@link UnhandledEventHandler#LOGGING}.
     *
     * @param unhandledEventHandler callback for events without functional handlers
     * @return this builder
     */
    public Builder unhandledEventHandler(UnhandledEventHandler unhandledEventHandler) {
      this.unhandledEventHandler = unhandledEventHandler;
      return this;
    }

    /**
     * Supplies the scheduler depth reported with queue-depth metrics.
     *
     * @param scheduledDepth current number of scheduled events
     * @return this builder
     */
    public Builder scheduledDepth(IntSupplier scheduledDepth) {
      this.scheduledDepth = scheduledDepth;
      return this;
    }

    /**
     * Sets the maximum number of queued events.
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
     * Optional. Defaults to {@code 100}. Must be &ge; 0; {@code 0} disables recording.
     *
     * @param maxRecordedErrors size of the recent-errors buffer
     * @return this builder
     */
    public Builder maxRecordedErrors(int maxRecordedErrors) {
      this.maxRecordedErrors = maxRecordedErrors;
      return this;
    }

    /**
     * Builds the dispatcher. Call {@link EventDispatcher#start()} to begin dispatching.
     *
     * @return a new {@link EventDispatcher}
     * @throws NullPointerException if {@code registry} or {@code invoker} is null
     * @throws IllegalArgumentException if {@code queueCapacity <= 0} or
     *     {@code maxRecordedErrors < 0}
     */
    public EventDispatcher build() {
      return new EventDispatcher(this);
    }
  }
}

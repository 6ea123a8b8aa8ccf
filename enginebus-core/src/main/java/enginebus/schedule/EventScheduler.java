package enginebus.schedule;

import enginebus.Event;
import enginebus.util.BusThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds scheduled events until their time and releases them in chronological order.
 *
 * <p>Pending events are ordered by {@link Event#scheduledAt()}, ties by the order they
 * were scheduled in. A single daemon thread calls {@link #releaseDue()} every tick; each
 * due event is handed to the sink, and an event the sink rejects stays pending for the
 * next tick so nothing is dropped.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class EventScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventScheduler.class.getName());

  private static final Comparator<Entry> ORDER =
      Comparator.comparing(Entry::dueAt).thenComparingLong(Entry::sequence);

  private final Predicate<Event> sink;
  private final Clock clock;
  private final Duration tick;

  private final Object lock = new Object();
  private final PriorityQueue<Entry> pending = new PriorityQueue<>(ORDER);
  private long sequence;

  private ScheduledExecutorService executor;
  private volatile ScheduledFuture<?> tickTask;

  private EventScheduler(Builder builder) {
    this.sink = Objects.requireNonNull(builder.sink, "sink");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.tick = builder.tick != null ? builder.tick : Duration.ofMillis(10);
    if (tick.isZero() || tick.isNegative()) {
      throw new IllegalArgumentException("tick must be > 0");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Accepts a scheduled event.
   *
   * @param event an event with {@link Event#isScheduled()} set
   * @throws IllegalArgumentException if the event has no scheduled time
   */
  public void schedule(Event event) {
    Objects.requireNonNull(event, "event");
    if (!event.isScheduled()) {
      throw new IllegalArgumentException("Event is not scheduled: " + event);
    }
    synchronized (lock) {
      pending.add(new Entry(event, event.scheduledAt(), sequence++));
    }
  }

  /**
   * Starts ticking. Subsequent calls are no-ops while it is running.
   */
  public synchronized void start() {
    if (tickTask != null) {
      return;
    }
    if (executor == null) {
      executor = Executors.newSingleThreadScheduledExecutor(BusThreadFactory.forComponent("scheduler"));
    }
    long nanos = tick.toNanos();
    tickTask = executor.scheduleWithFixedDelay(this::runTick, nanos, nanos, TimeUnit.NANOSECONDS);
  }

  /** Stops ticking. Pending events are kept. */
  public synchronized void stop() {
    if (tickTask != null) {
      tickTask.cancel(false);
      tickTask = null;
    }
  }

  public boolean isRunning() {
    return tickTask != null;
  }

  private void runTick() {
    try {
      releaseDue();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Scheduler tick failed", t);
    }
  }

  /**
   * Releases every event whose time has come, earliest first. Stops at the first event
   * the sink rejects.
   *
   * <p>May be invoked directly for testing.
   *
   * @return number of released events
   */
  public int releaseDue() {
    Instant now = clock.instant();
    int released = 0;
    synchronized (lock) {
      while (!pending.isEmpty()) {
        Entry head = pending.peek();
        if (head.dueAt().isAfter(now)) {
          break;
        }
        if (!sink.test(head.event())) {
          logger.log(Level.FINE, "Sink rejected {0}; retrying next tick", head.event());
          break;
        }
        pending.poll();
        released++;
      }
    }
    return released;
  }

  /**
   * Returns the pending events of one session in release order, without removing them.
   *
   * @param sessionId the session id
   * @return a snapshot
   */
  public List<Event> pending(String sessionId) {
    List<Entry> snapshot;
    synchronized (lock) {
      snapshot = new ArrayList<>(pending);
    }
    snapshot.sort(ORDER);
    List<Event> result = new ArrayList<>();
    for (Entry entry : snapshot) {
      if (entry.event().sessionId().equals(sessionId)) {
        result.add(entry.event());
      }
    }
    return result;
  }

  public int size() {
    synchronized (lock) {
      return pending.size();
    }
  }

  /** Drops every pending event. */
  public void clear() {
    synchronized (lock) {
      pending.clear();
    }
  }

  /** Stops ticking and shuts down the scheduler thread. Pending events are discarded. */
  @Override
  public synchronized void close() {
    stop();
    if (executor != null) {
      executor.shutdownNow();
      try {
        executor.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      executor = null;
    }
    int dropped = size();
    if (dropped > 0) {
      logger.log(Level.WARNING, "Discarding {0} scheduled events on close", dropped);
    }
    clear();
  }

  private record Entry(Event event, Instant dueAt, long sequence) {
  }

  /** Builder for {@link EventScheduler}. */
  public static final class Builder {
    private Predicate<Event> sink;
    private Clock clock;
    private Duration tick;

    private Builder() {}

    /**
     * Sets where due events are released to. The sink returns {@code false} to refuse an
     * event, which is then retried on the next tick.
     *
     * <p><b>Required.</b>
     *
     * @param sink the release target
     * @return this builder
     */
    public Builder sink(Predicate<Event> sink) {
      this.sink = sink;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock due times are compared against
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the delay between release checks.
     *
     * <p>Optional. Defaults to {@code 10ms}. Must be &gt; 0.
     *
     * @param tick tick interval
     * @return this builder
     */
    public Builder tick(Duration tick) {
      this.tick = tick;
      return this;
    }

    /**
     * @return a new {@link EventScheduler}; call {@link EventScheduler#start()} to begin ticking
     * @throws NullPointerException if {@code sink} is null
     * @throws IllegalArgumentException if {@code tick} is not positive
     */
    public EventScheduler build() {
      return new EventScheduler(this);
    }
  }
}

package enginebus.micrometer;

import enginebus.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and timers with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code enginebus.events.published} - events accepted into the dispatch queue</li>
 *   <li>{@code enginebus.events.scheduled} - events accepted by the scheduler</li>
 *   <li>{@code enginebus.events.rejected} - events refused because the queue was full</li>
 *   <li>{@code enginebus.events.dispatched} - events delivered to their handlers</li>
 *   <li>{@code enginebus.handler.failure} - event handler invocations that failed</li>
 *   <li>{@code enginebus.observability.failure} - observability handler invocations that failed</li>
 *   <li>{@code enginebus.command.success} / {@code enginebus.command.failure} - command outcomes</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code enginebus.queue.immediate.depth} - events waiting for dispatch</li>
 *   <li>{@code enginebus.queue.scheduled.depth} - events waiting for their scheduled time</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code enginebus.handler.duration} - event handler execution time</li>
 *   <li>{@code enginebus.command.duration} - command handler execution time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter published;
  private final Counter scheduled;
  private final Counter rejected;
  private final Counter dispatched;
  private final Counter handlerFailure;
  private final Counter observabilityFailure;
  private final Counter commandSuccess;
  private final Counter commandFailure;
  private final Gauge immediateDepthGauge;
  private final Gauge scheduledDepthGauge;
  private final Timer handlerDuration;
  private final Timer commandDuration;

  private final AtomicInteger immediateDepth = new AtomicInteger();
  private final AtomicInteger scheduledDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "enginebus"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "enginebus");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several buses in
   * one process.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "chat.bus"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.published = counter(namePrefix + ".events.published", "Events accepted into the dispatch queue");
    this.scheduled = counter(namePrefix + ".events.scheduled", "Events accepted by the scheduler");
    this.rejected = counter(namePrefix + ".events.rejected", "Events refused (queue full)");
    this.dispatched = counter(namePrefix + ".events.dispatched", "Events delivered to handlers");
    this.handlerFailure = counter(namePrefix + ".handler.failure", "Event handler invocations that failed");
    this.observabilityFailure = counter(namePrefix + ".observability.failure",
        "Observability handler invocations that failed");
    this.commandSuccess = counter(namePrefix + ".command.success", "Commands that succeeded");
    this.commandFailure = counter(namePrefix + ".command.failure", "Commands that failed");

    this.immediateDepthGauge = Gauge.builder(namePrefix + ".queue.immediate.depth", immediateDepth, AtomicInteger::get)
        .register(registry);
    this.scheduledDepthGauge = Gauge.builder(namePrefix + ".queue.scheduled.depth", scheduledDepth, AtomicInteger::get)
        .register(registry);

    this.handlerDuration = Timer.builder(namePrefix + ".handler.duration")
        .description("Event handler execution time")
        .register(registry);
    this.commandDuration = Timer.builder(namePrefix + ".command.duration")
        .description("Command handler execution time")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementPublished() {
    if (closed) return;
    published.increment();
  }

  @Override
  public void incrementScheduled() {
    if (closed) return;
    scheduled.increment();
  }

  @Override
  public void incrementRejected() {
    if (closed) return;
    rejected.increment();
  }

  @Override
  public void incrementDispatched() {
    if (closed) return;
    dispatched.increment();
  }

  @Override
  public void incrementHandlerFailure() {
    if (closed) return;
    handlerFailure.increment();
  }

  @Override
  public void incrementObservabilityFailure() {
    if (closed) return;
    observabilityFailure.increment();
  }

  @Override
  public void incrementCommandSuccess() {
    if (closed) return;
    commandSuccess.increment();
  }

  @Override
  public void incrementCommandFailure() {
    if (closed) return;
    commandFailure.increment();
  }

  @Override
  public void recordQueueDepths(int immediateDepth, int scheduledDepth) {
    if (closed) return;
    this.immediateDepth.set(immediateDepth);
    this.scheduledDepth.set(scheduledDepth);
  }

  @Override
  public void recordHandlerDurationMs(long durationMs) {
    if (closed) return;
    handlerDuration.record(Duration.ofMillis(durationMs));
  }

  @Override
  public void recordCommandDurationMs(long durationMs) {
    if (closed) return;
    commandDuration.record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the {@link enginebus.MessageBus} it was given to is closed, to
   * prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(published, scheduled, rejected, dispatched,
        handlerFailure, observabilityFailure, commandSuccess, commandFailure,
        immediateDepthGauge, scheduledDepthGauge, handlerDuration, commandDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}

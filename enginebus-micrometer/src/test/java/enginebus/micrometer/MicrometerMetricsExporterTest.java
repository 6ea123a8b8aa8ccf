package enginebus.micrometer;

import enginebus.Command;
import enginebus.CommandResult;
import enginebus.Event;
import enginebus.MessageBus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementPublished() {
    exporter.incrementPublished();
    exporter.incrementPublished();
    assertEquals(2.0, counter("enginebus.events.published").count());
  }

  @Test
  void incrementScheduledAndRejected() {
    exporter.incrementScheduled();
    exporter.incrementRejected();
    exporter.incrementRejected();
    assertEquals(1.0, counter("enginebus.events.scheduled").count());
    assertEquals(2.0, counter("enginebus.events.rejected").count());
  }

  @Test
  void incrementFailures() {
    exporter.incrementHandlerFailure();
    exporter.incrementObservabilityFailure();
    exporter.incrementCommandFailure();
    assertEquals(1.0, counter("enginebus.handler.failure").count());
    assertEquals(1.0, counter("enginebus.observability.failure").count());
    assertEquals(1.0, counter("enginebus.command.failure").count());
  }

  @Test
  void recordQueueDepths() {
    exporter.recordQueueDepths(42, 7);
    assertEquals(42.0, gauge("enginebus.queue.immediate.depth").value());
    assertEquals(7.0, gauge("enginebus.queue.scheduled.depth").value());

    exporter.recordQueueDepths(0, 0);
    assertEquals(0.0, gauge("enginebus.queue.immediate.depth").value());
    assertEquals(0.0, gauge("enginebus.queue.scheduled.depth").value());
  }

  @Test
  void recordDurations() {
    exporter.recordHandlerDurationMs(15);
    exporter.recordCommandDurationMs(40);
    assertEquals(1, timer("enginebus.handler.duration").count());
    assertEquals(40.0, timer("enginebus.command.duration").totalTime(TimeUnit.MILLISECONDS));
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "chat.bus");
    custom.incrementDispatched();
    custom.recordQueueDepths(10, 5);

    assertEquals(1.0, counter("chat.bus.events.dispatched").count());
    assertEquals(10.0, gauge("chat.bus.queue.immediate.depth").value());
    assertEquals(5.0, gauge("chat.bus.queue.scheduled.depth").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();

    assertNull(registry.find("enginebus.events.published").counter());
    assertNull(registry.find("enginebus.queue.immediate.depth").gauge());
    assertDoesNotThrow(() -> exporter.incrementPublished());
  }

  @Test
  void busReportsThroughExporter() {
    try (MessageBus bus = MessageBus.builder().metrics(exporter).build()) {
      bus.start();
      bus.registerCommandHandler("ok", command -> CommandResult.success(command, 1));
      bus.registerEventHandler("boom", event -> {
        throw new IllegalStateException("boom");
      });

      bus.execute(Command.of("ok", null));
      bus.execute(Command.of("missing", null));
      bus.publish(Event.of("boom", null));
      assertTrue(bus.ensureEventsProcessed());

      assertEquals(1.0, counter("enginebus.command.success").count());
      assertEquals(1.0, counter("enginebus.command.failure").count());
      assertEquals(1.0, counter("enginebus.handler.failure").count());
      // started + result for "ok", result for "missing", "boom", and its failure event
      assertEquals(5.0, counter("enginebus.events.dispatched").count());
    }
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "bus."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }

  private Timer timer(String name) {
    Timer t = registry.find(name).timer();
    assertNotNull(t, "Timer not found: " + name);
    return t;
  }
}

package enginebus.benchmark;

import enginebus.Event;
import enginebus.MessageBus;
import org.openjdk.jmh.annotations.*;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Measures publish-to-handler latency: publish -> queue -> dispatch loop -> every handler.
 *
 * <p>Run: {@code java -cp <classpath> org.openjdk.jmh.Main MessageBusDispatchBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class MessageBusDispatchBenchmark {

  private MessageBus bus;

  @Param({"1", "4", "16"})
  private int handlerCount;

  @Param({"0", "30000"})
  private long handlerTimeoutMs;

  private final AtomicReference<CountDownLatch> latchRef = new AtomicReference<>();

  @Setup(Level.Trial)
  public void setup() {
    bus = MessageBus.builder()
        .handlerTimeout(Duration.ofMillis(handlerTimeoutMs))
        .build();
    for (int i = 0; i < handlerCount; i++) {
      bus.registerEventHandler("BenchEvent", event -> {
        CountDownLatch latch = latchRef.get();
        if (latch != null) latch.countDown();
      });
    }
    bus.start();
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    bus.close();
  }

  @Benchmark
  public void publishAndDispatch() throws Exception {
    CountDownLatch latch = new CountDownLatch(handlerCount);
    latchRef.set(latch);

    bus.publish(Event.of("BenchEvent", "payload"));

    latch.await(5, TimeUnit.SECONDS);
  }

  @Benchmark
  @OperationsPerInvocation(100)
  public boolean publishBatchAndDrain() {
    latchRef.set(null);
    for (int i = 0; i < 100; i++) {
      bus.publish(Event.of("BenchEvent", i));
    }
    return bus.ensureEventsProcessed(Duration.ofSeconds(5));
  }
}

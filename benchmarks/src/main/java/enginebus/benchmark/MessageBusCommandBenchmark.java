package enginebus.benchmark;

import enginebus.Command;
import enginebus.CommandResult;
import enginebus.MessageBus;
import org.openjdk.jmh.annotations.*;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Measures synchronous command execution, including the lifecycle events it publishes.
 *
 * <p>Run: {@code java -cp <classpath> org.openjdk.jmh.Main MessageBusCommandBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class MessageBusCommandBenchmark {

  private MessageBus bus;

  @Param({"0", "30000"})
  private long handlerTimeoutMs;

  @Setup(Level.Trial)
  public void setup() {
    bus = MessageBus.builder()
        .handlerTimeout(Duration.ofMillis(handlerTimeoutMs))
        .build();
    bus.registerCommandHandler("BenchCommand",
        command -> CommandResult.success(command, command.payload()));
    bus.start();
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    bus.close();
  }

  @Benchmark
  public CommandResult execute() {
    return bus.execute(Command.of("BenchCommand", "payload"));
  }

  @Benchmark
  public CommandResult executeInSession() {
    CommandResult result = bus.execute(Command.builder("BenchCommand").sessionId("bench").build());
    bus.ensureEventsProcessed(Duration.ofSeconds(5));
    return result;
  }
}

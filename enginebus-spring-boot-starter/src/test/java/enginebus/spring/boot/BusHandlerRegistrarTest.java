package enginebus.spring.boot;

import enginebus.Command;
import enginebus.CommandHandler;
import enginebus.CommandResult;
import enginebus.Event;
import enginebus.EventHandler;
import enginebus.MessageBus;
import enginebus.MessageType;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class BusHandlerRegistrarTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner();

  @Test
  void registersStringBasedListener() {
    runner.withUserConfiguration(StringListenerConfig.class).run(ctx -> {
      var bus = ctx.getBean(MessageBus.class);
      bus.publish(Event.of("TestEvent", "payload"));
      bus.publish(Event.of("OtherEvent", "payload"));
      assertTrue(bus.ensureEventsProcessed());

      var listener = ctx.getBean(StringBasedListener.class);
      assertEquals(1, listener.received.size());
      assertEquals("TestEvent", listener.received.get(0).type());
    });
  }

  @Test
  void registersSessionScopedListener() {
    runner.withUserConfiguration(SessionListenerConfig.class).run(ctx -> {
      var bus = ctx.getBean(MessageBus.class);
      bus.publish(Event.builder("TestEvent").sessionId("s1").build());
      bus.publish(Event.builder("TestEvent").sessionId("s2").build());
      assertTrue(bus.ensureEventsProcessed());

      var listener = ctx.getBean(SessionListener.class);
      assertEquals(1, listener.received.size());
      assertEquals("s1", listener.received.get(0).sessionId());
    });
  }

  @Test
  void registersAllEventsListener() {
    runner.withUserConfiguration(AllEventsListenerConfig.class).run(ctx -> {
      var bus = ctx.getBean(MessageBus.class);
      bus.publish(Event.of("First", null));
      bus.publish(Event.of("Second", null));
      assertTrue(bus.ensureEventsProcessed());

      var listener = ctx.getBean(AllEventsListener.class);
      assertEquals(List.of("First", "Second"),
          listener.received.stream().map(Event::type).toList());
    });
  }

  @Test
  void registersClassBasedEventType() {
    runner.withUserConfiguration(ClassBasedListenerConfig.class).run(ctx -> {
      var bus = ctx.getBean(MessageBus.class);
      bus.publish(Event.of(new TestClassEventType(), null));
      assertTrue(bus.ensureEventsProcessed());

      assertEquals(1, ctx.getBean(ClassBasedListener.class).received.size());
    });
  }

  @Test
  void registersNamedEnumConstant() {
    runner.withUserConfiguration(EnumListenerConfig.class).run(ctx -> {
      var bus = ctx.getBean(MessageBus.class);
      bus.publish(Event.of(TestEventTypes.STATUS, null));
      bus.publish(Event.of(TestEventTypes.TOOL_CALL, null));
      assertTrue(bus.ensureEventsProcessed());

      var listener = ctx.getBean(EnumListener.class);
      assertEquals(1, listener.received.size());
      assertEquals("TOOL_CALL", listener.received.get(0).type());
    });
  }

  @Test
  void registersCommandHandlerFromSingleConstantEnum() {
    runner.withUserConfiguration(CommandHandlerConfig.class).run(ctx -> {
      var bus = ctx.getBean(MessageBus.class);
      CommandResult result = bus.execute(Command.of("RunTurn", "hello"));

      assertTrue(result.success());
      assertEquals("HELLO", result.result());
    });
  }

  @Test
  void startsBusAfterRegistration() {
    runner.withUserConfiguration(StringListenerConfig.class).run(ctx -> {
      assertTrue(ctx.getBean(MessageBus.class).isRunning());
    });
  }

  @Test
  void leavesBusStoppedWithoutAutoStart() {
    runner.withUserConfiguration(NoAutoStartConfig.class).run(ctx -> {
      assertFalse(ctx.getBean(MessageBus.class).isRunning());
    });
  }

  @Test
  void failsWhenBeanDoesNotImplementEventHandler() {
    runner.withUserConfiguration(NotAHandlerConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenNoEventTypeSpecified() {
    runner.withUserConfiguration(NoEventTypeConfig.class).run(ctx -> {
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenEnumConstantIsUnknown() {
    runner.withUserConfiguration(UnknownConstantConfig.class).run(ctx -> {
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenEnumConstantIsAmbiguous() {
    runner.withUserConfiguration(AmbiguousEnumConfig.class).run(ctx -> {
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsOnSecondHandlerForSameCommand() {
    runner.withUserConfiguration(DuplicateCommandConfig.class).run(ctx -> {
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  // ── Test support ─────────────────────────────────────────────

  public record TestClassEventType() implements MessageType {
    @Override
    public String name() {
      return "TestClassEvent";
    }
  }

  public enum TestEventTypes implements MessageType {
    STATUS, TOOL_CALL
  }

  public enum RunTurnCommand implements MessageType {
    RunTurn
  }

  abstract static class RecordingListener implements EventHandler {
    final List<Event> received = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(Event event) {
      received.add(event);
    }
  }

  @BusEventListener(eventType = "TestEvent")
  static class StringBasedListener extends RecordingListener {}

  @BusEventListener(eventType = "TestEvent", sessionId = "s1")
  static class SessionListener extends RecordingListener {}

  @BusEventListener(eventType = "*")
  static class AllEventsListener extends RecordingListener {}

  @BusEventListener(eventType = "IgnoredEvent", eventTypeClass = TestClassEventType.class)
  static class ClassBasedListener extends RecordingListener {}

  @BusEventListener(eventTypeClass = TestEventTypes.class, eventType = "TOOL_CALL")
  static class EnumListener extends RecordingListener {}

  @BusEventListener(eventTypeClass = TestEventTypes.class, eventType = "MISSING")
  static class UnknownConstantListener extends RecordingListener {}

  @BusEventListener(eventTypeClass = TestEventTypes.class)
  static class AmbiguousEnumListener extends RecordingListener {}

  @BusEventListener
  static class NoEventTypeListener extends RecordingListener {}

  @BusEventListener(eventType = "SomeEvent")
  static class NotAHandlerBean {
    // Does NOT implement EventHandler
  }

  @BusCommandHandler(commandTypeClass = RunTurnCommand.class)
  static class UpperCaseHandler implements CommandHandler {
    @Override
    public CommandResult handle(Command command) {
      return CommandResult.success(command, ((String) command.payload()).toUpperCase());
    }
  }

  @BusCommandHandler(commandType = "RunTurn")
  static class SecondRunTurnHandler implements CommandHandler {
    @Override
    public CommandResult handle(Command command) {
      return CommandResult.success(command, null);
    }
  }

  @Configuration
  static class BaseConfig {
    @Bean(destroyMethod = "close")
    MessageBus messageBus() {
      return MessageBus.builder().handlerTimeout(Duration.ZERO).build();
    }

    @Bean
    BusHandlerRegistrar registrar(ListableBeanFactory bf, MessageBus bus) {
      return new BusHandlerRegistrar(bf, bus, true);
    }
  }

  @Configuration
  static class StringListenerConfig extends BaseConfig {
    @Bean
    StringBasedListener stringBasedListener() {
      return new StringBasedListener();
    }
  }

  @Configuration
  static class SessionListenerConfig extends BaseConfig {
    @Bean
    SessionListener sessionListener() {
      return new SessionListener();
    }
  }

  @Configuration
  static class AllEventsListenerConfig extends BaseConfig {
    @Bean
    AllEventsListener allEventsListener() {
      return new AllEventsListener();
    }
  }

  @Configuration
  static class ClassBasedListenerConfig extends BaseConfig {
    @Bean
    ClassBasedListener classBasedListener() {
      return new ClassBasedListener();
    }
  }

  @Configuration
  static class EnumListenerConfig extends BaseConfig {
    @Bean
    EnumListener enumListener() {
      return new EnumListener();
    }
  }

  @Configuration
  static class UnknownConstantConfig extends BaseConfig {
    @Bean
    UnknownConstantListener unknownConstantListener() {
      return new UnknownConstantListener();
    }
  }

  @Configuration
  static class AmbiguousEnumConfig extends BaseConfig {
    @Bean
    AmbiguousEnumListener ambiguousEnumListener() {
      return new AmbiguousEnumListener();
    }
  }

  @Configuration
  static class NoEventTypeConfig extends BaseConfig {
    @Bean
    NoEventTypeListener noEventTypeListener() {
      return new NoEventTypeListener();
    }
  }

  @Configuration
  static class NotAHandlerConfig extends BaseConfig {
    @Bean
    NotAHandlerBean notAHandlerBean() {
      return new NotAHandlerBean();
    }
  }

  @Configuration
  static class CommandHandlerConfig extends BaseConfig {
    @Bean
    UpperCaseHandler upperCaseHandler() {
      return new UpperCaseHandler();
    }
  }

  @Configuration
  static class DuplicateCommandConfig extends CommandHandlerConfig {
    @Bean
    SecondRunTurnHandler secondRunTurnHandler() {
      return new SecondRunTurnHandler();
    }
  }

  @Configuration
  static class NoAutoStartConfig {
    @Bean(destroyMethod = "close")
    MessageBus messageBus() {
      return MessageBus.builder().build();
    }

    @Bean
    BusHandlerRegistrar registrar(ListableBeanFactory bf, MessageBus bus) {
      return new BusHandlerRegistrar(bf, bus, false);
    }
  }
}

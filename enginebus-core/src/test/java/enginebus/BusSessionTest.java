package enginebus;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BusSessionTest {

  private MessageBus bus;
  private final List<Event> observed = Collections.synchronizedList(new ArrayList<>());

  @BeforeEach
  void setUp() {
    bus = MessageBus.builder().build();
    bus.registerObservabilityHandler(observed::add);
    bus.start();
  }

  @AfterEach
  void tearDown() {
    bus.close();
  }

  private void publishTo(String sessionId) {
    bus.publish(Event.builder("status").sessionId(sessionId).build());
    assertTrue(bus.ensureEventsProcessed());
  }

  @Test
  void closingSessionRemovesItsHandlers() {
    AtomicInteger calls = new AtomicInteger();
    String id;
    try (BusSession session = bus.createSession()) {
      id = session.id();
      session.registerEventHandler("status", event -> calls.incrementAndGet());
      publishTo(id);
      assertEquals(1, calls.get());
    }

    publishTo(id);
    assertEquals(1, calls.get());
  }

  @Test
  void handlersAreRemovedWhenBodyThrows() {
    AtomicInteger calls = new AtomicInteger();
    assertThrows(IllegalStateException.class, () -> {
      try (BusSession session = bus.createSession("failing")) {
        session.registerEventHandler("status", event -> calls.incrementAndGet());
        throw new IllegalStateException("body failed");
      }
    });

    publishTo("failing");
    assertEquals(0, calls.get());
  }

  @Test
  void childTeardownDoesNotAffectParent() {
    AtomicInteger parentCalls = new AtomicInteger();
    AtomicInteger childCalls = new AtomicInteger();
    try (BusSession parent = bus.createSession("parent")) {
      parent.registerEventHandler("status", event -> parentCalls.incrementAndGet());
      try (BusSession child = parent.createSession("child")) {
        child.registerEventHandler("status", event -> childCalls.incrementAndGet());
        assertSame(parent, child.parent());
      }

      publishTo("parent");
      publishTo("child");
      assertEquals(1, parentCalls.get());
      assertEquals(0, childCalls.get());
    }
  }

  @Test
  void closingParentClosesOpenChildrenFirst() {
    BusSession parent = bus.createSession("p");
    BusSession first = parent.createSession("c1");
    BusSession second = parent.createSession("c2");
    AtomicInteger childCalls = new AtomicInteger();
    first.registerEventHandler("status", event -> childCalls.incrementAndGet());

    parent.close();
    assertTrue(bus.ensureEventsProcessed());

    assertTrue(first.isClosed());
    assertTrue(second.isClosed());
    publishTo("c1");
    assertEquals(0, childCalls.get());

    List<String> ended;
    synchronized (observed) {
      ended = observed.stream()
          .filter(e -> e.type().equals(BusEventType.SESSION_ENDED.name()))
          .map(Event::sessionId)
          .toList();
    }
    assertEquals(List.of("c2", "c1", "p"), ended);
  }

  @Test
  void sessionLifecycleEventsArePublished() {
    try (BusSession parent = bus.createSession("outer")) {
      parent.createSession("inner").close(new IllegalStateException("aborted"));
    }
    assertTrue(bus.ensureEventsProcessed());

    List<Event> started;
    List<Event> ended;
    synchronized (observed) {
      started = observed.stream().filter(e -> e.type().equals(BusEventType.SESSION_STARTED.name())).toList();
      ended = observed.stream().filter(e -> e.type().equals(BusEventType.SESSION_ENDED.name())).toList();
    }
    assertEquals(2, started.size());
    BusEvents.SessionStarted inner = started.get(1).payload(BusEvents.SessionStarted.class);
    assertEquals("inner", inner.sessionId());
    assertEquals("outer", inner.parentId());
    assertNull(started.get(0).payload(BusEvents.SessionStarted.class).parentId());

    assertEquals(2, ended.size());
    assertEquals("IllegalStateException: aborted", ended.get(0).payload(BusEvents.SessionEnded.class).error());
    assertNull(ended.get(1).payload(BusEvents.SessionEnded.class).error());
  }

  @Test
  void executeBindsCommandToSession() {
    bus.registerCommandHandler("whoami", command -> CommandResult.success(command, command.sessionId()));

    try (BusSession session = bus.createSession("s42")) {
      CommandResult result = session.execute(Command.of("whoami", null));

      assertEquals("s42", result.result());
    }
  }

  @Test
  void sessionCommandHandlerIsRemovedOnClose() {
    bus.registerCommandHandler("confirm", command -> CommandResult.success(command, "auto"));
    try (BusSession session = bus.createSession("ui")) {
      session.registerCommandHandler("confirm", command -> CommandResult.success(command, "prompted"));

      assertEquals("prompted", session.execute(Command.of("confirm", null)).result());
    }

    assertEquals("auto", bus.execute(Command.builder("confirm").sessionId("ui").build()).result());
  }

  @Test
  void closeRemovesOnlyRegistrationsMadeThroughHandle() {
    AtomicInteger direct = new AtomicInteger();
    bus.registerEventHandler("status", event -> direct.incrementAndGet(), "shared");
    try (BusSession session = bus.createSession("shared")) {
      session.registerAllEventsHandler(event -> { });
    }

    publishTo("shared");
    assertEquals(1, direct.get());
  }

  @Test
  void closedSessionRejectsRegistration() {
    BusSession session = bus.createSession();
    session.close();

    assertThrows(IllegalStateException.class, () ->
        session.registerEventHandler("status", event -> { }));
    assertThrows(IllegalStateException.class, session::createSession);
  }

  @Test
  void closeIsIdempotent() {
    BusSession session = bus.createSession("twice");
    session.close();
    session.close();
    assertTrue(bus.ensureEventsProcessed());

    long ended;
    synchronized (observed) {
      ended = observed.stream().filter(e -> e.type().equals(BusEventType.SESSION_ENDED.name())).count();
    }
    assertEquals(1, ended);
  }

  @Test
  void rejectsGlobalOrEmptyId() {
    assertThrows(IllegalArgumentException.class, () -> bus.createSession(BusSession.GLOBAL));
    assertThrows(IllegalArgumentException.class, () -> bus.createSession(""));
  }

  @Test
  void pendingEventsAreScopedToSession() {
    bus.stop();
    try (BusSession session = bus.createSession("queued")) {
      bus.publish(Event.builder("status").sessionId("queued").build());
      bus.publish(Event.builder("status").sessionId("other").build());

      List<Event> pending = session.pendingEvents();
      assertEquals(2, pending.size());
      assertEquals(BusEventType.SESSION_STARTED.name(), pending.get(0).type());
      assertEquals("status", pending.get(1).type());
      assertFalse(pending.stream().anyMatch(e -> e.sessionId().equals("other")));
    }
  }
}

package enginebus.dispatch;

import enginebus.BusEventType;
import enginebus.BusSession;
import enginebus.Event;
import enginebus.registry.DefaultHandlerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventDispatcherTest {

    private final DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    private final HandlerInvoker invoker = new HandlerInvoker(Duration.ZERO);
    private EventDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.close();
        }
        invoker.close();
    }

    private EventDispatcher newDispatcher(int capacity) {
        dispatcher = EventDispatcher.builder()
                .registry(registry)
                .invoker(invoker)
                .queueCapacity(capacity)
                .build();
        return dispatcher;
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsNullRegistry() {
        assertThrows(NullPointerException.class, () ->
                EventDispatcher.builder().invoker(invoker).build());
    }

    @Test
    void builderRejectsNullInvoker() {
        assertThrows(NullPointerException.class, () ->
                EventDispatcher.builder().registry(registry).build());
    }

    @Test
    void builderRejectsZeroQueueCapacity() {
        assertThrows(IllegalArgumentException.class, () ->
                EventDispatcher.builder().registry(registry).invoker(invoker).queueCapacity(0).build());
    }

    // ── Enqueue and lifecycle ───────────────────────────────────────

    @Test
    void enqueueReturnsFalseWhenQueueFull() {
        EventDispatcher d = newDispatcher(1);

        assertTrue(d.enqueue(Event.of("a", null)));
        assertFalse(d.enqueue(Event.of("b", null)));
        assertEquals(1, d.queueSize());
    }

    @Test
    void drainSucceedsImmediatelyWhenNothingWasEnqueued() {
        EventDispatcher d = newDispatcher(10);

        assertTrue(d.awaitDrained(Duration.ZERO));
    }

    @Test
    void drainFailsFastWhenStoppedWithPendingEvents() {
        EventDispatcher d = newDispatcher(10);
        d.enqueue(Event.of("a", null));

        assertFalse(d.awaitDrained(Duration.ofSeconds(5)));
    }

    @Test
    void drainTimesOutWhileHandlerBlocks() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        registry.registerEventHandler("block", BusSession.GLOBAL, event -> release.await());
        EventDispatcher d = newDispatcher(10);
        d.start();
        d.enqueue(Event.of("block", null));

        assertFalse(d.awaitDrained(Duration.ofMillis(100)));

        release.countDown();
        assertTrue(d.awaitDrained(Duration.ofSeconds(5)));
    }

    @Test
    void dispatchesInFifoOrder() {
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        registry.registerEventHandler("n", BusSession.GLOBAL, event -> order.add(event.payload(Integer.class)));
        EventDispatcher d = newDispatcher(100);
        for (int i = 0; i < 20; i++) {
            d.enqueue(Event.of("n", i));
        }

        d.start();

        assertTrue(d.awaitDrained(Duration.ofSeconds(5)));
        assertEquals(20, order.size());
        for (int i = 0; i < 20; i++) {
            assertEquals(i, order.get(i).intValue());
        }
    }

    @Test
    void observabilityHandlersRunBeforeFunctionalHandlers() {
        List<String> calls = Collections.synchronizedList(new ArrayList<>());
        registry.registerEventHandler("x", BusSession.GLOBAL, event -> calls.add("handler"));
        registry.registerObservabilityHandler(event -> calls.add("observer"));
        EventDispatcher d = newDispatcher(10);
        d.start();

        d.enqueue(Event.of("x", null));

        assertTrue(d.awaitDrained(Duration.ofSeconds(5)));
        assertEquals(List.of("observer", "handler"), calls);
    }

    @Test
    void failureEventIsPublishedAndIncludedInDrain() {
        AtomicInteger failures = new AtomicInteger();
        registry.registerEventHandler("x", BusSession.GLOBAL, event -> {
            throw new IllegalStateException("boom");
        });
        registry.registerEventHandler(BusEventType.EVENT_HANDLER_FAILED.name(), BusSession.GLOBAL,
                event -> failures.incrementAndGet());
        EventDispatcher d = newDispatcher(10);
        d.start();

        d.enqueue(Event.of("x", null));

        assertTrue(d.awaitDrained(Duration.ofSeconds(5)));
        assertEquals(1, failures.get());
        assertEquals(1, d.recordedErrors().size());
    }

    @Test
    void unhandledEventsGoToCallback() {
        List<Event> unhandled = Collections.synchronizedList(new ArrayList<>());
        registry.registerObservabilityHandler(event -> { });
        dispatcher = EventDispatcher.builder()
                .registry(registry)
                .invoker(invoker)
                .unhandledEventHandler(unhandled::add)
                .build();
        dispatcher.start();

        Event orphan = Event.of("orphan", null);
        dispatcher.enqueue(orphan);

        assertTrue(dispatcher.awaitDrained(Duration.ofSeconds(5)));
        assertEquals(List.of(orphan), unhandled);
    }

    @Test
    void observabilityErrorDoesNotSkipHandlers() {
        AtomicInteger delivered = new AtomicInteger();
        registry.registerObservabilityHandler(event -> {
            throw new AssertionError("tap broke");
        });
        registry.registerEventHandler("ping", BusSession.GLOBAL, event -> delivered.incrementAndGet());
        EventDispatcher d = newDispatcher(10);
        d.start();

        d.enqueue(Event.of("ping", null));

        assertTrue(d.awaitDrained(Duration.ofSeconds(5)));
        assertEquals(1, delivered.get());
    }

    @Test
    void unhandledCallbackErrorKeepsLoopAlive() {
        AtomicInteger delivered = new AtomicInteger();
        registry.registerEventHandler("ping", BusSession.GLOBAL, event -> delivered.incrementAndGet());
        dispatcher = EventDispatcher.builder()
                .registry(registry)
                .invoker(invoker)
                .unhandledEventHandler(event -> {
                    throw new AssertionError("callback broke");
                })
                .build();
        dispatcher.start();

        dispatcher.enqueue(Event.of("orphan", null));
        dispatcher.enqueue(Event.of("ping", null));

        assertTrue(dispatcher.awaitDrained(Duration.ofSeconds(5)));
        assertTrue(dispatcher.isRunning());
        assertEquals(1, delivered.get());
    }

    @Test
    void restartFromHandlerLeavesSingleLoop() throws Exception {
        EventDispatcher d = newDispatcher(100);
        AtomicReference<Thread> firstLoop = new AtomicReference<>();
        Set<Thread> laterLoops = ConcurrentHashMap.newKeySet();
        registry.registerEventHandler("restart", BusSession.GLOBAL, event -> {
            firstLoop.set(Thread.currentThread());
            d.stop();
            d.start();
        });
        registry.registerEventHandler("after", BusSession.GLOBAL, event -> laterLoops.add(Thread.currentThread()));
        d.start();

        d.enqueue(Event.of("restart", null));
        assertTrue(d.awaitDrained(Duration.ofSeconds(5)));
        firstLoop.get().join(1000);
        assertFalse(firstLoop.get().isAlive());

        for (int i = 0; i < 50; i++) {
            d.enqueue(Event.of("after", i));
        }
        assertTrue(d.awaitDrained(Duration.ofSeconds(5)));
        assertEquals(1, laterLoops.size());
        assertFalse(laterLoops.contains(firstLoop.get()));
    }

    @Test
    void stopFinishesInFlightEventAndKeepsQueue() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger completed = new AtomicInteger();
        registry.registerEventHandler("slow", BusSession.GLOBAL, event -> {
            entered.countDown();
            release.await();
            completed.incrementAndGet();
        });
        EventDispatcher d = newDispatcher(10);
        d.start();
        d.enqueue(Event.of("slow", 1));
        d.enqueue(Event.of("slow", 2));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        Thread stopper = new Thread(d::stop);
        stopper.start();
        while (d.isRunning()) {
            Thread.sleep(1);
        }
        release.countDown();
        stopper.join(5_000);

        assertFalse(d.isRunning());
        assertEquals(1, completed.get());
        assertEquals(1, d.pending(BusSession.GLOBAL).size());

        d.start();
        assertTrue(d.awaitDrained(Duration.ofSeconds(5)));
        assertEquals(2, completed.get());
    }

    @Test
    void clearDropsQueueAndReleasesDrain() {
        EventDispatcher d = newDispatcher(10);
        d.enqueue(Event.of("a", null));
        d.recordError(new IllegalStateException("old"));

        d.clear();

        assertEquals(0, d.queueSize());
        assertTrue(d.recordedErrors().isEmpty());
        assertTrue(d.awaitDrained(Duration.ZERO));
    }

    @Test
    void recordedErrorsEvictOldest() {
        dispatcher = EventDispatcher.builder()
                .registry(registry)
                .invoker(invoker)
                .maxRecordedErrors(2)
                .build();

        dispatcher.recordError(new IllegalStateException("1"));
        dispatcher.recordError(new IllegalStateException("2"));
        dispatcher.recordError(new IllegalStateException("3"));

        List<Throwable> errors = dispatcher.recordedErrors();
        assertEquals(2, errors.size());
        assertEquals("2", errors.get(0).getMessage());
        assertEquals("3", errors.get(1).getMessage());
    }
}

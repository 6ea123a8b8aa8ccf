package enginebus.registry;

import enginebus.BusSession;
import enginebus.CommandHandler;
import enginebus.DuplicateHandlerException;
import enginebus.EventHandler;
import enginebus.ObservabilityHandler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe handler registry.
 *
 * <p>Event handlers may be registered for a specific type or for every type with the
 * wildcard ({@value #ALL_EVENTS}). An event in session {@code s} is delivered, in this
 * order, to global handlers of its type, global wildcard handlers, handlers of its type
 * in {@code s}, and wildcard handlers in {@code s}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HandlerRegistry registry = new DefaultHandlerRegistry();
 * registry.registerEventHandler("TOOL_RESULT", "GLOBAL", event -> audit(event));
 * Registration r = registry.registerEventHandler("TOOL_RESULT", "s1", event -> push(event));
 * r.unregister();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Registrations can be made concurrently with lookups, and lookups return
 * consistent snapshots.
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {
  private static final Logger logger = Logger.getLogger(DefaultHandlerRegistry.class.getName());

  public static final String ALL_EVENTS = "*";

  private final Map<String, Map<String, CopyOnWriteArrayList<EventHandlerRegistration>>> eventHandlers =
      new ConcurrentHashMap<>();
  private final Map<String, Map<String, CommandHandler>> commandHandlers = new ConcurrentHashMap<>();
  private final CopyOnWriteArrayList<ObservabilityHandler> observabilityHandlers =
      new CopyOnWriteArrayList<>();

  @Override
  public Registration registerCommandHandler(String commandType, String scope, CommandHandler handler) {
    Objects.requireNonNull(commandType, "commandType");
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(handler, "handler");
    Map<String, CommandHandler> byType =
        commandHandlers.computeIfAbsent(scope, ignored -> new ConcurrentHashMap<>());
    if (byType.putIfAbsent(commandType, handler) != null) {
      throw new DuplicateHandlerException(commandType, scope);
    }
    logger.log(Level.FINE, "Registered command handler for {0} in {1}",
        new Object[]{commandType, scope});
    return () -> {
      Map<String, CommandHandler> current = commandHandlers.get(scope);
      return current != null && current.remove(commandType, handler);
    };
  }

  @Override
  public CommandHandler commandHandlerFor(String commandType, String sessionId) {
    if (!BusSession.GLOBAL.equals(sessionId)) {
      CommandHandler scoped = lookupCommand(commandType, sessionId);
      if (scoped != null) {
        return scoped;
      }
    }
    return lookupCommand(commandType, BusSession.GLOBAL);
  }

  private CommandHandler lookupCommand(String commandType, String scope) {
    Map<String, CommandHandler> byType = commandHandlers.get(scope);
    return byType == null ? null : byType.get(commandType);
  }

  @Override
  public Registration registerEventHandler(String eventType, String scope, EventHandler handler) {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(scope, "scope");
    CopyOnWriteArrayList<EventHandlerRegistration> list = eventHandlers
        .computeIfAbsent(scope, ignored -> new ConcurrentHashMap<>())
        .computeIfAbsent(eventType, ignored -> new CopyOnWriteArrayList<>());
    EventHandlerRegistration registration = new EventHandlerRegistration(eventType, scope, handler, list);
    list.add(registration);
    logger.log(Level.FINE, "Registered event handler for {0} in {1}", new Object[]{eventType, scope});
    return registration;
  }

  @Override
  public List<EventHandlerRegistration> eventHandlersFor(String eventType, String sessionId) {
    List<EventHandlerRegistration> result = new ArrayList<>();
    collect(result, BusSession.GLOBAL, eventType);
    if (!BusSession.GLOBAL.equals(sessionId)) {
      collect(result, sessionId, eventType);
    }
    return Collections.unmodifiableList(result);
  }

  private void collect(List<EventHandlerRegistration> result, String scope, String eventType) {
    Map<String, CopyOnWriteArrayList<EventHandlerRegistration>> byType = eventHandlers.get(scope);
    if (byType == null) {
      return;
    }
    CopyOnWriteArrayList<EventHandlerRegistration> specific = byType.get(eventType);
    if (specific != null) {
      result.addAll(specific);
    }
    if (!ALL_EVENTS.equals(eventType)) {
      CopyOnWriteArrayList<EventHandlerRegistration> all = byType.get(ALL_EVENTS);
      if (all != null) {
        result.addAll(all);
      }
    }
  }

  @Override
  public Registration registerObservabilityHandler(ObservabilityHandler handler) {
    Objects.requireNonNull(handler, "handler");
    observabilityHandlers.add(handler);
    return new Registration() {
      private boolean removed;

      @Override
      public synchronized boolean unregister() {
        if (removed) {
          return false;
        }
        removed = true;
        return observabilityHandlers.remove(handler);
      }
    };
  }

  @Override
  public List<ObservabilityHandler> observabilityHandlers() {
    return List.copyOf(observabilityHandlers);
  }

  @Override
  public boolean unregisterCommandHandler(String commandType, String scope) {
    Map<String, CommandHandler> byType = commandHandlers.get(scope);
    return byType != null && byType.remove(commandType) != null;
  }

  @Override
  public int unregisterEventHandlers(String eventType, String scope) {
    Map<String, CopyOnWriteArrayList<EventHandlerRegistration>> byType = eventHandlers.get(scope);
    if (byType == null) {
      return 0;
    }
    CopyOnWriteArrayList<EventHandlerRegistration> list = byType.get(eventType);
    if (list == null) {
      return 0;
    }
    int removed = list.size();
    list.clear();
    return removed;
  }

  @Override
  public int unregisterScope(String scope) {
    int removed = 0;
    Map<String, CommandHandler> commands = commandHandlers.remove(scope);
    if (commands != null) {
      removed += commands.size();
    }
    Map<String, CopyOnWriteArrayList<EventHandlerRegistration>> events = eventHandlers.remove(scope);
    if (events != null) {
      for (CopyOnWriteArrayList<EventHandlerRegistration> list : events.values()) {
        removed += list.size();
        list.clear();
      }
    }
    if (removed > 0) {
      logger.log(Level.FINE, "Removed {0} handlers from scope {1}", new Object[]{removed, scope});
    }
    return removed;
  }

  @Override
  public void clear() {
    for (Map<String, CopyOnWriteArrayList<EventHandlerRegistration>> byType : eventHandlers.values()) {
      byType.values().forEach(CopyOnWriteArrayList::clear);
    }
    eventHandlers.clear();
    commandHandlers.clear();
    observabilityHandlers.clear();
  }
}

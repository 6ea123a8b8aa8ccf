package enginebus.registry;

import enginebus.EventHandler;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One event handler registered for a type (or {@link DefaultHandlerRegistry#ALL_EVENTS})
 * in one scope. Identity-based: registering the same handler twice yields two
 * registrations and two invocations per event.
 */
public final class EventHandlerRegistration implements Registration {

  private final String eventType;
  private final String scope;
  private final EventHandler handler;
  private final CopyOnWriteArrayList<EventHandlerRegistration> owner;

  EventHandlerRegistration(String eventType, String scope, EventHandler handler,
      CopyOnWriteArrayList<EventHandlerRegistration> owner) {
    this.eventType = eventType;
    this.scope = scope;
    this.handler = Objects.requireNonNull(handler, "handler");
    this.owner = owner;
  }

  public String eventType() {
    return eventType;
  }

  public String scope() {
    return scope;
  }

  public EventHandler handler() {
    return handler;
  }

  /**
   * Returns a human-readable name of the handler, used in logs and failure events.
   *
   * @return handler class name, or the handler's own {@code toString} for named handlers
   */
  public String describe() {
    Class<?> type = handler.getClass();
    if (type.isSynthetic() || type.isAnonymousClass()) {
      return type.getName() + "@" + eventType + "/" + scope;
    }
    return handler.toString();
  }

  @Override
  public boolean unregister() {
    return owner.remove(this);
  }

  @Override
  public String toString() {
    return "EventHandlerRegistration{type=" + eventType + ", scope=" + scope + '}';
  }
}

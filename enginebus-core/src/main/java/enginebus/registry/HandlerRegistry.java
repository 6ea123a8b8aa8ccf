package enginebus.registry;

import enginebus.CommandHandler;
import enginebus.DuplicateHandlerException;
import enginebus.EventHandler;
import enginebus.ObservabilityHandler;

import java.util.List;

/**
 * Routing table of a bus: command handlers keyed by {@code (type, scope)}, event
 * handlers as ordered lists keyed by {@code (type, scope)}, and the observability taps.
 *
 * <p>Scopes are session ids; {@code "GLOBAL"} is the scope every session sees.
 * Implementations must allow registration from any thread while lookups run on the
 * dispatch loop.
 *
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * Registers the single command handler for a type in a scope.
   *
   * @throws DuplicateHandlerException if the scope already has a handler for the type
   */
  Registration registerCommandHandler(String commandType, String scope, CommandHandler handler);

  /**
   * Resolves the command handler for a session, falling back to the global scope.
   *
   * @param commandType the command type
   * @param sessionId the command's session id
   * @return the handler, or {@code null} if none is registered
   */
  CommandHandler commandHandlerFor(String commandType, String sessionId);

  Registration registerEventHandler(String eventType, String scope, EventHandler handler);

  /**
   * Returns the event handlers an event of the given type and session is delivered to:
   * global handlers first, then the session's, each in registration order.
   *
   * @param eventType the event type
   * @param sessionId the event's session id
   * @return an immutable snapshot, possibly empty
   */
  List<EventHandlerRegistration> eventHandlersFor(String eventType, String sessionId);

  Registration registerObservabilityHandler(ObservabilityHandler handler);

  List<ObservabilityHandler> observabilityHandlers();

  boolean unregisterCommandHandler(String commandType, String scope);

  /**
   * Removes all event handlers of a type in a scope.
   *
   * @return number of removed handlers
   */
  int unregisterEventHandlers(String eventType, String scope);

  /**
   * Removes every command and event handler registered in a scope.
   *
   * @return number of removed handlers
   */
  int unregisterScope(String scope);

  /** Removes every registration, observability handlers included. */
  void clear();
}

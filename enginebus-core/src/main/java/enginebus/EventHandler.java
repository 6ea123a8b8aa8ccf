package enginebus;

/**
 * Reacts to published events.
 *
 * <p>Any number of handlers may be registered for the same event type, in
 * {@link BusSession#GLOBAL} scope or in a session scope. Handlers run on the bus's
 * dispatch loop one at a time. A handler that throws does not stop the other handlers
 * for the same event; the failure is published as an
 * {@link BusEventType#EVENT_HANDLER_FAILED} event.
 *
 * <p>Handlers must treat the event as the only authoritative state for the invocation.
 *
 * @see MessageBus#registerEventHandler(MessageType, EventHandler)
 * @see ObservabilityHandler
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * Processes an event.
   *
   * @param event the event
   * @throws Exception if processing fails
   */
  void onEvent(Event event) throws Exception;
}

package enginebus;

/**
 * Event types the bus publishes on its own.
 *
 * <p>Lifecycle events flow through the same dispatch path as application events, so
 * observability handlers and functional handlers can subscribe to them like any other
 * type.
 *
 * @see BusEvents
 */
public enum BusEventType implements MessageType {
  /** Published before a command handler is invoked. Payload: {@link BusEvents.CommandStarted}. */
  COMMAND_STARTED,
  /** Published after every {@code execute}, successful or not. Payload: {@link BusEvents.CommandFinished}. */
  COMMAND_RESULT,
  /** Published when an event handler throws or times out. Payload: {@link BusEvents.HandlerFailed}. */
  EVENT_HANDLER_FAILED,
  /** Payload: {@link BusEvents.SessionStarted}. */
  SESSION_STARTED,
  /** Payload: {@link BusEvents.SessionEnded}. */
  SESSION_ENDED
}

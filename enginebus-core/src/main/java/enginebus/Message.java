package enginebus;

import java.time.Instant;
import java.util.Map;

/**
 * Common envelope of everything that travels over a {@link MessageBus}.
 *
 * <p>A message is either a {@link Command} (exactly one handler, returns a
 * {@link CommandResult}) or an {@link Event} (zero or more handlers, no reply).
 * Messages are immutable once built.
 */
public sealed interface Message permits Command, Event {

  /**
   * Unique identifier, a monotonic ULID unless set explicitly.
   *
   * @return the message id
   */
  String id();

  /**
   * Routing key, the {@link MessageType#name()} the message was built with.
   *
   * @return the type name
   */
  String type();

  /**
   * Session this message belongs to. Messages built without a session report
   * {@link BusSession#GLOBAL}.
   *
   * @return the session id, never null
   */
  String sessionId();

  Instant timestamp();

  /**
   * Open key-value metadata.
   *
   * @return an unmodifiable map, possibly empty
   */
  Map<String, Object> metadata();

  /**
   * Handler-specific payload.
   *
   * @return the payload, or {@code null}
   */
  Object payload();

  /**
   * Returns the payload cast to the requested type.
   *
   * @param type the expected payload class
   * @param <T> payload type
   * @return the payload, or {@code null} if there is none
   * @throws ClassCastException if the payload is of a different type
   */
  default <T> T payload(Class<T> type) {
    return type.cast(payload());
  }

  /**
   * Returns {@code true} if this message is not bound to a session.
   *
   * @return whether the session id is {@link BusSession#GLOBAL}
   */
  default boolean isGlobal() {
    return BusSession.GLOBAL.equals(sessionId());
  }
}

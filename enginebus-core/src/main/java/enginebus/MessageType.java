package enginebus;

/**
 * Stable identifier of a command or event type.
 *
 * <p>Handlers are keyed by {@link #name()}, resolved once when they are registered.
 * Implementations can be enums for compile-time safety:
 * <pre>{@code
 * public enum EngineEvents implements MessageType {
 *   CALLING_MODEL,
 *   EXECUTING_TOOL,
 *   FINISHED;
 *   // Enum.name() already satisfies the contract
 * }
 * }</pre>
 *
 * <p>Or use {@link StringMessageType} for types chosen at runtime:
 * <pre>{@code
 * MessageType type = StringMessageType.of("engine.turn");
 * }</pre>
 */
public interface MessageType {

  /**
   * Returns the routing key of this type.
   *
   * @return the type name, never null
   */
  default String name() {
    return this.getClass().getName();
  }
}

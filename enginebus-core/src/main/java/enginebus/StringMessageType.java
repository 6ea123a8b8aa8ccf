package enginebus;

import java.util.Objects;

/**
 * A string-based message type for dynamic scenarios.
 *
 * <pre>{@code
 * MessageType type = StringMessageType.of("tool.execute");
 * Command command = Command.of(type, Map.of("tool", "search"));
 * }</pre>
 */
public final class StringMessageType implements MessageType {

  private final String name;

  private StringMessageType(String name) {
    this.name = Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Message type name cannot be empty");
    }
  }

  /**
   * Creates a message type from a string.
   *
   * @param name the type name
   * @return the message type
   * @throws NullPointerException if name is null
   * @throws IllegalArgumentException if name is empty
   */
  public static StringMessageType of(String name) {
    return new StringMessageType(name);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof StringMessageType that)) return false;
    return name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}

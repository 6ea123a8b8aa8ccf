package enginebus;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable request addressed to exactly one {@link CommandHandler}.
 *
 * <p>Commands are executed with {@link MessageBus#execute(Command)}, which always
 * returns a {@link CommandResult}.
 *
 * <pre>{@code
 * Command turn = Command.builder(EngineCommands.RUN_TURN)
 *     .sessionId(session.id())
 *     .payload(new TurnRequest("summarize the thread"))
 *     .build();
 * CommandResult result = bus.execute(turn);
 * }</pre>
 *
 * @see Event
 * @see CommandResult
 */
public final class Command implements Message {

  private final String id;
  private final String type;
  private final String sessionId;
  private final Instant timestamp;
  private final Map<String, Object> metadata;
  private final Object payload;

  private Command(Builder builder) {
    this.id = builder.id == null ? MessageSupport.newId() : builder.id;
    this.type = MessageSupport.requireType(builder.type);
    this.sessionId = MessageSupport.normalizeSession(builder.sessionId);
    this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
    this.metadata = MessageSupport.copyMetadata(builder.metadata);
    this.payload = builder.payload;
  }

  private Command(Command source, String sessionId) {
    this.id = source.id;
    this.type = source.type;
    this.sessionId = MessageSupport.normalizeSession(sessionId);
    this.timestamp = source.timestamp;
    this.metadata = source.metadata;
    this.payload = source.payload;
  }

  /**
   * Creates a builder with a type-safe command type.
   *
   * @param type the command type
   * @return a new builder
   */
  public static Builder builder(MessageType type) {
    Objects.requireNonNull(type, "type");
    return new Builder(type.name());
  }

  /**
   * Creates a builder with a string command type.
   *
   * @param type the command type name
   * @return a new builder
   */
  public static Builder builder(String type) {
    return new Builder(type);
  }

  /**
   * Creates a global command carrying the given payload.
   *
   * @param type the command type
   * @param payload the payload, may be null
   * @return a new command
   */
  public static Command of(MessageType type, Object payload) {
    return builder(type).payload(payload).build();
  }

  public static Command of(String type, Object payload) {
    return builder(type).payload(payload).build();
  }

  /**
   * Returns a copy of this command bound to another session. Id, timestamp,
   * metadata and payload are preserved.
   *
   * @param sessionId the target session, or {@code null} for {@link BusSession#GLOBAL}
   * @return this command if already bound to that session, otherwise a copy
   */
  public Command withSessionId(String sessionId) {
    if (MessageSupport.normalizeSession(sessionId).equals(this.sessionId)) {
      return this;
    }
    return new Command(this, sessionId);
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public String type() {
    return type;
  }

  @Override
  public String sessionId() {
    return sessionId;
  }

  @Override
  public Instant timestamp() {
    return timestamp;
  }

  @Override
  public Map<String, Object> metadata() {
    return metadata;
  }

  @Override
  public Object payload() {
    return payload;
  }

  @Override
  public String toString() {
    return "Command{id=" + id + ", type=" + type + ", sessionId=" + sessionId + '}';
  }

  /** Builder for {@link Command}. */
  public static final class Builder {
    private final String type;
    private String id;
    private String sessionId;
    private Instant timestamp;
    private Map<String, ?> metadata;
    private Object payload;

    private Builder(String type) {
      this.type = type;
    }

    /**
     * Sets a custom command identifier.
     *
     * <p>Optional. Defaults to a monotonic ULID.
     *
     * @param id the command id
     * @return this builder
     */
    public Builder id(String id) {
      this.id = id;
      return this;
    }

    /**
     * Binds the command to a session.
     *
     * <p>Optional. Defaults to {@link BusSession#GLOBAL}.
     *
     * @param sessionId the session id
     * @return this builder
     */
    public Builder sessionId(String sessionId) {
      this.sessionId = sessionId;
      return this;
    }

    /**
     * Sets the command timestamp.
     *
     * <p>Optional. Defaults to {@link Instant#now()}.
     *
     * @param timestamp the timestamp
     * @return this builder
     */
    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    /**
     * Sets metadata. The map is copied at build time; null keys and values are rejected.
     *
     * @param metadata the metadata
     * @return this builder
     */
    public Builder metadata(Map<String, ?> metadata) {
      this.metadata = metadata;
      return this;
    }

    public Builder payload(Object payload) {
      this.payload = payload;
      return this;
    }

    /**
     * Builds an immutable {@link Command}.
     *
     * @return a new command
     * @throws NullPointerException if the type is null
     * @throws IllegalArgumentException if the type or session id is empty, or metadata
     *     contains null keys or values
     */
    public Command build() {
      return new Command(this);
    }
  }
}

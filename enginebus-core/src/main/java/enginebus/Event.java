package enginebus;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable notification broadcast to every matching {@link EventHandler}.
 *
 * <p>An event built with {@link Builder#scheduledAt(Instant)} or
 * {@link Builder#deliverAfter(Duration)} is a <em>scheduled event</em>: the bus holds
 * it until its scheduled time and releases scheduled events in chronological order.
 *
 * <pre>{@code
 * bus.publish(Event.builder(EngineEvents.EXECUTING_TOOL)
 *     .sessionId(sessionId)
 *     .payload(new ToolCall("search", args))
 *     .build());
 *
 * bus.publish(Event.builder("reminder")
 *     .deliverAfter(Duration.ofSeconds(30))
 *     .build());
 * }</pre>
 *
 * @see Command
 * @see MessageBus#publish(Event)
 */
public final class Event implements Message {

  private final String id;
  private final String type;
  private final String sessionId;
  private final Instant timestamp;
  private final Map<String, Object> metadata;
  private final Object payload;
  private final Instant scheduledAt;

  private Event(Builder builder) {
    this.id = builder.id == null ? MessageSupport.newId() : builder.id;
    this.type = MessageSupport.requireType(builder.type);
    this.sessionId = MessageSupport.normalizeSession(builder.sessionId);
    this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
    this.metadata = MessageSupport.copyMetadata(builder.metadata);
    this.payload = builder.payload;

    if (builder.scheduledAt != null && builder.deliverAfter != null) {
      throw new IllegalArgumentException("Set either scheduledAt or deliverAfter, not both");
    }
    if (builder.deliverAfter != null && (builder.deliverAfter.isZero() || builder.deliverAfter.isNegative())) {
      throw new IllegalArgumentException("deliverAfter must be positive");
    }
    if (builder.scheduledAt != null && builder.scheduledAt.isBefore(this.timestamp)) {
      throw new IllegalArgumentException("scheduledAt must not be before timestamp");
    }
    this.scheduledAt = builder.deliverAfter != null
        ? delayedFrom(this.timestamp, builder.deliverAfter)
        : builder.scheduledAt;
  }

  private static Instant delayedFrom(Instant timestamp, Duration deliverAfter) {
    try {
      return timestamp.plus(deliverAfter);
    } catch (DateTimeException | ArithmeticException e) {
      throw new IllegalArgumentException("deliverAfter " + deliverAfter + " is out of range", e);
    }
  }

  public static Builder builder(MessageType type) {
    Objects.requireNonNull(type, "type");
    return new Builder(type.name());
  }

  public static Builder builder(String type) {
    return new Builder(type);
  }

  /**
   * Creates a global, immediately delivered event.
   *
   * @param type the event type
   * @param payload the payload, may be null
   * @return a new event
   */
  public static Event of(MessageType type, Object payload) {
    return builder(type).payload(payload).build();
  }

  public static Event of(String type, Object payload) {
    return builder(type).payload(payload).build();
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

  /**
   * Returns the earliest time this event may be dispatched, or {@code null} for
   * immediate delivery.
   *
   * @return the scheduled time, or {@code null}
   */
  public Instant scheduledAt() {
    return scheduledAt;
  }

  /**
   * Returns {@code true} if this event goes through the scheduler.
   *
   * @return whether a scheduled time is set
   */
  public boolean isScheduled() {
    return scheduledAt != null;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Event{id=").append(id)
        .append(", type=").append(type)
        .append(", sessionId=").append(sessionId);
    if (scheduledAt != null) {
      sb.append(", scheduledAt=").append(scheduledAt);
    }
    return sb.append('}').toString();
  }

  /** Builder for {@link Event}. */
  public static final class Builder {
    private final String type;
    private String id;
    private String sessionId;
    private Instant timestamp;
    private Map<String, ?> metadata;
    private Object payload;
    private Instant scheduledAt;
    private Duration deliverAfter;

    private Builder(String type) {
      this.type = type;
    }

    /**
     * Sets a custom event identifier.
     *
     * <p>Optional. Defaults to a monotonic ULID.
     *
     * @param id the event id
     * @return this builder
     */
    public Builder id(String id) {
      this.id = id;
      return this;
    }

    /**
     * Binds the event to a session. The bus never stamps a session on its own.
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
     * Sets an absolute time before which the event is not dispatched.
     * Mutually exclusive with {@link #deliverAfter}.
     *
     * @param scheduledAt the earliest dispatch time, not before the timestamp
     * @return this builder
     */
    public Builder scheduledAt(Instant scheduledAt) {
      this.scheduledAt = Objects.requireNonNull(scheduledAt, "scheduledAt");
      return this;
    }

    /**
     * Sets a delay relative to the timestamp. Mutually exclusive with {@link #scheduledAt}.
     *
     * @param deliverAfter the delay (must be positive)
     * @return this builder
     */
    public Builder deliverAfter(Duration deliverAfter) {
      this.deliverAfter = Objects.requireNonNull(deliverAfter, "deliverAfter");
      return this;
    }

    /**
     * Builds an immutable {@link Event}.
     *
     * @return a new event
     * @throws IllegalArgumentException if the type or session id is empty, metadata
     *     contains nulls, both scheduling options are set, {@code deliverAfter} is not
     *     positive, or {@code scheduledAt} precedes the timestamp
     */
    public Event build() {
      return new Event(this);
    }
  }
}

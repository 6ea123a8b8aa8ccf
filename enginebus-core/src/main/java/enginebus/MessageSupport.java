package enginebus;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Validation and defaults shared by {@link Command} and {@link Event}. */
final class MessageSupport {

  private MessageSupport() {}

  static String newId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  static String requireType(String type) {
    Objects.requireNonNull(type, "type");
    if (type.isEmpty()) {
      throw new IllegalArgumentException("type cannot be empty");
    }
    return type;
  }

  static String normalizeSession(String sessionId) {
    if (sessionId == null) {
      return BusSession.GLOBAL;
    }
    if (sessionId.isEmpty()) {
      throw new IllegalArgumentException("sessionId cannot be empty");
    }
    return sessionId;
  }

  static Map<String, Object> copyMetadata(Map<String, ?> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : metadata.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("metadata cannot contain null keys");
      }
      if (entry.getValue() == null) {
        throw new IllegalArgumentException("metadata cannot contain null values");
      }
      copy.put(entry.getKey(), entry.getValue());
    }
    return Collections.unmodifiableMap(copy);
  }
}

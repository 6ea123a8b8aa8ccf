package enginebus;

import java.util.Objects;

/**
 * Payloads of the events listed in {@link BusEventType}, plus factories that wrap them
 * into {@link Event}s carrying the right session id.
 */
public final class BusEvents {

  private BusEvents() {}

  public record CommandStarted(Command command) {
    public CommandStarted {
      Objects.requireNonNull(command, "command");
    }
  }

  public record CommandFinished(Command command, CommandResult result) {
    public CommandFinished {
      Objects.requireNonNull(command, "command");
      Objects.requireNonNull(result, "result");
    }
  }

  /**
   * Failure of one event handler.
   *
   * @param event the event the handler was processing
   * @param handler description of the failed handler
   * @param error the exception it raised
   */
  public record HandlerFailed(Event event, String handler, Throwable error) {
    public HandlerFailed {
      Objects.requireNonNull(event, "event");
      Objects.requireNonNull(handler, "handler");
      Objects.requireNonNull(error, "error");
    }

    /**
     * Returns the error as {@code "<SimpleClassName>: <message>"}.
     *
     * @return the error description
     */
    public String errorMessage() {
      return CommandResult.describe(error);
    }
  }

  /**
   * @param sessionId the opened session
   * @param parentId id of the enclosing session, or {@code null} for a top-level session
   */
  public record SessionStarted(String sessionId, String parentId) {
    public SessionStarted {
      Objects.requireNonNull(sessionId, "sessionId");
    }
  }

  /**
   * @param sessionId the closed session
   * @param error failure description if the session ended with an error, else {@code null}
   */
  public record SessionEnded(String sessionId, String error) {
    public SessionEnded {
      Objects.requireNonNull(sessionId, "sessionId");
    }
  }

  static Event commandStarted(Command command) {
    return Event.builder(BusEventType.COMMAND_STARTED)
        .sessionId(command.sessionId())
        .payload(new CommandStarted(command))
        .build();
  }

  static Event commandResult(Command command, CommandResult result) {
    return Event.builder(BusEventType.COMMAND_RESULT)
        .sessionId(command.sessionId())
        .payload(new CommandFinished(command, result))
        .build();
  }

  /**
   * Wraps a handler failure into an {@link BusEventType#EVENT_HANDLER_FAILED} event in the
   * failed event's session.
   *
   * @param event the event being handled
   * @param handler handler description
   * @param error the failure
   * @return the failure event
   */
  public static Event handlerFailed(Event event, String handler, Throwable error) {
    return Event.builder(BusEventType.EVENT_HANDLER_FAILED)
        .sessionId(event.sessionId())
        .payload(new HandlerFailed(event, handler, error))
        .build();
  }

  static Event sessionStarted(String sessionId, String parentId) {
    return Event.builder(BusEventType.SESSION_STARTED)
        .sessionId(sessionId)
        .payload(new SessionStarted(sessionId, parentId))
        .build();
  }

  static Event sessionEnded(String sessionId, Throwable error) {
    return Event.builder(BusEventType.SESSION_ENDED)
        .sessionId(sessionId)
        .payload(new SessionEnded(sessionId, error == null ? null : CommandResult.describe(error)))
        .build();
  }
}

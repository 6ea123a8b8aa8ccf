package enginebus;

import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a {@link MessageBus#execute(Command)} call.
 *
 * <p>A successful result carries the handler's value (which may be {@code null} for
 * commands without a return value) and no error. A failed result carries an error
 * description and no value. Callers of {@code execute} always receive a result;
 * routing and handler errors are never thrown.
 */
public final class CommandResult {

  private final String commandId;
  private final boolean success;
  private final Object result;
  private final String error;
  private final Map<String, Object> metadata;

  private CommandResult(String commandId, boolean success, Object result, String error,
      Map<String, Object> metadata) {
    this.commandId = Objects.requireNonNull(commandId, "commandId");
    this.success = success;
    this.result = result;
    this.error = error;
    this.metadata = MessageSupport.copyMetadata(metadata);
  }

  /**
   * Creates a successful result for the given command.
   *
   * @param command the executed command
   * @param result the value, may be null
   * @return a successful result
   */
  public static CommandResult success(Command command, Object result) {
    Objects.requireNonNull(command, "command");
    return new CommandResult(command.id(), true, result, null, null);
  }

  public static CommandResult success(Command command, Object result, Map<String, Object> metadata) {
    Objects.requireNonNull(command, "command");
    return new CommandResult(command.id(), true, result, null, metadata);
  }

  /**
   * Creates a failed result for the given command.
   *
   * @param command the executed command
   * @param error the error description
   * @return a failed result
   * @throws NullPointerException if {@code error} is null
   */
  public static CommandResult failure(Command command, String error) {
    Objects.requireNonNull(command, "command");
    return failure(command.id(), error, null);
  }

  public static CommandResult failure(String commandId, String error, Map<String, Object> metadata) {
    Objects.requireNonNull(error, "error");
    return new CommandResult(commandId, false, null, error, metadata);
  }

  /**
   * Creates a failed result describing a thrown exception as
   * {@code "<SimpleClassName>: <message>"}, with {@code exceptionType} metadata.
   *
   * @param commandId id of the failed command
   * @param failure the exception raised while handling it
   * @return a failed result
   */
  public static CommandResult failure(String commandId, Throwable failure) {
    Objects.requireNonNull(failure, "failure");
    return failure(commandId, describe(failure),
        Map.of("exceptionType", failure.getClass().getName()));
  }

  static String describe(Throwable failure) {
    String message = failure.getMessage();
    String name = failure.getClass().getSimpleName();
    return message == null ? name : name + ": " + message;
  }

  public String commandId() {
    return commandId;
  }

  public boolean success() {
    return success;
  }

  /**
   * Returns the handler's value; always {@code null} for failed results.
   *
   * @return the result value, or {@code null}
   */
  public Object result() {
    return result;
  }

  public <T> T result(Class<T> type) {
    return type.cast(result);
  }

  /**
   * Returns the error description; {@code null} for successful results.
   *
   * @return the error, or {@code null}
   */
  public String error() {
    return error;
  }

  public Map<String, Object> metadata() {
    return metadata;
  }

  @Override
  public String toString() {
    return success
        ? "CommandResult{commandId=" + commandId + ", success=true}"
        : "CommandResult{commandId=" + commandId + ", success=false, error=" + error + '}';
  }
}

package enginebus;

/**
 * Configuration error: a command handler is already registered for the same
 * command type and scope. Thrown at registration time, never at dispatch time.
 */
public class DuplicateHandlerException extends IllegalStateException {

  private final String commandType;
  private final String scope;

  public DuplicateHandlerException(String commandType, String scope) {
    super("Command handler for " + commandType + " already registered in scope " + scope);
    this.commandType = commandType;
    this.scope = scope;
  }

  public String commandType() {
    return commandType;
  }

  public String scope() {
    return scope;
  }
}

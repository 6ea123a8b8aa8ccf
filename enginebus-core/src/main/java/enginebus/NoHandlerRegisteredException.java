package enginebus;

/**
 * Routing error: no handler is registered for a command type, neither in the
 * command's session nor in {@link BusSession#GLOBAL}.
 *
 * <p>{@link MessageBus#execute(Command)} never throws this exception; it is reported
 * through {@link CommandResult#error()}.
 */
public class NoHandlerRegisteredException extends RuntimeException {

  private final String commandType;

  public NoHandlerRegisteredException(String commandType) {
    super("No handler registered for command " + commandType);
    this.commandType = commandType;
  }

  public String commandType() {
    return commandType;
  }
}

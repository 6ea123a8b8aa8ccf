package enginebus;

/**
 * Handles exactly one command type.
 *
 * <p>At most one handler is registered per command type and scope; a second
 * registration is rejected with {@link DuplicateHandlerException}. Any exception
 * thrown here is converted by the bus into a failed {@link CommandResult}.
 *
 * <pre>{@code
 * bus.registerCommandHandler(EngineCommands.RUN_TURN, command -> {
 *   TurnRequest request = command.payload(TurnRequest.class);
 *   return CommandResult.success(command, engine.runTurn(request));
 * });
 * }</pre>
 *
 * @see MessageBus#registerCommandHandler(MessageType, CommandHandler)
 */
@FunctionalInterface
public interface CommandHandler {

  /**
   * Handles a command.
   *
   * @param command the command to handle
   * @return the result, never null
   * @throws Exception if handling fails; reported as a failed result
   */
  CommandResult handle(Command command) throws Exception;
}

package enginebus;

import enginebus.registry.Registration;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registration boundary for one session.
 *
 * <p>Handlers registered through a session only see events whose session id equals
 * {@link #id()}; {@link #GLOBAL} handlers see every event. Closing the session removes
 * exactly the registrations made through this handle, after closing any child sessions
 * still open, youngest first. Closing never touches the parent's registrations.
 *
 * <p>The bus never stamps a session id on events; producers set it explicitly.
 * {@link #execute(Command)} is the exception: it rebinds the command to this session.
 *
 * <pre>{@code
 * try (BusSession session = bus.createSession()) {
 *   session.registerEventHandler(EngineEvents.STATUS, event -> client.push(event));
 *   session.registerCommandHandler(EngineCommands.CONFIRM, confirmPrompt);
 *   CommandResult result = session.execute(Command.of(EngineCommands.RUN_TURN, request));
 * }
 * }</pre>
 *
 * @see MessageBus#createSession()
 */
public final class BusSession implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BusSession.class.getName());

  /** Scope of handlers that receive events of every session. */
  public static final String GLOBAL = "GLOBAL";

  private final MessageBus bus;
  private final String id;
  private final BusSession parent;

  private final List<Registration> registrations = new ArrayList<>();
  private final List<BusSession> children = new ArrayList<>();
  private boolean closed;

  BusSession(MessageBus bus, String id, BusSession parent) {
    this.bus = Objects.requireNonNull(bus, "bus");
    Objects.requireNonNull(id, "id");
    if (id.isEmpty()) {
      throw new IllegalArgumentException("session id cannot be empty");
    }
    if (GLOBAL.equals(id)) {
      throw new IllegalArgumentException("session id cannot be " + GLOBAL);
    }
    this.id = id;
    this.parent = parent;
  }

  public String id() {
    return id;
  }

  /**
   * Returns the session this one was created from.
   *
   * @return the parent, or {@code null} for a top-level session
   */
  public BusSession parent() {
    return parent;
  }

  public MessageBus bus() {
    return bus;
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  public Registration registerEventHandler(MessageType eventType, EventHandler handler) {
    Objects.requireNonNull(eventType, "eventType");
    return registerEventHandler(eventType.name(), handler);
  }

  public Registration registerEventHandler(String eventType, EventHandler handler) {
    return track(() -> bus.registerEventHandler(eventType, handler, id));
  }

  /**
   * Registers a handler for every event type of this session.
   *
   * @param handler the handler
   * @return the registration
   */
  public Registration registerAllEventsHandler(EventHandler handler) {
    return track(() -> bus.registerAllEventsHandler(handler, id));
  }

  public Registration registerCommandHandler(MessageType commandType, CommandHandler handler) {
    Objects.requireNonNull(commandType, "commandType");
    return registerCommandHandler(commandType.name(), handler);
  }

  /**
   * Registers a command handler that takes precedence over the global one for commands
   * of this session.
   *
   * @param commandType the command type
   * @param handler the handler
   * @return the registration
   * @throws DuplicateHandlerException if this session already has a handler for the type
   */
  public Registration registerCommandHandler(String commandType, CommandHandler handler) {
    return track(() -> bus.registerCommandHandler(commandType, handler, id));
  }

  /**
   * Executes a command in this session. Same as
   * {@code bus.execute(command.withSessionId(id()))}.
   *
   * @param command the command
   * @return the result
   */
  public CommandResult execute(Command command) {
    Objects.requireNonNull(command, "command");
    return bus.execute(command.withSessionId(id));
  }

  /**
   * Returns this session's events that are queued or scheduled but not yet dispatched.
   *
   * @return a snapshot
   */
  public List<Event> pendingEvents() {
    return bus.pendingEvents(id);
  }

  /**
   * Opens a child session with a generated id.
   *
   * @return the child session
   */
  public BusSession createSession() {
    return createSession(MessageSupport.newId());
  }

  /**
   * Opens a child session. The child's registrations are independent of this session's;
   * closing this session closes the child first.
   *
   * @param childId the child session id
   * @return the child session
   */
  public BusSession createSession(String childId) {
    synchronized (this) {
      ensureOpen();
    }
    BusSession child = bus.openSession(childId, this);
    synchronized (this) {
      children.add(child);
    }
    return child;
  }

  private Registration track(RegistrationAction action) {
    synchronized (this) {
      ensureOpen();
      Registration registration = action.register();
      registrations.add(registration);
      return registration;
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Session " + id + " has been closed");
    }
  }

  @Override
  public void close() {
    close(null);
  }

  /**
   * Closes the session, recording why it ended on the
   * {@link BusEventType#SESSION_ENDED} event.
   *
   * @param error the failure that ended the session, or {@code null}
   */
  public void close(Throwable error) {
    List<BusSession> openChildren;
    List<Registration> owned;
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      openChildren = new ArrayList<>(children);
      owned = new ArrayList<>(registrations);
      children.clear();
      registrations.clear();
    }
    for (int i = openChildren.size() - 1; i >= 0; i--) {
      openChildren.get(i).close();
    }
    int removed = 0;
    for (int i = owned.size() - 1; i >= 0; i--) {
      if (owned.get(i).unregister()) {
        removed++;
      }
    }
    if (parent != null) {
      parent.childClosed(this);
    }
    logger.log(Level.FINE, "Closed session {0}, removed {1} handlers", new Object[]{id, removed});
    bus.publishInternal(BusEvents.sessionEnded(id, error));
  }

  private synchronized void childClosed(BusSession child) {
    children.remove(child);
  }

  @Override
  public String toString() {
    return parent == null
        ? "BusSession{id=" + id + '}'
        : "BusSession{id=" + id + ", parent=" + parent.id + '}';
  }

  @FunctionalInterface
  private interface RegistrationAction {
    Registration register();
  }
}

package enginebus;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Callback for events that matched no functional handler in their scope.
 * Observability handlers do not count as functional handlers.
 *
 * @see MessageBus.Builder#unhandledEventHandler(UnhandledEventHandler)
 */
@FunctionalInterface
public interface UnhandledEventHandler {

  /** Default callback: logs the event at {@code FINE}. */
  UnhandledEventHandler LOGGING = new UnhandledEventHandler() {
    private final Logger logger = Logger.getLogger(UnhandledEventHandler.class.getName());

    @Override
    public void onUnhandled(Event event) {
      logger.log(Level.FINE, "No handler for event {0} in session {1}",
          new Object[]{event.type(), event.sessionId()});
    }
  };

  void onUnhandled(Event event);
}

package enginebus;

/**
 * Tap that receives every dispatched event, including bus lifecycle events,
 * regardless of session scope.
 *
 * <p>Observability handlers run before functional handlers. Their failures are
 * logged and counted but never published as events and never block delivery.
 *
 * <pre>{@code
 * bus.registerObservabilityHandler(event ->
 *     audit.append(event.type(), event.sessionId(), event.timestamp()));
 * }</pre>
 */
@FunctionalInterface
public interface ObservabilityHandler {

  void observe(Event event);
}

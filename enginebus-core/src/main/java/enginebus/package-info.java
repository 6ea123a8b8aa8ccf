/**
 * In-process message bus for engine components.
 *
 * <p>{@link enginebus.MessageBus} is the entry point: commands go to exactly one
 * {@link enginebus.CommandHandler} through {@code execute}, events fan out to any number of
 * {@link enginebus.EventHandler}s through {@code publish}. {@link enginebus.BusSession}
 * scopes handler registrations to one session, and {@link enginebus.BusEventType} lists the
 * lifecycle events the bus publishes on its own.
 *
 * @see enginebus.MessageBus
 * @see enginebus.BusSession
 * @see enginebus.Command
 * @see enginebus.Event
 */
package enginebus;

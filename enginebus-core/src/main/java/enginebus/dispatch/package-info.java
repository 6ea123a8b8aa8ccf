/**
 * The dispatch loop.
 *
 * <p>{@link enginebus.dispatch.EventDispatcher} drains a bounded FIFO queue on a single
 * daemon thread, fans each event out to observability and functional handlers, turns
 * handler failures into failure events, and offers a sequence-based drain barrier.
 * {@link enginebus.dispatch.HandlerInvoker} bounds each handler invocation by a timeout.
 *
 * @see enginebus.dispatch.EventDispatcher
 * @see enginebus.dispatch.HandlerInvoker
 * @see enginebus.dispatch.QueuedEvent
 */
package enginebus.dispatch;

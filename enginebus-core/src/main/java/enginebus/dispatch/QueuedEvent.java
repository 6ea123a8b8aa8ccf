package enginebus.dispatch;

import enginebus.Event;

/**
 * Internal wrapper pairing an {@link Event} with the sequence number it was enqueued
 * under. {@link EventDispatcher} uses the sequence for its drain barrier.
 */
public record QueuedEvent(Event event, long sequence) {
}

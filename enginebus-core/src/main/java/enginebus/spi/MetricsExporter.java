package enginebus.spi;

/**
 * Observability hook for exporting bus counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems. Implementations
 * are called from producer threads and from the dispatch loop and must be thread-safe.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events accepted into the immediate queue by {@code publish}.
     */
    void incrementPublished();

    /**
     * Increments the count of events accepted by the scheduler.
     */
    void incrementScheduled();

    /**
     * Increments the count of events rejected because the immediate queue was full.
     */
    void incrementRejected();

    /**
     * Increments the count of events taken off the queue and dispatched to their handlers.
     */
    void incrementDispatched();

    /**
     * Increments the count of event handler invocations that threw or timed out.
     */
    void incrementHandlerFailure();

    /**
     * Increments the count of observability handler invocations that threw.
     */
    default void incrementObservabilityFailure() {
    }

    void incrementCommandSuccess();

    void incrementCommandFailure();

    /**
     * Records the current depth of both queues.
     *
     * @param immediateDepth number of events waiting for dispatch
     * @param scheduledDepth number of events waiting for their scheduled time
     */
    void recordQueueDepths(int immediateDepth, int scheduledDepth);

    /**
     * Records the time spent in one event handler invocation.
     *
     * @param durationMs execution time in milliseconds (always non-negative)
     */
    default void recordHandlerDurationMs(long durationMs) {
    }

    /**
     * Records the time spent in one command handler invocation.
     *
     * @param durationMs execution time in milliseconds (always non-negative)
     */
    default void recordCommandDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementPublished() {
        }

        @Override
        public void incrementScheduled() {
        }

        @Override
        public void incrementRejected() {
        }

        @Override
        public void incrementDispatched() {
        }

        @Override
        public void incrementHandlerFailure() {
        }

        @Override
        public void incrementCommandSuccess() {
        }

        @Override
        public void incrementCommandFailure() {
        }

        @Override
        public void recordQueueDepths(int immediateDepth, int scheduledDepth) {
        }
    }
}

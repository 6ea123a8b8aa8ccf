package enginebus.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the message bus.
 *
 * @see EngineBusAutoConfiguration
 */
@ConfigurationProperties(prefix = "enginebus")
public class EngineBusProperties {

    /**
     * Whether to start the dispatch loop once all handler beans are registered.
     */
    private boolean autoStart = true;

    private final Dispatcher dispatcher = new Dispatcher();
    private final Scheduler scheduler = new Scheduler();
    private final Metrics metrics = new Metrics();

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Dispatcher {

        /**
         * Maximum number of events waiting for dispatch.
         */
        private int queueCapacity = 10_000;

        /**
         * Per-invocation limit for command and event handlers. Zero disables it.
         */
        private Duration handlerTimeout = Duration.ofSeconds(30);

        /**
         * Default wait of {@code ensureEventsProcessed()} and of the drain on shutdown.
         */
        private Duration drainTimeout = Duration.ofSeconds(10);

        /**
         * Number of handler failures kept for inspection.
         */
        private int maxRecordedErrors = 100;

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public Duration getHandlerTimeout() {
            return handlerTimeout;
        }

        public void setHandlerTimeout(Duration handlerTimeout) {
            this.handlerTimeout = handlerTimeout;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }

        public int getMaxRecordedErrors() {
            return maxRecordedErrors;
        }

        public void setMaxRecordedErrors(int maxRecordedErrors) {
            this.maxRecordedErrors = maxRecordedErrors;
        }
    }

    public static class Scheduler {

        /**
         * How often due scheduled events are moved to the dispatch queue.
         */
        private Duration tick = Duration.ofMillis(10);

        public Duration getTick() {
            return tick;
        }

        public void setTick(Duration tick) {
            this.tick = tick;
        }
    }

    public static class Metrics {

        /**
         * Whether to export bus metrics through Micrometer.
         */
        private boolean enabled = true;

        /**
         * Prefix of every meter name.
         */
        private String namePrefix = "enginebus";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}

package enginebus.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the bus's daemon threads, named {@code enginebus-<component>-<n>}.
 *
 * <p>Daemon threads keep a bus that is never closed from blocking JVM shutdown.
 * An exception escaping a bus thread is logged at {@code SEVERE} with the thread name.
 */
public final class BusThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(BusThreadFactory.class.getName());

    private static final String PREFIX = "enginebus-";

    private final String namePrefix;
    private final AtomicInteger counter = new AtomicInteger(1);

    private BusThreadFactory(String component) {
        this.namePrefix = PREFIX + component + '-';
    }

    /**
     * @param component short component name, e.g. {@code "dispatcher"}
     * @return a factory for that component's threads
     */
    public static BusThreadFactory forComponent(String component) {
        Objects.requireNonNull(component, "component");
        if (component.isBlank()) {
            throw new IllegalArgumentException("component cannot be blank");
        }
        return new BusThreadFactory(component);
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, namePrefix + counter.getAndIncrement());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(BusThreadFactory::logUncaught);
        return thread;
    }

    private static void logUncaught(Thread thread, Throwable error) {
        logger.log(Level.SEVERE, "Uncaught exception on bus thread " + thread.getName(), error);
    }
}

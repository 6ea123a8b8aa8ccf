package enginebus.dispatch;

import enginebus.HandlerTimeoutException;
import enginebus.util.BusThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs handler invocations, optionally bounded by a timeout.
 *
 * <p>With {@link Duration#ZERO} the handler runs on the calling thread. Otherwise it runs
 * on a cached pool of daemon threads while the caller waits up to the timeout; on expiry
 * the handler thread is interrupted and {@link HandlerTimeoutException} is thrown.
 *
 * <p>Whether the caller is on the dispatch loop is carried over to the pool thread, so a
 * handler cannot wait on the loop that is waiting on it.
 */
public final class HandlerInvoker implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(HandlerInvoker.class.getName());

  private static final ThreadLocal<Boolean> DISPATCH_CONTEXT = ThreadLocal.withInitial(() -> Boolean.FALSE);

  private final Duration timeout;
  private final ExecutorService pool;

  public HandlerInvoker(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be >= 0");
    }
    this.timeout = timeout;
    this.pool = timeout.isZero()
        ? null
        : Executors.newCachedThreadPool(BusThreadFactory.forComponent("handler"));
  }

  /**
   * Returns {@code true} if the current thread is running an event handler, or is the
   * dispatch loop itself.
   *
   * @return whether the caller is in dispatch context
   */
  public static boolean inDispatchContext() {
    return DISPATCH_CONTEXT.get();
  }

  static void enterDispatchContext() {
    DISPATCH_CONTEXT.set(Boolean.TRUE);
  }

  static void exitDispatchContext() {
    DISPATCH_CONTEXT.remove();
  }

  public Duration timeout() {
    return timeout;
  }

  /**
   * Invokes a handler.
   *
   * @param handlerName name used in timeout messages
   * @param call the invocation
   * @param <T> result type
   * @return the handler's result
   * @throws HandlerTimeoutException if the timeout expires first
   * @throws Exception whatever the handler throws
   */
  public <T> T invoke(String handlerName, Callable<T> call) throws Exception {
    if (pool == null) {
      return call.call();
    }
    boolean dispatching = inDispatchContext();
    Future<T> future;
    try {
      future = pool.submit(() -> {
        if (dispatching) {
          enterDispatchContext();
        }
        try {
          return call.call();
        } finally {
          exitDispatchContext();
        }
      });
    } catch (RejectedExecutionException e) {
      throw new IllegalStateException("Handler pool is shut down", e);
    }
    try {
      return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      logger.log(Level.WARNING, "Handler {0} timed out after {1}", new Object[]{handlerName, timeout});
      throw new HandlerTimeoutException(handlerName, timeout);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception ex) {
        throw ex;
      }
      if (cause instanceof Error err) {
        throw err;
      }
      throw e;
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw e;
    }
  }

  /** Interrupts running handlers and releases the pool threads. */
  @Override
  public void close() {
    if (pool == null) {
      return;
    }
    pool.shutdownNow();
    try {
      if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.warning("Handler pool did not terminate within 5s");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}

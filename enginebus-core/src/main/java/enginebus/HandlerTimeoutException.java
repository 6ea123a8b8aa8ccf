package enginebus;

import java.time.Duration;

/**
 * Raised when a command or event handler does not complete within the bus's
 * configured handler timeout. The handler thread is interrupted.
 *
 * @see MessageBus.Builder#handlerTimeout(Duration)
 */
public class HandlerTimeoutException extends RuntimeException {

  private final Duration timeout;

  public HandlerTimeoutException(String handler, Duration timeout) {
    super("Handler " + handler + " timed out after " + timeout);
    this.timeout = timeout;
  }

  public Duration timeout() {
    return timeout;
  }
}

package enginebus.registry;

/**
 * Handle to one handler registration. Closing the handle removes exactly that
 * registration; other registrations of the same handler or type are untouched.
 *
 * <p>{@link #unregister()} is idempotent.
 */
public interface Registration extends AutoCloseable {

  /**
   * Removes the registration.
   *
   * @return {@code true} if this call removed it, {@code false} if it was already gone
   */
  boolean unregister();

  @Override
  default void close() {
    unregister();
  }
}

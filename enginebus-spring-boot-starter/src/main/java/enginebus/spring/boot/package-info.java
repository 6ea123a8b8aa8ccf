/**
 * Spring Boot auto-configuration for the message bus.
 *
 * <p>Bind settings under {@code enginebus.*}, annotate handler beans with
 * {@link enginebus.spring.boot.BusEventListener} or
 * {@link enginebus.spring.boot.BusCommandHandler}, and inject the
 * {@link enginebus.MessageBus}.
 */
package enginebus.spring.boot;

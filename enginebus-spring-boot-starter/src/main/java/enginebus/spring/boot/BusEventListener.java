package enginebus.spring.boot;

import enginebus.BusSession;
import enginebus.MessageType;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a bus event handler.
 *
 * <p>The annotated bean must implement {@link enginebus.EventHandler}.
 *
 * <h2>String-based registration</h2>
 * <pre>{@code
 * @Component
 * @BusEventListener(eventType = "ToolCallFinished")
 * public class ToolAuditHandler implements EventHandler {
 *   public void onEvent(Event event) { ... }
 * }
 * }</pre>
 *
 * <h2>Type-safe class-based registration</h2>
 * <pre>{@code
 * @Component
 * @BusEventListener(eventTypeClass = EngineEvents.class, eventType = "STATUS")
 * public class StatusForwarder implements EventHandler { ... }
 * }</pre>
 *
 * <p>Resolution rules:
 * <ul>
 *   <li>{@code eventTypeClass} takes precedence; for an enum, {@code eventType} names the
 *       constant and may be omitted only when the enum has exactly one constant</li>
 *   <li>A non-enum {@code eventTypeClass} must have a no-arg constructor</li>
 *   <li>{@code eventType = "*"} subscribes to every event type</li>
 *   <li>Scope defaults to {@link BusSession#GLOBAL}</li>
 * </ul>
 *
 * @see BusHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface BusEventListener {

    /**
     * Event type name, or the constant name when {@link #eventTypeClass()} is an enum.
     */
    String eventType() default "";

    /**
     * Event type class (type-safe). Takes precedence over a plain {@link #eventType()}.
     */
    Class<? extends MessageType> eventTypeClass() default MessageType.class;

    /**
     * Session whose events the handler receives.
     */
    String sessionId() default BusSession.GLOBAL;
}

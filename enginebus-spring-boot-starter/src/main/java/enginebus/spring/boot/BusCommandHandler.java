package enginebus.spring.boot;

import enginebus.MessageType;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the global handler of one command type.
 *
 * <p>The annotated bean must implement {@link enginebus.CommandHandler}. Type resolution
 * follows the same rules as {@link BusEventListener}. Two beans for the same command type
 * fail the context.
 *
 * <pre>{@code
 * @Component
 * @BusCommandHandler(commandType = "RunTurn")
 * public class RunTurnHandler implements CommandHandler {
 *   public CommandResult handle(Command command) { ... }
 * }
 * }</pre>
 *
 * @see BusHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface BusCommandHandler {

    /**
     * Command type name, or the constant name when {@link #commandTypeClass()} is an enum.
     */
    String commandType() default "";

    /**
     * Command type class (type-safe). Takes precedence over a plain {@link #commandType()}.
     */
    Class<? extends MessageType> commandTypeClass() default MessageType.class;
}

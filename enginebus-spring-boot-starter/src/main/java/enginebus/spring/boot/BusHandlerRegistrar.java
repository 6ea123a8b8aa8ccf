package enginebus.spring.boot;

import enginebus.CommandHandler;
import enginebus.DuplicateHandlerException;
import enginebus.EventHandler;
import enginebus.MessageBus;
import enginebus.MessageType;
import enginebus.registry.DefaultHandlerRegistry;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.lang.annotation.Annotation;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link BusEventListener} or {@link BusCommandHandler} and
 * registers them on the {@link MessageBus}, then starts the bus when auto-start is on.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * so no event is dispatched before every annotated handler is in place.
 */
public class BusHandlerRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(BusHandlerRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final MessageBus bus;
    private final boolean autoStart;

    public BusHandlerRegistrar(ListableBeanFactory beanFactory, MessageBus bus, boolean autoStart) {
        this.beanFactory = beanFactory;
        this.bus = bus;
        this.autoStart = autoStart;
    }

    @Override
    public void afterSingletonsInstantiated() {
        registerEventListeners();
        registerCommandHandlers();
        if (autoStart && !bus.isRunning()) {
            bus.start();
        }
    }

    private void registerEventListeners() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(BusEventListener.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof EventHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @BusEventListener must implement EventHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }
            BusEventListener annotation = findAnnotation(beanName, bean, BusEventListener.class);
            String eventType = resolveType(beanName, "@BusEventListener",
                    annotation.eventTypeClass(), annotation.eventType());

            try {
                if (DefaultHandlerRegistry.ALL_EVENTS.equals(eventType)) {
                    bus.registerAllEventsHandler(handler, annotation.sessionId());
                } else {
                    bus.registerEventHandler(eventType, handler, annotation.sessionId());
                }
            } catch (IllegalArgumentException e) {
                throw new BeanCreationException(beanName, "Invalid @BusEventListener: " + e.getMessage(), e);
            }
            logger.log(Level.FINE, "Registered event handler bean {0} for {1}",
                    new Object[]{beanName, eventType});
        }
    }

    private void registerCommandHandlers() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(BusCommandHandler.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof CommandHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @BusCommandHandler must implement CommandHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }
            BusCommandHandler annotation = findAnnotation(beanName, bean, BusCommandHandler.class);
            String commandType = resolveType(beanName, "@BusCommandHandler",
                    annotation.commandTypeClass(), annotation.commandType());

            try {
                bus.registerCommandHandler(commandType, handler);
            } catch (DuplicateHandlerException e) {
                throw new BeanCreationException(beanName,
                        "Another bean already handles command type " + commandType, e);
            } catch (IllegalArgumentException e) {
                throw new BeanCreationException(beanName, "Invalid @BusCommandHandler: " + e.getMessage(), e);
            }
            logger.log(Level.FINE, "Registered command handler bean {0} for {1}",
                    new Object[]{beanName, commandType});
        }
    }

    private static <A extends Annotation> A findAnnotation(String beanName, Object bean, Class<A> type) {
        // Proxies hide the annotation on the generated class
        A annotation = AnnotationUtils.findAnnotation(bean.getClass(), type);
        if (annotation == null) {
            throw new BeanCreationException(beanName,
                    "Could not find @" + type.getSimpleName() + " annotation on " + bean.getClass().getName());
        }
        return annotation;
    }

    private static String resolveType(String beanName, String annotationName,
            Class<? extends MessageType> typeClass, String typeName) {
        if (typeClass != MessageType.class) {
            return instantiateAndGetName(beanName, annotationName, typeClass, typeName);
        }
        if (typeName.isEmpty()) {
            throw new BeanCreationException(beanName,
                    annotationName + " must specify a type name or a type class");
        }
        return typeName;
    }

    private static String instantiateAndGetName(String beanName, String annotationName,
            Class<? extends MessageType> clazz, String constantName) {
        if (clazz.isEnum()) {
            MessageType[] constants = clazz.getEnumConstants();
            if (constantName.isEmpty()) {
                if (constants.length != 1) {
                    throw new BeanCreationException(beanName,
                            annotationName + " enum " + clazz.getName()
                                    + " has " + constants.length + " constants; name one of them");
                }
                return constants[0].name();
            }
            for (MessageType constant : constants) {
                if (constant.name().equals(constantName)) {
                    return constant.name();
                }
            }
            throw new BeanCreationException(beanName,
                    annotationName + " enum " + clazz.getName() + " has no constant " + constantName);
        }
        try {
            return clazz.getDeclaredConstructor().newInstance().name();
        } catch (ReflectiveOperationException e) {
            throw new BeanCreationException(beanName,
                    "Failed to instantiate " + annotationName + " type class: " + clazz.getName(), e);
        }
    }
}

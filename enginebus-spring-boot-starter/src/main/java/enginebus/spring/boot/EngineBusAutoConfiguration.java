package enginebus.spring.boot;

import enginebus.MessageBus;
import enginebus.ObservabilityHandler;
import enginebus.UnhandledEventHandler;
import enginebus.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the message bus.
 *
 * <p>Builds a {@link MessageBus} from {@link EngineBusProperties}, attaches every
 * {@link ObservabilityHandler} bean, and registers beans annotated with
 * {@link BusEventListener} or {@link BusCommandHandler}.
 *
 * @see EngineBusProperties
 * @see EngineBusMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(MessageBus.class)
@EnableConfigurationProperties(EngineBusProperties.class)
public class EngineBusAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public MessageBus messageBus(EngineBusProperties props,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<UnhandledEventHandler> unhandledProvider,
      ObjectProvider<ObservabilityHandler> observabilityProvider) {
    var dispatcher = props.getDispatcher();
    var builder = MessageBus.builder()
        .queueCapacity(dispatcher.getQueueCapacity())
        .handlerTimeout(dispatcher.getHandlerTimeout())
        .drainTimeout(dispatcher.getDrainTimeout())
        .maxRecordedErrors(dispatcher.getMaxRecordedErrors())
        .schedulerTick(props.getScheduler().getTick());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    UnhandledEventHandler unhandled = unhandledProvider.getIfAvailable();
    if (unhandled != null) {
      builder.unhandledEventHandler(unhandled);
    }
    MessageBus bus = builder.build();
    observabilityProvider.orderedStream().forEach(bus::registerObservabilityHandler);
    return bus;
  }

  @Bean
  @ConditionalOnMissingBean
  public BusHandlerRegistrar busHandlerRegistrar(ListableBeanFactory beanFactory,
      MessageBus messageBus, EngineBusProperties props) {
    return new BusHandlerRegistrar(beanFactory, messageBus, props.isAutoStart());
  }
}

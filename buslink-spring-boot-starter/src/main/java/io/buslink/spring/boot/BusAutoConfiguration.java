package io.buslink.spring.boot;

import io.buslink.BusClient;
import io.buslink.BusConfig;
import io.buslink.api.Api;
import io.buslink.api.ApiRegistry;
import io.buslink.plugin.BusPlugin;
import io.buslink.schema.Schema;
import io.buslink.schema.SchemaValidator;
import io.buslink.spi.MetricsExporter;
import io.buslink.transport.EventTransport;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the bus client.
 *
 * <p>Wires up a {@link BusClient} from the application's {@link EventTransport} bean,
 * every {@link Api} bean and {@link BusProperties}. The client is opened on startup and
 * closed on shutdown. Optional {@link BusPlugin}, {@link Schema}, {@link SchemaValidator}
 * and {@link MetricsExporter} beans are picked up when present.
 *
 * <p>The client opens and closes the transport itself, so declare the transport bean with
 * {@code @Bean(destroyMethod = "")}.
 *
 * @see BusProperties
 * @see BusListener
 * @see BusMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(BusClient.class)
@ConditionalOnBean(EventTransport.class)
@EnableConfigurationProperties(BusProperties.class)
public class BusAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public BusConfig busConfig(BusProperties props) {
    return props.toBusConfig();
  }

  @Bean
  @ConditionalOnMissingBean
  public ApiRegistry apiRegistry(ObjectProvider<Api> apis) {
    ApiRegistry registry = new ApiRegistry();
    apis.orderedStream().forEach(registry::add);
    return registry;
  }

  @Bean(initMethod = "open", destroyMethod = "close")
  @ConditionalOnMissingBean
  public BusClient busClient(EventTransport transport,
      ApiRegistry apiRegistry,
      BusConfig busConfig,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<BusPlugin> pluginProvider,
      ObjectProvider<Schema> schemaProvider,
      ObjectProvider<SchemaValidator> validatorProvider) {

    BusClient.Builder builder = BusClient.builder()
        .transport(transport)
        .apis(apiRegistry)
        .config(busConfig)
        .schema(schemaProvider.getIfAvailable())
        .validator(validatorProvider.getIfAvailable());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    pluginProvider.orderedStream().forEach(builder::plugin);
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public BusListenerRegistrar busListenerRegistrar(ListableBeanFactory beanFactory, BusClient busClient) {
    return new BusListenerRegistrar(beanFactory, busClient);
  }
}

package io.wrabber.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.wrabber.Wrabber;
import io.wrabber.WrabberSettings;
import io.wrabber.broker.BrokerConnector;
import io.wrabber.broker.rabbit.RabbitBrokerConnector;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Exposes a started-on-refresh {@link Wrabber} client configured from {@code wrabber.*}.
 */
@AutoConfiguration(
    after = JacksonAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(Wrabber.class)
@ConditionalOnProperty(prefix = "wrabber", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(WrabberProperties.class)
public class WrabberAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    WrabberSettings wrabberSettings(WrabberProperties properties) {
        return properties.toSettings();
    }

    @Bean
    @ConditionalOnMissingBean
    BrokerConnector wrabberBrokerConnector() {
        return new RabbitBrokerConnector();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    Wrabber wrabber(WrabberSettings settings,
                    BrokerConnector connector,
                    ObjectProvider<ObjectMapper> objectMapper,
                    ObjectProvider<MeterRegistry> meterRegistry) {
        return Wrabber.builder(settings)
            .connector(connector)
            .objectMapper(objectMapper.getIfAvailable())
            .meterRegistry(meterRegistry.getIfAvailable())
            .build();
    }

    @Bean
    @ConditionalOnMissingBean
    WrabberLifecycle wrabberLifecycle(Wrabber wrabber, ObjectProvider<WrabberHandlerConfigurer> configurers) {
        return new WrabberLifecycle(wrabber, configurers.orderedStream().toList());
    }
}

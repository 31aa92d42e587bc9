package com.flowhub.orderservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowhub.common.messaging.BrokerProperties;
import com.flowhub.common.messaging.BrokerTransport;
import com.flowhub.common.messaging.RabbitBrokerTransport;
import com.flowhub.common.messaging.ResilientBrokerClient;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties(BrokerProperties.class)
public class MessagingConfig {

    @Bean
    public CachingConnectionFactory brokerConnectionFactory(BrokerProperties properties) {
        CachingConnectionFactory connectionFactory = new CachingConnectionFactory(URI.create(properties.getUrl()));
        connectionFactory.setConnectionTimeout((int) properties.getConnectionTimeout().toMillis());
        return connectionFactory;
    }

    @Bean
    public BrokerTransport brokerTransport(CachingConnectionFactory brokerConnectionFactory, BrokerProperties properties) {
        return new RabbitBrokerTransport(brokerConnectionFactory, properties);
    }

    // start() only validates the URL and schedules the first connect, so startup never waits on the broker
    @Bean(initMethod = "start", destroyMethod = "stop")
    public ResilientBrokerClient resilientBrokerClient(BrokerTransport brokerTransport, BrokerProperties properties,
            ObjectMapper objectMapper, Clock clock) {
        return new ResilientBrokerClient(brokerTransport, properties, objectMapper, clock);
    }
}

package com.flowhub.common.messaging;

import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageListener;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionListener;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.function.Consumer;

/**
 * RabbitMQ transport on Spring AMQP.
 * <p>
 * Events go to a topic exchange with the event type as routing key. The service queue is durable
 * and dead-lettered to {@code dlx}, so a message whose handler throws is parked on {@code q.dlq}
 * instead of being redelivered forever.
 */
@Slf4j
public class RabbitBrokerTransport implements BrokerTransport {

    public static final String DLX_NAME = "dlx";
    public static final String DLQ_NAME = "q.dlq";
    public static final String DLQ_ROUTING_KEY = "dlq";

    private final CachingConnectionFactory connectionFactory;
    private final RabbitTemplate rabbitTemplate;
    private final RabbitAdmin rabbitAdmin;
    private final BrokerProperties properties;

    private final Object containerLock = new Object();
    private SimpleMessageListenerContainer container;
    private volatile Consumer<Throwable> connectionLostListener = cause -> {
    };

    public RabbitBrokerTransport(CachingConnectionFactory connectionFactory, BrokerProperties properties) {
        this.connectionFactory = connectionFactory;
        this.properties = properties;
        this.rabbitTemplate = new RabbitTemplate(connectionFactory);
        this.rabbitAdmin = new RabbitAdmin(connectionFactory);
        this.rabbitAdmin.setAutoStartup(false);
        this.connectionFactory.addConnectionListener(new ConnectionListener() {
            @Override
            public void onCreate(Connection connection) {
                log.debug("AMQP connection opened");
            }

            @Override
            public void onShutDown(ShutdownSignalException signal) {
                if (!signal.isInitiatedByApplication()) {
                    connectionLostListener.accept(signal);
                }
            }
        });
    }

    @Override
    public void connect() {
        Connection connection = connectionFactory.createConnection();
        if (!connection.isOpen()) {
            throw new IllegalStateException("AMQP connection is not open");
        }
        declareTopology();
    }

    @Override
    public void send(String eventType, String payload) {
        MessageProperties props = new MessageProperties();
        props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        props.setContentEncoding(StandardCharsets.UTF_8.name());
        props.setDeliveryMode(MessageDeliveryMode.PERSISTENT);

        Message message = new Message(payload.getBytes(StandardCharsets.UTF_8), props);
        rabbitTemplate.send(properties.getExchange(), eventType, message);
    }

    @Override
    public void startConsuming(Set<String> eventTypes, InboundMessageSink sink) {
        synchronized (containerLock) {
            stopContainer();

            Queue queue = serviceQueue();
            TopicExchange exchange = new TopicExchange(properties.getExchange());
            rabbitAdmin.declareQueue(queue);
            for (String eventType : eventTypes) {
                rabbitAdmin.declareBinding(BindingBuilder.bind(queue).to(exchange).with(eventType));
            }

            SimpleMessageListenerContainer listenerContainer = new SimpleMessageListenerContainer(connectionFactory);
            listenerContainer.setQueueNames(queue.getName());
            // One consumer keeps delivery in queue order
            listenerContainer.setConcurrentConsumers(1);
            listenerContainer.setPrefetchCount(1);
            listenerContainer.setDefaultRequeueRejected(false);
            listenerContainer.setMessageListener((MessageListener) message -> handle(message, sink));
            listenerContainer.start();
            container = listenerContainer;
        }
    }

    @Override
    public void stopConsuming() {
        synchronized (containerLock) {
            stopContainer();
        }
    }

    @Override
    public void close() {
        stopConsuming();
        connectionFactory.resetConnection();
    }

    @Override
    public void setConnectionLostListener(Consumer<Throwable> listener) {
        this.connectionLostListener = listener;
    }

    private void handle(Message message, InboundMessageSink sink) {
        String eventType = message.getMessageProperties().getReceivedRoutingKey();
        String payload = new String(message.getBody(), StandardCharsets.UTF_8);
        try {
            sink.onMessage(eventType, payload);
        } catch (Exception e) {
            log.error("Handler failed, message sent to dead-letter queue. eventType={}, error={}",
                    eventType, e.getMessage(), e);
            throw new AmqpRejectAndDontRequeueException("Handler failed for " + eventType, e);
        }
    }

    private void declareTopology() {
        TopicExchange deadLetterExchange = new TopicExchange(DLX_NAME);
        Queue deadLetterQueue = new Queue(DLQ_NAME);
        rabbitAdmin.declareExchange(deadLetterExchange);
        rabbitAdmin.declareQueue(deadLetterQueue);
        rabbitAdmin.declareBinding(BindingBuilder.bind(deadLetterQueue).to(deadLetterExchange).with("#"));
        rabbitAdmin.declareExchange(new TopicExchange(properties.getExchange()));
    }

    private Queue serviceQueue() {
        return QueueBuilder.durable(properties.getQueue())
                .withArgument("x-dead-letter-exchange", DLX_NAME)
                .withArgument("x-dead-letter-routing-key", DLQ_ROUTING_KEY)
                .build();
    }

    private void stopContainer() {
        if (container != null) {
            container.stop();
            container = null;
        }
    }
}

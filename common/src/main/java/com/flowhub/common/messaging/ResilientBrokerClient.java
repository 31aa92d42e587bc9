package com.flowhub.common.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Publishes domain events at least once and dispatches consumed events to registered handlers,
 * surviving broker outages.
 * <p>
 * All broker work (connect, send, drain, reconnect) runs on a single scheduled thread owned by the
 * client. Callers of {@link #publish(String, Object)} only serialize the payload and hand the send
 * over, so they never block on the broker. While the broker is unreachable events go to a bounded
 * FIFO buffer which is replayed in order once the connection is back. When the buffer is full the
 * oldest event is evicted.
 * <p>
 * The buffer is only ever touched from the client thread. State, counters and the last error are
 * published through volatile fields so {@link #getStatus()} can be called from anywhere.
 */
@Slf4j
public class ResilientBrokerClient {

    private static final double JITTER_RATIO = 0.25;

    private final BrokerTransport transport;
    private final BrokerProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ScheduledExecutorService task;

    private final Deque<PendingEvent> pendingEvents = new ArrayDeque<>();
    private final Map<String, Subscription<?>> subscriptions = new ConcurrentHashMap<>();
    private final List<Consumer<BrokerStatus>> statusListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong evictedCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Instant stateSince;
    private volatile String lastError;
    private volatile int pendingCount;
    private volatile int reconnectAttempts;
    private volatile boolean stopped;

    private ScheduledFuture<?> reconnectFuture;

    public ResilientBrokerClient(BrokerTransport transport, BrokerProperties properties, ObjectMapper objectMapper) {
        this(transport, properties, objectMapper, Clock.systemUTC());
    }

    public ResilientBrokerClient(BrokerTransport transport, BrokerProperties properties,
            ObjectMapper objectMapper, Clock clock) {
        this.transport = transport;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.stateSince = clock.instant();
        this.task = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "broker-client");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Validates the broker URL and starts connecting in the background.
     * Returns immediately; an unreachable broker never fails the caller.
     *
     * @throws BrokerConfigurationException if the URL cannot possibly be connected to
     */
    public void start() {
        validateUrl(properties.getUrl());
        transport.setConnectionLostListener(this::onConnectionLost);
        log.info("Starting broker client. exchange={}, queue={}", properties.getExchange(), properties.getQueue());
        task.execute(this::attemptConnect);
    }

    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        try {
            task.submit(() -> {
                cancelReconnect();
                try {
                    transport.stopConsuming();
                    transport.close();
                } catch (Exception e) {
                    log.warn("Error while closing broker transport: {}", e.getMessage());
                }
                changeState(ConnectionState.DISCONNECTED);
            }).get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("Broker client did not shut down cleanly: {}", e.getMessage());
        } finally {
            task.shutdownNow();
        }
        try {
            task.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Broker client stopped. pendingEvents={}", pendingCount);
    }

    /**
     * Serializes the payload on the calling thread and hands the send to the client thread.
     * A {@code String} payload is taken as already-serialized JSON.
     *
     * @throws IllegalArgumentException if the payload cannot be serialized to JSON
     */
    public void publish(String eventType, Object payload) {
        String json;
        try {
            json = payload instanceof String s ? s : objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize payload for event " + eventType, e);
        }
        PendingEvent event = PendingEvent.of(eventType, json, clock.instant());
        try {
            task.execute(() -> deliverOrBuffer(event));
        } catch (RejectedExecutionException e) {
            droppedCount.incrementAndGet();
            log.error("Broker client is stopped, event dropped. eventType={}", eventType);
        }
    }

    /**
     * Binds a handler to an event type. Handlers are invoked one message at a time; a handler that
     * throws gets the message dead-lettered.
     */
    public <T> void subscribe(String eventType, Class<T> payloadType, EventHandler<T> handler) {
        subscriptions.put(eventType, new Subscription<>(payloadType, handler));
        log.info("Subscribed to broker events. eventType={}", eventType);
        if (state == ConnectionState.CONNECTED) {
            task.execute(this::resumeConsuming);
        }
    }

    public void addStatusListener(Consumer<BrokerStatus> listener) {
        statusListeners.add(listener);
    }

    public BrokerStatus getStatus() {
        return BrokerStatus.builder()
                .state(state)
                .pendingCount(pendingCount)
                .lastError(lastError)
                .evictedCount(evictedCount.get())
                .droppedCount(droppedCount.get())
                .reconnectAttempts(reconnectAttempts)
                .since(stateSince)
                .build();
    }

    /**
     * Copy of the buffered events, oldest first.
     */
    public List<PendingEvent> pendingEventsSnapshot() {
        if (task.isTerminated()) {
            return new ArrayList<>(pendingEvents);
        }
        try {
            return task.submit(() -> (List<PendingEvent>) new ArrayList<>(pendingEvents)).get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reading pending events", e);
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            throw new IllegalStateException("Cannot read pending events", e);
        }
    }

    void dispatch(String eventType, String payload) throws Exception {
        Subscription<?> subscription = subscriptions.get(eventType);
        if (subscription == null) {
            log.warn("No handler registered, message ignored. eventType={}", eventType);
            return;
        }
        subscription.deliver(objectMapper, payload);
    }

    // ---- client thread only below ----

    private void attemptConnect() {
        reconnectFuture = null;
        if (stopped || state == ConnectionState.CONNECTED) {
            return;
        }
        if (state != ConnectionState.FAILED) {
            changeState(ConnectionState.CONNECTING);
        }
        try {
            transport.connect();
        } catch (Exception e) {
            onConnectFailure(e);
            return;
        }
        log.info("Connected to broker after {} failed attempt(s)", reconnectAttempts);
        reconnectAttempts = 0;
        lastError = null;
        changeState(ConnectionState.CONNECTED);
        resumeConsuming();
        drainPendingEvents();
    }

    private void onConnectFailure(Exception e) {
        lastError = e.getMessage();
        reconnectAttempts++;
        int attempt = reconnectAttempts;
        Duration delay = backoffDelay(attempt);
        if (attempt >= properties.getMaxReconnectAttempts()) {
            if (state != ConnectionState.FAILED) {
                log.error("Broker unreachable after {} attempts, running degraded and buffering events. lastError={}",
                        attempt, lastError);
                changeState(ConnectionState.FAILED);
            }
        } else {
            log.warn("Broker connection attempt {} failed, retrying in {} ms. error={}",
                    attempt, delay.toMillis(), lastError);
            changeState(ConnectionState.DISCONNECTED);
        }
        scheduleReconnect(delay);
    }

    private void onConnectionLost(Throwable cause) {
        try {
            task.execute(() -> {
                if (stopped || state != ConnectionState.CONNECTED) {
                    return;
                }
                log.warn("Broker connection lost: {}", cause.getMessage());
                cancelReconnect();
                markDisconnected(cause);
                attemptConnect();
            });
        } catch (RejectedExecutionException e) {
            log.debug("Connection loss reported after broker client stop");
        }
    }

    private void markDisconnected(Throwable cause) {
        lastError = cause.getMessage();
        try {
            transport.stopConsuming();
        } catch (Exception e) {
            log.debug("Could not stop consumers after disconnect: {}", e.getMessage());
        }
        changeState(ConnectionState.DISCONNECTED);
    }

    private void deliverOrBuffer(PendingEvent event) {
        if (state == ConnectionState.CONNECTED) {
            try {
                transport.send(event.getEventType(), event.getPayload());
                log.debug("Published event. eventType={}", event.getEventType());
                return;
            } catch (Exception e) {
                log.warn("Publish failed, buffering event. eventType={}, error={}",
                        event.getEventType(), e.getMessage());
                buffer(event);
                markDisconnected(e);
                scheduleReconnect(backoffDelay(1));
                return;
            }
        }
        log.warn("Broker not connected (state={}), buffering event. eventType={}", state, event.getEventType());
        buffer(event);
    }

    private void buffer(PendingEvent event) {
        if (pendingEvents.size() >= properties.getMaxPendingEvents()) {
            PendingEvent evicted = pendingEvents.pollFirst();
            long total = evictedCount.incrementAndGet();
            log.error("Pending event buffer full, evicted oldest event. eventType={}, enqueuedAt={}, totalEvicted={}",
                    evicted.getEventType(), evicted.getEnqueuedAt(), total);
        }
        pendingEvents.addLast(event);
        pendingCount = pendingEvents.size();
    }

    private void drainPendingEvents() {
        if (pendingEvents.isEmpty()) {
            return;
        }
        log.info("Replaying {} buffered event(s)", pendingEvents.size());
        while (!pendingEvents.isEmpty() && state == ConnectionState.CONNECTED) {
            PendingEvent event = pendingEvents.pollFirst();
            try {
                transport.send(event.getEventType(), event.getPayload());
            } catch (Exception e) {
                PendingEvent failed = event.withFailedAttempt();
                if (failed.getReplayAttempts() >= properties.getMaxReplayAttempts()) {
                    long total = droppedCount.incrementAndGet();
                    log.error("Dropping event after {} failed replays. eventType={}, enqueuedAt={}, totalDropped={}",
                            failed.getReplayAttempts(), failed.getEventType(), failed.getEnqueuedAt(), total);
                } else {
                    pendingEvents.offerFirst(failed);
                }
                pendingCount = pendingEvents.size();
                log.warn("Replay interrupted by send failure: {}", e.getMessage());
                markDisconnected(e);
                scheduleReconnect(backoffDelay(1));
                return;
            }
            pendingCount = pendingEvents.size();
        }
    }

    private void resumeConsuming() {
        if (subscriptions.isEmpty() || state != ConnectionState.CONNECTED) {
            return;
        }
        Set<String> eventTypes = Set.copyOf(subscriptions.keySet());
        try {
            transport.startConsuming(eventTypes, this::dispatch);
            log.info("Consuming events. eventTypes={}", eventTypes);
        } catch (Exception e) {
            log.warn("Could not start consuming, reconnecting. error={}", e.getMessage());
            markDisconnected(e);
            scheduleReconnect(backoffDelay(1));
        }
    }

    private void scheduleReconnect(Duration delay) {
        if (stopped || reconnectFuture != null) {
            return;
        }
        reconnectFuture = task.schedule(this::attemptConnect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelReconnect() {
        if (reconnectFuture != null) {
            reconnectFuture.cancel(false);
            reconnectFuture = null;
        }
    }

    private void changeState(ConnectionState newState) {
        if (state == newState) {
            return;
        }
        state = newState;
        stateSince = clock.instant();
        BrokerStatus status = getStatus();
        for (Consumer<BrokerStatus> listener : statusListeners) {
            try {
                listener.accept(status);
            } catch (RuntimeException e) {
                log.warn("Broker status listener failed: {}", e.getMessage());
            }
        }
    }

    Duration backoffDelay(int attempt) {
        long base = properties.getBackoffBase().toMillis();
        long max = properties.getBackoffMax().toMillis();
        int exponent = Math.min(Math.max(attempt - 1, 0), 30);
        long delay = Math.min(base * (1L << exponent), max);
        if (properties.isJitter()) {
            double factor = 1 - JITTER_RATIO + ThreadLocalRandom.current().nextDouble() * 2 * JITTER_RATIO;
            delay = Math.min((long) (delay * factor), max);
        }
        return Duration.ofMillis(Math.max(delay, 0));
    }

    static void validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new BrokerConfigurationException("Broker URL is not configured");
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new BrokerConfigurationException("Malformed broker URL: " + url, e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("amqp") || scheme.equalsIgnoreCase("amqps"))) {
            throw new BrokerConfigurationException("Broker URL must use amqp or amqps scheme: " + url);
        }
        if (uri.getHost() == null) {
            throw new BrokerConfigurationException("Broker URL has no host: " + url);
        }
    }

    private static final class Subscription<T> {

        private final Class<T> payloadType;
        private final EventHandler<T> handler;

        private Subscription(Class<T> payloadType, EventHandler<T> handler) {
            this.payloadType = payloadType;
            this.handler = handler;
        }

        void deliver(ObjectMapper objectMapper, String payload) throws Exception {
            T event = objectMapper.readValue(payload, payloadType);
            handler.handle(event);
        }
    }
}

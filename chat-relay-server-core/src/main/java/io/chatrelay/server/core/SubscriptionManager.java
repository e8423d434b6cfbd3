package io.chatrelay.server.core;

import io.chatrelay.core.Envelope;
import io.chatrelay.json.spi.JsonCodec;
import io.chatrelay.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns the lifecycle of event-stream subscribers: handshake, registration, keep-alive pulse and cleanup.
 *
 * <p>Cleanup runs exactly once per subscriber no matter how many of remote close, pulse failure,
 * delivery failure and shutdown race for it.
 */
public final class SubscriptionManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionManager.class);

    public static final Duration DEFAULT_PULSE_INTERVAL = Duration.ofSeconds(30);

    private final SubscriberRegistry registry;
    private final JsonCodec codec;
    private final ExecutorService writeExecutor;
    private final boolean ownsWriteExecutor;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Duration pulseInterval;
    private final Clock clock;
    private volatile boolean shuttingDown;

    private SubscriptionManager(Builder b) {
        this.registry = b.registry == null ? new SubscriberRegistry() : b.registry;
        this.codec = Objects.requireNonNull(b.codec, "codec");
        this.ownsWriteExecutor = b.writeExecutor == null;
        this.writeExecutor = ownsWriteExecutor ? VirtualThreads.newExecutor("chat-relay-write") : b.writeExecutor;
        this.ownsScheduler = b.scheduler == null;
        this.scheduler = ownsScheduler ? VirtualThreads.newScheduler("chat-relay-pulse") : b.scheduler;
        this.pulseInterval = b.pulseInterval;
        this.clock = b.clock;
    }

    public static Builder builder(JsonCodec codec) {
        return new Builder(codec);
    }

    public SubscriberRegistry registry() {
        return registry;
    }

    public Duration pulseInterval() {
        return pulseInterval;
    }

    /**
     * Start a subscription: write the connected envelope, register for the session, start the pulse.
     *
     * <p>If the handshake write fails the subscriber is returned already closed and was never registered.
     */
    public SessionSubscriber open(String sessionId, SseChannel channel) {
        SessionSubscriber subscriber = new SessionSubscriber(sessionId, channel, writeExecutor, this, clock.instant());
        if (shuttingDown) {
            close(subscriber, CloseReason.SHUTDOWN);
            return subscriber;
        }

        try {
            subscriber.sendNow(SseFrame.data(codec.writeString(Envelope.connected(sessionId))));
        } catch (IOException | JsonException e) {
            log.warn("SSE handshake failed for session {}: {}", sessionId, e.getMessage());
            close(subscriber, CloseReason.HANDSHAKE_FAILED);
            return subscriber;
        }

        subscriber.markOpen();
        registry.register(subscriber);
        if (!subscriber.isOpen() || shuttingDown) {
            // lost a race with close(); make sure nothing stays registered
            registry.unregister(subscriber);
            close(subscriber, CloseReason.SHUTDOWN);
            return subscriber;
        }

        try {
            long periodMillis = pulseInterval.toMillis();
            ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(
                    () -> subscriber.send(SseFrame.heartbeat(), CloseReason.PULSE_FAILED),
                    periodMillis, periodMillis, TimeUnit.MILLISECONDS);
            subscriber.attachPulse(future);
        } catch (RejectedExecutionException e) {
            log.warn("Cannot schedule heartbeat for session {}: {}", sessionId, e.getMessage());
            close(subscriber, CloseReason.SHUTDOWN);
            return subscriber;
        }

        log.info("SSE client connected: session={} subscriber={} (session total {})",
                sessionId, subscriber.id(), registry.size(sessionId));
        return subscriber;
    }

    /**
     * Close a subscriber: stop its pulse, unregister it and end its response. Idempotent.
     *
     * @return whether this call performed the cleanup
     */
    public boolean close(SessionSubscriber subscriber, CloseReason reason) {
        if (!subscriber.markClosed(reason)) {
            return false;
        }
        subscriber.cancelPulse();
        registry.unregister(subscriber);
        try {
            subscriber.channel().close();
        } catch (RuntimeException e) {
            log.debug("Error ending SSE response for session {}", subscriber.sessionId(), e);
        }
        log.info("SSE client disconnected: session={} subscriber={} reason={} after {}s",
                subscriber.sessionId(), subscriber.id(), reason,
                Duration.between(subscriber.openedAt(), clock.instant()).toSeconds());
        return true;
    }

    void writeFailed(SessionSubscriber subscriber, CloseReason reason, Throwable cause) {
        if (subscriber.isOpen()) {
            log.warn("SSE write failed for session {} subscriber {}: {}",
                    subscriber.sessionId(), subscriber.id(), String.valueOf(cause.getMessage()));
        }
        close(subscriber, reason);
    }

    /** Close every live subscriber and stop the pulse scheduler. Further {@link #open} calls close immediately. */
    public void shutdown() {
        shuttingDown = true;
        int closed = 0;
        for (String sessionId : registry.listActiveSessions()) {
            for (SessionSubscriber subscriber : registry.snapshot(sessionId)) {
                if (close(subscriber, CloseReason.SHUTDOWN)) {
                    closed++;
                }
            }
        }
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        if (ownsWriteExecutor) {
            writeExecutor.shutdown();
        }
        log.info("Subscription manager stopped; closed {} subscriber(s)", closed);
    }

    @Override
    public void close() {
        shutdown();
    }

    public static final class Builder {
        private final JsonCodec codec;
        private SubscriberRegistry registry;
        private ExecutorService writeExecutor;
        private ScheduledExecutorService scheduler;
        private Duration pulseInterval = DEFAULT_PULSE_INTERVAL;
        private Clock clock = Clock.systemUTC();

        private Builder(JsonCodec codec) {
            this.codec = Objects.requireNonNull(codec, "codec");
        }

        public Builder registry(SubscriberRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
            return this;
        }

        /** Executor for frame writes. Not shut down by the manager when supplied here. */
        public Builder writeExecutor(ExecutorService writeExecutor) {
            this.writeExecutor = Objects.requireNonNull(writeExecutor, "writeExecutor");
            return this;
        }

        /** Scheduler for keep-alive pulses. Not shut down by the manager when supplied here. */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            return this;
        }

        public Builder pulseInterval(Duration pulseInterval) {
            Objects.requireNonNull(pulseInterval, "pulseInterval");
            if (pulseInterval.isZero() || pulseInterval.isNegative()) {
                throw new IllegalArgumentException("pulseInterval must be positive");
            }
            this.pulseInterval = pulseInterval;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public SubscriptionManager build() {
            return new SubscriptionManager(this);
        }
    }
}

package io.chatrelay.server.core;

import io.chatrelay.core.Envelope;
import io.chatrelay.json.spi.JsonCodec;
import io.chatrelay.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Fans an envelope out to every subscriber of a session.
 *
 * <p>The envelope is serialized once and written to a snapshot of the session's subscribers taken at
 * call time. One subscriber failing never affects delivery to the others; the failing one is closed.
 * There is no retry and no buffering for sessions without subscribers.
 */
public final class BroadcastDispatcher {
    private static final Logger log = LoggerFactory.getLogger(BroadcastDispatcher.class);

    private final SubscriberRegistry registry;
    private final JsonCodec codec;

    public BroadcastDispatcher(SubscriberRegistry registry, JsonCodec codec) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Returns immediately; the future completes once every write has been attempted. It completes
     * exceptionally only when the envelope cannot be serialized.
     */
    public CompletableFuture<BroadcastReport> broadcast(String sessionId, Envelope envelope) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(envelope, "envelope");

        Set<SessionSubscriber> targets = registry.snapshot(sessionId);
        if (targets.isEmpty()) {
            log.debug("No SSE subscribers for session {}; dropping {}", sessionId, envelope.type());
            return CompletableFuture.completedFuture(BroadcastReport.none(sessionId));
        }

        SseFrame frame;
        try {
            frame = SseFrame.data(codec.writeString(envelope));
        } catch (JsonException e) {
            return CompletableFuture.failedFuture(e);
        }

        List<CompletableFuture<Boolean>> writes = new ArrayList<>(targets.size());
        for (SessionSubscriber subscriber : targets) {
            writes.add(subscriber.send(frame, CloseReason.DELIVERY_FAILED));
        }
        return CompletableFuture.allOf(writes.toArray(new CompletableFuture<?>[0])).thenApply(done -> {
            int delivered = 0;
            for (CompletableFuture<Boolean> w : writes) {
                if (w.join()) {
                    delivered++;
                }
            }
            BroadcastReport report = new BroadcastReport(sessionId, writes.size(), delivered);
            log.debug("Broadcast {} to session {}: {}/{} delivered",
                    envelope.type(), sessionId, delivered, report.attempted());
            return report;
        });
    }
}

package io.chatrelay.server.core;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One open event stream bound to a session.
 *
 * <p>Writes are queued on a per-subscriber {@link SerialExecutor}, so frames reach the client in the
 * order they were sent and a slow client only delays itself. Identity is by instance: two streams for
 * the same session are distinct subscribers.
 */
public final class SessionSubscriber implements SseSubscription {
    private static final AtomicLong IDS = new AtomicLong();

    public enum State { HANDSHAKING, OPEN, CLOSED }

    private final long id = IDS.incrementAndGet();
    private final String sessionId;
    private final SseChannel channel;
    private final SerialExecutor writes;
    private final SubscriptionManager owner;
    private final Instant openedAt;
    private final AtomicReference<State> state = new AtomicReference<>(State.HANDSHAKING);
    private final AtomicReference<ScheduledFuture<?>> pulse = new AtomicReference<>();
    private volatile CloseReason closeReason;

    SessionSubscriber(String sessionId, SseChannel channel, Executor writeExecutor, SubscriptionManager owner,
                      Instant openedAt) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.writes = new SerialExecutor(writeExecutor);
        this.owner = Objects.requireNonNull(owner, "owner");
        this.openedAt = openedAt;
    }

    public long id() {
        return id;
    }

    public String sessionId() {
        return sessionId;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public State state() {
        return state.get();
    }

    /** Set once the subscriber is closed. */
    public CloseReason closeReason() {
        return closeReason;
    }

    @Override
    public boolean isOpen() {
        return state.get() != State.CLOSED;
    }

    @Override
    public void cancel() {
        owner.close(this, CloseReason.REMOTE_CLOSED);
    }

    /**
     * Queue a frame behind earlier ones. A failed write closes this subscriber with {@code onFailure}.
     *
     * @return completes with {@code true} when the frame was written, {@code false} when it was skipped
     *     or failed; never completes exceptionally
     */
    CompletableFuture<Boolean> send(SseFrame frame, CloseReason onFailure) {
        if (!isOpen()) {
            return CompletableFuture.completedFuture(false);
        }
        return writes.submit(() -> {
            if (!isOpen()) {
                return false;
            }
            channel.send(frame);
            return true;
        }).handle((written, err) -> {
            if (err == null) {
                return written;
            }
            owner.writeFailed(this, onFailure, unwrap(err));
            return false;
        });
    }

    /** Direct write used only before registration, when nothing else can write. */
    void sendNow(SseFrame frame) throws IOException {
        channel.send(frame);
    }

    boolean markOpen() {
        return state.compareAndSet(State.HANDSHAKING, State.OPEN);
    }

    /** One-shot transition to CLOSED. Only the winning caller runs cleanup. */
    boolean markClosed(CloseReason reason) {
        State prev = state.getAndSet(State.CLOSED);
        if (prev == State.CLOSED) {
            return false;
        }
        closeReason = reason;
        return true;
    }

    void attachPulse(ScheduledFuture<?> future) {
        pulse.set(future);
        if (!isOpen()) {
            cancelPulse();
        }
    }

    void cancelPulse() {
        ScheduledFuture<?> f = pulse.getAndSet(null);
        if (f != null) {
            f.cancel(false);
        }
    }

    SseChannel channel() {
        return channel;
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }

    @Override
    public String toString() {
        return "SessionSubscriber{id=" + id + ", session=" + sessionId + ", state=" + state.get() + "}";
    }
}

package io.chatrelay.server.core;

import java.util.Objects;

/**
 * One Server-Sent Events block written to a subscriber.
 *
 * <p>The relay writes two kinds: unnamed {@code data:} events carrying a JSON envelope and
 * comment lines used as keep-alive pulses. Neither carries an {@code event:} or {@code id:} field.
 */
public final class SseFrame {
    private static final SseFrame HEARTBEAT = new SseFrame(Kind.COMMENT, "heartbeat");

    private enum Kind { DATA, COMMENT }

    private final Kind kind;
    private final String text;

    private SseFrame(Kind kind, String text) {
        this.kind = kind;
        this.text = Objects.requireNonNull(text, "text");
    }

    public static SseFrame data(String json) {
        return new SseFrame(Kind.DATA, json);
    }

    /** The {@code :heartbeat} pulse. */
    public static SseFrame heartbeat() {
        return HEARTBEAT;
    }

    public String text() {
        return text;
    }

    /**
     * Render as an SSE block terminated by a blank line. Multi-line payloads get one prefix per line.
     */
    public String render() {
        String prefix = kind == Kind.DATA ? "data: " : ":";
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (String line : text.split("\r?\n", -1)) {
            sb.append(prefix).append(line).append('\n');
        }
        return sb.append('\n').toString();
    }

    @Override
    public String toString() {
        return render();
    }
}

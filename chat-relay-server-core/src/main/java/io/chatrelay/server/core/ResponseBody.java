package io.chatrelay.server.core;

/**
 * Framework-neutral response body abstraction.
 *
 * <p>{@link Sse} bodies are long-lived: the host keeps the exchange open, hands the stream an
 * {@link SseChannel} and holds the exchange until the channel is closed.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes, ResponseBody.Sse {

    record Empty() implements ResponseBody {}

    record Bytes(byte[] bytes) implements ResponseBody {}

    record Sse(SseStream stream) implements ResponseBody {}
}

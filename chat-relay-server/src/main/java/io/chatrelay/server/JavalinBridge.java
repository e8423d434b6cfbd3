package io.chatrelay.server;

import io.chatrelay.server.core.ChatRelayHandler;
import io.chatrelay.server.core.HttpMethod;
import io.chatrelay.server.core.ResponseBody;
import io.chatrelay.server.core.ServerRequest;
import io.chatrelay.server.core.ServerResponse;
import io.chatrelay.server.core.SseChannel;
import io.chatrelay.server.core.SseFrame;
import io.chatrelay.server.core.SseSubscription;
import io.javalin.http.Context;
import io.javalin.http.Handler;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * Adapts Javalin exchanges to {@link ChatRelayHandler}.
 *
 * <p>Event streams hold the request thread until the relay closes the channel; with virtual threads
 * enabled that costs no platform thread.
 */
final class JavalinBridge implements Handler {
    private final ChatRelayHandler handler;

    JavalinBridge(ChatRelayHandler handler) {
        this.handler = handler;
    }

    @Override
    public void handle(Context ctx) throws Exception {
        ServerRequest request = new ServerRequest(
                HttpMethod.of(ctx.method().name()),
                URI.create(ctx.fullUrl()),
                toHeaders(ctx),
                ctx.bodyAsBytes());

        ServerResponse response = handler.handle(request);
        ctx.status(response.status());
        for (Map.Entry<String, List<String>> e : response.headers().entrySet()) {
            for (String v : e.getValue()) {
                ctx.header(e.getKey(), v);
            }
        }

        if (response.body() instanceof ResponseBody.Bytes bytes) {
            ctx.result(bytes.bytes());
        } else if (response.body() instanceof ResponseBody.Sse sse) {
            stream(ctx, sse);
        }
    }

    private static void stream(Context ctx, ResponseBody.Sse sse) throws IOException {
        OutputStream out = ctx.res().getOutputStream();
        ctx.res().flushBuffer();
        StreamChannel channel = new StreamChannel(out);
        SseSubscription subscription = sse.stream().open(channel);
        try {
            channel.awaitClosed();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            subscription.cancel();
        }
    }

    private static Map<String, List<String>> toHeaders(Context ctx) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : ctx.headerMap().entrySet()) {
            headers.put(e.getKey(), List.of(e.getValue()));
        }
        return headers;
    }

    /** Servlet output stream as an {@link SseChannel}. */
    static final class StreamChannel implements SseChannel {
        private final OutputStream out;
        private final CountDownLatch closed = new CountDownLatch(1);

        StreamChannel(OutputStream out) {
            this.out = out;
        }

        @Override
        public synchronized void send(SseFrame frame) throws IOException {
            if (closed.getCount() == 0) {
                throw new IOException("stream closed");
            }
            out.write(frame.render().getBytes(StandardCharsets.UTF_8));
            out.flush();
        }

        @Override
        public void close() {
            closed.countDown();
        }

        void awaitClosed() throws InterruptedException {
            closed.await();
        }
    }
}

package io.chatrelay.server.core;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Framework-neutral request abstraction.
 *
 * <p>Relay request bodies are small JSON documents, so hosts buffer them before handing the request over.
 */
public final class ServerRequest {
    private final HttpMethod method;
    private final URI uri;
    private final Map<String, List<String>> headers;
    private final byte[] body; // may be null

    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, byte[] body) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = Objects.requireNonNull(headers, "headers");
        this.body = body;
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    /** Decoded path, never empty. */
    public String path() {
        String p = uri.getPath();
        return p == null || p.isEmpty() ? "/" : p;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public byte[] body() {
        return body;
    }
}

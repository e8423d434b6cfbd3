package io.chatrelay.server.core;

import java.util.Locale;

/**
 * Request methods a host may forward; the relay routes only {@link #GET} and {@link #POST}.
 */
public enum HttpMethod {
    GET,
    HEAD,
    POST,
    PUT,
    PATCH,
    DELETE,
    OPTIONS;

    /**
     * @throws IllegalArgumentException for methods the relay does not model (e.g. TRACE)
     */
    public static HttpMethod of(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}

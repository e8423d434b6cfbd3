package io.chatrelay.server.core;

import io.chatrelay.core.Protocol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Framework-neutral response abstraction.
 */
public final class ServerResponse {
    private final int status;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final ResponseBody body;

    public ServerResponse(int status, ResponseBody body) {
        this.status = status;
        this.body = body;
    }

    /** JSON document response; relay JSON is never cacheable. */
    static ServerResponse json(int status, byte[] json) {
        return new ServerResponse(status, new ResponseBody.Bytes(json))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON)
                .header(Protocol.H_CACHE_CONTROL, "no-store");
    }

    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public ResponseBody body() {
        return body;
    }

    public ServerResponse header(String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }
}

package io.chatrelay.core;

import java.util.List;

/**
 * Chat relay protocol constants (routes, wire field names, envelope tags and well-known values).
 *
 * <p>This module intentionally contains no HTTP client/server bindings and no JSON library dependencies.
 * It only models protocol-level concerns that are shared by the relay core, stores and hosts.
 */
public final class Protocol {
    private Protocol() {}

    // Routes
    public static final String PATH_ROOT = "/";
    public static final String PATH_STORE_TEST = "/api/test";
    public static final String PATH_SSE_PREFIX = "/api/sse/";
    public static final String PATH_MESSAGES = "/api/messages";
    public static final String PATH_MESSAGES_PREFIX = "/api/messages/";
    public static final String PATH_MESSAGE_PREFIX = "/api/message/";
    public static final String PATH_SESSIONS = "/api/sessions";
    public static final String PATH_CHANGE_WEBHOOK = "/webhook/supabase";

    // Message record fields
    public static final String F_MESSAGE_ID = "w_msg_id";
    public static final String F_SESSION_ID = "session_id";
    public static final String F_SENDER_ID = "sender_id";
    public static final String F_RECIPIENT_ID = "recipient_id";
    public static final String F_MESSAGE_TEXT = "message_text";
    public static final String F_MESSAGE_TYPE = "message_type";
    public static final String F_STATUS = "status";
    public static final String F_TIMESTAMP = "timestamp";

    // Envelope fields and tags
    public static final String F_TYPE = "type";
    public static final String F_MESSAGE = "message";
    public static final String ENVELOPE_CONNECTED = "connected";
    public static final String ENVELOPE_NEW_MESSAGE = "NEW_MESSAGE";

    // Change-notification fields
    public static final String F_TABLE = "table";
    public static final String F_RECORD = "record";
    public static final String F_OLD_RECORD = "old_record";

    // HTTP headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_CONNECTION = "Connection";
    public static final String H_ALLOW_ORIGIN = "Access-Control-Allow-Origin";

    // Content types
    public static final String CT_JSON = "application/json";
    public static final String CT_EVENT_STREAM = "text/event-stream";

    /** Recipient used when a submission does not name one. */
    public static final String DEFAULT_RECIPIENT = "bot";

    /** The only message type produced by the direct-write path. */
    public static final String MESSAGE_TYPE_TEXT = "text";

    /** Status assigned to every message accepted by the direct-write path. */
    public static final String STATUS_SENT = "sent";

    /** Table whose inserts are relayed from the change feed unless configured otherwise. */
    public static final String DEFAULT_MESSAGES_TABLE = "whatsapp_messages";

    /** Fields a submission must carry, in the order they are validated. */
    public static final List<String> REQUIRED_SUBMISSION_FIELDS = List.of(F_SESSION_ID, F_SENDER_ID, F_MESSAGE_TEXT);
}

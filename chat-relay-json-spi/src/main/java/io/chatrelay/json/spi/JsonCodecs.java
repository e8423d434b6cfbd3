package io.chatrelay.json.spi;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.StreamSupport;

/**
 * {@link JsonCodec} lookup backed by {@link ServiceLoader}.
 *
 * <p>For GraalVM native-image or tests, pass a codec explicitly instead of relying on discovery.
 */
public final class JsonCodecs {

    private JsonCodecs() {}

    public static Optional<JsonCodec> find(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        ServiceLoader<JsonCodecProvider> loader = ServiceLoader.load(JsonCodecProvider.class, cl);
        return StreamSupport.stream(loader.spliterator(), false)
                .max(Comparator.comparingInt(JsonCodecProvider::priority))
                .map(JsonCodecProvider::codec);
    }

    /**
     * Resolves the highest-priority codec visible to the context class loader.
     *
     * @throws IllegalStateException if no codec module is installed
     */
    public static JsonCodec defaultCodec() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = JsonCodecs.class.getClassLoader();
        return find(cl).orElseThrow(() ->
                new IllegalStateException("no JsonCodecProvider found; add chat-relay-json-jackson to the class path"));
    }
}

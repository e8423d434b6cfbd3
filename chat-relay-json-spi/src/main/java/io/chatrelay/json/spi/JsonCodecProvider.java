package io.chatrelay.json.spi;

/**
 * ServiceLoader entry point for {@link JsonCodec} implementations.
 *
 * <p>Register implementations in {@code META-INF/services/io.chatrelay.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    JsonCodec codec();

    /** Higher wins when several providers are on the class path. */
    default int priority() {
        return 0;
    }
}

package io.chatrelay.json.jackson;

import io.chatrelay.json.spi.JsonCodec;
import io.chatrelay.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    @Override
    public JsonCodec codec() {
        return new JacksonJsonCodec();
    }
}

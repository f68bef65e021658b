package com.rpagent.providerconfig.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import com.rpagent.providerconfig.ResourceProviderConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Serialization and deserialization of resource provider configs (and any other payload of the
 * agent API) in the supported {@link PayloadFormat}s. Nulls are excluded when serializing.
 */
public final class ProviderConfigCodec {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final ObjectMapper CBOR_MAPPER = new ObjectMapper(new CBORFactory())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final ObjectMapper PRETTY_JSON_MAPPER = JSON_MAPPER.copy()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ProviderConfigCodec() {
    }

    /**
     * Decodes a config from raw payload bytes.
     *
     * @throws UncheckedIOException when the payload is not a well-formed config in the given format
     */
    public static ResourceProviderConfig decode(byte[] payload, PayloadFormat format) {
        return read(payload, format, ResourceProviderConfig.class);
    }

    public static byte[] encode(ResourceProviderConfig config, PayloadFormat format) {
        return write(config, format);
    }

    /** Pretty-printed JSON, the layout of persisted records. */
    public static byte[] toPrettyJson(ResourceProviderConfig config) {
        try {
            return PRETTY_JSON_MAPPER.writeValueAsBytes(config);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Reads any payload type.
     *
     * @throws UncheckedIOException on parse failure (including empty input)
     */
    public static <T> T read(byte[] payload, PayloadFormat format, Class<T> type) {
        Objects.requireNonNull(format, "format");
        if (payload == null || payload.length == 0) {
            throw new UncheckedIOException(new IOException("Empty " + format + " payload"));
        }
        try {
            T value = mapper(format).readValue(payload, type);
            if (value == null) {
                throw new UncheckedIOException(new IOException("Null " + format + " payload"));
            }
            return value;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] write(Object value, PayloadFormat format) {
        Objects.requireNonNull(format, "format");
        try {
            return mapper(format).writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    private static ObjectMapper mapper(PayloadFormat format) {
        return format == PayloadFormat.CBOR ? CBOR_MAPPER : JSON_MAPPER;
    }
}

package com.rpagent.providerconfig.codec;

import java.util.Locale;
import java.util.Optional;

/** Wire encodings accepted for configs and API calls. */
public enum PayloadFormat {
    /** Human-readable encoding; also the on-disk format of persisted records. */
    JSON("application/json"),
    /** Compact binary encoding. */
    CBOR("application/cbor");

    private final String mediaType;

    PayloadFormat(String mediaType) {
        this.mediaType = mediaType;
    }

    public String getMediaType() {
        return mediaType;
    }

    /**
     * Resolves a Content-Type or single Accept entry (parameters such as {@code ;charset=utf-8}
     * are ignored). Empty when the media type is not supported.
     */
    public static Optional<PayloadFormat> fromMediaType(String mediaType) {
        if (mediaType == null) {
            return Optional.empty();
        }
        String base = mediaType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        for (PayloadFormat f : values()) {
            if (f.mediaType.equals(base)) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }
}

package com.hcltech.causal.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hcltech.causal.common.errorsor.ErrorsOr;

import java.util.Objects;

/** JSON for one concrete type. Failures on either side are reported as errors, never thrown. */
public final class JacksonTypedJsonCodec<T> implements Codec<T, String> {
    private final ObjectMapper mapper = new ObjectMapper();
    private final Class<T> klass;

    public JacksonTypedJsonCodec(Class<T> klass) {
        this.klass = Objects.requireNonNull(klass);
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        try {
            return ErrorsOr.lift(mapper.writeValueAsString(value));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to encode to JSON: " + e.getMessage());
        }
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        if (json == null || json.isBlank()) return ErrorsOr.error("Failed to decode from JSON: empty input");
        try {
            T value = mapper.readValue(json, klass);
            if (value == null) return ErrorsOr.error("Failed to decode from JSON: null document");
            return ErrorsOr.lift(value);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to decode from JSON: " + e.getMessage());
        }
    }
}

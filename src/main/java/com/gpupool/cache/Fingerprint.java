package com.gpupool.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gpupool.core.Tier;
import com.gpupool.request.ValidationRequest;

import java.util.Objects;

/**
 * Cache key of a validation: tier, request kind and the canonical JSON of the request
 * parameters with map keys sorted. The hypothesis id is not part of the key, so two
 * hypotheses with identical parameters share a cached result.
 *
 * @param value Canonical key text
 */
public record Fingerprint(String value) {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public Fingerprint {
        Objects.requireNonNull(value, "value cannot be null");
    }

    public static Fingerprint of(Tier tier, ValidationRequest request) {
        try {
            String parameters = CANONICAL.writeValueAsString(request.parameters());
            return new Fingerprint(tier.name() + "|" + request.kind().wireName() + "|" + parameters);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request parameters are not serializable", e);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}

package com.gpupool.core;

import com.gpupool.request.ValidationRequest;

import java.util.Objects;

/**
 * What a caller submits: which hypothesis to validate, where and how urgently.
 *
 * @param hypothesisId Hypothesis reference id
 * @param tier         Target GPU tier
 * @param priority     Queue priority within the tier
 * @param request      Kind-specific validation request
 */
public record TaskSpec(
        String hypothesisId,
        Tier tier,
        Priority priority,
        ValidationRequest request
) {
    public TaskSpec {
        Objects.requireNonNull(hypothesisId, "hypothesisId cannot be null");
        Objects.requireNonNull(tier, "tier cannot be null");
        Objects.requireNonNull(request, "request cannot be null");
        if (priority == null) {
            priority = Priority.NORMAL;
        }
    }

    public static TaskSpec of(String hypothesisId, Tier tier, ValidationRequest request) {
        return new TaskSpec(hypothesisId, tier, Priority.NORMAL, request);
    }
}

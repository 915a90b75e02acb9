package com.gpupool.backend;

import com.gpupool.request.ValidationRequest;

import java.util.Objects;

/**
 * One validation as sent to a remote handle.
 *
 * @param hypothesisId Hypothesis the request belongs to
 * @param request      Kind-specific request
 */
public record RemoteCall(String hypothesisId, ValidationRequest request) {

    public RemoteCall {
        Objects.requireNonNull(hypothesisId, "hypothesisId cannot be null");
        Objects.requireNonNull(request, "request cannot be null");
    }
}

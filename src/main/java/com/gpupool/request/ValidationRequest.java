package com.gpupool.request;

import java.util.Map;

/**
 * A validation request. One variant per {@link RequestKind}, each carrying its own parameter shape.
 */
public sealed interface ValidationRequest
        permits PhysicsValidation, BatchValidation, MonteCarlo, ParametricSweep {

    RequestKind kind();

    /**
     * Canonical key/value view of the request, used for fingerprinting and the wire format.
     */
    Map<String, Object> parameters();
}

package com.gpupool.backend;

import com.gpupool.request.RequestKind;

import java.util.List;

/**
 * Handle on the remote service that runs validations for one GPU tier.
 * <p>
 * Calls block until they settle. Transport, authentication and retries are the
 * implementation's business; the pool never retries a failed call.
 */
public interface RemoteExecutionHandle {

    /**
     * Run one validation.
     *
     * @throws RuntimeException on transport, backend or decoding errors
     */
    ValidationOutcome executeSingle(RemoteCall call);

    /**
     * Run several validations of the same kind in one call.
     * Outputs are returned in input order; an entry may be null if the backend dropped it.
     *
     * @throws UnsupportedOperationException if {@link #supportsBatch(RequestKind)} is false for the kind
     */
    List<ValidationOutcome> executeBatch(RequestKind kind, List<RemoteCall> calls);

    /**
     * Whether {@link #executeBatch} accepts the given kind.
     */
    boolean supportsBatch(RequestKind kind);

    /**
     * Health probe. Must not throw.
     */
    boolean isAvailable();

    /**
     * Best-effort hint to pre-provision instances.
     *
     * @return true if the backend acknowledged the warm-up
     */
    boolean warmUp(int count);
}

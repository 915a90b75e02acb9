package com.gpupool.exception;

import com.gpupool.core.Tier;

/**
 * The remote handle of a tier reported that it is not reachable.
 * Submissions to that tier fail fast instead of queuing.
 */
public class PoolUnavailableException extends PoolException {

    private final Tier tier;

    public PoolUnavailableException(Tier tier) {
        super("GPU tier " + tier + " is unavailable");
        this.tier = tier;
    }

    public Tier getTier() {
        return tier;
    }
}

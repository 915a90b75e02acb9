package com.gpupool.selection;

import com.gpupool.core.Priority;
import com.gpupool.core.TaskSpec;
import com.gpupool.core.Tier;
import com.gpupool.request.ValidationRequest;

/**
 * Maps a hypothesis score (0-10) to the GPU tier and queue priority it deserves.
 * Stronger hypotheses get faster hardware and are served first.
 */
public final class TierSelector {

    static final double HIGH_TIER_THRESHOLD = 8.5;
    static final double MID_TIER_THRESHOLD = 7.0;

    private TierSelector() {
    }

    public static Tier tierFor(double score) {
        if (score >= HIGH_TIER_THRESHOLD) {
            return Tier.HIGH;
        }
        if (score >= MID_TIER_THRESHOLD) {
            return Tier.MID;
        }
        return Tier.LOW;
    }

    public static Priority priorityFor(double score) {
        if (score >= 9.0) {
            return Priority.CRITICAL;
        }
        if (score >= 8.0) {
            return Priority.HIGH;
        }
        if (score >= 7.0) {
            return Priority.NORMAL;
        }
        return Priority.LOW;
    }

    /**
     * Build a submission whose tier and priority follow from the score.
     */
    public static TaskSpec specFor(String hypothesisId, double score, ValidationRequest request) {
        return new TaskSpec(hypothesisId, tierFor(score), priorityFor(score), request);
    }
}

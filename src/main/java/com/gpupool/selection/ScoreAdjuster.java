package com.gpupool.selection;

import com.gpupool.core.MetricEstimate;
import com.gpupool.core.ValidationResult;

/**
 * Adjusts a hypothesis score (0-10) after a GPU validation.
 * <p>
 * Physical validity moves the score by 0.3, with extra bonus or penalty depending on the
 * confidence of the run; economic viability adds up to 0.3 or costs 0.1. The total
 * adjustment is capped at +/-0.5 and the adjusted score stays within [0, 10].
 */
public final class ScoreAdjuster {

    static final double MAX_ADJUSTMENT = 0.5;
    static final double LOW_LCOE = 0.05;

    private ScoreAdjuster() {
    }

    public static double adjustment(ValidationResult result) {
        double adjustment = 0.0;

        if (result.physicallyValid()) {
            adjustment += 0.3;
            if (result.confidenceScore() > 0.9) {
                adjustment += 0.1;
            }
            if (result.confidenceScore() > 0.95) {
                adjustment += 0.1;
            }
        } else {
            adjustment -= 0.3;
            if (result.confidenceScore() < 0.5) {
                adjustment -= 0.2;
            }
        }

        if (result.economicallyViable()) {
            adjustment += 0.2;
            MetricEstimate lcoe = result.metrics().get("lcoe");
            if (lcoe != null && lcoe.mean() < LOW_LCOE) {
                adjustment += 0.1;
            }
        } else {
            adjustment -= 0.1;
        }

        return Math.max(-MAX_ADJUSTMENT, Math.min(MAX_ADJUSTMENT, adjustment));
    }

    public static double adjust(double score, ValidationResult result) {
        return Math.max(0.0, Math.min(10.0, score + adjustment(result)));
    }
}

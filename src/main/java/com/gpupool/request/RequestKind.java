package com.gpupool.request;

/**
 * Kinds of validation work a remote backend can run.
 */
public enum RequestKind {
    MONTE_CARLO("monte_carlo"),
    PARAMETRIC_SWEEP("parametric_sweep"),
    PHYSICS_VALIDATION("physics_validation"),
    BATCH_VALIDATION("batch_validation");

    private final String wireName;

    RequestKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static RequestKind fromWireName(String value) {
        for (RequestKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown request kind: " + value);
    }
}

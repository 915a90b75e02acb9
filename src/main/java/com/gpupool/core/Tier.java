package com.gpupool.core;

/**
 * GPU capability classes. Each tier has its own queue, concurrency limit and cost profile.
 */
public enum Tier {
    LOW("T4"),
    MID("A10G"),
    HIGH("A100");

    private final String defaultGpu;

    Tier(String defaultGpu) {
        this.defaultGpu = defaultGpu;
    }

    /**
     * GPU class used by this tier when configuration does not name one.
     */
    public String defaultGpu() {
        return defaultGpu;
    }

    /**
     * Parse a tier from its name or its default GPU label (case-insensitive).
     */
    public static Tier parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Tier cannot be blank");
        }
        String normalized = value.trim().toUpperCase();
        for (Tier tier : values()) {
            if (tier.name().equals(normalized) || tier.defaultGpu.equals(normalized)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown tier: " + value);
    }
}

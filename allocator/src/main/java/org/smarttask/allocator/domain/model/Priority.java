package org.smarttask.allocator.domain.model;

import java.util.Locale;

/**
 * Task urgency level. Higher weight is processed first.
 */
public enum Priority {
    HIGH("high", 3),
    MEDIUM("medium", 2),
    LOW("low", 1);

    private final String code;
    private final int weight;

    Priority(String code, int weight) {
        this.code = code;
        this.weight = weight;
    }

    public String getCode() {
        return code;
    }

    public int getWeight() {
        return weight;
    }

    /**
     * Resolve a priority from its wire code, ignoring case.
     *
     * @throws IllegalArgumentException if the code is null or unknown
     */
    public static Priority fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("priority must not be null");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Priority p : values()) {
            if (p.code.equals(normalized)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + code + " (expected high, medium or low)");
    }
}

package com.aletheia.engine.types;

/**
 * Coarse risk bucket derived from a continuous fraud score. Declaration order is severity order.
 */
public enum FraudLevel {
    LOW(0, "low"),
    MEDIUM(1, "medium"),
    HIGH(2, "high"),
    CRITICAL(3, "critical");

    private final int id;
    private final String label;

    FraudLevel(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean isAtLeast(FraudLevel other) {
        return compareTo(other) >= 0;
    }

    /** HIGH and CRITICAL workers are barred from assignment and payment. */
    public boolean isFraudulent() {
        return isAtLeast(HIGH);
    }

    public static FraudLevel fromId(int id) {
        for (FraudLevel l : values()) {
            if (l.id == id) return l;
        }
        throw new IllegalArgumentException("Unknown FraudLevel id: " + id);
    }
}

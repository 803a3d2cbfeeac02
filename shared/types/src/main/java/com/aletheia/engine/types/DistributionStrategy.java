package com.aletheia.engine.types;

/**
 * How a task is offered to its candidate workers.
 */
public enum DistributionStrategy {
    BROADCAST(0, "broadcast"),
    TARGETED(1, "targeted"),
    AUCTION(2, "auction");

    private final int id;
    private final String label;

    DistributionStrategy(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static DistributionStrategy fromId(int id) {
        for (DistributionStrategy v : values()) {
            if (v.id == id) return v;
        }
        throw new IllegalArgumentException("Unknown DistributionStrategy id: " + id);
    }
}

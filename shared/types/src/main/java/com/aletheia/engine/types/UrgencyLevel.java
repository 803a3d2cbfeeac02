package com.aletheia.engine.types;

public enum UrgencyLevel {
    LOW(0, "low"),
    MEDIUM(1, "medium"),
    HIGH(2, "high"),
    CRITICAL(3, "critical");

    private final int id;
    private final String label;

    UrgencyLevel(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static UrgencyLevel fromId(int id) {
        for (UrgencyLevel u : values()) {
            if (u.id == id) return u;
        }
        throw new IllegalArgumentException("Unknown UrgencyLevel id: " + id);
    }
}

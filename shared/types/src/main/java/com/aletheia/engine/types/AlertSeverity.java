package com.aletheia.engine.types;

public enum AlertSeverity {
    MEDIUM(0, "medium"),
    HIGH(1, "high");

    private final int id;
    private final String label;

    AlertSeverity(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static AlertSeverity fromId(int id) {
        for (AlertSeverity v : values()) {
            if (v.id == id) return v;
        }
        throw new IllegalArgumentException("Unknown AlertSeverity id: " + id);
    }
}

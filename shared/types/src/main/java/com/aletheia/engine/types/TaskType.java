package com.aletheia.engine.types;

public enum TaskType {
    TEXT_VERIFICATION(0, "text"),
    IMAGE_VERIFICATION(1, "image"),
    CODE_VERIFICATION(2, "code"),
    DATA_VERIFICATION(3, "data"),
    AUDIO_VERIFICATION(4, "audio");

    private final int id;
    private final String label;

    TaskType(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static TaskType fromId(int id) {
        for (TaskType v : values()) {
            if (v.id == id) return v;
        }
        throw new IllegalArgumentException("Unknown TaskType id: " + id);
    }
}

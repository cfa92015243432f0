package com.libragraph.atomizer.types;

public enum Modality {
    TEXT(0, "text"),
    CODE(1, "code"),
    STRUCTURED(2, "structured"),
    DOCUMENT(3, "document"),
    IMAGE(4, "image"),
    AUDIO(5, "audio"),
    VIDEO(6, "video"),
    MODEL(7, "model"),
    ARCHIVE(8, "archive"),
    BINARY(9, "binary");

    private final int id;
    private final String label;

    Modality(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static Modality fromId(int id) {
        for (Modality m : values()) {
            if (m.id == id) return m;
        }
        throw new IllegalArgumentException("Unknown Modality id: " + id);
    }

    public static Modality fromLabel(String label) {
        for (Modality m : values()) {
            if (m.label.equals(label)) return m;
        }
        throw new IllegalArgumentException("Unknown Modality label: " + label);
    }
}

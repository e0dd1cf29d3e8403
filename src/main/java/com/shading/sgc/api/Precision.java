package com.shading.sgc.api;

/** GLSL ES precision qualifiers. */
public enum Precision {
    LOWP("lowp"),
    MEDIUMP("mediump"),
    HIGHP("highp");

    private final String keyword;

    Precision(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Precision fromString(String text) {
        for (Precision p : values()) {
            if (p.keyword.equalsIgnoreCase(text) || p.name().equalsIgnoreCase(text))
                return p;
        }
        throw new IllegalArgumentException("Unknown Precision: " + text);
    }
}

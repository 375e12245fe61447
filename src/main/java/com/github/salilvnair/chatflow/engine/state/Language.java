package com.github.salilvnair.chatflow.engine.state;

import java.util.Locale;

public enum Language {
    EN("English"),
    HI("हिंदी"),
    GU("ગુજરાતી"),
    TA("தமிழ்"),
    TE("తెలుగు");

    private final String displayName;

    Language(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Language fromCode(String code, Language fallback) {
        if (code == null || code.isBlank()) {
            return fallback;
        }
        for (Language value : values()) {
            if (value.name().equalsIgnoreCase(code.trim())) {
                return value;
            }
        }
        return fallback;
    }
}

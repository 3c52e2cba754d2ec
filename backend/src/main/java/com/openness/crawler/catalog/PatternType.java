package com.openness.crawler.catalog;

import java.util.Locale;

public enum PatternType {
    TEXT,
    URL,
    LOGO;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PatternType fromKey(String value) {
        if (value == null) {
            return null;
        }
        for (PatternType type : values()) {
            if (type.key().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        return null;
    }
}

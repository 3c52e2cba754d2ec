package com.openness.crawler.catalog;

import java.util.Locale;

public enum CriterionType {
    OPERATIONAL,
    STRATEGIC;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CriterionType fromKey(String value) {
        if (value == null) {
            return null;
        }
        for (CriterionType type : values()) {
            if (type.key().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        return null;
    }
}

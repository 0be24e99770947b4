package com.tigerwatch.monitor.entity;

/**
 * Origin of a piece of evidence.
 */
public enum EvidenceSourceType {
    WEB_SEARCH("web_search"),
    SOCIAL_MEDIA("social_media"),
    DOCUMENT("document"),
    DATABASE("database"),
    OFFICIAL_REPORT("official_report");

    private final String value;

    EvidenceSourceType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static EvidenceSourceType fromValue(String value) {
        if (value == null) return WEB_SEARCH;
        for (EvidenceSourceType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return WEB_SEARCH;
    }
}

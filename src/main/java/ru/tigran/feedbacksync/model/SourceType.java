package ru.tigran.feedbacksync.model;

/**
 * Source type of a feedback item.
 * The value is the wire/storage form, the display name is used in logs and metrics.
 */
public enum SourceType {
    TWITTER_SEARCH("twitter-search", "Twitter search"),
    GITHUB_ISSUE("github-issue", "GitHub issues"),
    GITHUB_DISCUSSION("github-discussion", "GitHub discussions"),
    DISCOURSE("discourse", "Discourse forum");

    private final String value;
    private final String displayName;

    SourceType(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Accepts both the wire value ("github-issue") and the enum name ("GITHUB_ISSUE").
     */
    public static SourceType fromValue(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (SourceType type : values()) {
            if (type.value.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + value);
    }
}

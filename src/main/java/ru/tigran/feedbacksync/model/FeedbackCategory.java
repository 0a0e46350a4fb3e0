package ru.tigran.feedbacksync.model;

/**
 * Feedback categories assigned by classification.
 */
public enum FeedbackCategory {
    BUG_REPORT("bug-report", "Bug Report"),
    FEATURE_REQUEST("feature-request", "Feature Request"),
    PERFORMANCE_ISSUE("performance-issue", "Performance Issue"),
    DOCUMENTATION_GAP("documentation-gap", "Documentation Gap"),
    INTEGRATION_PROBLEM("integration-problem", "Integration Problem"),
    BREAKING_CHANGE("breaking-change", "Breaking Change"),
    PRICING_QUOTA("pricing-quota", "Pricing/Quota"),
    PRAISE("praise", "Praise"),
    QUESTION("question", "Question"),
    OTHER("other", "Other");

    private final String value;
    private final String displayName;

    FeedbackCategory(String value, String displayName) {
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
     * Lenient lookup for AI-supplied values: anything unrecognised becomes OTHER.
     */
    public static FeedbackCategory fromValue(String value) {
        if (value == null) {
            return OTHER;
        }
        String normalized = value.trim().toLowerCase().replace('_', '-');
        for (FeedbackCategory category : values()) {
            if (category.value.equals(normalized)) {
                return category;
            }
        }
        return OTHER;
    }
}

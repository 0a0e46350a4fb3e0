package ru.tigran.feedbacksync.model;

public enum Sentiment {
    POSITIVE("positive"),
    NEUTRAL("neutral"),
    NEGATIVE("negative");

    private final String value;

    Sentiment(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup for AI-supplied values: anything unrecognised becomes NEUTRAL.
     */
    public static Sentiment fromValue(String value) {
        if (value == null) {
            return NEUTRAL;
        }
        for (Sentiment sentiment : values()) {
            if (sentiment.value.equalsIgnoreCase(value.trim())) {
                return sentiment;
            }
        }
        return NEUTRAL;
    }
}

package ru.tigran.feedbacksync.util;

import ru.tigran.feedbacksync.model.SourceType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Utility class for stable identifiers.
 * Re-fetching the same logical item (or re-emitting the same theme) always yields the same id.
 */
public class FeedbackIds {

    private static final int GROUP_HASH_LENGTH = 12;

    private FeedbackIds() {
        // Private constructor to prevent instantiation
    }

    /**
     * Normalizes free text for hashing: trims, lowercases, collapses whitespace.
     *
     * Example:
     * Input:  "  Slow   Streaming\n responses "
     * Output: "slow streaming responses"
     */
    public static String normalizeText(String text) {
        if (text == null) {
            return "";
        }
        return text
                .trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " ");
    }

    /**
     * Builds an item id from its source type and the source-native key parts,
     * e.g. itemId(GITHUB_ISSUE, "googleapis", "python-genai", "42") -> "github-issue-googleapis-python-genai-42".
     */
    public static String itemId(SourceType sourceType, String... keyParts) {
        StringBuilder id = new StringBuilder(sourceType.getValue());
        for (String part : keyParts) {
            id.append('-').append(part.trim().replace('/', '-'));
        }
        return id.toString();
    }

    /**
     * Canonical group id derived from the normalized theme: "group-" + 12 hex chars of SHA-256.
     */
    public static String groupId(String theme) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(normalizeText(theme).getBytes(StandardCharsets.UTF_8));
            return "group-" + HexFormat.of().formatHex(hash).substring(0, GROUP_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * Reduces a language tag to its ISO 639-1 base: "pt-BR" -> "pt", "zh_CN" -> "zh", "EN" -> "en".
     */
    public static String normalizeLanguage(String language) {
        if (language == null || language.isBlank()) {
            return null;
        }
        String lower = language.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        int dash = lower.indexOf('-');
        return dash > 0 ? lower.substring(0, dash) : lower;
    }
}

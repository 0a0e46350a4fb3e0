package ru.tigran.feedbacksync.dto;

import java.util.Map;

/**
 * Translations of one item, keyed by target language code.
 */
public record TranslationResult(Map<String, String> translations, Map<String, String> titles) {
}

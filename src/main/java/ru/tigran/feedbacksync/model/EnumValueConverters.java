package ru.tigran.feedbacksync.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * JPA converters storing enums by their wire value ("github-issue", "bug-report")
 * so that rows stay readable by other clients of the shared store.
 */
public final class EnumValueConverters {

    private EnumValueConverters() {
    }

    @Converter(autoApply = true)
    public static class SourceTypeConverter implements AttributeConverter<SourceType, String> {
        @Override
        public String convertToDatabaseColumn(SourceType attribute) {
            return attribute == null ? null : attribute.getValue();
        }

        @Override
        public SourceType convertToEntityAttribute(String dbData) {
            if (dbData == null || dbData.isEmpty()) {
                return null;
            }
            try {
                return SourceType.fromValue(dbData);
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
    }

    @Converter(autoApply = true)
    public static class SentimentConverter implements AttributeConverter<Sentiment, String> {
        @Override
        public String convertToDatabaseColumn(Sentiment attribute) {
            return attribute == null ? null : attribute.getValue();
        }

        @Override
        public Sentiment convertToEntityAttribute(String dbData) {
            return dbData == null || dbData.isEmpty() ? null : Sentiment.fromValue(dbData);
        }
    }

    @Converter(autoApply = true)
    public static class FeedbackCategoryConverter implements AttributeConverter<FeedbackCategory, String> {
        @Override
        public String convertToDatabaseColumn(FeedbackCategory attribute) {
            return attribute == null ? null : attribute.getValue();
        }

        @Override
        public FeedbackCategory convertToEntityAttribute(String dbData) {
            return dbData == null || dbData.isEmpty() ? null : FeedbackCategory.fromValue(dbData);
        }
    }
}

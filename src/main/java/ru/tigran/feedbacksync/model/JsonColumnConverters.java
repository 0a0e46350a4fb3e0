package ru.tigran.feedbacksync.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * JPA конвертеры для JSON колонок (labels, translations, itemIds, watermarks).
 * Пустые коллекции пишутся как NULL, NULL читается как пустая изменяемая коллекция.
 */
@Slf4j
public final class JsonColumnConverters {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private JsonColumnConverters() {
    }

    abstract static class JsonConverter<T extends Map<?, ?>> implements AttributeConverter<T, String> {
        private final TypeReference<? extends T> typeReference;
        private final Supplier<T> emptyValue;

        JsonConverter(TypeReference<? extends T> typeReference, Supplier<T> emptyValue) {
            this.typeReference = typeReference;
            this.emptyValue = emptyValue;
        }

        @Override
        public String convertToDatabaseColumn(T attribute) {
            return attribute == null || attribute.isEmpty() ? null : write(attribute);
        }

        @Override
        public T convertToEntityAttribute(String dbData) {
            return dbData == null || dbData.isEmpty() ? emptyValue.get() : read(dbData, typeReference);
        }
    }

    abstract static class JsonCollectionConverter<T extends java.util.Collection<String>>
            implements AttributeConverter<T, String> {
        private final TypeReference<? extends T> typeReference;
        private final Supplier<T> emptyValue;

        JsonCollectionConverter(TypeReference<? extends T> typeReference, Supplier<T> emptyValue) {
            this.typeReference = typeReference;
            this.emptyValue = emptyValue;
        }

        @Override
        public String convertToDatabaseColumn(T attribute) {
            return attribute == null || attribute.isEmpty() ? null : write(attribute);
        }

        @Override
        public T convertToEntityAttribute(String dbData) {
            return dbData == null || dbData.isEmpty() ? emptyValue.get() : read(dbData, typeReference);
        }
    }

    @Converter
    public static class StringListConverter extends JsonCollectionConverter<List<String>> {
        public StringListConverter() {
            super(new TypeReference<ArrayList<String>>() {}, ArrayList::new);
        }
    }

    /**
     * Ordered set (insertion order is preserved in the JSON array).
     */
    @Converter
    public static class StringSetConverter extends JsonCollectionConverter<Set<String>> {
        public StringSetConverter() {
            super(new TypeReference<LinkedHashSet<String>>() {}, LinkedHashSet::new);
        }
    }

    @Converter
    public static class StringMapConverter extends JsonConverter<Map<String, String>> {
        public StringMapConverter() {
            super(new TypeReference<LinkedHashMap<String, String>>() {}, LinkedHashMap::new);
        }
    }

    @Converter
    public static class CountMapConverter extends JsonConverter<Map<String, Integer>> {
        public CountMapConverter() {
            super(new TypeReference<LinkedHashMap<String, Integer>>() {}, LinkedHashMap::new);
        }
    }

    @Converter
    public static class InstantMapConverter extends JsonConverter<Map<String, Instant>> {
        public InstantMapConverter() {
            super(new TypeReference<LinkedHashMap<String, Instant>>() {}, LinkedHashMap::new);
        }
    }

    private static String write(Object attribute) {
        try {
            return objectMapper.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            log.error("Error converting value to JSON", e);
            throw new IllegalStateException("Failed to convert value to JSON", e);
        }
    }

    private static <T> T read(String dbData, TypeReference<T> typeReference) {
        try {
            return objectMapper.readValue(dbData, typeReference);
        } catch (JsonProcessingException e) {
            log.error("Error converting JSON column: {}", dbData, e);
            throw new IllegalStateException("Failed to convert JSON column", e);
        }
    }
}

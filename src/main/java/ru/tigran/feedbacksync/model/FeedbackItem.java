package ru.tigran.feedbacksync.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Единица обратной связи, собранная из внешнего источника.
 *
 * Содержимое (title, content, author, counters) принадлежит источнику и обновляется при каждом fetch.
 * Поля анализа (sentiment, category, summary, groupId, analyzed, translations) принадлежат пайплайну
 * и переносятся из сохранённой версии при слиянии.
 */
@Entity
@Table(name = "feedback_items", indexes = {
    @Index(name = "idx_feedback_item_published", columnList = "published_at"),
    @Index(name = "idx_feedback_item_source", columnList = "source_type"),
    @Index(name = "idx_feedback_item_group", columnList = "group_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString(of = {"id", "sourceType", "title", "analyzed", "groupId"})
public class FeedbackItem {
    @Id
    @Column(length = 255)
    private String id;

    @Column(nullable = false, length = 40)
    private SourceType sourceType;

    @Column(length = 255)
    private String sourceId;

    @Column(length = 255)
    private String sourceName;

    @Column(columnDefinition = "TEXT")
    private String title;

    @Column(columnDefinition = "TEXT")
    private String content;

    private String author;

    private String authorHandle;

    @Column(length = 1024)
    private String authorAvatar;

    @Column(nullable = false)
    private Instant publishedAt;

    @Column(length = 2048)
    private String url;

    // ===== Analysis =====

    @Column(length = 20)
    private Sentiment sentiment;

    private Double sentimentConfidence;

    @Column(length = 40)
    private FeedbackCategory category;

    private Double categoryConfidence;

    @Column(columnDefinition = "TEXT")
    private String summary;  // One-sentence summary from classification

    @Column(length = 64)
    private String groupId;

    @Column(length = 16)
    private String language;  // ISO 639-1 code as reported by the source

    // ===== Engagement / thread metadata =====

    private int replyCount;

    private int reactionCount;

    @Column(name = "is_reply")
    private boolean reply;

    @Column(length = 255)
    private String parentId;

    @Convert(converter = JsonColumnConverters.StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> labels = new ArrayList<>();

    @Column(length = 20)
    private String state;  // GitHub issue state: open/closed

    private String repo;   // owner/repo for GitHub sourced items

    // ===== Flags =====

    private boolean analyzed;

    private boolean dismissed;

    // UI-only selection state, never persisted
    @Transient
    private boolean selected;

    // ===== Translations: language code -> text =====

    @Convert(converter = JsonColumnConverters.StringMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, String> translations = new LinkedHashMap<>();

    @Convert(converter = JsonColumnConverters.StringMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, String> translatedTitles = new LinkedHashMap<>();

    private Instant updatedAt;

    public boolean hasTranslations() {
        return translations != null && !translations.isEmpty();
    }

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = Instant.now();
    }
}

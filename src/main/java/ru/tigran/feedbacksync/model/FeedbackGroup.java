package ru.tigran.feedbacksync.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Тематический кластер элементов обратной связи.
 * itemCount всегда равен размеру itemIds.
 */
@Entity
@Table(name = "feedback_groups")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString(of = {"id", "theme", "itemCount"})
public class FeedbackGroup {
    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String theme;

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Column(length = 20)
    private Sentiment sentiment;

    @Column(length = 40)
    private FeedbackCategory category;

    @Convert(converter = JsonColumnConverters.StringSetConverter.class)
    @Column(columnDefinition = "TEXT")
    private Set<String> itemIds = new LinkedHashSet<>();

    private int itemCount;

    // source type value -> number of items
    @Convert(converter = JsonColumnConverters.CountMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Integer> sourceCounts = new LinkedHashMap<>();

    @Convert(converter = JsonColumnConverters.StringSetConverter.class)
    @Column(columnDefinition = "TEXT")
    private Set<String> languages = new LinkedHashSet<>();

    private Instant createdAt;

    private Instant updatedAt;

    public void setItemIds(Collection<String> ids) {
        this.itemIds = new LinkedHashSet<>(ids);
        this.itemCount = this.itemIds.size();
    }

    /**
     * Recomputes per-source counts and languages from the given members.
     */
    public void refreshStats(Collection<FeedbackItem> members) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Set<String> langs = new LinkedHashSet<>();
        for (FeedbackItem item : members) {
            if (item.getSourceType() != null) {
                counts.merge(item.getSourceType().getValue(), 1, Integer::sum);
            }
            if (item.getLanguage() != null && !item.getLanguage().isBlank()) {
                langs.add(item.getLanguage());
            }
        }
        this.sourceCounts = counts;
        this.languages = langs;
    }

    @PrePersist
    @PreUpdate
    void syncItemCount() {
        itemCount = itemIds == null ? 0 : itemIds.size();
    }
}

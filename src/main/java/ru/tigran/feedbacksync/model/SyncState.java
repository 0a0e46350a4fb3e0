package ru.tigran.feedbacksync.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Состояние инкрементальной синхронизации (одна строка).
 * Watermark источника - максимальный publishedAt среди его элементов, а не время синхронизации.
 */
@Entity
@Table(name = "sync_state")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class SyncState {
    public static final String SINGLETON_ID = "sync-state";

    @Id
    @Column(length = 32)
    private String id = SINGLETON_ID;

    // source type value -> watermark
    @Convert(converter = JsonColumnConverters.InstantMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Instant> watermarks = new LinkedHashMap<>();

    private Instant lastSync;

    public Instant getWatermark(SourceType sourceType) {
        return watermarks == null ? null : watermarks.get(sourceType.getValue());
    }

    public void setWatermark(SourceType sourceType, Instant watermark) {
        if (watermarks == null) {
            watermarks = new LinkedHashMap<>();
        }
        if (watermark == null) {
            watermarks.remove(sourceType.getValue());
        } else {
            watermarks.put(sourceType.getValue(), watermark);
        }
    }
}

package ru.tigran.feedbacksync.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.tigran.feedbacksync.dto.MergedGroupProposal;
import ru.tigran.feedbacksync.model.FeedbackCategory;
import ru.tigran.feedbacksync.model.FeedbackGroup;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.model.Sentiment;
import ru.tigran.feedbacksync.util.FeedbackIds;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reduce-шаг кластеризации: из batch-local групп и ответа консолидации строит канонические группы.
 *
 * Гарантии:
 * - каждый элемент batch-local группы попадает ровно в одну каноническую группу;
 * - batch-local группа, не упомянутая в ответе, становится канонической как есть;
 * - id, отсутствующие в анализируемом наборе, отбрасываются;
 * - id канонической группы стабилен (хэш темы), createdAt существующей группы сохраняется.
 */
@Slf4j
@Component
public class GroupConsolidator {

    private record Draft(String theme, String summary, Sentiment sentiment, FeedbackCategory category,
                         Set<String> itemIds) {
    }

    public List<FeedbackGroup> reconcile(
            List<FeedbackGroup> batchGroups,
            List<MergedGroupProposal> mergedGroups,
            Map<String, FeedbackItem> analyzedItems,
            Map<String, FeedbackGroup> previousGroups,
            Instant now
    ) {
        Map<String, FeedbackGroup> batchGroupsById = new LinkedHashMap<>();
        batchGroups.forEach(group -> batchGroupsById.put(group.getId(), group));

        List<Draft> drafts = new ArrayList<>();
        Set<String> referenced = new HashSet<>();
        for (MergedGroupProposal merged : mergedGroups) {
            Set<String> itemIds = new LinkedHashSet<>();
            for (String sourceGroupId : merged.originalGroupIds()) {
                FeedbackGroup source = batchGroupsById.get(sourceGroupId);
                if (source != null && referenced.add(sourceGroupId)) {
                    itemIds.addAll(source.getItemIds());
                }
            }
            itemIds.addAll(merged.itemIds());
            drafts.add(new Draft(merged.theme(), merged.summary(), merged.sentiment(), merged.category(), itemIds));
        }

        int singletons = 0;
        for (FeedbackGroup group : batchGroups) {
            if (!referenced.contains(group.getId())) {
                drafts.add(new Draft(group.getTheme(), group.getSummary(), group.getSentiment(),
                        group.getCategory(), new LinkedHashSet<>(group.getItemIds())));
                singletons++;
            }
        }

        Set<String> claimed = new HashSet<>();
        Map<String, FeedbackGroup> canonical = new LinkedHashMap<>();
        for (Draft draft : drafts) {
            List<String> members = new ArrayList<>();
            for (String itemId : draft.itemIds()) {
                if (analyzedItems.containsKey(itemId) && claimed.add(itemId)) {
                    members.add(itemId);
                }
            }
            if (members.isEmpty()) {
                continue;
            }
            String groupId = FeedbackIds.groupId(draft.theme());
            FeedbackGroup existing = canonical.get(groupId);
            if (existing != null) {
                // Same normalized theme emitted twice: fold into the first group
                Set<String> union = new LinkedHashSet<>(existing.getItemIds());
                union.addAll(members);
                existing.setItemIds(union);
                continue;
            }
            canonical.put(groupId, toGroup(groupId, draft, members, previousGroups.get(groupId), now));
        }

        for (FeedbackGroup group : canonical.values()) {
            group.refreshStats(group.getItemIds().stream().map(analyzedItems::get).toList());
        }
        log.debug("Reconciled {} batch groups ({} unreferenced) into {} canonical groups",
                batchGroups.size(), singletons, canonical.size());
        return new ArrayList<>(canonical.values());
    }

    private static FeedbackGroup toGroup(String groupId, Draft draft, List<String> members,
                                         FeedbackGroup previous, Instant now) {
        FeedbackGroup group = new FeedbackGroup();
        group.setId(groupId);
        group.setTheme(draft.theme());
        group.setSummary(draft.summary());
        group.setSentiment(draft.sentiment() != null ? draft.sentiment() : Sentiment.NEUTRAL);
        group.setCategory(draft.category() != null ? draft.category() : FeedbackCategory.OTHER);
        group.setItemIds(members);
        group.setCreatedAt(previous != null && previous.getCreatedAt() != null ? previous.getCreatedAt() : now);
        group.setUpdatedAt(now);
        return group;
    }
}

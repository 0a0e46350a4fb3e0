package ru.tigran.feedbacksync.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import ru.tigran.feedbacksync.dto.GroupProposal;
import ru.tigran.feedbacksync.dto.GroupingReport;
import ru.tigran.feedbacksync.dto.MergedGroupProposal;
import ru.tigran.feedbacksync.dto.SyncProgressListener;
import ru.tigran.feedbacksync.dto.SyncStage;
import ru.tigran.feedbacksync.exception.GroupingBatchException;
import ru.tigran.feedbacksync.model.FeedbackGroup;
import ru.tigran.feedbacksync.model.FeedbackItem;
import ru.tigran.feedbacksync.service.AIService;
import ru.tigran.feedbacksync.store.SharedStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Двухфазная кластеризация всего проанализированного набора.
 *
 * Фаза 1: батчи по 200 элементов, волнами, каждый батч даёт batch-local группы.
 * Фаза 2: один вызов консолидации объединяет дубликаты тем между батчами,
 * затем {@link GroupConsolidator} строит канонические группы.
 *
 * Политика хранения (supersede): предыдущие группы, не переизданные как канонические, удаляются,
 * а ссылающиеся на них элементы теряют groupId. Исключение - элементы из упавших батчей фазы 1:
 * они сохраняют groupId, а их группы остаются (урезанные до оставшихся участников).
 */
@Slf4j
@Component
public class FeedbackGrouper {

    private final AIService aiService;
    private final SharedStore sharedStore;
    private final WaveExecutor waveExecutor;
    private final GroupConsolidator consolidator;
    private final Clock clock;
    private final int batchSize;
    private final int waveWidth;

    public FeedbackGrouper(
            AIService aiService,
            SharedStore sharedStore,
            WaveExecutor waveExecutor,
            GroupConsolidator consolidator,
            Clock clock,
            @Value("${app.grouping.batch-size:200}") int batchSize,
            @Value("${app.grouping.wave-width:10}") int waveWidth
    ) {
        this.aiService = aiService;
        this.sharedStore = sharedStore;
        this.waveExecutor = waveExecutor;
        this.consolidator = consolidator;
        this.clock = clock;
        this.batchSize = batchSize;
        this.waveWidth = waveWidth;
    }

    /**
     * @param items the whole final item set; only analyzed items are clustered
     * @param previousGroups groups currently in the store
     */
    public GroupingReport group(List<FeedbackItem> items, List<FeedbackGroup> previousGroups,
                                SyncProgressListener listener) {
        List<FeedbackItem> analyzed = items.stream().filter(FeedbackItem::isAnalyzed).toList();
        Map<String, FeedbackItem> analyzedById = new LinkedHashMap<>();
        analyzed.forEach(item -> analyzedById.put(item.getId(), item));

        // ===== Phase 1: batch clustering =====
        List<List<FeedbackItem>> batches = WaveExecutor.partition(analyzed, batchSize);
        log.info("Grouping {} analyzed items in {} batches", analyzed.size(), batches.size());

        Map<Integer, List<FeedbackGroup>> groupsByBatch = new TreeMap<>();
        Set<String> itemsOfFailedBatches = new HashSet<>();
        AtomicInteger processed = new AtomicInteger();
        WaveExecutor.WaveSummary summary = waveExecutor.execute(
                "grouping",
                batches,
                waveWidth,
                aiService::group,
                (index, batch, cause) -> new GroupingBatchException(index, BatchAnalyzer.idsOf(batch), cause),
                outcome -> {
                    if (outcome.succeeded()) {
                        groupsByBatch.put(outcome.index(), toBatchGroups(outcome.index(), outcome.batch(), outcome.result()));
                    } else {
                        itemsOfFailedBatches.addAll(BatchAnalyzer.idsOf(outcome.batch()));
                    }
                    listener.onProgress(SyncStage.GROUPING, processed.addAndGet(outcome.batch().size()), analyzed.size());
                });

        List<FeedbackGroup> batchGroups = new ArrayList<>();
        groupsByBatch.values().forEach(batchGroups::addAll);
        if (batchGroups.isEmpty()) {
            log.warn("Grouping produced no groups ({} of {} batches failed), keeping existing groups",
                    summary.failedBatches(), summary.totalBatches());
            return new GroupingReport(true, analyzed.size(), 0, 0, summary.failedBatches(), false, 0);
        }

        // ===== Phase 2: consolidation =====
        List<MergedGroupProposal> merged = List.of();
        boolean consolidationFailed = false;
        if (batchGroups.size() >= 2) {
            listener.onProgress(SyncStage.CONSOLIDATION, 0, 1);
            try {
                merged = aiService.consolidate(batchGroups);
            } catch (RuntimeException e) {
                consolidationFailed = true;
                log.warn("Consolidation of {} batch groups failed, using them as canonical groups: {}",
                        batchGroups.size(), e.getMessage());
            }
            listener.onProgress(SyncStage.CONSOLIDATION, 1, 1);
        }

        Instant now = clock.instant();
        Map<String, FeedbackGroup> previousById = new LinkedHashMap<>();
        previousGroups.forEach(group -> previousById.put(group.getId(), group));
        List<FeedbackGroup> canonical = consolidator.reconcile(batchGroups, merged, analyzedById, previousById, now);

        int superseded = applyAssignments(items, canonical, previousById, itemsOfFailedBatches, now);
        log.info("Grouping finished: {} batch groups -> {} canonical groups, {} superseded, {}/{} batches failed",
                batchGroups.size(), canonical.size(), superseded, summary.failedBatches(), summary.totalBatches());
        return new GroupingReport(true, analyzed.size(), batchGroups.size(), canonical.size(),
                summary.failedBatches(), consolidationFailed, superseded);
    }

    /**
     * Rewrites item groupIds, persists groups and changed items, then deletes superseded groups.
     *
     * @return number of deleted groups
     */
    private int applyAssignments(List<FeedbackItem> items, List<FeedbackGroup> canonical,
                                 Map<String, FeedbackGroup> previousById, Set<String> protectedItemIds,
                                 Instant now) {
        Map<String, FeedbackGroup> canonicalById = new LinkedHashMap<>();
        Map<String, String> assignment = new LinkedHashMap<>();
        for (FeedbackGroup group : canonical) {
            canonicalById.put(group.getId(), group);
            group.getItemIds().forEach(itemId -> assignment.put(itemId, group.getId()));
        }

        Map<String, List<FeedbackItem>> membersByGroup = new LinkedHashMap<>();
        Set<String> retainedIds = new LinkedHashSet<>();
        List<FeedbackItem> changed = new ArrayList<>();
        for (FeedbackItem item : items) {
            String current = item.getGroupId();
            String target = assignment.get(item.getId());
            if (target == null && current != null && protectedItemIds.contains(item.getId())) {
                if (canonicalById.containsKey(current)) {
                    target = current;
                } else if (previousById.containsKey(current)) {
                    target = current;
                    retainedIds.add(current);
                }
            }
            if (!Objects.equals(current, target)) {
                item.setGroupId(target);
                changed.add(item);
            }
            if (target != null) {
                membersByGroup.computeIfAbsent(target, id -> new ArrayList<>()).add(item);
            }
        }

        List<FeedbackGroup> groupsToSave = new ArrayList<>(canonical);
        for (FeedbackGroup group : canonical) {
            syncMembers(group, membersByGroup.getOrDefault(group.getId(), List.of()), now);
        }
        for (String retainedId : retainedIds) {
            FeedbackGroup retained = previousById.get(retainedId);
            syncMembers(retained, membersByGroup.getOrDefault(retainedId, List.of()), now);
            groupsToSave.add(retained);
        }

        List<String> supersededIds = previousById.keySet().stream()
                .filter(id -> !canonicalById.containsKey(id) && !retainedIds.contains(id))
                .toList();

        sharedStore.saveGroups(groupsToSave);
        sharedStore.saveItems(changed);
        sharedStore.deleteGroups(supersededIds);
        log.debug("Group assignment changed for {} items, {} groups retained for failed batches",
                changed.size(), retainedIds.size());
        return supersededIds.size();
    }

    /**
     * Aligns itemIds and stats with the items that actually point at the group.
     */
    private static void syncMembers(FeedbackGroup group, List<FeedbackItem> members, Instant now) {
        Set<String> present = new HashSet<>(BatchAnalyzer.idsOf(members));
        Set<String> memberIds = new LinkedHashSet<>();
        group.getItemIds().stream().filter(present::contains).forEach(memberIds::add);
        members.forEach(member -> memberIds.add(member.getId()));
        if (!memberIds.equals(group.getItemIds())) {
            group.setItemIds(memberIds);
            group.setUpdatedAt(now);
        }
        group.refreshStats(members);
    }

    private static List<FeedbackGroup> toBatchGroups(int batchIndex, List<FeedbackItem> batch,
                                                     List<GroupProposal> proposals) {
        Set<String> batchIds = new HashSet<>(BatchAnalyzer.idsOf(batch));
        Set<String> claimed = new HashSet<>();
        List<FeedbackGroup> groups = new ArrayList<>();
        for (GroupProposal proposal : proposals) {
            List<String> itemIds = proposal.itemIds().stream()
                    .filter(id -> batchIds.contains(id) && claimed.add(id))
                    .toList();
            if (itemIds.isEmpty()) {
                continue;
            }
            FeedbackGroup group = new FeedbackGroup();
            group.setId("batch-" + batchIndex + "-" + groups.size());
            group.setTheme(proposal.theme());
            group.setSummary(proposal.summary());
            group.setSentiment(proposal.sentiment());
            group.setCategory(proposal.category());
            group.setItemIds(itemIds);
            groups.add(group);
        }
        return groups;
    }
}

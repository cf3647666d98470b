package no.cantara.ktree;

import no.cantara.ktree.model.KnowledgeEntry;
import no.cantara.ktree.model.Priority;
import no.cantara.ktree.store.EntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only summaries over the whole store: recent changes and an index of entries.
 * Unreadable entries are skipped.
 */
public class TreeOverview {

    private static final Logger log = LoggerFactory.getLogger(TreeOverview.class);

    private final EntryStore store;
    private final Clock clock;

    public TreeOverview(EntryStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Entries created or modified in the last {@code days} days, judged by their
     * {@code created_at} and {@code updated_at} stamps. An entry created in the window counts
     * as added; one created earlier and updated in the window counts as modified.
     */
    public RecentChanges recent(int days, RecentChanges.Filter filter, int limit) throws IOException {
        Instant to = clock.instant();
        Instant from = to.minus(Duration.ofDays(days));
        List<RecentChanges.Change> matches = new ArrayList<>();
        for (String key : store.listAll()) {
            KnowledgeEntry entry = readQuietly(key);
            if (entry == null) continue;
            RecentChanges.ChangeType type = classify(entry, from);
            if (type != null && filter.accepts(type)) {
                matches.add(new RecentChanges.Change(key, entry, type));
            }
        }
        matches.sort(Comparator.comparing(RecentChanges.Change::changedAt, Comparator.reverseOrder())
                .thenComparing(RecentChanges.Change::path));

        int added = (int) matches.stream().filter(c -> c.type() == RecentChanges.ChangeType.ADDED).count();
        List<RecentChanges.Change> shown = matches.subList(0, Math.min(limit, matches.size()));
        return new RecentChanges(from, to, matches.size(), added, matches.size() - added, shown);
    }

    /** Indexes the first {@code maxEntries} keys in key order. */
    public EntryIndex index(int maxEntries) throws IOException {
        List<String> keys = store.listAll().stream().sorted().toList();
        List<EntryIndex.Indexed> entries = new ArrayList<>();
        for (String key : keys.subList(0, Math.min(maxEntries, keys.size()))) {
            KnowledgeEntry entry = readQuietly(key);
            if (entry != null) {
                entries.add(new EntryIndex.Indexed(key, entry));
            }
        }

        Map<String, Integer> byPriority = new LinkedHashMap<>();
        for (Priority p : Priority.values()) byPriority.put(p.value(), 0);
        Map<String, Integer> byCategory = new TreeMap<>();
        int withRelationships = 0;
        int withCode = 0;
        for (EntryIndex.Indexed indexed : entries) {
            KnowledgeEntry entry = indexed.entry();
            if (entry.priority() != null) byPriority.merge(entry.priority().value(), 1, Integer::sum);
            byCategory.merge(indexed.category(), 1, Integer::sum);
            if (!entry.relatedTo().isEmpty()) withRelationships++;
            if (entry.code() != null && !entry.code().isEmpty()) withCode++;
        }
        return new EntryIndex(keys.size(), entries, byPriority, byCategory, withRelationships, withCode);
    }

    private static RecentChanges.ChangeType classify(KnowledgeEntry entry, Instant from) {
        Instant created = entry.createdAt();
        Instant updated = entry.updatedAt();
        if (created != null && !created.isBefore(from)) {
            return RecentChanges.ChangeType.ADDED;
        }
        if (updated != null && !updated.isBefore(from) && !updated.equals(created)) {
            return RecentChanges.ChangeType.MODIFIED;
        }
        return null;
    }

    private KnowledgeEntry readQuietly(String key) {
        try {
            return store.read(key);
        } catch (IOException | KnowledgeTreeException e) {
            log.debug("Skipping unreadable entry {}: {}", key, e.getMessage());
            return null;
        }
    }
}

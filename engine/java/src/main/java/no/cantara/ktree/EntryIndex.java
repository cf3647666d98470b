package no.cantara.ktree;

import no.cantara.ktree.model.KnowledgeEntry;

import java.util.List;
import java.util.Map;

/**
 * Overview of the stored entries, in key order.
 *
 * @param total             number of keys in the store
 * @param entries           the readable entries among the first {@code maxEntries} keys
 * @param byPriority        entry count per priority wire value, every priority present
 * @param byCategory        entry count per category (see {@link #categoryOf(String)})
 * @param withRelationships entries with at least one relation
 * @param withCode          entries carrying a code snippet
 */
public record EntryIndex(int total, List<Indexed> entries, Map<String, Integer> byPriority,
                         Map<String, Integer> byCategory, int withRelationships, int withCode) {

    public static final String ROOT_CATEGORY = "root";

    public EntryIndex {
        entries = List.copyOf(entries);
        byPriority = Map.copyOf(byPriority);
        byCategory = Map.copyOf(byCategory);
    }

    public record Indexed(String path, KnowledgeEntry entry) {

        public String category() {
            return categoryOf(path);
        }
    }

    /** The directory part of a key, or {@value #ROOT_CATEGORY} for top-level entries. */
    public static String categoryOf(String key) {
        int slash = key.lastIndexOf('/');
        return slash > 0 ? key.substring(0, slash) : ROOT_CATEGORY;
    }
}

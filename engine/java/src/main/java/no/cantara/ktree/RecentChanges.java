package no.cantara.ktree;

import no.cantara.ktree.model.KnowledgeEntry;

import java.time.Instant;
import java.util.List;

/**
 * Entries added or modified within a time window, newest first.
 *
 * @param from    start of the window, inclusive
 * @param to      end of the window (the time of the query)
 * @param total   number of matching changes before the limit was applied
 * @param added   matching entries created in the window
 * @param modified matching entries only modified in the window
 * @param changes at most {@code limit} matching changes
 */
public record RecentChanges(Instant from, Instant to, int total, int added, int modified, List<Change> changes) {

    public RecentChanges {
        changes = List.copyOf(changes);
    }

    public enum ChangeType {
        ADDED("added"), MODIFIED("modified");

        private final String value;

        ChangeType(String value) { this.value = value; }

        public String value() { return value; }
    }

    /** Which changes a query selects. */
    public enum Filter {
        ALL, ADDED, MODIFIED;

        boolean accepts(ChangeType type) {
            return this == ALL || name().equals(type.name());
        }
    }

    public record Change(String path, KnowledgeEntry entry, ChangeType type) {

        /** The instant the change is ordered by. */
        public Instant changedAt() {
            return entry.updatedAt() != null ? entry.updatedAt() : entry.createdAt();
        }
    }
}

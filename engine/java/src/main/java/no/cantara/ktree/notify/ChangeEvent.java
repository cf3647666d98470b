package no.cantara.ktree.notify;

import no.cantara.ktree.model.KnowledgeEntry;

/**
 * A change to the store, delivered after the mutation has been written.
 *
 * @param type    what happened
 * @param path    key of the affected entry (the new key for moves)
 * @param oldPath previous key, only for moves
 * @param entry   entry content, absent for deletions
 */
public record ChangeEvent(
        Type type,
        String path,
        String oldPath,
        KnowledgeEntry entry
) {
    public enum Type {
        ENTRY_ADDED("entryAdded"),
        ENTRY_UPDATED("entryUpdated"),
        ENTRY_DELETED("entryDeleted"),
        ENTRY_MOVED("entryMoved");

        private final String value;

        Type(String value) { this.value = value; }

        public String value() { return value; }
    }

    public static ChangeEvent added(String path, KnowledgeEntry entry) {
        return new ChangeEvent(Type.ENTRY_ADDED, path, null, entry);
    }

    public static ChangeEvent updated(String path, KnowledgeEntry entry) {
        return new ChangeEvent(Type.ENTRY_UPDATED, path, null, entry);
    }

    public static ChangeEvent deleted(String path) {
        return new ChangeEvent(Type.ENTRY_DELETED, path, null, null);
    }

    public static ChangeEvent moved(String oldPath, String newPath, KnowledgeEntry entry) {
        return new ChangeEvent(Type.ENTRY_MOVED, newPath, oldPath, entry);
    }
}

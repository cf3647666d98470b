package no.cantara.ktree.store;

import no.cantara.ktree.model.KnowledgeEntry;

import java.io.IOException;
import java.util.List;

/**
 * Keyed access to stored entries. Keys are normalized entry paths (see {@link EntryPaths}).
 *
 * <p>Implementations do not cache: every call observes the backing store as of that call.
 */
public interface EntryStore {

    boolean exists(String key) throws IOException;

    /**
     * @throws no.cantara.ktree.EntryNotFoundException  if no entry is stored at {@code key}
     * @throws no.cantara.ktree.MalformedEntryException if the stored content is not a valid entry
     */
    KnowledgeEntry read(String key) throws IOException;

    /** Creates or overwrites the entry at {@code key}, creating parent containers as needed. */
    void write(String key, KnowledgeEntry entry) throws IOException;

    /**
     * @throws no.cantara.ktree.EntryNotFoundException if no entry is stored at {@code key}
     */
    void delete(String key) throws IOException;

    /** All entry keys in the store, in no particular order. */
    List<String> listAll() throws IOException;
}

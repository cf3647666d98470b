package no.cantara.ktree;

import no.cantara.ktree.model.KnowledgeEntry;
import no.cantara.ktree.model.Relation;
import no.cantara.ktree.store.EntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Store-wide scans that find entries holding relations to a given key.
 *
 * <p>Each scan lists the whole store and handles entries one at a time. A failure on one entry
 * is logged, reported and skipped. The scan is not isolated from concurrent writers.
 */
public class ReferenceRewriter {

    private static final Logger log = LoggerFactory.getLogger(ReferenceRewriter.class);

    private final EntryStore store;

    public ReferenceRewriter(EntryStore store) {
        this.store = store;
    }

    /**
     * Points every relation targeting {@code oldKey} at {@code newKey}. Entries are written
     * back only when at least one relation changed.
     */
    public SideEffectReport rewrite(String oldKey, String newKey) throws IOException {
        SideEffectReport.Builder report = new SideEffectReport.Builder();
        for (String key : store.listAll()) {
            if (key.equals(oldKey) || key.equals(newKey)) continue;
            try {
                KnowledgeEntry entry = store.read(key);
                if (!entry.hasRelationTo(oldKey)) continue;
                List<Relation> relations = new ArrayList<>(entry.relatedTo().size());
                for (Relation r : entry.relatedTo()) {
                    relations.add(r.targets(oldKey) ? r.withPath(newKey) : r);
                }
                store.write(key, entry.withRelatedTo(relations));
                report.modified(key);
            } catch (IOException | KnowledgeTreeException e) {
                log.warn("Failed to update references in {}: {}", key, e.getMessage());
                report.failed(key, SideEffectFailure.Stage.REFERENCE_REWRITE, e);
            }
        }
        SideEffectReport result = report.build();
        log.debug("Rewrote references {} -> {} in {} entries", oldKey, newKey, result.modifiedCount());
        return result;
    }

    /**
     * Removes every relation targeting {@code deadKey}. Entries are written back only when
     * their relation list shrank.
     */
    public SideEffectReport strip(String deadKey) throws IOException {
        SideEffectReport.Builder report = new SideEffectReport.Builder();
        for (String key : store.listAll()) {
            if (key.equals(deadKey)) continue;
            try {
                KnowledgeEntry entry = store.read(key);
                KnowledgeEntry stripped = entry.withoutRelationsTo(deadKey);
                if (stripped.relatedTo().size() < entry.relatedTo().size()) {
                    store.write(key, stripped);
                    report.modified(key);
                }
            } catch (IOException | KnowledgeTreeException e) {
                log.warn("Failed to strip references to {} from {}: {}", deadKey, key, e.getMessage());
                report.failed(key, SideEffectFailure.Stage.REFERENCE_STRIP, e);
            }
        }
        return report.build();
    }

    /**
     * Keys of entries, other than {@code key} itself, holding at least one relation to it.
     * Unreadable entries are skipped.
     */
    public List<String> incomingSources(String key) throws IOException {
        List<String> sources = new ArrayList<>();
        for (String candidate : store.listAll()) {
            if (candidate.equals(key)) continue;
            try {
                if (store.read(candidate).hasRelationTo(key)) {
                    sources.add(candidate);
                }
            } catch (IOException | KnowledgeTreeException e) {
                log.debug("Skipping unreadable entry {} while counting references: {}", candidate, e.getMessage());
            }
        }
        return sources;
    }

    public int countIncoming(String key) throws IOException {
        return incomingSources(key).size();
    }
}

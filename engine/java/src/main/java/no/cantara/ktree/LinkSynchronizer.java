package no.cantara.ktree;

import no.cantara.ktree.model.KnowledgeEntry;
import no.cantara.ktree.model.Relation;
import no.cantara.ktree.store.EntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;

/**
 * Maintains mirror links for symmetric relationship kinds.
 *
 * <p>Every method is idempotent and best-effort: a target that is missing, malformed or cannot
 * be written is logged and reported, and the next relation is processed. Directional kinds are
 * ignored.
 */
public class LinkSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(LinkSynchronizer.class);

    private final EntryStore store;

    public LinkSynchronizer(EntryStore store) {
        this.store = store;
    }

    /**
     * Mirrors every symmetric relation of {@code source} onto its target.
     */
    public SideEffectReport sync(String sourceKey, KnowledgeEntry source) {
        return addMirrors(sourceKey, source.relatedTo());
    }

    /**
     * For each symmetric relation, appends {@code target -> sourceKey} with the same kind and
     * description unless the target already links back to the source.
     */
    public SideEffectReport addMirrors(String sourceKey, Collection<Relation> relations) {
        SideEffectReport.Builder report = new SideEffectReport.Builder();
        for (Relation relation : relations) {
            if (!relation.relationship().isSymmetric() || relation.targets(sourceKey)) continue;
            String target = relation.path();
            try {
                KnowledgeEntry targetEntry = store.read(target);
                if (targetEntry.hasRelationTo(sourceKey)) continue;
                store.write(target, targetEntry.withRelation(
                        new Relation(sourceKey, relation.relationship(), relation.description())));
                report.modified(target);
                log.debug("Mirrored {} {} {}", target, relation.relationship(), sourceKey);
            } catch (IOException | KnowledgeTreeException e) {
                log.warn("Could not mirror {} link from {} onto {}: {}",
                        relation.relationship(), sourceKey, target, e.getMessage());
                report.failed(target, SideEffectFailure.Stage.MIRROR_ADD, e);
            }
        }
        return report.build();
    }

    /**
     * For each symmetric relation, removes every relation on the target that points back at
     * {@code sourceKey}.
     */
    public SideEffectReport removeMirrors(String sourceKey, Collection<Relation> relations) {
        SideEffectReport.Builder report = new SideEffectReport.Builder();
        for (Relation relation : relations) {
            if (!relation.relationship().isSymmetric() || relation.targets(sourceKey)) continue;
            String target = relation.path();
            try {
                KnowledgeEntry targetEntry = store.read(target);
                if (!targetEntry.hasRelationTo(sourceKey)) continue;
                store.write(target, targetEntry.withoutRelationsTo(sourceKey));
                report.modified(target);
                log.debug("Removed mirror {} -> {}", target, sourceKey);
            } catch (IOException | KnowledgeTreeException e) {
                log.warn("Could not remove mirror of {} from {}: {}", sourceKey, target, e.getMessage());
                report.failed(target, SideEffectFailure.Stage.MIRROR_REMOVE, e);
            }
        }
        return report.build();
    }
}

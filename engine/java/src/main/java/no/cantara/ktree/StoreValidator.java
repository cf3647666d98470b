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
 * Checks stored entries for field problems, broken links and missing mirror links, and
 * optionally repairs missing mirrors. Repair is idempotent.
 */
public class StoreValidator {

    private static final Logger log = LoggerFactory.getLogger(StoreValidator.class);

    private final EntryStore store;
    private final LinkSynchronizer links;

    public StoreValidator(EntryStore store, LinkSynchronizer links) {
        this.store = store;
        this.links = links;
    }

    public ValidationReport validate(List<String> keys, boolean fix) {
        List<String> issues = new ArrayList<>();
        int fixed = 0;
        for (String key : keys) {
            KnowledgeEntry entry;
            try {
                entry = store.read(key);
            } catch (IOException | KnowledgeTreeException e) {
                issues.add(key + ": cannot read entry - " + e.getMessage());
                continue;
            }
            EntryValidator.requiredFieldProblems(entry).forEach(p -> issues.add(key + ": " + p));

            for (Relation link : entry.relatedTo()) {
                KnowledgeEntry target;
                try {
                    if (!store.exists(link.path())) {
                        issues.add(key + ": broken link to " + link.path());
                        continue;
                    }
                    target = store.read(link.path());
                } catch (IOException | KnowledgeTreeException e) {
                    issues.add(key + ": cannot check link to " + link.path() + " - " + e.getMessage());
                    continue;
                }
                if (!link.relationship().isSymmetric() || target.hasRelationTo(key)) continue;

                if (!fix) {
                    issues.add(key + ": missing mirror " + link.relationship().value() + " link on " + link.path());
                    continue;
                }
                SideEffectReport repair = links.addMirrors(key, List.of(link));
                if (repair.isComplete()) {
                    fixed += repair.modifiedCount();
                } else {
                    issues.add(key + ": cannot fix mirror link on " + link.path());
                }
            }
        }
        if (fixed > 0) {
            log.info("Added {} missing mirror link(s)", fixed);
        }
        return new ValidationReport(keys.size(), issues, fixed);
    }
}

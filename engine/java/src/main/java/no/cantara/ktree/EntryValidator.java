package no.cantara.ktree;

import no.cantara.ktree.model.EntryPatch;
import no.cantara.ktree.model.KnowledgeEntry;
import no.cantara.ktree.model.Priority;
import no.cantara.ktree.model.Relation;
import no.cantara.ktree.store.EntryStore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Field and reference rules shared by create, update and store validation. Every method
 * collects all problems rather than stopping at the first.
 */
public final class EntryValidator {

    private EntryValidator() {}

    /**
     * Problems with an entry's own fields: priority, problem and solution are required, and a
     * title, when given, must not be blank.
     */
    public static List<String> requiredFieldProblems(KnowledgeEntry entry) {
        List<String> errors = new ArrayList<>();
        if (entry.title() != null && entry.title().isBlank()) {
            errors.add("'title' must be non-empty when given");
        }
        if (entry.priority() == null) {
            errors.add("'priority' is required, one of " + Priority.wireValues());
        }
        if (isBlank(entry.problem())) {
            errors.add("'problem' is required and must be non-empty");
        }
        if (isBlank(entry.solution())) {
            errors.add("'solution' is required and must be non-empty");
        }
        return errors;
    }

    /**
     * Full check for a new entry at {@code key}: required fields plus every relation target
     * must already exist.
     */
    public static List<String> validateNew(String key, KnowledgeEntry entry, EntryStore store) throws IOException {
        List<String> errors = requiredFieldProblems(entry);
        errors.addAll(missingTargets(key, entry.relatedTo(), store));
        return errors;
    }

    /**
     * Checks only the fields present in {@code patch}.
     */
    public static List<String> validatePatch(String key, EntryPatch patch, EntryStore store) throws IOException {
        List<String> errors = new ArrayList<>();
        if (patch.title() != null && patch.title().isBlank()) {
            errors.add("'title' must be a non-empty string");
        }
        if (patch.problem() != null && patch.problem().isBlank()) {
            errors.add("'problem' must be a non-empty string");
        }
        if (patch.solution() != null && patch.solution().isBlank()) {
            errors.add("'solution' must be a non-empty string");
        }
        if (patch.relatedTo() != null) {
            errors.addAll(missingTargets(key, patch.relatedTo(), store));
        }
        return errors;
    }

    static List<String> missingTargets(String key, List<Relation> relations, EntryStore store) throws IOException {
        List<String> errors = new ArrayList<>();
        for (Relation r : relations) {
            if (r.targets(key)) {
                errors.add("An entry cannot be related to itself: " + key);
            } else if (!store.exists(r.path())) {
                errors.add("Related entry does not exist: " + r.path());
            }
        }
        return errors;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}

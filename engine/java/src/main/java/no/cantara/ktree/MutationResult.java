package no.cantara.ktree;

import no.cantara.ktree.model.KnowledgeEntry;

import java.util.List;

/**
 * Successful outcome of a mutation. Side effects on other entries are best-effort; any that did
 * not complete are listed in {@code failures} and make the result partial.
 *
 * @param operation    the mutation performed
 * @param path         key of the affected entry after the operation
 * @param previousPath key before a move, otherwise {@code null}
 * @param entry        content as written, {@code null} for deletions
 * @param warnings     non-fatal notes for the caller
 * @param sideEffects  other entries touched by mirror sync or reference rewriting
 */
public record MutationResult(
        Operation operation,
        String path,
        String previousPath,
        KnowledgeEntry entry,
        List<String> warnings,
        SideEffectReport sideEffects
) {
    public enum Operation { CREATE, UPDATE, DELETE, MOVE, LINK, UNLINK }

    public MutationResult {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        sideEffects = sideEffects != null ? sideEffects : SideEffectReport.EMPTY;
    }

    public boolean moved() {
        return previousPath != null && !previousPath.equals(path);
    }

    /** True when some side effect did not complete for every affected entry. */
    public boolean isPartial() {
        return !sideEffects.isComplete();
    }

    public List<SideEffectFailure> failures() {
        return sideEffects.failures();
    }
}

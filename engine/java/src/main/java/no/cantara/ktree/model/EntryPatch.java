package no.cantara.ktree.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A field-level update to an entry. A {@code null} component means the field is not part of
 * the patch and keeps its current value. An empty {@code relatedTo} list removes all relations.
 */
public record EntryPatch(
        String title,
        String slug,
        Priority priority,
        String category,
        List<String> tags,
        String problem,
        String context,
        String solution,
        List<KnowledgeExample> examples,
        String code,
        List<Relation> relatedTo,
        String author,
        String version
) {
    public EntryPatch {
        tags = tags != null ? List.copyOf(tags) : null;
        examples = examples != null ? List.copyOf(examples) : null;
        relatedTo = relatedTo != null ? List.copyOf(relatedTo) : null;
    }

    public static EntryPatch empty() {
        return new EntryPatch(null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public static EntryPatch relations(List<Relation> relatedTo) {
        return new EntryPatch(null, null, null, null, null, null, null, null, null, null, relatedTo, null, null);
    }

    public static EntryPatch solution(String solution) {
        return new EntryPatch(null, null, null, null, null, null, null, solution, null, null, null, null, null);
    }

    public boolean replacesRelations() {
        return relatedTo != null;
    }

    /**
     * Applies every present field to {@code current} and stamps {@code updatedAt}.
     */
    public KnowledgeEntry applyTo(KnowledgeEntry current, Instant now) {
        KnowledgeEntry.Builder b = current.toBuilder();
        if (title != null) b.title(title);
        if (slug != null) b.slug(slug);
        if (priority != null) b.priority(priority);
        if (category != null) b.category(category);
        if (tags != null) b.tags(tags);
        if (problem != null) b.problem(problem);
        if (context != null) b.context(context);
        if (solution != null) b.solution(solution);
        if (examples != null) b.examples(examples);
        if (code != null) b.code(code);
        if (relatedTo != null) b.relatedTo(relatedTo);
        if (author != null) b.author(author);
        if (version != null) b.version(version);
        return b.updatedAt(now).build();
    }

    /** Stored names of the fields this patch touches, for reporting. */
    public List<String> fieldNames() {
        List<String> names = new ArrayList<>();
        if (title != null) names.add("title");
        if (slug != null) names.add("slug");
        if (priority != null) names.add("priority");
        if (category != null) names.add("category");
        if (tags != null) names.add("tags");
        if (problem != null) names.add("problem");
        if (context != null) names.add("context");
        if (solution != null) names.add("solution");
        if (examples != null) names.add("examples");
        if (code != null) names.add("code");
        if (relatedTo != null) names.add("related_to");
        if (author != null) names.add("author");
        if (version != null) names.add("version");
        return names;
    }
}

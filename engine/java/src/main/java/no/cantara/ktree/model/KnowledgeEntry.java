package no.cantara.ktree.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A single knowledge document. The entry does not know its own key; the store addresses
 * it by path.
 */
public record KnowledgeEntry(
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
        Instant createdAt,
        Instant updatedAt,
        String version
) {
    public KnowledgeEntry {
        // tags behave as an ordered set
        tags = tags != null ? List.copyOf(new LinkedHashSet<>(tags)) : List.of();
        examples = examples != null ? List.copyOf(examples) : List.of();
        relatedTo = relatedTo != null ? List.copyOf(relatedTo) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .title(title)
                .slug(slug)
                .priority(priority)
                .category(category)
                .tags(tags)
                .problem(problem)
                .context(context)
                .solution(solution)
                .examples(examples)
                .code(code)
                .relatedTo(relatedTo)
                .author(author)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .version(version);
    }

    public KnowledgeEntry withRelatedTo(List<Relation> relations) {
        return toBuilder().relatedTo(relations).build();
    }

    public boolean hasRelationTo(String path) {
        return relatedTo.stream().anyMatch(r -> r.targets(path));
    }

    /**
     * Returns a copy with {@code relation} appended.
     */
    public KnowledgeEntry withRelation(Relation relation) {
        List<Relation> relations = new ArrayList<>(relatedTo);
        relations.add(relation);
        return withRelatedTo(relations);
    }

    /**
     * Returns a copy without any relation targeting {@code path}.
     */
    public KnowledgeEntry withoutRelationsTo(String path) {
        return withRelatedTo(relatedTo.stream().filter(r -> !r.targets(path)).toList());
    }

    public static final class Builder {
        private String title;
        private String slug;
        private Priority priority;
        private String category;
        private List<String> tags;
        private String problem;
        private String context;
        private String solution;
        private List<KnowledgeExample> examples;
        private String code;
        private List<Relation> relatedTo;
        private String author;
        private Instant createdAt;
        private Instant updatedAt;
        private String version;

        private Builder() {}

        public Builder title(String title) { this.title = title; return this; }
        public Builder slug(String slug) { this.slug = slug; return this; }
        public Builder priority(Priority priority) { this.priority = priority; return this; }
        public Builder category(String category) { this.category = category; return this; }
        public Builder tags(List<String> tags) { this.tags = tags; return this; }
        public Builder problem(String problem) { this.problem = problem; return this; }
        public Builder context(String context) { this.context = context; return this; }
        public Builder solution(String solution) { this.solution = solution; return this; }
        public Builder examples(List<KnowledgeExample> examples) { this.examples = examples; return this; }
        public Builder code(String code) { this.code = code; return this; }
        public Builder relatedTo(List<Relation> relatedTo) { this.relatedTo = relatedTo; return this; }
        public Builder author(String author) { this.author = author; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder version(String version) { this.version = version; return this; }

        public KnowledgeEntry build() {
            return new KnowledgeEntry(title, slug, priority, category, tags, problem, context,
                    solution, examples, code, relatedTo, author, createdAt, updatedAt, version);
        }
    }
}

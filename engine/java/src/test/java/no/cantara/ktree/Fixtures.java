package no.cantara.ktree;

import no.cantara.ktree.model.KnowledgeEntry;
import no.cantara.ktree.model.Priority;
import no.cantara.ktree.model.Relation;
import no.cantara.ktree.model.RelationshipType;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/** Shared test data. */
final class Fixtures {

    static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private Fixtures() {}

    static KnowledgeEntry entry(String problem, Relation... relations) {
        return KnowledgeEntry.builder()
                .title(problem)
                .priority(Priority.COMMON)
                .problem(problem)
                .solution("Solution for " + problem)
                .relatedTo(List.of(relations))
                .build();
    }

    static Relation related(String path) {
        return new Relation(path, RelationshipType.RELATED);
    }

    static Relation rel(String path, RelationshipType type) {
        return new Relation(path, type);
    }
}

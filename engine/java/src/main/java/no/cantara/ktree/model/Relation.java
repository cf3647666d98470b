package no.cantara.ktree.model;

import java.util.Objects;

/**
 * A typed, outgoing edge stored on the source entry's {@code related_to} list.
 *
 * @param path         key of the target entry
 * @param relationship relationship kind
 * @param description  optional annotation, may be {@code null}
 */
public record Relation(
        String path,
        RelationshipType relationship,
        String description
) {
    public Relation {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(relationship, "relationship");
    }

    public Relation(String path, RelationshipType relationship) {
        this(path, relationship, null);
    }

    public boolean targets(String key) {
        return path.equals(key);
    }

    public Relation withPath(String newPath) {
        return new Relation(newPath, relationship, description);
    }
}

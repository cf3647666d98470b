package no.cantara.ktree.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The closed set of relationship kinds between entries.
 *
 * <p>Symmetric kinds are undirected: a relation A&rarr;B of a symmetric kind implies B&rarr;A
 * of the same kind, and the engine maintains that mirror. Directional kinds have an inverse
 * kind, but the inverse edge is never created automatically.
 */
public enum RelationshipType {
    RELATED("related", true),
    SUPERSEDES("supersedes", false),
    SUPERSEDED_BY("superseded_by", false),
    CONFLICTS_WITH("conflicts_with", true),
    IMPLEMENTS("implements", false),
    IMPLEMENTED_BY("implemented_by", false);

    private final String value;
    private final boolean symmetric;

    RelationshipType(String value, boolean symmetric) {
        this.value = value;
        this.symmetric = symmetric;
    }

    public String value() { return value; }

    public boolean isSymmetric() { return symmetric; }

    /**
     * The inverse kind. Symmetric kinds are their own inverse.
     */
    public RelationshipType inverse() {
        return switch (this) {
            case RELATED -> RELATED;
            case CONFLICTS_WITH -> CONFLICTS_WITH;
            case SUPERSEDES -> SUPERSEDED_BY;
            case SUPERSEDED_BY -> SUPERSEDES;
            case IMPLEMENTS -> IMPLEMENTED_BY;
            case IMPLEMENTED_BY -> IMPLEMENTS;
        };
    }

    public boolean isInverseOf(RelationshipType other) {
        return other != null && inverse() == other;
    }

    public static Optional<RelationshipType> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(t -> t.value.equals(value)).findFirst();
    }

    public static List<String> wireValues() {
        return Arrays.stream(values()).map(RelationshipType::value).toList();
    }

    @Override
    public String toString() { return value; }
}

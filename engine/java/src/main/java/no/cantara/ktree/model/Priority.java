package no.cantara.ktree.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Priority level of a knowledge entry, in order of importance.
 */
public enum Priority {
    CRITICAL("CRITICAL", 4),
    REQUIRED("REQUIRED", 3),
    COMMON("COMMON", 2),
    EDGE_CASE("EDGE-CASE", 1);

    private final String value;
    private final int weight;

    Priority(String value, int weight) {
        this.value = value;
        this.weight = weight;
    }

    /** The value as it appears in stored documents. */
    public String value() { return value; }

    /** Higher is more important. */
    public int weight() { return weight; }

    public static Optional<Priority> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(p -> p.value.equals(value)).findFirst();
    }

    public static List<String> wireValues() {
        return Arrays.stream(values()).map(Priority::value).toList();
    }

    @Override
    public String toString() { return value; }
}

package no.cantara.ktree;

import java.util.List;

/**
 * Result of checking stored entries.
 *
 * @param checked number of entries examined
 * @param issues  problems found, one line each, prefixed by the entry key
 * @param fixed   number of missing mirror links that were added
 */
public record ValidationReport(int checked, List<String> issues, int fixed) {

    public ValidationReport {
        issues = List.copyOf(issues);
    }

    public boolean isValid() { return issues.isEmpty(); }
}

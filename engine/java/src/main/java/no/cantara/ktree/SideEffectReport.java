package no.cantara.ktree;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a best-effort pass over other entries.
 *
 * @param modified keys of entries that were rewritten
 * @param failures entries the pass could not process
 */
public record SideEffectReport(List<String> modified, List<SideEffectFailure> failures) {

    public static final SideEffectReport EMPTY = new SideEffectReport(List.of(), List.of());

    public SideEffectReport {
        modified = List.copyOf(modified);
        failures = List.copyOf(failures);
    }

    public int modifiedCount() { return modified.size(); }

    public boolean isComplete() { return failures.isEmpty(); }

    public SideEffectReport merge(SideEffectReport other) {
        List<String> m = new ArrayList<>(modified);
        other.modified.stream().filter(k -> !m.contains(k)).forEach(m::add);
        List<SideEffectFailure> f = new ArrayList<>(failures);
        f.addAll(other.failures);
        return new SideEffectReport(m, f);
    }

    /** Mutable accumulator used while a pass is running. */
    static final class Builder {
        private final List<String> modified = new ArrayList<>();
        private final List<SideEffectFailure> failures = new ArrayList<>();

        void modified(String key) {
            if (!modified.contains(key)) modified.add(key);
        }

        void failed(String key, SideEffectFailure.Stage stage, Exception cause) {
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            failures.add(new SideEffectFailure(key, stage, message));
        }

        SideEffectReport build() {
            return new SideEffectReport(modified, failures);
        }
    }
}

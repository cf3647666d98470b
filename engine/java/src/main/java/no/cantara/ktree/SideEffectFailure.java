package no.cantara.ktree;

import java.util.Locale;

/**
 * A best-effort side effect that did not complete for one entry. The primary mutation it
 * belongs to still succeeded.
 *
 * @param path    key of the entry the side effect was applied to
 * @param stage   which side effect failed
 * @param message cause, for humans
 */
public record SideEffectFailure(String path, Stage stage, String message) {

    public enum Stage { MIRROR_ADD, MIRROR_REMOVE, REFERENCE_REWRITE, REFERENCE_STRIP }

    @Override
    public String toString() {
        return stage.name().toLowerCase(Locale.ROOT) + " failed for " + path + ": " + message;
    }
}

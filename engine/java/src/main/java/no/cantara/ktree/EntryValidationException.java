package no.cantara.ktree;

import java.util.List;

/**
 * Thrown when an entry, patch or path fails validation. Carries every problem found, not just
 * the first.
 */
public class EntryValidationException extends KnowledgeTreeException {

    private final List<String> errors;

    public EntryValidationException(List<String> errors) {
        super(ErrorKind.VALIDATION, "Validation failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public EntryValidationException(String error) {
        this(List.of(error));
    }

    public List<String> errors() { return errors; }
}

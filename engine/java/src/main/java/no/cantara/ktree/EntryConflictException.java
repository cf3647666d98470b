package no.cantara.ktree;

/** Thrown when a create or move cannot claim the key it targets. */
public class EntryConflictException extends KnowledgeTreeException {

    private final String path;

    public EntryConflictException(String path, String message) {
        super(ErrorKind.CONFLICT, message);
        this.path = path;
    }

    public String path() { return path; }
}

package no.cantara.ktree;

/** Thrown when the target entry of an operation does not exist. */
public class EntryNotFoundException extends KnowledgeTreeException {

    private final String path;

    public EntryNotFoundException(String path) {
        this(path, "Entry not found: " + path);
    }

    public EntryNotFoundException(String path, String message) {
        super(ErrorKind.NOT_FOUND, message);
        this.path = path;
    }

    public String path() { return path; }
}

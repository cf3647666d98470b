package no.cantara.ktree;

/**
 * Base type for structural failures of an engine operation. These are raised before any write
 * to the primary target happens.
 */
public class KnowledgeTreeException extends RuntimeException {

    public enum ErrorKind { NOT_FOUND, CONFLICT, VALIDATION, MALFORMED }

    private final ErrorKind kind;

    public KnowledgeTreeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public KnowledgeTreeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }
}

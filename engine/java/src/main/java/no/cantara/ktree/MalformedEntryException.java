package no.cantara.ktree;

import java.util.List;

/** Thrown when stored content does not decode to a valid entry. */
public class MalformedEntryException extends KnowledgeTreeException {

    private final String path;
    private final List<String> problems;

    public MalformedEntryException(String path, List<String> problems) {
        super(ErrorKind.MALFORMED, "Malformed entry " + path + ": " + String.join("; ", problems));
        this.path = path;
        this.problems = List.copyOf(problems);
    }

    public MalformedEntryException(String path, String message, Throwable cause) {
        super(ErrorKind.MALFORMED, "Malformed entry " + path + ": " + message, cause);
        this.path = path;
        this.problems = List.of(message);
    }

    public String path() { return path; }

    public List<String> problems() { return problems; }
}

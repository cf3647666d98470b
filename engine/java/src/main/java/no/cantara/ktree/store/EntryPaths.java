package no.cantara.ktree.store;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Entry key handling. A key is a slash-separated, lower-case path relative to the store root
 * that always ends in {@code .json}.
 */
public final class EntryPaths {

    public static final String EXTENSION = ".json";

    /** Store-level control file; never an entry. */
    public static final String CONTROL_FILE = ".knowledge-tree.json";

    private static final Pattern KEY_PATTERN = Pattern.compile("^[a-z0-9\\-_/.]+$");
    private static final int MAX_KEY_LENGTH = 255;

    private EntryPaths() {}

    /**
     * Normalizes a caller-supplied path into an entry key.
     *
     * @throws IllegalArgumentException if the path is empty, escapes the store root or uses
     *                                  characters a key may not contain
     */
    public static String normalize(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            throw new IllegalArgumentException("Path is required and must be non-empty");
        }
        String key = rawPath.trim().replace('\\', '/').toLowerCase(Locale.ROOT);
        key = key.replaceAll("/{2,}", "/").replaceAll("^/+|/+$", "");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Path is required and must be non-empty: '" + rawPath + "'");
        }
        if (!key.endsWith(EXTENSION)) {
            key = key + EXTENSION;
        }
        if (!KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException("Path may only contain a-z, 0-9, '-', '_', '.' and '/': '" + rawPath + "'");
        }
        if (key.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("Path exceeds " + MAX_KEY_LENGTH + " characters: '" + rawPath + "'");
        }
        for (String segment : key.split("/")) {
            if (segment.equals("..") || segment.equals(".")) {
                throw new IllegalArgumentException("Path escapes the knowledge root: '" + rawPath + "'");
            }
        }
        try {
            if (Path.of(key).normalize().startsWith("..")) {
                throw new IllegalArgumentException("Path escapes the knowledge root: '" + rawPath + "'");
            }
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid path: '" + rawPath + "'", e);
        }
        if (key.equals(CONTROL_FILE) || key.endsWith("/" + CONTROL_FILE)) {
            throw new IllegalArgumentException("Path is reserved: '" + rawPath + "'");
        }
        return key;
    }

    /**
     * Derives a collision-free candidate for {@code key} by suffixing the file name.
     * {@code "a/b.json"} with stamp 42 becomes {@code "a/b-42.json"}; attempt 2 becomes
     * {@code "a/b-42-2.json"}.
     */
    public static String disambiguate(String key, long stamp, int attempt) {
        String base = key.substring(0, key.length() - EXTENSION.length());
        String suffix = attempt > 0 ? "-" + stamp + "-" + attempt : "-" + stamp;
        return base + suffix + EXTENSION;
    }

    /** The key with its extension removed, as shown to humans. */
    public static String display(String key) {
        return key.endsWith(EXTENSION) ? key.substring(0, key.length() - EXTENSION.length()) : key;
    }
}

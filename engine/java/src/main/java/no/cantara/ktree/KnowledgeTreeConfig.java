package no.cantara.ktree;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Settings for a knowledge tree, usually read from {@code knowledge-tree.yaml}.
 *
 * <pre>
 * knowledge_root: ./docs
 * default_depth: 1
 * cleanup_links: true
 * max_move_attempts: 16
 * server:
 *   name: knowledge-tree
 *   version: 1.0.0
 * </pre>
 */
public record KnowledgeTreeConfig(
        Path knowledgeRoot,
        int defaultDepth,
        boolean cleanupLinks,
        int maxMoveAttempts,
        String serverName,
        String serverVersion
) {
    public static final String DEFAULT_FILE = "knowledge-tree.yaml";

    // SafeConstructor: config files must not be able to instantiate arbitrary types
    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    public KnowledgeTreeConfig {
        if (knowledgeRoot == null) {
            throw new IllegalArgumentException("'knowledge_root' is required");
        }
        if (defaultDepth < 1) {
            throw new IllegalArgumentException("'default_depth' must be at least 1, got " + defaultDepth);
        }
        if (maxMoveAttempts < 1) {
            throw new IllegalArgumentException("'max_move_attempts' must be at least 1, got " + maxMoveAttempts);
        }
    }

    public static KnowledgeTreeConfig defaults(Path knowledgeRoot) {
        return new KnowledgeTreeConfig(knowledgeRoot, 1, true, KnowledgeTree.DEFAULT_MAX_MOVE_ATTEMPTS,
                "knowledge-tree", "1.0.0");
    }

    /**
     * Loads a YAML config file. A relative {@code knowledge_root} is resolved against the
     * directory holding the file.
     */
    public static KnowledgeTreeConfig load(Path file) throws IOException {
        Map<String, Object> data;
        try (InputStream is = Files.newInputStream(file)) {
            data = YAML.load(is);
        }
        Path base = file.toAbsolutePath().getParent();
        return fromMap(data != null ? data : Map.of(), base);
    }

    @SuppressWarnings("unchecked")
    public static KnowledgeTreeConfig fromMap(Map<String, Object> data, Path base) {
        Object rawRoot = data.get("knowledge_root");
        if (rawRoot == null) {
            throw new IllegalArgumentException("'knowledge_root' is required");
        }
        Path root = Path.of(rawRoot.toString());
        if (!root.isAbsolute() && base != null) {
            root = base.resolve(root).normalize();
        }
        Map<String, Object> server = (Map<String, Object>) data.getOrDefault("server", Map.of());
        return new KnowledgeTreeConfig(
                root,
                intValue(data.get("default_depth"), 1, "default_depth"),
                boolValue(data.get("cleanup_links"), true),
                intValue(data.get("max_move_attempts"), KnowledgeTree.DEFAULT_MAX_MOVE_ATTEMPTS, "max_move_attempts"),
                String.valueOf(server.getOrDefault("name", "knowledge-tree")),
                String.valueOf(server.getOrDefault("version", "1.0.0")));
    }

    private static int intValue(Object value, int fallback, String key) {
        if (value == null) return fallback;
        if (value instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be an integer, got '" + value + "'", e);
        }
    }

    private static boolean boolValue(Object value, boolean fallback) {
        if (value == null) return fallback;
        if (value instanceof Boolean b) return b;
        return Boolean.parseBoolean(value.toString().trim());
    }
}

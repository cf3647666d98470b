package no.cantara.ktree.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.modelcontextprotocol.spec.McpSchema;
import no.cantara.ktree.EntryIndex;
import no.cantara.ktree.EntryValidationException;
import no.cantara.ktree.KnowledgeTreeException;
import no.cantara.ktree.MalformedEntryException;
import no.cantara.ktree.MutationResult;
import no.cantara.ktree.RecentChanges;
import no.cantara.ktree.SideEffectFailure;
import no.cantara.ktree.ValidationReport;
import no.cantara.ktree.model.KnowledgeEntry;
import no.cantara.ktree.model.Priority;
import no.cantara.ktree.model.RelationshipType;
import no.cantara.ktree.store.EntryCodec;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.*;

/**
 * Pure mapping functions: engine types ↔ MCP tool schemas, arguments and results.
 * No I/O.
 */
public final class KnowledgeTreeMapper {

    private KnowledgeTreeMapper() {}

    /** Shapes of the {@code index_knowledge} overview. */
    public enum IndexFormat { TREE, LIST, SUMMARY, CATEGORIES }

    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    // ── Schemas ───────────────────────────────────────────────────────────────────

    public static McpSchema.Tool tool(String name, String description,
                                      Map<String, Object> properties, List<String> required) {
        return McpSchema.Tool.builder()
            .name(name)
            .description(description)
            .inputSchema(new McpSchema.JsonSchema(
                "object", properties, required, false, Map.of(), Map.of()))
            .build();
    }

    public static Map<String, Object> stringProperty(String description) {
        return Map.of("type", "string", "description", description);
    }

    public static Map<String, Object> integerProperty(String description, int minimum) {
        return Map.of("type", "integer", "description", description, "minimum", minimum);
    }

    public static Map<String, Object> booleanProperty(String description) {
        return Map.of("type", "boolean", "description", description);
    }

    public static Map<String, Object> choiceProperty(String description, List<String> values) {
        return Map.of("type", "string", "enum", values, "description", description);
    }

    public static Map<String, Object> relationshipProperty() {
        return Map.of(
            "type", "string",
            "enum", RelationshipType.wireValues(),
            "description", "related and conflicts_with are mirrored on the target");
    }

    /** Schema of an entry object; {@code requireCore} marks priority, problem and solution required. */
    public static Map<String, Object> entryProperty(String description, boolean requireCore) {
        Map<String, Object> relation = Map.of(
            "type", "object",
            "properties", Map.of(
                "path",         stringProperty("Target entry path"),
                "relationship", relationshipProperty(),
                "description",  stringProperty("Optional note on the relation")),
            "required", List.of("path", "relationship"));

        Map<String, Object> props = new LinkedHashMap<>();
        props.put("title",      stringProperty("Short human-readable title"));
        props.put("slug",       stringProperty("URL-friendly identifier"));
        props.put("priority",   Map.of("type", "string", "enum", Priority.wireValues()));
        props.put("category",   stringProperty("Free-form category"));
        props.put("tags",       Map.of("type", "array", "items", Map.of("type", "string")));
        props.put("problem",    stringProperty("The problem this entry addresses"));
        props.put("context",    stringProperty("When the problem occurs"));
        props.put("solution",   stringProperty("How to solve it"));
        props.put("examples",   Map.of("type", "array", "items", Map.of("type", "object")));
        props.put("code",       stringProperty("Code snippet"));
        props.put("related_to", Map.of("type", "array", "items", relation));
        props.put("author",     stringProperty("Author"));
        props.put("version",    stringProperty("Content version"));

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("description", description);
        schema.put("properties", props);
        if (requireCore) {
            schema.put("required", List.of("priority", "problem", "solution"));
        }
        return schema;
    }

    // ── Arguments ─────────────────────────────────────────────────────────────────

    public static String requireString(Map<String, Object> args, String key) {
        Object v = args.get(key);
        if (!(v instanceof String s) || s.isBlank()) {
            throw new EntryValidationException("'" + key + "' is required and must be a non-empty string");
        }
        return s;
    }

    public static String optionalString(Map<String, Object> args, String key) {
        Object v = args.get(key);
        if (v == null) return null;
        if (!(v instanceof String s)) {
            throw new EntryValidationException("'" + key + "' must be a string");
        }
        return s;
    }

    public static int optionalInt(Map<String, Object> args, String key, int fallback) {
        Object v = args.get(key);
        if (v == null) return fallback;
        if (v instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) return n.intValue();
        throw new EntryValidationException("'" + key + "' must be an integer");
    }

    public static boolean optionalBoolean(Map<String, Object> args, String key, boolean fallback) {
        Object v = args.get(key);
        if (v == null) return fallback;
        if (v instanceof Boolean b) return b;
        throw new EntryValidationException("'" + key + "' must be a boolean");
    }

    /** A lower-case enum constant name, e.g. {@code "added"} for {@code ADDED}. */
    public static <E extends Enum<E>> E optionalChoice(Map<String, Object> args, String key, Class<E> type, E fallback) {
        String raw = optionalString(args, key);
        if (raw == null) return fallback;
        for (E constant : type.getEnumConstants()) {
            if (choiceName(constant).equals(raw)) return constant;
        }
        throw new EntryValidationException("'" + key + "' must be one of " + choices(type) + ", got '" + raw + "'");
    }

    public static <E extends Enum<E>> List<String> choices(Class<E> type) {
        return Arrays.stream(type.getEnumConstants()).map(KnowledgeTreeMapper::choiceName).toList();
    }

    private static String choiceName(Enum<?> constant) {
        return constant.name().toLowerCase(Locale.ROOT);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> requireObject(Map<String, Object> args, String key) {
        Object v = args.get(key);
        if (!(v instanceof Map<?, ?>)) {
            throw new EntryValidationException("'" + key + "' is required and must be an object");
        }
        return (Map<String, Object>) v;
    }

    public static RelationshipType requireRelationship(Map<String, Object> args, String key) {
        String raw = requireString(args, key);
        return RelationshipType.fromValue(raw).orElseThrow(() -> new EntryValidationException(
            "'" + key + "' must be one of " + RelationshipType.wireValues() + ", got '" + raw + "'"));
    }

    // ── Result bodies ─────────────────────────────────────────────────────────────

    public static Map<String, Object> mutationToMap(MutationResult result) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("operation", result.operation().name().toLowerCase(Locale.ROOT));
        m.put("path", result.path());
        if (result.previousPath() != null) m.put("previous_path", result.previousPath());
        if (result.entry() != null) m.put("entry", EntryCodec.toMap(result.entry()));
        if (!result.warnings().isEmpty()) m.put("warnings", result.warnings());
        m.put("updated_entries", result.sideEffects().modified());
        if (result.isPartial()) {
            m.put("partial", true);
            m.put("failures", result.failures().stream().map(KnowledgeTreeMapper::failureToMap).toList());
        }
        return m;
    }

    public static Map<String, Object> validationToMap(ValidationReport report) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("valid", report.isValid());
        m.put("checked", report.checked());
        m.put("fixed", report.fixed());
        m.put("issues", report.issues());
        return m;
    }

    public static Map<String, Object> recentToMap(RecentChanges recent) {
        Map<String, Object> period = new LinkedHashMap<>();
        period.put("from", recent.from().toString());
        period.put("to", recent.to().toString());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_changes", recent.total());
        summary.put("showing", recent.changes().size());
        summary.put("added", recent.added());
        summary.put("modified", recent.modified());

        List<Map<String, Object>> entries = new ArrayList<>();
        for (RecentChanges.Change change : recent.changes()) {
            KnowledgeEntry entry = change.entry();
            Map<String, Object> e = new LinkedHashMap<>();
            e.put("path", change.path());
            e.put("priority", priorityOf(entry));
            e.put("problem", entry.problem());
            e.put("solution", preview(entry.solution(), 100));
            e.put("change_type", change.type().value());
            e.put("created_at", instantOf(entry.createdAt()));
            e.put("updated_at", instantOf(entry.updatedAt()));
            e.put("relationships", entry.relatedTo().size());
            entries.add(e);
        }

        Map<String, Object> m = new LinkedHashMap<>();
        m.put("period", period);
        m.put("summary", summary);
        m.put("entries", entries);
        return m;
    }

    /**
     * Renders an index in {@code format}. Without {@code includeContent}, problems are
     * shortened and solutions left out.
     */
    public static Map<String, Object> indexToMap(EntryIndex index, IndexFormat format, boolean includeContent) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("total_entries", index.total());
        m.put("showing", index.entries().size());
        m.put("format", choiceName(format));
        m.put("index", switch (format) {
            case TREE -> treeIndex(index, includeContent);
            case LIST -> listIndex(index, includeContent);
            case SUMMARY -> summaryIndex(index);
            case CATEGORIES -> categoryIndex(index);
        });

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("by_priority", new TreeMap<>(index.byPriority()));
        stats.put("by_category", new TreeMap<>(index.byCategory()));
        stats.put("with_relationships", index.withRelationships());
        stats.put("with_code", index.withCode());
        m.put("statistics", stats);
        return m;
    }

    /** Nested by directory; leaves keep their file name so they never clash with a directory. */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> treeIndex(EntryIndex index, boolean includeContent) {
        Map<String, Object> tree = new LinkedHashMap<>();
        for (EntryIndex.Indexed indexed : index.entries()) {
            String[] parts = indexed.path().split("/");
            Map<String, Object> current = tree;
            for (int i = 0; i < parts.length - 1; i++) {
                current = (Map<String, Object>) current.computeIfAbsent(parts[i], k -> new LinkedHashMap<String, Object>());
            }
            KnowledgeEntry entry = indexed.entry();
            Map<String, Object> leaf = new LinkedHashMap<>();
            leaf.put("priority", priorityOf(entry));
            leaf.put("problem", includeContent ? entry.problem() : preview(entry.problem(), 50));
            leaf.put("links", entry.relatedTo().size());
            if (includeContent) leaf.put("solution", preview(entry.solution(), 100));
            current.put(parts[parts.length - 1], leaf);
        }
        return tree;
    }

    private static List<Map<String, Object>> listIndex(EntryIndex index, boolean includeContent) {
        List<Map<String, Object>> list = new ArrayList<>();
        for (EntryIndex.Indexed indexed : index.entries()) {
            KnowledgeEntry entry = indexed.entry();
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("path", indexed.path());
            item.put("priority", priorityOf(entry));
            item.put("problem", includeContent ? entry.problem() : preview(entry.problem(), 60));
            if (includeContent) item.put("solution", preview(entry.solution(), 100));
            item.put("relationships", entry.relatedTo().size());
            item.put("has_code", hasText(entry.code()));
            list.add(item);
        }
        return list;
    }

    private static List<Map<String, Object>> summaryIndex(EntryIndex index) {
        List<Map<String, Object>> list = new ArrayList<>();
        for (EntryIndex.Indexed indexed : index.entries()) {
            KnowledgeEntry entry = indexed.entry();
            Map<String, Object> features = new LinkedHashMap<>();
            features.put("has_code", hasText(entry.code()));
            features.put("has_examples", !entry.examples().isEmpty());
            features.put("has_links", !entry.relatedTo().isEmpty());

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("path", indexed.path());
            item.put("priority", priorityOf(entry));
            item.put("title", entry.title() != null ? entry.title() : preview(entry.problem(), 40));
            item.put("relationships", entry.relatedTo().size());
            item.put("features", features);
            item.put("created_at", instantOf(entry.createdAt()));
            item.put("updated_at", instantOf(entry.updatedAt()));
            list.add(item);
        }
        return list;
    }

    private static Map<String, Object> categoryIndex(EntryIndex index) {
        Map<String, Map<String, Object>> categories = new TreeMap<>();
        for (EntryIndex.Indexed indexed : index.entries()) {
            KnowledgeEntry entry = indexed.entry();
            Map<String, Object> category = categories.computeIfAbsent(indexed.category(), k -> {
                Map<String, Object> c = new LinkedHashMap<>();
                c.put("count", 0);
                c.put("priorities", new TreeMap<String, Integer>());
                c.put("entries", new ArrayList<Map<String, Object>>());
                return c;
            });
            category.merge("count", 1, (a, b) -> (Integer) a + (Integer) b);
            @SuppressWarnings("unchecked")
            Map<String, Integer> priorities = (Map<String, Integer>) category.get("priorities");
            priorities.merge(String.valueOf(priorityOf(entry)), 1, Integer::sum);
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> entries = (List<Map<String, Object>>) category.get("entries");
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("filename", indexed.path().substring(indexed.path().lastIndexOf('/') + 1));
            item.put("priority", priorityOf(entry));
            item.put("problem", preview(entry.problem(), 50));
            entries.add(item);
        }
        return new LinkedHashMap<>(categories);
    }

    /** {@code text} cut to {@code max} characters, with "..." when something was cut. */
    static String preview(String text, int max) {
        if (text == null || text.length() <= max) return text;
        return text.substring(0, max) + "...";
    }

    private static String priorityOf(KnowledgeEntry entry) {
        return entry.priority() != null ? entry.priority().value() : null;
    }

    private static String instantOf(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isEmpty();
    }

    private static Map<String, Object> failureToMap(SideEffectFailure failure) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("path", failure.path());
        m.put("stage", failure.stage().name().toLowerCase(Locale.ROOT));
        m.put("message", failure.message());
        return m;
    }

    /** Problems carried by an engine exception, one line each. */
    public static List<String> problems(KnowledgeTreeException e) {
        if (e instanceof EntryValidationException v) return v.errors();
        if (e instanceof MalformedEntryException m) return m.problems();
        return List.of(e.getMessage());
    }

    // ── Results ───────────────────────────────────────────────────────────────────

    public static McpSchema.CallToolResult success(Object body) {
        return McpSchema.CallToolResult.builder()
            .addTextContent(toJson(body))
            .isError(false)
            .build();
    }

    public static McpSchema.CallToolResult failure(KnowledgeTreeException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.kind().name().toLowerCase(Locale.ROOT));
        body.put("message", e.getMessage());
        body.put("problems", problems(e));
        return error(toJson(body));
    }

    public static McpSchema.CallToolResult error(String text) {
        return McpSchema.CallToolResult.builder()
            .addTextContent(text)
            .isError(true)
            .build();
    }

    public static String toJson(Object body) {
        try {
            return JSON.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}

package no.cantara.ktree.store;

import no.cantara.ktree.EntryValidationException;
import no.cantara.ktree.MalformedEntryException;
import no.cantara.ktree.model.EntryPatch;
import no.cantara.ktree.model.KnowledgeEntry;
import no.cantara.ktree.model.KnowledgeExample;
import no.cantara.ktree.model.Priority;
import no.cantara.ktree.model.Relation;
import no.cantara.ktree.model.RelationshipType;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between the stored document shape (a JSON object with snake_case keys) and
 * {@link KnowledgeEntry}.
 *
 * <p>Decoding checks types and enum values only. Required-field rules belong to
 * {@link no.cantara.ktree.EntryValidator}. Unknown keys are ignored.
 */
public final class EntryCodec {

    private EntryCodec() {}

    /**
     * Decodes a stored document.
     *
     * @throws MalformedEntryException listing every shape problem found
     */
    public static KnowledgeEntry fromMap(String path, Map<String, Object> data) {
        Reader r = new Reader(data);
        KnowledgeEntry entry = r.entry();
        if (!r.problems.isEmpty()) {
            throw new MalformedEntryException(path, r.problems);
        }
        return entry;
    }

    /**
     * Decodes an entry supplied by a caller (for example a tool argument).
     *
     * @throws EntryValidationException listing every shape problem found
     */
    public static KnowledgeEntry inputFromMap(Map<String, Object> data) {
        Reader r = new Reader(data);
        KnowledgeEntry entry = r.entry();
        if (!r.problems.isEmpty()) {
            throw new EntryValidationException(r.problems);
        }
        return entry;
    }

    /**
     * Decodes a field-level patch. Keys that are absent stay {@code null} in the patch.
     */
    public static EntryPatch patchFromMap(Map<String, Object> data) {
        Reader r = new Reader(data);
        EntryPatch patch = new EntryPatch(
                r.string("title"),
                r.string("slug"),
                r.priority(),
                r.string("category"),
                r.stringList("tags"),
                r.string("problem"),
                r.string("context"),
                r.string("solution"),
                r.examples(),
                r.string("code"),
                r.relations(),
                r.string("author"),
                r.string("version"));
        if (!r.problems.isEmpty()) {
            throw new EntryValidationException(r.problems);
        }
        return patch;
    }

    public static Map<String, Object> toMap(KnowledgeEntry entry) {
        Map<String, Object> m = new LinkedHashMap<>();
        putIfPresent(m, "title", entry.title());
        putIfPresent(m, "slug", entry.slug());
        if (entry.priority() != null) m.put("priority", entry.priority().value());
        putIfPresent(m, "category", entry.category());
        if (!entry.tags().isEmpty()) m.put("tags", entry.tags());
        putIfPresent(m, "problem", entry.problem());
        putIfPresent(m, "context", entry.context());
        putIfPresent(m, "solution", entry.solution());
        if (!entry.examples().isEmpty()) {
            m.put("examples", entry.examples().stream().map(EntryCodec::exampleToMap).toList());
        }
        putIfPresent(m, "code", entry.code());
        if (!entry.relatedTo().isEmpty()) {
            m.put("related_to", entry.relatedTo().stream().map(EntryCodec::relationToMap).toList());
        }
        putIfPresent(m, "author", entry.author());
        if (entry.createdAt() != null) m.put("created_at", entry.createdAt().toString());
        if (entry.updatedAt() != null) m.put("updated_at", entry.updatedAt().toString());
        putIfPresent(m, "version", entry.version());
        return m;
    }

    public static Map<String, Object> relationToMap(Relation relation) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("path", relation.path());
        m.put("relationship", relation.relationship().value());
        putIfPresent(m, "description", relation.description());
        return m;
    }

    private static Map<String, Object> exampleToMap(KnowledgeExample example) {
        Map<String, Object> m = new LinkedHashMap<>();
        putIfPresent(m, "title", example.title());
        putIfPresent(m, "description", example.description());
        putIfPresent(m, "code", example.code());
        putIfPresent(m, "language", example.language());
        return m;
    }

    private static void putIfPresent(Map<String, Object> m, String key, String value) {
        if (value != null) m.put(key, value);
    }

    /** Reads typed fields out of a raw map, collecting problems instead of failing fast. */
    private static final class Reader {
        private final Map<String, Object> data;
        private final List<String> problems = new ArrayList<>();

        Reader(Map<String, Object> data) {
            this.data = data != null ? data : Map.of();
        }

        KnowledgeEntry entry() {
            return KnowledgeEntry.builder()
                    .title(string("title"))
                    .slug(string("slug"))
                    .priority(priority())
                    .category(string("category"))
                    .tags(stringList("tags"))
                    .problem(string("problem"))
                    .context(string("context"))
                    .solution(string("solution"))
                    .examples(examples())
                    .code(string("code"))
                    .relatedTo(relations())
                    .author(string("author"))
                    .createdAt(instant("created_at"))
                    .updatedAt(instant("updated_at"))
                    .version(string("version"))
                    .build();
        }

        String string(String key) {
            Object v = data.get(key);
            if (v == null) return null;
            if (v instanceof String s) return s;
            if (v instanceof Number || v instanceof Boolean) return v.toString();
            problems.add("'" + key + "' must be a string");
            return null;
        }

        Priority priority() {
            String raw = string("priority");
            if (raw == null) return null;
            return Priority.fromValue(raw).orElseGet(() -> {
                problems.add("'priority' must be one of " + Priority.wireValues() + ", got '" + raw + "'");
                return null;
            });
        }

        List<String> stringList(String key) {
            Object v = data.get(key);
            if (v == null) return null;
            if (!(v instanceof List<?> list)) {
                problems.add("'" + key + "' must be a list of strings");
                return null;
            }
            List<String> out = new ArrayList<>();
            for (Object item : list) {
                if (item instanceof String s) {
                    out.add(s);
                } else {
                    problems.add("'" + key + "' must contain only strings");
                    return null;
                }
            }
            return out;
        }

        Instant instant(String key) {
            String raw = string(key);
            if (raw == null) return null;
            try {
                return Instant.parse(raw);
            } catch (DateTimeParseException e) {
                try {
                    return OffsetDateTime.parse(raw).toInstant();
                } catch (DateTimeParseException e2) {
                    problems.add("'" + key + "' is not an ISO-8601 timestamp: '" + raw + "'");
                    return null;
                }
            }
        }

        List<KnowledgeExample> examples() {
            Object v = data.get("examples");
            if (v == null) return null;
            if (!(v instanceof List<?> list)) {
                problems.add("'examples' must be a list");
                return null;
            }
            List<KnowledgeExample> out = new ArrayList<>();
            for (int i = 0; i < list.size(); i++) {
                if (!(list.get(i) instanceof Map<?, ?> raw)) {
                    problems.add("example " + (i + 1) + " must be an object");
                    continue;
                }
                Map<String, Object> e = stringKeys(raw);
                out.add(new KnowledgeExample(
                        asString(e.get("title")),
                        asString(e.get("description")),
                        asString(e.get("code")),
                        asString(e.get("language"))));
            }
            return out;
        }

        List<Relation> relations() {
            Object v = data.get("related_to");
            if (v == null) return null;
            if (!(v instanceof List<?> list)) {
                problems.add("'related_to' must be a list");
                return null;
            }
            List<Relation> out = new ArrayList<>();
            for (int i = 0; i < list.size(); i++) {
                String p = "related entry " + (i + 1);
                if (!(list.get(i) instanceof Map<?, ?> raw)) {
                    problems.add(p + ": must be an object");
                    continue;
                }
                Map<String, Object> link = stringKeys(raw);
                String target = asString(link.get("path"));
                String kind = asString(link.get("relationship"));
                if (target == null || target.isBlank()) {
                    problems.add(p + ": 'path' is required");
                    continue;
                }
                RelationshipType type = RelationshipType.fromValue(kind).orElse(null);
                if (type == null) {
                    problems.add(p + ": 'relationship' must be one of " + RelationshipType.wireValues()
                            + ", got '" + kind + "'");
                    continue;
                }
                String key;
                try {
                    key = EntryPaths.normalize(target);
                } catch (IllegalArgumentException e) {
                    problems.add(p + ": " + e.getMessage());
                    continue;
                }
                out.add(new Relation(key, type, asString(link.get("description"))));
            }
            return out;
        }

        private static String asString(Object v) {
            return v != null ? v.toString() : null;
        }

        private static Map<String, Object> stringKeys(Map<?, ?> raw) {
            Map<String, Object> m = new LinkedHashMap<>();
            raw.forEach((k, val) -> m.put(String.valueOf(k), val));
            return m;
        }
    }
}

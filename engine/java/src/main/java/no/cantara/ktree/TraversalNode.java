package no.cantara.ktree;

import no.cantara.ktree.model.KnowledgeEntry;
import no.cantara.ktree.model.RelationshipType;
import no.cantara.ktree.store.EntryCodec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One node of a depth-limited read: either a resolved entry or a marker for a path already
 * on the current branch.
 */
public interface TraversalNode {

    String path();

    /** Document shape of this node, as returned to callers. */
    Map<String, Object> toMap();

    /**
     * A resolved entry.
     *
     * @param linkedEntries neighbors keyed by target path, or {@code null} when the read did
     *                      not expand this node's relations
     */
    record Resolved(String path, KnowledgeEntry entry, Map<String, Link> linkedEntries) implements TraversalNode {

        public boolean hasLinkedEntries() {
            return linkedEntries != null;
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("path", path);
            m.putAll(EntryCodec.toMap(entry));
            if (linkedEntries != null) {
                Map<String, Object> linked = new LinkedHashMap<>();
                linkedEntries.forEach((target, link) -> linked.put(target, link.toMap()));
                m.put("linked_entries", linked);
            }
            return m;
        }
    }

    /** Terminal marker: {@code path} is an ancestor on the branch being expanded. */
    record Circular(String path) implements TraversalNode {

        @Override
        public Map<String, Object> toMap() {
            return Map.of("circular_reference", path);
        }
    }

    /**
     * An embedded neighbor. Exactly one of {@code content} and {@code error} is set.
     */
    record Link(RelationshipType relationship, String description, TraversalNode content, String error) {

        public boolean failed() {
            return error != null;
        }

        public Map<String, Object> toMap() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("relationship", relationship.value());
            if (description != null) m.put("description", description);
            if (content != null) m.put("content", content.toMap());
            if (error != null) m.put("error", error);
            return m;
        }
    }
}

package no.cantara.ktree;

import no.cantara.ktree.model.KnowledgeEntry;
import no.cantara.ktree.model.Relation;
import no.cantara.ktree.store.EntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reads an entry together with the entries its relations lead to, up to a number of hops.
 *
 * <p>The graph may contain cycles. Each branch carries its own copy of the set of paths on the
 * way down from the root, so a path seen again on the same branch becomes a
 * {@link TraversalNode.Circular} marker, while sibling branches never suppress each other.
 */
public class TreeTraversal {

    private static final Logger log = LoggerFactory.getLogger(TreeTraversal.class);

    static final String LOAD_FAILED = "Failed to load linked entry";

    private final EntryStore store;

    public TreeTraversal(EntryStore store) {
        this.store = store;
    }

    /**
     * @param depth   1 reads only the entry itself; each extra level embeds one more hop
     * @param visited paths already on this branch; not modified
     * @throws EntryNotFoundException  if the root entry does not exist
     * @throws MalformedEntryException if the root entry cannot be decoded
     */
    public TraversalNode readWithDepth(String path, int depth, Set<String> visited) throws IOException {
        if (visited.contains(path)) {
            return new TraversalNode.Circular(path);
        }
        Set<String> branch = new HashSet<>(visited);
        branch.add(path);

        KnowledgeEntry entry = store.read(path);
        if (depth <= 1 || entry.relatedTo().isEmpty()) {
            return new TraversalNode.Resolved(path, entry, null);
        }

        Map<String, TraversalNode.Link> linked = new LinkedHashMap<>();
        for (Relation relation : entry.relatedTo()) {
            TraversalNode.Link link;
            try {
                TraversalNode content = readWithDepth(relation.path(), depth - 1, new HashSet<>(branch));
                link = new TraversalNode.Link(relation.relationship(), relation.description(), content, null);
            } catch (IOException | KnowledgeTreeException e) {
                log.debug("Linked entry {} of {} unavailable: {}", relation.path(), path, e.getMessage());
                link = new TraversalNode.Link(relation.relationship(), relation.description(), null, LOAD_FAILED);
            }
            linked.put(relation.path(), link);
        }
        return new TraversalNode.Resolved(path, entry, linked);
    }
}

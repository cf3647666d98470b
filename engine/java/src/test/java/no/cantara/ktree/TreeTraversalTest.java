package no.cantara.ktree;

import no.cantara.ktree.model.RelationshipType;
import no.cantara.ktree.store.FileEntryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static no.cantara.ktree.Fixtures.entry;
import static no.cantara.ktree.Fixtures.rel;
import static no.cantara.ktree.Fixtures.related;
import static org.junit.jupiter.api.Assertions.*;

class TreeTraversalTest {

    @TempDir Path root;
    private FileEntryStore store;
    private TreeTraversal traversal;

    @BeforeEach
    void setUp() {
        store = new FileEntryStore(root);
        traversal = new TreeTraversal(store);
    }

    private static TraversalNode.Resolved resolved(TraversalNode node) {
        return assertInstanceOf(TraversalNode.Resolved.class, node);
    }

    private static TraversalNode child(TraversalNode node, String target) {
        TraversalNode.Link link = resolved(node).linkedEntries().get(target);
        assertNotNull(link, "no link to " + target);
        return link.content();
    }

    @Test void depthOneDoesNotExpandRelations() throws IOException {
        store.write("a.json", entry("A", related("b.json")));
        store.write("b.json", entry("B", related("a.json")));

        TraversalNode.Resolved node = resolved(traversal.readWithDepth("a.json", 1, Set.of()));

        assertEquals("A", node.entry().problem());
        assertFalse(node.hasLinkedEntries());
        assertFalse(node.toMap().containsKey("linked_entries"));
    }

    @Test void followsChainUpToDepth() throws IOException {
        store.write("a.json", entry("A", rel("b.json", RelationshipType.IMPLEMENTS)));
        store.write("b.json", entry("B", rel("c.json", RelationshipType.SUPERSEDES)));
        store.write("c.json", entry("C", rel("d.json", RelationshipType.SUPERSEDES)));
        store.write("d.json", entry("D"));

        TraversalNode a = traversal.readWithDepth("a.json", 3, Set.of());

        TraversalNode c = child(child(a, "b.json"), "c.json");
        assertEquals("C", resolved(c).entry().problem());
        assertFalse(resolved(c).hasLinkedEntries());
        assertEquals(RelationshipType.IMPLEMENTS, resolved(a).linkedEntries().get("b.json").relationship());
    }

    @Test void cycleEndsInCircularMarker() throws IOException {
        store.write("a.json", entry("A", related("b.json")));
        store.write("b.json", entry("B", related("a.json")));

        TraversalNode a = traversal.readWithDepth("a.json", 3, Set.of());

        TraversalNode back = child(child(a, "b.json"), "a.json");
        assertEquals(new TraversalNode.Circular("a.json"), back);
        assertEquals(Map.of("circular_reference", "a.json"), back.toMap());
    }

    @Test void deepCycleTerminates() throws IOException {
        store.write("a.json", entry("A", related("b.json")));
        store.write("b.json", entry("B", related("a.json")));

        TraversalNode a = traversal.readWithDepth("a.json", 50, Set.of());

        assertInstanceOf(TraversalNode.Circular.class, child(child(a, "b.json"), "a.json"));
    }

    @Test void siblingsDoNotSuppressEachOther() throws IOException {
        store.write("a.json", entry("A", rel("b.json", RelationshipType.IMPLEMENTS), rel("c.json", RelationshipType.IMPLEMENTS)));
        store.write("b.json", entry("B", rel("c.json", RelationshipType.IMPLEMENTS)));
        store.write("c.json", entry("C"));

        TraversalNode a = traversal.readWithDepth("a.json", 3, Set.of());

        assertEquals("C", resolved(child(a, "c.json")).entry().problem());
        assertEquals("C", resolved(child(child(a, "b.json"), "c.json")).entry().problem());
    }

    @Test void missingNeighborBecomesErrorLink() throws IOException {
        store.write("a.json", entry("A", related("gone.json"), related("b.json")));
        store.write("b.json", entry("B"));

        TraversalNode.Resolved a = resolved(traversal.readWithDepth("a.json", 2, Set.of()));

        TraversalNode.Link gone = a.linkedEntries().get("gone.json");
        assertTrue(gone.failed());
        assertEquals(TreeTraversal.LOAD_FAILED, gone.error());
        assertNull(gone.content());
        assertFalse(a.linkedEntries().get("b.json").failed());
    }

    @Test void malformedNeighborBecomesErrorLink() throws IOException {
        store.write("a.json", entry("A", related("bad.json")));
        Files.writeString(root.resolve("bad.json"), "invalid json");

        TraversalNode.Resolved a = resolved(traversal.readWithDepth("a.json", 2, Set.of()));

        assertTrue(a.linkedEntries().get("bad.json").failed());
    }

    @Test void missingRootThrows() {
        assertThrows(EntryNotFoundException.class, () -> traversal.readWithDepth("ghost.json", 2, Set.of()));
    }

    @Test void malformedRootThrows() throws IOException {
        Files.writeString(root.resolve("bad.json"), "invalid json");
        assertThrows(MalformedEntryException.class, () -> traversal.readWithDepth("bad.json", 2, Set.of()));
    }

    @Test void pathAlreadyVisitedIsCircular() throws IOException {
        store.write("a.json", entry("A"));
        assertEquals(new TraversalNode.Circular("a.json"), traversal.readWithDepth("a.json", 2, Set.of("a.json")));
    }

    @Test void nodeMapEmbedsNeighbors() throws IOException {
        store.write("a.json", entry("A", related("b.json")));
        store.write("b.json", entry("B"));

        Map<String, Object> map = traversal.readWithDepth("a.json", 2, Set.of()).toMap();

        assertEquals("a.json", map.get("path"));
        @SuppressWarnings("unchecked")
        Map<String, Object> linked = (Map<String, Object>) map.get("linked_entries");
        @SuppressWarnings("unchecked")
        Map<String, Object> b = (Map<String, Object>) linked.get("b.json");
        assertEquals("related", b.get("relationship"));
        assertTrue(b.containsKey("content"));
    }
}

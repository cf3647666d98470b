package no.cantara.ktree;

import no.cantara.ktree.model.Relation;
import no.cantara.ktree.model.RelationshipType;
import no.cantara.ktree.store.FileEntryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static no.cantara.ktree.Fixtures.entry;
import static no.cantara.ktree.Fixtures.rel;
import static no.cantara.ktree.Fixtures.related;
import static org.junit.jupiter.api.Assertions.*;

class LinkSynchronizerTest {

    @TempDir Path root;
    private FileEntryStore store;
    private LinkSynchronizer links;

    @BeforeEach
    void setUp() throws IOException {
        store = new FileEntryStore(root);
        links = new LinkSynchronizer(store);
        store.write("a.json", entry("A", related("b.json")));
        store.write("b.json", entry("B"));
    }

    @Test void addsMirrorWithSameKindAndDescription() throws IOException {
        Relation r = new Relation("b.json", RelationshipType.CONFLICTS_WITH, "pick one");
        SideEffectReport report = links.addMirrors("a.json", List.of(r));

        assertEquals(List.of("b.json"), report.modified());
        Relation mirror = store.read("b.json").relatedTo().get(0);
        assertEquals(new Relation("a.json", RelationshipType.CONFLICTS_WITH, "pick one"), mirror);
    }

    @Test void syncIsIdempotent() throws IOException {
        links.sync("a.json", store.read("a.json"));
        SideEffectReport second = links.sync("a.json", store.read("a.json"));

        assertEquals(0, second.modifiedCount());
        assertEquals(1, store.read("b.json").relatedTo().size());
    }

    @Test void existingLinkBackOfAnyKindSuppressesMirror() throws IOException {
        store.write("b.json", entry("B", rel("a.json", RelationshipType.SUPERSEDES)));
        links.addMirrors("a.json", List.of(related("b.json")));

        assertEquals(List.of(rel("a.json", RelationshipType.SUPERSEDES)), store.read("b.json").relatedTo());
    }

    @Test void directionalKindsAreNotMirrored() throws IOException {
        SideEffectReport report = links.addMirrors("a.json", List.of(
                rel("b.json", RelationshipType.IMPLEMENTS),
                rel("b.json", RelationshipType.SUPERSEDED_BY)));

        assertEquals(0, report.modifiedCount());
        assertTrue(store.read("b.json").relatedTo().isEmpty());
    }

    @Test void missingTargetIsReportedAndOthersStillMirrored() throws IOException {
        store.write("c.json", entry("C"));
        SideEffectReport report = links.addMirrors("a.json", List.of(related("gone.json"), related("c.json")));

        assertEquals(List.of("c.json"), report.modified());
        assertEquals(1, report.failures().size());
        assertEquals("gone.json", report.failures().get(0).path());
        assertEquals(SideEffectFailure.Stage.MIRROR_ADD, report.failures().get(0).stage());
    }

    @Test void unwritableTargetIsReported() {
        LinkSynchronizer faulty = new LinkSynchronizer(new FaultyEntryStore(store).failWritesTo("b.json"));
        SideEffectReport report = faulty.addMirrors("a.json", List.of(related("b.json")));

        assertFalse(report.isComplete());
        assertTrue(report.failures().get(0).message().contains("simulated write failure"));
    }

    @Test void removeMirrorsDropsEveryRelationBackToSource() throws IOException {
        store.write("b.json", entry("B", related("a.json"), rel("a.json", RelationshipType.IMPLEMENTS), related("c.json")));
        SideEffectReport report = links.removeMirrors("a.json", List.of(related("b.json")));

        assertEquals(List.of("b.json"), report.modified());
        assertEquals(List.of(related("c.json")), store.read("b.json").relatedTo());
    }

    @Test void removeMirrorsIgnoresDirectionalKinds() throws IOException {
        store.write("b.json", entry("B", related("a.json")));
        links.removeMirrors("a.json", List.of(rel("b.json", RelationshipType.SUPERSEDES)));

        assertEquals(1, store.read("b.json").relatedTo().size());
    }
}

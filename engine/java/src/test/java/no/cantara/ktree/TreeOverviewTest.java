package no.cantara.ktree;

import no.cantara.ktree.model.KnowledgeEntry;
import no.cantara.ktree.model.Priority;
import no.cantara.ktree.store.FileEntryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static no.cantara.ktree.Fixtures.CLOCK;
import static no.cantara.ktree.Fixtures.NOW;
import static no.cantara.ktree.Fixtures.entry;
import static no.cantara.ktree.Fixtures.related;
import static org.junit.jupiter.api.Assertions.*;

class TreeOverviewTest {

    @TempDir Path root;
    private FileEntryStore store;
    private KnowledgeTree tree;

    @BeforeEach
    void setUp() {
        store = new FileEntryStore(root);
        tree = new KnowledgeTree(store, null, CLOCK, 4);
    }

    private void stored(String key, Instant created, Instant updated) throws IOException {
        store.write(key, entry(key).toBuilder().createdAt(created).updatedAt(updated).build());
    }

    private static Instant daysAgo(int days) {
        return NOW.minus(Duration.ofDays(days));
    }

    // ── recent ────────────────────────────────────────────────────────────────────

    @Test void recentClassifiesAddedAndModified() throws IOException {
        stored("new.json", daysAgo(1), daysAgo(1));
        stored("edited.json", daysAgo(30), daysAgo(2));
        stored("old.json", daysAgo(30), daysAgo(20));

        RecentChanges recent = tree.recent(7, RecentChanges.Filter.ALL, 20);

        assertEquals(daysAgo(7), recent.from());
        assertEquals(NOW, recent.to());
        assertEquals(2, recent.total());
        assertEquals(1, recent.added());
        assertEquals(1, recent.modified());
        assertEquals(List.of("new.json", "edited.json"),
                recent.changes().stream().map(RecentChanges.Change::path).toList());
        assertEquals(RecentChanges.ChangeType.MODIFIED, recent.changes().get(1).type());
    }

    @Test void recentFiltersByChangeType() throws IOException {
        stored("new.json", daysAgo(1), daysAgo(1));
        stored("edited.json", daysAgo(30), daysAgo(2));

        assertEquals(List.of("edited.json"), tree.recent(7, RecentChanges.Filter.MODIFIED, 20).changes()
                .stream().map(RecentChanges.Change::path).toList());
        assertEquals(List.of("new.json"), tree.recent(7, RecentChanges.Filter.ADDED, 20).changes()
                .stream().map(RecentChanges.Change::path).toList());
    }

    @Test void recentLimitKeepsNewestAndReportsTotal() throws IOException {
        stored("a.json", daysAgo(3), daysAgo(3));
        stored("b.json", daysAgo(1), daysAgo(1));
        stored("c.json", daysAgo(2), daysAgo(2));

        RecentChanges recent = tree.recent(7, RecentChanges.Filter.ALL, 2);

        assertEquals(3, recent.total());
        assertEquals(List.of("b.json", "c.json"),
                recent.changes().stream().map(RecentChanges.Change::path).toList());
    }

    @Test void recentSkipsEntriesWithoutStampsAndUnreadableFiles() throws IOException {
        stored("unstamped.json", null, null);
        Files.writeString(root.resolve("bad.json"), "invalid json");
        tree.create("fresh", entry("Fresh"));

        RecentChanges recent = tree.recent(1, null, 10);

        assertEquals(List.of("fresh.json"), recent.changes().stream().map(RecentChanges.Change::path).toList());
    }

    @Test void recentRejectsNonPositiveArguments() {
        EntryValidationException e = assertThrows(EntryValidationException.class,
                () -> tree.recent(0, RecentChanges.Filter.ALL, 0));
        assertEquals(2, e.errors().size());
    }

    // ── index ─────────────────────────────────────────────────────────────────────

    @Test void indexCountsByPriorityAndCategory() throws IOException {
        tree.create("security/jwt", entry("JWT").toBuilder().priority(Priority.CRITICAL).code("verify()").build());
        tree.create("security/cors", entry("CORS"));
        tree.create("top", entry("Top", related("security/cors.json")));

        EntryIndex index = tree.index(100);

        assertEquals(3, index.total());
        assertEquals(List.of("security/cors.json", "security/jwt.json", "top.json"),
                index.entries().stream().map(EntryIndex.Indexed::path).toList());
        assertEquals(Map.of("CRITICAL", 1, "REQUIRED", 0, "COMMON", 2, "EDGE-CASE", 0), index.byPriority());
        assertEquals(Map.of("security", 2, "root", 1), index.byCategory());
        assertEquals(2, index.withRelationships());
        assertEquals(1, index.withCode());
    }

    @Test void indexHonorsMaxEntriesButReportsTotal() throws IOException {
        tree.create("a", entry("A"));
        tree.create("b", entry("B"));
        tree.create("c", entry("C"));

        EntryIndex index = tree.index(2);

        assertEquals(3, index.total());
        assertEquals(2, index.entries().size());
    }

    @Test void indexSkipsUnreadableEntries() throws IOException {
        tree.create("a", entry("A"));
        Files.writeString(root.resolve("bad.json"), "invalid json");

        EntryIndex index = tree.index(10);

        assertEquals(2, index.total());
        assertEquals(List.of("a.json"), index.entries().stream().map(EntryIndex.Indexed::path).toList());
    }

    @Test void categoryOfTopLevelKeyIsRoot() {
        assertEquals("root", EntryIndex.categoryOf("a.json"));
        assertEquals("x/y", EntryIndex.categoryOf("x/y/a.json"));
    }
}

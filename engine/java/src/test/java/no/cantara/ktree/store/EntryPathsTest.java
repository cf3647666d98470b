package no.cantara.ktree.store;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EntryPathsTest {

    @Test void appendsExtension() {
        assertEquals("backend/redis/caching.json", EntryPaths.normalize("backend/redis/caching"));
    }

    @Test void keepsExistingExtension() {
        assertEquals("a/b.json", EntryPaths.normalize("a/b.json"));
    }

    @Test void lowerCasesAndTrims() {
        assertEquals("security/jwt.json", EntryPaths.normalize("  Security/JWT "));
    }

    @Test void stripsLeadingAndTrailingSlashes() {
        assertEquals("a/b.json", EntryPaths.normalize("/a/b/"));
    }

    @Test void convertsBackslashesAndCollapsesSlashes() {
        assertEquals("a/b/c.json", EntryPaths.normalize("a\\b//c"));
    }

    @Test void rejectsEmpty() {
        assertThrows(IllegalArgumentException.class, () -> EntryPaths.normalize(""));
        assertThrows(IllegalArgumentException.class, () -> EntryPaths.normalize("  "));
        assertThrows(IllegalArgumentException.class, () -> EntryPaths.normalize("///"));
        assertThrows(IllegalArgumentException.class, () -> EntryPaths.normalize(null));
    }

    @Test void rejectsTraversal() {
        assertThrows(IllegalArgumentException.class, () -> EntryPaths.normalize("../secret"));
        assertThrows(IllegalArgumentException.class, () -> EntryPaths.normalize("a/../../b"));
    }

    @Test void rejectsInvalidCharacters() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> EntryPaths.normalize("a b/c"));
        assertTrue(e.getMessage().contains("a b/c"));
        assertThrows(IllegalArgumentException.class, () -> EntryPaths.normalize("a/c?x"));
    }

    @Test void rejectsControlFile() {
        assertThrows(IllegalArgumentException.class, () -> EntryPaths.normalize(".knowledge-tree.json"));
    }

    @Test void disambiguateSuffixesFileName() {
        assertEquals("a/b-42.json", EntryPaths.disambiguate("a/b.json", 42, 0));
        assertEquals("a/b-42-2.json", EntryPaths.disambiguate("a/b.json", 42, 2));
    }

    @Test void displayDropsExtension() {
        assertEquals("a/b", EntryPaths.display("a/b.json"));
    }
}

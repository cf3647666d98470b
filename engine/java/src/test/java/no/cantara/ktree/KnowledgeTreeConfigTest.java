package no.cantara.ktree;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeTreeConfigTest {

    @TempDir Path dir;

    @Test void loadsEverySetting() throws IOException {
        Path file = dir.resolve(KnowledgeTreeConfig.DEFAULT_FILE);
        Files.writeString(file, """
                knowledge_root: docs/knowledge
                default_depth: 3
                cleanup_links: false
                max_move_attempts: 5
                server:
                  name: team-kb
                  version: 2.1.0
                """);

        KnowledgeTreeConfig config = KnowledgeTreeConfig.load(file);

        assertEquals(dir.toAbsolutePath().resolve("docs/knowledge").normalize(), config.knowledgeRoot());
        assertEquals(3, config.defaultDepth());
        assertFalse(config.cleanupLinks());
        assertEquals(5, config.maxMoveAttempts());
        assertEquals("team-kb", config.serverName());
        assertEquals("2.1.0", config.serverVersion());
    }

    @Test void missingSettingsFallBackToDefaults() throws IOException {
        Path file = dir.resolve("kt.yaml");
        Files.writeString(file, "knowledge_root: " + dir.toAbsolutePath() + "\n");

        KnowledgeTreeConfig config = KnowledgeTreeConfig.load(file);

        assertEquals(KnowledgeTreeConfig.defaults(dir.toAbsolutePath()), config);
    }

    @Test void missingRootIsRejected() throws IOException {
        Path file = dir.resolve("kt.yaml");
        Files.writeString(file, "default_depth: 2\n");
        assertThrows(IllegalArgumentException.class, () -> KnowledgeTreeConfig.load(file));
    }

    @Test void emptyFileIsRejected() throws IOException {
        Path file = dir.resolve("kt.yaml");
        Files.writeString(file, "");
        assertThrows(IllegalArgumentException.class, () -> KnowledgeTreeConfig.load(file));
    }

    @Test void nonPositiveDepthIsRejected() throws IOException {
        Path file = dir.resolve("kt.yaml");
        Files.writeString(file, "knowledge_root: kb\ndefault_depth: 0\n");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> KnowledgeTreeConfig.load(file));
        assertTrue(e.getMessage().contains("default_depth"));
    }

    @Test void nonNumericAttemptsAreRejected() throws IOException {
        Path file = dir.resolve("kt.yaml");
        Files.writeString(file, "knowledge_root: kb\nmax_move_attempts: many\n");
        assertThrows(IllegalArgumentException.class, () -> KnowledgeTreeConfig.load(file));
    }

    @Test void openedTreeUsesConfiguredRoot() throws IOException {
        KnowledgeTree tree = KnowledgeTree.open(KnowledgeTreeConfig.defaults(dir), null);
        tree.create("ops/restart", Fixtures.entry("Restart"));
        assertTrue(Files.isRegularFile(dir.resolve("ops/restart.json")));
    }
}

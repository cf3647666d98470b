package no.cantara.ktree.store;

import no.cantara.ktree.EntryValidationException;
import no.cantara.ktree.MalformedEntryException;
import no.cantara.ktree.model.EntryPatch;
import no.cantara.ktree.model.KnowledgeEntry;
import no.cantara.ktree.model.Priority;
import no.cantara.ktree.model.RelationshipType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EntryCodecTest {

    private static final Map<String, Object> COMPLETE = Map.ofEntries(
            Map.entry("title", "JWT validation"),
            Map.entry("priority", "CRITICAL"),
            Map.entry("category", "security"),
            Map.entry("tags", List.of("jwt", "auth")),
            Map.entry("problem", "Tokens are accepted without signature checks"),
            Map.entry("context", "Gateway services"),
            Map.entry("solution", "Verify the signature against the JWKS"),
            Map.entry("examples", List.of(Map.of("title", "Good", "code", "verify(token)", "language", "java"))),
            Map.entry("related_to", List.of(
                    Map.of("path", "security/jwks", "relationship", "implements", "description", "uses keys"),
                    Map.of("path", "security/session.json", "relationship", "related"))),
            Map.entry("author", "ops"),
            Map.entry("created_at", "2026-01-02T03:04:05Z"),
            Map.entry("updated_at", "2026-01-03T03:04:05.123Z"),
            Map.entry("version", "2"));

    private static Map<String, Object> completeWith(String key, Object value) {
        Map<String, Object> m = new HashMap<>(COMPLETE);
        m.put(key, value);
        return m;
    }

    // ── decoding ──────────────────────────────────────────────────────────────────

    @Test void decodesCompleteDocument() {
        KnowledgeEntry e = EntryCodec.fromMap("security/jwt.json", COMPLETE);
        assertEquals("JWT validation", e.title());
        assertEquals(Priority.CRITICAL, e.priority());
        assertEquals(List.of("jwt", "auth"), e.tags());
        assertEquals("java", e.examples().get(0).language());
        assertEquals(Instant.parse("2026-01-02T03:04:05Z"), e.createdAt());
        assertEquals("2", e.version());
    }

    @Test void relationTargetsAreNormalizedToKeys() {
        KnowledgeEntry e = EntryCodec.fromMap("security/jwt.json", COMPLETE);
        assertEquals("security/jwks.json", e.relatedTo().get(0).path());
        assertEquals(RelationshipType.IMPLEMENTS, e.relatedTo().get(0).relationship());
        assertEquals("uses keys", e.relatedTo().get(0).description());
        assertNull(e.relatedTo().get(1).description());
    }

    @Test void ignoresUnknownKeys() {
        KnowledgeEntry e = EntryCodec.fromMap("x.json", completeWith("score", 3));
        assertEquals("JWT validation", e.title());
    }

    @Test void unknownPriorityIsMalformed() {
        MalformedEntryException e = assertThrows(MalformedEntryException.class,
                () -> EntryCodec.fromMap("x.json", completeWith("priority", "URGENT")));
        assertEquals("x.json", e.path());
        assertTrue(e.getMessage().contains("URGENT"));
    }

    @Test void collectsEveryShapeProblem() {
        Map<String, Object> data = completeWith("tags", "jwt");
        data.put("related_to", List.of(Map.of("path", "a", "relationship", "depends_on")));
        data.put("created_at", "yesterday");
        MalformedEntryException e = assertThrows(MalformedEntryException.class,
                () -> EntryCodec.fromMap("x.json", data));
        assertEquals(3, e.problems().size());
    }

    @Test void relationWithoutPathIsMalformed() {
        Map<String, Object> data = completeWith("related_to", List.of(Map.of("relationship", "related")));
        MalformedEntryException e = assertThrows(MalformedEntryException.class,
                () -> EntryCodec.fromMap("x.json", data));
        assertTrue(e.problems().get(0).contains("'path' is required"));
    }

    @Test void inputDecodingReportsValidationErrors() {
        EntryValidationException e = assertThrows(EntryValidationException.class,
                () -> EntryCodec.inputFromMap(completeWith("priority", "URGENT")));
        assertEquals(1, e.errors().size());
    }

    @Test void acceptsOffsetTimestamps() {
        KnowledgeEntry e = EntryCodec.fromMap("x.json", completeWith("created_at", "2026-01-02T05:04:05+02:00"));
        assertEquals(Instant.parse("2026-01-02T03:04:05Z"), e.createdAt());
    }

    // ── patches ───────────────────────────────────────────────────────────────────

    @Test void patchKeepsAbsentFieldsNull() {
        EntryPatch patch = EntryCodec.patchFromMap(Map.of("solution", "new"));
        assertEquals("new", patch.solution());
        assertNull(patch.problem());
        assertNull(patch.priority());
        assertFalse(patch.replacesRelations());
    }

    @Test void patchWithEmptyRelationsReplacesThem() {
        EntryPatch patch = EntryCodec.patchFromMap(Map.of("related_to", List.of()));
        assertTrue(patch.replacesRelations());
        assertTrue(patch.relatedTo().isEmpty());
    }

    // ── encoding ──────────────────────────────────────────────────────────────────

    @Test void encodesSnakeCaseAndOmitsAbsentFields() {
        KnowledgeEntry e = KnowledgeEntry.builder()
                .priority(Priority.EDGE_CASE)
                .problem("p")
                .solution("s")
                .build();
        Map<String, Object> m = EntryCodec.toMap(e);
        assertEquals("EDGE-CASE", m.get("priority"));
        assertFalse(m.containsKey("title"));
        assertFalse(m.containsKey("related_to"));
        assertFalse(m.containsKey("tags"));
    }

    @Test void encodedDocumentDecodesToSameEntry() {
        KnowledgeEntry e = EntryCodec.fromMap("security/jwt.json", COMPLETE);
        assertEquals(e, EntryCodec.fromMap("security/jwt.json", EntryCodec.toMap(e)));
    }
}

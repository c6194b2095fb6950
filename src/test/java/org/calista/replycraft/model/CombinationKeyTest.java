package org.calista.replycraft.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CombinationKeyTest {

    @Test
    void testKeyIndependentOfAssignmentOrder() {
        Candidate a = Candidate.builder()
                .with(EntityRef.rhetoric("agree_build"))
                .with(EntityRef.lengthPacing("drive_by"))
                .with(EntityRef.personality("friendly"))
                .with(EntityRef.vocabulary("plain_english"))
                .build();
        Candidate b = Candidate.of("friendly", "plain_english", "agree_build", "drive_by");

        assertEquals(b.key(), a.key());
        assertEquals("v1:friendly|plain_english|agree_build|drive_by", a.key());
        assertEquals(a, b);
    }

    @Test
    void testMissingSlotIsEmptyString() {
        Candidate legacy = Candidate.of("friendly", null, "ask_question", " ");
        assertEquals("v1:friendly||ask_question|", legacy.key());
        assertEquals("v1:|||", Candidate.empty().key());
    }

    @Test
    void testLabelDoesNotAffectIdentity() {
        Candidate c = Candidate.of("friendly", "plain_english", "agree_build", "drive_by");
        Candidate labeled = c.withLabel("The Friend");
        assertEquals(c, labeled);
        assertEquals(c.key(), labeled.key());
        assertEquals(c.hashCode(), labeled.hashCode());
    }

    @Test
    void testParseRestoresSlots() {
        Candidate legacy = Candidate.of("friendly", null, "ask_question", null);
        Candidate parsed = CombinationKey.parse(legacy.key());
        assertEquals(legacy, parsed);
        assertTrue(parsed.slot(EntityKind.VOCABULARY).isEmpty());
        assertEquals(2, parsed.size());
    }

    @Test
    void testParseRejectsForeignVersionAndShape() {
        assertThrows(IllegalArgumentException.class, () -> CombinationKey.parse("v0:a|b|c|d"));
        assertThrows(IllegalArgumentException.class, () -> CombinationKey.parse("v1:a|b|c"));
        assertThrows(IllegalArgumentException.class, () -> CombinationKey.parse("v1:a|b|c|d|e"));
        assertThrows(IllegalArgumentException.class, () -> CombinationKey.parse("v1: a|b|c|d"));
        assertFalse(CombinationKey.hasCurrentVersion("a|b|c|d"));
    }

    @Test
    void testEntityIdsAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> EntityRef.personality("a|b"));
        assertThrows(IllegalArgumentException.class, () -> EntityRef.personality("  "));
        assertEquals("friendly", EntityRef.personality(" friendly ").id);
    }

    @Test
    void testKindStorageNames() {
        assertEquals(EntityKind.LENGTH_PACING, EntityKind.fromStorageName("lengthPacing"));
        assertEquals(EntityKind.RHETORIC, EntityKind.fromStorageName("RHETORIC"));
        assertThrows(IllegalArgumentException.class, () -> EntityKind.fromStorageName("tone"));
    }
}

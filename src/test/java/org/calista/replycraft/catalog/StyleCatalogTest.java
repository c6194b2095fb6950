package org.calista.replycraft.catalog;

import org.calista.replycraft.model.Candidate;
import org.calista.replycraft.model.EntityKind;
import org.calista.replycraft.model.EntityRef;
import org.calista.replycraft.testutil.TestCatalogs;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StyleCatalogTest {

    @Test
    void testCandidatesArePersonalityMajor() {
        List<Candidate> all = TestCatalogs.small().allCandidates();

        assertEquals(8, all.size());
        assertEquals(Candidate.of("friendly", "plain", "agree_and_build", "punchy"), all.get(0));
        assertEquals(Candidate.of("friendly", "plain", "devils_advocate", "punchy"), all.get(1));
        assertEquals(Candidate.of("friendly", "academic", "agree_and_build", "punchy"), all.get(2));
        assertEquals(Candidate.of("analytical", "plain", "agree_and_build", "punchy"), all.get(4));
    }

    @Test
    void testCandidateListIsBuiltOnce() {
        StyleCatalog c = TestCatalogs.small();
        assertSame(c.allCandidates(), c.allCandidates());
        assertThrows(UnsupportedOperationException.class, () -> c.allCandidates().add(Candidate.empty()));
    }

    @Test
    void testDuplicateEntityRejected() {
        Map<EntityKind, List<StyleEntity>> m = new EnumMap<>(EntityKind.class);
        StyleEntity e = new StyleEntity(EntityRef.personality("dup"), null, null, null, null);
        m.put(EntityKind.PERSONALITY, List.of(e, e));
        assertThrows(IllegalArgumentException.class, () -> new StyleCatalog(m, List.of()));
    }

    @Test
    void testEntityUnderWrongKindRejected() {
        Map<EntityKind, List<StyleEntity>> m = new EnumMap<>(EntityKind.class);
        m.put(EntityKind.VOCABULARY, List.of(new StyleEntity(EntityRef.personality("p"), null, null, null, null)));
        assertThrows(IllegalArgumentException.class, () -> new StyleCatalog(m, List.of()));
    }

    @Test
    void testPersonaLookup() {
        StyleCatalog c = TestCatalogs.small();
        Persona p = c.persona("the_nerd").orElseThrow();
        assertEquals("The Nerd", p.name);
        assertTrue(c.persona("nobody").isEmpty());
    }
}

package org.calista.replycraft.testutil;

import org.calista.replycraft.catalog.Persona;
import org.calista.replycraft.catalog.Register;
import org.calista.replycraft.catalog.StyleCatalog;
import org.calista.replycraft.catalog.StyleEntity;
import org.calista.replycraft.model.Candidate;
import org.calista.replycraft.model.EntityKind;
import org.calista.replycraft.model.EntityRef;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Small hand-made catalog: 2 personalities x 2 vocabularies x 2 rhetoric x 1 pacing = 8 candidates.
 */
public final class TestCatalogs {

    private TestCatalogs() {
    }

    public static StyleCatalog small() {
        Map<EntityKind, List<StyleEntity>> m = new EnumMap<>(EntityKind.class);
        m.put(EntityKind.PERSONALITY, List.of(
                entity(EntityRef.personality("friendly"), Register.CASUAL, "good-for-replies", "humor"),
                entity(EntityRef.personality("analytical"), Register.PROFESSIONAL, "data", "question")));
        m.put(EntityKind.VOCABULARY, List.of(
                entity(EntityRef.vocabulary("plain"), Register.NEUTRAL),
                entity(EntityRef.vocabulary("academic"), Register.PROFESSIONAL, "data")));
        m.put(EntityKind.RHETORIC, List.of(
                entity(EntityRef.rhetoric("agree_and_build"), Register.NEUTRAL, "good-for-replies"),
                entity(EntityRef.rhetoric("devils_advocate"), Register.CASUAL, "debate", "opinion")));
        m.put(EntityKind.LENGTH_PACING, List.of(
                entity(EntityRef.lengthPacing("punchy"), Register.CASUAL)));

        List<Persona> personas = List.of(
                new Persona("the_nerd", "The Nerd", "numbers first",
                        Candidate.of("analytical", "academic", "agree_and_build", "punchy")));
        return new StyleCatalog(m, personas);
    }

    public static Candidate friendlyPlain() {
        return Candidate.of("friendly", "plain", "agree_and_build", "punchy");
    }

    public static Candidate analyticalAcademic() {
        return Candidate.of("analytical", "academic", "devils_advocate", "punchy");
    }

    private static StyleEntity entity(EntityRef ref, Register register, String... tags) {
        return new StyleEntity(ref, null, "test", List.of(tags), register);
    }
}

package org.calista.replycraft.catalog;

import org.calista.replycraft.model.Candidate;

import java.util.Objects;

/** Pre-bundled candidate with all four slots fixed. */
public final class Persona {
    public final String id;
    public final String name;
    public final String description;
    public final Candidate candidate;

    public Persona(String id, String name, String description, Candidate candidate) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Persona.id is required");
        this.id = id.trim();
        this.name = (name == null || name.isBlank()) ? this.id : name.trim();
        this.description = description == null ? "" : description.trim();
        Objects.requireNonNull(candidate, "candidate");
        if (!candidate.isFull()) {
            throw new IllegalArgumentException("Persona " + id + " must fill all four slots: " + candidate.key());
        }
        this.candidate = candidate.withLabel(this.name);
    }

    @Override
    public String toString() {
        return "Persona{" + id + " -> " + candidate.key() + '}';
    }
}

package org.calista.replycraft.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.replycraft.io.FileIO;
import org.calista.replycraft.model.Candidate;
import org.calista.replycraft.model.EntityKind;
import org.calista.replycraft.model.EntityRef;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads a {@link StyleCatalog} from JSON.
 *
 * <p>
 * Schema "catalog-v1": {@code entities} keyed by kind storage name, each an ordered list of
 * {id,label,category,register,tags}; {@code personas} list {id,name,description,personality,
 * vocabulary,rhetoric,lengthPacing}. A broken catalog is a developer error: load fails.
 * </p>
 */
public final class CatalogLoader {
    private static final Logger log = LogManager.getLogger(CatalogLoader.class);

    public static final String DEFAULT_RESOURCE = "/catalog/default-catalog.json";
    public static final String SCHEMA = "catalog-v1";

    private final ObjectMapper mapper;

    public CatalogLoader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public StyleCatalog loadDefault() throws IOException {
        try (InputStream in = CatalogLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IOException("Bundled catalog not found on classpath: " + DEFAULT_RESOURCE);
            CatalogFile f = mapper.readValue(in, CatalogFile.class);
            return build(f, DEFAULT_RESOURCE);
        }
    }

    public StyleCatalog load(FileIO io, Path file) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(file, "file");
        String json = io.readString(file);
        CatalogFile f = mapper.readValue(json, CatalogFile.class);
        return build(f, file.toString());
    }

    StyleCatalog build(CatalogFile f, String origin) throws IOException {
        if (f == null) throw new IOException("Empty catalog: " + origin);
        if (f.schema != null && !SCHEMA.equals(f.schema)) {
            throw new IOException("Unsupported catalog schema '" + f.schema + "' in " + origin);
        }

        EnumMap<EntityKind, List<StyleEntity>> entities = new EnumMap<>(EntityKind.class);
        Map<String, List<EntityDto>> raw = f.entities == null ? Map.of() : f.entities;

        try {
            for (var e : raw.entrySet()) {
                EntityKind kind = EntityKind.fromStorageName(e.getKey());
                List<StyleEntity> list = new ArrayList<>();
                if (e.getValue() != null) {
                    for (EntityDto d : e.getValue()) {
                        if (d == null) continue;
                        list.add(new StyleEntity(new EntityRef(kind, d.id), d.label, d.category, d.tags, Register.parse(d.register)));
                    }
                }
                entities.put(kind, list);
            }

            List<Persona> personas = new ArrayList<>();
            if (f.personas != null) {
                for (PersonaDto p : f.personas) {
                    if (p == null) continue;
                    Candidate c = Candidate.of(p.personality, p.vocabulary, p.rhetoric, p.lengthPacing);
                    personas.add(new Persona(p.id, p.name, p.description, c));
                }
            }

            StyleCatalog catalog = new StyleCatalog(entities, personas);
            log.info("Catalog loaded from {}: entities={}, personas={}", origin, catalog.size(), catalog.personas().size());
            return catalog;
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid catalog " + origin + ": " + e.getMessage(), e);
        }
    }

    // -------------------- DTOs --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CatalogFile {
        public String schema;
        public Map<String, List<EntityDto>> entities = new LinkedHashMap<>();
        public List<PersonaDto> personas = List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EntityDto {
        public String id;
        public String label;
        public String category;
        public String register;
        public List<String> tags = List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PersonaDto {
        public String id;
        public String name;
        public String description;
        public String personality;
        public String vocabulary;
        public String rhetoric;
        public String lengthPacing;
    }
}

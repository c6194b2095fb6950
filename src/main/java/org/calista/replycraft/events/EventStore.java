package org.calista.replycraft.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.replycraft.io.FileIO;
import org.calista.replycraft.model.Candidate;
import org.calista.replycraft.usage.SelectionListener;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only JSONL log of selections. Registered on the ledger as a {@link SelectionListener}.
 */
public final class EventStore implements SelectionListener {
    private static final Logger log = LogManager.getLogger(EventStore.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public EventStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = io;
        this.mapper = mapper;
        this.file = file;
    }

    public void append(SelectionEvent e) throws IOException {
        String line = mapper.writeValueAsString(e);
        io.appendJsonl(file, line);
    }

    @Override
    public void onSelection(Candidate candidate, String key, String source, long atEpochMs) {
        try {
            append(SelectionEvent.of(SelectionEvent.TYPE_SELECTION, source, key, atEpochMs));
        } catch (IOException e) {
            log.warn("Failed to append selection event to {}: {}", file, e.toString());
        }
    }

    /** Parsed events; lines that do not parse are skipped. */
    public List<SelectionEvent> readAll() throws IOException {
        List<SelectionEvent> out = new ArrayList<>();
        for (String line : io.readJsonl(file)) {
            if (line == null || line.isBlank()) continue;
            try {
                out.add(mapper.readValue(line, SelectionEvent.class));
            } catch (IOException e) {
                log.debug("Skipping unreadable event line: {}", e.getMessage());
            }
        }
        return out;
    }
}

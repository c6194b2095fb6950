package org.calista.replycraft.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.replycraft.io.FileIO;
import org.calista.replycraft.model.Candidate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void testSelectionsAppendOneLineEach() throws Exception {
        FileIO io = new FileIO(tempDir);
        EventStore events = new EventStore(io, new ObjectMapper(), io.resolve("selections.jsonl"));
        Candidate c = Candidate.of("friendly", null, "support", null);

        events.onSelection(c, c.key(), "persona", 1000L);
        events.onSelection(c, c.key(), "manual", 2000L);

        List<SelectionEvent> all = events.readAll();
        assertEquals(2, all.size());
        assertEquals(SelectionEvent.TYPE_SELECTION, all.get(0).type);
        assertEquals("persona", all.get(0).source);
        assertEquals("v1:friendly||support|", all.get(1).key);
        assertEquals(2000L, all.get(1).tsEpochMs);
    }
}

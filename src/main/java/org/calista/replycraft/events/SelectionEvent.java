package org.calista.replycraft.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class SelectionEvent {
    public static final String TYPE_SELECTION = "SELECTION";

    public String type;
    public long tsEpochMs;
    public String source;   // provenance tag, e.g. "persona"
    public String key;      // combination key

    public static SelectionEvent of(String type, String source, String key, long tsEpochMs) {
        SelectionEvent e = new SelectionEvent();
        e.type = type;
        e.source = source;
        e.key = key;
        e.tsEpochMs = tsEpochMs;
        return e;
    }
}

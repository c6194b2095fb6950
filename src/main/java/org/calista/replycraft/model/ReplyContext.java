package org.calista.replycraft.model;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reply context as delivered by the page-extraction collaborator.
 * The engine never calls back into the host page.
 */
public final class ReplyContext {

    public final String tweetText;
    public final boolean isReply;
    /** Oldest first, possibly empty. */
    public final List<ThreadMessage> threadContext;
    /** Local hour 0..23. */
    public final int timeOfDay;
    /** 0..6, 0 = Sunday. */
    public final int dayOfWeek;

    public ReplyContext(String tweetText, boolean isReply, List<ThreadMessage> threadContext, int timeOfDay, int dayOfWeek) {
        if (timeOfDay < 0 || timeOfDay > 23) {
            throw new IllegalArgumentException("timeOfDay must be in 0..23: " + timeOfDay);
        }
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new IllegalArgumentException("dayOfWeek must be in 0..6: " + dayOfWeek);
        }
        this.tweetText = tweetText == null ? "" : tweetText;
        this.isReply = isReply;
        if (threadContext == null || threadContext.isEmpty()) {
            this.threadContext = List.of();
        } else {
            ArrayList<ThreadMessage> copy = new ArrayList<>(threadContext.size());
            for (ThreadMessage m : threadContext) {
                if (m != null) copy.add(m);
            }
            this.threadContext = Collections.unmodifiableList(copy);
        }
        this.timeOfDay = timeOfDay;
        this.dayOfWeek = dayOfWeek;
    }

    /** Context stamped with the clock's local hour and weekday. */
    public static ReplyContext now(String tweetText, boolean isReply, List<ThreadMessage> thread, Clock clock) {
        Objects.requireNonNull(clock, "clock");
        ZonedDateTime t = ZonedDateTime.now(clock);
        // DayOfWeek: MONDAY=1..SUNDAY=7 -> 0=Sunday
        int dow = t.getDayOfWeek().getValue() % 7;
        return new ReplyContext(tweetText, isReply, thread, t.getHour(), dow);
    }

    public int threadLength() {
        return threadContext.size();
    }

    public boolean hasText() {
        return !tweetText.isBlank();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof ReplyContext c)) return false;
        return isReply == c.isReply
                && timeOfDay == c.timeOfDay
                && dayOfWeek == c.dayOfWeek
                && tweetText.equals(c.tweetText)
                && threadContext.equals(c.threadContext);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tweetText, isReply, threadContext, timeOfDay, dayOfWeek);
    }

    @Override
    public String toString() {
        return "ReplyContext{reply=" + isReply + ", thread=" + threadContext.size()
                + ", hour=" + timeOfDay + ", dow=" + dayOfWeek + ", textLen=" + tweetText.length() + "}";
    }

    public static final class ThreadMessage {
        public final String author;
        public final String text;

        public ThreadMessage(String author, String text) {
            this.author = author == null ? "" : author;
            this.text = text == null ? "" : text;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) return true;
            if (!(other instanceof ThreadMessage m)) return false;
            return author.equals(m.author) && text.equals(m.text);
        }

        @Override
        public int hashCode() {
            return Objects.hash(author, text);
        }

        @Override
        public String toString() {
            return author + ": " + text;
        }
    }
}

package com.videre.tracker.ingest;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventTrackerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T20:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock private EventDatabaseWriter writer;

    @Test
    void alreadyCompletedEventIsFinalizedOnConstruction() {
        Instant reportedEnd = NOW.minusSeconds(600);
        given(writer.updateEventEndTime(100L, reportedEnd)).willReturn(true);

        EventTracker tracker = new EventTracker(event(100, true, reportedEnd), writer, clock);

        assertThat(tracker.isFinalized()).isTrue();
        verify(writer).updateEventEndTime(100L, reportedEnd);
    }

    @Test
    void liveEventIsNotFinalizedOnConstruction() {
        EventTracker tracker = new EventTracker(event(100, false, null), writer, clock);

        assertThat(tracker.isFinalized()).isFalse();
        verifyNoInteractions(writer);
    }

    @Test
    void closeRechecksCompletionAndFallsBackToNow() {
        MutableEvent event = event(100, false, null);
        EventTracker tracker = new EventTracker(event, writer, clock);
        event.completed = true;

        tracker.close();

        verify(writer).updateEventEndTime(100L, NOW);
        assertThat(tracker.isFinalized()).isTrue();
        assertThat(tracker.isClosed()).isTrue();
    }

    @Test
    void closeOnLiveEventLeavesEndTimeAlone() {
        EventTracker tracker = new EventTracker(event(100, false, null), writer, clock);
        tracker.close();

        verify(writer, never()).updateEventEndTime(anyLong(), any());
        assertThat(tracker.isFinalized()).isFalse();
    }

    @Test
    void closeIsIdempotent() {
        MutableEvent event = event(100, true, NOW);
        given(writer.updateEventEndTime(eq(100L), any())).willReturn(true, false);
        EventTracker tracker = new EventTracker(event, writer, clock);

        tracker.close();
        tracker.close();

        // construction plus the first close; the second close is a no-op
        verify(writer, times(2)).updateEventEndTime(100L, NOW);
    }

    private static MutableEvent event(long id, boolean completed, Instant endTime) {
        MutableEvent e = new MutableEvent(id);
        e.completed = completed;
        e.endTime = endTime;
        return e;
    }

    private static final class MutableEvent implements TrackedEvent {
        private final long id;
        private boolean completed;
        private Instant endTime;

        private MutableEvent(long id) { this.id = id; }

        @Override public long getId() { return id; }
        @Override public boolean isCompleted() { return completed; }
        @Override public Instant getEndTime() { return endTime; }
    }
}

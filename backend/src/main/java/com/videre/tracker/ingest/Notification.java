package com.videre.tracker.ingest;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.videre.tracker.model.CardEntry;
import com.videre.tracker.model.GamePlayerResult;
import com.videre.tracker.model.GameLogType;

import java.time.Instant;
import java.util.List;

/**
 * Lifecycle notifications pushed by the game client. Every notification carries the
 * client-assigned identity of its subject and, for nested entities, the immediate parent's.
 * Delivery is at-least-once and unordered across branches.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Notification.EventStarted.class, name = "EventStarted"),
        @JsonSubTypes.Type(value = Notification.EventCompleted.class, name = "EventCompleted"),
        @JsonSubTypes.Type(value = Notification.MatchStarted.class, name = "MatchStarted"),
        @JsonSubTypes.Type(value = Notification.GameStarted.class, name = "GameStarted"),
        @JsonSubTypes.Type(value = Notification.GameLogged.class, name = "GameLogged"),
        @JsonSubTypes.Type(value = Notification.GameResultsChanged.class, name = "GameResultsChanged"),
        @JsonSubTypes.Type(value = Notification.SideboardChanged.class, name = "SideboardChanged"),
        @JsonSubTypes.Type(value = Notification.MatchCompleted.class, name = "MatchCompleted")
})
public interface Notification {

    /** Identity of the entity the notification is about. */
    long subjectId();

    record DeckSnapshot(String hash, Long deckId, String name, String format, Instant timestamp,
                        List<CardEntry> mainboard, List<CardEntry> sideboard) {}

    record EventStarted(long eventId, String format, String description, Instant startTime,
                        DeckSnapshot deck, boolean completed, Instant endTime) implements Notification {
        @Override public long subjectId() { return eventId; }
    }

    record EventCompleted(long eventId, Instant endTime) implements Notification {
        @Override public long subjectId() { return eventId; }
    }

    record MatchStarted(long matchId, long eventId) implements Notification {
        @Override public long subjectId() { return matchId; }
    }

    record GameStarted(long gameId, long matchId) implements Notification {
        @Override public long subjectId() { return gameId; }
    }

    record GameLogged(long gameId, Instant timestamp, GameLogType type, String data) implements Notification {
        @Override public long subjectId() { return gameId; }

        public GameLogEntry toEntry() {
            return new GameLogEntry(gameId, timestamp, type, data);
        }
    }

    record GameResultsChanged(long gameId, List<GamePlayerResult> results) implements Notification {
        @Override public long subjectId() { return gameId; }
    }

    /** Mainboard as it stands after sideboarding, heading into {@code gameId}. */
    record SideboardChanged(long matchId, long gameId, List<CardEntry> mainboard) implements Notification {
        @Override public long subjectId() { return matchId; }
    }

    record MatchCompleted(long matchId, List<Long> gameIds, List<String> players) implements Notification {
        @Override public long subjectId() { return matchId; }
    }
}

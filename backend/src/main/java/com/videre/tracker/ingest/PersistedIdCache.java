package com.videre.tracker.ingest;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Identities already known to be durable, with the parent each child was attached to.
 * Owned by one {@link EventDatabaseWriter}; a hit lets the writer skip the parent-existence
 * round trip. Entries are only ever added for committed rows, so a miss just means "ask the store".
 */
public class PersistedIdCache {

    private final Set<Long> events = ConcurrentHashMap.newKeySet();
    private final Map<Long, Long> matchToEvent = new ConcurrentHashMap<>();
    private final Map<Long, Long> gameToMatch = new ConcurrentHashMap<>();

    public void recordEvent(long eventId) {
        events.add(eventId);
    }

    public void recordMatch(long matchId, Long eventId) {
        matchToEvent.putIfAbsent(matchId, eventId != null ? eventId : -1L);
    }

    public void recordGame(long gameId, Long matchId) {
        gameToMatch.putIfAbsent(gameId, matchId != null ? matchId : -1L);
    }

    public void record(RowKind kind, long id) {
        switch (kind) {
            case EVENT: recordEvent(id); break;
            case MATCH: recordMatch(id, null); break;
            case GAME: recordGame(id, null); break;
            default: throw new IllegalArgumentException("Unknown row kind " + kind);
        }
    }

    public boolean contains(RowKind kind, long id) {
        switch (kind) {
            case EVENT: return events.contains(id);
            case MATCH: return matchToEvent.containsKey(id);
            case GAME: return gameToMatch.containsKey(id);
            default: return false;
        }
    }

    public Optional<Long> parentOfGame(long gameId) {
        Long matchId = gameToMatch.get(gameId);
        return matchId == null || matchId < 0 ? Optional.empty() : Optional.of(matchId);
    }

    public int size() {
        return events.size() + matchToEvent.size() + gameToMatch.size();
    }

    public void clear() {
        events.clear();
        matchToEvent.clear();
        gameToMatch.clear();
    }
}

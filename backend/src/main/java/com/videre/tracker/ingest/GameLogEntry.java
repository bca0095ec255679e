package com.videre.tracker.ingest;

import com.videre.tracker.model.GameLogType;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * One observed state change of a game. Ordered by timestamp, then game id, for chronological
 * replay. The {@link #derivedId()} is computed from content so that redelivered copies collapse
 * onto the same row without a read-modify-write.
 */
public final class GameLogEntry implements Comparable<GameLogEntry> {

    /** Width of the per-game identity bucket. */
    public static final long ID_RANGE = 1_000_000_000L;

    private static final long MAX_GAME_ID = Long.MAX_VALUE / ID_RANGE - 1;

    private static final Comparator<GameLogEntry> ORDER = Comparator
            .comparing(GameLogEntry::getTimestamp)
            .thenComparingLong(GameLogEntry::getGameId);

    private final long gameId;
    private final Instant timestamp;
    private final GameLogType type;
    private final String data;

    public GameLogEntry(long gameId, Instant timestamp, GameLogType type, String data) {
        if (gameId < 0 || gameId > MAX_GAME_ID) {
            throw new IllegalArgumentException("Game id out of range: " + gameId);
        }
        this.gameId = gameId;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.type = Objects.requireNonNull(type, "type");
        this.data = data != null ? data : "";
    }

    public long getGameId() { return gameId; }
    public Instant getTimestamp() { return timestamp; }
    public GameLogType getType() { return type; }
    public String getData() { return data; }

    /**
     * Identity for deduplication only: {@code gameId * ID_RANGE + (digest mod ID_RANGE)}.
     * Equal content always maps to the same value; distinct content may collide within a game.
     */
    public long derivedId() {
        return gameId * ID_RANGE + Math.floorMod(contentDigest(), ID_RANGE);
    }

    private long contentDigest() {
        String canonical = gameId + "|" + timestamp + "|" + type.name() + "|" + data;
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public int compareTo(GameLogEntry other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameLogEntry)) return false;
        GameLogEntry that = (GameLogEntry) o;
        return gameId == that.gameId && timestamp.equals(that.timestamp) && type == that.type && data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gameId, timestamp, type, data);
    }

    @Override
    public String toString() {
        return "GameLogEntry[gameId=" + gameId + ", timestamp=" + timestamp + ", type=" + type + "]";
    }
}

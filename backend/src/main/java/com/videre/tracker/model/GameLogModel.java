package com.videre.tracker.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "game_logs", indexes = {
        @Index(name = "idx_game_logs_game_ts", columnList = "game_id, log_timestamp")
})
public class GameLogModel {

    // derived from content, see GameLogEntry#derivedId
    @Id
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "game_id", nullable = false, insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_game_log_game"))
    private GameModel game;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Column(name = "log_timestamp", nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "log_type", length = 32, nullable = false)
    private GameLogType type;

    @Column(name = "data", length = 100000)
    private String data;

    public GameLogModel() {}

    public GameLogModel(Long id, Long gameId, Instant timestamp, GameLogType type, String data) {
        this.id = id;
        this.gameId = gameId;
        this.timestamp = timestamp;
        this.type = type;
        this.data = data;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public GameModel getGame() { return game; }
    public void setGame(GameModel game) { this.game = game; }

    public Long getGameId() { return gameId; }
    public void setGameId(Long gameId) { this.gameId = gameId; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public GameLogType getType() { return type; }
    public void setType(GameLogType type) { this.type = type; }

    public String getData() { return data; }
    public void setData(String data) { this.data = data; }
}

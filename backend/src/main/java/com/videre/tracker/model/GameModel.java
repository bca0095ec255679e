package com.videre.tracker.model;

import jakarta.persistence.*;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "games", indexes = {
        @Index(name = "idx_games_match", columnList = "match_id")
})
public class GameModel {

    @Id
    private Long id;

    // Player results are read-modify-write; concurrent writers retry on a stale version
    @Version
    @Column(name = "version")
    private Long version;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "match_id", nullable = false, foreignKey = @ForeignKey(name = "fk_game_match"))
    private MatchModel match;

    @Convert(converter = JsonColumnConverters.GamePlayerResultList.class)
    @Column(name = "game_player_results", length = 100000)
    private List<GamePlayerResult> gamePlayerResults = new ArrayList<>();

    @OneToMany(mappedBy = "game", fetch = FetchType.LAZY)
    @OrderBy("timestamp ASC")
    private List<GameLogModel> gameLogs = new ArrayList<>();

    public GameModel() {}

    public GameModel(Long id) {
        this.id = id;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Long getVersion() { return version; }

    public MatchModel getMatch() { return match; }
    public void setMatch(MatchModel match) { this.match = match; }

    public List<GamePlayerResult> getGamePlayerResults() { return gamePlayerResults; }
    public void setGamePlayerResults(List<GamePlayerResult> gamePlayerResults) { this.gamePlayerResults = gamePlayerResults; }

    public List<GameLogModel> getGameLogs() { return gameLogs; }
    public void setGameLogs(List<GameLogModel> gameLogs) { this.gameLogs = gameLogs; }
}

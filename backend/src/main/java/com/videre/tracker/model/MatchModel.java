package com.videre.tracker.model;

import jakarta.persistence.*;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Entity
@Table(name = "matches", indexes = {
        @Index(name = "idx_matches_event", columnList = "event_id")
})
public class MatchModel {

    @Id
    private Long id;

    // Results and sideboard changes are read-modify-write; concurrent writers retry on a stale version
    @Version
    @Column(name = "version")
    private Long version;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "event_id", nullable = false, foreignKey = @ForeignKey(name = "fk_match_event"))
    private EventModel event;

    @Convert(converter = JsonColumnConverters.PlayerResultList.class)
    @Column(name = "player_results", length = 100000)
    private List<PlayerResult> playerResults = new ArrayList<>();

    @Convert(converter = JsonColumnConverters.SideboardChanges.class)
    @Column(name = "sideboard_changes", length = 100000)
    private Map<Long, List<CardEntry>> sideboardChanges = new LinkedHashMap<>();

    @OneToMany(mappedBy = "match", fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    private List<GameModel> games = new ArrayList<>();

    public MatchModel() {}

    public MatchModel(Long id) {
        this.id = id;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Long getVersion() { return version; }

    public EventModel getEvent() { return event; }
    public void setEvent(EventModel event) { this.event = event; }

    public List<PlayerResult> getPlayerResults() { return playerResults; }
    public void setPlayerResults(List<PlayerResult> playerResults) { this.playerResults = playerResults; }

    public Map<Long, List<CardEntry>> getSideboardChanges() { return sideboardChanges; }
    public void setSideboardChanges(Map<Long, List<CardEntry>> sideboardChanges) { this.sideboardChanges = sideboardChanges; }

    public List<GameModel> getGames() { return games; }
    public void setGames(List<GameModel> games) { this.games = games; }
}

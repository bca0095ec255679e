package com.videre.tracker.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "events", indexes = {
        @Index(name = "idx_events_format", columnList = "format"),
        @Index(name = "idx_events_start_time", columnList = "start_time")
})
public class EventModel {

    // assigned by the game client, never generated
    @Id
    private Long id;

    @Column(length = 64)
    private String format;

    @Column(length = 255)
    private String description;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "deck_hash", nullable = true, foreignKey = @ForeignKey(name = "fk_event_deck"))
    private DeckModel deck;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime; // set once, see EventRepository.setEndTimeIfUnset

    @OneToMany(mappedBy = "event", fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    private List<MatchModel> matches = new ArrayList<>();

    public EventModel() {}

    public EventModel(Long id, String format, String description, Instant startTime) {
        this.id = id;
        this.format = format;
        this.description = description;
        this.startTime = startTime;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getFormat() { return format; }
    public void setFormat(String format) { this.format = format; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public DeckModel getDeck() { return deck; }
    public void setDeck(DeckModel deck) { this.deck = deck; }

    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }

    public Instant getEndTime() { return endTime; }
    public void setEndTime(Instant endTime) { this.endTime = endTime; }

    public List<MatchModel> getMatches() { return matches; }
    public void setMatches(List<MatchModel> matches) { this.matches = matches; }
}

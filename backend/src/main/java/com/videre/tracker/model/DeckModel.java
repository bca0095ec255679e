package com.videre.tracker.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "decks")
public class DeckModel {

    @Id
    @Column(name = "hash", length = 128, nullable = false)
    private String hash;

    @Column(name = "deck_id")
    private Long deckId;

    @Column(length = 255)
    private String name;

    @Column(length = 64)
    private String format;

    @Column(name = "deck_timestamp")
    private Instant timestamp;

    @Convert(converter = JsonColumnConverters.CardEntryList.class)
    @Column(name = "mainboard", length = 100000)
    private List<CardEntry> mainboard = new ArrayList<>();

    @Convert(converter = JsonColumnConverters.CardEntryList.class)
    @Column(name = "sideboard", length = 100000)
    private List<CardEntry> sideboard = new ArrayList<>();

    public DeckModel() {}

    public DeckModel(String hash, Long deckId, String name, String format, Instant timestamp,
                     List<CardEntry> mainboard, List<CardEntry> sideboard) {
        this.hash = hash;
        this.deckId = deckId;
        this.name = name;
        this.format = format;
        this.timestamp = timestamp;
        this.mainboard = mainboard != null ? new ArrayList<>(mainboard) : new ArrayList<>();
        this.sideboard = sideboard != null ? new ArrayList<>(sideboard) : new ArrayList<>();
    }

    public String getHash() { return hash; }
    public void setHash(String hash) { this.hash = hash; }

    public Long getDeckId() { return deckId; }
    public void setDeckId(Long deckId) { this.deckId = deckId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getFormat() { return format; }
    public void setFormat(String format) { this.format = format; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public List<CardEntry> getMainboard() { return mainboard; }
    public void setMainboard(List<CardEntry> mainboard) { this.mainboard = mainboard; }

    public List<CardEntry> getSideboard() { return sideboard; }
    public void setSideboard(List<CardEntry> sideboard) { this.sideboard = sideboard; }
}

package com.videre.tracker.dto;

import com.videre.tracker.model.GameLogModel;
import com.videre.tracker.model.GameLogType;

import java.time.Instant;

public record GameLogDTO(Long id, Long gameId, Instant timestamp, GameLogType type, String data) {

    public static GameLogDTO from(GameLogModel m) {
        return new GameLogDTO(m.getId(), m.getGameId(), m.getTimestamp(), m.getType(), m.getData());
    }
}

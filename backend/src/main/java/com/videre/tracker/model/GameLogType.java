package com.videre.tracker.model;

public enum GameLogType {
    PHASE_CHANGE,
    TURN_CHANGE,
    ZONE_CHANGE,
    GAME_ACTION,
    LIFE_CHANGE,
    LOG_MESSAGE
}

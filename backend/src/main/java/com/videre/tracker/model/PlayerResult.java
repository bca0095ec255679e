package com.videre.tracker.model;

public record PlayerResult(String player, MatchResult result, int wins, int losses, int draws) {}

package com.videre.tracker.model;

public record GamePlayerResult(String player, PlayDrawResult playDraw, MatchResult result, long clockSeconds) {}

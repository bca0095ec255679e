package com.videre.tracker.model;

public enum MatchResult { WIN, LOSS, DRAW }

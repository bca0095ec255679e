package com.videre.tracker.ingest;

/** Hierarchy levels with caller-assigned identities. */
public enum RowKind { EVENT, MATCH, GAME }

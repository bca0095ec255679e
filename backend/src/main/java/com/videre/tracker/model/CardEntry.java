package com.videre.tracker.model;

/**
 * One card line of a deck or a sideboard delta. For deltas the quantity is signed.
 */
public record CardEntry(int catalogId, String name, int quantity) {}

package com.videre.tracker.model;

public enum PlayDrawResult { PLAY, DRAW }

package com.gorax.collab.session;

public record CursorPosition(double x, double y) {}

package com.cra.context;

public record MatchResult(String packId, int score, LoadedContext entry) {
}

package com.example.fishbowl.game.dto.response;

import java.util.List;

public record PhraseSubmissionStatus(
        int phrasesPerPlayer,
        long totalSubmitted,
        boolean allSubmitted,
        List<PlayerProgress> players) {

    public record PlayerProgress(String playerId, String playerName, long submitted, boolean complete) {
    }
}

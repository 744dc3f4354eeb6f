package com.example.fishbowl.game.dto.response;

public record PhraseActionResponse(
        String phraseId,
        String phraseStatus,
        long remainingPhrases,
        boolean roundComplete,
        TurnSummary turn,
        GameSnapshot game) {
}

package com.example.fishbowl.game.dto.response;

import com.example.fishbowl.game.domain.entity.Phrase;

public record PhraseResponse(
        String id,
        String playerId,
        String text,
        String status,
        Integer guessedInRound) {

    public static PhraseResponse from(Phrase phrase) {
        return new PhraseResponse(phrase.getId(), phrase.getPlayerId(), phrase.getText(),
                phrase.getStatus().getValue(), phrase.getGuessedInRound());
    }
}

package com.example.fishbowl.game.domain.entity;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import com.example.fishbowl.game.domain.state.PhraseStatus;
import com.example.fishbowl.global.util.GameCodeGenerator;

@Entity
@Table(name = "phrases", indexes = {
        @Index(name = "idx_phrases_game_status", columnList = "game_id, status"),
        @Index(name = "idx_phrases_player", columnList = "player_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Phrase {
    @Id
    @Column(name = "phrase_id", nullable = false)
    private String id;

    @Column(name = "game_id", nullable = false)
    private String gameId;

    @Column(name = "player_id", nullable = false)
    private String playerId;

    @Column(nullable = false, length = 100)
    private String text;

    @Builder.Default
    @Column(nullable = false, length = 20)
    private PhraseStatus status = PhraseStatus.ACTIVE;

    @Column(name = "guessed_in_round")
    private Integer guessedInRound;

    @Column(name = "guessed_by_team_id")
    private String guessedByTeamId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public static Phrase submit(String gameId, String playerId, String text) {
        return Phrase.builder()
                .id(GameCodeGenerator.generateId())
                .gameId(gameId)
                .playerId(playerId)
                .text(text)
                .status(PhraseStatus.ACTIVE)
                .createdAt(LocalDateTime.now())
                .build();
    }

    public boolean isActive() {
        return status == PhraseStatus.ACTIVE;
    }

    public void markGuessed(int round, String teamId) {
        this.status = PhraseStatus.GUESSED;
        this.guessedInRound = round;
        this.guessedByTeamId = teamId;
    }

    public void markSkipped() {
        this.status = PhraseStatus.SKIPPED;
    }
}

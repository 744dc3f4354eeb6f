package com.example.fishbowl.game.domain.entity;

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

import com.example.fishbowl.global.util.GameCodeGenerator;

@Entity
@Table(name = "teams", indexes = {
        @Index(name = "idx_teams_game", columnList = "game_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Team {
    @Id
    @Column(name = "team_id", nullable = false)
    private String id;

    @Column(name = "game_id", nullable = false)
    private String gameId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String color;

    // 생성 순서 (팀 배정 시 동점이면 앞 팀 우선)
    @Column(name = "slot", nullable = false)
    private int slot;

    @Builder.Default
    @Column(name = "score_round_1", nullable = false)
    private int scoreRound1 = 0;

    @Builder.Default
    @Column(name = "score_round_2", nullable = false)
    private int scoreRound2 = 0;

    @Builder.Default
    @Column(name = "score_round_3", nullable = false)
    private int scoreRound3 = 0;

    @Builder.Default
    @Column(name = "total_score", nullable = false)
    private int totalScore = 0;

    public static Team create(String gameId, int slot, String name, String color) {
        return Team.builder()
                .id(GameCodeGenerator.generateId())
                .gameId(gameId)
                .slot(slot)
                .name(name)
                .color(color)
                .build();
    }

    /**
     * 턴 종료 시 1회만 호출된다. 라운드 점수와 총점을 함께 올린다.
     */
    public void addScore(int round, int points) {
        switch (round) {
            case 1 -> this.scoreRound1 += points;
            case 2 -> this.scoreRound2 += points;
            case 3 -> this.scoreRound3 += points;
            default -> throw new IllegalArgumentException("잘못된 라운드: " + round);
        }
        this.totalScore += points;
    }

    public int getRoundScore(int round) {
        return switch (round) {
            case 1 -> scoreRound1;
            case 2 -> scoreRound2;
            case 3 -> scoreRound3;
            default -> throw new IllegalArgumentException("잘못된 라운드: " + round);
        };
    }
}

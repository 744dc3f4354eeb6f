package com.example.fishbowl.game.domain.entity;

import java.time.Duration;
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

import com.example.fishbowl.game.domain.state.PausedReason;
import com.example.fishbowl.global.util.GameCodeGenerator;

@Entity
@Table(name = "turns", indexes = {
        @Index(name = "idx_turns_game_complete", columnList = "game_id, is_complete"),
        @Index(name = "idx_turns_player", columnList = "player_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Turn {
    @Id
    @Column(name = "turn_id", nullable = false)
    private String id;

    @Column(name = "game_id", nullable = false)
    private String gameId;

    @Column(nullable = false)
    private int round;

    @Column(name = "team_id", nullable = false)
    private String teamId;

    @Column(name = "player_id", nullable = false)
    private String playerId;

    @Column(name = "start_time")
    private LocalDateTime startTime;

    @Column(name = "end_time")
    private LocalDateTime endTime;

    @Column(name = "paused_at")
    private LocalDateTime pausedAt;

    @Column(name = "resumed_at")
    private LocalDateTime resumedAt;

    @Column(name = "paused_reason", length = 30)
    private PausedReason pausedReason;

    // 실제 진행된 시간 (초), 일시정지 구간 제외
    @Builder.Default
    @Column(nullable = false)
    private int duration = 0;

    @Builder.Default
    @Column(name = "phrases_guessed", nullable = false)
    private int phrasesGuessed = 0;

    @Builder.Default
    @Column(name = "phrases_skipped", nullable = false)
    private int phrasesSkipped = 0;

    @Builder.Default
    @Column(name = "points_scored", nullable = false)
    private int pointsScored = 0;

    @Builder.Default
    @Column(name = "is_complete", nullable = false)
    private boolean complete = false;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public static Turn create(String gameId, int round, String teamId, String playerId) {
        return Turn.builder()
                .id(GameCodeGenerator.generateId())
                .gameId(gameId)
                .round(round)
                .teamId(teamId)
                .playerId(playerId)
                .createdAt(LocalDateTime.now())
                .build();
    }

    /**
     * 아직 시작되지 않은 턴 (게임 시작 또는 라운드 종료 시 미리 만들어 둔 턴)
     */
    public boolean isPending() {
        return !complete && startTime == null;
    }

    public void begin(LocalDateTime now) {
        this.startTime = now;
        this.resumedAt = null;
    }

    public boolean isPaused() {
        return pausedAt != null;
    }

    public void pause(LocalDateTime now, PausedReason reason) {
        accumulateDuration(now);
        this.pausedAt = now;
        this.pausedReason = reason;
    }

    public void resume(LocalDateTime now) {
        this.pausedAt = null;
        this.pausedReason = null;
        // 재개 시점부터 다시 측정
        this.resumedAt = now;
    }

    public void recordGuess(int points) {
        this.phrasesGuessed++;
        this.pointsScored += points;
    }

    public void recordSkip() {
        this.phrasesSkipped++;
    }

    public void complete(LocalDateTime now) {
        accumulateDuration(now);
        this.endTime = now;
        this.complete = true;
    }

    private void accumulateDuration(LocalDateTime now) {
        if (startTime == null || pausedAt != null) {
            return;
        }
        LocalDateTime segmentStart = resumedAt != null ? resumedAt : startTime;
        this.duration += (int) Math.max(0, Duration.between(segmentStart, now).getSeconds());
    }
}

package com.example.fishbowl.game.domain.entity;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import com.example.fishbowl.game.domain.state.GameStatus;
import com.example.fishbowl.game.domain.state.GameSubStatus;
import com.example.fishbowl.game.domain.state.RoundType;

@Entity
@Table(name = "games", indexes = {
        @Index(name = "idx_games_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Game {
    @Id
    @Column(name = "game_id", length = 6, nullable = false)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(name = "host_player_id")
    private String hostPlayerId;

    @Column(nullable = false, length = 20)
    private GameStatus status;

    @Column(name = "sub_status", nullable = false, length = 30)
    private GameSubStatus subStatus;

    @Column(name = "team_count", nullable = false)
    private int teamCount;

    @Column(name = "phrases_per_player", nullable = false)
    private int phrasesPerPlayer;

    @Column(name = "timer_duration", nullable = false)
    private int timerDuration;

    @Builder.Default
    @Column(name = "current_round", nullable = false)
    private int currentRound = 1;

    @Column(name = "current_turn_id")
    private String currentTurnId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    /**
     * Optimistic Lock (낙관적 락)용 버전 필드
     * 같은 게임에 대한 상태 전이가 동시에 커밋되면 한쪽은 ObjectOptimisticLockingFailureException
     */
    @Version
    private Long version;

    /**
     * 새 게임 생성 - 설정 단계에서 시작
     */
    public static Game createNew(String code, String name, int teamCount, int phrasesPerPlayer, int timerDuration) {
        return Game.builder()
                .id(code)
                .name(name)
                .status(GameStatus.SETUP)
                .subStatus(GameSubStatus.WAITING_FOR_PLAYERS)
                .teamCount(teamCount)
                .phrasesPerPlayer(phrasesPerPlayer)
                .timerDuration(timerDuration)
                .currentRound(1)
                .createdAt(LocalDateTime.now())
                .build();
    }

    public RoundType getRoundType() {
        return RoundType.ofRound(currentRound);
    }

    public boolean isInSetup() {
        return status == GameStatus.SETUP;
    }

    @PrePersist
    @PreUpdate
    void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}

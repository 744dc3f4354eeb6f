package com.example.fishbowl.game.domain.entity;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import com.example.fishbowl.global.util.GameCodeGenerator;

@Entity
@Table(name = "players",
        uniqueConstraints = @UniqueConstraint(name = "uk_players_game_name", columnNames = {"game_id", "name"}),
        indexes = {
                @Index(name = "idx_players_game", columnList = "game_id"),
                @Index(name = "idx_players_team", columnList = "team_id")
        })
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Player {
    @Id
    @Column(name = "player_id", nullable = false)
    private String id;

    @Column(name = "game_id", nullable = false)
    private String gameId;

    @Column(name = "team_id")
    private String teamId;

    @Column(nullable = false)
    private String name;

    /**
     * 접속 여부. 접속 관리 계층(PresenceService)이 갱신하고 턴 순서 탐색에서 읽기만 한다.
     */
    @Builder.Default
    @Column(name = "is_connected", nullable = false)
    private boolean connected = true;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_seen_at")
    private LocalDateTime lastSeenAt;

    public static Player join(String gameId, String name, String teamId) {
        LocalDateTime now = LocalDateTime.now();
        return Player.builder()
                .id(GameCodeGenerator.generateId())
                .gameId(gameId)
                .name(name)
                .teamId(teamId)
                .connected(true)
                .createdAt(now)
                .lastSeenAt(now)
                .build();
    }

    public boolean hasTeam() {
        return teamId != null;
    }
}

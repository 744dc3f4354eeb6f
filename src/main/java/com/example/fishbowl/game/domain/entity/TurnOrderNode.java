package com.example.fishbowl.game.domain.entity;

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

/**
 * 턴 순서 링의 노드. 게임 시작 시 한 번 생성되고 이후 변경되지 않는다.
 * 노드끼리는 객체 참조가 아니라 플레이어 ID로 연결된다.
 */
@Entity
@Table(name = "turn_order",
        uniqueConstraints = @UniqueConstraint(name = "uk_turn_order_game_player", columnNames = {"game_id", "player_id"}),
        indexes = @Index(name = "idx_turn_order_game", columnList = "game_id"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnOrderNode {
    @Id
    @Column(name = "turn_order_id", nullable = false)
    private String id;

    @Column(name = "game_id", nullable = false)
    private String gameId;

    @Column(name = "player_id", nullable = false)
    private String playerId;

    @Column(name = "team_id", nullable = false)
    private String teamId;

    @Column(name = "next_player_id", nullable = false)
    private String nextPlayerId;

    @Column(name = "prev_player_id", nullable = false)
    private String prevPlayerId;

    // 드래프트 순번 (0부터)
    @Column(name = "draft_position", nullable = false)
    private int position;
}

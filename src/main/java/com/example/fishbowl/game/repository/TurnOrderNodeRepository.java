package com.example.fishbowl.game.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.fishbowl.game.domain.entity.TurnOrderNode;

@Repository
public interface TurnOrderNodeRepository extends JpaRepository<TurnOrderNode, String> {

    Optional<TurnOrderNode> findByGameIdAndPlayerId(String gameId, String playerId);

    List<TurnOrderNode> findAllByGameIdOrderByPositionAsc(String gameId);

    long countByGameId(String gameId);

    boolean existsByGameId(String gameId);

    /**
     * 링 위의 접속 중인 플레이어 ID (드래프트 순)
     */
    @Query("SELECT n.playerId FROM TurnOrderNode n, Player p " +
            "WHERE p.id = n.playerId AND n.gameId = :gameId AND p.connected = true " +
            "ORDER BY n.position ASC")
    List<String> findConnectedPlayerIds(@Param("gameId") String gameId);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM TurnOrderNode n WHERE n.gameId = :gameId")
    int deleteAllByGameIdInBulk(@Param("gameId") String gameId);
}

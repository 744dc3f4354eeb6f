package com.example.fishbowl.game.repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.example.fishbowl.game.domain.entity.Player;

@Repository
public interface PlayerRepository extends JpaRepository<Player, String> {

    List<Player> findAllByGameIdOrderByCreatedAtAsc(String gameId);

    Optional<Player> findByIdAndGameId(String id, String gameId);

    boolean existsByGameIdAndNameIgnoreCase(String gameId, String name);

    long countByGameIdAndTeamId(String gameId, String teamId);

    List<Player> findAllByConnectedTrue();

    /**
     * 접속 상태만 갱신 (단일 UPDATE 쿼리, 엔티티 버전과 무관)
     * 접속 관리 계층이 게임 트랜잭션과 별도로 호출한다
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Player p SET p.connected = :connected, p.lastSeenAt = :now WHERE p.id = :playerId")
    int updateConnected(@Param("playerId") String playerId, @Param("connected") boolean connected,
                        @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM Player p WHERE p.gameId = :gameId")
    int deleteAllByGameIdInBulk(@Param("gameId") String gameId);
}

package com.example.fishbowl.game.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.fishbowl.game.domain.entity.Team;

@Repository
public interface TeamRepository extends JpaRepository<Team, String> {

    List<Team> findAllByGameIdOrderBySlotAsc(String gameId);

    Optional<Team> findByIdAndGameId(String id, String gameId);

    long countByGameId(String gameId);

    /**
     * 설정 변경 중에도 호출되므로 영속성 컨텍스트를 비우지 않는다 (이미 조회한 Game 유지)
     */
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM Team t WHERE t.gameId = :gameId")
    int deleteAllByGameIdInBulk(@Param("gameId") String gameId);
}

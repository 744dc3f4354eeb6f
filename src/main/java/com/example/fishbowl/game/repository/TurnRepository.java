package com.example.fishbowl.game.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.fishbowl.game.domain.entity.Turn;

@Repository
public interface TurnRepository extends JpaRepository<Turn, String> {

    List<Turn> findAllByGameIdOrderByCreatedAtAsc(String gameId);

    List<Turn> findAllByGameIdAndCompleteFalse(String gameId);

    Optional<Turn> findFirstByGameIdAndCompleteTrueOrderByEndTimeDesc(String gameId);

    long countByGameId(String gameId);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM Turn t WHERE t.gameId = :gameId")
    int deleteAllByGameIdInBulk(@Param("gameId") String gameId);
}

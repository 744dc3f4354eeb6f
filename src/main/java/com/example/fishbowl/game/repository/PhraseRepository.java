package com.example.fishbowl.game.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.fishbowl.game.domain.entity.Phrase;
import com.example.fishbowl.game.domain.state.PhraseStatus;

@Repository
public interface PhraseRepository extends JpaRepository<Phrase, String> {

    List<Phrase> findAllByGameIdOrderByCreatedAtAsc(String gameId);

    List<Phrase> findAllByGameIdAndPlayerId(String gameId, String playerId);

    Optional<Phrase> findByIdAndGameId(String id, String gameId);

    List<Phrase> findAllByGameIdAndStatus(String gameId, PhraseStatus status);

    long countByGameId(String gameId);

    boolean existsByGameIdAndIdNotAndTextIgnoreCase(String gameId, String id, String text);

    long countByGameIdAndPlayerId(String gameId, String playerId);

    long countByGameIdAndStatus(String gameId, PhraseStatus status);

    /**
     * 라운드 시작 시 넘긴 문구를 다시 통에 넣는다. 맞춘 문구는 그대로 둔다.
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Phrase p SET p.status = :to WHERE p.gameId = :gameId AND p.status = :from")
    int updateStatusInBulk(@Param("gameId") String gameId,
                           @Param("from") PhraseStatus from,
                           @Param("to") PhraseStatus to);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM Phrase p WHERE p.gameId = :gameId")
    int deleteAllByGameIdInBulk(@Param("gameId") String gameId);
}

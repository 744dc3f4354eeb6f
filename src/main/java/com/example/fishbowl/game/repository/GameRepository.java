package com.example.fishbowl.game.repository;

import java.util.Optional;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.fishbowl.game.domain.entity.Game;

@Repository
public interface GameRepository extends JpaRepository<Game, String> {

    /**
     * 상태 전이용 조회. 엔티티 변경 여부와 관계없이 커밋 시 version을 올리므로
     * 같은 게임에 대한 전이(문구 처리 포함)는 동시에 하나만 커밋된다.
     */
    @Lock(LockModeType.OPTIMISTIC_FORCE_INCREMENT)
    @Query("SELECT g FROM Game g WHERE g.id = :gameId")
    Optional<Game> findByIdForUpdate(@Param("gameId") String gameId);
}

package com.example.fishbowl.game.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import com.example.fishbowl.game.dto.response.EndTurnResponse;
import com.example.fishbowl.game.dto.response.PhraseActionResponse;
import com.example.fishbowl.game.dto.response.StartGameResponse;
import com.example.fishbowl.game.dto.response.StartRoundResponse;
import com.example.fishbowl.game.dto.response.TurnActionResponse;

/**
 * 게임 진행 요청의 진입점.
 *
 * Optimistic Lock 충돌(ObjectOptimisticLockingFailureException)은 트랜잭션 커밋 시점에 발생하므로
 * 트랜잭션 바깥인 이 클래스에서 재시도한다. 재시도는 새 트랜잭션에서 최신 상태를 다시 읽으므로
 * 이미 처리된 요청은 NOT_YOUR_TURN / INVALID_GAME_STATE 로 거절된다 (중복 진행 없음).
 * 재시도를 모두 소진하면 GlobalExceptionHandler 가 409로 응답한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Retryable(retryFor = ObjectOptimisticLockingFailureException.class, maxAttempts = 3, backoff = @Backoff(delay = 100))
public class GameFlowFacade {

    private final GameFlowService gameFlowService;

    public StartGameResponse startGame(String gameId) {
        return gameFlowService.startGame(gameId);
    }

    public StartRoundResponse startRound(String gameId) {
        return gameFlowService.startRound(gameId);
    }

    public TurnActionResponse startTurn(String gameId, String playerId) {
        return gameFlowService.startTurn(gameId, playerId);
    }

    public TurnActionResponse pauseTurn(String gameId, String requesterId) {
        return gameFlowService.pauseTurn(gameId, requesterId);
    }

    public TurnActionResponse resumeTurn(String gameId, String requesterId) {
        return gameFlowService.resumeTurn(gameId, requesterId);
    }

    public EndTurnResponse endTurn(String gameId, String playerId) {
        return gameFlowService.endTurn(gameId, playerId);
    }

    public PhraseActionResponse guessPhrase(String gameId, String phraseId, String playerId) {
        return gameFlowService.guessPhrase(gameId, phraseId, playerId);
    }

    public PhraseActionResponse skipPhrase(String gameId, String phraseId, String playerId) {
        return gameFlowService.skipPhrase(gameId, phraseId, playerId);
    }

    public boolean pauseForDisconnect(String gameId, String playerId) {
        return gameFlowService.pauseForDisconnect(gameId, playerId);
    }

    public boolean resumeForReconnect(String gameId, String playerId) {
        return gameFlowService.resumeForReconnect(gameId, playerId);
    }
}

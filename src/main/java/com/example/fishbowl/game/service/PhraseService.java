package com.example.fishbowl.game.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.fishbowl.game.domain.entity.Game;
import com.example.fishbowl.game.domain.entity.Phrase;
import com.example.fishbowl.game.domain.entity.Player;
import com.example.fishbowl.game.domain.entity.Turn;
import com.example.fishbowl.game.domain.state.GameStatus;
import com.example.fishbowl.game.domain.state.GameSubStatus;
import com.example.fishbowl.game.domain.state.PhraseStatus;
import com.example.fishbowl.game.dto.response.PhraseResponse;
import com.example.fishbowl.game.dto.response.PhraseSubmissionStatus;
import com.example.fishbowl.game.repository.GameRepository;
import com.example.fishbowl.game.repository.PhraseRepository;
import com.example.fishbowl.game.repository.PlayerRepository;
import com.example.fishbowl.game.state.GameStateMachine;
import com.example.fishbowl.global.error.ErrorCode;

/**
 * 문구 제출/수정/삭제/조회 서비스 (설정 단계) + 진행 중 문구 뽑기
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class PhraseService {

    private final GameRepository gameRepository;
    private final PlayerRepository playerRepository;
    private final PhraseRepository phraseRepository;
    private final GameSetupService gameSetupService;
    private final GameStateMachine stateMachine;
    private final TurnLifecycleService turnLifecycle;
    private final Random gameRandom;

    /**
     * 1인당 문구 수를 넘지 않는 범위에서 추가 제출 가능. 제출 후 준비 상태를 다시 계산한다.
     */
    public List<PhraseResponse> submitPhrases(String gameId, String playerId, List<String> texts) {
        Game game = loadSetupGame(gameId);
        Player player = requirePlayer(gameId, playerId);

        long alreadySubmitted = phraseRepository.countByGameIdAndPlayerId(gameId, playerId);
        if (alreadySubmitted + texts.size() > game.getPhrasesPerPlayer()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("playerId", playerId);
            details.put("limit", game.getPhrasesPerPlayer());
            details.put("submitted", alreadySubmitted);
            details.put("requested", texts.size());
            throw ErrorCode.PHRASE_QUOTA_EXCEEDED.commonException(details);
        }

        List<Phrase> phrases = texts.stream()
                .map(text -> Phrase.submit(gameId, player.getId(), text.trim()))
                .toList();
        phraseRepository.saveAll(phrases);
        gameSetupService.refreshReadiness(game);

        log.info("문구 제출: gameId={}, playerId={}, count={}, total={}", gameId, playerId, phrases.size(),
                alreadySubmitted + phrases.size());
        return phrases.stream().map(PhraseResponse::from).toList();
    }

    /**
     * 준비 단계에서 본인 문구만 수정 가능. 같은 게임의 다른 문구와 (대소문자 무시) 겹칠 수 없다.
     */
    public PhraseResponse updatePhrase(String gameId, String phraseId, String playerId, String text) {
        Game game = loadSetupGame(gameId);
        Phrase phrase = requirePhrase(gameId, phraseId);
        if (!phrase.getPlayerId().equals(playerId)) {
            throw ErrorCode.PHRASE_NOT_OWNED.commonException(
                    Map.of("phraseId", phraseId, "requestedBy", playerId));
        }

        String trimmed = text.trim();
        if (phraseRepository.existsByGameIdAndIdNotAndTextIgnoreCase(gameId, phraseId, trimmed)) {
            throw ErrorCode.DUPLICATE_PHRASE.commonException(Map.of("text", trimmed));
        }
        phrase.setText(trimmed);
        phraseRepository.save(phrase);
        gameSetupService.refreshReadiness(game);

        log.info("문구 수정: gameId={}, phraseId={}, playerId={}", gameId, phraseId, playerId);
        return PhraseResponse.from(phrase);
    }

    /**
     * 준비 단계에서 본인 문구 또는 (호스트라면) 아무 문구나 삭제. 삭제 후 준비 상태를 다시 계산한다.
     */
    public void deletePhrase(String gameId, String phraseId, String playerId) {
        Game game = loadSetupGame(gameId);
        Phrase phrase = requirePhrase(gameId, phraseId);
        requirePlayer(gameId, playerId);
        if (!phrase.getPlayerId().equals(playerId) && !playerId.equals(game.getHostPlayerId())) {
            throw ErrorCode.PHRASE_NOT_OWNED.commonException(
                    Map.of("phraseId", phraseId, "requestedBy", playerId));
        }

        phraseRepository.delete(phrase);
        gameSetupService.refreshReadiness(game);
        log.info("문구 삭제: gameId={}, phraseId={}, owner={}, requestedBy={}", gameId, phraseId,
                phrase.getPlayerId(), playerId);
    }

    @Transactional(readOnly = true)
    public List<PhraseResponse> getPlayerPhrases(String gameId, String playerId) {
        requirePlayer(gameId, playerId);
        return phraseRepository.findAllByGameIdAndPlayerId(gameId, playerId).stream()
                .map(PhraseResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public PhraseSubmissionStatus getSubmissionStatus(String gameId) {
        Game game = gameRepository.findById(gameId)
                .orElseThrow(() -> ErrorCode.GAME_NOT_FOUND.commonException(Map.of("gameId", gameId)));
        Map<String, Long> counts = phraseRepository.findAllByGameIdOrderByCreatedAtAsc(gameId).stream()
                .collect(Collectors.groupingBy(Phrase::getPlayerId, Collectors.counting()));

        List<PhraseSubmissionStatus.PlayerProgress> progress = playerRepository
                .findAllByGameIdOrderByCreatedAtAsc(gameId).stream()
                .map(player -> {
                    long submitted = counts.getOrDefault(player.getId(), 0L);
                    return new PhraseSubmissionStatus.PlayerProgress(player.getId(), player.getName(), submitted,
                            submitted >= game.getPhrasesPerPlayer());
                })
                .toList();

        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        boolean allSubmitted = !progress.isEmpty()
                && progress.stream().allMatch(PhraseSubmissionStatus.PlayerProgress::complete);
        return new PhraseSubmissionStatus(game.getPhrasesPerPlayer(), total, allSubmitted, progress);
    }

    /**
     * 현재 턴 플레이어에게 통에서 무작위 문구 하나를 보여준다 (상태 변경 없음)
     */
    @Transactional(readOnly = true)
    public PhraseResponse drawPhrase(String gameId, String playerId) {
        Game game = gameRepository.findById(gameId)
                .orElseThrow(() -> ErrorCode.GAME_NOT_FOUND.commonException(Map.of("gameId", gameId)));
        stateMachine.requireSubStatus(game, GameSubStatus.TURN_ACTIVE);
        Turn turn = turnLifecycle.requireCurrentTurn(game);
        turnLifecycle.requireActingPlayer(turn, playerId);

        List<Phrase> bowl = phraseRepository.findAllByGameIdAndStatus(gameId, PhraseStatus.ACTIVE);
        if (bowl.isEmpty()) {
            throw ErrorCode.PHRASE_NOT_FOUND.commonException(Map.of("gameId", gameId, "reason", "bowl is empty"));
        }
        return PhraseResponse.from(bowl.get(gameRandom.nextInt(bowl.size())));
    }

    private Game loadSetupGame(String gameId) {
        Game game = gameRepository.findByIdForUpdate(gameId)
                .orElseThrow(() -> ErrorCode.GAME_NOT_FOUND.commonException(Map.of("gameId", gameId)));
        stateMachine.requireStatus(game, GameStatus.SETUP);
        return game;
    }

    private Phrase requirePhrase(String gameId, String phraseId) {
        return phraseRepository.findByIdAndGameId(phraseId, gameId)
                .orElseThrow(() -> ErrorCode.PHRASE_NOT_FOUND.commonException(Map.of("phraseId", phraseId)));
    }

    private Player requirePlayer(String gameId, String playerId) {
        return playerRepository.findByIdAndGameId(playerId, gameId)
                .orElseThrow(() -> ErrorCode.PLAYER_NOT_IN_GAME.commonException(
                        Map.of("gameId", gameId, "playerId", playerId)));
    }
}

package com.example.fishbowl.game.service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.fishbowl.game.domain.entity.Game;
import com.example.fishbowl.game.domain.entity.Phrase;
import com.example.fishbowl.game.domain.entity.Player;
import com.example.fishbowl.game.domain.entity.Team;
import com.example.fishbowl.game.domain.entity.Turn;
import com.example.fishbowl.game.domain.entity.TurnOrderNode;
import com.example.fishbowl.game.domain.state.GameStatus;
import com.example.fishbowl.game.domain.state.GameSubStatus;
import com.example.fishbowl.game.domain.state.PausedReason;
import com.example.fishbowl.game.domain.state.RoundType;
import com.example.fishbowl.game.dto.response.EndTurnResponse;
import com.example.fishbowl.game.dto.response.EndTurnResponse.Outcome;
import com.example.fishbowl.game.dto.response.PhraseActionResponse;
import com.example.fishbowl.game.dto.response.PlayerSummary;
import com.example.fishbowl.game.dto.response.StartGameResponse;
import com.example.fishbowl.game.dto.response.StartRoundResponse;
import com.example.fishbowl.game.dto.response.TeamSummary;
import com.example.fishbowl.game.dto.response.TurnActionResponse;
import com.example.fishbowl.game.dto.response.TurnSummary;
import com.example.fishbowl.game.event.GameFinishedEvent;
import com.example.fishbowl.game.event.GameStartedEvent;
import com.example.fishbowl.game.event.RoundCompletedEvent;
import com.example.fishbowl.game.event.RoundStartedEvent;
import com.example.fishbowl.game.event.TurnEndedEvent;
import com.example.fishbowl.game.event.TurnPausedEvent;
import com.example.fishbowl.game.event.TurnResumedEvent;
import com.example.fishbowl.game.event.TurnStartedEvent;
import com.example.fishbowl.game.repository.GameRepository;
import com.example.fishbowl.game.repository.PhraseRepository;
import com.example.fishbowl.game.repository.PlayerRepository;
import com.example.fishbowl.game.repository.TeamRepository;
import com.example.fishbowl.game.repository.TurnOrderNodeRepository;
import com.example.fishbowl.game.repository.TurnRepository;
import com.example.fishbowl.game.state.GameStateMachine;
import com.example.fishbowl.game.turnorder.TurnNavigator;
import com.example.fishbowl.game.turnorder.TurnOrderBuilder;
import com.example.fishbowl.global.error.ErrorCode;
import com.example.fishbowl.global.error.TurnOrderIntegrityException;

/**
 * 게임 진행 (상태 전이) 서비스.
 * 모든 public 메서드는 하나의 트랜잭션이며 예외가 나면 아무 변경도 남지 않는다.
 * 동시 요청 재시도는 GameFlowFacade 가 담당한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class GameFlowService {

    private static final int POINTS_PER_GUESS = 1;

    private final GameRepository gameRepository;
    private final TeamRepository teamRepository;
    private final PlayerRepository playerRepository;
    private final PhraseRepository phraseRepository;
    private final TurnRepository turnRepository;
    private final TurnOrderNodeRepository turnOrderNodeRepository;
    private final TurnOrderBuilder turnOrderBuilder;
    private final TurnNavigator turnNavigator;
    private final GameStateMachine stateMachine;
    private final GameValidator gameValidator;
    private final TurnLifecycleService turnLifecycle;
    private final GameQueryService gameQueryService;
    private final ApplicationEventPublisher eventPublisher;

    // ================= 게임 시작 =================

    /**
     * setup -> playing/round_intro
     * 검증, 턴 순서 생성, 첫 턴 생성이 한 트랜잭션에서 이뤄진다.
     */
    public StartGameResponse startGame(String gameId) {
        Game game = loadForUpdate(gameId);
        stateMachine.requireStatus(game, GameStatus.SETUP);

        List<Team> teams = teamRepository.findAllByGameIdOrderBySlotAsc(gameId);
        List<Player> players = playerRepository.findAllByGameIdOrderByCreatedAtAsc(gameId);
        Map<String, Long> phraseCounts = phraseRepository.findAllByGameIdOrderByCreatedAtAsc(gameId).stream()
                .collect(Collectors.groupingBy(Phrase::getPlayerId, Collectors.counting()));
        gameValidator.validateStartGame(game, teams, players, phraseCounts);

        if (turnOrderNodeRepository.existsByGameId(gameId)) {
            throw new TurnOrderIntegrityException(gameId, "turn order already exists before game start");
        }
        List<TurnOrderNode> ring = turnOrderBuilder.build(gameId, players, teams);

        String firstPlayerId = turnNavigator.randomStartPlayer(gameId)
                .orElseThrow(() -> ErrorCode.NO_ELIGIBLE_PLAYER.commonException(Map.of("gameId", gameId)));

        game.setCurrentRound(1);
        turnLifecycle.openTurn(game, firstPlayerId);
        game.setStartedAt(LocalDateTime.now());
        stateMachine.transition(game, GameStatus.PLAYING, GameSubStatus.ROUND_INTRO);

        List<String> turnOrder = ring.stream().map(TurnOrderNode::getPlayerId).toList();
        eventPublisher.publishEvent(new GameStartedEvent(gameId, firstPlayerId, turnOrder));
        log.info("게임 시작: gameId={}, players={}, teams={}, firstPlayer={}", gameId, players.size(),
                teams.size(), firstPlayerId);

        Player firstPlayer = players.stream()
                .filter(player -> player.getId().equals(firstPlayerId))
                .findFirst()
                .orElseThrow(() -> new TurnOrderIntegrityException(gameId, "unknown first player " + firstPlayerId));
        return new StartGameResponse(gameQueryService.snapshot(game), true, turnOrder,
                PlayerSummary.from(firstPlayer));
    }

    // ================= 라운드 시작 =================

    /**
     * round_intro -> turn_starting
     * 넘긴 문구를 통에 되돌리고, 라운드 첫 턴을 정한다.
     */
    public StartRoundResponse startRound(String gameId) {
        Game game = loadForUpdate(gameId);
        stateMachine.requireSubStatus(game, GameSubStatus.ROUND_INTRO);

        RoundType roundType = game.getRoundType();
        turnLifecycle.resetSkippedPhrases(gameId);

        Turn turn = resolveRoundOpeningTurn(game);
        stateMachine.transition(game, GameStatus.PLAYING, GameSubStatus.TURN_STARTING);

        Player player = findRingPlayer(gameId, turn.getPlayerId());
        Team team = teamRepository.findById(turn.getTeamId())
                .orElseThrow(() -> ErrorCode.TEAM_NOT_FOUND.commonException(Map.of("teamId", turn.getTeamId())));

        eventPublisher.publishEvent(new RoundStartedEvent(gameId, roundType.getRound(), roundType.getDisplayName(),
                turn.getPlayerId()));
        eventPublisher.publishEvent(turnStarted(turn, false));
        log.info("라운드 시작: gameId={}, round={} ({}), actingPlayer={}", gameId, roundType.getRound(),
                roundType.getDisplayName(), turn.getPlayerId());

        return new StartRoundResponse(gameQueryService.snapshot(game), roundType.getRound(),
                roundType.getDisplayName(), turn.getId(), PlayerSummary.from(player), TeamSummary.from(team),
                LocalDateTime.now());
    }

    /**
     * 1. 미리 만들어 둔(아직 끝나지 않은) 현재 턴이 있고 그 플레이어가 접속 중이면 그대로 사용
     * 2. 턴이 한 번도 없었으면 무작위 시작
     * 3. 그 외에는 마지막으로 끝난 턴의 다음 플레이어
     */
    private Turn resolveRoundOpeningTurn(Game game) {
        String gameId = game.getId();
        if (game.getCurrentTurnId() != null) {
            Optional<Turn> current = turnRepository.findById(game.getCurrentTurnId());
            if (current.isPresent() && !current.get().isComplete()) {
                Turn pending = current.get();
                if (findRingPlayer(gameId, pending.getPlayerId()).isConnected()) {
                    return pending;
                }
                // 대기 턴을 만든 뒤 플레이어가 끊긴 경우: 버리고 다시 고른다
                turnRepository.delete(pending);
                game.setCurrentTurnId(null);
                log.info("끊긴 플레이어의 대기 턴 폐기: gameId={}, turnId={}, playerId={}", gameId, pending.getId(),
                        pending.getPlayerId());
            }
        }

        Optional<String> nextPlayerId = turnRepository.findFirstByGameIdAndCompleteTrueOrderByEndTimeDesc(gameId)
                .map(lastTurn -> turnNavigator.nextPlayer(gameId, lastTurn.getPlayerId()))
                .orElseGet(() -> turnNavigator.randomStartPlayer(gameId));

        String playerId = nextPlayerId
                .orElseThrow(() -> ErrorCode.NO_ELIGIBLE_PLAYER.commonException(Map.of("gameId", gameId)));
        return turnLifecycle.openTurn(game, playerId);
    }

    // ================= 턴 시작 / 일시정지 / 재개 =================

    /**
     * turn_starting -> turn_active (현재 턴 플레이어만)
     */
    public TurnActionResponse startTurn(String gameId, String playerId) {
        Game game = loadForUpdate(gameId);
        stateMachine.requireSubStatus(game, GameSubStatus.TURN_STARTING);
        Turn turn = turnLifecycle.requireCurrentTurn(game);
        turnLifecycle.requireActingPlayer(turn, playerId);

        turn.begin(LocalDateTime.now());
        stateMachine.transition(game, GameStatus.PLAYING, GameSubStatus.TURN_ACTIVE);
        eventPublisher.publishEvent(turnStarted(turn, true));

        return new TurnActionResponse(gameQueryService.snapshot(game), TurnSummary.from(turn));
    }

    /**
     * 호스트 또는 현재 턴 플레이어의 수동 일시정지
     */
    public TurnActionResponse pauseTurn(String gameId, String requesterId) {
        Game game = loadForUpdate(gameId);
        stateMachine.requireSubStatus(game, GameSubStatus.TURN_STARTING, GameSubStatus.TURN_ACTIVE);
        Turn turn = turnLifecycle.requireCurrentTurn(game);
        requireHostOrActingPlayer(game, turn, requesterId);

        pause(game, turn, PausedReason.HOST_PAUSED);
        return new TurnActionResponse(gameQueryService.snapshot(game), TurnSummary.from(turn));
    }

    /**
     * 현재 턴 플레이어의 접속이 끊겼을 때 진행 중인 턴을 멈춘다.
     *
     * @return 실제로 일시정지했으면 true
     */
    public boolean pauseForDisconnect(String gameId, String playerId) {
        Game game = loadForUpdate(gameId);
        if (game.getSubStatus() != GameSubStatus.TURN_ACTIVE || game.getCurrentTurnId() == null) {
            return false;
        }
        Turn turn = turnLifecycle.requireCurrentTurn(game);
        if (!turn.getPlayerId().equals(playerId)) {
            return false;
        }
        pause(game, turn, PausedReason.PLAYER_DISCONNECTED);
        return true;
    }

    /**
     * turn_paused -> turn_active (시작 전에 멈췄던 턴이면 turn_starting)
     */
    public TurnActionResponse resumeTurn(String gameId, String requesterId) {
        Game game = loadForUpdate(gameId);
        stateMachine.requireSubStatus(game, GameSubStatus.TURN_PAUSED);
        Turn turn = turnLifecycle.requireCurrentTurn(game);
        requireHostOrActingPlayer(game, turn, requesterId);

        resume(game, turn);
        return new TurnActionResponse(gameQueryService.snapshot(game), TurnSummary.from(turn));
    }

    /**
     * 접속이 끊겨 멈췄던 턴의 플레이어가 돌아오면 자동 재개
     *
     * @return 실제로 재개했으면 true
     */
    public boolean resumeForReconnect(String gameId, String playerId) {
        Game game = loadForUpdate(gameId);
        if (game.getSubStatus() != GameSubStatus.TURN_PAUSED || game.getCurrentTurnId() == null) {
            return false;
        }
        Turn turn = turnLifecycle.requireCurrentTurn(game);
        if (!turn.getPlayerId().equals(playerId) || turn.getPausedReason() != PausedReason.PLAYER_DISCONNECTED) {
            return false;
        }
        resume(game, turn);
        return true;
    }

    private void pause(Game game, Turn turn, PausedReason reason) {
        LocalDateTime now = LocalDateTime.now();
        if (turn.isPaused()) {
            turn.setPausedReason(reason);
        } else {
            turn.pause(now, reason);
        }
        stateMachine.transition(game, GameStatus.PLAYING, GameSubStatus.TURN_PAUSED);
        eventPublisher.publishEvent(new TurnPausedEvent(game.getId(), turn.getId(), turn.getPlayerId(), reason));
        log.info("턴 일시정지: gameId={}, turnId={}, reason={}", game.getId(), turn.getId(), reason);
    }

    private void resume(Game game, Turn turn) {
        turn.resume(LocalDateTime.now());
        GameSubStatus target = turn.getStartTime() == null ? GameSubStatus.TURN_STARTING : GameSubStatus.TURN_ACTIVE;
        stateMachine.transition(game, GameStatus.PLAYING, target);
        eventPublisher.publishEvent(new TurnResumedEvent(game.getId(), turn.getId(), turn.getPlayerId()));
        log.info("턴 재개: gameId={}, turnId={}", game.getId(), turn.getId());
    }

    // ================= 턴 종료 =================

    /**
     * 현재 턴 플레이어만 호출 가능.
     * - 남은 문구가 없으면 라운드 종료
     * - 다음 접속자가 없으면 턴을 끝내지 않고 일시정지 (NO_ELIGIBLE_PLAYER)
     * - 그 외에는 같은 라운드의 다음 턴 생성
     */
    public EndTurnResponse endTurn(String gameId, String playerId) {
        Game game = loadForUpdate(gameId);
        stateMachine.requireSubStatus(game,
                GameSubStatus.TURN_STARTING, GameSubStatus.TURN_ACTIVE, GameSubStatus.TURN_PAUSED);
        Turn turn = turnLifecycle.requireCurrentTurn(game);
        turnLifecycle.requireActingPlayer(turn, playerId);

        LocalDateTime now = LocalDateTime.now();
        if (turnLifecycle.remainingPhrases(gameId) == 0) {
            return completeRound(game, turn, now);
        }

        Optional<String> nextPlayerId = turnNavigator.nextPlayer(gameId, turn.getPlayerId());
        if (nextPlayerId.isEmpty()) {
            // 접속 끊김으로 멈춘 턴은 사유를 유지해야 재접속 시 자동 재개된다
            PausedReason reason = turn.getPausedReason() == PausedReason.PLAYER_DISCONNECTED
                    ? PausedReason.PLAYER_DISCONNECTED : PausedReason.NO_ELIGIBLE_PLAYER;
            pause(game, turn, reason);
            return new EndTurnResponse(Outcome.NO_ELIGIBLE_PLAYER, gameQueryService.snapshot(game),
                    TurnSummary.from(turn), null, null);
        }

        turnLifecycle.completeAndScore(turn, now);
        Turn nextTurn = turnLifecycle.openTurn(game, nextPlayerId.get());
        stateMachine.transition(game, GameStatus.PLAYING, GameSubStatus.TURN_STARTING);

        eventPublisher.publishEvent(turnEnded(turn, nextTurn.getPlayerId()));
        eventPublisher.publishEvent(turnStarted(nextTurn, false));

        Player nextPlayer = findRingPlayer(gameId, nextTurn.getPlayerId());
        return new EndTurnResponse(Outcome.NEXT_TURN, gameQueryService.snapshot(game),
                TurnSummary.from(turn), TurnSummary.from(nextTurn), PlayerSummary.from(nextPlayer));
    }

    // ================= 문구 처리 =================

    public PhraseActionResponse guessPhrase(String gameId, String phraseId, String playerId) {
        return resolvePhrase(gameId, phraseId, playerId, true);
    }

    public PhraseActionResponse skipPhrase(String gameId, String phraseId, String playerId) {
        return resolvePhrase(gameId, phraseId, playerId, false);
    }

    private PhraseActionResponse resolvePhrase(String gameId, String phraseId, String playerId, boolean guessed) {
        Game game = loadForUpdate(gameId);
        stateMachine.requireSubStatus(game, GameSubStatus.TURN_ACTIVE);
        Turn turn = turnLifecycle.requireCurrentTurn(game);
        turnLifecycle.requireActingPlayer(turn, playerId);

        Phrase phrase = phraseRepository.findByIdAndGameId(phraseId, gameId)
                .orElseThrow(() -> ErrorCode.PHRASE_NOT_FOUND.commonException(Map.of("phraseId", phraseId)));
        if (!phrase.isActive()) {
            throw ErrorCode.PHRASE_NOT_ACTIVE.commonException(
                    Map.of("phraseId", phraseId, "status", phrase.getStatus().getValue()));
        }

        if (guessed) {
            phrase.markGuessed(game.getCurrentRound(), turn.getTeamId());
            turn.recordGuess(POINTS_PER_GUESS);
        } else {
            phrase.markSkipped();
            turn.recordSkip();
        }
        phraseRepository.save(phrase);

        long remaining = turnLifecycle.remainingPhrases(gameId);
        boolean roundComplete = false;
        if (remaining == 0) {
            completeRound(game, turn, LocalDateTime.now());
            roundComplete = true;
        }

        return new PhraseActionResponse(phrase.getId(), phrase.getStatus().getValue(), remaining, roundComplete,
                TurnSummary.from(turn), gameQueryService.snapshot(game));
    }

    // ================= 라운드 종료 =================

    /**
     * 현재 턴을 마감하고 round_complete 를 거쳐
     * - 3라운드 미만: 라운드 +1, 다음 플레이어의 대기 턴 생성, round_intro
     * - 3라운드: finished/game_complete
     */
    private EndTurnResponse completeRound(Game game, Turn turn, LocalDateTime now) {
        String gameId = game.getId();
        RoundType finishedRound = game.getRoundType();

        turnLifecycle.completeAndScore(turn, now);
        stateMachine.transition(game, GameStatus.PLAYING, GameSubStatus.ROUND_COMPLETE);

        List<Team> teams = teamRepository.findAllByGameIdOrderBySlotAsc(gameId);
        Map<String, Integer> roundScores = scores(teams, team -> team.getRoundScore(finishedRound.getRound()));

        if (finishedRound.isLast()) {
            game.setCurrentTurnId(null);
            game.setFinishedAt(now);
            stateMachine.transition(game, GameStatus.FINISHED, GameSubStatus.GAME_COMPLETE);

            eventPublisher.publishEvent(turnEnded(turn, null));
            eventPublisher.publishEvent(new RoundCompletedEvent(gameId, finishedRound.getRound(), null, roundScores));
            eventPublisher.publishEvent(new GameFinishedEvent(gameId, scores(teams, Team::getTotalScore)));
            log.info("게임 종료: gameId={}, totalScores={}", gameId, scores(teams, Team::getTotalScore));

            return new EndTurnResponse(Outcome.GAME_COMPLETE, gameQueryService.snapshot(game),
                    TurnSummary.from(turn), null, null);
        }

        game.setCurrentRound(finishedRound.getRound() + 1);
        Optional<String> nextPlayerId = turnNavigator.nextPlayer(gameId, turn.getPlayerId());
        Turn nextTurn = null;
        Player nextPlayer = null;
        if (nextPlayerId.isPresent()) {
            nextTurn = turnLifecycle.openTurn(game, nextPlayerId.get());
            nextPlayer = findRingPlayer(gameId, nextPlayerId.get());
        } else {
            // 라운드 시작 시 다시 다음 플레이어를 찾는다
            game.setCurrentTurnId(null);
            log.warn("다음 라운드 첫 턴을 받을 접속자가 없음: gameId={}", gameId);
        }
        stateMachine.transition(game, GameStatus.PLAYING, GameSubStatus.ROUND_INTRO);

        eventPublisher.publishEvent(turnEnded(turn, nextPlayerId.orElse(null)));
        eventPublisher.publishEvent(new RoundCompletedEvent(gameId, finishedRound.getRound(),
                game.getCurrentRound(), roundScores));
        log.info("라운드 종료: gameId={}, round={}, scores={}", gameId, finishedRound.getRound(), roundScores);

        return new EndTurnResponse(Outcome.ROUND_COMPLETE, gameQueryService.snapshot(game),
                TurnSummary.from(turn), TurnSummary.from(nextTurn),
                nextPlayer != null ? PlayerSummary.from(nextPlayer) : null);
    }

    // ================= 헬퍼 메소드 =================

    private Game loadForUpdate(String gameId) {
        return gameRepository.findByIdForUpdate(gameId)
                .orElseThrow(() -> ErrorCode.GAME_NOT_FOUND.commonException(Map.of("gameId", gameId)));
    }

    private Player findRingPlayer(String gameId, String playerId) {
        return playerRepository.findByIdAndGameId(playerId, gameId)
                .orElseThrow(() -> new TurnOrderIntegrityException(gameId, "unknown player " + playerId));
    }

    private void requireHostOrActingPlayer(Game game, Turn turn, String requesterId) {
        if (requesterId.equals(game.getHostPlayerId())) {
            return;
        }
        turnLifecycle.requireActingPlayer(turn, requesterId);
    }

    private static Map<String, Integer> scores(List<Team> teams, Function<Team, Integer> score) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        teams.forEach(team -> scores.put(team.getId(), score.apply(team)));
        return scores;
    }

    private static TurnStartedEvent turnStarted(Turn turn, boolean active) {
        return new TurnStartedEvent(turn.getGameId(), turn.getId(), turn.getRound(), turn.getPlayerId(),
                turn.getTeamId(), active);
    }

    private static TurnEndedEvent turnEnded(Turn turn, String nextPlayerId) {
        return new TurnEndedEvent(turn.getGameId(), turn.getId(), turn.getPlayerId(), turn.getTeamId(),
                turn.getPhrasesGuessed(), turn.getPhrasesSkipped(), turn.getPointsScored(), nextPlayerId);
    }
}

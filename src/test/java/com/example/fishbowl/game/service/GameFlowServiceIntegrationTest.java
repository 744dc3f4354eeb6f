package com.example.fishbowl.game.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.fishbowl.game.domain.entity.Game;
import com.example.fishbowl.game.domain.entity.Phrase;
import com.example.fishbowl.game.domain.entity.Team;
import com.example.fishbowl.game.domain.entity.Turn;
import com.example.fishbowl.game.domain.state.GameStatus;
import com.example.fishbowl.game.domain.state.GameSubStatus;
import com.example.fishbowl.game.domain.state.PausedReason;
import com.example.fishbowl.game.domain.state.PhraseStatus;
import com.example.fishbowl.game.dto.response.EndTurnResponse;
import com.example.fishbowl.game.dto.response.EndTurnResponse.Outcome;
import com.example.fishbowl.game.dto.response.StartGameResponse;
import com.example.fishbowl.game.dto.response.StartRoundResponse;
import com.example.fishbowl.global.error.CommonException;
import com.example.fishbowl.global.error.ErrorCode;
import com.example.fishbowl.support.GameIntegrationTestSupport;

/**
 * 게임 진행 통합 테스트 (H2)
 * 2팀 x 2명, 1인당 문구 3개 = 문구 12개 기준
 */
class GameFlowServiceIntegrationTest extends GameIntegrationTestSupport {

    @Test
    @DisplayName("게임 시작: 링 생성, 첫 턴 대기, playing/round_intro")
    void startGame_buildsRingAndPendingFirstTurn() {
        // given
        TestGame testGame = createReadyGame(2, 2);
        assertThat(game(testGame.gameId()).getSubStatus()).isEqualTo(GameSubStatus.READY_TO_START);

        // when
        StartGameResponse response = gameFlowFacade.startGame(testGame.gameId());

        // then
        Game game = game(testGame.gameId());
        assertThat(game.getStatus()).isEqualTo(GameStatus.PLAYING);
        assertThat(game.getSubStatus()).isEqualTo(GameSubStatus.ROUND_INTRO);
        assertThat(game.getCurrentRound()).isEqualTo(1);
        assertThat(game.getStartedAt()).isNotNull();

        assertThat(response.turnOrderEstablished()).isTrue();
        assertThat(response.turnOrder()).containsExactlyInAnyOrderElementsOf(testGame.playerIds());
        assertThat(turnOrderNodeRepository.countByGameId(testGame.gameId())).isEqualTo(4);
        assertThat(ringIntegrityChecker.check(testGame.gameId()).valid()).isTrue();

        // 스네이크 순서: 1행 (X, Y), 2행 (Y, X)
        List<String> teamOrder = response.turnOrder().stream()
                .map(playerId -> playerRepository.findById(playerId).orElseThrow().getTeamId())
                .toList();
        assertThat(teamOrder.get(0)).isNotEqualTo(teamOrder.get(1));
        assertThat(teamOrder).containsExactly(teamOrder.get(0), teamOrder.get(1), teamOrder.get(1), teamOrder.get(0));

        Turn firstTurn = currentTurn(testGame.gameId());
        assertThat(firstTurn.getPlayerId()).isEqualTo(response.firstPlayer().id());
        assertThat(firstTurn.isPending()).isTrue();
        assertThat(firstTurn.getRound()).isEqualTo(1);
    }

    @Test
    @DisplayName("문구가 모자라면 시작이 거절되고 링도 만들어지지 않는다")
    void startGame_rejectedWithoutPhrases() {
        // given
        TestGame testGame = createGameWithPlayers(2, 2);
        submitAllPhrases(testGame.gameId(), testGame.hostId());

        // when & then
        assertThatThrownBy(() -> gameFlowFacade.startGame(testGame.gameId()))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.NOT_ENOUGH_PHRASES);

        Game game = game(testGame.gameId());
        assertThat(game.getStatus()).isEqualTo(GameStatus.SETUP);
        assertThat(game.getCurrentTurnId()).isNull();
        assertThat(turnOrderNodeRepository.countByGameId(testGame.gameId())).isZero();
    }

    @Test
    @DisplayName("인원이 모자라면 NOT_ENOUGH_PLAYERS")
    void startGame_rejectedWithoutEnoughPlayers() {
        // given
        TestGame testGame = createGameWithPlayers(2, 1);

        // when & then
        assertThatThrownBy(() -> gameFlowFacade.startGame(testGame.gameId()))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.NOT_ENOUGH_PLAYERS);
    }

    @Test
    @DisplayName("현재 턴 플레이어가 아니면 턴 종료가 거절되고 현재 턴은 그대로다")
    void endTurn_rejectsOtherPlayer() {
        // given
        TestGame testGame = startedGame();
        gameFlowFacade.startRound(testGame.gameId());
        String acting = actingPlayer(testGame.gameId());
        String currentTurnId = game(testGame.gameId()).getCurrentTurnId();
        String intruder = testGame.playerIds().stream().filter(id -> !id.equals(acting)).findFirst().orElseThrow();

        // when & then
        assertThatThrownBy(() -> gameFlowFacade.endTurn(testGame.gameId(), intruder))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> {
                    CommonException ce = (CommonException) e;
                    assertThat(ce.getErrorCode()).isEqualTo(ErrorCode.NOT_YOUR_TURN);
                    assertThat(ce.getDetails()).containsEntry("currentPlayerId", acting);
                });
        assertThat(game(testGame.gameId()).getCurrentTurnId()).isEqualTo(currentTurnId);
        assertThat(turnRepository.countByGameId(testGame.gameId())).isEqualTo(1);
    }

    @Test
    @DisplayName("턴 종료: 점수가 팀에 한 번 반영되고 링의 다음 플레이어 턴이 대기 상태로 생성된다")
    void endTurn_scoresAndAdvances() {
        // given
        TestGame testGame = createReadyGame(2, 2);
        List<String> ring = gameFlowFacade.startGame(testGame.gameId()).turnOrder();
        gameFlowFacade.startRound(testGame.gameId());
        Turn turn = currentTurn(testGame.gameId());
        gameFlowFacade.startTurn(testGame.gameId(), turn.getPlayerId());

        List<Phrase> bowl = phrases(testGame.gameId(), PhraseStatus.ACTIVE);
        gameFlowFacade.guessPhrase(testGame.gameId(), bowl.get(0).getId(), turn.getPlayerId());
        gameFlowFacade.guessPhrase(testGame.gameId(), bowl.get(1).getId(), turn.getPlayerId());
        gameFlowFacade.skipPhrase(testGame.gameId(), bowl.get(2).getId(), turn.getPlayerId());

        // when
        EndTurnResponse response = gameFlowFacade.endTurn(testGame.gameId(), turn.getPlayerId());

        // then
        assertThat(response.outcome()).isEqualTo(Outcome.NEXT_TURN);
        assertThat(response.nextPlayer().id()).isEqualTo(nextInRing(ring, turn.getPlayerId()));

        Turn ended = turnRepository.findById(turn.getId()).orElseThrow();
        assertThat(ended.isComplete()).isTrue();
        assertThat(ended.getEndTime()).isNotNull();
        assertThat(ended.getPhrasesGuessed()).isEqualTo(2);
        assertThat(ended.getPhrasesSkipped()).isEqualTo(1);

        Team team = teamRepository.findById(turn.getTeamId()).orElseThrow();
        assertThat(team.getScoreRound1()).isEqualTo(2);
        assertThat(team.getTotalScore()).isEqualTo(2);

        Game game = game(testGame.gameId());
        assertThat(game.getSubStatus()).isEqualTo(GameSubStatus.TURN_STARTING);
        assertThat(turnRepository.findAllByGameIdAndCompleteFalse(testGame.gameId()))
                .singleElement()
                .extracting(Turn::getId).isEqualTo(game.getCurrentTurnId());
    }

    @Test
    @DisplayName("다음 플레이어가 끊겨 있으면 건너뛴다")
    void endTurn_skipsDisconnectedSuccessor() {
        // given
        TestGame testGame = createReadyGame(2, 2);
        List<String> ring = gameFlowFacade.startGame(testGame.gameId()).turnOrder();
        gameFlowFacade.startRound(testGame.gameId());
        String acting = actingPlayer(testGame.gameId());
        String successor = nextInRing(ring, acting);
        setConnected(successor, false);

        // when
        EndTurnResponse response = gameFlowFacade.endTurn(testGame.gameId(), acting);

        // then
        assertThat(response.nextPlayer().id()).isEqualTo(nextInRing(ring, successor));
        assertThat(actingPlayer(testGame.gameId())).isEqualTo(nextInRing(ring, successor));
    }

    @Test
    @DisplayName("나머지가 모두 끊겨 있으면 접속 중인 현재 플레이어에게 턴이 다시 돌아온다")
    void endTurn_wrapsToSelf() {
        // given
        TestGame testGame = startedGame();
        gameFlowFacade.startRound(testGame.gameId());
        String acting = actingPlayer(testGame.gameId());
        testGame.playerIds().stream().filter(id -> !id.equals(acting)).forEach(id -> setConnected(id, false));

        // when
        EndTurnResponse response = gameFlowFacade.endTurn(testGame.gameId(), acting);

        // then
        assertThat(response.outcome()).isEqualTo(Outcome.NEXT_TURN);
        assertThat(response.nextPlayer().id()).isEqualTo(acting);
        assertThat(turnRepository.countByGameId(testGame.gameId())).isEqualTo(2);
    }

    @Test
    @DisplayName("접속자가 아무도 없으면 턴을 끝내지 않고 NO_ELIGIBLE_PLAYER로 일시정지한다")
    void endTurn_noEligiblePlayerPauses() {
        // given
        TestGame testGame = startedGame();
        gameFlowFacade.startRound(testGame.gameId());
        String acting = actingPlayer(testGame.gameId());
        String turnId = game(testGame.gameId()).getCurrentTurnId();
        testGame.playerIds().forEach(id -> setConnected(id, false));

        // when
        EndTurnResponse response = gameFlowFacade.endTurn(testGame.gameId(), acting);

        // then
        assertThat(response.outcome()).isEqualTo(Outcome.NO_ELIGIBLE_PLAYER);
        assertThat(response.advanced()).isFalse();

        Game game = game(testGame.gameId());
        assertThat(game.getSubStatus()).isEqualTo(GameSubStatus.TURN_PAUSED);
        assertThat(game.getCurrentTurnId()).isEqualTo(turnId);

        Turn turn = currentTurn(testGame.gameId());
        assertThat(turn.isComplete()).isFalse();
        assertThat(turn.getPausedReason()).isEqualTo(PausedReason.NO_ELIGIBLE_PLAYER);
    }

    @Test
    @DisplayName("접속 끊김으로 멈춘 턴은 NO_ELIGIBLE_PLAYER로 끝나도 사유가 유지되어 재접속 시 자동 재개된다")
    void endTurn_noEligiblePlayerKeepsDisconnectReason() {
        // given
        TestGame testGame = startedGame();
        gameFlowFacade.startRound(testGame.gameId());
        String acting = actingPlayer(testGame.gameId());
        gameFlowFacade.startTurn(testGame.gameId(), acting);
        assertThat(gameFlowFacade.pauseForDisconnect(testGame.gameId(), acting)).isTrue();
        testGame.playerIds().forEach(id -> setConnected(id, false));

        // when
        EndTurnResponse response = gameFlowFacade.endTurn(testGame.gameId(), acting);

        // then
        assertThat(response.outcome()).isEqualTo(Outcome.NO_ELIGIBLE_PLAYER);
        assertThat(currentTurn(testGame.gameId()).getPausedReason()).isEqualTo(PausedReason.PLAYER_DISCONNECTED);

        setConnected(acting, true);
        assertThat(gameFlowFacade.resumeForReconnect(testGame.gameId(), acting)).isTrue();
        assertThat(game(testGame.gameId()).getSubStatus()).isEqualTo(GameSubStatus.TURN_ACTIVE);
    }

    @Test
    @DisplayName("1라운드 문구를 모두 맞추면 2라운드 round_intro로 넘어가고, 라운드 시작 시 넘긴 문구만 통으로 돌아온다")
    void roundComplete_thenSkippedPhrasesReturnToBowl() {
        // given
        TestGame testGame = createReadyGame(2, 2);
        List<String> ring = gameFlowFacade.startGame(testGame.gameId()).turnOrder();
        gameFlowFacade.startRound(testGame.gameId());
        String acting = actingPlayer(testGame.gameId());
        gameFlowFacade.startTurn(testGame.gameId(), acting);

        List<Phrase> bowl = phrases(testGame.gameId(), PhraseStatus.ACTIVE);
        gameFlowFacade.skipPhrase(testGame.gameId(), bowl.get(0).getId(), acting);
        for (Phrase phrase : bowl.subList(1, bowl.size())) {
            gameFlowFacade.guessPhrase(testGame.gameId(), phrase.getId(), acting);
        }

        // then: 1라운드 종료
        Game afterRound1 = game(testGame.gameId());
        assertThat(afterRound1.getSubStatus()).isEqualTo(GameSubStatus.ROUND_INTRO);
        assertThat(afterRound1.getCurrentRound()).isEqualTo(2);
        assertThat(phrases(testGame.gameId(), PhraseStatus.SKIPPED)).hasSize(1);

        // when
        gameFlowFacade.startRound(testGame.gameId());

        // then
        assertThat(phrases(testGame.gameId(), PhraseStatus.SKIPPED)).isEmpty();
        assertThat(phrases(testGame.gameId(), PhraseStatus.ACTIVE))
                .singleElement()
                .extracting(Phrase::getId).isEqualTo(bowl.get(0).getId());
        assertThat(phrases(testGame.gameId(), PhraseStatus.GUESSED)).hasSize(bowl.size() - 1);

        Turn round2Turn = currentTurn(testGame.gameId());
        assertThat(round2Turn.getRound()).isEqualTo(2);
        assertThat(round2Turn.getPlayerId()).isEqualTo(nextInRing(ring, acting));
        assertThat(game(testGame.gameId()).getSubStatus()).isEqualTo(GameSubStatus.TURN_STARTING);
    }

    @Test
    @DisplayName("1라운드 문구를 모두 맞추면 넘긴 문구 없이 2라운드를 시작할 수 있다")
    void allGuessedInRound1_startsRound2() {
        // given
        TestGame testGame = startedGame();
        gameFlowFacade.startRound(testGame.gameId());

        // when
        guessEverythingInCurrentTurn(testGame.gameId());
        gameFlowFacade.startRound(testGame.gameId());

        // then
        Game game = game(testGame.gameId());
        assertThat(game.getCurrentRound()).isEqualTo(2);
        assertThat(game.getSubStatus()).isEqualTo(GameSubStatus.TURN_STARTING);
        assertThat(phrases(testGame.gameId(), PhraseStatus.ACTIVE)).isEmpty();
        assertThat(phrases(testGame.gameId(), PhraseStatus.GUESSED)).hasSize(12);
    }

    @Test
    @DisplayName("라운드 종료 후 대기 턴의 플레이어가 끊기면 라운드 시작 시 다음 접속자에게 첫 턴을 넘긴다")
    void startRound_replacesPendingTurnOfDisconnectedPlayer() {
        // given
        TestGame testGame = createReadyGame(2, 2);
        List<String> ring = gameFlowFacade.startGame(testGame.gameId()).turnOrder();
        gameFlowFacade.startRound(testGame.gameId());
        guessEverythingInCurrentTurn(testGame.gameId());

        Turn pending = currentTurn(testGame.gameId());
        assertThat(pending.isPending()).isTrue();
        assertThat(pending.getRound()).isEqualTo(2);
        setConnected(pending.getPlayerId(), false);

        // when
        StartRoundResponse response = gameFlowFacade.startRound(testGame.gameId());

        // then
        String expected = nextInRing(ring, pending.getPlayerId());
        assertThat(response.currentPlayer().id()).isEqualTo(expected);
        assertThat(response.currentPlayer().connected()).isTrue();

        Turn opening = currentTurn(testGame.gameId());
        assertThat(opening.getId()).isNotEqualTo(pending.getId());
        assertThat(opening.getPlayerId()).isEqualTo(expected);
        assertThat(opening.getRound()).isEqualTo(2);
        assertThat(turnRepository.findById(pending.getId())).isEmpty();
        assertThat(turnRepository.countByGameId(testGame.gameId())).isEqualTo(2);
        assertThat(game(testGame.gameId()).getSubStatus()).isEqualTo(GameSubStatus.TURN_STARTING);
    }

    @Test
    @DisplayName("3라운드가 끝나면 finished/game_complete, 점수 합계는 맞춘 문구 수와 같다")
    void gameFinishesAfterRound3() {
        // given
        TestGame testGame = startedGame();
        gameFlowFacade.startRound(testGame.gameId());
        guessEverythingInCurrentTurn(testGame.gameId());

        // 2, 3라운드는 통이 비어 있으므로 턴 종료만으로 라운드가 끝난다
        gameFlowFacade.startRound(testGame.gameId());
        String round2Player = actingPlayer(testGame.gameId());
        gameFlowFacade.startTurn(testGame.gameId(), round2Player);
        EndTurnResponse round2 = gameFlowFacade.endTurn(testGame.gameId(), round2Player);
        assertThat(round2.outcome()).isEqualTo(Outcome.ROUND_COMPLETE);

        gameFlowFacade.startRound(testGame.gameId());
        String round3Player = actingPlayer(testGame.gameId());
        gameFlowFacade.startTurn(testGame.gameId(), round3Player);

        // when
        EndTurnResponse round3 = gameFlowFacade.endTurn(testGame.gameId(), round3Player);

        // then
        assertThat(round3.outcome()).isEqualTo(Outcome.GAME_COMPLETE);
        Game game = game(testGame.gameId());
        assertThat(game.getStatus()).isEqualTo(GameStatus.FINISHED);
        assertThat(game.getSubStatus()).isEqualTo(GameSubStatus.GAME_COMPLETE);
        assertThat(game.getFinishedAt()).isNotNull();
        assertThat(game.getCurrentTurnId()).isNull();
        assertThat(turnRepository.findAllByGameIdAndCompleteFalse(testGame.gameId())).isEmpty();

        int total = teamRepository.findAllByGameIdOrderBySlotAsc(testGame.gameId()).stream()
                .mapToInt(Team::getTotalScore).sum();
        assertThat(total).isEqualTo(12);

        assertThatThrownBy(() -> gameFlowFacade.startRound(testGame.gameId()))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_GAME_STATE);
    }

    @Test
    @DisplayName("일시정지 후 재개: 시작 전 멈춘 턴은 turn_starting, 진행 중 멈춘 턴은 turn_active로 돌아간다")
    void pauseAndResume() {
        // given
        TestGame testGame = startedGame();
        gameFlowFacade.startRound(testGame.gameId());
        String acting = actingPlayer(testGame.gameId());

        // 시작 전 (호스트가 멈춤)
        gameFlowFacade.pauseTurn(testGame.gameId(), testGame.hostId());
        assertThat(game(testGame.gameId()).getSubStatus()).isEqualTo(GameSubStatus.TURN_PAUSED);
        assertThat(currentTurn(testGame.gameId()).getPausedReason()).isEqualTo(PausedReason.HOST_PAUSED);
        gameFlowFacade.resumeTurn(testGame.gameId(), testGame.hostId());
        assertThat(game(testGame.gameId()).getSubStatus()).isEqualTo(GameSubStatus.TURN_STARTING);

        // 진행 중 (현재 플레이어 접속 끊김)
        gameFlowFacade.startTurn(testGame.gameId(), acting);
        assertThat(gameFlowFacade.pauseForDisconnect(testGame.gameId(), acting)).isTrue();
        assertThat(currentTurn(testGame.gameId()).getPausedReason()).isEqualTo(PausedReason.PLAYER_DISCONNECTED);

        // 문구 처리는 turn_active에서만
        Phrase phrase = phrases(testGame.gameId(), PhraseStatus.ACTIVE).get(0);
        assertThatThrownBy(() -> gameFlowFacade.guessPhrase(testGame.gameId(), phrase.getId(), acting))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_GAME_STATE);

        assertThat(gameFlowFacade.resumeForReconnect(testGame.gameId(), acting)).isTrue();
        assertThat(game(testGame.gameId()).getSubStatus()).isEqualTo(GameSubStatus.TURN_ACTIVE);
        assertThat(currentTurn(testGame.gameId()).isPaused()).isFalse();
    }

    @Test
    @DisplayName("[동시성] 같은 턴에 대한 턴 종료가 동시에 들어와도 한 번만 진행된다")
    void concurrentEndTurn_advancesOnce() throws Exception {
        // given
        TestGame testGame = startedGame();
        gameFlowFacade.startRound(testGame.gameId());
        String acting = actingPlayer(testGame.gameId());

        int threadCount = 5;
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        CountDownLatch ready = new CountDownLatch(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger failCount = new AtomicInteger();

        // when
        for (int i = 0; i < threadCount; i++) {
            executorService.submit(() -> {
                try {
                    ready.countDown();
                    start.await();
                    gameFlowFacade.endTurn(testGame.gameId(), acting);
                    successCount.incrementAndGet();
                } catch (Exception e) {
                    failCount.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }
        ready.await();
        start.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executorService.shutdown();

        // then
        assertThat(successCount.get()).isEqualTo(1);
        assertThat(failCount.get()).isEqualTo(threadCount - 1);
        assertThat(turnRepository.countByGameId(testGame.gameId())).isEqualTo(2);
        assertThat(turnRepository.findAllByGameIdAndCompleteFalse(testGame.gameId())).hasSize(1);
    }

    private TestGame startedGame() {
        TestGame testGame = createReadyGame(2, 2);
        gameFlowFacade.startGame(testGame.gameId());
        return testGame;
    }

    private static String nextInRing(List<String> ring, String playerId) {
        return ring.get((ring.indexOf(playerId) + 1) % ring.size());
    }
}

package com.example.fishbowl.game.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.fishbowl.game.domain.entity.Team;
import com.example.fishbowl.game.domain.state.GameSubStatus;
import com.example.fishbowl.game.dto.request.CreateGameRequest;
import com.example.fishbowl.game.dto.request.UpdateGameConfigRequest;
import com.example.fishbowl.game.dto.response.CreateGameResponse;
import com.example.fishbowl.game.dto.response.GameSnapshot;
import com.example.fishbowl.game.dto.response.PhraseSubmissionStatus;
import com.example.fishbowl.game.dto.response.PlayerSummary;
import com.example.fishbowl.global.error.CommonException;
import com.example.fishbowl.global.error.ErrorCode;
import com.example.fishbowl.support.GameIntegrationTestSupport;

class GameSetupServiceTest extends GameIntegrationTestSupport {

    @Test
    @DisplayName("게임 생성: 설정값이 없으면 기본값, 팀 이름/색상 부여, 호스트는 첫 팀")
    void createGame_withDefaults() {
        // when
        CreateGameResponse response = gameSetupService.createGame(
                new CreateGameRequest("금요일 게임", "민수", null, null, null));

        // then
        GameSnapshot game = response.game();
        assertThat(game.id()).hasSize(6).matches("[A-Z0-9]{6}");
        assertThat(game.status()).isEqualTo("setup");
        assertThat(game.subStatus()).isEqualTo("waiting_for_players");
        assertThat(game.teamCount()).isEqualTo(2);
        assertThat(game.phrasesPerPlayer()).isEqualTo(3);
        assertThat(game.timerDuration()).isEqualTo(60);
        assertThat(game.hostPlayerId()).isEqualTo(response.host().id());

        List<Team> teams = teamRepository.findAllByGameIdOrderBySlotAsc(game.id());
        assertThat(teams).extracting(Team::getName).containsExactly("Red Team", "Teal Team");
        assertThat(teams).extracting(Team::getColor).containsExactly("#FF6B6B", "#4ECDC4");
        assertThat(response.host().teamId()).isEqualTo(teams.get(0).getId());
    }

    @Test
    @DisplayName("범위를 벗어난 설정이면 INVALID_GAME_CONFIG")
    void createGame_invalidConfig() {
        assertThatThrownBy(() -> gameSetupService.createGame(new CreateGameRequest("게임", "host", 9, 5, 60)))
                .isInstanceOf(CommonException.class)
                .satisfies(e -> {
                    CommonException ce = (CommonException) e;
                    assertThat(ce.getErrorCode()).isEqualTo(ErrorCode.INVALID_GAME_CONFIG);
                    assertThat(ce.getDetails()).containsEntry("field", "teamCount").containsEntry("max", 8);
                });
    }

    @Test
    @DisplayName("참가자는 인원이 가장 적은 팀에 배정되고, 같으면 앞 팀")
    void joinGame_balancesTeams() {
        // given
        TestGame testGame = createGameWithPlayers(2, 2);
        List<Team> teams = teamRepository.findAllByGameIdOrderBySlotAsc(testGame.gameId());

        // then
        assertThat(testGame.playerIds())
                .extracting(playerId -> playerRepository.findById(playerId).orElseThrow().getTeamId())
                .containsExactly(teams.get(0).getId(), teams.get(1).getId(), teams.get(0).getId(),
                        teams.get(1).getId());
    }

    @Test
    @DisplayName("같은 게임에서 대소문자만 다른 이름은 DUPLICATE_PLAYER_NAME")
    void joinGame_duplicateName() {
        TestGame testGame = createGameWithPlayers(2, 1);

        assertThatThrownBy(() -> gameSetupService.joinGame(testGame.gameId(), "PLAYER1"))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.DUPLICATE_PLAYER_NAME);
    }

    @Test
    @DisplayName("형식이 틀린 게임 코드는 INVALID_GAME_CODE")
    void joinGame_invalidCode() {
        assertThatThrownBy(() -> gameSetupService.joinGame("abc", "someone"))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_GAME_CODE);
    }

    @Test
    @DisplayName("게임이 시작된 뒤에는 참가할 수 없다")
    void joinGame_afterStart() {
        TestGame testGame = createReadyGame(2, 2);
        gameFlowFacade.startGame(testGame.gameId());

        assertThatThrownBy(() -> gameSetupService.joinGame(testGame.gameId(), "latecomer"))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.GAME_NOT_ACCEPTING_PLAYERS);
    }

    @Test
    @DisplayName("모든 플레이어가 문구를 내면 ready_to_start, 새 참가자가 오면 다시 waiting_for_players")
    void readinessFollowsSubmissions() {
        // given
        TestGame testGame = createReadyGame(2, 2);
        assertThat(game(testGame.gameId()).getSubStatus()).isEqualTo(GameSubStatus.READY_TO_START);

        PhraseSubmissionStatus status = phraseService.getSubmissionStatus(testGame.gameId());
        assertThat(status.allSubmitted()).isTrue();
        assertThat(status.totalSubmitted()).isEqualTo(12);

        // when
        gameSetupService.joinGame(testGame.gameId(), "latecomer");

        // then
        assertThat(game(testGame.gameId()).getSubStatus()).isEqualTo(GameSubStatus.WAITING_FOR_PLAYERS);
        assertThat(phraseService.getSubmissionStatus(testGame.gameId()).allSubmitted()).isFalse();
    }

    @Test
    @DisplayName("1인당 문구 수를 넘겨 제출하면 PHRASE_QUOTA_EXCEEDED")
    void submitPhrases_quotaExceeded() {
        TestGame testGame = createGameWithPlayers(2, 1);
        submitAllPhrases(testGame.gameId(), testGame.hostId());

        assertThatThrownBy(() -> phraseService.submitPhrases(testGame.gameId(), testGame.hostId(), List.of("하나 더")))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.PHRASE_QUOTA_EXCEEDED);
        assertThat(phraseRepository.countByGameIdAndPlayerId(testGame.gameId(), testGame.hostId()))
                .isEqualTo(PHRASES_PER_PLAYER);
    }

    @Test
    @DisplayName("팀 수를 바꾸면 팀을 다시 만들고 참가 순서대로 번갈아 배정한다 (호스트만 가능)")
    void updateConfig_reassignsTeams() {
        // given
        TestGame testGame = createGameWithPlayers(2, 3);

        assertThatThrownBy(() -> gameSetupService.updateConfig(testGame.gameId(),
                new UpdateGameConfigRequest(testGame.playerIds().get(1), 3, null, null)))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.HOST_ONLY);

        // when
        GameSnapshot snapshot = gameSetupService.updateConfig(testGame.gameId(),
                new UpdateGameConfigRequest(testGame.hostId(), 3, null, 90));

        // then
        assertThat(snapshot.teamCount()).isEqualTo(3);
        assertThat(snapshot.timerDuration()).isEqualTo(90);
        assertThat(snapshot.teams()).hasSize(3);

        List<Team> teams = teamRepository.findAllByGameIdOrderBySlotAsc(testGame.gameId());
        assertThat(teams).hasSize(3);
        for (int i = 0; i < testGame.playerIds().size(); i++) {
            String teamId = playerRepository.findById(testGame.playerIds().get(i)).orElseThrow().getTeamId();
            assertThat(teamId).isEqualTo(teams.get(i % 3).getId());
        }
    }

    @Test
    @DisplayName("준비 단계에서 플레이어는 스스로 팀을 바꿀 수 있다")
    void assignTeam_bySelf() {
        // given
        TestGame testGame = createReadyGame(2, 2);
        List<Team> teams = teamRepository.findAllByGameIdOrderBySlotAsc(testGame.gameId());
        String player = testGame.playerIds().get(1);
        assertThat(playerRepository.findById(player).orElseThrow().getTeamId()).isEqualTo(teams.get(1).getId());

        // when
        PlayerSummary summary = gameSetupService.assignTeam(testGame.gameId(), player, player, teams.get(0).getId());

        // then
        assertThat(summary.teamId()).isEqualTo(teams.get(0).getId());
        assertThat(playerRepository.findById(player).orElseThrow().getTeamId()).isEqualTo(teams.get(0).getId());
        assertThat(playerRepository.countByGameIdAndTeamId(testGame.gameId(), teams.get(0).getId())).isEqualTo(3);
        assertThat(game(testGame.gameId()).getSubStatus()).isEqualTo(GameSubStatus.READY_TO_START);
    }

    @Test
    @DisplayName("다른 플레이어의 팀은 호스트만 바꿀 수 있다")
    void assignTeam_otherPlayerRequiresHost() {
        // given
        TestGame testGame = createGameWithPlayers(2, 2);
        List<Team> teams = teamRepository.findAllByGameIdOrderBySlotAsc(testGame.gameId());
        String target = testGame.playerIds().get(2);
        String stranger = testGame.playerIds().get(1);

        // when & then
        assertThatThrownBy(() -> gameSetupService.assignTeam(testGame.gameId(), target, stranger,
                teams.get(1).getId()))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.HOST_ONLY);

        gameSetupService.assignTeam(testGame.gameId(), target, testGame.hostId(), teams.get(1).getId());
        assertThat(playerRepository.findById(target).orElseThrow().getTeamId()).isEqualTo(teams.get(1).getId());
    }

    @Test
    @DisplayName("게임에 없는 팀이면 TEAM_NOT_FOUND, 시작 후에는 INVALID_GAME_STATE")
    void assignTeam_rejections() {
        // given
        TestGame testGame = createReadyGame(2, 2);
        TestGame otherGame = createGameWithPlayers(2, 1);
        String foreignTeam = teamRepository.findAllByGameIdOrderBySlotAsc(otherGame.gameId()).get(0).getId();
        String player = testGame.playerIds().get(1);

        // when & then
        assertThatThrownBy(() -> gameSetupService.assignTeam(testGame.gameId(), player, player, foreignTeam))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.TEAM_NOT_FOUND);

        gameFlowFacade.startGame(testGame.gameId());
        String ownTeam = teamRepository.findAllByGameIdOrderBySlotAsc(testGame.gameId()).get(0).getId();
        assertThatThrownBy(() -> gameSetupService.assignTeam(testGame.gameId(), player, player, ownTeam))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_GAME_STATE);
    }
}

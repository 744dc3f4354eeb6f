package com.example.fishbowl.game.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
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
import com.example.fishbowl.game.domain.state.GameStatus;
import com.example.fishbowl.game.domain.state.GameSubStatus;
import com.example.fishbowl.game.dto.request.CreateGameRequest;
import com.example.fishbowl.game.dto.request.UpdateGameConfigRequest;
import com.example.fishbowl.game.dto.response.CreateGameResponse;
import com.example.fishbowl.game.dto.response.GameSnapshot;
import com.example.fishbowl.game.dto.response.JoinGameResponse;
import com.example.fishbowl.game.dto.response.PlayerSummary;
import com.example.fishbowl.game.event.TeamAssignedEvent;
import com.example.fishbowl.game.repository.GameRepository;
import com.example.fishbowl.game.repository.PhraseRepository;
import com.example.fishbowl.game.repository.PlayerRepository;
import com.example.fishbowl.game.repository.TeamRepository;
import com.example.fishbowl.game.repository.TurnOrderNodeRepository;
import com.example.fishbowl.game.repository.TurnRepository;
import com.example.fishbowl.game.state.GameStateMachine;
import com.example.fishbowl.global.config.FishbowlProperties;
import com.example.fishbowl.global.error.ErrorCode;
import com.example.fishbowl.global.util.GameCodeGenerator;

/**
 * 게임 준비 단계 서비스
 * - 게임 생성 (기본 팀 + 호스트)
 * - 참가 (인원이 가장 적은 팀에 배정), 팀 변경
 * - 설정 변경, 삭제
 * - 준비 완료 여부 갱신 (waiting_for_players <-> ready_to_start)
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class GameSetupService {

    private static final List<String> TEAM_NAMES = List.of(
            "Red Team", "Teal Team", "Blue Team", "Green Team",
            "Yellow Team", "Purple Team", "Mint Team", "Gold Team");
    private static final List<String> TEAM_COLORS = List.of(
            "#FF6B6B", "#4ECDC4", "#45B7D1", "#96CEB4",
            "#FFEAA7", "#DDA0DD", "#98D8C8", "#F7DC6F");
    private static final String FALLBACK_COLOR = "#CCCCCC";
    private static final int MAX_CODE_ATTEMPTS = 10;

    private final GameRepository gameRepository;
    private final TeamRepository teamRepository;
    private final PlayerRepository playerRepository;
    private final PhraseRepository phraseRepository;
    private final TurnRepository turnRepository;
    private final TurnOrderNodeRepository turnOrderNodeRepository;
    private final GameValidator gameValidator;
    private final GameStateMachine stateMachine;
    private final GameQueryService gameQueryService;
    private final FishbowlProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    // ================= 생성 / 참가 =================

    public CreateGameResponse createGame(CreateGameRequest request) {
        int teamCount = request.teamCount() != null ? request.teamCount() : properties.defaultTeamCount();
        int phrasesPerPlayer = request.phrasesPerPlayer() != null
                ? request.phrasesPerPlayer() : properties.defaultPhrasesPerPlayer();
        int timerDuration = request.timerDuration() != null
                ? request.timerDuration() : properties.defaultTimerDuration();
        gameValidator.validateConfig(teamCount, phrasesPerPlayer, timerDuration);

        Game game = Game.createNew(newGameCode(), request.name(), teamCount, phrasesPerPlayer, timerDuration);
        gameRepository.save(game);
        List<Team> teams = createTeams(game.getId(), teamCount);

        Player host = Player.join(game.getId(), request.hostPlayerName(), teams.get(0).getId());
        playerRepository.save(host);
        game.setHostPlayerId(host.getId());

        log.info("게임 생성: gameId={}, name={}, teams={}, host={}", game.getId(), game.getName(), teamCount,
                host.getName());
        return new CreateGameResponse(gameQueryService.snapshot(game), PlayerSummary.from(host));
    }

    public JoinGameResponse joinGame(String gameId, String playerName) {
        gameValidator.validateGameCode(gameId);
        Game game = loadForUpdate(gameId);
        if (!game.isInSetup()) {
            throw ErrorCode.GAME_NOT_ACCEPTING_PLAYERS.commonException(
                    Map.of("gameId", gameId, "status", game.getStatus().getValue()));
        }
        if (playerRepository.existsByGameIdAndNameIgnoreCase(gameId, playerName)) {
            throw ErrorCode.DUPLICATE_PLAYER_NAME.commonException(Map.of("playerName", playerName));
        }

        Team team = smallestTeam(gameId);
        Player player = Player.join(gameId, playerName, team.getId());
        playerRepository.save(player);
        refreshReadiness(game);

        log.info("플레이어 참가: gameId={}, player={}, team={}", gameId, playerName, team.getName());
        return new JoinGameResponse(gameQueryService.snapshot(game), PlayerSummary.from(player));
    }

    /**
     * 준비 단계에서 플레이어의 팀 변경 (본인 또는 호스트)
     */
    public PlayerSummary assignTeam(String gameId, String playerId, String requesterId, String teamId) {
        Game game = loadForUpdate(gameId);
        stateMachine.requireStatus(game, GameStatus.SETUP);
        if (!playerId.equals(requesterId)) {
            requireHost(game, requesterId);
        }

        Player player = playerRepository.findByIdAndGameId(playerId, gameId)
                .orElseThrow(() -> ErrorCode.PLAYER_NOT_IN_GAME.commonException(
                        Map.of("gameId", gameId, "playerId", playerId)));
        Team team = teamRepository.findByIdAndGameId(teamId, gameId)
                .orElseThrow(() -> ErrorCode.TEAM_NOT_FOUND.commonException(Map.of("teamId", teamId)));

        player.setTeamId(team.getId());
        playerRepository.save(player);
        refreshReadiness(game);

        eventPublisher.publishEvent(new TeamAssignedEvent(gameId, playerId, player.getName(), team.getId()));
        log.info("팀 변경: gameId={}, player={}, team={}", gameId, player.getName(), team.getName());
        return PlayerSummary.from(player);
    }

    // ================= 설정 변경 / 삭제 =================

    /**
     * 팀 수가 바뀌면 팀을 다시 만들고 참가 순서대로 번갈아 배정한다
     */
    public GameSnapshot updateConfig(String gameId, UpdateGameConfigRequest request) {
        Game game = loadForUpdate(gameId);
        requireHost(game, request.playerId());
        stateMachine.requireStatus(game, GameStatus.SETUP);

        int teamCount = request.teamCount() != null ? request.teamCount() : game.getTeamCount();
        int phrasesPerPlayer = request.phrasesPerPlayer() != null
                ? request.phrasesPerPlayer() : game.getPhrasesPerPlayer();
        int timerDuration = request.timerDuration() != null ? request.timerDuration() : game.getTimerDuration();
        gameValidator.validateConfig(teamCount, phrasesPerPlayer, timerDuration);

        if (teamCount != game.getTeamCount()) {
            reassignTeams(game, teamCount);
        }
        game.setTeamCount(teamCount);
        game.setPhrasesPerPlayer(phrasesPerPlayer);
        game.setTimerDuration(timerDuration);
        refreshReadiness(game);

        log.info("게임 설정 변경: gameId={}, teams={}, phrasesPerPlayer={}, timer={}s", gameId, teamCount,
                phrasesPerPlayer, timerDuration);
        return gameQueryService.snapshot(game);
    }

    public void deleteGame(String gameId, String requesterId) {
        Game game = loadForUpdate(gameId);
        requireHost(game, requesterId);

        turnOrderNodeRepository.deleteAllByGameIdInBulk(gameId);
        turnRepository.deleteAllByGameIdInBulk(gameId);
        phraseRepository.deleteAllByGameIdInBulk(gameId);
        playerRepository.deleteAllByGameIdInBulk(gameId);
        teamRepository.deleteAllByGameIdInBulk(gameId);
        gameRepository.deleteById(gameId);
        log.info("게임 삭제: gameId={}", gameId);
    }

    // ================= 준비 상태 =================

    /**
     * 모든 플레이어가 문구를 다 냈고 인원이 충분하면 ready_to_start, 아니면 waiting_for_players
     */
    public void refreshReadiness(Game game) {
        if (!game.isInSetup()) {
            return;
        }
        List<Player> players = playerRepository.findAllByGameIdOrderByCreatedAtAsc(game.getId());
        Map<String, Long> phraseCounts = phraseRepository.findAllByGameIdOrderByCreatedAtAsc(game.getId()).stream()
                .collect(Collectors.groupingBy(Phrase::getPlayerId, Collectors.counting()));

        GameSubStatus target = gameValidator.isReadyToStart(game, players, phraseCounts)
                ? GameSubStatus.READY_TO_START : GameSubStatus.WAITING_FOR_PLAYERS;
        if (game.getSubStatus() != target) {
            stateMachine.transition(game, GameStatus.SETUP, target);
        }
    }

    // ================= 헬퍼 메소드 =================

    private Game loadForUpdate(String gameId) {
        return gameRepository.findByIdForUpdate(gameId)
                .orElseThrow(() -> ErrorCode.GAME_NOT_FOUND.commonException(Map.of("gameId", gameId)));
    }

    private void requireHost(Game game, String playerId) {
        if (!game.getHostPlayerId().equals(playerId)) {
            throw ErrorCode.HOST_ONLY.commonException(Map.of("gameId", game.getId(), "requestedBy", playerId));
        }
    }

    private String newGameCode() {
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            String code = GameCodeGenerator.generateGameCode(properties.gameCodeLength());
            if (!gameRepository.existsById(code)) {
                return code;
            }
        }
        throw new IllegalStateException("사용 가능한 게임 코드를 만들지 못했습니다.");
    }

    private List<Team> createTeams(String gameId, int teamCount) {
        List<Team> teams = new ArrayList<>(teamCount);
        for (int i = 0; i < teamCount; i++) {
            String name = i < TEAM_NAMES.size() ? TEAM_NAMES.get(i) : "Team " + (i + 1);
            String color = i < TEAM_COLORS.size() ? TEAM_COLORS.get(i) : FALLBACK_COLOR;
            teams.add(Team.create(gameId, i, name, color));
        }
        return teamRepository.saveAll(teams);
    }

    // 인원이 같으면 앞 팀 우선
    private Team smallestTeam(String gameId) {
        return teamRepository.findAllByGameIdOrderBySlotAsc(gameId).stream()
                .min(Comparator.comparingLong((Team team) -> playerRepository.countByGameIdAndTeamId(gameId, team.getId()))
                        .thenComparingInt(Team::getSlot))
                .orElseThrow(() -> ErrorCode.TEAM_NOT_FOUND.commonException(Map.of("gameId", gameId)));
    }

    private void reassignTeams(Game game, int teamCount) {
        List<Player> players = playerRepository.findAllByGameIdOrderByCreatedAtAsc(game.getId());
        teamRepository.deleteAllByGameIdInBulk(game.getId());
        List<Team> teams = createTeams(game.getId(), teamCount);

        for (int i = 0; i < players.size(); i++) {
            players.get(i).setTeamId(teams.get(i % teamCount).getId());
        }
        playerRepository.saveAll(players);
    }
}

package com.example.fishbowl.game.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import com.example.fishbowl.game.domain.entity.Game;
import com.example.fishbowl.game.domain.entity.Player;
import com.example.fishbowl.game.domain.entity.Team;
import com.example.fishbowl.global.config.FishbowlProperties;
import com.example.fishbowl.global.error.ErrorCode;
import com.example.fishbowl.global.util.GameCodeGenerator;

@Component
@RequiredArgsConstructor
public class GameValidator {

    private static final int MIN_PLAYERS_PER_TEAM = 2;

    private final FishbowlProperties properties;

    public void validateGameCode(String gameId) {
        if (!GameCodeGenerator.isValidGameCode(gameId, properties.gameCodeLength())) {
            throw ErrorCode.INVALID_GAME_CODE.commonException(details("gameId", gameId));
        }
    }

    public void validateConfig(int teamCount, int phrasesPerPlayer, int timerDuration) {
        checkRange("teamCount", teamCount, properties.minTeamCount(), properties.maxTeamCount());
        checkRange("phrasesPerPlayer", phrasesPerPlayer,
                properties.minPhrasesPerPlayer(), properties.maxPhrasesPerPlayer());
        checkRange("timerDuration", timerDuration, properties.minTimerDuration(), properties.maxTimerDuration());
    }

    /**
     * 게임 시작 조건
     * 1. 팀 수 = 설정된 팀 수
     * 2. 플레이어 수 >= 팀 수 x 2
     * 3. 모든 플레이어가 팀에 배정됨
     * 4. 문구 총합 >= 플레이어 수 x 1인당 문구 수, 그리고 각자 할당량 충족
     */
    public void validateStartGame(Game game, List<Team> teams, List<Player> players,
                                  Map<String, Long> phraseCountByPlayer) {
        if (teams.size() != game.getTeamCount()) {
            throw ErrorCode.TEAM_COUNT_NOT_SATISFIED.commonException(
                    details("expected", game.getTeamCount(), "actual", teams.size()));
        }

        int requiredPlayers = game.getTeamCount() * MIN_PLAYERS_PER_TEAM;
        if (players.size() < requiredPlayers) {
            throw ErrorCode.NOT_ENOUGH_PLAYERS.commonException(
                    details("required", requiredPlayers, "actual", players.size()));
        }

        for (Player player : players) {
            if (!player.hasTeam()) {
                throw ErrorCode.PLAYER_WITHOUT_TEAM.commonException(details("playerId", player.getId()));
            }
        }

        long requiredPhrases = (long) players.size() * game.getPhrasesPerPlayer();
        long totalPhrases = phraseCountByPlayer.values().stream().mapToLong(Long::longValue).sum();
        if (totalPhrases < requiredPhrases) {
            throw ErrorCode.NOT_ENOUGH_PHRASES.commonException(
                    details("required", requiredPhrases, "actual", totalPhrases));
        }

        for (Player player : players) {
            long submitted = phraseCountByPlayer.getOrDefault(player.getId(), 0L);
            if (submitted < game.getPhrasesPerPlayer()) {
                throw ErrorCode.PHRASE_QUOTA_NOT_MET.commonException(
                        details("playerId", player.getId(), "required", game.getPhrasesPerPlayer(),
                                "actual", submitted));
            }
        }
    }

    /**
     * 설정 단계의 준비 완료 여부 (WAITING_FOR_PLAYERS <-> READY_TO_START 판단용, 예외 없음)
     */
    public boolean isReadyToStart(Game game, List<Player> players, Map<String, Long> phraseCountByPlayer) {
        if (players.size() < game.getTeamCount() * MIN_PLAYERS_PER_TEAM) {
            return false;
        }
        return players.stream().allMatch(player -> player.hasTeam()
                && phraseCountByPlayer.getOrDefault(player.getId(), 0L) >= game.getPhrasesPerPlayer());
    }

    private void checkRange(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw ErrorCode.INVALID_GAME_CONFIG.commonException(
                    details("field", field, "value", value, "min", min, "max", max));
        }
    }

    // Map.of는 null 값을 허용하지 않으므로 직접 구성
    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return details;
    }
}

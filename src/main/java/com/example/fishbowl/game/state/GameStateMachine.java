package com.example.fishbowl.game.state;

import static com.example.fishbowl.game.domain.state.GameSubStatus.GAME_COMPLETE;
import static com.example.fishbowl.game.domain.state.GameSubStatus.READY_TO_START;
import static com.example.fishbowl.game.domain.state.GameSubStatus.ROUND_COMPLETE;
import static com.example.fishbowl.game.domain.state.GameSubStatus.ROUND_INTRO;
import static com.example.fishbowl.game.domain.state.GameSubStatus.TURN_ACTIVE;
import static com.example.fishbowl.game.domain.state.GameSubStatus.TURN_PAUSED;
import static com.example.fishbowl.game.domain.state.GameSubStatus.TURN_STARTING;
import static com.example.fishbowl.game.domain.state.GameSubStatus.WAITING_FOR_PLAYERS;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import com.example.fishbowl.game.domain.entity.Game;
import com.example.fishbowl.game.domain.state.GameStatus;
import com.example.fishbowl.game.domain.state.GameSubStatus;
import com.example.fishbowl.global.error.ErrorCode;

/**
 * 게임 상태(status/subStatus) 전이 규칙.
 * 세부 상태는 하나의 상위 상태에만 속하므로 전이표는 세부 상태 기준으로 관리한다.
 * FINISHED/GAME_COMPLETE 는 종료 상태 (나가는 전이 없음)
 */
@Slf4j
@Component
public class GameStateMachine {

    private static final Map<GameSubStatus, Set<GameSubStatus>> TRANSITIONS = new EnumMap<>(GameSubStatus.class);

    static {
        TRANSITIONS.put(WAITING_FOR_PLAYERS, EnumSet.of(READY_TO_START, ROUND_INTRO));
        TRANSITIONS.put(READY_TO_START, EnumSet.of(WAITING_FOR_PLAYERS, ROUND_INTRO));
        TRANSITIONS.put(ROUND_INTRO, EnumSet.of(TURN_STARTING));
        // 같은 세부 상태로의 전이: 다음 플레이어 턴 준비 / 일시정지 사유 변경
        TRANSITIONS.put(TURN_STARTING, EnumSet.of(TURN_ACTIVE, TURN_STARTING, TURN_PAUSED, ROUND_COMPLETE));
        TRANSITIONS.put(TURN_ACTIVE, EnumSet.of(TURN_PAUSED, TURN_STARTING, ROUND_COMPLETE));
        TRANSITIONS.put(TURN_PAUSED, EnumSet.of(TURN_ACTIVE, TURN_STARTING, TURN_PAUSED, ROUND_COMPLETE));
        TRANSITIONS.put(ROUND_COMPLETE, EnumSet.of(ROUND_INTRO, GAME_COMPLETE));
        TRANSITIONS.put(GAME_COMPLETE, EnumSet.noneOf(GameSubStatus.class));
    }

    public boolean canTransition(GameStatus fromStatus, GameSubStatus fromSubStatus,
                                 GameStatus toStatus, GameSubStatus toSubStatus) {
        if (!fromSubStatus.isLegalFor(fromStatus) || !toSubStatus.isLegalFor(toStatus)) {
            return false;
        }
        return TRANSITIONS.getOrDefault(fromSubStatus, Collections.emptySet()).contains(toSubStatus);
    }

    public Set<GameSubStatus> allowedTargets(GameSubStatus from) {
        return Collections.unmodifiableSet(TRANSITIONS.getOrDefault(from, Collections.emptySet()));
    }

    /**
     * 전이 규칙을 확인한 뒤 게임 엔티티의 상태를 바꾼다. 저장은 호출자의 트랜잭션에서 이뤄진다.
     */
    public void transition(Game game, GameStatus toStatus, GameSubStatus toSubStatus) {
        GameStatus fromStatus = game.getStatus();
        GameSubStatus fromSubStatus = game.getSubStatus();

        if (!canTransition(fromStatus, fromSubStatus, toStatus, toSubStatus)) {
            log.warn("허용되지 않은 상태 전이: gameId={}, {}/{} -> {}/{}", game.getId(),
                    fromStatus.getValue(), fromSubStatus.getValue(), toStatus.getValue(), toSubStatus.getValue());
            Map<String, Object> details = currentState(game);
            details.put("targetStatus", toStatus.getValue());
            details.put("targetSubStatus", toSubStatus.getValue());
            throw ErrorCode.INVALID_STATE_TRANSITION.commonException(details);
        }

        game.setStatus(toStatus);
        game.setSubStatus(toSubStatus);
        log.info("게임 상태 전이: gameId={}, {}/{} -> {}/{}", game.getId(),
                fromStatus.getValue(), fromSubStatus.getValue(), toStatus.getValue(), toSubStatus.getValue());
    }

    /**
     * 작업 전 현재 세부 상태 확인. 맞지 않으면 INVALID_GAME_STATE (변경 없음)
     */
    public void requireSubStatus(Game game, GameSubStatus... expected) {
        for (GameSubStatus subStatus : expected) {
            if (game.getSubStatus() == subStatus) {
                return;
            }
        }
        Map<String, Object> details = currentState(game);
        details.put("expected", Arrays.stream(expected).map(GameSubStatus::getValue).collect(Collectors.toList()));
        throw ErrorCode.INVALID_GAME_STATE.commonException(details);
    }

    public void requireStatus(Game game, GameStatus expected) {
        if (game.getStatus() != expected) {
            Map<String, Object> details = currentState(game);
            details.put("expected", expected.getValue());
            throw ErrorCode.INVALID_GAME_STATE.commonException(details);
        }
    }

    private Map<String, Object> currentState(Game game) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("gameId", game.getId());
        details.put("currentStatus", game.getStatus().getValue());
        details.put("currentSubStatus", game.getSubStatus().getValue());
        return details;
    }
}

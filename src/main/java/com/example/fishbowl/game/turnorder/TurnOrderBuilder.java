package com.example.fishbowl.game.turnorder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import com.example.fishbowl.game.domain.entity.Player;
import com.example.fishbowl.game.domain.entity.Team;
import com.example.fishbowl.game.domain.entity.TurnOrderNode;
import com.example.fishbowl.game.repository.TurnOrderNodeRepository;
import com.example.fishbowl.global.util.GameCodeGenerator;

/**
 * 스네이크 드래프트 방식으로 팀이 번갈아 나오는 원형 턴 순서를 만든다.
 *
 * 1. 팀별로 플레이어를 묶고 팀 안에서 섞는다.
 * 2. 팀 순서를 섞는다.
 * 3. 짝수 행은 팀 순서대로, 홀수 행은 역순으로 한 명씩 뽑는다. 인원이 모자란 팀은 그 행에서 빠진다.
 * 4. 결과 순서의 마지막 다음은 처음으로 이어진다.
 *
 * 호출 전 검증(모든 플레이어의 팀 배정, 최소 인원)은 호출자가 책임진다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TurnOrderBuilder {

    private final TurnOrderNodeRepository turnOrderNodeRepository;
    private final Random gameRandom;

    /**
     * 드래프트 순서만 계산 (저장 없음)
     */
    public List<Player> draftSequence(List<Player> players, List<Team> teams) {
        Map<String, List<Player>> playersByTeam = new LinkedHashMap<>();
        for (Team team : teams) {
            playersByTeam.put(team.getId(), new ArrayList<>());
        }
        for (Player player : players) {
            List<Player> teamPlayers = playersByTeam.get(player.getTeamId());
            if (teamPlayers == null) {
                throw new IllegalArgumentException("팀 목록에 없는 팀에 배정된 플레이어: " + player.getId());
            }
            teamPlayers.add(player);
        }

        int maxPlayersPerTeam = 0;
        for (List<Player> teamPlayers : playersByTeam.values()) {
            Collections.shuffle(teamPlayers, gameRandom);
            maxPlayersPerTeam = Math.max(maxPlayersPerTeam, teamPlayers.size());
        }

        List<String> teamOrder = new ArrayList<>(playersByTeam.keySet());
        Collections.shuffle(teamOrder, gameRandom);
        List<String> reversedTeamOrder = new ArrayList<>(teamOrder);
        Collections.reverse(reversedTeamOrder);

        List<Player> sequence = new ArrayList<>(players.size());
        for (int position = 0; position < maxPlayersPerTeam; position++) {
            List<String> rowOrder = (position % 2 == 0) ? teamOrder : reversedTeamOrder;
            for (String teamId : rowOrder) {
                List<Player> teamPlayers = playersByTeam.get(teamId);
                if (position < teamPlayers.size()) {
                    sequence.add(teamPlayers.get(position));
                }
            }
        }
        return sequence;
    }

    /**
     * 드래프트 순서를 원형 연결 리스트 노드로 만들어 저장한다.
     */
    public List<TurnOrderNode> build(String gameId, List<Player> players, List<Team> teams) {
        List<Player> sequence = draftSequence(players, teams);
        List<TurnOrderNode> nodes = link(gameId, sequence);
        turnOrderNodeRepository.saveAll(nodes);

        log.info("턴 순서 생성 완료: gameId={}, players={}, order={}", gameId, nodes.size(),
                nodes.stream().map(TurnOrderNode::getPlayerId).toList());
        return nodes;
    }

    static List<TurnOrderNode> link(String gameId, List<Player> sequence) {
        int n = sequence.size();
        List<TurnOrderNode> nodes = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Player player = sequence.get(i);
            nodes.add(TurnOrderNode.builder()
                    .id(GameCodeGenerator.generateId())
                    .gameId(gameId)
                    .playerId(player.getId())
                    .teamId(player.getTeamId())
                    .nextPlayerId(sequence.get((i + 1) % n).getId())
                    .prevPlayerId(sequence.get((i - 1 + n) % n).getId())
                    .position(i)
                    .build());
        }
        return nodes;
    }
}

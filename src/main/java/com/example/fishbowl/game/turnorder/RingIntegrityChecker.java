package com.example.fishbowl.game.turnorder;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.example.fishbowl.game.domain.entity.Player;
import com.example.fishbowl.game.domain.entity.TurnOrderNode;
import com.example.fishbowl.game.repository.PlayerRepository;
import com.example.fishbowl.game.repository.TurnOrderNodeRepository;
import com.example.fishbowl.global.error.TurnOrderIntegrityException;

/**
 * 저장된 턴 순서 링 진단.
 * 정상 흐름에서는 호출되지 않으며 테스트와 운영 점검용이다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RingIntegrityChecker {

    private final TurnOrderNodeRepository turnOrderNodeRepository;
    private final PlayerRepository playerRepository;

    /**
     * 링 구조 + 팀에 배정된 플레이어가 모두 링에 있는지 검사
     */
    @Transactional(readOnly = true)
    public RingIntegrityReport check(String gameId) {
        List<TurnOrderNode> nodes = turnOrderNodeRepository.findAllByGameIdOrderByPositionAsc(gameId);
        RingIntegrityReport structural = verify(nodes);
        if (nodes.isEmpty()) {
            return structural;
        }

        Set<String> ringPlayers = new HashSet<>();
        nodes.forEach(node -> ringPlayers.add(node.getPlayerId()));

        List<String> violations = new ArrayList<>(structural.violations());
        for (Player player : playerRepository.findAllByGameIdOrderByCreatedAtAsc(gameId)) {
            if (player.hasTeam() && !ringPlayers.contains(player.getId())) {
                violations.add("enrolled player missing from ring: " + player.getId());
            }
        }

        if (violations.isEmpty()) {
            return structural;
        }
        log.warn("턴 순서 무결성 검사 실패: gameId={}, violations={}", gameId, violations);
        return RingIntegrityReport.broken(nodes.size(), violations);
    }

    @Transactional(readOnly = true)
    public void requireValid(String gameId) {
        RingIntegrityReport report = check(gameId);
        if (!report.valid()) {
            throw new TurnOrderIntegrityException(gameId, String.join("; ", report.violations()));
        }
    }

    /**
     * 링 구조만 검사 (O(n))
     * (a) next/prev가 모두 같은 링의 노드를 가리키고, A.next = B 이면 B.prev = A 인지
     * (b) 아무 노드에서 next를 따라가면 모든 노드를 한 번씩 거쳐 출발점으로 돌아오는지
     */
    public RingIntegrityReport verify(List<TurnOrderNode> nodes) {
        if (nodes.isEmpty()) {
            return RingIntegrityReport.ok(0);
        }

        List<String> violations = new ArrayList<>();
        Map<String, TurnOrderNode> byPlayer = new HashMap<>(nodes.size() * 2);
        for (TurnOrderNode node : nodes) {
            if (byPlayer.put(node.getPlayerId(), node) != null) {
                violations.add("duplicate node for player " + node.getPlayerId());
            }
        }

        for (TurnOrderNode node : nodes) {
            if (!byPlayer.containsKey(node.getNextPlayerId())) {
                violations.add("dangling next reference: " + node.getPlayerId() + " -> " + node.getNextPlayerId());
            }
            if (!byPlayer.containsKey(node.getPrevPlayerId())) {
                violations.add("dangling prev reference: " + node.getPlayerId() + " -> " + node.getPrevPlayerId());
            }
        }
        if (!violations.isEmpty()) {
            return RingIntegrityReport.broken(nodes.size(), violations);
        }

        for (TurnOrderNode node : nodes) {
            TurnOrderNode next = byPlayer.get(node.getNextPlayerId());
            if (!node.getPlayerId().equals(next.getPrevPlayerId())) {
                violations.add("inconsistent prev reference: " + node.getPlayerId() + " -> " + next.getPlayerId()
                        + " but " + next.getPlayerId() + " <- " + next.getPrevPlayerId());
            }
        }
        if (!violations.isEmpty()) {
            return RingIntegrityReport.broken(nodes.size(), violations);
        }

        TurnOrderNode start = nodes.get(0);
        Set<String> visited = new HashSet<>();
        visited.add(start.getPlayerId());
        String cursor = start.getNextPlayerId();
        while (!cursor.equals(start.getPlayerId())) {
            if (!visited.add(cursor)) {
                violations.add("cycle does not return to " + start.getPlayerId() + ", revisits " + cursor);
                return RingIntegrityReport.broken(nodes.size(), violations);
            }
            cursor = byPlayer.get(cursor).getNextPlayerId();
        }

        if (visited.size() != byPlayer.size()) {
            violations.add("ring covers " + visited.size() + " of " + byPlayer.size() + " nodes");
            return RingIntegrityReport.broken(nodes.size(), violations);
        }
        return RingIntegrityReport.ok(nodes.size());
    }
}

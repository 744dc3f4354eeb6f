package com.example.fishbowl.game.turnorder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import com.example.fishbowl.game.domain.entity.Game;
import com.example.fishbowl.game.domain.entity.Player;
import com.example.fishbowl.game.domain.entity.Turn;
import com.example.fishbowl.game.domain.entity.TurnOrderNode;
import com.example.fishbowl.game.repository.GameRepository;
import com.example.fishbowl.game.repository.PlayerRepository;
import com.example.fishbowl.game.repository.TurnOrderNodeRepository;
import com.example.fishbowl.game.repository.TurnRepository;
import com.example.fishbowl.global.error.CommonException;
import com.example.fishbowl.global.error.ErrorCode;
import com.example.fishbowl.global.error.TurnOrderIntegrityException;

/**
 * 링 A1 -> B1 -> A2 -> B2 -> (A1) 기준 탐색 테스트
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TurnNavigatorTest {

    private static final String GAME_ID = "ABC123";

    @Mock
    private TurnOrderNodeRepository turnOrderNodeRepository;
    @Mock
    private PlayerRepository playerRepository;
    @Mock
    private GameRepository gameRepository;
    @Mock
    private TurnRepository turnRepository;
    @Mock
    private Random gameRandom;

    @InjectMocks
    private TurnNavigator turnNavigator;

    private final Map<String, Player> players = new HashMap<>();

    @BeforeEach
    void setUp() {
        givenRing("A1", "B1", "A2", "B2");
    }

    @Nested
    @DisplayName("nextPlayer")
    class NextPlayer {

        @Test
        @DisplayName("모두 접속 중이면 바로 다음 노드를 반환한다")
        void allConnected() {
            assertThat(turnNavigator.nextPlayer(GAME_ID, "A1")).contains("B1");
            assertThat(turnNavigator.nextPlayer(GAME_ID, "B2")).contains("A1");
        }

        @Test
        @DisplayName("마지막 플레이어의 다음 사람이 끊겨 있으면 건너뛰고 그 다음 사람을 반환한다")
        void skipsDisconnectedAcrossRingBoundary() {
            disconnect("A1");

            assertThat(turnNavigator.nextPlayer(GAME_ID, "B2")).contains("B1");
        }

        @Test
        @DisplayName("연속으로 끊긴 플레이어를 모두 건너뛴다")
        void skipsConsecutiveDisconnected() {
            disconnect("B1");
            disconnect("A2");

            assertThat(turnNavigator.nextPlayer(GAME_ID, "A1")).contains("B2");
        }

        @Test
        @DisplayName("나머지가 모두 끊겨 있으면 한 바퀴 돌아 접속 중인 자기 자신을 반환한다")
        void wrapsToSelfWhenOnlyCurrentConnected() {
            disconnect("A1");
            disconnect("A2");
            disconnect("B2");

            assertThat(turnNavigator.nextPlayer(GAME_ID, "B1")).contains("B1");
        }

        @Test
        @DisplayName("현재 플레이어까지 모두 끊겨 있으면 빈 값을 반환한다")
        void emptyWhenNobodyConnected() {
            players.keySet().forEach(TurnNavigatorTest.this::disconnect);

            assertThat(turnNavigator.nextPlayer(GAME_ID, "A1")).isEmpty();
        }

        @Test
        @DisplayName("현재 플레이어의 노드가 없으면 무결성 예외")
        void missingNode() {
            assertThatThrownBy(() -> turnNavigator.nextPlayer(GAME_ID, "ghost"))
                    .isInstanceOf(TurnOrderIntegrityException.class);
        }

        @Test
        @DisplayName("링이 존재하지 않는 플레이어를 가리키면 무결성 예외")
        void ringReferencesUnknownPlayer() {
            players.remove("B1");

            assertThatThrownBy(() -> turnNavigator.nextPlayer(GAME_ID, "A1"))
                    .isInstanceOf(TurnOrderIntegrityException.class)
                    .hasMessage(ErrorCode.TURN_ORDER_CORRUPTED.getMessage());
        }
    }

    @Nested
    @DisplayName("randomStartPlayer / currentPlayer")
    class StartAndCurrent {

        @Test
        @DisplayName("접속자가 없으면 시작 플레이어도 없다")
        void randomStart_empty() {
            when(turnOrderNodeRepository.findConnectedPlayerIds(GAME_ID)).thenReturn(List.of());

            assertThat(turnNavigator.randomStartPlayer(GAME_ID)).isEmpty();
        }

        @Test
        @DisplayName("접속자 중에서 무작위로 고른다")
        void randomStart_picksConnected() {
            when(turnOrderNodeRepository.findConnectedPlayerIds(GAME_ID)).thenReturn(List.of("A1", "A2", "B2"));
            when(gameRandom.nextInt(anyInt())).thenReturn(2);

            assertThat(turnNavigator.randomStartPlayer(GAME_ID)).contains("B2");
        }

        @Test
        @DisplayName("현재 턴의 플레이어를 반환하고, 현재 턴이 없으면 빈 값")
        void currentPlayer() {
            Game game = Game.builder().id(GAME_ID).currentTurnId("turn-1").build();
            when(gameRepository.findById(GAME_ID)).thenReturn(Optional.of(game));
            when(turnRepository.findById("turn-1"))
                    .thenReturn(Optional.of(Turn.builder().id("turn-1").playerId("A2").build()));

            assertThat(turnNavigator.currentPlayer(GAME_ID)).contains("A2");

            game.setCurrentTurnId(null);
            assertThat(turnNavigator.currentPlayer(GAME_ID)).isEmpty();
        }

        @Test
        @DisplayName("없는 게임이면 GAME_NOT_FOUND")
        void currentPlayer_unknownGame() {
            when(gameRepository.findById(anyString())).thenReturn(Optional.empty());

            assertThatThrownBy(() -> turnNavigator.currentPlayer("NOPE00"))
                    .isInstanceOf(CommonException.class)
                    .extracting("errorCode").isEqualTo(ErrorCode.GAME_NOT_FOUND);
        }
    }

    private void givenRing(String... order) {
        List<Player> sequence = new ArrayList<>();
        for (String id : order) {
            Player player = Player.builder().id(id).gameId(GAME_ID).teamId(id.substring(0, 1)).name(id).build();
            players.put(id, player);
            sequence.add(player);
        }
        List<TurnOrderNode> nodes = TurnOrderBuilder.link(GAME_ID, sequence);

        when(turnOrderNodeRepository.countByGameId(GAME_ID)).thenReturn((long) nodes.size());
        when(turnOrderNodeRepository.findByGameIdAndPlayerId(eq(GAME_ID), anyString())).thenAnswer(invocation ->
                nodes.stream().filter(node -> node.getPlayerId().equals(invocation.getArgument(1))).findFirst());
        when(playerRepository.findByIdAndGameId(anyString(), eq(GAME_ID))).thenAnswer(invocation ->
                Optional.ofNullable(players.get(invocation.<String>getArgument(0))));
    }

    private void disconnect(String playerId) {
        players.get(playerId).setConnected(false);
    }
}

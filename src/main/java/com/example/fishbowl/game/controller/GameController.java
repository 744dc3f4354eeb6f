package com.example.fishbowl.game.controller;

import java.util.List;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.fishbowl.game.dto.request.AssignTeamRequest;
import com.example.fishbowl.game.dto.request.CreateGameRequest;
import com.example.fishbowl.game.dto.request.JoinGameRequest;
import com.example.fishbowl.game.dto.request.PlayerActionRequest;
import com.example.fishbowl.game.dto.request.SubmitPhrasesRequest;
import com.example.fishbowl.game.dto.request.UpdateGameConfigRequest;
import com.example.fishbowl.game.dto.request.UpdatePhraseRequest;
import com.example.fishbowl.game.dto.response.CreateGameResponse;
import com.example.fishbowl.game.dto.response.EndTurnResponse;
import com.example.fishbowl.game.dto.response.GameSnapshot;
import com.example.fishbowl.game.dto.response.JoinGameResponse;
import com.example.fishbowl.game.dto.response.PhraseActionResponse;
import com.example.fishbowl.game.dto.response.PhraseResponse;
import com.example.fishbowl.game.dto.response.PhraseSubmissionStatus;
import com.example.fishbowl.game.dto.response.PlayerSummary;
import com.example.fishbowl.game.dto.response.StartGameResponse;
import com.example.fishbowl.game.dto.response.StartRoundResponse;
import com.example.fishbowl.game.dto.response.TurnActionResponse;
import com.example.fishbowl.game.dto.response.TurnOrderResponse;
import com.example.fishbowl.game.dto.response.TurnSummary;
import com.example.fishbowl.game.service.GameFlowFacade;
import com.example.fishbowl.game.service.GameQueryService;
import com.example.fishbowl.game.service.GameSetupService;
import com.example.fishbowl.game.service.PhraseService;
import com.example.fishbowl.global.dto.CommonResponse;
import com.example.fishbowl.presence.PresenceService;

@Tag(name = "GameController", description = "게임 생성/참가/진행 API")
@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
@Slf4j
public class GameController {

    private final GameSetupService gameSetupService;
    private final GameQueryService gameQueryService;
    private final GameFlowFacade gameFlowFacade;
    private final PhraseService phraseService;
    private final PresenceService presenceService;

    // ================== 준비 단계 ================== //

    @PostMapping
    @Operation(summary = "게임 생성", description = "기본 팀을 만들고 호스트를 첫 번째 팀에 배정합니다.")
    public ResponseEntity<CommonResponse<CreateGameResponse>> createGame(@Valid @RequestBody CreateGameRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CommonResponse.success(gameSetupService.createGame(request), "게임 생성 성공"));
    }

    @PostMapping("/{gameId}/join")
    @Operation(summary = "게임 참가", description = "인원이 가장 적은 팀에 배정됩니다.")
    public ResponseEntity<CommonResponse<JoinGameResponse>> joinGame(@PathVariable String gameId,
                                                                     @Valid @RequestBody JoinGameRequest request) {
        return ResponseEntity.ok(CommonResponse.success(
                gameSetupService.joinGame(gameId.toUpperCase(), request.playerName()), "게임 참가 성공"));
    }

    @GetMapping("/{gameId}")
    @Operation(summary = "게임 상태 조회")
    public ResponseEntity<CommonResponse<GameSnapshot>> getGame(@PathVariable String gameId) {
        return ResponseEntity.ok(CommonResponse.success(gameQueryService.getSnapshot(gameId), "게임 조회 성공"));
    }

    @GetMapping("/{gameId}/players")
    @Operation(summary = "플레이어 목록 조회")
    public ResponseEntity<CommonResponse<List<PlayerSummary>>> getPlayers(@PathVariable String gameId) {
        return ResponseEntity.ok(CommonResponse.success(gameQueryService.getPlayers(gameId), "플레이어 조회 성공"));
    }

    @PostMapping("/{gameId}/players/{playerId}/leave")
    @Operation(summary = "게임 나가기", description = "모든 기기의 접속을 끊고 턴 순서에서 건너뛰게 합니다.")
    public ResponseEntity<CommonResponse<Void>> leaveGame(@PathVariable String gameId, @PathVariable String playerId) {
        presenceService.leave(gameId, playerId);
        return ResponseEntity.ok(CommonResponse.success(null, "게임 나가기 성공"));
    }

    @PatchMapping("/{gameId}/players/{playerId}/team")
    @Operation(summary = "팀 변경", description = "[본인 또는 호스트] 준비 단계에서만 가능합니다.")
    public ResponseEntity<CommonResponse<PlayerSummary>> assignTeam(@PathVariable String gameId,
                                                                   @PathVariable String playerId,
                                                                   @Valid @RequestBody AssignTeamRequest request) {
        return ResponseEntity.ok(CommonResponse.success(
                gameSetupService.assignTeam(gameId, playerId, request.requesterId(), request.teamId()), "팀 변경 성공"));
    }

    @PatchMapping("/{gameId}/config")
    @Operation(summary = "게임 설정 변경", description = "[호스트] 준비 단계에서만 가능합니다.")
    public ResponseEntity<CommonResponse<GameSnapshot>> updateConfig(@PathVariable String gameId,
                                                                     @Valid @RequestBody UpdateGameConfigRequest request) {
        return ResponseEntity.ok(CommonResponse.success(gameSetupService.updateConfig(gameId, request), "설정 변경 성공"));
    }

    @DeleteMapping("/{gameId}")
    @Operation(summary = "게임 삭제", description = "[호스트] 게임과 관련된 모든 데이터를 삭제합니다.")
    public ResponseEntity<CommonResponse<Void>> deleteGame(@PathVariable String gameId, @RequestParam String playerId) {
        gameSetupService.deleteGame(gameId, playerId);
        return ResponseEntity.ok(CommonResponse.success(null, "게임 삭제 성공"));
    }

    // ================== 문구 ================== //

    @PostMapping("/{gameId}/phrases")
    @Operation(summary = "문구 제출", description = "1인당 문구 수를 넘을 수 없습니다.")
    public ResponseEntity<CommonResponse<List<PhraseResponse>>> submitPhrases(@PathVariable String gameId,
                                                                             @Valid @RequestBody SubmitPhrasesRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(CommonResponse.success(
                phraseService.submitPhrases(gameId, request.playerId(), request.phrases()), "문구 제출 성공"));
    }

    @GetMapping("/{gameId}/phrases")
    @Operation(summary = "내 문구 조회")
    public ResponseEntity<CommonResponse<List<PhraseResponse>>> getPhrases(@PathVariable String gameId,
                                                                          @RequestParam String playerId) {
        return ResponseEntity.ok(CommonResponse.success(phraseService.getPlayerPhrases(gameId, playerId), "문구 조회 성공"));
    }

    @PutMapping("/{gameId}/phrases/{phraseId}")
    @Operation(summary = "문구 수정", description = "[작성자] 준비 단계에서만 가능하며 게임 안에서 중복될 수 없습니다.")
    public ResponseEntity<CommonResponse<PhraseResponse>> updatePhrase(@PathVariable String gameId,
                                                                      @PathVariable String phraseId,
                                                                      @Valid @RequestBody UpdatePhraseRequest request) {
        return ResponseEntity.ok(CommonResponse.success(
                phraseService.updatePhrase(gameId, phraseId, request.playerId(), request.text()), "문구 수정 성공"));
    }

    @DeleteMapping("/{gameId}/phrases/{phraseId}")
    @Operation(summary = "문구 삭제", description = "[작성자 또는 호스트] 준비 단계에서만 가능합니다.")
    public ResponseEntity<CommonResponse<Void>> deletePhrase(@PathVariable String gameId,
                                                             @PathVariable String phraseId,
                                                             @RequestParam String playerId) {
        phraseService.deletePhrase(gameId, phraseId, playerId);
        return ResponseEntity.ok(CommonResponse.success(null, "문구 삭제 성공"));
    }

    @GetMapping("/{gameId}/phrases/status")
    @Operation(summary = "문구 제출 현황")
    public ResponseEntity<CommonResponse<PhraseSubmissionStatus>> getSubmissionStatus(@PathVariable String gameId) {
        return ResponseEntity.ok(CommonResponse.success(phraseService.getSubmissionStatus(gameId), "제출 현황 조회 성공"));
    }

    // ================== 진행 ================== //

    @PostMapping("/{gameId}/start")
    @Operation(summary = "게임 시작", description = "턴 순서를 만들고 첫 라운드 대기 상태로 전환합니다.")
    public ResponseEntity<CommonResponse<StartGameResponse>> startGame(@PathVariable String gameId) {
        return ResponseEntity.ok(CommonResponse.success(gameFlowFacade.startGame(gameId), "게임 시작 성공"));
    }

    @PostMapping("/{gameId}/rounds/start")
    @Operation(summary = "라운드 시작", description = "넘긴 문구를 통에 되돌리고 첫 턴 플레이어를 정합니다.")
    public ResponseEntity<CommonResponse<StartRoundResponse>> startRound(@PathVariable String gameId) {
        return ResponseEntity.ok(CommonResponse.success(gameFlowFacade.startRound(gameId), "라운드 시작 성공"));
    }

    @PostMapping("/{gameId}/turns/start")
    @Operation(summary = "턴 시작", description = "[현재 턴 플레이어] 타이머가 시작됩니다.")
    public ResponseEntity<CommonResponse<TurnActionResponse>> startTurn(@PathVariable String gameId,
                                                                        @Valid @RequestBody PlayerActionRequest request) {
        return ResponseEntity.ok(CommonResponse.success(gameFlowFacade.startTurn(gameId, request.playerId()), "턴 시작 성공"));
    }

    @PostMapping("/{gameId}/turns/pause")
    @Operation(summary = "턴 일시정지", description = "[호스트 또는 현재 턴 플레이어]")
    public ResponseEntity<CommonResponse<TurnActionResponse>> pauseTurn(@PathVariable String gameId,
                                                                        @Valid @RequestBody PlayerActionRequest request) {
        return ResponseEntity.ok(CommonResponse.success(gameFlowFacade.pauseTurn(gameId, request.playerId()), "턴 일시정지 성공"));
    }

    @PostMapping("/{gameId}/turns/resume")
    @Operation(summary = "턴 재개", description = "[호스트 또는 현재 턴 플레이어]")
    public ResponseEntity<CommonResponse<TurnActionResponse>> resumeTurn(@PathVariable String gameId,
                                                                         @Valid @RequestBody PlayerActionRequest request) {
        return ResponseEntity.ok(CommonResponse.success(gameFlowFacade.resumeTurn(gameId, request.playerId()), "턴 재개 성공"));
    }

    @PostMapping("/{gameId}/turns/end")
    @Operation(summary = "턴 종료", description = "[현재 턴 플레이어] 점수를 반영하고 다음 플레이어에게 턴을 넘깁니다.")
    public ResponseEntity<CommonResponse<EndTurnResponse>> endTurn(@PathVariable String gameId,
                                                                   @Valid @RequestBody PlayerActionRequest request) {
        EndTurnResponse response = gameFlowFacade.endTurn(gameId, request.playerId());
        String message = response.advanced() ? "턴 종료 성공" : "다음 플레이어가 없어 턴이 일시정지되었습니다";
        return ResponseEntity.ok(CommonResponse.success(response, message));
    }

    @GetMapping("/{gameId}/turns")
    @Operation(summary = "턴 기록 조회")
    public ResponseEntity<CommonResponse<List<TurnSummary>>> getTurns(@PathVariable String gameId) {
        return ResponseEntity.ok(CommonResponse.success(gameQueryService.getTurns(gameId), "턴 기록 조회 성공"));
    }

    @GetMapping("/{gameId}/turns/current/phrase")
    @Operation(summary = "문구 뽑기", description = "[현재 턴 플레이어] 통에서 무작위 문구 하나를 봅니다.")
    public ResponseEntity<CommonResponse<PhraseResponse>> drawPhrase(@PathVariable String gameId,
                                                                     @RequestParam String playerId) {
        return ResponseEntity.ok(CommonResponse.success(phraseService.drawPhrase(gameId, playerId), "문구 뽑기 성공"));
    }

    @PostMapping("/{gameId}/phrases/{phraseId}/guess")
    @Operation(summary = "문구 맞춤", description = "[현재 턴 플레이어] 1점 획득, 통이 비면 라운드가 끝납니다.")
    public ResponseEntity<CommonResponse<PhraseActionResponse>> guessPhrase(@PathVariable String gameId,
                                                                            @PathVariable String phraseId,
                                                                            @Valid @RequestBody PlayerActionRequest request) {
        return ResponseEntity.ok(CommonResponse.success(
                gameFlowFacade.guessPhrase(gameId, phraseId, request.playerId()), "문구 맞춤 처리 성공"));
    }

    @PostMapping("/{gameId}/phrases/{phraseId}/skip")
    @Operation(summary = "문구 넘기기", description = "[현재 턴 플레이어] 넘긴 문구는 다음 라운드에 다시 나옵니다.")
    public ResponseEntity<CommonResponse<PhraseActionResponse>> skipPhrase(@PathVariable String gameId,
                                                                           @PathVariable String phraseId,
                                                                           @Valid @RequestBody PlayerActionRequest request) {
        return ResponseEntity.ok(CommonResponse.success(
                gameFlowFacade.skipPhrase(gameId, phraseId, request.playerId()), "문구 넘기기 성공"));
    }

    // ================== 턴 순서 ================== //

    @GetMapping("/{gameId}/turn-order")
    @Operation(summary = "턴 순서 조회", description = "링 구조, 접속 중인 플레이어 순서, 무결성 검사 결과를 반환합니다.")
    public ResponseEntity<CommonResponse<TurnOrderResponse>> getTurnOrder(@PathVariable String gameId) {
        return ResponseEntity.ok(CommonResponse.success(gameQueryService.getTurnOrder(gameId), "턴 순서 조회 성공"));
    }
}

package com.poolmate.backend.modules.draw.presentation;

import java.util.UUID;

import com.poolmate.backend.modules.draw.application.DrawOrchestrator;
import com.poolmate.backend.modules.draw.application.DrawQueryService;
import com.poolmate.backend.modules.draw.application.RoundHandle;
import com.poolmate.backend.modules.draw.presentation.dto.AbortRoundRequest;
import com.poolmate.backend.modules.draw.presentation.dto.RoundAckResponse;
import com.poolmate.backend.modules.draw.presentation.dto.RoundAnswerRequest;
import com.poolmate.backend.modules.draw.presentation.dto.RoundResultResponse;
import com.poolmate.backend.modules.draw.presentation.dto.RoundStatusResponse;
import com.poolmate.backend.modules.draw.presentation.dto.StartRoundRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DrawRoundController {

    private final DrawOrchestrator drawOrchestrator;
    private final DrawQueryService drawQueryService;

    public DrawRoundController(DrawOrchestrator drawOrchestrator, DrawQueryService drawQueryService) {
        this.drawOrchestrator = drawOrchestrator;
        this.drawQueryService = drawQueryService;
    }

    @Operation(summary = "추첨 라운드 시작", description = "참여 자격을 확인하고 참여 확인 창을 연다. 추첨은 창이 닫힌 뒤 진행된다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "라운드 시작"),
            @ApiResponse(responseCode = "409", description = "`POOL_NOT_ACTIVE` 또는 `ROUND_ALREADY_IN_PROGRESS`"),
            @ApiResponse(responseCode = "422", description = "`INSUFFICIENT_PAYMENTS` 또는 `NO_ELIGIBLE_MEMBERS`")
    })
    @PostMapping("/pools/{poolId}/rounds")
    public ResponseEntity<RoundStatusResponse> startRound(
            @PathVariable("poolId") UUID poolId,
            @Valid @RequestBody StartRoundRequest request
    ) {
        RoundHandle handle = drawOrchestrator.startRound(poolId, request.actorId());
        return ResponseEntity.status(HttpStatus.CREATED).body(drawQueryService.getRound(handle.getRoundId()));
    }

    @Operation(summary = "참여 여부 응답", description = "창이 열려 있는 동안만 받는다. 마지막 응답이면 창이 바로 닫힌다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "응답 반영"),
            @ApiResponse(responseCode = "409", description = "`WINDOW_CLOSED`")
    })
    @PostMapping("/pools/{poolId}/rounds/current/responses")
    public ResponseEntity<RoundAckResponse> respond(
            @PathVariable("poolId") UUID poolId,
            @Valid @RequestBody RoundAnswerRequest request
    ) {
        return ResponseEntity.ok(RoundAckResponse.from(
                drawOrchestrator.respond(poolId, request.userId(), request.participate())));
    }

    @GetMapping("/pools/{poolId}/rounds/current")
    public ResponseEntity<RoundStatusResponse> currentRound(@PathVariable("poolId") UUID poolId) {
        return drawQueryService.findCurrentRound(poolId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/rounds/{roundId}")
    public ResponseEntity<RoundStatusResponse> getRound(@PathVariable("roundId") UUID roundId) {
        return ResponseEntity.ok(drawQueryService.getRound(roundId));
    }

    @Operation(summary = "진행 중인 라운드 중단", description = "확정 전의 라운드만 중단할 수 있다.")
    @PostMapping("/pools/{poolId}/rounds/current/abort")
    public ResponseEntity<RoundResultResponse> abortRound(
            @PathVariable("poolId") UUID poolId,
            @Valid @RequestBody AbortRoundRequest request
    ) {
        return ResponseEntity.ok(RoundResultResponse.from(
                drawOrchestrator.abortRound(poolId, request.actorId(), request.reason())));
    }
}

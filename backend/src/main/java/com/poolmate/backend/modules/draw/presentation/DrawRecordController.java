package com.poolmate.backend.modules.draw.presentation;

import java.util.List;
import java.util.UUID;

import com.poolmate.backend.modules.draw.application.DrawCancellationService;
import com.poolmate.backend.modules.draw.application.DrawOrchestrator;
import com.poolmate.backend.modules.draw.application.DrawQueryService;
import com.poolmate.backend.modules.draw.domain.DrawRecord;
import com.poolmate.backend.modules.draw.presentation.dto.CancelDrawRequest;
import com.poolmate.backend.modules.draw.presentation.dto.DrawRecordResponse;
import com.poolmate.backend.modules.draw.presentation.dto.ManualDrawRequest;
import com.poolmate.backend.modules.draw.presentation.dto.WinningsResponse;

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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DrawRecordController {

    private final DrawOrchestrator drawOrchestrator;
    private final DrawQueryService drawQueryService;
    private final DrawCancellationService drawCancellationService;

    public DrawRecordController(
            DrawOrchestrator drawOrchestrator,
            DrawQueryService drawQueryService,
            DrawCancellationService drawCancellationService
    ) {
        this.drawOrchestrator = drawOrchestrator;
        this.drawQueryService = drawQueryService;
        this.drawCancellationService = drawCancellationService;
    }

    @Operation(summary = "수동 추첨", description = "관리자가 수령자를 지정한다. 이미 당첨된 회원은 지정할 수 없다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "추첨 기록 생성"),
            @ApiResponse(responseCode = "409", description = "`MEMBER_ALREADY_WON`, `ROUND_ALREADY_IN_PROGRESS` 또는 `ROUND_ABORTED_RETRY_LATER`")
    })
    @PostMapping("/pools/{poolId}/draws/manual")
    public ResponseEntity<DrawRecordResponse> manualDraw(
            @PathVariable("poolId") UUID poolId,
            @Valid @RequestBody ManualDrawRequest request
    ) {
        DrawRecord record = drawOrchestrator.manualDraw(poolId, request.actorId(), request.memberId(), request.reason());
        return ResponseEntity.status(HttpStatus.CREATED).body(DrawRecordResponse.from(record));
    }

    @GetMapping("/pools/{poolId}/draws")
    public ResponseEntity<List<DrawRecordResponse>> listDraws(
            @PathVariable("poolId") UUID poolId,
            @RequestParam(name = "status", required = false) String status
    ) {
        return ResponseEntity.ok(drawQueryService.listDraws(poolId, status));
    }

    @Operation(summary = "회차별 추첨 결과 조회")
    @GetMapping("/pools/{poolId}/draws/{roundNumber}")
    public ResponseEntity<DrawRecordResponse> getResult(
            @PathVariable("poolId") UUID poolId,
            @PathVariable("roundNumber") int roundNumber
    ) {
        return ResponseEntity.ok(drawQueryService.getResult(poolId, roundNumber));
    }

    @GetMapping("/draws/winnings")
    public ResponseEntity<WinningsResponse> getWinnings(@RequestParam("userId") UUID userId) {
        return ResponseEntity.ok(drawQueryService.getWinnings(userId));
    }

    @GetMapping("/draws/{drawId}")
    public ResponseEntity<DrawRecordResponse> getDraw(@PathVariable("drawId") UUID drawId) {
        return ResponseEntity.ok(drawQueryService.getDraw(drawId));
    }

    @Operation(summary = "추첨 취소", description = "확정된 추첨을 취소 처리한다. 회차 번호는 다시 쓰지 않는다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "취소 완료"),
            @ApiResponse(responseCode = "409", description = "`DRAW_ALREADY_CANCELLED`"),
            @ApiResponse(responseCode = "422", description = "`CANCEL_REASON_TOO_SHORT`")
    })
    @PostMapping("/draws/{drawId}/cancel")
    public ResponseEntity<DrawRecordResponse> cancelDraw(
            @PathVariable("drawId") UUID drawId,
            @Valid @RequestBody CancelDrawRequest request
    ) {
        return ResponseEntity.ok(drawCancellationService.cancel(drawId, request.actorId(), request.reason()));
    }
}

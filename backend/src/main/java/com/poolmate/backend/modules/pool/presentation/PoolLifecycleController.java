package com.poolmate.backend.modules.pool.presentation;

import java.util.UUID;

import com.poolmate.backend.modules.pool.application.PoolLifecycleService;
import com.poolmate.backend.modules.pool.presentation.dto.PoolResponse;
import com.poolmate.backend.modules.pool.presentation.dto.PoolTransitionRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/pools/{poolId}")
public class PoolLifecycleController {

    private final PoolLifecycleService poolLifecycleService;

    public PoolLifecycleController(PoolLifecycleService poolLifecycleService) {
        this.poolLifecycleService = poolLifecycleService;
    }

    @GetMapping
    public ResponseEntity<PoolResponse> getPool(@PathVariable("poolId") UUID poolId) {
        return ResponseEntity.ok(poolLifecycleService.getPool(poolId));
    }

    @Operation(summary = "풀 활성화", description = "회계 담당자와 최소 인원이 갖춰진 대기 중인 풀을 활성화한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "활성화 성공"),
            @ApiResponse(responseCode = "422", description = "`TREASURER_REQUIRED` 또는 `ROSTER_TOO_SMALL`")
    })
    @PostMapping("/activate")
    public ResponseEntity<PoolResponse> activate(
            @PathVariable("poolId") UUID poolId,
            @Valid @RequestBody PoolTransitionRequest request
    ) {
        return ResponseEntity.ok(poolLifecycleService.activate(poolId, request.actorId()));
    }

    @PostMapping("/suspend")
    public ResponseEntity<PoolResponse> suspend(
            @PathVariable("poolId") UUID poolId,
            @Valid @RequestBody PoolTransitionRequest request
    ) {
        return ResponseEntity.ok(poolLifecycleService.suspend(poolId, request.actorId()));
    }

    @PostMapping("/resume")
    public ResponseEntity<PoolResponse> resume(
            @PathVariable("poolId") UUID poolId,
            @Valid @RequestBody PoolTransitionRequest request
    ) {
        return ResponseEntity.ok(poolLifecycleService.resume(poolId, request.actorId()));
    }

    @Operation(summary = "풀 종료", description = "모든 회원이 한 번씩 수령한 풀을 종료한다.")
    @PostMapping("/close")
    public ResponseEntity<PoolResponse> close(
            @PathVariable("poolId") UUID poolId,
            @Valid @RequestBody PoolTransitionRequest request
    ) {
        return ResponseEntity.ok(poolLifecycleService.close(poolId, request.actorId()));
    }
}

package com.poolmate.backend.modules.draw.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.poolmate.backend.modules.audit.application.AuditLogService;
import com.poolmate.backend.modules.draw.domain.DrawRecord;
import com.poolmate.backend.modules.draw.presentation.dto.DrawRecordResponse;
import com.poolmate.backend.modules.notification.application.NotificationDispatcher;
import com.poolmate.backend.modules.notification.application.NotificationService;
import com.poolmate.backend.modules.notification.domain.NotificationKind;
import com.poolmate.backend.modules.pool.application.PoolStandingService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Post-commit cancellation: flags the record and gives the former winner their eligibility back
 * in one transaction, then tells them about it. Round numbers are never reused.
 */
@Service
public class DrawCancellationService {

    private static final Logger log = LoggerFactory.getLogger(DrawCancellationService.class);

    private final RoundLedger roundLedger;
    private final PoolStandingService poolStandingService;
    private final NotificationDispatcher notificationDispatcher;
    private final AuditLogService auditLogService;

    public DrawCancellationService(
            RoundLedger roundLedger,
            PoolStandingService poolStandingService,
            NotificationDispatcher notificationDispatcher,
            AuditLogService auditLogService
    ) {
        this.roundLedger = roundLedger;
        this.poolStandingService = poolStandingService;
        this.notificationDispatcher = notificationDispatcher;
        this.auditLogService = auditLogService;
    }

    public DrawRecordResponse cancel(UUID drawId, UUID actorId, String reason) {
        DrawRecord record = roundLedger.cancel(drawId, reason, actorId,
                target -> poolStandingService.clearWinner(target.getPool().getId(), target.getWinner().getId()));
        UUID poolId = record.getPool().getId();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(NotificationService.PAYLOAD_CORRELATION_ID, record.getId());
        payload.put("poolId", poolId);
        payload.put("roundNumber", record.getRoundNumber());
        payload.put("reason", record.getCancelReason());
        try {
            notificationDispatcher.notify(record.getWinner().getUserId(), NotificationKind.DRAW_CANCELLED, payload);
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Draw][{}] notification dispatch failed user={} detail={}",
                    NotificationKind.DRAW_CANCELLED, record.getWinner().getUserId(), ex.getMessage());
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("poolId", poolId.toString());
        detail.put("roundNumber", record.getRoundNumber());
        detail.put("winnerMemberId", record.getWinner().getId().toString());
        detail.put("reason", record.getCancelReason());
        try {
            auditLogService.record(new AuditLogService.AuditLogCommand(
                    "DRAW_CANCEL", "DRAW_RECORD", drawId.toString(), actorId, drawId, detail));
        } catch (RuntimeException ex) {
            log.warn("Audit entry DRAW_CANCEL for {} could not be written: {}", drawId, ex.getMessage());
        }
        return DrawRecordResponse.from(record);
    }
}

package com.poolmate.backend.modules.draw.application;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import com.poolmate.backend.global.error.ProblemException;
import com.poolmate.backend.modules.draw.domain.DrawRecord;
import com.poolmate.backend.modules.draw.domain.DrawRound;
import com.poolmate.backend.modules.draw.domain.DrawStatus;
import com.poolmate.backend.modules.draw.domain.RoundOutcome;
import com.poolmate.backend.modules.draw.infrastructure.persistence.DrawRecordRepository;
import com.poolmate.backend.modules.draw.infrastructure.persistence.DrawRoundRepository;
import com.poolmate.backend.modules.draw.infrastructure.persistence.RoundParticipationRepository;
import com.poolmate.backend.modules.draw.presentation.dto.DrawRecordResponse;
import com.poolmate.backend.modules.draw.presentation.dto.RoundStatusResponse;
import com.poolmate.backend.modules.draw.presentation.dto.WinningsResponse;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class DrawQueryService {

    private final DrawRoundRepository drawRoundRepository;
    private final RoundParticipationRepository roundParticipationRepository;
    private final DrawRecordRepository drawRecordRepository;

    public DrawQueryService(
            DrawRoundRepository drawRoundRepository,
            RoundParticipationRepository roundParticipationRepository,
            DrawRecordRepository drawRecordRepository
    ) {
        this.drawRoundRepository = drawRoundRepository;
        this.roundParticipationRepository = roundParticipationRepository;
        this.drawRecordRepository = drawRecordRepository;
    }

    public Optional<RoundStatusResponse> findCurrentRound(UUID poolId) {
        return drawRoundRepository.findFirstByPoolIdAndOutcome(poolId, RoundOutcome.IN_PROGRESS)
                .map(this::toStatus);
    }

    public RoundStatusResponse getRound(UUID roundId) {
        return drawRoundRepository.findById(roundId)
                .map(this::toStatus)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "ROUND_NOT_FOUND"));
    }

    public DrawRecordResponse getResult(UUID poolId, int roundNumber) {
        return drawRecordRepository.findDetailedByPoolIdAndRoundNumber(poolId, roundNumber)
                .map(DrawRecordResponse::from)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "DRAW_NOT_FOUND",
                        "no draw recorded for round " + roundNumber));
    }

    public DrawRecordResponse getDraw(UUID drawId) {
        return drawRecordRepository.findDetailedById(drawId)
                .map(DrawRecordResponse::from)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "DRAW_NOT_FOUND"));
    }

    public List<DrawRecordResponse> listDraws(UUID poolId, String status) {
        List<DrawRecord> records = status == null || status.isBlank()
                ? drawRecordRepository.findDetailedByPoolId(poolId)
                : drawRecordRepository.findDetailedByPoolIdAndStatus(poolId, parseStatus(status));
        return records.stream().map(DrawRecordResponse::from).toList();
    }

    public WinningsResponse getWinnings(UUID userId) {
        List<DrawRecordResponse> draws = drawRecordRepository.findWinningsByUserId(userId).stream()
                .map(DrawRecordResponse::from)
                .toList();
        long total = draws.stream().mapToLong(DrawRecordResponse::amount).sum();
        return new WinningsResponse(userId, draws.size(), total, draws);
    }

    private RoundStatusResponse toStatus(DrawRound round) {
        return RoundStatusResponse.from(round, roundParticipationRepository.findByRoundIdOrdered(round.getId()));
    }

    private DrawStatus parseStatus(String value) {
        try {
            return DrawStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_STATUS", "unknown draw status: " + value);
        }
    }
}

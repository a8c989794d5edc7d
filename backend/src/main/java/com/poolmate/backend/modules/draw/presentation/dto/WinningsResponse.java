package com.poolmate.backend.modules.draw.presentation.dto;

import java.util.List;
import java.util.UUID;

public record WinningsResponse(
        UUID userId,
        int count,
        long totalAmount,
        List<DrawRecordResponse> draws
) {
}

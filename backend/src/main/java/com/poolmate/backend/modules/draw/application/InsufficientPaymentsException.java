package com.poolmate.backend.modules.draw.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.poolmate.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Raised when the payment requirement of a round is not met. Carries the exact shortfall.
 */
public class InsufficientPaymentsException extends ProblemException {

    private final int validated;
    private final int required;
    private final List<UUID> missingMemberIds;

    public InsufficientPaymentsException(int installmentNumber, int validated, int required, List<UUID> missingMemberIds) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "INSUFFICIENT_PAYMENTS",
                detail(installmentNumber, validated, required),
                properties(installmentNumber, validated, required, missingMemberIds));
        this.validated = validated;
        this.required = required;
        this.missingMemberIds = List.copyOf(missingMemberIds);
    }

    public int getValidated() {
        return validated;
    }

    public int getRequired() {
        return required;
    }

    public int getMissing() {
        return missingMemberIds.size();
    }

    public List<UUID> getMissingMemberIds() {
        return missingMemberIds;
    }

    public boolean isNobodyPaid() {
        return validated == 0;
    }

    private static String detail(int installmentNumber, int validated, int required) {
        String base = "insufficient payments: " + validated + "/" + required;
        if (validated == 0) {
            return base + " (no validated payment for installment " + installmentNumber + ")";
        }
        return base;
    }

    private static Map<String, Object> properties(int installmentNumber, int validated, int required, List<UUID> missing) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("installmentNumber", installmentNumber);
        properties.put("validated", validated);
        properties.put("required", required);
        properties.put("missing", missing.size());
        properties.put("nobodyPaid", validated == 0);
        properties.put("missingMemberIds", missing.stream().map(UUID::toString).toList());
        return properties;
    }
}

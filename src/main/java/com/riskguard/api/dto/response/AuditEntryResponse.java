package com.riskguard.api.dto.response;

import com.riskguard.entity.AuditLogEntity;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class AuditEntryResponse {

    private final Instant timestamp;
    private final String action;
    private final String symbol;
    private final String reason;
    private final String result;
    private final String detail;

    public static AuditEntryResponse from(AuditLogEntity entity) {
        return AuditEntryResponse.builder()
                .timestamp(entity.getTimestamp())
                .action(entity.getAction())
                .symbol(entity.getSymbol())
                .reason(entity.getReason())
                .result(entity.getResult())
                .detail(entity.getDetail())
                .build();
    }
}

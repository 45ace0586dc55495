package com.riskguard.enforcement;

import com.riskguard.entity.AuditLogEntity;
import com.riskguard.repository.jpa.AuditLogJpaRepository;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Append-only audit trail of enforcement actions and lockout decisions.
 *
 * <p>Rows are written synchronously. A failed write is logged at error level and does not
 * abort the enforcement that produced it.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String RESULT_SUCCESS = "SUCCESS";
    public static final String RESULT_FAILED = "FAILED";
    public static final String RESULT_INSTALLED = "INSTALLED";
    public static final String RESULT_SKIPPED = "SKIPPED";

    private final AuditLogJpaRepository auditLogJpaRepository;
    private final Clock clock;

    public AuditService(AuditLogJpaRepository auditLogJpaRepository, Clock clock) {
        this.auditLogJpaRepository = auditLogJpaRepository;
        this.clock = clock;
    }

    public void record(String accountId, String action, String symbol, String reason, String result, String detail) {
        AuditLogEntity entry = AuditLogEntity.builder()
                .timestamp(clock.instant())
                .accountId(accountId)
                .action(action)
                .symbol(symbol)
                .reason(truncate(reason, 500))
                .result(result)
                .detail(truncate(detail, 1000))
                .build();
        try {
            auditLogJpaRepository.save(entry);
        } catch (DataAccessException e) {
            log.error("stage=audit.failed account={} action={} result={}: {}", accountId, action, result, e.getMessage(), e);
        }
    }

    public List<AuditLogEntity> recent(String accountId) {
        return auditLogJpaRepository.findTop100ByAccountIdOrderByTimestampDesc(accountId);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}

package com.riskguard.repository.jpa;

import com.riskguard.entity.AuditLogEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the append-only audit_log table.
 */
@Repository
public interface AuditLogJpaRepository extends JpaRepository<AuditLogEntity, Long> {

    List<AuditLogEntity> findTop100ByAccountIdOrderByTimestampDesc(String accountId);
}

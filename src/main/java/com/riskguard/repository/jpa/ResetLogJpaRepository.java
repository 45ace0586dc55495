package com.riskguard.repository.jpa;

import com.riskguard.domain.enums.ResetType;
import com.riskguard.entity.ResetLogEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ResetLogJpaRepository extends JpaRepository<ResetLogEntity, Long> {

    Optional<ResetLogEntity> findFirstByAccountIdAndResetTypeOrderByTriggeredAtDesc(String accountId, ResetType resetType);
}

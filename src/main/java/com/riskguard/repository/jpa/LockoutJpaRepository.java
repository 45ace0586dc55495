package com.riskguard.repository.jpa;

import com.riskguard.entity.LockoutEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the lockouts table. Unique on (account_id, symbol_key); the lockout
 * manager is the only writer.
 */
@Repository
public interface LockoutJpaRepository extends JpaRepository<LockoutEntity, Long> {

    List<LockoutEntity> findByAccountIdAndSymbolKey(String accountId, String symbolKey);
}

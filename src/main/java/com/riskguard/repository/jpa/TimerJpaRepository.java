package com.riskguard.repository.jpa;

import com.riskguard.entity.TimerEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TimerJpaRepository extends JpaRepository<TimerEntity, Long> {

    Optional<TimerEntity> findByAccountIdAndName(String accountId, String name);
}

package com.riskguard;

import static org.assertj.core.api.Assertions.assertThat;

import com.riskguard.core.engine.RiskEngine;
import com.riskguard.enforcement.EnforcementExecutor;
import com.riskguard.event.EventPublisherHelper;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Boots the full application context against an in-memory H2 database so bean wiring
 * problems (name clashes, missing qualifiers) fail the build.
 */
@SpringBootTest(
        properties = {
            "spring.datasource.url=jdbc:h2:mem:riskguard-ctx;DB_CLOSE_DELAY=-1",
            "spring.jpa.hibernate.ddl-auto=create-drop",
            "logging.file.name=",
            "riskguard.account-id=PRAC-CTX-1",
            "riskguard.broker.mode=dry-run"
        })
class RiskGuardApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {}

    @Test
    void enforcementServiceAndWorkerPoolAreDistinctBeans() {
        assertThat(context.getBean("enforcementExecutor")).isInstanceOf(EnforcementExecutor.class);
        assertThat(context.getBean("enforcementWorker")).isInstanceOf(ThreadPoolTaskExecutor.class);
        assertThat(context.getBean(RiskEngine.class)).isNotNull();
    }

    @Test
    void stopAdjustmentsReachTheMetricsListener() {
        context.getBean(EventPublisherHelper.class)
                .publishStopAdjustment(this, "PRAC-CTX-1", "MNQ", new BigDecimal("17998.00"), "initial stop");

        assertThat(context.getBean(MeterRegistry.class).counter("riskguard.stop.adjustments", "symbol", "MNQ").count())
                .isEqualTo(1.0);
    }
}

package com.riskguard.config;

import java.lang.reflect.Method;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Infrastructure beans shared by the engine: the wall clock and the worker pool that runs
 * broker enforcement calls off the event loop.
 *
 * <p>All components take a {@link Clock} so tests can drive time explicitly. The production
 * clock is UTC; timezone-aware logic converts at the edges.
 */
@Configuration
public class RiskGuardConfig implements AsyncConfigurer {

    private final EnforcementConfig enforcementConfig;

    public RiskGuardConfig(EnforcementConfig enforcementConfig) {
        this.enforcementConfig = enforcementConfig;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean("enforcementWorker")
    public ThreadPoolTaskExecutor enforcementWorker() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(enforcementConfig.getWorkerThreads());
        executor.setMaxPoolSize(enforcementConfig.getWorkerThreads());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("enforce-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return enforcementWorker();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}

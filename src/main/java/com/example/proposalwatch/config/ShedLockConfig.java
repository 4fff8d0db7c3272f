package com.example.proposalwatch.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.inmemory.InMemoryLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * ShedLock configuration.
 * <p>
 * Locks are process-local: the tick loop is guarded by @SchedulerLock and
 * every job dispatch takes a lock named after its job key, so one job never
 * runs twice at the same time.
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "10m")
public class ShedLockConfig {

    /**
     * In-memory lock provider. Locks live as long as the process.
     */
    @Bean
    public LockProvider lockProvider() {
        return new InMemoryLockProvider();
    }
}

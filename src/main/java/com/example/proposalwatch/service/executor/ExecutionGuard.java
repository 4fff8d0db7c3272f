package com.example.proposalwatch.service.executor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Process-wide single-flight gate for fetch work.
 * <p>
 * Shared by every fire path because the dataset refresh is not re-entrant for the whole
 * process. Acquisition never blocks.
 */
@Slf4j
@Component
public class ExecutionGuard {

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * Run {@code work} unless another caller holds the guard. The guard is released even when
     * {@code work} throws.
     *
     * @param work must not return null
     * @return the work's result, or empty when skipped
     */
    public <T> Optional<T> tryRun(Supplier<T> work) {
        if (!running.compareAndSet(false, true)) {
            log.info("Fetch skipped, previous run in progress");
            return Optional.empty();
        }

        try {
            return Optional.of(work.get());
        } finally {
            running.set(false);
        }
    }

    public boolean isBusy() {
        return running.get();
    }
}

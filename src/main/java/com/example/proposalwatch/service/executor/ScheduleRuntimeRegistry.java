package com.example.proposalwatch.service.executor;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scheduler instances keyed by schedule id; the default schedule uses {@link #DEFAULT_KEY}.
 */
@Component
public class ScheduleRuntimeRegistry {

    public static final String DEFAULT_KEY = "default";

    private final Map<String, ScheduleRuntime> runtimes = new ConcurrentHashMap<>();

    public ScheduleRuntime get(String scheduleId) {
        var key = keyOf(scheduleId);
        return runtimes.computeIfAbsent(key, ScheduleRuntime::new);
    }

    public Optional<ScheduleRuntime> find(String scheduleId) {
        return Optional.ofNullable(runtimes.get(keyOf(scheduleId)));
    }

    public Optional<ScheduleRuntime> remove(String scheduleId) {
        return Optional.ofNullable(runtimes.remove(keyOf(scheduleId)));
    }

    public Collection<ScheduleRuntime> all() {
        return runtimes.values();
    }

    public long standingFailureCount() {
        return runtimes.values().stream().filter(ScheduleRuntime::isStandingFailure).count();
    }

    /**
     * A stored schedule may not use the default schedule's key, or the two would share state.
     */
    public static boolean isReservedId(String scheduleId) {
        return DEFAULT_KEY.equals(scheduleId);
    }

    public static String keyOf(String scheduleId) {
        return scheduleId == null ? DEFAULT_KEY : scheduleId;
    }
}

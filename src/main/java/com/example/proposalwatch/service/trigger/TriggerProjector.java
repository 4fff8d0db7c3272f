package com.example.proposalwatch.service.trigger;

import com.example.proposalwatch.domain.model.RunWindowConfig;
import com.example.proposalwatch.service.window.WindowEvaluator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Projects upcoming admissible run times for a set of triggers.
 * <p>
 * Each trigger is walked until it has produced {@code count} admissible times or the search
 * bound is reached, so a window that can never be satisfied yields an empty list.
 */
@Component
@RequiredArgsConstructor
public class TriggerProjector {

    static final Duration SEARCH_HORIZON = Duration.ofDays(400);
    static final int MAX_CANDIDATES_PER_TRIGGER = 10_000;

    private final WindowEvaluator windowEvaluator;

    /**
     * @return ascending, de-duplicated admissible fire times, at most {@code count}
     */
    public List<ZonedDateTime> nextRunTimes(RunWindowConfig config, Collection<TriggerDefinition> triggers,
                                            Instant now, int count) {
        if (count <= 0 || triggers.isEmpty()) {
            return List.of();
        }

        var horizon = now.plus(SEARCH_HORIZON);
        var times = new TreeSet<Instant>();

        for (var trigger : triggers) {
            var found = 0;
            var candidate = trigger.firstFireAfter(now, config.getZone());
            for (var examined = 0; candidate != null && examined < MAX_CANDIDATES_PER_TRIGGER
                    && found < count && !candidate.isAfter(horizon); examined++) {
                if (windowEvaluator.isAdmissible(candidate, config)) {
                    times.add(candidate);
                    found++;
                }
                candidate = trigger.nextFireAfter(candidate, candidate, config.getZone());
            }
        }

        var result = new ArrayList<ZonedDateTime>(Math.min(count, times.size()));
        for (var time : times) {
            if (result.size() == count) {
                break;
            }
            result.add(time.atZone(config.getZone()));
        }
        return result;
    }
}

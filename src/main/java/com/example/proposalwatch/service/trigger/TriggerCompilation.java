package com.example.proposalwatch.service.trigger;

import com.example.proposalwatch.exception.ScheduleConfigException;
import lombok.Getter;

import java.util.List;

/**
 * Valid triggers of a schedule plus the configuration errors found while compiling it.
 */
@Getter
public class TriggerCompilation {

    private final String scheduleId;
    private final List<TriggerDefinition> triggers;
    private final List<ScheduleConfigException> errors;

    public TriggerCompilation(String scheduleId, List<TriggerDefinition> triggers,
                              List<ScheduleConfigException> errors) {
        this.scheduleId = scheduleId;
        this.triggers = List.copyOf(triggers);
        this.errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean isEmpty() {
        return triggers.isEmpty();
    }
}

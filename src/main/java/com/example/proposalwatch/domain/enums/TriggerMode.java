package com.example.proposalwatch.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Selects which trigger field of a schedule is authoritative.
 */
@Getter
@RequiredArgsConstructor
public enum TriggerMode {

    INTERVAL("interval"),
    CRON("cron"),
    SPECIFIC_TIMES("specific_times");

    @JsonValue
    private final String code;

    @JsonCreator
    public static TriggerMode fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (var mode : values()) {
            if (mode.getCode().equalsIgnoreCase(code.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown schedule mode: " + code);
    }
}

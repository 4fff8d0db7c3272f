package com.example.proposalwatch.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * What caused a fetch run.
 */
@Getter
@RequiredArgsConstructor
public enum RunTrigger {

    SCHEDULED("scheduled", true),
    RETRY("retry", true),
    MANUAL("manual", false),
    STARTUP("startup", true);

    private final String code;

    /**
     * Whether the run window and daily budget gate this trigger
     */
    private final boolean windowChecked;
}

package com.example.proposalwatch.service.notification;

import com.example.proposalwatch.domain.model.FetchDelta;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Channel-independent rendering of a {@link FetchDelta}.
 */
@Value
@Builder
public class ProposalDigest {

    public static final String TITLE = "New Blockchain Proposals Detected";

    String subject;

    /**
     * One-line summary, e.g. "Found 3 new proposals across 2 protocols"
     */
    String summary;

    String htmlBody;

    /**
     * One entry per protocol with its new-proposal count
     */
    List<Field> fields;

    int totalCount;

    Instant generatedAt;

    FetchDelta delta;

    @Value
    public static class Field {
        String name;
        String value;
    }
}

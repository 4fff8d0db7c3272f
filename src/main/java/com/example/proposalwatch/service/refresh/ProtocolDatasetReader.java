package com.example.proposalwatch.service.refresh;

import com.example.proposalwatch.domain.model.ProposalRecord;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Read access to the per-protocol datasets written by the refresh.
 */
public interface ProtocolDatasetReader {

    /**
     * @return proposal numbers currently in the protocol's dataset; empty when no dataset exists yet
     * @throws com.example.proposalwatch.exception.DatasetReadException when the dataset exists but is unreadable
     */
    Set<Long> readIdentities(String protocol);

    /**
     * @return records for the given numbers, ordered by number; unknown numbers are skipped
     * @throws com.example.proposalwatch.exception.DatasetReadException when the dataset is unreadable
     */
    List<ProposalRecord> readRecords(String protocol, Collection<Long> numbers);
}

package com.example.proposalwatch.domain.repository;

import com.example.proposalwatch.domain.model.LastCheckRecord;

import java.util.Optional;

/**
 * Holds the summary of the most recent completed check.
 */
public interface LastCheckRepository {

    Optional<LastCheckRecord> find();

    /**
     * @throws com.example.proposalwatch.exception.StoreWriteException when the file cannot be replaced
     */
    void save(LastCheckRecord record);
}

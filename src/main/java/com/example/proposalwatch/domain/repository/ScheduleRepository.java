package com.example.proposalwatch.domain.repository;

import com.example.proposalwatch.domain.model.Schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable collection of user schedules.
 * <p>
 * Returned schedules are copies; changes only take effect through {@link #save(Schedule)}.
 */
public interface ScheduleRepository {

    List<Schedule> findAll();

    Optional<Schedule> findById(String id);

    /**
     * Insert or replace by id.
     *
     * @throws com.example.proposalwatch.exception.StoreWriteException when the store file cannot be replaced
     */
    Schedule save(Schedule schedule);

    /**
     * Record the time of the latest run without touching any other field.
     *
     * @return false if the schedule no longer exists
     */
    boolean updateLastRun(String id, Instant lastRun);

    /**
     * @return true if a schedule was removed
     */
    boolean deleteById(String id);
}

package com.example.proposalwatch.domain.repository;

import com.example.proposalwatch.config.ProposalWatchProperties;
import com.example.proposalwatch.domain.model.Schedule;
import com.example.proposalwatch.exception.StoreWriteException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Schedule store backed by a JSON array file.
 * <p>
 * The file is re-read on every access so edits made by other processes are picked up. When it
 * cannot be parsed the last successfully read or written view is served instead. Writes are
 * refused until such a view exists, so an unreadable file is never overwritten from nothing.
 */
@Slf4j
@Repository
public class JsonScheduleRepository implements ScheduleRepository {

    private static final TypeReference<List<Schedule>> SCHEDULE_LIST = new TypeReference<>() {
    };

    private final JsonFileStore file;

    private List<Schedule> committed = List.of();

    private boolean loaded;

    @Autowired
    public JsonScheduleRepository(ObjectMapper objectMapper, ProposalWatchProperties properties) {
        this(objectMapper, Path.of(properties.getStore().getSchedulesFile()));
    }

    public JsonScheduleRepository(ObjectMapper objectMapper, Path path) {
        this.file = new JsonFileStore(objectMapper, path);
    }

    @Override
    public synchronized List<Schedule> findAll() {
        return copyOf(load());
    }

    @Override
    public synchronized Optional<Schedule> findById(String id) {
        return load().stream()
                .filter(schedule -> schedule.getId() != null && schedule.getId().equals(id))
                .findFirst()
                .map(Schedule::copy);
    }

    @Override
    public synchronized Schedule save(Schedule schedule) {
        var updated = new ArrayList<Schedule>();
        var replaced = false;
        for (var existing : loadForWrite()) {
            if (existing.getId() != null && existing.getId().equals(schedule.getId())) {
                updated.add(schedule.copy());
                replaced = true;
            } else {
                updated.add(existing);
            }
        }
        if (!replaced) {
            updated.add(schedule.copy());
        }

        commit(updated);
        log.debug("Saved schedule {} ({} schedules stored)", schedule.getId(), updated.size());
        return schedule.copy();
    }

    @Override
    public synchronized boolean updateLastRun(String id, Instant lastRun) {
        var updated = new ArrayList<Schedule>();
        var found = false;
        for (var existing : loadForWrite()) {
            if (existing.getId() != null && existing.getId().equals(id)) {
                var copy = existing.copy();
                copy.setLastRun(lastRun);
                updated.add(copy);
                found = true;
            } else {
                updated.add(existing);
            }
        }
        if (!found) {
            return false;
        }

        commit(updated);
        return true;
    }

    @Override
    public synchronized boolean deleteById(String id) {
        var current = loadForWrite();
        var remaining = current.stream()
                .filter(schedule -> schedule.getId() == null || !schedule.getId().equals(id))
                .toList();
        if (remaining.size() == current.size()) {
            return false;
        }

        commit(remaining);
        log.debug("Deleted schedule {} ({} schedules stored)", id, remaining.size());
        return true;
    }

    private List<Schedule> load() {
        try {
            var read = file.read(SCHEDULE_LIST).orElse(List.of());
            committed = read.stream().filter(schedule -> schedule != null).toList();
            loaded = true;
        } catch (IOException e) {
            log.error("Cannot read schedules from {}, serving last committed view: {}",
                    file.getPath(), e.getMessage());
        }
        return committed;
    }

    private List<Schedule> loadForWrite() {
        var current = load();
        if (!loaded) {
            throw new StoreWriteException(file.getPath().toString(),
                    new IOException("store is unreadable and no committed view exists to write from"));
        }
        return current;
    }

    private void commit(List<Schedule> schedules) {
        file.write(schedules);
        committed = List.copyOf(schedules);
        loaded = true;
    }

    private static List<Schedule> copyOf(List<Schedule> schedules) {
        return schedules.stream().map(Schedule::copy).toList();
    }
}

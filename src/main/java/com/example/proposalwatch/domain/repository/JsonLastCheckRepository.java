package com.example.proposalwatch.domain.repository;

import com.example.proposalwatch.config.ProposalWatchProperties;
import com.example.proposalwatch.domain.model.LastCheckRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

@Slf4j
@Repository
public class JsonLastCheckRepository implements LastCheckRepository {

    private static final TypeReference<LastCheckRecord> RECORD = new TypeReference<>() {
    };

    private final JsonFileStore file;

    @Autowired
    public JsonLastCheckRepository(ObjectMapper objectMapper, ProposalWatchProperties properties) {
        this(objectMapper, Path.of(properties.getStore().getLastCheckFile()));
    }

    public JsonLastCheckRepository(ObjectMapper objectMapper, Path path) {
        this.file = new JsonFileStore(objectMapper, path);
    }

    @Override
    public synchronized Optional<LastCheckRecord> find() {
        try {
            return file.read(RECORD);
        } catch (IOException e) {
            log.warn("Cannot read last check record from {}: {}", file.getPath(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized void save(LastCheckRecord record) {
        file.write(record);
    }
}

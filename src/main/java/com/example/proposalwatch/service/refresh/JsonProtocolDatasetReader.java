package com.example.proposalwatch.service.refresh;

import com.example.proposalwatch.config.ProposalWatchProperties;
import com.example.proposalwatch.domain.model.ProposalRecord;
import com.example.proposalwatch.exception.DatasetReadException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads {@code {"items": [{"number": ..., ...}]}} dataset files from the data directory.
 * <p>
 * Items without a usable number are ignored.
 */
@Slf4j
@Component
public class JsonProtocolDatasetReader implements ProtocolDatasetReader {

    private static final Map<String, String> DEFAULT_FILES = Map.of(
            "ethereum", "eips.json",
            "tron", "tips.json",
            "bitcoin", "bips.json",
            "binance_smart_chain", "beps.json"
    );

    private static final TypeReference<Map<String, Object>> ATTRIBUTES = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ProposalWatchProperties properties;

    public JsonProtocolDatasetReader(ObjectMapper objectMapper, ProposalWatchProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public Set<Long> readIdentities(String protocol) {
        var identities = new HashSet<Long>();
        for (var item : readItems(protocol)) {
            var number = numberOf(item);
            if (number != null) {
                identities.add(number);
            }
        }
        return identities;
    }

    @Override
    public List<ProposalRecord> readRecords(String protocol, Collection<Long> numbers) {
        var wanted = new HashSet<>(numbers);
        var records = new ArrayList<ProposalRecord>();
        for (var item : readItems(protocol)) {
            var number = numberOf(item);
            if (number != null && wanted.remove(number)) {
                records.add(new ProposalRecord(number, objectMapper.convertValue(item, ATTRIBUTES)));
            }
        }
        if (!wanted.isEmpty()) {
            log.warn("{} proposal(s) of {} disappeared from the dataset: {}", wanted.size(), protocol, wanted);
        }
        records.sort(Comparator.comparingLong(ProposalRecord::getNumber));
        return records;
    }

    Path datasetPath(String protocol) {
        var fileName = properties.getProtocolFiles().getOrDefault(protocol,
                DEFAULT_FILES.getOrDefault(protocol, protocol + ".json"));
        return Path.of(properties.getDataDir()).resolve(fileName);
    }

    private List<JsonNode> readItems(String protocol) {
        var path = datasetPath(protocol);
        if (!Files.exists(path)) {
            log.debug("No dataset for {} at {} yet", protocol, path);
            return List.of();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new DatasetReadException(protocol, path.toString(), e);
        }

        if (root == null || root.isMissingNode() || root.isNull()) {
            return List.of();
        }
        var items = root.path("items");
        if (items.isMissingNode()) {
            return List.of();
        }
        if (!items.isArray()) {
            throw new DatasetReadException(protocol, path.toString(), "'items' is not an array");
        }

        var result = new ArrayList<JsonNode>(items.size());
        items.forEach(result::add);
        return result;
    }

    private static Long numberOf(JsonNode item) {
        var number = item.path("number");
        if (number.canConvertToLong() && number.isIntegralNumber()) {
            return number.asLong();
        }
        if (number.isTextual()) {
            try {
                return Long.parseLong(number.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}

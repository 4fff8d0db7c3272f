package com.example.proposalwatch.domain.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One proposal from a protocol dataset. {@code number} is its stable identity; the remaining
 * attributes are only used when formatting notifications.
 */
@Value
public class ProposalRecord {

    long number;

    Map<String, Object> attributes;

    public ProposalRecord(long number, Map<String, Object> attributes) {
        this.number = number;
        this.attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String attribute(String key) {
        var value = attributes.get(key);
        return value == null ? null : String.valueOf(value);
    }

    public String attribute(String key, String fallback) {
        var value = attribute(key);
        return value == null || value.isBlank() ? fallback : value;
    }
}

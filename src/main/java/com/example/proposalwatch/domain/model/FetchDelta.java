package com.example.proposalwatch.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Proposals newly observed during one run, grouped by protocol in check order.
 * Protocols without new proposals are not present.
 */
public final class FetchDelta {

    private static final FetchDelta EMPTY = new FetchDelta(Collections.emptyMap());

    private final Map<String, List<ProposalRecord>> byProtocol;

    private FetchDelta(Map<String, List<ProposalRecord>> byProtocol) {
        this.byProtocol = byProtocol;
    }

    public static FetchDelta empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return byProtocol.isEmpty();
    }

    public int totalCount() {
        return byProtocol.values().stream().mapToInt(List::size).sum();
    }

    public Set<String> protocols() {
        return byProtocol.keySet();
    }

    public List<ProposalRecord> get(String protocol) {
        return byProtocol.getOrDefault(protocol, List.of());
    }

    public Map<String, List<ProposalRecord>> asMap() {
        return byProtocol;
    }

    @Override
    public String toString() {
        var counts = new LinkedHashMap<String, Integer>();
        byProtocol.forEach((protocol, records) -> counts.put(protocol, records.size()));
        return "FetchDelta" + counts;
    }

    public static final class Builder {

        private final Map<String, List<ProposalRecord>> byProtocol = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(String protocol, List<ProposalRecord> records) {
            if (records != null && !records.isEmpty()) {
                byProtocol.put(protocol, List.copyOf(records));
            }
            return this;
        }

        public FetchDelta build() {
            if (byProtocol.isEmpty()) {
                return EMPTY;
            }
            return new FetchDelta(Collections.unmodifiableMap(new LinkedHashMap<>(byProtocol)));
        }
    }
}

package net.shelfsync.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/** 외부 피드의 레코드 한 건. identifier가 카탈로그 엔티티의 기본 식별자다. */
public record FeedRecord(String identifier, byte[] payload, Map<String, String> attributes) {
    public FeedRecord {
        Objects.requireNonNull(identifier, "identifier");
        payload = payload == null ? new byte[0] : payload;
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public FeedRecord(String identifier, byte[] payload) {
        this(identifier, payload, Map.of());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeedRecord other)) return false;
        return identifier.equals(other.identifier)
                && Arrays.equals(payload, other.payload)
                && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, Arrays.hashCode(payload), attributes);
    }

    @Override
    public String toString() {
        return "FeedRecord{identifier='" + identifier + "', bytes=" + payload.length + ", attributes=" + attributes + '}';
    }
}

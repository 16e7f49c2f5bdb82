package com.ryuqq.olympus.testkit.fixture;

import com.ryuqq.olympus.core.event.DomainEvent;
import com.ryuqq.olympus.core.model.Guid;

import java.time.Instant;

/**
 * Event fixtures for dispatcher and registry tests.
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public final class SampleEvents {

    private SampleEvents() {
    }

    /**
     * A sample was created.
     */
    public record SampleCreated(Guid aggregateId, String name, Instant occurredAt) implements DomainEvent {

        public SampleCreated {
            if (aggregateId == null) {
                throw new IllegalArgumentException("aggregateId cannot be null");
            }
            if (occurredAt == null) {
                throw new IllegalArgumentException("occurredAt cannot be null");
            }
        }

        public static SampleCreated of(Guid aggregateId, String name) {
            return new SampleCreated(aggregateId, name, Instant.now());
        }

        @Override
        public Guid getAggregateId() {
            return aggregateId;
        }

        @Override
        public Instant getOccurredAt() {
            return occurredAt;
        }
    }

    /**
     * A sample was renamed.
     */
    public record SampleRenamed(Guid aggregateId, String from, String to, Instant occurredAt) implements DomainEvent {

        public SampleRenamed {
            if (aggregateId == null) {
                throw new IllegalArgumentException("aggregateId cannot be null");
            }
            if (occurredAt == null) {
                throw new IllegalArgumentException("occurredAt cannot be null");
            }
        }

        public static SampleRenamed of(Guid aggregateId, String from, String to) {
            return new SampleRenamed(aggregateId, from, to, Instant.now());
        }

        @Override
        public Guid getAggregateId() {
            return aggregateId;
        }

        @Override
        public Instant getOccurredAt() {
            return occurredAt;
        }
    }
}

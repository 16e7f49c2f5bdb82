package com.ryuqq.olympus.testkit.fixture;

import com.ryuqq.olympus.core.event.AggregateRoot;
import com.ryuqq.olympus.core.model.Guid;
import com.ryuqq.olympus.core.monad.Maybe;

/**
 * Minimal aggregate that records {@link SampleEvents} on each state change.
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public class SampleAggregate extends AggregateRoot<SampleAggregate.Props> {

    /**
     * @param name current name
     */
    public record Props(String name) {
    }

    private String name;

    private SampleAggregate(Props props, Maybe<Guid> id) {
        super(props, id);
        this.name = props.name();
    }

    /**
     * Creates a new aggregate and records {@link SampleEvents.SampleCreated}.
     *
     * @param name initial name
     * @return new aggregate with one pending event
     */
    public static SampleAggregate create(String name) {
        SampleAggregate aggregate = new SampleAggregate(new Props(name), Maybe.none());
        aggregate.remind(SampleEvents.SampleCreated.of(aggregate.getId(), name));
        return aggregate;
    }

    /**
     * Restores an aggregate without recording events.
     *
     * @param id existing identifier
     * @param name current name
     * @return aggregate with no pending events
     */
    public static SampleAggregate restore(Guid id, String name) {
        return new SampleAggregate(new Props(name), Maybe.some(id));
    }

    public void rename(String newName) {
        String previous = this.name;
        this.name = newName;
        remind(SampleEvents.SampleRenamed.of(getId(), previous, newName));
    }

    public String getName() {
        return name;
    }
}

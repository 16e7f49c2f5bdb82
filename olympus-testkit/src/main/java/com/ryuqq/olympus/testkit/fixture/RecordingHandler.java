package com.ryuqq.olympus.testkit.fixture;

import com.ryuqq.olympus.core.event.DomainEvent;
import com.ryuqq.olympus.core.event.EventHandler;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handler that records every event it receives, optionally into a shared journal
 * so that invocation order across handlers can be asserted.
 *
 * @param <E> event type
 * @author Olympus Team
 * @since 1.0.0
 */
public class RecordingHandler<E extends DomainEvent> implements EventHandler<E> {

    private final String label;
    private final List<String> journal;
    private final List<E> received = new CopyOnWriteArrayList<>();

    public RecordingHandler(String label) {
        this(label, new CopyOnWriteArrayList<>());
    }

    /**
     * @param label name written to the journal on each call
     * @param journal shared journal
     */
    public RecordingHandler(String label, List<String> journal) {
        this.label = label;
        this.journal = journal;
    }

    @Override
    public void handle(E event) {
        received.add(event);
        journal.add(label);
    }

    public List<E> received() {
        return List.copyOf(received);
    }

    public int count() {
        return received.size();
    }

    public String label() {
        return label;
    }
}

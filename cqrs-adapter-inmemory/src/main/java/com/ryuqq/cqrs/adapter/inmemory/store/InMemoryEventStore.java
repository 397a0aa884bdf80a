package com.ryuqq.cqrs.adapter.inmemory.store;

import com.ryuqq.cqrs.core.contract.AggregateSnapshot;
import com.ryuqq.cqrs.core.contract.DomainEvent;
import com.ryuqq.cqrs.core.handler.EventSubscriber;
import com.ryuqq.cqrs.core.handler.Subscription;
import com.ryuqq.cqrs.core.outcome.HandlerFailure;
import com.ryuqq.cqrs.core.spi.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of {@link EventStore} for testing and reference purposes.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Event Log:</strong> ArrayList guarded by a {@link ReadWriteLock} - global store order</li>
 *   <li><strong>Snapshots:</strong> ConcurrentHashMap&lt;aggregateId, AggregateSnapshot&gt; - latest only</li>
 *   <li><strong>Subscribers:</strong> CopyOnWriteArrayList of registrations - snapshot iteration during publish</li>
 * </ul>
 *
 * <p>Events are immutable records, so the log keeps the appended instances and returns
 * unmodifiable copies of the list from every scan.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * EventStore store = new InMemoryEventStore();
 * Subscription subscription = store.subscribe("OrderCreated", event -&gt; ...);
 *
 * store.append(events);
 * List&lt;HandlerFailure&gt; failures = store.publish(events);
 *
 * subscription.unsubscribe();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final List<DomainEvent> events = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, AggregateSnapshot> snapshots = new ConcurrentHashMap<>();
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    /**
     * {@inheritDoc}
     *
     * <p>Appends under the write lock, so a batch is never interleaved with another batch.</p>
     */
    @Override
    public void append(List<DomainEvent> newEvents) {
        if (newEvents == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        for (DomainEvent event : newEvents) {
            if (event == null) {
                throw new IllegalArgumentException("events cannot contain null");
            }
        }
        if (newEvents.isEmpty()) {
            return;
        }

        lock.writeLock().lock();
        try {
            events.addAll(newEvents);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Appended {} event(s), log size {}", newEvents.size(), getEventCount());
    }

    @Override
    public List<DomainEvent> getEventsForAggregate(String aggregateId, long afterVersion) {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        }

        lock.readLock().lock();
        try {
            List<DomainEvent> result = new ArrayList<>();
            for (DomainEvent event : events) {
                if (event.aggregateId().equals(aggregateId) && event.version() > afterVersion) {
                    result.add(event);
                }
            }
            return List.copyOf(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<DomainEvent> getEventsByType(String eventType, Instant since) {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType cannot be null");
        }

        lock.readLock().lock();
        try {
            List<DomainEvent> result = new ArrayList<>();
            for (DomainEvent event : events) {
                if (event.eventType().equals(eventType)
                    && (since == null || !event.occurredAt().isBefore(since))) {
                    result.add(event);
                }
            }
            return List.copyOf(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<DomainEvent> getAllEvents(long afterPosition) {
        if (afterPosition < 0) {
            throw new IllegalArgumentException("afterPosition must be non-negative (current: " + afterPosition + ")");
        }

        lock.readLock().lock();
        try {
            if (afterPosition >= events.size()) {
                return List.of();
            }
            return List.copyOf(events.subList((int) afterPosition, events.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long getEventCount() {
        lock.readLock().lock();
        try {
            return events.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void saveSnapshot(AggregateSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        snapshots.put(snapshot.aggregateId(), snapshot);
        log.debug("Saved snapshot for {} at version {}", snapshot.aggregateId(), snapshot.version());
    }

    @Override
    public Optional<AggregateSnapshot> getSnapshot(String aggregateId) {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        }
        return Optional.ofNullable(snapshots.get(aggregateId));
    }

    @Override
    public Subscription subscribe(String eventType, EventSubscriber subscriber) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType cannot be null or blank");
        }
        return register(eventType, subscriber);
    }

    @Override
    public Subscription subscribeAll(EventSubscriber subscriber) {
        return register(null, subscriber);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Iterates a snapshot of the registrations, so subscribers may unsubscribe
     * themselves during delivery.</p>
     */
    @Override
    public List<HandlerFailure> publish(List<DomainEvent> toPublish) {
        if (toPublish == null) {
            throw new IllegalArgumentException("events cannot be null");
        }

        List<HandlerFailure> failures = new ArrayList<>();
        for (DomainEvent event : toPublish) {
            for (Registration registration : registrations) {
                if (registration.eventType != null && registration.eventType.equals(event.eventType())) {
                    deliver(registration, event, failures);
                }
            }
            for (Registration registration : registrations) {
                if (registration.eventType == null) {
                    deliver(registration, event, failures);
                }
            }
        }
        return failures;
    }

    /**
     * Number of active subscriptions, for testing and debugging.
     */
    public int subscriberCount() {
        return registrations.size();
    }

    /**
     * Clears events, snapshots and subscriptions. Used for test cleanup.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            events.clear();
        } finally {
            lock.writeLock().unlock();
        }
        snapshots.clear();
        registrations.clear();
    }

    private Subscription register(String eventType, EventSubscriber subscriber) {
        if (subscriber == null) {
            throw new IllegalArgumentException("subscriber cannot be null");
        }
        Registration registration = new Registration(eventType, subscriber);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    private void deliver(Registration registration, DomainEvent event, List<HandlerFailure> failures) {
        try {
            registration.subscriber.onEvent(event);
        } catch (Exception e) {
            log.error("Subscriber {} failed on event {} ({})",
                registration.name(), event.eventId(), event.eventType(), e);
            failures.add(new HandlerFailure(registration.name(), event.eventId(), event.eventType(), e));
        }
    }

    /**
     * One subscription. Identity equality, so the same subscriber registered twice
     * yields two independent registrations.
     */
    private static final class Registration {

        private final String eventType;
        private final EventSubscriber subscriber;

        private Registration(String eventType, EventSubscriber subscriber) {
            this.eventType = eventType;
            this.subscriber = subscriber;
        }

        private String name() {
            return (eventType == null ? "*" : eventType) + ":" + subscriber.getClass().getSimpleName();
        }
    }
}

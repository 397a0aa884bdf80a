package com.ryuqq.cqrs.core.spi;

import com.ryuqq.cqrs.core.contract.AggregateSnapshot;
import com.ryuqq.cqrs.core.contract.DomainEvent;
import com.ryuqq.cqrs.core.handler.EventSubscriber;
import com.ryuqq.cqrs.core.handler.Subscription;
import com.ryuqq.cqrs.core.outcome.HandlerFailure;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only event log SPI with snapshots and synchronous subscriber delivery.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Append immutable events in caller order</li>
 *   <li>Per-aggregate and global log scans</li>
 *   <li>Latest snapshot per aggregate (overwritten, not versioned)</li>
 *   <li>Subscriber registration and in-order delivery</li>
 * </ul>
 *
 * <p><strong>Not a responsibility:</strong> version contiguity. The store accepts whatever
 * it is given; the aggregate repository validates sequences before appending.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently</li>
 *   <li>Events returned by scans must never be mutated after append</li>
 *   <li>{@link #publish(List)} never throws because of a subscriber</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventStore {

    /**
     * Appends events in the given order.
     *
     * @param events events to append (empty list is a no-op)
     * @throws IllegalArgumentException if events or any element is null
     */
    void append(List<DomainEvent> events);

    /**
     * Returns events of one aggregate with {@code version > afterVersion}, in store order.
     *
     * @param aggregateId the aggregate
     * @param afterVersion exclusive lower bound (0 for all)
     * @return immutable list, empty if none
     */
    List<DomainEvent> getEventsForAggregate(String aggregateId, long afterVersion);

    /**
     * Returns events of one type, optionally at or after {@code since}.
     *
     * @param eventType the event type
     * @param since inclusive lower bound on {@code occurredAt}, or null for all
     * @return immutable list in store order
     */
    List<DomainEvent> getEventsByType(String eventType, Instant since);

    /**
     * Returns the global log starting at a zero-based position.
     *
     * @param afterPosition number of leading events to skip (0 for the full log)
     * @return immutable list in store order
     */
    List<DomainEvent> getAllEvents(long afterPosition);

    /**
     * Total number of appended events.
     */
    long getEventCount();

    /**
     * Stores the latest snapshot for its aggregate, replacing any previous one.
     *
     * @param snapshot the snapshot
     */
    void saveSnapshot(AggregateSnapshot snapshot);

    /**
     * Returns the latest snapshot of an aggregate.
     *
     * @param aggregateId the aggregate
     * @return the snapshot, or empty
     */
    Optional<AggregateSnapshot> getSnapshot(String aggregateId);

    /**
     * Subscribes to one event type.
     *
     * @param eventType the event type
     * @param subscriber the subscriber
     * @return handle removing exactly this registration
     */
    Subscription subscribe(String eventType, EventSubscriber subscriber);

    /**
     * Subscribes to every event.
     *
     * @param subscriber the subscriber
     * @return handle removing exactly this registration
     */
    Subscription subscribeAll(EventSubscriber subscriber);

    /**
     * Delivers events synchronously: for each event in order, type subscribers first,
     * then global subscribers.
     *
     * <p>Each subscriber failure is caught, logged and isolated. It never prevents delivery
     * to the remaining subscribers.</p>
     *
     * @param events events to deliver
     * @return failures collected during delivery, empty when all succeeded
     */
    List<HandlerFailure> publish(List<DomainEvent> events);
}

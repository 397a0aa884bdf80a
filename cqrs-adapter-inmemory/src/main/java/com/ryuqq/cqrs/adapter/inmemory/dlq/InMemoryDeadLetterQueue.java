package com.ryuqq.cqrs.adapter.inmemory.dlq;

import com.ryuqq.cqrs.core.contract.Command;
import com.ryuqq.cqrs.core.model.Identifiers;
import com.ryuqq.cqrs.core.spi.DeadLetterEntry;
import com.ryuqq.cqrs.core.spi.DeadLetterQueue;
import com.ryuqq.cqrs.core.spi.DeadLetterQueueStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;
import java.util.Optional;

/**
 * In-memory implementation of {@link DeadLetterQueue} for testing and reference purposes.
 *
 * <p>Entries are kept in insertion order in a list guarded by the instance monitor.</p>
 *
 * <p><strong>Eviction on overflow:</strong></p>
 * <ol>
 *   <li>Oldest resolved entry, if any (logged at DEBUG)</li>
 *   <li>Otherwise the oldest entry unconditionally (data loss, logged at WARN)</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryDeadLetterQueue implements DeadLetterQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDeadLetterQueue.class);

    private final LinkedList<DeadLetterEntry> entries = new LinkedList<>();
    private final int maxSize;
    private final Clock clock;

    /**
     * Creates a queue bounded to {@code maxSize} entries using the system clock.
     *
     * @param maxSize capacity
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public InMemoryDeadLetterQueue(int maxSize) {
        this(maxSize, Clock.systemUTC());
    }

    public InMemoryDeadLetterQueue(int maxSize, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive (current: " + maxSize + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.maxSize = maxSize;
        this.clock = clock;
    }

    @Override
    public synchronized DeadLetterEntry enqueue(Command command, String error, int retryCount) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }

        if (entries.size() >= maxSize) {
            evictOne();
        }
        DeadLetterEntry entry = new DeadLetterEntry(
            Identifiers.next("dlq"), command, error, clock.instant(), retryCount, false
        );
        entries.addLast(entry);
        log.warn("Dead-lettered command {} ({}) after {} attempt(s): {}",
            command.commandId(), command.commandType(), retryCount, error);
        return entry;
    }

    @Override
    public synchronized List<DeadLetterEntry> getUnresolved() {
        List<DeadLetterEntry> result = new ArrayList<>();
        for (DeadLetterEntry entry : entries) {
            if (!entry.resolved()) {
                result.add(entry);
            }
        }
        return List.copyOf(result);
    }

    @Override
    public synchronized List<DeadLetterEntry> getAll() {
        return List.copyOf(entries);
    }

    @Override
    public synchronized Optional<DeadLetterEntry> getById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return entries.stream().filter(entry -> entry.id().equals(id)).findFirst();
    }

    @Override
    public synchronized boolean resolve(String id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }

        ListIterator<DeadLetterEntry> iterator = entries.listIterator();
        while (iterator.hasNext()) {
            DeadLetterEntry entry = iterator.next();
            if (entry.id().equals(id)) {
                iterator.set(entry.markResolved());
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized int size() {
        int unresolved = 0;
        for (DeadLetterEntry entry : entries) {
            if (!entry.resolved()) {
                unresolved++;
            }
        }
        return unresolved;
    }

    @Override
    public synchronized DeadLetterQueueStats stats() {
        if (entries.isEmpty()) {
            return DeadLetterQueueStats.empty();
        }

        Instant oldest = null;
        Instant newest = null;
        long retrySum = 0;
        for (DeadLetterEntry entry : entries) {
            if (oldest == null || entry.failedAt().isBefore(oldest)) {
                oldest = entry.failedAt();
            }
            if (newest == null || entry.failedAt().isAfter(newest)) {
                newest = entry.failedAt();
            }
            retrySum += entry.retryCount();
        }
        return new DeadLetterQueueStats(
            entries.size(), size(), oldest, newest, (double) retrySum / entries.size()
        );
    }

    public int capacity() {
        return maxSize;
    }

    private void evictOne() {
        ListIterator<DeadLetterEntry> iterator = entries.listIterator();
        while (iterator.hasNext()) {
            DeadLetterEntry entry = iterator.next();
            if (entry.resolved()) {
                iterator.remove();
                log.debug("Evicted resolved dead letter {} to make room", entry.id());
                return;
            }
        }
        DeadLetterEntry dropped = entries.removeFirst();
        log.warn("Dead letter queue full (maxSize={}), dropped unresolved entry {} for command {}",
            maxSize, dropped.id(), dropped.command().commandId());
    }
}

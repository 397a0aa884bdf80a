package com.ryuqq.cqrs.core.outcome;

import com.ryuqq.cqrs.core.contract.DomainEvent;
import com.ryuqq.cqrs.core.model.Payload;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CommandResult / QueryResult 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CommandResultTest {

    @Test
    void success_CopiesEvents() {
        // Given
        List<DomainEvent> events = new ArrayList<>();
        events.add(DomainEvent.create("order-1", "Order", "OrderCreated", 1, Payload.empty()));

        // When
        CommandResult result = CommandResult.success("cmd-1", events, 1);
        events.clear();

        // Then
        assertTrue(result.success());
        assertTrue(result.hasEvents());
        assertEquals(1, result.events().size());
        assertNull(result.errorCode());
        assertThrows(UnsupportedOperationException.class, () -> result.events().clear());
    }

    @Test
    void failure_CarriesCodeAndRetriable() {
        // When
        CommandResult result = CommandResult.failure("cmd-1", ErrorCode.CONCURRENCY_CONFLICT, "stale", true);

        // Then
        assertFalse(result.success());
        assertFalse(result.hasEvents());
        assertEquals(ErrorCode.CONCURRENCY_CONFLICT, result.errorCode());
        assertEquals("stale", result.error());
        assertTrue(result.retriable());
    }

    @Test
    void constructor_SuccessWithError_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalArgumentException.class,
            () -> new CommandResult("cmd-1", true, List.of(), 0, "boom", null, false)
        );
    }

    @Test
    void constructor_FailureWithoutCode_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new CommandResult("cmd-1", false, List.of(), 0, "boom", null, false)
        );
        assertTrue(exception.getMessage().contains("errorCode cannot be null"));
    }

    @Test
    void queryResult_Cached_HasZeroExecutionTime() {
        // When
        QueryResult<String> result = QueryResult.cached("qry-1", "data", null);

        // Then
        assertTrue(result.fromCache());
        assertEquals(0L, result.executionMs());
        assertEquals("data", result.data());
    }

    @Test
    void handlerFailure_NullMessage_FallsBackToClassName() {
        // When
        HandlerFailure failure = new HandlerFailure("type:Sub", "evt-1", "OrderCreated", new IllegalStateException());

        // Then
        assertEquals("IllegalStateException", failure.message());
    }
}

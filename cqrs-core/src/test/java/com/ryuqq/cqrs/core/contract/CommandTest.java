package com.ryuqq.cqrs.core.contract;

import com.ryuqq.cqrs.core.model.IdempotencyKey;
import com.ryuqq.cqrs.core.model.Payload;
import com.ryuqq.cqrs.core.model.Priority;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Command / CommandMetadata 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CommandTest {

    @Test
    void create_GeneratesIdAndDefaults() {
        // When
        Command command = Command.create("CreateOrder", "order-1", null);

        // Then
        assertTrue(command.commandId().startsWith("cmd-"));
        assertTrue(command.payload().isEmpty());
        assertEquals(0, command.metadata().retryCount());
        assertNull(command.metadata().maxRetries());
        assertEquals(Priority.NORMAL, command.metadata().priority());
        assertNotNull(command.issuedAt());
    }

    @Test
    void constructor_BlankCommandType_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Command("cmd-1", " ", "order-1", Payload.empty(), CommandMetadata.of("cor-1"), Instant.now())
        );
        assertTrue(exception.getMessage().contains("commandType"));
    }

    @Test
    void withRetryCount_KeepsIdentity() {
        // Given
        Command command = Command.create(
            "CreateOrder", "order-1", Payload.of("total", 10),
            CommandMetadata.of("cor-1").withIdempotencyKey("req-1")
        );

        // When
        Command retried = command.withRetryCount(2);

        // Then
        assertEquals(command.commandId(), retried.commandId());
        assertEquals(command.issuedAt(), retried.issuedAt());
        assertEquals(2, retried.metadata().retryCount());
        assertEquals(IdempotencyKey.of("req-1"), retried.metadata().idempotencyKey());
        assertEquals(0, command.metadata().retryCount());
    }

    @Test
    void metadata_NegativeMaxRetries_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> CommandMetadata.create().withMaxRetries(-1));
    }

    @Test
    void idempotencyKey_TooLong_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> IdempotencyKey.of("k".repeat(256)));
        assertThrows(IllegalArgumentException.class, () -> IdempotencyKey.of(""));
    }
}

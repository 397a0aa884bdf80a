package com.ryuqq.cqrs.core.outcome;

import com.ryuqq.cqrs.core.contract.DomainEvent;

import java.util.List;

/**
 * Command 처리 결과.
 *
 * <p><strong>성공:</strong> {@code error}와 {@code errorCode}는 null이며 {@code retriable}은 false.</p>
 * <p><strong>실패:</strong> {@code error} 메시지와 {@code errorCode}를 반드시 가집니다.</p>
 *
 * @param commandId 대상 Command ID
 * @param success 성공 여부
 * @param events 생성된 이벤트 (불변 사본)
 * @param aggregateVersion 처리 후 Aggregate 버전 (알 수 없으면 0)
 * @param error 오류 메시지 (성공 시 null)
 * @param errorCode 오류 분류 (성공 시 null)
 * @param retriable 호출자가 다시 시도해도 되는지 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CommandResult(
    String commandId,
    boolean success,
    List<DomainEvent> events,
    long aggregateVersion,
    String error,
    ErrorCode errorCode,
    boolean retriable
) {

    public CommandResult {
        if (commandId == null || commandId.isBlank()) {
            throw new IllegalArgumentException("commandId cannot be null or blank");
        }
        if (aggregateVersion < 0) {
            throw new IllegalArgumentException("aggregateVersion must be non-negative (current: " + aggregateVersion + ")");
        }
        if (success && (error != null || errorCode != null)) {
            throw new IllegalArgumentException("successful result cannot carry an error");
        }
        if (!success && errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null for a failed result");
        }
        events = events == null ? List.of() : List.copyOf(events);
    }

    /**
     * 성공 결과 생성.
     *
     * @param commandId Command ID
     * @param events 생성된 이벤트
     * @param aggregateVersion 처리 후 버전
     * @return 성공 결과
     */
    public static CommandResult success(String commandId, List<DomainEvent> events, long aggregateVersion) {
        return new CommandResult(commandId, true, events, aggregateVersion, null, null, false);
    }

    /**
     * 실패 결과 생성.
     *
     * @param commandId Command ID
     * @param errorCode 오류 분류
     * @param error 오류 메시지
     * @param retriable 재시도 가능 여부
     * @return 실패 결과
     */
    public static CommandResult failure(String commandId, ErrorCode errorCode, String error, boolean retriable) {
        return new CommandResult(commandId, false, List.of(), 0L, error, errorCode, retriable);
    }

    public boolean hasEvents() {
        return !events.isEmpty();
    }
}

package com.ryuqq.cqrs.core.outcome;

/**
 * 이벤트 전달 중 구독자/Projection에서 발생한 실패.
 *
 * <p>이벤트 발행은 실패를 던지지 않고 이 레코드 목록으로 돌려줍니다.</p>
 *
 * @param source 실패한 구독자 또는 Projection 이름
 * @param eventId 이벤트 ID
 * @param eventType 이벤트 유형
 * @param error 원인 예외
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record HandlerFailure(
    String source,
    String eventId,
    String eventType,
    Throwable error
) {

    public HandlerFailure {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
        if (eventId == null) {
            throw new IllegalArgumentException("eventId cannot be null");
        }
        if (eventType == null) {
            throw new IllegalArgumentException("eventType cannot be null");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    public String message() {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}

package com.ryuqq.cqrs.core.model;

/**
 * 멱등성 키 (Idempotency Key).
 *
 * <p>클라이언트가 "논리적으로 같은 Command"의 중복 제출을 식별하기 위해 제공하는 토큰입니다.
 * 중복 여부는 payload가 아니라 키 자체로만 판단합니다 (정확 일치).</p>
 *
 * <p><strong>사용 시나리오:</strong></p>
 * <ul>
 *   <li>클라이언트가 요청별로 고유 키 생성 (UUID 권장)</li>
 *   <li>네트워크 타임아웃 후 재전송 시 동일 키 사용</li>
 *   <li>중복 제거 윈도우 내 동일 키는 캐시된 CommandResult 반환</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class IdempotencyKey {

    private final String value;

    private IdempotencyKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("IdempotencyKey cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("IdempotencyKey length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * IdempotencyKey 생성.
     *
     * @param value 키 값
     * @return IdempotencyKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static IdempotencyKey of(String value) {
        return new IdempotencyKey(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IdempotencyKey that = (IdempotencyKey) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "IdempotencyKey{" + value + '}';
    }
}

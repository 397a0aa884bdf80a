package com.ryuqq.cqrs.core.model;

import java.util.UUID;

/**
 * 접두사 기반 식별자 생성기.
 *
 * <p>형식: {@code <prefix>-<uuid>} (예: {@code cmd-550e8400-e29b-41d4-a716-446655440000})</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Identifiers {

    private Identifiers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 새 식별자 생성.
     *
     * @param prefix 접두사 (예: cmd, qry, evt, cor)
     * @return 고유 식별자
     * @throws IllegalArgumentException prefix가 null이거나 빈 문자열인 경우
     */
    public static String next(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        return prefix + "-" + UUID.randomUUID();
    }
}

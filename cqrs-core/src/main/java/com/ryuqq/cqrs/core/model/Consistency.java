package com.ryuqq.cqrs.core.model;

/**
 * Query 일관성 요구 수준.
 *
 * <ul>
 *   <li>{@link #STRONG}: 캐시를 우회하고 항상 핸들러 실행</li>
 *   <li>{@link #EVENTUAL}: 캐시된 결과 허용 (TTL 이내)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Consistency {
    STRONG,
    EVENTUAL
}

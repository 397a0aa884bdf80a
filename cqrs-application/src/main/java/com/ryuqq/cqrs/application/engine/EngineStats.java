package com.ryuqq.cqrs.application.engine;

/**
 * 엔진 운영 현황.
 *
 * @param totalEvents 저장된 전체 이벤트 수
 * @param registeredCommands 등록된 Command 유형 수
 * @param registeredQueries 등록된 Query 유형 수
 * @param projections 등록된 Projection 수
 * @param activeSagas 진행 중인 Saga 인스턴스 수
 * @param deadLetters 미해결 DLQ 항목 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EngineStats(
    long totalEvents,
    int registeredCommands,
    int registeredQueries,
    int projections,
    int activeSagas,
    int deadLetters
) {
}

package com.ryuqq.cqrs.core.config;

/**
 * CQRS 엔진 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>snapshotInterval: 스냅샷 생성 주기 (이벤트 수, 기본 50)</li>
 *   <li>maxRetries: Command 최대 재시도 횟수 (기본 3, 총 시도는 maxRetries + 1)</li>
 *   <li>baseRetryDelayMs: 재시도 기본 지연 (기본 100ms)</li>
 *   <li>maxRetryDelayMs: 재시도 최대 지연 (기본 5000ms)</li>
 *   <li>retryJitterFactor: 지터 비율 (0.0 ~ 1.0, 기본 0.1)</li>
 *   <li>deduplicationWindowMs: 멱등성 캐시 유지 시간 (기본 300000ms = 5분)</li>
 *   <li>deadLetterMaxSize: DLQ 최대 크기 (기본 1000)</li>
 *   <li>queryCacheEnabled: Query 캐시 활성화 여부 (기본 true)</li>
 *   <li>queryCacheTtlMs: Query 캐시 기본 TTL (기본 30000ms)</li>
 *   <li>sagaHistoryLimit: 보관할 종료 Saga 인스턴스 수 (기본 1000)</li>
 * </ul>
 *
 * <p><strong>테스트 튜닝:</strong> baseRetryDelayMs=0, retryJitterFactor=0으로 재시도 대기를 없앨 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param snapshotInterval 스냅샷 주기 (양수)
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param baseRetryDelayMs 기본 지연 (0 이상)
 * @param maxRetryDelayMs 최대 지연 (baseRetryDelayMs 이상)
 * @param retryJitterFactor 지터 비율 (0.0 ~ 1.0)
 * @param deduplicationWindowMs 멱등성 캐시 유지 시간 (양수)
 * @param deadLetterMaxSize DLQ 최대 크기 (양수)
 * @param queryCacheEnabled Query 캐시 활성화 여부
 * @param queryCacheTtlMs Query 캐시 TTL (양수)
 * @param sagaHistoryLimit 종료 Saga 보관 수 (0 이상)
 */
public record CqrsEngineConfig(
    int snapshotInterval,
    int maxRetries,
    long baseRetryDelayMs,
    long maxRetryDelayMs,
    double retryJitterFactor,
    long deduplicationWindowMs,
    int deadLetterMaxSize,
    boolean queryCacheEnabled,
    long queryCacheTtlMs,
    int sagaHistoryLimit
) {

    /**
     * 기본 설정 생성자.
     */
    public CqrsEngineConfig() {
        this(50, 3, 100, 5000, 0.1, 300_000, 1000, true, 30_000, 1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CqrsEngineConfig {
        if (snapshotInterval <= 0) {
            throw new IllegalArgumentException(
                "snapshotInterval must be positive (current: " + snapshotInterval + ")"
            );
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must be non-negative (current: " + maxRetries + ")"
            );
        }
        if (baseRetryDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseRetryDelayMs must be non-negative (current: " + baseRetryDelayMs + ")"
            );
        }
        if (maxRetryDelayMs < baseRetryDelayMs) {
            throw new IllegalArgumentException(
                "maxRetryDelayMs must be >= baseRetryDelayMs (current: " + maxRetryDelayMs + ")"
            );
        }
        if (retryJitterFactor < 0.0 || retryJitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "retryJitterFactor must be between 0.0 and 1.0 (current: " + retryJitterFactor + ")"
            );
        }
        if (deduplicationWindowMs <= 0) {
            throw new IllegalArgumentException(
                "deduplicationWindowMs must be positive (current: " + deduplicationWindowMs + ")"
            );
        }
        if (deadLetterMaxSize <= 0) {
            throw new IllegalArgumentException(
                "deadLetterMaxSize must be positive (current: " + deadLetterMaxSize + ")"
            );
        }
        if (queryCacheTtlMs <= 0) {
            throw new IllegalArgumentException(
                "queryCacheTtlMs must be positive (current: " + queryCacheTtlMs + ")"
            );
        }
        if (sagaHistoryLimit < 0) {
            throw new IllegalArgumentException(
                "sagaHistoryLimit must be non-negative (current: " + sagaHistoryLimit + ")"
            );
        }
    }

    /**
     * 기본 설정.
     *
     * @return 기본값 인스턴스
     */
    public static CqrsEngineConfig defaults() {
        return new CqrsEngineConfig();
    }

    /**
     * snapshotInterval만 변경한 새 인스턴스 생성.
     */
    public CqrsEngineConfig withSnapshotInterval(int snapshotInterval) {
        return new CqrsEngineConfig(
            snapshotInterval, maxRetries, baseRetryDelayMs, maxRetryDelayMs, retryJitterFactor, deduplicationWindowMs, deadLetterMaxSize, queryCacheEnabled, queryCacheTtlMs, sagaHistoryLimit
        );
    }

    /**
     * maxRetries만 변경한 새 인스턴스 생성.
     */
    public CqrsEngineConfig withMaxRetries(int maxRetries) {
        return new CqrsEngineConfig(
            snapshotInterval, maxRetries, baseRetryDelayMs, maxRetryDelayMs, retryJitterFactor, deduplicationWindowMs, deadLetterMaxSize, queryCacheEnabled, queryCacheTtlMs, sagaHistoryLimit
        );
    }

    /**
     * baseRetryDelayMs만 변경한 새 인스턴스 생성.
     */
    public CqrsEngineConfig withBaseRetryDelayMs(long baseRetryDelayMs) {
        return new CqrsEngineConfig(
            snapshotInterval, maxRetries, baseRetryDelayMs, maxRetryDelayMs, retryJitterFactor, deduplicationWindowMs, deadLetterMaxSize, queryCacheEnabled, queryCacheTtlMs, sagaHistoryLimit
        );
    }

    /**
     * maxRetryDelayMs만 변경한 새 인스턴스 생성.
     */
    public CqrsEngineConfig withMaxRetryDelayMs(long maxRetryDelayMs) {
        return new CqrsEngineConfig(
            snapshotInterval, maxRetries, baseRetryDelayMs, maxRetryDelayMs, retryJitterFactor, deduplicationWindowMs, deadLetterMaxSize, queryCacheEnabled, queryCacheTtlMs, sagaHistoryLimit
        );
    }

    /**
     * retryJitterFactor만 변경한 새 인스턴스 생성.
     */
    public CqrsEngineConfig withRetryJitterFactor(double retryJitterFactor) {
        return new CqrsEngineConfig(
            snapshotInterval, maxRetries, baseRetryDelayMs, maxRetryDelayMs, retryJitterFactor, deduplicationWindowMs, deadLetterMaxSize, queryCacheEnabled, queryCacheTtlMs, sagaHistoryLimit
        );
    }

    /**
     * deduplicationWindowMs만 변경한 새 인스턴스 생성.
     */
    public CqrsEngineConfig withDeduplicationWindowMs(long deduplicationWindowMs) {
        return new CqrsEngineConfig(
            snapshotInterval, maxRetries, baseRetryDelayMs, maxRetryDelayMs, retryJitterFactor, deduplicationWindowMs, deadLetterMaxSize, queryCacheEnabled, queryCacheTtlMs, sagaHistoryLimit
        );
    }

    /**
     * deadLetterMaxSize만 변경한 새 인스턴스 생성.
     */
    public CqrsEngineConfig withDeadLetterMaxSize(int deadLetterMaxSize) {
        return new CqrsEngineConfig(
            snapshotInterval, maxRetries, baseRetryDelayMs, maxRetryDelayMs, retryJitterFactor, deduplicationWindowMs, deadLetterMaxSize, queryCacheEnabled, queryCacheTtlMs, sagaHistoryLimit
        );
    }

    /**
     * queryCacheEnabled만 변경한 새 인스턴스 생성.
     */
    public CqrsEngineConfig withQueryCacheEnabled(boolean queryCacheEnabled) {
        return new CqrsEngineConfig(
            snapshotInterval, maxRetries, baseRetryDelayMs, maxRetryDelayMs, retryJitterFactor, deduplicationWindowMs, deadLetterMaxSize, queryCacheEnabled, queryCacheTtlMs, sagaHistoryLimit
        );
    }

    /**
     * queryCacheTtlMs만 변경한 새 인스턴스 생성.
     */
    public CqrsEngineConfig withQueryCacheTtlMs(long queryCacheTtlMs) {
        return new CqrsEngineConfig(
            snapshotInterval, maxRetries, baseRetryDelayMs, maxRetryDelayMs, retryJitterFactor, deduplicationWindowMs, deadLetterMaxSize, queryCacheEnabled, queryCacheTtlMs, sagaHistoryLimit
        );
    }

    /**
     * sagaHistoryLimit만 변경한 새 인스턴스 생성.
     */
    public CqrsEngineConfig withSagaHistoryLimit(int sagaHistoryLimit) {
        return new CqrsEngineConfig(
            snapshotInterval, maxRetries, baseRetryDelayMs, maxRetryDelayMs, retryJitterFactor, deduplicationWindowMs, deadLetterMaxSize, queryCacheEnabled, queryCacheTtlMs, sagaHistoryLimit
        );
    }
}

package com.ryuqq.cqrs.application.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ryuqq.cqrs.application.middleware.MiddlewareChain;
import com.ryuqq.cqrs.core.config.CqrsEngineConfig;
import com.ryuqq.cqrs.core.contract.Query;
import com.ryuqq.cqrs.core.error.HandlerNotFoundException;
import com.ryuqq.cqrs.core.error.MiddlewareAbortedException;
import com.ryuqq.cqrs.core.error.QueryFailedException;
import com.ryuqq.cqrs.core.handler.Middleware;
import com.ryuqq.cqrs.core.handler.MiddlewareContext;
import com.ryuqq.cqrs.core.handler.QueryHandler;
import com.ryuqq.cqrs.core.model.Consistency;
import com.ryuqq.cqrs.core.outcome.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Query 디스패처 (결과 캐시 포함).
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * dispatch(query)
 *   ↓
 * 1. 핸들러 조회 → 없으면 HandlerNotFoundException
 *   ↓
 * 2. 캐시 사용 조건: 설정 활성화 + consistency != STRONG
 *    적중 (만료 전) → fromCache = true, executionMs = 0
 *   ↓
 * 3. 미들웨어 체인 → 핸들러
 *    abort → MiddlewareAbortedException
 *   ↓
 * 4. 결과 캐시 (TTL: Query 메타데이터 override, 없으면 설정 기본값)
 * </pre>
 *
 * <p><strong>캐시 키:</strong> queryType + params의 정규화 JSON (맵 키 정렬).
 * 같은 params는 키 삽입 순서와 무관하게 같은 캐시 항목을 가리킵니다.
 * params를 JSON으로 직렬화할 수 없으면 캐시를 사용하지 않습니다.</p>
 *
 * <p><strong>만료 항목 정리:</strong> 조회 시 만료된 항목은 즉시 제거되고,
 * 데몬 스레드가 {@code queryCacheTtlMs} 주기로 나머지 만료 항목을 정리합니다.
 * 사용이 끝나면 {@link #shutdown()}을 호출해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class QueryBus {

    private static final Logger log = LoggerFactory.getLogger(QueryBus.class);

    private final CqrsEngineConfig config;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, QueryHandler<?>> handlers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, CacheEntry>> cache = new ConcurrentHashMap<>();
    private final MiddlewareChain middlewares = new MiddlewareChain();
    private final ScheduledExecutorService sweeper;

    public QueryBus(CqrsEngineConfig config) {
        this(config, Clock.systemUTC());
    }

    public QueryBus(CqrsEngineConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cqrs-query-cache-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long period = config.queryCacheTtlMs();
        sweeper.scheduleAtFixedRate(this::sweep, period, period, TimeUnit.MILLISECONDS);
    }

    public void register(String queryType, QueryHandler<?> handler) {
        if (queryType == null || queryType.isBlank()) {
            throw new IllegalArgumentException("queryType cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (handlers.put(queryType, handler) != null) {
            log.warn("Overwriting query handler for {}", queryType);
            invalidateCache(queryType);
        } else {
            log.info("Registered query handler for {}", queryType);
        }
    }

    public void use(Middleware middleware) {
        middlewares.add(middleware);
    }

    public Set<String> getRegisteredQueries() {
        return Set.copyOf(handlers.keySet());
    }

    /**
     * 결과 타입을 지정하여 Query 디스패치.
     *
     * @param query Query
     * @param resultType 핸들러 결과 타입
     * @param <T> 결과 타입
     * @return 조회 결과
     * @throws ClassCastException 핸들러 결과가 resultType이 아닌 경우
     * @see #dispatch(Query)
     */
    public <T> QueryResult<T> dispatch(Query query, Class<T> resultType) {
        return dispatch(query).as(resultType);
    }

    /**
     * Query 디스패치.
     *
     * @param query Query
     * @return 조회 결과
     * @throws HandlerNotFoundException 핸들러가 없는 경우
     * @throws MiddlewareAbortedException 미들웨어가 중단한 경우
     * @throws QueryFailedException 핸들러가 checked 예외를 던진 경우
     */
    public QueryResult<Object> dispatch(Query query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }

        QueryHandler<?> handler = handlers.get(query.queryType());
        if (handler == null) {
            throw new HandlerNotFoundException("query", query.queryType());
        }

        boolean cacheable = config.queryCacheEnabled()
            && query.metadata().consistency() != Consistency.STRONG;
        String cacheKey = cacheable ? cacheKey(query) : null;

        if (cacheKey != null) {
            Map<String, CacheEntry> entries = cacheFor(query.queryType());
            CacheEntry entry = entries.get(cacheKey);
            if (entry != null) {
                if (entry.isLiveAt(clock.instant())) {
                    log.debug("Query {} served from cache", query.queryType());
                    return QueryResult.cached(query.queryId(), entry.data(), entry.expiresAt());
                }
                entries.remove(cacheKey, entry);
            }
        }

        MiddlewareContext context = MiddlewareContext.forQuery(query, clock);
        Object[] data = new Object[1];
        try {
            middlewares.execute(context, () -> {
                data[0] = handler.handle(query, context);
                context.setResult(data[0]);
            });
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new QueryFailedException(query.queryType(), e);
        }

        if (context.isAborted()) {
            throw new MiddlewareAbortedException(context.getAbortReason());
        }

        long executionMs = context.elapsedMillis();
        Instant staleAt = null;
        if (cacheKey != null) {
            long ttl = query.metadata().cacheTtlMs() != null
                ? query.metadata().cacheTtlMs()
                : config.queryCacheTtlMs();
            staleAt = clock.instant().plusMillis(ttl);
            cacheFor(query.queryType()).put(cacheKey, new CacheEntry(data[0], staleAt));
        }
        return QueryResult.executed(query.queryId(), data[0], executionMs, staleAt);
    }

    public void invalidateCache(String queryType) {
        if (cache.remove(queryType) != null) {
            log.debug("Invalidated query cache for {}", queryType);
        }
    }

    public void invalidateCache() {
        cache.clear();
        log.debug("Invalidated all query cache entries");
    }

    /**
     * 만료된 캐시 항목 제거.
     *
     * @return 제거된 항목 수
     */
    public int pruneExpiredCache() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map<String, CacheEntry> entries : cache.values()) {
            for (Map.Entry<String, CacheEntry> entry : entries.entrySet()) {
                if (!entry.getValue().isLiveAt(now) && entries.remove(entry.getKey(), entry.getValue())) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("Pruned {} expired query cache entr(ies)", removed);
        }
        return removed;
    }

    public void shutdown() {
        sweeper.shutdown();
        try {
            if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                sweeper.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweeper.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isShutdown() {
        return sweeper.isShutdown();
    }

    private void sweep() {
        try {
            pruneExpiredCache();
        } catch (RuntimeException e) {
            log.error("Query cache sweep failed", e);
        }
    }

    private ConcurrentHashMap<String, CacheEntry> cacheFor(String queryType) {
        return cache.computeIfAbsent(queryType, key -> new ConcurrentHashMap<>());
    }

    private String cacheKey(Query query) {
        try {
            return objectMapper.writeValueAsString(query.params().asMap());
        } catch (JsonProcessingException e) {
            log.debug("Query {} params are not serializable, bypassing cache: {}",
                query.queryType(), e.getOriginalMessage());
            return null;
        }
    }

    private record CacheEntry(Object data, Instant expiresAt) {

        boolean isLiveAt(Instant now) {
            return now.isBefore(expiresAt);
        }
    }

    Map<String, Integer> cacheSizes() {
        Map<String, Integer> sizes = new ConcurrentHashMap<>();
        cache.forEach((type, entries) -> sizes.put(type, entries.size()));
        return sizes;
    }
}

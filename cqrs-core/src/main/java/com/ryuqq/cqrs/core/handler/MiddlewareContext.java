package com.ryuqq.cqrs.core.handler;

import com.ryuqq.cqrs.core.contract.Command;
import com.ryuqq.cqrs.core.contract.Query;
import com.ryuqq.cqrs.core.model.Payload;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 단일 Command 시도 또는 Query 처리에 대한 미들웨어 컨텍스트.
 *
 * <p>Command의 경우 시도마다 새 컨텍스트가 만들어지므로, 한 시도에서의 abort나
 * 속성은 다음 시도로 이어지지 않습니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 하나의 디스패치 스레드에서만 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MiddlewareContext {

    private final Command command;
    private final Query query;
    private final int attempt;
    private final Instant startedAt;
    private final Clock clock;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private Object result;
    private boolean aborted;
    private String abortReason;

    private MiddlewareContext(Command command, Query query, int attempt, Clock clock) {
        this.command = command;
        this.query = query;
        this.attempt = attempt;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    /**
     * Command 시도용 컨텍스트 생성.
     *
     * @param command 시도 번호가 설정된 Command
     * @param attempt 시도 번호 (0부터)
     * @param clock 시계
     * @return 새 컨텍스트
     */
    public static MiddlewareContext forCommand(Command command, int attempt, Clock clock) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative (current: " + attempt + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return new MiddlewareContext(command, null, attempt, clock);
    }

    /**
     * Query용 컨텍스트 생성.
     *
     * @param query Query
     * @param clock 시계
     * @return 새 컨텍스트
     */
    public static MiddlewareContext forQuery(Query query, Clock clock) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return new MiddlewareContext(null, query, 0, clock);
    }

    public boolean isCommand() {
        return command != null;
    }

    public Optional<Command> getCommand() {
        return Optional.ofNullable(command);
    }

    public Optional<Query> getQuery() {
        return Optional.ofNullable(query);
    }

    /**
     * commandType 또는 queryType.
     */
    public String getRequestType() {
        return isCommand() ? command.commandType() : query.queryType();
    }

    /**
     * commandId 또는 queryId.
     */
    public String getRequestId() {
        return isCommand() ? command.commandId() : query.queryId();
    }

    /**
     * Command payload 또는 Query params.
     */
    public Payload getPayload() {
        return isCommand() ? command.payload() : query.params();
    }

    public String getCorrelationId() {
        return isCommand() ? command.metadata().correlationId() : query.metadata().correlationId();
    }

    public String getUserId() {
        return isCommand() ? command.metadata().userId() : query.metadata().userId();
    }

    public String getTenantId() {
        return isCommand() ? command.metadata().tenantId() : query.metadata().tenantId();
    }

    public int getAttempt() {
        return attempt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    /**
     * 컨텍스트 생성 이후 경과 시간 (밀리초).
     */
    public long elapsedMillis() {
        return Math.max(0L, clock.millis() - startedAt.toEpochMilli());
    }

    public Object getResult() {
        return result;
    }

    public void setResult(Object result) {
        this.result = result;
    }

    public void setAttribute(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        attributes.put(key, value);
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * 처리 중단.
     *
     * <p>중단된 컨텍스트는 이후 미들웨어와 핸들러를 호출하지 않습니다.
     * 먼저 기록된 사유가 유지됩니다.</p>
     *
     * @param reason 중단 사유
     * @throws IllegalArgumentException reason이 비어있는 경우
     */
    public void abort(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (!aborted) {
            this.aborted = true;
            this.abortReason = reason;
        }
    }

    public boolean isAborted() {
        return aborted;
    }

    public String getAbortReason() {
        return abortReason;
    }

    @Override
    public String toString() {
        return "MiddlewareContext{" +
            "requestType=" + getRequestType() +
            ", requestId=" + getRequestId() +
            ", attempt=" + attempt +
            ", aborted=" + aborted +
            '}';
    }
}

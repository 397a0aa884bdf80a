package com.ryuqq.cqrs.application.command;

import com.ryuqq.cqrs.application.middleware.MiddlewareChain;
import com.ryuqq.cqrs.application.support.BackoffCalculator;
import com.ryuqq.cqrs.core.config.CqrsEngineConfig;
import com.ryuqq.cqrs.core.contract.Command;
import com.ryuqq.cqrs.core.error.ConcurrencyException;
import com.ryuqq.cqrs.core.handler.CommandHandler;
import com.ryuqq.cqrs.core.handler.Middleware;
import com.ryuqq.cqrs.core.handler.MiddlewareContext;
import com.ryuqq.cqrs.core.model.IdempotencyKey;
import com.ryuqq.cqrs.core.outcome.CommandResult;
import com.ryuqq.cqrs.core.outcome.ErrorCode;
import com.ryuqq.cqrs.core.spi.DeadLetterQueue;
import com.ryuqq.cqrs.core.spi.DeduplicationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Command 디스패처.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * dispatch(command)
 *   ↓
 * 1. 멱등성 캐시 확인 → 적중 시 캐시된 결과 그대로 반환
 *   ↓
 * 2. 핸들러 조회 → 없으면 HANDLER_NOT_FOUND (재시도/DLQ 없음)
 *   ↓
 * 3. attempt = 0..maxRetries:
 *      새 MiddlewareContext → 미들웨어 체인 → 핸들러
 *      - abort              → MIDDLEWARE_ABORTED (재시도 없음)
 *      - ConcurrencyException → CONCURRENCY_CONFLICT, retriable (재시도/DLQ 없음)
 *      - 그 외 예외          → backoff 후 재시도
 *   ↓
 * 4. 성공 + 멱등성 키 → now + deduplicationWindow까지 캐시
 *    재시도 소진         → 원본 Command를 DLQ로, RETRIES_EXHAUSTED
 * </pre>
 *
 * <p><strong>멱등성 캐시 정리:</strong> deduplicationWindowMs 주기로 데몬 스레드가
 * 만료 항목을 제거합니다. {@link #shutdown()}으로 중지합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CommandBus {

    private static final Logger log = LoggerFactory.getLogger(CommandBus.class);

    private final CqrsEngineConfig config;
    private final DeadLetterQueue deadLetterQueue;
    private final DeduplicationStore deduplicationStore;
    private final BackoffCalculator backoffCalculator;
    private final Clock clock;
    private final ConcurrentHashMap<String, CommandHandler> handlers = new ConcurrentHashMap<>();
    private final MiddlewareChain middlewares = new MiddlewareChain();
    private final ScheduledExecutorService sweeper;

    public CommandBus(CqrsEngineConfig config, DeadLetterQueue deadLetterQueue, DeduplicationStore deduplicationStore) {
        this(config, deadLetterQueue, deduplicationStore, Clock.systemUTC());
    }

    /**
     * 생성자 (설정값으로 BackoffCalculator 구성).
     *
     * @param config 엔진 설정
     * @param deadLetterQueue DLQ
     * @param deduplicationStore 멱등성 캐시
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CommandBus(
        CqrsEngineConfig config,
        DeadLetterQueue deadLetterQueue,
        DeduplicationStore deduplicationStore,
        Clock clock
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (deadLetterQueue == null) {
            throw new IllegalArgumentException("deadLetterQueue cannot be null");
        }
        if (deduplicationStore == null) {
            throw new IllegalArgumentException("deduplicationStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        this.config = config;
        this.deadLetterQueue = deadLetterQueue;
        this.deduplicationStore = deduplicationStore;
        this.clock = clock;
        this.backoffCalculator = BackoffCalculator.forCommands(config);
        this.sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cqrs-dedup-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long window = config.deduplicationWindowMs();
        sweeper.scheduleAtFixedRate(this::sweep, window, window, TimeUnit.MILLISECONDS);
    }

    /**
     * 핸들러 등록 (기존 핸들러는 경고 후 교체).
     */
    public void register(String commandType, CommandHandler handler) {
        if (commandType == null || commandType.isBlank()) {
            throw new IllegalArgumentException("commandType cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (handlers.put(commandType, handler) != null) {
            log.warn("Overwriting command handler for {}", commandType);
        } else {
            log.info("Registered command handler for {}", commandType);
        }
    }

    public void use(Middleware middleware) {
        middlewares.add(middleware);
    }

    public Set<String> getRegisteredCommands() {
        return Set.copyOf(handlers.keySet());
    }

    /**
     * Command 디스패치.
     *
     * @param command Command
     * @return 처리 결과 (실패도 결과로 반환, 예외를 던지지 않음)
     */
    public CommandResult dispatch(Command command) {
        return dispatchWithOutcome(command).result();
    }

    /**
     * Command 디스패치 (중복 제거 여부 포함).
     *
     * @param command Command
     * @return 결과와 캐시 적중 여부
     */
    public DispatchOutcome dispatchWithOutcome(Command command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }

        IdempotencyKey key = command.metadata().idempotencyKey();
        if (key != null) {
            Optional<CommandResult> cached = deduplicationStore.find(key, clock.instant());
            if (cached.isPresent()) {
                log.debug("Command {} deduplicated by key {}", command.commandId(), key.getValue());
                return new DispatchOutcome(cached.get(), true);
            }
        }
        return new DispatchOutcome(execute(command, true), false);
    }

    /**
     * DLQ 재처리용 디스패치.
     *
     * <p>멱등성 캐시를 확인하지 않고, 재시도 소진 시 DLQ로 보내지 않습니다.
     * 성공 결과는 멱등성 키가 있으면 캐시됩니다.</p>
     *
     * @param command DLQ에 보관된 원본 Command
     * @return 처리 결과
     */
    public CommandResult replay(Command command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return execute(command, false);
    }

    /**
     * 만료된 멱등성 캐시 항목 제거.
     *
     * @return 제거된 항목 수
     */
    public int pruneDeduplicationCache() {
        int removed = deduplicationStore.pruneExpired(clock.instant());
        if (removed > 0) {
            log.debug("Pruned {} expired deduplication entr(ies)", removed);
        }
        return removed;
    }

    /**
     * 캐시 정리 스케줄러 종료.
     */
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

    private CommandResult execute(Command command, boolean routeToDeadLetter) {
        CommandHandler handler = handlers.get(command.commandType());
        if (handler == null) {
            log.warn("No handler registered for command type {}", command.commandType());
            return CommandResult.failure(
                command.commandId(), ErrorCode.HANDLER_NOT_FOUND,
                "No handler for command: " + command.commandType(), false
            );
        }

        int maxRetries = command.metadata().maxRetries() != null
            ? command.metadata().maxRetries()
            : config.maxRetries();

        Exception lastError = null;
        int attempts = 0;
        while (attempts <= maxRetries) {
            int attempt = attempts++;
            try {
                CommandResult result = attempt(command, handler, attempt);
                if (result.success() && command.metadata().idempotencyKey() != null) {
                    deduplicationStore.record(
                        command.metadata().idempotencyKey(),
                        result,
                        clock.instant().plusMillis(config.deduplicationWindowMs())
                    );
                }
                return result;
            } catch (ConcurrencyException e) {
                log.info("Command {} hit a concurrency conflict: {}", command.commandId(), e.getMessage());
                return CommandResult.failure(command.commandId(), ErrorCode.CONCURRENCY_CONFLICT, e.getMessage(), true);
            } catch (Exception e) {
                lastError = e;
                if (attempt >= maxRetries) {
                    break;
                }
                long delay = backoffCalculator.calculate(attempt + 1);
                log.warn("Command {} ({}) failed on attempt {}, retrying in {}ms: {}",
                    command.commandId(), command.commandType(), attempt + 1, delay, e.getMessage());
                if (!sleep(delay)) {
                    log.warn("Retry of command {} interrupted after {} attempt(s)", command.commandId(), attempts);
                    break;
                }
            }
        }

        String error = describe(lastError);
        if (routeToDeadLetter) {
            deadLetterQueue.enqueue(command, error, attempts);
        } else {
            log.warn("Replay of command {} failed after {} attempt(s): {}", command.commandId(), attempts, error);
        }
        return CommandResult.failure(command.commandId(), ErrorCode.RETRIES_EXHAUSTED, error, false);
    }

    private CommandResult attempt(Command command, CommandHandler handler, int attempt) throws Exception {
        Command attemptCommand = command.withRetryCount(attempt);
        MiddlewareContext context = MiddlewareContext.forCommand(attemptCommand, attempt, clock);
        CommandResult[] result = new CommandResult[1];

        middlewares.execute(context, () -> {
            result[0] = handler.handle(attemptCommand, context);
            context.setResult(result[0]);
        });

        if (context.isAborted()) {
            log.info("Command {} aborted by middleware: {}", command.commandId(), context.getAbortReason());
            return CommandResult.failure(
                command.commandId(), ErrorCode.MIDDLEWARE_ABORTED, context.getAbortReason(), false
            );
        }
        if (result[0] == null) {
            throw new IllegalStateException("Handler for " + command.commandType() + " returned no result");
        }
        return result[0];
    }

    private void sweep() {
        try {
            pruneDeduplicationCache();
        } catch (RuntimeException e) {
            log.error("Deduplication cache sweep failed", e);
        }
    }

    private static String describe(Exception error) {
        if (error == null) {
            return "Unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    /**
     * 재시도 대기.
     *
     * <p>InterruptedException 발생 시 인터럽트 플래그를 복원하고 false를 반환합니다.</p>
     *
     * @param millis 대기 시간 (밀리초)
     * @return 대기를 끝까지 마쳤으면 true
     */
    private boolean sleep(long millis) {
        if (millis <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

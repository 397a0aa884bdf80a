package com.ryuqq.cqrs.application.middleware;

import com.ryuqq.cqrs.core.handler.Middleware;
import com.ryuqq.cqrs.core.handler.MiddlewareContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 요청 시작/종료/실패를 기록하는 미들웨어.
 *
 * <p>실패는 기록 후 그대로 다시 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class LoggingMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(LoggingMiddleware.class);

    @Override
    public void handle(MiddlewareContext context, Next next) throws Exception {
        String kind = context.isCommand() ? "command" : "query";
        log.debug("Handling {} {} (id={}, attempt={})",
            kind, context.getRequestType(), context.getRequestId(), context.getAttempt());
        try {
            next.proceed();
        } catch (Exception e) {
            log.error("{} {} (id={}) failed after {}ms: {}",
                kind, context.getRequestType(), context.getRequestId(), context.elapsedMillis(), e.getMessage());
            throw e;
        }
        if (context.isAborted()) {
            log.info("{} {} (id={}) aborted: {}",
                kind, context.getRequestType(), context.getRequestId(), context.getAbortReason());
        } else {
            log.debug("Handled {} {} (id={}) in {}ms",
                kind, context.getRequestType(), context.getRequestId(), context.elapsedMillis());
        }
    }
}

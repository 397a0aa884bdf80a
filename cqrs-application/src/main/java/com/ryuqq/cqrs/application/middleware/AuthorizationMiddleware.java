package com.ryuqq.cqrs.application.middleware;

import com.ryuqq.cqrs.core.handler.Middleware;
import com.ryuqq.cqrs.core.handler.MiddlewareContext;

/**
 * {@link Authorizer} 판정에 따라 요청을 중단하는 미들웨어.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AuthorizationMiddleware implements Middleware {

    private final Authorizer authorizer;

    public AuthorizationMiddleware(Authorizer authorizer) {
        if (authorizer == null) {
            throw new IllegalArgumentException("authorizer cannot be null");
        }
        this.authorizer = authorizer;
    }

    @Override
    public void handle(MiddlewareContext context, Next next) throws Exception {
        if (!authorizer.isAllowed(context)) {
            context.abort("Unauthorized: user " + context.getUserId() + " may not " + context.getRequestType());
            return;
        }
        next.proceed();
    }
}

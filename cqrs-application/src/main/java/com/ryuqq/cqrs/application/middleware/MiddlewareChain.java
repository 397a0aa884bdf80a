package com.ryuqq.cqrs.application.middleware;

import com.ryuqq.cqrs.core.handler.Middleware;
import com.ryuqq.cqrs.core.handler.MiddlewareContext;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 등록 순서대로 미들웨어를 실행하고 마지막에 핸들러를 호출하는 체인.
 *
 * <p><strong>실행 규칙:</strong></p>
 * <ul>
 *   <li>컨텍스트가 중단(abort)되면 이후 미들웨어와 핸들러는 호출되지 않음</li>
 *   <li>한 미들웨어가 next를 두 번 호출하면 {@link IllegalStateException}</li>
 *   <li>실행 중 등록된 미들웨어는 다음 실행부터 적용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MiddlewareChain {

    private final List<Middleware> middlewares = new CopyOnWriteArrayList<>();

    public void add(Middleware middleware) {
        if (middleware == null) {
            throw new IllegalArgumentException("middleware cannot be null");
        }
        middlewares.add(middleware);
    }

    public int size() {
        return middlewares.size();
    }

    /**
     * 체인 실행.
     *
     * @param context 요청 컨텍스트
     * @param handler 체인 끝에서 호출될 핸들러 단계
     * @throws Exception 미들웨어 또는 핸들러가 던진 예외
     */
    public void execute(MiddlewareContext context, Middleware.Next handler) throws Exception {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        invoke(List.copyOf(middlewares), 0, context, handler);
    }

    private void invoke(List<Middleware> snapshot, int index, MiddlewareContext context, Middleware.Next handler)
        throws Exception {
        if (context.isAborted()) {
            return;
        }
        if (index == snapshot.size()) {
            handler.proceed();
            return;
        }

        Middleware middleware = snapshot.get(index);
        boolean[] proceeded = {false};
        middleware.handle(context, () -> {
            if (proceeded[0]) {
                throw new IllegalStateException(
                    "next() called more than once by " + middleware.getClass().getName()
                );
            }
            proceeded[0] = true;
            invoke(snapshot, index + 1, context, handler);
        });
    }
}

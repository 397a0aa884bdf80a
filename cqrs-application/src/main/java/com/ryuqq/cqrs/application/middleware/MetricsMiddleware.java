package com.ryuqq.cqrs.application.middleware;

import com.ryuqq.cqrs.core.handler.Middleware;
import com.ryuqq.cqrs.core.handler.MiddlewareContext;

/**
 * 처리 시간과 성공 여부를 {@link MetricsRecorder}로 보내는 미들웨어.
 *
 * <p>중단(abort)된 요청과 예외로 끝난 요청은 실패로 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MetricsMiddleware implements Middleware {

    private final MetricsRecorder recorder;

    public MetricsMiddleware(MetricsRecorder recorder) {
        if (recorder == null) {
            throw new IllegalArgumentException("recorder cannot be null");
        }
        this.recorder = recorder;
    }

    @Override
    public void handle(MiddlewareContext context, Next next) throws Exception {
        boolean success = false;
        try {
            next.proceed();
            success = !context.isAborted();
        } finally {
            recorder.record(context.getRequestType(), context.elapsedMillis(), success);
        }
    }
}

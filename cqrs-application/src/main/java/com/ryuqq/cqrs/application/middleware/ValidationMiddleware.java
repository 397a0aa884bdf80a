package com.ryuqq.cqrs.application.middleware;

import com.ryuqq.cqrs.core.handler.Middleware;
import com.ryuqq.cqrs.core.handler.MiddlewareContext;
import com.ryuqq.cqrs.core.model.PayloadValidator;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 요청 유형별 Payload 검증 미들웨어.
 *
 * <p>검증기가 등록되지 않은 유형은 그대로 통과합니다. 검증 오류가 있으면
 * {@code "Validation failed: <오류1>, <오류2>"} 사유로 중단합니다.</p>
 *
 * <pre>
 * ValidationMiddleware validation = new ValidationMiddleware()
 *     .register("CreateOrder", PayloadSchema.builder()
 *         .required("customerId", String.class)
 *         .required("total", Number.class)
 *         .build());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ValidationMiddleware implements Middleware {

    private final ConcurrentHashMap<String, PayloadValidator> validators = new ConcurrentHashMap<>();

    public ValidationMiddleware register(String requestType, PayloadValidator validator) {
        if (requestType == null || requestType.isBlank()) {
            throw new IllegalArgumentException("requestType cannot be null or blank");
        }
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        validators.put(requestType, validator);
        return this;
    }

    @Override
    public void handle(MiddlewareContext context, Next next) throws Exception {
        PayloadValidator validator = validators.get(context.getRequestType());
        if (validator != null) {
            List<String> errors = validator.validate(context.getPayload());
            if (!errors.isEmpty()) {
                context.abort("Validation failed: " + String.join(", ", errors));
                return;
            }
        }
        next.proceed();
    }
}

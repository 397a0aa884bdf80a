package com.ryuqq.cqrs.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command/Query 유형별 Payload 스키마.
 *
 * <p>필수/선택 필드와 각 필드의 값 타입을 선언하고, 핸들러 경계에서
 * (ValidationMiddleware를 통해) Payload를 검증합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * PayloadSchema schema = PayloadSchema.builder()
 *     .required("orderId", String.class)
 *     .required("total", Number.class)
 *     .optional("note", String.class)
 *     .build();
 *
 * List&lt;String&gt; errors = schema.validate(command.payload());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PayloadSchema implements PayloadValidator {

    private final Map<String, Field> fields;
    private final boolean allowUnknownFields;

    private PayloadSchema(Map<String, Field> fields, boolean allowUnknownFields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.allowUnknownFields = allowUnknownFields;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<String> validate(Payload payload) {
        Payload target = payload == null ? Payload.empty() : payload;
        List<String> errors = new ArrayList<>();

        for (Field field : fields.values()) {
            Object value = target.get(field.name());
            if (value == null) {
                if (field.required()) {
                    errors.add(field.name() + " is required");
                }
                continue;
            }
            if (!field.type().isInstance(value)) {
                errors.add(field.name() + " must be of type " + field.type().getSimpleName());
            }
        }

        if (!allowUnknownFields) {
            for (String key : target.keys()) {
                if (!fields.containsKey(key)) {
                    errors.add(key + " is not a known field");
                }
            }
        }
        return errors;
    }

    public Map<String, Field> getFields() {
        return fields;
    }

    /**
     * 스키마 필드 선언.
     *
     * @param name 필드명
     * @param type 허용 값 타입
     * @param required 필수 여부
     */
    public record Field(String name, Class<?> type, boolean required) {

        public Field {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (type == null) {
                throw new IllegalArgumentException("type cannot be null");
            }
        }
    }

    /**
     * PayloadSchema Builder.
     */
    public static final class Builder {

        private final Map<String, Field> fields = new LinkedHashMap<>();
        private boolean allowUnknownFields = true;

        private Builder() {
        }

        public Builder required(String name, Class<?> type) {
            fields.put(name, new Field(name, type, true));
            return this;
        }

        public Builder optional(String name, Class<?> type) {
            fields.put(name, new Field(name, type, false));
            return this;
        }

        /**
         * 선언되지 않은 필드를 거부하도록 설정.
         */
        public Builder strict() {
            this.allowUnknownFields = false;
            return this;
        }

        public PayloadSchema build() {
            return new PayloadSchema(fields, allowUnknownFields);
        }
    }
}

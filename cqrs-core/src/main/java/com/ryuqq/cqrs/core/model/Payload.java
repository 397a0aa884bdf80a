package com.ryuqq.cqrs.core.model;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Command, Query, Event에 실리는 업무 데이터 및 Aggregate/Projection 상태.
 *
 * <p>Payload는 문자열 키를 가진 순서 보존 맵이며, 생성 시점에 중첩된 Map/Collection/배열까지
 * 모두 불변 사본으로 고정됩니다. Set은 순서 보존 불변 Set으로, 그 밖의 Collection과 배열은
 * 불변 List로 복사됩니다. 따라서 한 번 저장된 이벤트의 payload는 이후 어떤 경로로도 변경될 수 없습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Payload payload = Payload.builder()
 *     .put("orderId", "ORDER-123")
 *     .put("total", 100)
 *     .build();
 *
 * Payload next = payload.with("status", "created");
 * </pre>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가 ({@link #with(String, Object)}는 새 인스턴스 반환)</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>키: null 또는 빈 문자열 불가</li>
 *   <li>값: null 허용</li>
 *   <li>중첩 Map의 키는 문자열이어야 함</li>
 *   <li>컨테이너가 아닌 값은 그대로 저장되므로 불변 타입(String, Number, Boolean, java.time 등)이어야 함</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(Collections.emptyMap());

    private final Map<String, Object> values;

    private Payload(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * Map으로부터 Payload 생성 (깊은 불변 사본).
     *
     * @param values 원본 맵 (null이면 빈 Payload)
     * @return Payload 인스턴스
     * @throws IllegalArgumentException 키가 null이거나 빈 문자열인 경우
     */
    public static Payload of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new Payload(freezeMap(values));
    }

    /**
     * 단일 키-값 Payload 생성.
     *
     * @param key 키
     * @param value 값 (null 허용)
     * @return Payload 인스턴스
     */
    public static Payload of(String key, Object value) {
        return builder().put(key, value).build();
    }

    /**
     * 빈 Payload.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return EMPTY;
    }

    /**
     * Builder 생성.
     *
     * @return 새 Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 값 조회.
     *
     * @param key 키
     * @return 값 (없으면 null)
     */
    public Object get(String key) {
        return values.get(key);
    }

    /**
     * 문자열 값 조회.
     *
     * @param key 키
     * @return 문자열 값 (없으면 null)
     * @throws IllegalStateException 값이 문자열이 아닌 경우
     */
    public String getString(String key) {
        return typed(key, String.class);
    }

    /**
     * 숫자 값 조회.
     *
     * @param key 키
     * @return 숫자 값 (없으면 null)
     * @throws IllegalStateException 값이 숫자가 아닌 경우
     */
    public Number getNumber(String key) {
        return typed(key, Number.class);
    }

    /**
     * 불리언 값 조회.
     *
     * @param key 키
     * @return 불리언 값 (없으면 null)
     * @throws IllegalStateException 값이 불리언이 아닌 경우
     */
    public Boolean getBoolean(String key) {
        return typed(key, Boolean.class);
    }

    /**
     * 필수 문자열 값 조회.
     *
     * @param key 키
     * @return 문자열 값
     * @throws IllegalStateException 값이 없거나 문자열이 아닌 경우
     */
    public String requireString(String key) {
        String value = getString(key);
        if (value == null) {
            throw new IllegalStateException("Payload field '" + key + "' is required");
        }
        return value;
    }

    /**
     * 필수 숫자 값 조회.
     *
     * @param key 키
     * @return 숫자 값
     * @throws IllegalStateException 값이 없거나 숫자가 아닌 경우
     */
    public Number requireNumber(String key) {
        Number value = getNumber(key);
        if (value == null) {
            throw new IllegalStateException("Payload field '" + key + "' is required");
        }
        return value;
    }

    /**
     * 키 존재 여부.
     *
     * @param key 키
     * @return 존재하면 true (값이 null이어도 true)
     */
    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /**
     * 키를 추가/교체한 새 Payload 반환.
     *
     * @param key 키
     * @param value 값 (null 허용)
     * @return 새 Payload 인스턴스
     */
    public Payload with(String key, Object value) {
        return builder().putAll(this).put(key, value).build();
    }

    /**
     * 다른 Payload의 모든 키를 덮어쓴 새 Payload 반환.
     *
     * @param other 병합할 Payload
     * @return 새 Payload 인스턴스
     */
    public Payload merge(Payload other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        return builder().putAll(this).putAll(other).build();
    }

    /**
     * 불변 Map 뷰.
     *
     * @return 불변 맵
     */
    public Map<String, Object> asMap() {
        return values;
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    private <T> T typed(String key, Class<T> type) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException(
                "Payload field '" + key + "' is " + value.getClass().getSimpleName() + ", expected " + type.getSimpleName()
            );
        }
        return type.cast(value);
    }

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            if (!(entry.getKey() instanceof String key) || key.isBlank()) {
                throw new IllegalArgumentException("Payload keys must be non-blank strings (current: " + entry.getKey() + ")");
            }
            copy.put(key, freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Payload payload) {
            return payload.values;
        }
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            for (Object element : set) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableSet(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value != null && value.getClass().isArray()) {
            // 배열은 원소를 복사한 불변 List로 저장
            int length = Array.getLength(value);
            List<Object> copy = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                copy.add(freeze(Array.get(value, i)));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return values.equals(payload.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Payload" + values;
    }

    /**
     * Payload Builder (삽입 순서 보존).
     */
    public static final class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, Object value) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("key cannot be null or blank");
            }
            values.put(key, value);
            return this;
        }

        public Builder putAll(Payload payload) {
            if (payload != null) {
                values.putAll(payload.values);
            }
            return this;
        }

        public Payload build() {
            return Payload.of(values);
        }
    }
}

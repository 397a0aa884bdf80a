package com.ryuqq.cqrs.core.model;

import java.util.List;

/**
 * Payload 유효성 검증기.
 *
 * <p>검증 오류 메시지 목록을 반환하며, 빈 목록은 유효함을 의미합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PayloadValidator {

    /**
     * Payload 검증.
     *
     * @param payload 검증 대상 (null 아님)
     * @return 오류 메시지 목록 (유효하면 빈 목록)
     */
    List<String> validate(Payload payload);
}

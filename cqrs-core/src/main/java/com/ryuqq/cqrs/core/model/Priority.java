package com.ryuqq.cqrs.core.model;

/**
 * Command 우선순위.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Priority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}

package com.ryuqq.cqrs.core.error;

/**
 * 등록되지 않은 Projection.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ProjectionNotFoundException extends CqrsException {

    public ProjectionNotFoundException(String name) {
        super("Projection not found: " + name);
    }
}

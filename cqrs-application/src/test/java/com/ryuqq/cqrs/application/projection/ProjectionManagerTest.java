package com.ryuqq.cqrs.application.projection;

import com.ryuqq.cqrs.adapter.inmemory.store.InMemoryEventStore;
import com.ryuqq.cqrs.core.contract.DomainEvent;
import com.ryuqq.cqrs.core.contract.ProjectionDefinition;
import com.ryuqq.cqrs.core.error.ProjectionNotFoundException;
import com.ryuqq.cqrs.core.handler.ProjectionHandler;
import com.ryuqq.cqrs.core.model.Payload;
import com.ryuqq.cqrs.core.outcome.HandlerFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ProjectionManager 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ProjectionManagerTest {

    private static final ProjectionHandler REVENUE = (event, state) -> {
        Number total = state.getNumber("revenue");
        Number amount = event.payload().getNumber("total");
        return state
            .with("revenue", (total == null ? 0 : total.intValue()) + (amount == null ? 0 : amount.intValue()))
            .with("lastOrder", event.aggregateId());
    };

    private InMemoryEventStore eventStore;
    private ProjectionManager manager;

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore();
        manager = new ProjectionManager();
        manager.register(ProjectionDefinition.of("revenue", Set.of("OrderCreated"), REVENUE, Payload.of("revenue", 0)));
    }

    @Test
    void 반응하는_이벤트만_적용하고_위치를_증가() {
        // when
        manager.apply(event("order-1", "OrderCreated", 100));
        manager.apply(event("order-1", "OrderShipped", 0));
        manager.apply(event("order-2", "OrderCreated", 50));

        // then
        assertThat(manager.getState("revenue").getNumber("revenue")).isEqualTo(150);
        assertThat(manager.getState("revenue").getString("lastOrder")).isEqualTo("order-2");
        assertThat(manager.getPosition("revenue")).isEqualTo(2);
    }

    @Test
    void 와일드카드_Projection은_모든_이벤트에_반응() {
        // given
        manager.register(ProjectionDefinition.of("counter", Set.of(ProjectionDefinition.WILDCARD),
            (event, state) -> state.with("count", state.getNumber("count").intValue() + 1), Payload.of("count", 0)));

        // when
        manager.apply(event("order-1", "OrderCreated", 1));
        manager.apply(event("order-1", "OrderShipped", 0));

        // then
        assertThat(manager.getState("counter").getNumber("count")).isEqualTo(2);
    }

    @Test
    void 한_Projection의_실패는_다른_Projection에_영향_없음() {
        // given
        manager.register(ProjectionDefinition.of("broken", Set.of("OrderCreated"), (event, state) -> {
            throw new IllegalStateException("read model offline");
        }, null));
        DomainEvent created = event("order-1", "OrderCreated", 100);

        // when
        List<HandlerFailure> failures = manager.apply(created);

        // then
        assertThat(failures).singleElement().satisfies(failure -> {
            assertThat(failure.source()).isEqualTo("projection:broken");
            assertThat(failure.eventId()).isEqualTo(created.eventId());
            assertThat(failure.message()).isEqualTo("read model offline");
        });
        assertThat(manager.getState("revenue").getNumber("revenue")).isEqualTo(100);
        assertThat(manager.getPosition("broken")).isZero();
    }

    @Test
    void 재구성_결과는_증분_적용_결과와_같음() {
        // given
        List<DomainEvent> events = List.of(
            event("order-1", "OrderCreated", 100),
            event("order-2", "OrderCreated", 30),
            event("order-1", "OrderShipped", 0),
            event("order-3", "OrderCreated", 7)
        );
        for (DomainEvent event : events) {
            eventStore.append(List.of(event));
            manager.apply(event);
        }
        Payload incremental = manager.getState("revenue");
        long incrementalPosition = manager.getPosition("revenue");

        // when
        manager.rebuild("revenue", eventStore);

        // then
        assertThat(manager.getState("revenue")).isEqualTo(incremental);
        assertThat(manager.getPosition("revenue")).isEqualTo(incrementalPosition);
    }

    @Test
    void 재구성은_잘못된_상태를_로그로부터_복구() {
        // given
        DomainEvent created = event("order-1", "OrderCreated", 40);
        eventStore.append(List.of(created));
        manager.apply(created);
        manager.apply(created);

        // when
        manager.rebuild("revenue", eventStore);

        // then
        assertThat(manager.getState("revenue").getNumber("revenue")).isEqualTo(40);
        assertThat(manager.getPosition("revenue")).isEqualTo(1);
    }

    @Test
    void 재구성_중_예외가_나면_기존_상태_유지() {
        // given
        manager.register(ProjectionDefinition.of("fragile", Set.of("OrderCreated"), (event, state) -> {
            if (event.payload().getNumber("total").intValue() < 0) {
                throw new IllegalArgumentException("negative total");
            }
            return state.with("seen", true);
        }, null));
        DomainEvent good = event("order-1", "OrderCreated", 1);
        manager.apply(good);
        eventStore.append(List.of(good, event("order-2", "OrderCreated", -1)));

        // when & then
        assertThatThrownBy(() -> manager.rebuild("fragile", eventStore))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(manager.getState("fragile").getBoolean("seen")).isTrue();
        assertThat(manager.getPosition("fragile")).isEqualTo(1);
    }

    @Test
    void 등록되지_않은_Projection은_ProjectionNotFoundException() {
        // when & then
        assertThatThrownBy(() -> manager.rebuild("missing", eventStore))
            .isInstanceOf(ProjectionNotFoundException.class);
        assertThatThrownBy(() -> manager.getState("missing"))
            .isInstanceOf(ProjectionNotFoundException.class);
        assertThat(manager.listProjections()).containsExactly("revenue");
    }

    private static DomainEvent event(String aggregateId, String type, int total) {
        return DomainEvent.create(aggregateId, "order", type, 1, Payload.of("total", total));
    }
}

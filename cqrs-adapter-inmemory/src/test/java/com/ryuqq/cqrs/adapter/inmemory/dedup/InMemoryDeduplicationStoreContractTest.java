package com.ryuqq.cqrs.adapter.inmemory.dedup;

import com.ryuqq.cqrs.core.spi.DeduplicationStore;
import com.ryuqq.cqrs.testkit.contract.AbstractDeduplicationStoreContractTest;

/**
 * Contract Tests for {@link InMemoryDeduplicationStore}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryDeduplicationStoreContractTest extends AbstractDeduplicationStoreContractTest {

    @Override
    protected DeduplicationStore createDeduplicationStore() {
        return new InMemoryDeduplicationStore();
    }
}

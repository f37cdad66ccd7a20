package com.ryuqq.taskbridge.adapter.inmemory.registry;

import com.ryuqq.taskbridge.core.model.JobKind;
import com.ryuqq.taskbridge.core.model.JobSnapshot;
import com.ryuqq.taskbridge.core.spi.JobRegistry;
import com.ryuqq.taskbridge.testkit.contract.AbstractJobRegistryContractTest;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryJobRegistry 계약 테스트.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
class InMemoryJobRegistryContractTest extends AbstractJobRegistryContractTest {

    @Override
    protected JobRegistry createRegistry() {
        return new InMemoryJobRegistry();
    }

    @Test
    void clear_후에도_발급된_id는_재사용_불가() {
        // given
        InMemoryJobRegistry inMemory = (InMemoryJobRegistry) registry;
        JobSnapshot snapshot = pending(JobKind.SEND_MESSAGE);
        inMemory.register(snapshot);

        // when
        inMemory.clear();

        // then
        assertThat(inMemory.size()).isZero();
        assertThatThrownBy(() -> inMemory.register(snapshot.cancelled(Instant.now())))
            .hasMessageContaining("Duplicate job id");
    }
}

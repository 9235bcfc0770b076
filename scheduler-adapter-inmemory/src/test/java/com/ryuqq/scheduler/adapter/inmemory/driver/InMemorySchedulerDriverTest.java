package com.ryuqq.scheduler.adapter.inmemory.driver;

import com.ryuqq.scheduler.core.launch.TaskInfo;
import com.ryuqq.scheduler.core.offer.AgentId;
import com.ryuqq.scheduler.core.offer.OfferId;
import com.ryuqq.scheduler.core.operation.LaunchOperation;
import com.ryuqq.scheduler.core.operation.OfferOperation;
import com.ryuqq.scheduler.core.spi.SchedulerDriverException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemorySchedulerDriver 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemorySchedulerDriverTest {

    private final InMemorySchedulerDriver driver = new InMemorySchedulerDriver();
    private final List<OfferOperation> operations = List.of(
        new LaunchOperation(new TaskInfo("web.1", "web", AgentId.of("agent-1"), List.of())));

    @Test
    void acceptOffer_RecordsBatchInOrder() throws SchedulerDriverException {
        // When
        driver.acceptOffer(OfferId.of("offer-1"), operations);
        driver.acceptOffer(OfferId.of("offer-2"), operations);

        // Then
        assertThat(driver.getAcceptedOffers())
            .extracting(InMemorySchedulerDriver.AcceptedOffer::offerId)
            .containsExactly(OfferId.of("offer-1"), OfferId.of("offer-2"));
        assertThat(driver.getAcceptedOffers().get(0).operations()).isEqualTo(operations);
    }

    @Test
    void acceptOffer_Failing_ThrowsAndRecordsNothing() {
        // Given
        driver.failWith("connection refused");

        // When & Then
        assertThatThrownBy(() -> driver.acceptOffer(OfferId.of("offer-1"), operations))
            .isInstanceOf(SchedulerDriverException.class)
            .hasMessage("connection refused");
        assertThat(driver.getAcceptedOffers()).isEmpty();
    }

    @Test
    void acceptOffer_EmptyBatch_ThrowsException() {
        assertThatThrownBy(() -> driver.acceptOffer(OfferId.of("offer-1"), List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void declineOffer_RecordsOffer() throws SchedulerDriverException {
        // When
        driver.declineOffer(OfferId.of("offer-1"));

        // Then
        assertThat(driver.getDeclinedOffers()).containsExactly(OfferId.of("offer-1"));
    }

    @Test
    void clear_ResetsFailureMode() throws SchedulerDriverException {
        // Given
        driver.failWith("down");

        // When
        driver.clear();
        driver.declineOffer(OfferId.of("offer-1"));

        // Then
        assertThat(driver.getDeclinedOffers()).hasSize(1);
    }
}

package com.ryuqq.scheduler.core.offer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Offer 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OfferTest {

    @Test
    void consume_ReturnsNewOfferWithSameIdentity() {
        // Given
        Offer offer = new Offer(OfferId.of("offer-1"), AgentId.of("agent-1"), "host-1",
            List.of(Resource.scalar(Resource.CPUS, 2.0)));

        // When
        Offer remaining = offer.consume(List.of(Resource.scalar(Resource.CPUS, 0.5)));

        // Then
        assertEquals(offer.id(), remaining.id());
        assertEquals(offer.agentId(), remaining.agentId());
        assertEquals(1.5, remaining.scalarSum(Resource.CPUS));
        assertEquals(2.0, offer.scalarSum(Resource.CPUS), "original offer is unchanged");
    }

    @Test
    void resources_AreDefensivelyCopied() {
        // Given
        List<Resource> resources = new ArrayList<>(List.of(Resource.scalar(Resource.CPUS, 2.0)));
        Offer offer = new Offer(OfferId.of("offer-1"), AgentId.of("agent-1"), "host-1", resources);

        // When
        resources.add(Resource.scalar(Resource.MEM, 10.0));

        // Then
        assertEquals(1, offer.resources().size());
        assertThrows(UnsupportedOperationException.class, () -> offer.resources().clear());
    }

    @Test
    void isOvercommitted_AfterConsumingTooMuch_ReturnsTrue() {
        // Given
        Offer offer = new Offer(OfferId.of("offer-1"), AgentId.of("agent-1"), "host-1",
            List.of(Resource.scalar(Resource.MEM, 128.0)));

        // When
        Offer remaining = offer.consume(List.of(Resource.scalar(Resource.MEM, 256.0)));

        // Then
        assertFalse(offer.isOvercommitted());
        assertTrue(remaining.isOvercommitted());
    }

    @Test
    void constructor_NullId_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> new Offer(null, AgentId.of("agent-1"), "host-1", List.of()));
        assertTrue(exception.getMessage().contains("id cannot be null"));
    }

    @Test
    void offerId_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> OfferId.of(" "));
    }
}

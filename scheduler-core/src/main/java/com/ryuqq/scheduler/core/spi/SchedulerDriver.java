package com.ryuqq.scheduler.core.spi;

import com.ryuqq.scheduler.core.offer.OfferId;
import com.ryuqq.scheduler.core.operation.OfferOperation;

import java.util.List;

/**
 * Cluster Manager SPI for submitting offer decisions.
 *
 * <p>This interface abstracts the cluster-manager integration: the wire format,
 * connection handling and authentication are the implementation's concern.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Accepting an offer with an ordered batch of low-level operations</li>
 *   <li>Declining an offer that produced no operations</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: offers may be submitted from multiple threads</li>
 *   <li>Atomic batch: all operations of one acceptOffer call apply together or not at all</li>
 *   <li>No retry: a failed submission is reported to the caller, never retried internally</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SchedulerDriver {

    /**
     * Accepts the offer with the given operations.
     *
     * @param offerId the offer the operations apply to
     * @param operations ordered, non-empty batch of low-level operations
     * @throws SchedulerDriverException if the cluster manager could not be reached or refused the batch
     * @throws IllegalArgumentException if offerId is null or operations is null or empty
     */
    void acceptOffer(OfferId offerId, List<OfferOperation> operations) throws SchedulerDriverException;

    /**
     * Declines the offer so that its resources are offered again later.
     *
     * @param offerId the offer to decline
     * @throws SchedulerDriverException if the cluster manager could not be reached
     * @throws IllegalArgumentException if offerId is null
     */
    void declineOffer(OfferId offerId) throws SchedulerDriverException;
}

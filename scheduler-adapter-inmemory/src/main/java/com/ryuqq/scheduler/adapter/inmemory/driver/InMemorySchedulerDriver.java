package com.ryuqq.scheduler.adapter.inmemory.driver;

import com.ryuqq.scheduler.core.offer.OfferId;
import com.ryuqq.scheduler.core.operation.OfferOperation;
import com.ryuqq.scheduler.core.spi.SchedulerDriver;
import com.ryuqq.scheduler.core.spi.SchedulerDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link SchedulerDriver} SPI.
 *
 * <p>Records every accepted batch and declined offer instead of talking to a cluster
 * manager. A failure reason can be configured to simulate submission errors.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemorySchedulerDriver driver = new InMemorySchedulerDriver();
 * processor.processOffer(offer);
 * List&lt;AcceptedOffer&gt; accepted = driver.getAcceptedOffers();
 *
 * // simulate an unreachable cluster manager
 * driver.failWith("connection refused");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemorySchedulerDriver implements SchedulerDriver {

    private static final Logger log = LoggerFactory.getLogger(InMemorySchedulerDriver.class);

    private final CopyOnWriteArrayList<AcceptedOffer> acceptedOffers = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<OfferId> declinedOffers = new CopyOnWriteArrayList<>();
    private volatile String failureReason;

    @Override
    public void acceptOffer(OfferId offerId, List<OfferOperation> operations) throws SchedulerDriverException {
        if (offerId == null) {
            throw new IllegalArgumentException("offerId cannot be null");
        }
        if (operations == null || operations.isEmpty()) {
            throw new IllegalArgumentException("operations cannot be null or empty");
        }
        String reason = failureReason;
        if (reason != null) {
            throw new SchedulerDriverException(reason);
        }
        acceptedOffers.add(new AcceptedOffer(offerId, List.copyOf(operations)));
        log.debug("Accepted {} with {} operations", offerId, operations.size());
    }

    @Override
    public void declineOffer(OfferId offerId) throws SchedulerDriverException {
        if (offerId == null) {
            throw new IllegalArgumentException("offerId cannot be null");
        }
        String reason = failureReason;
        if (reason != null) {
            throw new SchedulerDriverException(reason);
        }
        declinedOffers.add(offerId);
    }

    /**
     * Makes every following call fail with the given reason.
     *
     * @param reason failure message, or null to recover
     */
    public void failWith(String reason) {
        this.failureReason = reason;
    }

    public List<AcceptedOffer> getAcceptedOffers() {
        return List.copyOf(acceptedOffers);
    }

    public List<OfferId> getDeclinedOffers() {
        return List.copyOf(declinedOffers);
    }

    public void clear() {
        acceptedOffers.clear();
        declinedOffers.clear();
        failureReason = null;
    }

    /**
     * One accepted offer with its ordered operation batch.
     *
     * @param offerId accepted offer
     * @param operations submitted operations in order
     */
    public record AcceptedOffer(OfferId offerId, List<OfferOperation> operations) {
    }
}

package com.ryuqq.scheduler.testkit.fixture;

import com.ryuqq.scheduler.core.offer.AgentId;
import com.ryuqq.scheduler.core.offer.Offer;
import com.ryuqq.scheduler.core.offer.OfferId;
import com.ryuqq.scheduler.core.offer.Resource;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

/**
 * Offer fixtures for tests.
 *
 * <p>Every offer gets a fresh id ({@code offer-1}, {@code offer-2}, ...) on agent {@code agent-1}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TestOffers {

    public static final String HOSTNAME = "host-1";
    public static final AgentId AGENT_ID = AgentId.of("agent-1");

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private TestOffers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Unreserved cpus and mem only.
     */
    public static Offer offer(double cpus, double mem) {
        return offer(
            Resource.scalar(Resource.CPUS, cpus),
            Resource.scalar(Resource.MEM, mem)
        );
    }

    /**
     * Unreserved cpus, mem, disk and a port range {@code [firstPort, lastPort]}.
     */
    public static Offer offer(double cpus, double mem, double disk, long firstPort, long lastPort) {
        Set<Long> ports = LongStream.rangeClosed(firstPort, lastPort).boxed().collect(Collectors.toSet());
        return offer(
            Resource.scalar(Resource.CPUS, cpus),
            Resource.scalar(Resource.MEM, mem),
            Resource.scalar(Resource.DISK, disk),
            Resource.set(Resource.PORTS, ports)
        );
    }

    public static Offer offer(Resource... resources) {
        return new Offer(nextOfferId(), AGENT_ID, HOSTNAME, List.of(resources));
    }

    public static OfferId nextOfferId() {
        return OfferId.of("offer-" + SEQUENCE.incrementAndGet());
    }
}

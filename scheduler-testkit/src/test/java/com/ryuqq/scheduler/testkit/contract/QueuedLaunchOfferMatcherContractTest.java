package com.ryuqq.scheduler.testkit.contract;

import com.ryuqq.scheduler.application.launcher.FrameworkIdentity;
import com.ryuqq.scheduler.application.launcher.TaskOpFactory;
import com.ryuqq.scheduler.application.matcher.PendingLaunch;
import com.ryuqq.scheduler.application.matcher.QueuedLaunchOfferMatcher;
import com.ryuqq.scheduler.core.offer.Resource;

import java.time.Clock;
import java.util.List;

/**
 * Contract Tests for {@link QueuedLaunchOfferMatcher}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class QueuedLaunchOfferMatcherContractTest extends AbstractOfferMatcherContractTest<QueuedLaunchOfferMatcher> {

    @Override
    protected QueuedLaunchOfferMatcher createMatcher(Clock clock) {
        return new QueuedLaunchOfferMatcher(new TaskOpFactory(new FrameworkIdentity(), clock), clock);
    }

    @Override
    protected void addDemand(QueuedLaunchOfferMatcher matcher, String runSpecId, double cpus, double mem) {
        matcher.add(new PendingLaunch(runSpecId, runSpecId.substring(1), List.of(
            Resource.scalar(Resource.CPUS, cpus),
            Resource.scalar(Resource.MEM, mem)
        ), NOW));
    }
}

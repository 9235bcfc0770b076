package com.ryuqq.scheduler.application.matcher;

import com.ryuqq.scheduler.application.launcher.TaskOpFactory;
import com.ryuqq.scheduler.core.instance.AgentInfo;
import com.ryuqq.scheduler.core.instance.Task;
import com.ryuqq.scheduler.core.instance.TaskId;
import com.ryuqq.scheduler.core.launch.TaskInfo;
import com.ryuqq.scheduler.core.matcher.MatchedTaskOps;
import com.ryuqq.scheduler.core.matcher.OfferMatcher;
import com.ryuqq.scheduler.core.matcher.TaskOpSource;
import com.ryuqq.scheduler.core.matcher.TaskOpWithSource;
import com.ryuqq.scheduler.core.offer.Offer;
import com.ryuqq.scheduler.core.operation.TaskOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 대기열 기반 OfferMatcher 구현체.
 *
 * <p>실행 요청을 FIFO 대기열에 쌓아 두고, Offer 하나당 최대 한 개의 요청을 실행합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>deadline이 이미 지났으면 resend 결과 반환</li>
 *   <li>대기열 앞에서부터 Offer에 들어맞는 첫 요청을 선택</li>
 *   <li>선택된 요청은 대기열에서 빠져 제출 대기(in-flight) 상태가 됨</li>
 *   <li>accept 통지 시 in-flight에서 제거</li>
 *   <li>reject 통지 시 대기열 맨 앞으로 되돌림 (다음 라운드에 재평가)</li>
 * </ol>
 *
 * <p><strong>동시성:</strong> 모든 상태 변경은 내부 잠금으로 직렬화됩니다.
 * accept/reject 통지는 매칭 호출과 다른 스레드에서 도착할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class QueuedLaunchOfferMatcher implements OfferMatcher, TaskOpSource {

    private static final Logger log = LoggerFactory.getLogger(QueuedLaunchOfferMatcher.class);

    private final TaskOpFactory taskOpFactory;
    private final Clock clock;
    private final Object lock = new Object();
    private final Deque<PendingLaunch> queue = new ArrayDeque<>();
    private final Map<TaskId, PendingLaunch> inFlight = new HashMap<>();

    public QueuedLaunchOfferMatcher(TaskOpFactory taskOpFactory, Clock clock) {
        if (taskOpFactory == null) {
            throw new IllegalArgumentException("taskOpFactory cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.taskOpFactory = taskOpFactory;
        this.clock = clock;
    }

    /**
     * 실행 요청을 대기열 끝에 추가.
     *
     * @param launch 실행 요청
     */
    public void add(PendingLaunch launch) {
        if (launch == null) {
            throw new IllegalArgumentException("launch cannot be null");
        }
        synchronized (lock) {
            queue.addLast(launch);
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public int inFlightCount() {
        synchronized (lock) {
            return inFlight.size();
        }
    }

    @Override
    public CompletableFuture<MatchedTaskOps> matchOffer(Instant deadline, Offer offer) {
        if (deadline == null || offer == null) {
            throw new IllegalArgumentException("deadline and offer cannot be null");
        }
        if (!clock.instant().isBefore(deadline)) {
            log.debug("Deadline {} already passed for {}, asking for resend", deadline, offer.id());
            return CompletableFuture.completedFuture(MatchedTaskOps.resend(offer.id()));
        }

        PendingLaunch selected = pollFitting(offer);
        if (selected == null) {
            return CompletableFuture.completedFuture(MatchedTaskOps.noMatch(offer.id()));
        }

        TaskOp op = buildLaunch(selected, offer);
        synchronized (lock) {
            inFlight.put(op.taskId(), selected);
        }
        log.debug("Matched {} to {} on {}", selected.runSpecId(), op.taskId(), offer.hostname());
        return CompletableFuture.completedFuture(
            new MatchedTaskOps(offer.id(), List.of(new TaskOpWithSource(this, op))));
    }

    @Override
    public void taskOpAccepted(TaskOp taskOp) {
        PendingLaunch launch;
        synchronized (lock) {
            launch = inFlight.remove(taskOp.taskId());
        }
        if (launch == null) {
            log.warn("Accepted {} was not in flight", taskOp.taskId());
            return;
        }
        log.info("Launch of {} accepted as {}", launch.runSpecId(), taskOp.taskId());
    }

    @Override
    public void taskOpRejected(TaskOp taskOp, String reason) {
        synchronized (lock) {
            PendingLaunch launch = inFlight.remove(taskOp.taskId());
            if (launch == null) {
                log.warn("Rejected {} was not in flight: {}", taskOp.taskId(), reason);
                return;
            }
            queue.addFirst(launch);
        }
        log.warn("Launch of {} rejected, re-queued: {}", taskOp.taskId(), reason);
    }

    private PendingLaunch pollFitting(Offer offer) {
        synchronized (lock) {
            Iterator<PendingLaunch> iterator = queue.iterator();
            while (iterator.hasNext()) {
                PendingLaunch candidate = iterator.next();
                if (candidate.fits(offer)) {
                    iterator.remove();
                    return candidate;
                }
            }
            return null;
        }
    }

    private TaskOp buildLaunch(PendingLaunch launch, Offer offer) {
        TaskId taskId = TaskId.forRunSpec(launch.runSpecId());
        Task task = Task.launchedEphemeral(taskId, AgentInfo.of(offer), launch.runSpecVersion());
        TaskInfo taskInfo = new TaskInfo(taskId.idString(), launch.name(), offer.agentId(), launch.resources());
        return taskOpFactory.launchEphemeral(taskInfo, task);
    }
}

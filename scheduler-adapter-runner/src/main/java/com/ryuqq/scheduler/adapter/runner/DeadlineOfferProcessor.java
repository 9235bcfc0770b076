package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.application.offer.OfferProcessor;
import com.ryuqq.scheduler.core.instance.Instance;
import com.ryuqq.scheduler.core.matcher.MatchedTaskOps;
import com.ryuqq.scheduler.core.matcher.OfferMatcher;
import com.ryuqq.scheduler.core.matcher.TaskOpWithSource;
import com.ryuqq.scheduler.core.offer.Offer;
import com.ryuqq.scheduler.core.operation.LaunchTask;
import com.ryuqq.scheduler.core.operation.LaunchTaskGroup;
import com.ryuqq.scheduler.core.operation.OfferOperation;
import com.ryuqq.scheduler.core.operation.ReserveAndCreateVolumes;
import com.ryuqq.scheduler.core.operation.TaskOp;
import com.ryuqq.scheduler.core.spi.InstanceStore;
import com.ryuqq.scheduler.core.spi.SchedulerDriver;
import com.ryuqq.scheduler.core.spi.SchedulerDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Deadline 기반 Offer 처리기 구현체.
 *
 * <p>매칭 라운드의 deadline을 강제하고, 매칭 결과를 클러스터 매니저에 제출하는 경계입니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>deadline 계산 (현재 시각 + matchingTimeoutMs)</li>
 *   <li>OfferMatcher 호출 후 최대 matchingTimeoutMs 대기</li>
 *   <li>타임아웃 시: 연산 없는 resend 결과로 처리, 늦게 도착한 연산은 모두 reject</li>
 *   <li>매처 실패 시: 매칭 없음으로 처리</li>
 *   <li>연산을 Offer에 순서대로 적용, 과다 할당이면 모든 연산 reject 후 IllegalStateException</li>
 *   <li>제출 전 각 연산의 newState 저장 (저장 실패한 연산은 reject 후 배치에서 제외)</li>
 *   <li>저장된 연산의 저수준 연산 배치 제출 (남은 연산이 없으면 Offer 거절)</li>
 *   <li>성공 시: accept, 실패 시: 저장한 상태 되돌린 후 reject</li>
 * </ol>
 *
 * <p>각 연산의 source는 정확히 한 번 통지됩니다 (accept 또는 reject).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DeadlineOfferProcessor implements OfferProcessor {

    private static final Logger log = LoggerFactory.getLogger(DeadlineOfferProcessor.class);

    private final OfferMatcher matcher;
    private final SchedulerDriver driver;
    private final InstanceStore instanceStore;
    private final Clock clock;
    private final OfferProcessorConfig config;

    /**
     * 생성자 (기본 설정).
     *
     * @param matcher Offer 매처
     * @param driver 클러스터 매니저 드라이버
     * @param instanceStore 인스턴스 저장소
     * @param clock deadline 계산용 시계
     */
    public DeadlineOfferProcessor(OfferMatcher matcher, SchedulerDriver driver, InstanceStore instanceStore, Clock clock) {
        this(matcher, driver, instanceStore, clock, new OfferProcessorConfig());
    }

    /**
     * 생성자.
     *
     * @param matcher Offer 매처
     * @param driver 클러스터 매니저 드라이버
     * @param instanceStore 인스턴스 저장소
     * @param clock deadline 계산용 시계
     * @param config 처리기 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DeadlineOfferProcessor(
        OfferMatcher matcher,
        SchedulerDriver driver,
        InstanceStore instanceStore,
        Clock clock,
        OfferProcessorConfig config
    ) {
        if (matcher == null) {
            throw new IllegalArgumentException("matcher cannot be null");
        }
        if (driver == null) {
            throw new IllegalArgumentException("driver cannot be null");
        }
        if (instanceStore == null) {
            throw new IllegalArgumentException("instanceStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.matcher = matcher;
        this.driver = driver;
        this.instanceStore = instanceStore;
        this.clock = clock;
        this.config = config;
    }

    @Override
    public MatchedTaskOps processOffer(Offer offer) {
        if (offer == null) {
            throw new IllegalArgumentException("offer cannot be null");
        }

        // 1. 라운드 deadline 계산
        Instant deadline = clock.instant().plusMillis(config.matchingTimeoutMs());

        // 2. 매칭 (deadline까지 대기)
        MatchedTaskOps matched = awaitMatch(offer, deadline);

        // 3. 제출
        if (matched.isEmpty()) {
            declineIfConfigured(offer, matched);
            return matched;
        }
        submit(offer, matched);
        return matched;
    }

    private MatchedTaskOps awaitMatch(Offer offer, Instant deadline) {
        CompletableFuture<MatchedTaskOps> future;
        try {
            future = matcher.matchOffer(deadline, offer);
        } catch (RuntimeException e) {
            log.error("Matcher failed for {}, treating as no match", offer.id(), e);
            return MatchedTaskOps.noMatch(offer.id());
        }

        try {
            MatchedTaskOps matched = future.get(config.matchingTimeoutMs(), TimeUnit.MILLISECONDS);
            return matched == null ? MatchedTaskOps.noMatch(offer.id()) : matched;
        } catch (TimeoutException e) {
            rejectWhenLate(future, "matching timed out");
            log.warn("Matching {} did not finish within {}ms, offer will be resent", offer.id(), config.matchingTimeoutMs());
            return MatchedTaskOps.resend(offer.id());
        } catch (ExecutionException e) {
            log.error("Matcher failed for {}, treating as no match", offer.id(), e.getCause());
            return MatchedTaskOps.noMatch(offer.id());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            rejectWhenLate(future, "matching interrupted");
            throw new RuntimeException("Offer matching interrupted", e);
        }
    }

    private void submit(Offer offer, MatchedTaskOps matched) {
        List<TaskOpWithSource> opsWithSource = matched.opsWithSource();

        // 과다 할당 검사 (연산을 순서대로 적용)
        Offer remaining = offer;
        for (TaskOpWithSource opWithSource : opsWithSource) {
            remaining = opWithSource.op().applyToOffer(remaining);
        }
        if (remaining.isOvercommitted()) {
            rejectAll(opsWithSource, "offer overcommitted");
            throw new IllegalStateException(String.format(
                "Matched operations overcommit %s (remaining: %s)", offer.id(), remaining.resources()));
        }

        List<TaskOpWithSource> persisted = new ArrayList<>();
        for (TaskOpWithSource opWithSource : opsWithSource) {
            try {
                instanceStore.process(opWithSource.op().newState());
            } catch (RuntimeException e) {
                log.error("Failed to persist {} before accepting {}", opWithSource.taskId(), offer.id(), e);
                opWithSource.reject("failed to persist new state: " + e.getMessage());
                continue;
            }
            persisted.add(opWithSource);
        }
        if (persisted.isEmpty()) {
            declineIfConfigured(offer, matched);
            return;
        }

        List<OfferOperation> batch = new ArrayList<>();
        for (TaskOpWithSource opWithSource : persisted) {
            batch.addAll(lowLevelOperationsOf(opWithSource.op()));
        }

        try {
            driver.acceptOffer(offer.id(), batch);
        } catch (SchedulerDriverException e) {
            log.warn("Failed to accept {} with {} operations: {}", offer.id(), batch.size(), e.getMessage());
            for (TaskOpWithSource opWithSource : persisted) {
                revert(opWithSource.op());
                opWithSource.reject(e.getMessage());
            }
            return;
        }

        for (TaskOpWithSource opWithSource : persisted) {
            opWithSource.accept();
        }
        log.info("Accepted {} on {} with {} task operations", offer.id(), offer.hostname(), persisted.size());
    }

    private void revert(TaskOp op) {
        try {
            Optional<Instance> oldState = op.oldState();
            if (oldState.isPresent()) {
                instanceStore.store(oldState.get());
            } else {
                instanceStore.remove(op.newState().instanceId());
            }
        } catch (RuntimeException e) {
            log.error("Failed to revert state of {}", op.taskId(), e);
        }
    }

    private void rejectWhenLate(CompletableFuture<MatchedTaskOps> future, String reason) {
        future.thenAccept(late -> {
            if (late != null && !late.isEmpty()) {
                log.warn("Rejecting {} operations matched after the deadline for {}", late.ops().size(), late.offerId());
                rejectAll(late.opsWithSource(), reason);
            }
        });
    }

    private List<OfferOperation> lowLevelOperationsOf(TaskOp op) {
        if (op instanceof LaunchTask launch) {
            log.debug("Launching {}", launch.taskInfo().taskId());
            return launch.lowLevelOperations();
        } else if (op instanceof LaunchTaskGroup group) {
            log.debug("Launching task group {} with {} tasks", group.executorInfo().executorId(), group.taskGroup().tasks().size());
            return group.lowLevelOperations();
        } else if (op instanceof ReserveAndCreateVolumes reserve) {
            log.debug("Reserving resources and creating {} volumes for {}",
                reserve.createVolumeOperations().size(), reserve.newState().instanceId());
            return reserve.lowLevelOperations();
        }
        throw new IllegalStateException("Unsupported task operation: " + op.getClass().getName());
    }

    private void declineIfConfigured(Offer offer, MatchedTaskOps matched) {
        if (!config.declineEmptyOffers()) {
            return;
        }
        try {
            driver.declineOffer(offer.id());
            log.debug("Declined {} (resend: {})", offer.id(), matched.resendThisOffer());
        } catch (SchedulerDriverException e) {
            log.warn("Failed to decline {}: {}", offer.id(), e.getMessage());
        }
    }

    private void rejectAll(List<TaskOpWithSource> opsWithSource, String reason) {
        for (TaskOpWithSource opWithSource : opsWithSource) {
            opWithSource.reject(reason);
        }
    }
}

package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.application.status.TaskStatusProcessor;
import com.ryuqq.scheduler.application.status.TaskStatusUpdate;
import com.ryuqq.scheduler.core.instance.Instance;
import com.ryuqq.scheduler.core.instance.InstanceStatus;
import com.ryuqq.scheduler.core.spi.InstanceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Task 상태 이벤트를 인스턴스 상태로 집계하는 처리기.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>Task ID로 소속 인스턴스 조회 (없으면 경고 로그 후 무시)</li>
 *   <li>저장소의 원자적 update 안에서 Task 상태 반영 및 인스턴스 상태 재집계</li>
 * </ol>
 *
 * <p>같은 인스턴스의 형제 Task 이벤트가 동시에 들어와도 각 재집계는 최신 저장 상태를
 * 입력으로 사용하므로 갱신이 유실되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AggregatingTaskStatusProcessor implements TaskStatusProcessor {

    private static final Logger log = LoggerFactory.getLogger(AggregatingTaskStatusProcessor.class);

    private final InstanceStore instanceStore;

    public AggregatingTaskStatusProcessor(InstanceStore instanceStore) {
        if (instanceStore == null) {
            throw new IllegalArgumentException("instanceStore cannot be null");
        }
        this.instanceStore = instanceStore;
    }

    @Override
    public Optional<Instance> process(TaskStatusUpdate update) {
        if (update == null) {
            throw new IllegalArgumentException("update cannot be null");
        }

        Optional<Instance> current = instanceStore.findByTaskId(update.taskId());
        if (current.isEmpty()) {
            log.warn("Ignoring {} for unknown task {}", update.status(), update.taskId());
            return Optional.empty();
        }

        AtomicReference<InstanceStatus> before = new AtomicReference<>();
        Optional<Instance> updated = instanceStore.update(current.get().instanceId(), instance -> {
            before.set(instance.state().status());
            return instance.withTaskStatus(update.taskId(), update.status(), update.timestamp());
        });
        if (updated.isEmpty()) {
            log.warn("Ignoring {} for task {}, instance was removed", update.status(), update.taskId());
            return Optional.empty();
        }

        InstanceStatus after = updated.get().state().status();
        if (before.get() != after) {
            log.info("Instance {} changed {} → {} (task {} is {})",
                updated.get().instanceId(), before.get(), after, update.taskId(), update.status());
        }
        return updated;
    }
}

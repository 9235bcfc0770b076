package com.ryuqq.scheduler.core.matcher;

import com.ryuqq.scheduler.core.instance.Task;
import com.ryuqq.scheduler.core.instance.TaskId;
import com.ryuqq.scheduler.core.launch.TaskInfo;
import com.ryuqq.scheduler.core.offer.OfferId;
import com.ryuqq.scheduler.core.operation.LaunchTask;
import com.ryuqq.scheduler.core.operation.TaskOp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 하나의 Offer에 대한 Matcher의 응답.
 *
 * <p>아무것도 매칭하지 못했다면 opsWithSource는 비어 있습니다. 이는 오류가 아닌 정상 결과입니다.</p>
 *
 * <p>MatchedTaskOps가 있다고 해서 작업이 실제로 실행된다는 보장은 없습니다.
 * 각 작업의 최종 결과는 {@link TaskOpSource}로 통지됩니다.</p>
 *
 * @param offerId 대상 Offer ID
 * @param opsWithSource 실행할 작업과 결과 통지 대상
 * @param resendThisOffer Offer를 끝까지 평가하지 못해(예: 타임아웃) 다음 라운드에 다시 보내야 하면 true.
 *                        부분 진행 상태는 없으며 재전송 시 처음부터 다시 매칭합니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MatchedTaskOps(
    OfferId offerId,
    List<TaskOpWithSource> opsWithSource,
    boolean resendThisOffer
) {

    public MatchedTaskOps {
        if (offerId == null) {
            throw new IllegalArgumentException("offerId cannot be null");
        }
        opsWithSource = opsWithSource == null ? List.of() : List.copyOf(opsWithSource);
    }

    public MatchedTaskOps(OfferId offerId, List<TaskOpWithSource> opsWithSource) {
        this(offerId, opsWithSource, false);
    }

    /**
     * 매칭 결과 없음.
     *
     * @param offerId Offer ID
     * @return 빈 MatchedTaskOps
     */
    public static MatchedTaskOps noMatch(OfferId offerId) {
        return new MatchedTaskOps(offerId, List.of(), false);
    }

    /**
     * 평가를 끝내지 못함, 다음 라운드에 재전송.
     *
     * @param offerId Offer ID
     * @return resendThisOffer=true인 빈 MatchedTaskOps
     */
    public static MatchedTaskOps resend(OfferId offerId) {
        return new MatchedTaskOps(offerId, List.of(), true);
    }

    /**
     * 통지 대상을 제외한 작업 목록.
     *
     * @return TaskOp 목록
     */
    public List<TaskOp> ops() {
        return opsWithSource.stream().map(TaskOpWithSource::op).toList();
    }

    /**
     * 실행되는 단일 Task의 명세 목록.
     *
     * @return LaunchTask의 TaskInfo 목록
     */
    public List<TaskInfo> launchedTaskInfos() {
        return ops().stream()
            .filter(LaunchTask.class::isInstance)
            .map(op -> ((LaunchTask) op).taskInfo())
            .toList();
    }

    /**
     * 작업 적용 후 영향받는 Task의 마지막 상태.
     *
     * <p>같은 Task ID가 여러 번 나오면 마지막 것이 남습니다 (정상적인 Matcher라면 발생하지 않음).</p>
     *
     * @return Task ID별 새 Task 상태
     */
    public Map<TaskId, Task> resultingTasks() {
        Map<TaskId, Task> tasks = new LinkedHashMap<>();
        for (TaskOp op : ops()) {
            tasks.put(op.taskId(), op.newTask());
        }
        return Collections.unmodifiableMap(tasks);
    }

    public boolean isEmpty() {
        return opsWithSource.isEmpty();
    }
}

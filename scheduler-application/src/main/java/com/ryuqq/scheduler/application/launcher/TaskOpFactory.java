package com.ryuqq.scheduler.application.launcher;

import com.ryuqq.scheduler.core.instance.Instance;
import com.ryuqq.scheduler.core.instance.Task;
import com.ryuqq.scheduler.core.instance.update.LaunchEphemeral;
import com.ryuqq.scheduler.core.instance.update.LaunchOnReservation;
import com.ryuqq.scheduler.core.instance.update.Reserve;
import com.ryuqq.scheduler.core.launch.ExecutorInfo;
import com.ryuqq.scheduler.core.launch.TaskGroupInfo;
import com.ryuqq.scheduler.core.launch.TaskInfo;
import com.ryuqq.scheduler.core.offer.Resource;
import com.ryuqq.scheduler.core.operation.LaunchTask;
import com.ryuqq.scheduler.core.operation.LaunchTaskGroup;
import com.ryuqq.scheduler.core.operation.OfferOperation;
import com.ryuqq.scheduler.core.operation.ReserveAndCreateVolumes;
import com.ryuqq.scheduler.core.volume.LocalVolume;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 배치 결정으로부터 TaskOp를 만드는 팩토리.
 *
 * <p>모든 메서드는 순수 생성자 역할만 합니다. 재시도나 제출은 하지 않으며,
 * 제출 실패는 호출자가 {@code TaskOpSource#taskOpRejected}로 처리합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TaskOpFactory factory = new TaskOpFactory(new FrameworkIdentity("scheduler", "batch"), Clock.systemUTC());
 *
 * Task newTask = Task.launchedEphemeral(taskId, AgentInfo.of(offer), runSpecVersion);
 * LaunchTask op = factory.launchEphemeral(taskInfo, newTask);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskOpFactory {

    private final OfferOperationFactory offerOperationFactory;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param identity 예약 태깅에 사용할 프레임워크 신원
     * @param clock 새 인스턴스 상태의 since 계산용 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public TaskOpFactory(FrameworkIdentity identity, Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.offerOperationFactory = new OfferOperationFactory(identity);
        this.clock = clock;
    }

    /**
     * 단일 Task 임시 실행. 인스턴스는 새 Task로부터 유도됩니다.
     *
     * @param taskInfo 클러스터 매니저용 Task payload
     * @param newTask 실행될 Task의 초기 상태
     * @return LaunchTask
     * @throws IllegalStateException 두 Task ID가 다른 경우
     */
    public LaunchTask launchEphemeral(TaskInfo taskInfo, Task newTask) {
        return launchEphemeral(taskInfo, newTask, Instance.fromTask(newTask, clock.instant()));
    }

    /**
     * 단일 Task 임시 실행 (인스턴스 지정).
     *
     * @param taskInfo 클러스터 매니저용 Task payload
     * @param newTask 실행될 Task의 초기 상태
     * @param instance newTask를 포함하는 인스턴스
     * @return LaunchTask
     * @throws IllegalStateException 두 Task ID가 다른 경우
     */
    public LaunchTask launchEphemeral(TaskInfo taskInfo, Task newTask, Instance instance) {
        if (taskInfo == null || newTask == null) {
            throw new IllegalArgumentException("taskInfo and newTask cannot be null");
        }
        if (!newTask.taskId().idString().equals(taskInfo.taskId())) {
            throw new IllegalStateException(String.format(
                "task id and cluster manager task id must be equal (task: %s, taskInfo: %s)",
                newTask.taskId().idString(), taskInfo.taskId()));
        }
        List<OfferOperation> operations = List.of(offerOperationFactory.launch(taskInfo));
        return new LaunchTask(taskInfo, new LaunchEphemeral(instance), null, operations);
    }

    /**
     * Pod(Task 그룹) 원자적 실행.
     *
     * @param executorInfo Pod 실행기 payload
     * @param groupInfo Task 그룹 payload
     * @param launchRequest 실행할 Pod 인스턴스
     * @return LaunchTaskGroup
     * @throws IllegalStateException 실행기 ID가 인스턴스의 실행기 ID와 다른 경우
     */
    public LaunchTaskGroup launchEphemeral(ExecutorInfo executorInfo, TaskGroupInfo groupInfo, Instance.LaunchRequest launchRequest) {
        if (launchRequest == null) {
            throw new IllegalArgumentException("launchRequest cannot be null");
        }
        List<OfferOperation> operations = List.of(offerOperationFactory.launch(executorInfo, groupInfo));
        return new LaunchTaskGroup(executorInfo, groupInfo, new LaunchEphemeral(launchRequest.instance()), null, operations);
    }

    /**
     * 이전 라운드에서 예약한 리소스 위에서 실행.
     *
     * <p>예약 상태의 이전 Task를 oldState로 함께 전달하여, 저장소가 전이 전후를 모두 알 수 있게 합니다.</p>
     *
     * @param taskInfo 클러스터 매니저용 Task payload
     * @param newState 예약 위 실행 전이
     * @param oldTask 예약 상태의 이전 Task
     * @return LaunchTask
     */
    public LaunchTask launchOnReservation(TaskInfo taskInfo, LaunchOnReservation newState, Task oldTask) {
        if (oldTask == null) {
            throw new IllegalArgumentException("oldTask cannot be null");
        }
        List<OfferOperation> operations = List.of(offerOperationFactory.launch(taskInfo));
        return new LaunchTask(taskInfo, newState, Instance.fromTask(oldTask, clock.instant()), operations);
    }

    /**
     * 모든 리소스를 예약하고 필요한 영구 볼륨을 생성.
     *
     * @param frameworkId 예약하는 프레임워크
     * @param newState 예약 전이
     * @param resources 예약할 리소스 (Offer에서 차감될 미예약 리소스)
     * @param localVolumes 생성할 로컬 볼륨
     * @return reserve 연산 하나와 볼륨별 create-volume 연산을 담은 ReserveAndCreateVolumes
     * @throws IllegalStateException principal 또는 role이 설정되지 않은 경우
     */
    public ReserveAndCreateVolumes reserveAndCreateVolumes(
        FrameworkId frameworkId,
        Reserve newState,
        Collection<Resource> resources,
        Collection<LocalVolume> localVolumes
    ) {
        if (newState == null) {
            throw new IllegalArgumentException("newState cannot be null");
        }
        List<OfferOperation> operations = new ArrayList<>();
        operations.add(offerOperationFactory.reserve(frameworkId, newState.instanceId(), resources));
        operations.addAll(offerOperationFactory.createVolumes(frameworkId, newState.instanceId(), localVolumes));
        return new ReserveAndCreateVolumes(newState, List.copyOf(resources), operations);
    }
}

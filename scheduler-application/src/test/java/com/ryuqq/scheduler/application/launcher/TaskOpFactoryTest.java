package com.ryuqq.scheduler.application.launcher;

import com.ryuqq.scheduler.core.instance.AgentInfo;
import com.ryuqq.scheduler.core.instance.Instance;
import com.ryuqq.scheduler.core.instance.InstanceId;
import com.ryuqq.scheduler.core.instance.InstanceStatus;
import com.ryuqq.scheduler.core.instance.Task;
import com.ryuqq.scheduler.core.instance.TaskId;
import com.ryuqq.scheduler.core.instance.update.LaunchEphemeral;
import com.ryuqq.scheduler.core.instance.update.LaunchOnReservation;
import com.ryuqq.scheduler.core.instance.update.Reserve;
import com.ryuqq.scheduler.core.launch.ExecutorInfo;
import com.ryuqq.scheduler.core.launch.TaskGroupInfo;
import com.ryuqq.scheduler.core.launch.TaskInfo;
import com.ryuqq.scheduler.core.offer.AgentId;
import com.ryuqq.scheduler.core.offer.Offer;
import com.ryuqq.scheduler.core.offer.OfferId;
import com.ryuqq.scheduler.core.offer.Resource;
import com.ryuqq.scheduler.core.operation.CreateVolumeOperation;
import com.ryuqq.scheduler.core.operation.LaunchGroupOperation;
import com.ryuqq.scheduler.core.operation.LaunchOperation;
import com.ryuqq.scheduler.core.operation.LaunchTask;
import com.ryuqq.scheduler.core.operation.LaunchTaskGroup;
import com.ryuqq.scheduler.core.operation.ReserveAndCreateVolumes;
import com.ryuqq.scheduler.core.operation.ReserveOperation;
import com.ryuqq.scheduler.core.volume.LocalVolume;
import com.ryuqq.scheduler.core.volume.LocalVolumeId;
import com.ryuqq.scheduler.core.volume.PersistentVolume;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TaskOpFactory 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskOpFactoryTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");
    private static final Instant VERSION = Instant.parse("2024-01-01T00:00:00Z");
    private static final AgentId AGENT_ID = AgentId.of("agent-1");
    private static final AgentInfo AGENT = new AgentInfo("host-1", AGENT_ID);

    private final TaskOpFactory factory = new TaskOpFactory(
        new FrameworkIdentity("scheduler", "db"), Clock.fixed(NOW, ZoneOffset.UTC));

    // ========== launchEphemeral ==========

    @Test
    void launchEphemeral_DerivesInstanceFromNewTask() {
        // Given
        Task task = Task.launchedEphemeral(TaskId.forRunSpec("/web"), AGENT, VERSION);
        TaskInfo taskInfo = taskInfo(task.taskId());

        // When
        LaunchTask op = factory.launchEphemeral(taskInfo, task);

        // Then
        assertThat(op.newState()).isInstanceOf(LaunchEphemeral.class);
        assertThat(op.newInstance().instanceId()).isEqualTo(task.taskId().instanceId());
        assertThat(op.newInstance().state().since()).isEqualTo(NOW);
        assertThat(op.oldState()).isEmpty();
        assertThat(op.lowLevelOperations()).containsExactly(new LaunchOperation(taskInfo));
    }

    @Test
    void launchEphemeral_TaskIdMismatch_ThrowsIllegalStateException() {
        // Given
        Task task = Task.launchedEphemeral(TaskId.forRunSpec("/web"), AGENT, VERSION);
        TaskInfo otherInfo = taskInfo(TaskId.forRunSpec("/web"));

        // When & Then
        assertThatThrownBy(() -> factory.launchEphemeral(otherInfo, task))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("must be equal");
    }

    @Test
    void launchEphemeral_TaskGroup_UsesSingleLaunchGroupOperation() {
        // Given
        InstanceId instanceId = InstanceId.forRunSpec("/prod/pod");
        TaskId web = TaskId.forContainer(instanceId, "web");
        Instance instance = Instance.of(instanceId, AGENT, List.of(Task.launchedEphemeral(web, AGENT, VERSION)), NOW, VERSION);
        ExecutorInfo executor = new ExecutorInfo(instanceId.executorIdString(), List.of(Resource.scalar(Resource.CPUS, 0.1)));
        TaskGroupInfo group = new TaskGroupInfo(List.of(taskInfo(web)));

        // When
        LaunchTaskGroup op = factory.launchEphemeral(executor, group, new Instance.LaunchRequest(instance));

        // Then
        assertThat(op.lowLevelOperations()).containsExactly(new LaunchGroupOperation(executor, group));
        assertThat(op.newInstance()).isEqualTo(instance);
    }

    @Test
    void launchEphemeral_TaskGroupExecutorMismatch_ThrowsIllegalStateException() {
        // Given
        InstanceId instanceId = InstanceId.forRunSpec("/prod/pod");
        TaskId web = TaskId.forContainer(instanceId, "web");
        Instance instance = Instance.of(instanceId, AGENT, List.of(Task.launchedEphemeral(web, AGENT, VERSION)), NOW, VERSION);
        ExecutorInfo executor = new ExecutorInfo("instance-unrelated", List.of());

        // When & Then
        assertThatThrownBy(() -> factory.launchEphemeral(executor, new TaskGroupInfo(List.of(taskInfo(web))), new Instance.LaunchRequest(instance)))
            .isInstanceOf(IllegalStateException.class);
    }

    // ========== launchOnReservation ==========

    @Test
    void launchOnReservation_CarriesOldTaskAsOldState() {
        // Given
        Task oldTask = Task.reserved(TaskId.forRunSpec("/db"), AGENT, VERSION, List.of());
        Task launched = oldTask.launchedOnReservation(VERSION);
        LaunchOnReservation newState = new LaunchOnReservation(Instance.fromTask(launched, NOW));

        // When
        LaunchTask op = factory.launchOnReservation(taskInfo(oldTask.taskId()), newState, oldTask);

        // Then
        assertThat(op.oldState()).isPresent();
        assertThat(op.oldState().get().firstTask()).isEqualTo(oldTask);
        assertThat(op.newTask()).isEqualTo(launched);
        assertThat(op.lowLevelOperations()).hasSize(1).first().isInstanceOf(LaunchOperation.class);
    }

    // ========== reserveAndCreateVolumes ==========

    @Test
    void reserveAndCreateVolumes_ReserveFirstThenOneCreatePerVolume() {
        // Given
        PersistentVolume data = new PersistentVolume("data", 256);
        PersistentVolume logs = new PersistentVolume("logs", 64);
        List<LocalVolumeId> volumeIds = List.of(
            LocalVolumeId.forVolume("/db", data), LocalVolumeId.forVolume("/db", logs));
        Task task = Task.reserved(TaskId.forRunSpec("/db"), AGENT, VERSION, volumeIds);
        Reserve reserve = new Reserve(Instance.fromTask(task, NOW));
        List<Resource> resources = List.of(Resource.scalar(Resource.CPUS, 1.0), Resource.scalar(Resource.DISK, 320.0));

        // When
        ReserveAndCreateVolumes op = factory.reserveAndCreateVolumes(FrameworkId.of("fw"), reserve, resources, List.of(
            new LocalVolume(volumeIds.get(0), data, null),
            new LocalVolume(volumeIds.get(1), logs, null)
        ));

        // Then
        assertThat(op.lowLevelOperations()).hasSize(3);
        assertThat(op.lowLevelOperations().get(0)).isInstanceOf(ReserveOperation.class);
        assertThat(op.lowLevelOperations().subList(1, 3)).allMatch(CreateVolumeOperation.class::isInstance);
        assertThat(op.createVolumeOperations())
            .extracting(create -> create.volume().disk().persistenceId())
            .containsExactly(volumeIds.get(0).idString(), volumeIds.get(1).idString());

        Offer offer = new Offer(OfferId.of("offer-1"), AGENT_ID, "host-1", List.of(
            Resource.scalar(Resource.CPUS, 2.0), Resource.scalar(Resource.DISK, 1000.0)));
        assertThat(op.applyToOffer(offer).scalarSum(Resource.DISK)).isEqualTo(680.0);
    }

    @Test
    void reserveAndCreateVolumes_WithoutIdentity_ThrowsIllegalStateException() {
        // Given
        TaskOpFactory anonymous = new TaskOpFactory(new FrameworkIdentity(), Clock.fixed(NOW, ZoneOffset.UTC));
        Task task = Task.reserved(TaskId.forRunSpec("/db"), AGENT, VERSION, List.of());
        Reserve reserve = new Reserve(Instance.fromTask(task, NOW));

        // When & Then
        assertThatThrownBy(() -> anonymous.reserveAndCreateVolumes(
            FrameworkId.of("fw"), reserve, List.of(Resource.scalar(Resource.CPUS, 1.0)), List.of()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void newInstance_StatusIsCreated() {
        Task task = Task.launchedEphemeral(TaskId.forRunSpec("/web"), AGENT, VERSION);

        assertThat(factory.launchEphemeral(taskInfo(task.taskId()), task).newInstance().state().status())
            .isEqualTo(InstanceStatus.CREATED);
    }

    private static TaskInfo taskInfo(TaskId taskId) {
        return new TaskInfo(taskId.idString(), "task", AGENT_ID, List.of(Resource.scalar(Resource.CPUS, 0.5)));
    }
}

package com.ryuqq.scheduler.core.instance;

import com.ryuqq.scheduler.core.offer.AgentId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Instance 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InstanceTest {

    private static final Instant VERSION = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");
    private static final AgentInfo AGENT = new AgentInfo("host-1", AgentId.of("agent-1"));

    @Test
    void fromTask_단일_Task로_인스턴스를_유도한다() {
        // Given
        Task task = Task.launchedEphemeral(TaskId.forRunSpec("/prod/web"), AGENT, VERSION);

        // When
        Instance instance = Instance.fromTask(task, NOW);

        // Then
        assertThat(instance.instanceId()).isEqualTo(task.taskId().instanceId());
        assertThat(instance.tasks()).containsOnlyKeys(task.taskId());
        assertThat(instance.state().status()).isEqualTo(InstanceStatus.CREATED);
        assertThat(instance.state().since()).isEqualTo(NOW);
        assertThat(instance.state().runSpecVersion()).isEqualTo(VERSION);
        assertThat(instance.firstTask()).isEqualTo(task);
    }

    @Test
    void withTaskStatus_인스턴스_상태를_재집계한다() {
        // Given
        InstanceId instanceId = InstanceId.forRunSpec("/prod/pod");
        TaskId web = TaskId.forContainer(instanceId, "web");
        TaskId sidecar = TaskId.forContainer(instanceId, "sidecar");
        Instance instance = Instance.of(instanceId, AGENT, List.of(
            Task.launchedEphemeral(web, AGENT, VERSION).withStatus(InstanceStatus.RUNNING),
            Task.launchedEphemeral(sidecar, AGENT, VERSION).withStatus(InstanceStatus.RUNNING)
        ), NOW, VERSION);
        Instant later = NOW.plusSeconds(30);

        // When
        Instance updated = instance.withTaskStatus(sidecar, InstanceStatus.FAILED, later);

        // Then
        assertThat(instance.state().status()).isEqualTo(InstanceStatus.RUNNING);
        assertThat(updated.state().status()).isEqualTo(InstanceStatus.FAILED);
        assertThat(updated.state().since()).isEqualTo(later);
        assertThat(updated.task(sidecar)).get().extracting(Task::status).isEqualTo(InstanceStatus.FAILED);
        assertThat(updated.task(web)).get().extracting(Task::status).isEqualTo(InstanceStatus.RUNNING);
    }

    @Test
    void withTaskStatus_모든_Task가_종료되면_isTerminal() {
        // Given
        Task task = Task.launchedEphemeral(TaskId.forRunSpec("/batch"), AGENT, VERSION);
        Instance instance = Instance.fromTask(task, NOW);

        // When
        Instance finished = instance.withTaskStatus(task.taskId(), InstanceStatus.FINISHED, NOW.plusSeconds(5));

        // Then
        assertThat(instance.isTerminal()).isFalse();
        assertThat(finished.isTerminal()).isTrue();
        assertThat(finished.state().status()).isEqualTo(InstanceStatus.FINISHED);
    }

    @Test
    void withTaskStatus_UnknownTask_ThrowsException() {
        // Given
        Instance instance = Instance.fromTask(
            Task.launchedEphemeral(TaskId.forRunSpec("/batch"), AGENT, VERSION), NOW);
        TaskId unknown = TaskId.forContainer(instance.instanceId(), "other");

        // When & Then
        assertThatThrownBy(() -> instance.withTaskStatus(unknown, InstanceStatus.RUNNING, NOW))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("is not a task of");
    }

    @Test
    void constructor_TaskOfOtherInstance_ThrowsException() {
        // Given
        InstanceId instanceId = InstanceId.forRunSpec("/prod/web");
        Task foreign = Task.launchedEphemeral(TaskId.forRunSpec("/prod/web"), AGENT, VERSION);
        InstanceState state = new InstanceState(InstanceStatus.CREATED, NOW, null, null, VERSION);

        // When & Then
        assertThatThrownBy(() -> new Instance(instanceId, AGENT, state, Map.of(foreign.taskId(), foreign)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("does not belong to");
    }

    @Test
    void constructor_NoTasks_ThrowsException() {
        InstanceState state = new InstanceState(InstanceStatus.CREATED, NOW, null, null, VERSION);

        assertThatThrownBy(() -> new Instance(InstanceId.forRunSpec("/web"), AGENT, state, Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void launchedOnReservation_KeepsReservationAndResetsStatus() {
        // Given
        Task reserved = Task.reserved(TaskId.forRunSpec("/db"), AGENT, VERSION, List.of())
            .withStatus(InstanceStatus.KILLED);
        Instant newVersion = VERSION.plusSeconds(60);

        // When
        Task launched = reserved.launchedOnReservation(newVersion);

        // Then
        assertThat(launched.isReserved()).isTrue();
        assertThat(launched.status()).isEqualTo(InstanceStatus.CREATED);
        assertThat(launched.runSpecVersion()).isEqualTo(newVersion);
    }
}

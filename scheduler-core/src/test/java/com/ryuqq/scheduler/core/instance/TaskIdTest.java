package com.ryuqq.scheduler.core.instance;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TaskId / InstanceId 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskIdTest {

    @Test
    void idString_NestedRunSpec_UsesSafeForm() {
        // Given
        InstanceId instanceId = new InstanceId("/prod/web", "1234");

        // When & Then
        assertEquals("prod_web.1234", instanceId.idString());
        assertEquals("instance-prod_web.1234", instanceId.executorIdString());
        assertEquals("prod_web.1234", TaskId.forInstance(instanceId).idString());
        assertEquals("prod_web.1234.nginx", TaskId.forContainer(instanceId, "nginx").idString());
    }

    @Test
    void forRunSpec_GeneratesUniqueIds() {
        // When
        TaskId first = TaskId.forRunSpec("/prod/web");
        TaskId second = TaskId.forRunSpec("/prod/web");

        // Then
        assertNotEquals(first, second);
        assertEquals("/prod/web", first.runSpecId());
    }

    @Test
    void forContainer_NullName_ThrowsException() {
        InstanceId instanceId = InstanceId.forRunSpec("/prod/web");

        assertThrows(IllegalArgumentException.class, () -> TaskId.forContainer(instanceId, null));
    }

    @Test
    void constructor_BlankRunSpec_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> new InstanceId(" ", "1234"));
        assertTrue(exception.getMessage().contains("runSpecId"));
    }

    @Test
    void isTerminal_MatchesStatusGroups() {
        assertTrue(InstanceStatus.KILLED.isTerminal());
        assertTrue(InstanceStatus.DROPPED.isTerminal());
        assertFalse(InstanceStatus.UNREACHABLE.isTerminal());
        assertFalse(InstanceStatus.KILLING.isTerminal());
        assertTrue(InstanceStatus.KILLING.isActive());
        assertFalse(InstanceStatus.CREATED.isActive());
    }
}

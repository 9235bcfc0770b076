package com.ryuqq.scheduler.core.launch;

import com.ryuqq.scheduler.core.offer.Resource;

import java.util.List;

/**
 * 원자적으로 함께 실행되는 Task 묶음 (Pod 컨테이너들).
 *
 * @param tasks Task 명세 목록 (1개 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskGroupInfo(List<TaskInfo> tasks) {

    public TaskGroupInfo {
        if (tasks == null || tasks.isEmpty()) {
            throw new IllegalArgumentException("tasks cannot be null or empty");
        }
        tasks = List.copyOf(tasks);
    }

    public List<Resource> resources() {
        return tasks.stream()
            .flatMap(task -> task.resources().stream())
            .toList();
    }
}

package com.ryuqq.scheduler.core.matcher;

import com.ryuqq.scheduler.core.instance.TaskId;
import com.ryuqq.scheduler.core.operation.TaskOp;

/**
 * 결과 통지 대상({@link TaskOpSource})이 붙은 TaskOp.
 *
 * @param source 결과를 통지받을 Matcher
 * @param op 작업
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskOpWithSource(
    TaskOpSource source,
    TaskOp op
) {

    public TaskOpWithSource {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (op == null) {
            throw new IllegalArgumentException("op cannot be null");
        }
    }

    public TaskId taskId() {
        return op.taskId();
    }

    public void accept() {
        source.taskOpAccepted(op);
    }

    public void reject(String reason) {
        source.taskOpRejected(op, reason);
    }
}

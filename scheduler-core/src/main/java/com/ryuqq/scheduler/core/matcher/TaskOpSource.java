package com.ryuqq.scheduler.core.matcher;

import com.ryuqq.scheduler.core.operation.TaskOp;

/**
 * TaskOp을 만든 쪽(Matcher)에 제출 결과를 알려주는 콜백.
 *
 * <p>제출 계층은 반환된 TaskOp마다 정확히 한 번 {@link #taskOpAccepted(TaskOp)} 또는
 * {@link #taskOpRejected(TaskOp, String)}를 호출합니다. 호출은 matchOffer를 호출한 스레드와
 * 다른 스레드에서 비동기로 일어날 수 있습니다.</p>
 *
 * <p>Matcher는 이 콜백을 받기 전까지 작업이 수락되었다고 가정하면 안 되며,
 * 콜백을 기다리며 스스로 타임아웃을 걸지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TaskOpSource {

    /**
     * 작업이 클러스터 매니저에 제출되었음.
     *
     * @param taskOp 수락된 작업
     */
    void taskOpAccepted(TaskOp taskOp);

    /**
     * 작업이 제출되지 못했음 (정상적인 결과, 다음 라운드에서 재평가).
     *
     * @param taskOp 거절된 작업
     * @param reason 거절 사유
     */
    void taskOpRejected(TaskOp taskOp, String reason);
}

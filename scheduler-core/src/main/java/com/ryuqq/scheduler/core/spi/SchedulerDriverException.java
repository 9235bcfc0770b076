package com.ryuqq.scheduler.core.spi;

/**
 * 클러스터 매니저 제출 실패.
 *
 * <p>정상적으로 발생할 수 있는 결과입니다. 제출 계층은 이 예외를 받으면
 * 해당 작업들을 거절(reject)로 통지하고, 재시도는 상위 제어 루프에 맡깁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SchedulerDriverException extends Exception {

    public SchedulerDriverException(String message) {
        super(message);
    }

    public SchedulerDriverException(String message, Throwable cause) {
        super(message, cause);
    }
}

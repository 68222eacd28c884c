package com.ryuqq.taskqueue.runner;

/**
 * 비활성화된 TaskRunner의 진입점이 호출되었을 때 발생하는 예외.
 *
 * <p>예외 발생 시 어떠한 상태도 변경되지 않습니다.</p>
 *
 * @author TaskQueue Team
 * @since 1.0.0
 */
public class TaskRunnerDisabledException extends IllegalStateException {

    /**
     * 생성자.
     *
     * @param method 호출된 진입점 이름
     */
    public TaskRunnerDisabledException(String method) {
        super("Enable the TaskRunner to use the `" + method + "()` method");
    }
}

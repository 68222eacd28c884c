package com.ryuqq.taskqueue.core.outcome;

/**
 * 성공 결과.
 *
 * @param message 성공 메시지 (선택, null 가능)
 *
 * @author TaskQueue Team
 * @since 1.0.0
 */
public record Success(String message) implements Outcome {

    static final Success INSTANCE = new Success(null);

    /**
     * 메시지를 포함한 성공 결과 생성.
     *
     * @param message 성공 메시지
     * @return Success 인스턴스
     */
    public static Success of(String message) {
        return new Success(message);
    }
}

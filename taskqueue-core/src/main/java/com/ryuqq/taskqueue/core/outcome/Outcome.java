package com.ryuqq.taskqueue.core.outcome;

/**
 * 작업 처리 결과.
 *
 * <p>Outcome은 작업이 정상적으로 끝났을 때 선언하는 두 가지 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 성공 (값을 반환하지 않는 작업의 기본값)</li>
 *   <li>{@link Failure}: 선언된 실패 (예외가 아닌 정상 결과)</li>
 * </ul>
 *
 * <p>작업이 예외를 던진 경우는 Outcome이 아니라 {@link Settlement#error()}로 전달됩니다.
 * 선언된 실패와 예외는 서로 독립된 채널입니다.</p>
 *
 * @author TaskQueue Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Success, Failure {

    /**
     * 메시지 없는 성공 결과.
     *
     * @return Success 인스턴스
     */
    static Outcome success() {
        return Success.INSTANCE;
    }

    /**
     * 사유 없는 실패 결과.
     *
     * @return Failure 인스턴스
     */
    static Outcome failure() {
        return Failure.of(null);
    }

    /**
     * 사유를 포함한 실패 결과.
     *
     * @param reason 실패 사유 (null 허용)
     * @return Failure 인스턴스
     */
    static Outcome failure(String reason) {
        return Failure.of(reason);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * 결과가 선언된 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailure() {
        return this instanceof Failure;
    }
}

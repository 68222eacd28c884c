package com.ryuqq.taskqueue.core.outcome;

/**
 * 작업의 종료(settlement) 결과.
 *
 * <p>한 요소에 대한 작업이 종료되면 정확히 하나의 Settlement가 만들어집니다.</p>
 *
 * <p><strong>세 가지 경우:</strong></p>
 * <ul>
 *   <li>예외 발생: {@code error != null}, {@code outcome == null}</li>
 *   <li>선언된 실패: {@code outcome}이 {@link Failure}</li>
 *   <li>성공: {@code outcome}이 {@link Success}</li>
 * </ul>
 *
 * @param item 처리된 요소
 * @param outcome 정상 종료 시 결과 (예외 시 null)
 * @param error 예외 종료 시 원인 (정상 종료 시 null)
 * @param <T> 요소 타입
 *
 * @author TaskQueue Team
 * @since 1.0.0
 */
public record Settlement<T>(T item, Outcome outcome, Throwable error) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException item이 null이거나 outcome과 error가 동시에 설정/누락된 경우
     */
    public Settlement {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if ((outcome == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of outcome or error must be set");
        }
    }

    /**
     * 정상 종료 Settlement 생성.
     *
     * @param item 처리된 요소
     * @param outcome 결과 (null이면 Success)
     * @param <T> 요소 타입
     * @return Settlement 인스턴스
     */
    public static <T> Settlement<T> completed(T item, Outcome outcome) {
        return new Settlement<>(item, outcome == null ? Outcome.success() : outcome, null);
    }

    /**
     * 예외 종료 Settlement 생성.
     *
     * @param item 처리된 요소
     * @param error 원인
     * @param <T> 요소 타입
     * @return Settlement 인스턴스
     */
    public static <T> Settlement<T> errored(T item, Throwable error) {
        return new Settlement<>(item, null, error);
    }

    public boolean isError() {
        return error != null;
    }

    public boolean isFailure() {
        return outcome != null && outcome.isFailure();
    }

    public boolean isSuccess() {
        return outcome != null && outcome.isSuccess();
    }
}

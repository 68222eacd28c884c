package com.ryuqq.taskqueue.core.outcome;

/**
 * 선언된 실패 결과.
 *
 * <p>작업이 예외 없이 완료되었지만 처리 결과가 실패임을 스스로 알리는 경우입니다.
 * 재시도되지 않으며 {@code onFailure} 핸들러로 전달됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>유효성 검증 실패</li>
 *   <li>비즈니스 규칙 위반</li>
 * </ul>
 *
 * @param reason 실패 사유 (선택, null 가능)
 *
 * @author TaskQueue Team
 * @since 1.0.0
 */
public record Failure(String reason) implements Outcome {

    /**
     * Failure 생성.
     *
     * @param reason 실패 사유
     * @return Failure 인스턴스
     */
    public static Failure of(String reason) {
        return new Failure(reason);
    }
}

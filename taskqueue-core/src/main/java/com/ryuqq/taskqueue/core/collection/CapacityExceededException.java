package com.ryuqq.taskqueue.core.collection;

/**
 * 고정 용량을 초과하는 변경이 시도되었을 때 발생하는 예외.
 *
 * <p>예외가 발생한 경우 컨테이너 상태는 변경되지 않습니다.</p>
 *
 * @author TaskQueue Team
 * @since 1.0.0
 */
public class CapacityExceededException extends IllegalStateException {

    private final int capacity;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param capacity 초과된 용량
     */
    public CapacityExceededException(String message, int capacity) {
        super(message);
        this.capacity = capacity;
    }

    /**
     * 초과된 용량 조회.
     *
     * @return 컨테이너의 최대 용량
     */
    public int getCapacity() {
        return capacity;
    }
}

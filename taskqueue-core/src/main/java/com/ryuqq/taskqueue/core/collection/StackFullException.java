package com.ryuqq.taskqueue.core.collection;

/**
 * 가득 찬 스택에 push를 시도했을 때 발생하는 예외.
 *
 * @author TaskQueue Team
 * @since 1.0.0
 */
public class StackFullException extends CapacityExceededException {

    /**
     * 생성자.
     *
     * @param capacity 스택의 최대 용량
     */
    public StackFullException(int capacity) {
        super("Stack is full (capacity: " + capacity + ")", capacity);
    }
}

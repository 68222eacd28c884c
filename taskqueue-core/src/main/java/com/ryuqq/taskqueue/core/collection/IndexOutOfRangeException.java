package com.ryuqq.taskqueue.core.collection;

/**
 * 유효하지 않은 인덱스로 update/insert를 시도했을 때 발생하는 예외.
 *
 * @author TaskQueue Team
 * @since 1.0.0
 */
public class IndexOutOfRangeException extends IndexOutOfBoundsException {

    /**
     * 생성자.
     *
     * @param index 요청된 인덱스
     * @param length 현재 길이
     */
    public IndexOutOfRangeException(int index, int length) {
        super("index " + index + " out of range (length: " + length + ")");
    }
}

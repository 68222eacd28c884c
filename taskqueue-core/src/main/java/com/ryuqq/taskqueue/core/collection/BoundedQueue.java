package com.ryuqq.taskqueue.core.collection;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 용량이 제한된 FIFO 큐.
 *
 * <p>{@link BoundedSequence}의 꼬리에 추가하고 머리에서 꺼냅니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>enqueue(): 가득 찬 경우 {@link QueueFullException}, 상태 불변</li>
 *   <li>dequeue(): 비어 있으면 {@link Optional#empty()} (예외 아님)</li>
 *   <li>clear(): 멱등, 용량 유지</li>
 * </ul>
 *
 * <p>thread-safe하지 않습니다.</p>
 *
 * @param <T> 요소 타입
 * @author TaskQueue Team
 * @since 1.0.0
 */
public class BoundedQueue<T> {

    private final BoundedSequence<T> elements;

    /**
     * 생성자.
     *
     * @param capacity 최대 용량 (양수 또는 {@link BoundedSequence#UNBOUNDED})
     * @param initialElements 초기 요소
     * @throws IllegalArgumentException capacity가 양수가 아닌 경우
     * @throws CapacityExceededException 초기 요소 수가 용량을 초과한 경우
     */
    public BoundedQueue(int capacity, Collection<? extends T> initialElements) {
        this.elements = new BoundedSequence<>(capacity, initialElements);
    }

    /**
     * 가변 인자 생성자.
     *
     * @param capacity 최대 용량
     * @param initialElements 초기 요소
     */
    @SafeVarargs
    public BoundedQueue(int capacity, T... initialElements) {
        this(capacity, Arrays.asList(initialElements));
    }

    /**
     * 꼬리에 요소 추가.
     *
     * @param element 추가할 요소
     * @return this
     * @throws QueueFullException 가득 찬 경우
     */
    public BoundedQueue<T> enqueue(T element) {
        if (elements.isFull()) {
            throw new QueueFullException(elements.capacity());
        }
        elements.append(element);
        return this;
    }

    /**
     * 머리 요소를 꺼내어 반환.
     *
     * @return 머리 요소, 비어 있으면 empty
     */
    public Optional<T> dequeue() {
        return elements.remove(0);
    }

    /**
     * 머리 요소 조회 (제거하지 않음).
     *
     * @return 머리 요소, 비어 있으면 empty
     */
    public Optional<T> peek() {
        return elements.first();
    }

    public BoundedQueue<T> clear() {
        elements.clear();
        return this;
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public boolean isFull() {
        return elements.isFull();
    }

    public int length() {
        return elements.length();
    }

    public int capacity() {
        return elements.capacity();
    }

    /**
     * 머리부터 꼬리까지의 읽기 전용 스냅샷.
     *
     * @return 불변 리스트
     */
    public List<T> state() {
        return elements.toList();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{state=" + elements.toList() + ", capacity=" + elements.capacity() + "}";
    }
}

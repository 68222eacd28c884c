package com.ryuqq.taskqueue.core.collection;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 용량이 제한된 LIFO 스택.
 *
 * <p>{@link BoundedSequence}의 꼬리를 top으로 사용합니다.
 * push는 가득 찬 경우 {@link StackFullException}, pop/peek는 비어 있으면 empty를 반환합니다.</p>
 *
 * @param <T> 요소 타입
 * @author TaskQueue Team
 * @since 1.0.0
 */
public class BoundedStack<T> {

    private final BoundedSequence<T> elements;

    public BoundedStack(int capacity, Collection<? extends T> initialElements) {
        this.elements = new BoundedSequence<>(capacity, initialElements);
    }

    @SafeVarargs
    public BoundedStack(int capacity, T... initialElements) {
        this(capacity, Arrays.asList(initialElements));
    }

    /**
     * top에 요소 추가.
     *
     * @param element 추가할 요소
     * @return this
     * @throws StackFullException 가득 찬 경우
     */
    public BoundedStack<T> push(T element) {
        if (elements.isFull()) {
            throw new StackFullException(elements.capacity());
        }
        elements.append(element);
        return this;
    }

    /**
     * top 요소를 꺼내어 반환.
     *
     * @return top 요소, 비어 있으면 empty
     */
    public Optional<T> pop() {
        return elements.remove(elements.length() - 1);
    }

    public Optional<T> peek() {
        return elements.last();
    }

    public BoundedStack<T> clear() {
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
     * bottom부터 top까지의 읽기 전용 스냅샷.
     *
     * @return 불변 리스트
     */
    public List<T> state() {
        return elements.toList();
    }

    @Override
    public String toString() {
        return "BoundedStack{state=" + elements.toList() + ", capacity=" + elements.capacity() + "}";
    }
}

package com.ryuqq.taskqueue.core.collection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 용량이 제한된 순서 있는 요소 컨테이너.
 *
 * <p>큐와 스택이 공유하는 저장소입니다. 배열 기반이며 삽입 순서가 유지됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>{@code length() <= capacity()} 항상 성립</li>
 *   <li>append/prepend/insert는 가득 찬 상태에서 {@link CapacityExceededException} 발생, 상태 불변</li>
 *   <li>update는 길이를 바꾸지 않으므로 용량 검사 대상이 아님</li>
 *   <li>null 요소는 허용하지 않음 (부재는 {@link Optional#empty()}로 표현)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> thread-safe하지 않습니다.
 * 여러 스레드에서 변경하려면 외부 동기화가 필요합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * BoundedSequence<String> sequence = new BoundedSequence<>(3, List.of("a", "b"));
 * sequence.append("c");          // [a, b, c]
 * sequence.isFull();             // true
 * sequence.remove(0);            // Optional[a]
 * sequence.first();              // Optional[b]
 * }</pre>
 *
 * @param <T> 요소 타입
 * @author TaskQueue Team
 * @since 1.0.0
 */
public final class BoundedSequence<T> {

    /**
     * 용량 제한 없음.
     */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final List<T> elements;
    private final int capacity;

    /**
     * 빈 시퀀스 생성.
     *
     * @param capacity 최대 용량 (양수)
     * @throws IllegalArgumentException capacity가 양수가 아닌 경우
     */
    public BoundedSequence(int capacity) {
        this(capacity, List.of());
    }

    /**
     * 초기 요소를 포함한 시퀀스 생성.
     *
     * @param capacity 최대 용량 (양수)
     * @param initialElements 초기 요소 (순서대로 추가됨)
     * @throws IllegalArgumentException capacity가 양수가 아니거나 initialElements가 null 또는 null 요소를 포함한 경우
     * @throws CapacityExceededException 초기 요소 수가 용량을 초과한 경우
     */
    public BoundedSequence(int capacity, Collection<? extends T> initialElements) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        if (initialElements == null) {
            throw new IllegalArgumentException("initialElements cannot be null");
        }
        if (initialElements.size() > capacity) {
            throw new CapacityExceededException(
                "initial elements exceed the capacity " + capacity + " by " + (initialElements.size() - capacity),
                capacity
            );
        }
        for (T element : initialElements) {
            requireElement(element);
        }

        this.capacity = capacity;
        this.elements = new ArrayList<>(initialElements);
    }

    /**
     * 끝에 요소 추가.
     *
     * @param element 추가할 요소
     * @return this
     * @throws CapacityExceededException 가득 찬 경우
     */
    public BoundedSequence<T> append(T element) {
        requireElement(element);
        checkNotFull();
        elements.add(element);
        return this;
    }

    /**
     * 앞에 요소 추가.
     *
     * @param element 추가할 요소
     * @return this
     * @throws CapacityExceededException 가득 찬 경우
     */
    public BoundedSequence<T> prepend(T element) {
        requireElement(element);
        checkNotFull();
        elements.add(0, element);
        return this;
    }

    /**
     * 지정 위치에 요소 삽입.
     *
     * @param index 삽입 위치 (0 이상 length 이하)
     * @param element 삽입할 요소
     * @return this
     * @throws CapacityExceededException 가득 찬 경우
     * @throws IndexOutOfRangeException index가 범위를 벗어난 경우
     */
    public BoundedSequence<T> insert(int index, T element) {
        requireElement(element);
        checkNotFull();
        if (index < 0 || index > elements.size()) {
            throw new IndexOutOfRangeException(index, elements.size());
        }
        elements.add(index, element);
        return this;
    }

    /**
     * 지정 위치의 요소 교체.
     *
     * <p>길이가 변하지 않으므로 가득 찬 상태에서도 허용됩니다.</p>
     *
     * @param index 교체 위치
     * @param element 새 요소
     * @return this
     * @throws IndexOutOfRangeException index가 범위를 벗어난 경우
     */
    public BoundedSequence<T> update(int index, T element) {
        requireElement(element);
        if (!isValidIndex(index)) {
            throw new IndexOutOfRangeException(index, elements.size());
        }
        elements.set(index, element);
        return this;
    }

    /**
     * 지정 위치의 요소를 제거하고 반환.
     *
     * @param index 제거 위치
     * @return 제거된 요소, index가 범위를 벗어나면 empty
     */
    public Optional<T> remove(int index) {
        if (!isValidIndex(index)) {
            return Optional.empty();
        }
        return Optional.of(elements.remove(index));
    }

    /**
     * 지정 위치의 요소 조회.
     *
     * @param index 조회 위치
     * @return 요소, index가 범위를 벗어나면 empty
     */
    public Optional<T> get(int index) {
        if (!isValidIndex(index)) {
            return Optional.empty();
        }
        return Optional.of(elements.get(index));
    }

    public Optional<T> first() {
        return get(0);
    }

    public Optional<T> last() {
        return get(elements.size() - 1);
    }

    /**
     * 모든 요소 제거. 용량은 유지됩니다.
     *
     * @return this
     */
    public BoundedSequence<T> clear() {
        elements.clear();
        return this;
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public boolean isFull() {
        return elements.size() == capacity;
    }

    public int length() {
        return elements.size();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * 현재 요소의 읽기 전용 스냅샷.
     *
     * @return 순서가 유지된 불변 리스트
     */
    public List<T> toList() {
        return List.copyOf(elements);
    }

    @Override
    public String toString() {
        return "BoundedSequence{elements=" + elements + ", capacity="
            + (capacity == UNBOUNDED ? "unbounded" : capacity) + "}";
    }

    private boolean isValidIndex(int index) {
        return index >= 0 && index < elements.size();
    }

    private void checkNotFull() {
        if (isFull()) {
            throw new CapacityExceededException("sequence is full of size " + capacity, capacity);
        }
    }

    private static void requireElement(Object element) {
        if (element == null) {
            throw new IllegalArgumentException("element cannot be null");
        }
    }
}

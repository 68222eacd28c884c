package com.ryuqq.taskqueue.core.executor;

import java.util.Iterator;
import java.util.Optional;

/**
 * drain 대상 요소 공급자.
 *
 * <p>{@link #poll()}은 다음 요소를 꺼내며, 더 이상 없으면 empty를 반환합니다.
 * 큐 기반 공급자는 empty를 반환한 뒤에도 새 요소가 추가되면 다시 값을 반환할 수 있습니다.</p>
 *
 * <p>drain 중에는 한 번에 한 스레드에서만 호출됩니다.</p>
 *
 * @param <T> 요소 타입
 * @author TaskQueue Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ItemSource<T> {

    /**
     * 다음 요소를 꺼냅니다.
     *
     * @return 다음 요소, 없으면 empty
     */
    Optional<T> poll();

    /**
     * Iterable 기반 공급자 생성.
     *
     * @param items 요소 목록
     * @param <T> 요소 타입
     * @return ItemSource
     * @throws IllegalArgumentException items가 null인 경우. null 요소는 poll 시점에 같은 예외로 거부됩니다.
     */
    static <T> ItemSource<T> of(Iterable<? extends T> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        Iterator<? extends T> iterator = items.iterator();
        return () -> {
            if (!iterator.hasNext()) {
                return Optional.empty();
            }
            T next = iterator.next();
            if (next == null) {
                throw new IllegalArgumentException("item cannot be null");
            }
            return Optional.of(next);
        };
    }
}

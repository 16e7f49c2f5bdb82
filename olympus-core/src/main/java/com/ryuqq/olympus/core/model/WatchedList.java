package com.ryuqq.olympus.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 추가/삭제된 항목을 추적하는 목록.
 *
 * <p>영속화 시 변경분(added, removed)만 반영할 때 사용합니다. 항목 동일성은
 * {@link #compare(Object, Object)}로 판단합니다.</p>
 *
 * <p><strong>상태 규칙:</strong></p>
 * <ul>
 *   <li>처음부터 있던 항목을 삭제하면 removed에 기록</li>
 *   <li>새로 추가한 항목을 삭제하면 added에서 제거 (removed에는 기록하지 않음)</li>
 *   <li>삭제했던 원래 항목을 다시 추가하면 removed에서 제거 (added에는 기록하지 않음)</li>
 *   <li>이미 있는 항목은 중복 추가되지 않음</li>
 * </ul>
 *
 * <p>스레드 안전하지 않습니다. Aggregate 내부에서 단일 스레드로 사용합니다.</p>
 *
 * @param <T> 항목 타입
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public abstract class WatchedList<T> {

    private final List<T> items;
    private final List<T> original;
    private final List<T> added = new ArrayList<>();
    private final List<T> removed = new ArrayList<>();

    protected WatchedList() {
        this(List.of());
    }

    /**
     * @param initial 처음부터 있던 항목
     * @throws IllegalArgumentException initial이 null인 경우
     */
    protected WatchedList(List<T> initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        this.items = new ArrayList<>(initial);
        this.original = List.copyOf(initial);
    }

    /**
     * 두 항목이 같은 항목인지 판단.
     *
     * @param a 왼쪽 항목
     * @param b 오른쪽 항목
     * @return 같은 항목이면 true
     */
    protected abstract boolean compare(T a, T b);

    public List<T> getItems() {
        return Collections.unmodifiableList(items);
    }

    public List<T> getOriginalItems() {
        return original;
    }

    public List<T> getAddedItems() {
        return Collections.unmodifiableList(added);
    }

    public List<T> getRemovedItems() {
        return Collections.unmodifiableList(removed);
    }

    public boolean exists(T item) {
        return contains(items, item) || contains(added, item);
    }

    /**
     * 항목 추가.
     *
     * @param item 항목
     */
    public void add(T item) {
        if (contains(removed, item)) {
            removeFrom(removed, item);
        }
        if (!contains(added, item) && !contains(original, item)) {
            added.add(item);
        }
        if (!contains(items, item)) {
            items.add(item);
        }
    }

    /**
     * 항목 삭제.
     *
     * @param item 항목
     */
    public void remove(T item) {
        removeFrom(items, item);

        if (contains(added, item)) {
            removeFrom(added, item);
            return;
        }
        if (contains(original, item) && !contains(removed, item)) {
            removed.add(item);
        }
    }

    private boolean contains(List<T> list, T item) {
        for (T candidate : list) {
            if (compare(item, candidate)) {
                return true;
            }
        }
        return false;
    }

    private void removeFrom(List<T> list, T item) {
        list.removeIf(candidate -> compare(item, candidate));
    }
}

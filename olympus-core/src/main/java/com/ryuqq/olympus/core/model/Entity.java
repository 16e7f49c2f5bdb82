package com.ryuqq.olympus.core.model;

import com.ryuqq.olympus.core.monad.Maybe;

/**
 * 식별자로 구분되는 도메인 객체의 기반 클래스.
 *
 * <p>속성(props)이 같아도 식별자가 다르면 다른 Entity이고, 속성이 달라도 식별자가 같으면
 * 같은 Entity입니다. 식별자가 주어지지 않으면 새 {@link Guid}가 생성됩니다.</p>
 *
 * <pre>
 * class Person extends Entity&lt;PersonProps&gt; {
 *     Person(PersonProps props, Maybe&lt;Guid&gt; id) {
 *         super(props, id);
 *     }
 * }
 *
 * new Person(props, Maybe.none());              // 새 Guid
 * new Person(props, Maybe.some(Guid.of("1")));  // 기존 Guid
 * </pre>
 *
 * @param <P> 속성 타입
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public abstract class Entity<P> {

    private final Guid id;
    private final P props;

    /**
     * @param props 속성
     * @param id 식별자 (None이면 새로 생성)
     * @throws IllegalArgumentException props 또는 id가 null인 경우
     */
    protected Entity(P props, Maybe<Guid> id) {
        if (props == null) {
            throw new IllegalArgumentException("props cannot be null");
        }
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null, use Maybe.none() to generate one");
        }
        this.props = props;
        this.id = id.getOrElseGet(Guid::generate);
    }

    public Guid getId() {
        return id;
    }

    public P getProps() {
        return props;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity<?> entity = (Entity<?>) o;
        return id.equals(entity.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id.getValue() + ", props=" + props + '}';
    }
}

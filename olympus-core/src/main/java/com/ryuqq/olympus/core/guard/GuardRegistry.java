package com.ryuqq.olympus.core.guard;

import com.ryuqq.olympus.core.guard.builtin.BuiltinGuards;
import com.ryuqq.olympus.core.monad.Result;
import com.ryuqq.olympus.core.monad.Unit;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * Guard 이름 → {@link GuardFactory} 매핑.
 *
 * <p>전역 상태가 아니라 평가기에 주입되는 값입니다. 초기화 단계에서 명시적인 등록 호출로 채우고,
 * {@link #freeze()} 이후에는 읽기 전용입니다.</p>
 *
 * <p><strong>등록 정책:</strong></p>
 * <ul>
 *   <li>이름은 유일해야 하며 덮어쓰기 불가 ({@link DuplicateGuardNameException})</li>
 *   <li>이름 패턴: {@code [A-Za-z_][A-Za-z0-9_]*}</li>
 *   <li>freeze 이후 등록 불가 ({@link IllegalStateException})</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 등록은 단일 lock으로 직렬화되고, 조회는 lock 없이
 * {@link ConcurrentHashMap}을 읽습니다. frozen 플래그는 volatile로 공개됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * GuardRegistry registry = GuardRegistry.withDefaults();
 * registry.register("uuid", args -&gt; new UuidGuard());
 * registry.freeze();
 *
 * GuardEvaluator evaluator = new GuardEvaluator(registry);
 * </pre>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public final class GuardRegistry {

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final ConcurrentMap<String, GuardFactory> factories = new ConcurrentHashMap<>();
    private final Object registrationLock = new Object();
    private volatile boolean frozen;

    /**
     * 빈 레지스트리 생성.
     */
    public GuardRegistry() {
    }

    /**
     * 기본 guard가 모두 등록된 레지스트리 생성 (freeze되지 않음).
     *
     * @return 새 GuardRegistry
     * @see BuiltinGuards
     */
    public static GuardRegistry withDefaults() {
        GuardRegistry registry = new GuardRegistry();
        BuiltinGuards.registerAll(registry);
        return registry;
    }

    /**
     * Guard 등록.
     *
     * @param name guard 이름
     * @param factory guard 팩토리
     * @throws IllegalArgumentException name 또는 factory가 null이거나 name 형식이 잘못된 경우
     * @throws DuplicateGuardNameException 같은 이름이 이미 등록된 경우
     * @throws IllegalStateException 레지스트리가 freeze된 경우
     */
    public void register(String name, GuardFactory factory) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (!NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Guard name must match [A-Za-z_][A-Za-z0-9_]* (current: " + name + ")");
        }

        synchronized (registrationLock) {
            if (frozen) {
                throw new IllegalStateException("Guard registry is frozen, cannot register " + name);
            }
            if (factories.putIfAbsent(name, factory) != null) {
                throw new DuplicateGuardNameException(name);
            }
        }
    }

    /**
     * Guard 등록 (예외 대신 Result).
     *
     * <p>중복 이름, 잘못된 이름, freeze된 레지스트리는 Err로 반환됩니다.
     * 시작 시점에 등록 실패를 한 번에 모아 확인할 때 사용합니다.</p>
     *
     * @param name guard 이름
     * @param factory guard 팩토리
     * @return Ok(UNIT) 또는 실패 사유를 담은 Err
     * @throws IllegalArgumentException name 또는 factory가 null인 경우
     */
    public Result<Unit, String> tryRegister(String name, GuardFactory factory) {
        if (name == null || factory == null) {
            throw new IllegalArgumentException("name and factory cannot be null");
        }
        try {
            register(name, factory);
            return Result.ok();
        } catch (GuardException | IllegalArgumentException | IllegalStateException e) {
            return Result.err(e.getMessage());
        }
    }

    /**
     * 이름으로 guard를 생성.
     *
     * @param name guard 이름
     * @param args 규칙 인자
     * @return Guard 인스턴스
     * @throws UnknownGuardException 등록되지 않은 이름인 경우
     * @throws MalformedRuleException 인자가 올바르지 않은 경우
     */
    public Guard resolve(String name, List<RuleArgument> args) {
        GuardFactory factory = factories.get(name);
        if (factory == null) {
            throw new UnknownGuardException(name);
        }
        Guard guard = factory.create(args == null ? List.of() : args);
        if (guard == null) {
            throw new IllegalStateException("GuardFactory for " + name + " returned null");
        }
        return guard;
    }

    /**
     * 파싱된 규칙으로 guard를 생성.
     *
     * @param rule 규칙
     * @return Guard 인스턴스
     * @throws UnknownGuardException 등록되지 않은 이름인 경우
     */
    public Guard resolve(GuardRule rule) {
        return resolve(rule.name(), rule.args());
    }

    public boolean has(String name) {
        return name != null && factories.containsKey(name);
    }

    /**
     * 등록된 이름 목록 (정렬됨, 스냅샷).
     *
     * @return 불변 이름 집합
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
    }

    public int size() {
        return factories.size();
    }

    /**
     * 이후 등록을 막음. 여러 번 호출해도 안전합니다.
     */
    public void freeze() {
        synchronized (registrationLock) {
            frozen = true;
        }
    }

    public boolean isFrozen() {
        return frozen;
    }
}

package com.ryuqq.olympus.core.usecase;

/**
 * 애플리케이션 use case.
 *
 * <pre>
 * UseCase&lt;CreateUserCommand, Result&lt;User, UseCaseError&gt;&gt; createUser = command -&gt; ...;
 * createUser.execute(command);
 * </pre>
 *
 * @param <I> 요청 타입
 * @param <O> 응답 타입
 *
 * @author Olympus Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface UseCase<I, O> {

    O execute(I request);
}

package com.ryuqq.olympus.core.guard;

/**
 * 이미 등록된 이름으로 guard를 다시 등록하려 할 때 발생.
 *
 * <p>레지스트리는 덮어쓰기를 허용하지 않습니다.</p>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public class DuplicateGuardNameException extends GuardException {

    private final String guardName;

    public DuplicateGuardNameException(String guardName) {
        super("Guard " + guardName + " is already registered");
        this.guardName = guardName;
    }

    public String getGuardName() {
        return guardName;
    }
}

package com.ryuqq.olympus.core.guard;

/**
 * 규칙 문자열이 등록되지 않은 guard 이름을 참조할 때 발생.
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public class UnknownGuardException extends GuardException {

    private final String guardName;

    public UnknownGuardException(String guardName) {
        super("Guard " + guardName + " is not registered");
        this.guardName = guardName;
    }

    public String getGuardName() {
        return guardName;
    }
}

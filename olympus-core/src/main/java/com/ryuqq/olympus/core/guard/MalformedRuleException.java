package com.ryuqq.olympus.core.guard;

/**
 * 규칙 문자열이 문법에 맞지 않거나 guard 인자가 올바르지 않을 때 발생.
 *
 * <p>문법 오류인 경우 메시지에 위치 표시가 포함됩니다:</p>
 * <pre>
 * Expected ] at position 6:
 * lt[18
 *       ^
 * </pre>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public class MalformedRuleException extends GuardException {

    private final String statement;
    private final int position;

    /**
     * 문법 오류.
     *
     * @param statement 규칙 문자열
     * @param position 오류 위치 (0부터)
     * @param reason 오류 내용
     */
    public MalformedRuleException(String statement, int position, String reason) {
        super(reason + " at position " + position + ":\n" + statement + "\n" + " ".repeat(position) + "^");
        this.statement = statement;
        this.position = position;
    }

    /**
     * 위치가 없는 오류 (인자 개수, 인자 종류 등).
     *
     * @param reason 오류 내용
     */
    public MalformedRuleException(String reason) {
        this(reason, null);
    }

    public MalformedRuleException(String reason, Throwable cause) {
        super(reason, cause);
        this.statement = null;
        this.position = -1;
    }

    /**
     * @return 규칙 문자열, 위치 없는 오류면 null
     */
    public String getStatement() {
        return statement;
    }

    /**
     * @return 오류 위치, 위치 없는 오류면 -1
     */
    public int getPosition() {
        return position;
    }
}

package com.ryuqq.olympus.core.guard;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 규칙 문자열 파서.
 *
 * <p><strong>문법:</strong></p>
 * <pre>
 * rules  := rule ("|" rule)*
 * rule   := ["!"] name [ "[" args "]" | "(" args ")" ]
 * args   := arg ("," arg)*
 * arg    := regex | quoted | list | tuple | bare
 * regex  := r"..."        (역슬래시 유지, \" 는 따옴표)
 * quoted := "..."         (\" 와 \\ 이스케이프)
 * list   := "[" args "]"
 * tuple  := "(" args ")"
 * bare   := [ ] ( ) , " | 를 제외한 문자열
 * name   := [A-Za-z_][A-Za-z0-9_]*
 * </pre>
 *
 * <p>bare 인자는 {@code true}/{@code false}, {@code none}/{@code null}, 숫자, 텍스트 순으로 분류됩니다.
 * 토큰 앞뒤 공백은 무시하며, 공백뿐인 규칙 문자열은 빈 규칙 목록입니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * RuleParser.parse("required|regex[r\"^[a-zA-Z0-9 ]+$\"]|lt[18]");
 * // [required, regex[r"^[a-zA-Z0-9 ]+$"], lt[18]]
 *
 * RuleParser.parse("!empty|between[1, 10]|in[[a, b, c]]");
 * </pre>
 *
 * <p>이 클래스는 상태를 가지므로 호출마다 새 인스턴스를 사용합니다 ({@link #parse(String)}).</p>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public final class RuleParser {

    private static final String PUNCTUATORS = "[](),\"|";
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    private final String statement;
    private final int length;
    private int pos;

    private RuleParser(String statement) {
        this.statement = statement;
        this.length = statement.length();
        this.pos = 0;
    }

    /**
     * 규칙 문자열을 GuardRule 목록으로 파싱.
     *
     * @param statement 규칙 문자열
     * @return 순서가 유지된 불변 규칙 목록
     * @throws IllegalArgumentException statement가 null인 경우
     * @throws MalformedRuleException 문법 오류인 경우
     */
    public static List<GuardRule> parse(String statement) {
        if (statement == null) {
            throw new IllegalArgumentException("statement cannot be null");
        }
        return new RuleParser(statement).parseRules();
    }

    private List<GuardRule> parseRules() {
        skipWhitespace();
        if (atEnd()) {
            return List.of();
        }

        List<GuardRule> rules = new ArrayList<>();
        while (true) {
            rules.add(parseRule());
            skipWhitespace();
            if (atEnd()) {
                return List.copyOf(rules);
            }
            if (peek() != '|') {
                throw error("Expected |");
            }
            pos++;
            skipWhitespace();
            if (atEnd()) {
                throw error("Expected guard name after |");
            }
        }
    }

    private GuardRule parseRule() {
        boolean negate = false;
        if (peek() == '!') {
            negate = true;
            pos++;
            skipWhitespace();
        }

        String name = parseName();
        skipWhitespace();

        List<RuleArgument> args = List.of();
        if (!atEnd() && (peek() == '[' || peek() == '(')) {
            args = parseGroup();
        }
        return new GuardRule(name, negate, args);
    }

    private String parseName() {
        if (atEnd() || !isNameStart(peek())) {
            throw error("Expected guard name");
        }
        int start = pos;
        while (!atEnd() && isNamePart(peek())) {
            pos++;
        }
        return statement.substring(start, pos);
    }

    private List<RuleArgument> parseGroup() {
        char close = peek() == '[' ? ']' : ')';
        pos++;

        skipWhitespace();
        if (atEnd()) {
            throw error("Expected " + close);
        }
        if (peek() == close) {
            pos++;
            return List.of();
        }

        List<RuleArgument> items = new ArrayList<>();
        while (true) {
            items.add(parseArgument());
            skipWhitespace();
            if (atEnd()) {
                throw error("Expected " + close);
            }
            char c = peek();
            if (c == close) {
                pos++;
                return List.copyOf(items);
            }
            if (c != ',') {
                throw error("Expected , or " + close);
            }
            pos++;
        }
    }

    private RuleArgument parseArgument() {
        skipWhitespace();
        if (atEnd()) {
            throw error("Expected argument");
        }

        char c = peek();
        if (c == '[' || c == '(') {
            return new RuleArgument.Sequence(parseGroup());
        }
        if (c == '"') {
            return new RuleArgument.Text(parseQuoted());
        }
        if (c == 'r' && pos + 1 < length && statement.charAt(pos + 1) == '"') {
            pos++;
            return new RuleArgument.RegexLiteral(parseRegex());
        }
        return parseBare();
    }

    private String parseQuoted() {
        pos++; // opening "
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (atEnd()) {
                throw error("Expected \"");
            }
            char c = peek();
            if (c == '\\' && pos + 1 < length) {
                sb.append(statement.charAt(pos + 1));
                pos += 2;
            } else if (c == '"') {
                pos++;
                return sb.toString();
            } else {
                sb.append(c);
                pos++;
            }
        }
    }

    private String parseRegex() {
        pos++; // opening "
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (atEnd()) {
                throw error("Expected \"");
            }
            char c = peek();
            if (c == '\\' && pos + 1 < length) {
                char next = statement.charAt(pos + 1);
                if (next != '"') {
                    sb.append(c);
                }
                sb.append(next);
                pos += 2;
            } else if (c == '"') {
                pos++;
                return sb.toString();
            } else {
                sb.append(c);
                pos++;
            }
        }
    }

    private RuleArgument parseBare() {
        int start = pos;
        StringBuilder sb = new StringBuilder();
        while (!atEnd() && PUNCTUATORS.indexOf(peek()) < 0) {
            char c = peek();
            if (c == '\\' && pos + 1 < length) {
                sb.append(statement.charAt(pos + 1));
                pos += 2;
            } else {
                sb.append(c);
                pos++;
            }
        }

        String token = sb.toString().strip();
        if (token.isEmpty()) {
            pos = start;
            throw error("Expected argument");
        }
        return classify(token);
    }

    private static RuleArgument classify(String token) {
        switch (token.toLowerCase(Locale.ROOT)) {
            case "true":
                return new RuleArgument.Flag(true);
            case "false":
                return new RuleArgument.Flag(false);
            case "none":
            case "null":
                return new RuleArgument.Nil();
            default:
                if (NUMBER.matcher(token).matches()) {
                    return RuleArgument.Numeric.of(token);
                }
                return new RuleArgument.Text(token);
        }
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private boolean atEnd() {
        return pos >= length;
    }

    private char peek() {
        return statement.charAt(pos);
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isNamePart(char c) {
        return isNameStart(c) || (c >= '0' && c <= '9');
    }

    private MalformedRuleException error(String reason) {
        return new MalformedRuleException(statement, pos, reason);
    }
}

package com.ryuqq.olympus.core.guard;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RuleParser 테스트.
 *
 * @author Olympus Team
 * @since 1.0.0
 */
class RuleParserTest {

    @Test
    void parse_PipeSeparatedRules_PreservesOrder() {
        // When
        List<GuardRule> rules = RuleParser.parse("required|regex[r\"^[a-zA-Z0-9 ]+$\"]|lt[18]");

        // Then
        assertEquals(3, rules.size());
        assertEquals(GuardRule.of("required"), rules.get(0));
        assertEquals("regex", rules.get(1).name());
        assertEquals(List.of(new RuleArgument.RegexLiteral("^[a-zA-Z0-9 ]+$")), rules.get(1).args());
        assertEquals("lt", rules.get(2).name());
        assertEquals(List.of(RuleArgument.Numeric.of("18")), rules.get(2).args());
    }

    @Test
    void parse_NegatedRule_SetsNegateFlag() {
        GuardRule rule = RuleParser.parse("!empty").get(0);

        assertTrue(rule.negate());
        assertEquals("empty", rule.name());
        assertEquals("!empty", rule.toString());
    }

    @Test
    void parse_WhitespaceAroundTokens_IsIgnored() {
        List<GuardRule> rules = RuleParser.parse("  required |  ! lt [ 18 ]  ");

        assertEquals(2, rules.size());
        assertTrue(rules.get(1).negate());
        assertEquals(new BigDecimal("18"), rules.get(1).args().get(0).toValue());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\t\n"})
    void parse_BlankStatement_ReturnsEmptyChain(String statement) {
        assertTrue(RuleParser.parse(statement).isEmpty());
    }

    @Test
    void parse_BareArguments_AreClassified() {
        List<RuleArgument> args = RuleParser.parse("eq[true, FALSE, none, null, -2.5, 7, hello world]").get(0).args();

        assertEquals(new RuleArgument.Flag(true), args.get(0));
        assertEquals(new RuleArgument.Flag(false), args.get(1));
        assertEquals(new RuleArgument.Nil(), args.get(2));
        assertEquals(new RuleArgument.Nil(), args.get(3));
        assertEquals(RuleArgument.Numeric.of("-2.5"), args.get(4));
        assertEquals(RuleArgument.Numeric.of("7"), args.get(5));
        assertEquals(new RuleArgument.Text("hello world"), args.get(6));
    }

    @Test
    void parse_QuotedArgument_KeepsPunctuators() {
        RuleArgument arg = RuleParser.parse("eq[\"a, [b] | c\"]").get(0).args().get(0);

        assertEquals(new RuleArgument.Text("a, [b] | c"), arg);
    }

    @Test
    void parse_QuotedArgument_HandlesEscapes() {
        RuleArgument arg = RuleParser.parse("eq[\"say \\\"hi\\\" \\\\ bye\"]").get(0).args().get(0);

        assertEquals(new RuleArgument.Text("say \"hi\" \\ bye"), arg);
    }

    @Test
    void parse_RegexLiteral_KeepsBackslashes() {
        RuleArgument digits = RuleParser.parse("regex[r\"^\\d+$\"]").get(0).args().get(0);
        RuleArgument quote = RuleParser.parse("regex[r\"a\\\"b\"]").get(0).args().get(0);

        assertEquals(new RuleArgument.RegexLiteral("^\\d+$"), digits);
        assertEquals(new RuleArgument.RegexLiteral("a\"b"), quote);
    }

    @Test
    void parse_NestedListAndTuple_BecomeSequences() {
        List<RuleArgument> list = RuleParser.parse("in[[a, b, c]]").get(0).args();
        List<RuleArgument> tuple = RuleParser.parse("in((1, 2), x)").get(0).args();

        assertEquals(1, list.size());
        assertEquals(new RuleArgument.Sequence(List.of(
            new RuleArgument.Text("a"), new RuleArgument.Text("b"), new RuleArgument.Text("c")
        )), list.get(0));
        assertEquals("[a, b, c]", list.get(0).text());

        assertEquals(2, tuple.size());
        assertInstanceOf(RuleArgument.Sequence.class, tuple.get(0));
        assertEquals(List.of(new BigDecimal("1"), new BigDecimal("2")), tuple.get(0).toValue());
    }

    @Test
    void parse_EmptyGroup_ReturnsNoArguments() {
        assertTrue(RuleParser.parse("required[]").get(0).args().isEmpty());
        assertTrue(RuleParser.parse("required()").get(0).args().isEmpty());
    }

    @Test
    void parse_UnclosedGroup_ReportsPosition() {
        // When
        MalformedRuleException exception = assertThrows(
            MalformedRuleException.class,
            () -> RuleParser.parse("lt[18")
        );

        // Then
        assertEquals(5, exception.getPosition());
        assertEquals("lt[18", exception.getStatement());
        assertTrue(exception.getMessage().startsWith("Expected ] at position 5"));
        assertTrue(exception.getMessage().endsWith("lt[18\n     ^"));
    }

    @Test
    void parse_TrailingPipe_Throws() {
        MalformedRuleException exception = assertThrows(
            MalformedRuleException.class,
            () -> RuleParser.parse("required|")
        );
        assertTrue(exception.getMessage().contains("Expected guard name after |"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"|required", "required lt", "1abc", "lt[,]", "eq[\"abc", "lt[18]]", "regex[r\"abc]", "!"})
    void parse_MalformedStatement_Throws(String statement) {
        assertThrows(MalformedRuleException.class, () -> RuleParser.parse(statement));
    }

    @Test
    void parse_Null_ThrowsIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> RuleParser.parse(null));
    }

    @Test
    void guardRule_ToString_RendersArguments() {
        GuardRule rule = RuleParser.parse("!between[1, 10]").get(0);

        assertEquals("!between[1, 10]", rule.toString());
    }

    @Test
    void guardRule_ToString_KeepsDelimitersAndParsesBack() {
        // Given
        String regex = "regex[r\"^\\d{2}$\"]";
        String list = "in[[\"a, b\", c, true, none, (1, 2)]]";
        String quoted = "eq[\"say \\\"hi\\\" \\\\ bye\"]";

        // When
        GuardRule regexRule = RuleParser.parse(regex).get(0);
        GuardRule listRule = RuleParser.parse(list).get(0);
        GuardRule quotedRule = RuleParser.parse(quoted).get(0);

        // Then
        assertEquals(regex, regexRule.toString());
        assertEquals("in[[\"a, b\", \"c\", true, none, [1, 2]]]", listRule.toString());
        assertEquals(quoted, quotedRule.toString());
        assertEquals(List.of(regexRule), RuleParser.parse(regexRule.toString()));
        assertEquals(List.of(listRule), RuleParser.parse(listRule.toString()));
        assertEquals(List.of(quotedRule), RuleParser.parse(quotedRule.toString()));
    }
}

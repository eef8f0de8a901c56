package com.clawrelay.autoreply.directive;

import com.clawrelay.common.model.ElevatedLevel;
import com.clawrelay.common.model.ReasoningLevel;
import com.clawrelay.common.model.ThinkLevel;
import com.clawrelay.common.model.VerboseLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DirectiveParserTest {

    private static DirectiveParser.Parsed parse(String text) {
        return DirectiveParser.parse(text, List.of("Opus", "help"));
    }

    @Test
    void directiveLines_runInOrder_restIsResidual() {
        DirectiveParser.Parsed parsed = parse("/verbose on\n  fix the build  \n/think:high");

        assertEquals(List.of(
                new DirectiveParser.Directive(DirectiveParser.Command.VERBOSE, "on"),
                new DirectiveParser.Directive(DirectiveParser.Command.THINK, "high")), parsed.directives());
        assertEquals("fix the build", parsed.residual());
        assertTrue(parsed.inline().isEmpty());
    }

    @Test
    void commandAliases_mapToTheirCommand() {
        assertEquals(List.of(
                new DirectiveParser.Directive(DirectiveParser.Command.THINK, "max"),
                new DirectiveParser.Directive(DirectiveParser.Command.VERBOSE, "1"),
                new DirectiveParser.Directive(DirectiveParser.Command.ELEVATED, "off"),
                new DirectiveParser.Directive(DirectiveParser.Command.REASONING, "stream"),
                new DirectiveParser.Directive(DirectiveParser.Command.MODELS, "")),
                parse("/t max\n/v 1\n/elev off\n/reason stream\n/models").directives());
    }

    @Test
    void inlineLevels_areStrippedAndNotDirectives() {
        DirectiveParser.Parsed parsed = parse("please sync /think:high now");

        assertTrue(parsed.directives().isEmpty());
        assertEquals("please sync now", parsed.residual());
        assertEquals(ThinkLevel.HIGH, parsed.inline().think());
    }

    @Test
    void inlineLevels_laterWins_acrossLines() {
        DirectiveParser.Parsed parsed = parse("hello there /elevated off\nand /verbose on /v off please\n"
                + "also /reasoning stream");

        assertEquals("hello there\nand please\nalso", parsed.residual());
        assertEquals(new InlineLevels(null, VerboseLevel.OFF, ElevatedLevel.OFF, ReasoningLevel.STREAM),
                parsed.inline());
    }

    @Test
    void inlineWithInvalidLevel_isLeftAlone() {
        DirectiveParser.Parsed parsed = parse("I /think about it");

        assertEquals("I /think about it", parsed.residual());
        assertTrue(parsed.inline().isEmpty());
    }

    @Test
    void lineOfOnlyLevelDirectives_isPersistent() {
        DirectiveParser.Parsed parsed = parse("/think high /verbose on");

        assertEquals(2, parsed.directives().size());
        assertEquals("", parsed.residual());
        assertTrue(parsed.inline().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = { "can you /model gpt later", "run /queue collect for me", "what does /status show" })
    void inlineModelQueueStatus_stayInText(String text) {
        DirectiveParser.Parsed parsed = parse(text);

        assertTrue(parsed.directives().isEmpty());
        assertEquals(text, parsed.residual());
    }

    @Test
    void levelCommandWithSentence_isFreeText() {
        DirectiveParser.Parsed parsed = parse("/status of the deploy?");

        assertTrue(parsed.directives().isEmpty());
        assertEquals("/status of the deploy?", parsed.residual());
    }

    @Test
    void queueTakesAllArguments() {
        assertEquals(new DirectiveParser.Directive(DirectiveParser.Command.QUEUE, "collect debounce:2s cap:5"),
                parse("/queue collect debounce:2s cap:5").directives().get(0));
    }

    @Test
    void modelAliasShortcut_isCaseInsensitive() {
        assertEquals(List.of(new DirectiveParser.Directive(DirectiveParser.Command.MODEL, "Opus")),
                parse("/opus").directives());
    }

    @Test
    void reservedNameAlias_staysACommand() {
        assertEquals(List.of(new DirectiveParser.Directive(DirectiveParser.Command.HELP, "")),
                parse("/help").directives());
        assertTrue(DirectiveParser.isReserved(" Think "));
    }

    @Test
    void unknownSlashLine_isText() {
        DirectiveParser.Parsed parsed = parse("/tmp/build.log is empty");

        assertTrue(parsed.directives().isEmpty());
        assertEquals("/tmp/build.log is empty", parsed.residual());
    }
}

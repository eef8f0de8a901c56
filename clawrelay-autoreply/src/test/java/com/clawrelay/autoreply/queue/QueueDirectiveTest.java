package com.clawrelay.autoreply.queue;

import com.clawrelay.common.model.QueueDropPolicy;
import com.clawrelay.common.model.QueueMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueueDirectiveTest {

    @ParameterizedTest
    @CsvSource({
            "1500, 1500",
            "1500ms, 1500",
            "2s, 2000",
            "1.5s, 1500",
            "1m, 60000",
            "0, 0",
            "250MS, 250"
    })
    void parseDurationMs_acceptsMillisAndSuffixes(String raw, int expected) {
        assertEquals(expected, QueueDirective.parseDurationMs(raw));
    }

    @ParameterizedTest
    @ValueSource(strings = { "bogus", "-5", "2h", "", "s", "1.5.2s" })
    void parseDurationMs_rejectsMalformed(String raw) {
        assertNull(QueueDirective.parseDurationMs(raw));
    }

    @Test
    void parse_fullCommand() {
        QueueDirective.Args args = QueueDirective.parse("collect debounce:2s cap:5 drop:old");

        assertEquals(QueueMode.COLLECT, args.mode());
        assertEquals(2000, args.debounceMs());
        assertEquals(5, args.cap());
        assertEquals(QueueDropPolicy.OLD, args.drop());
        assertFalse(args.hasErrors());
        assertFalse(args.reset());
    }

    @Test
    void parse_equalsSignAndModeAlias() {
        QueueDirective.Args args = QueueDirective.parse("steer+backlog debounce=500 cap=3");

        assertEquals(QueueMode.STEER_BACKLOG, args.mode());
        assertEquals(500, args.debounceMs());
        assertEquals(3, args.cap());
    }

    @Test
    void parse_optionsOnly_hasNoMode() {
        QueueDirective.Args args = QueueDirective.parse("drop:summarize");

        assertNull(args.mode());
        assertTrue(args.hasOptions());
        assertEquals(QueueDropPolicy.SUMMARIZE, args.drop());
    }

    @ParameterizedTest
    @ValueSource(strings = { "reset", "default", "clear", "RESET" })
    void parse_resetWords(String word) {
        assertTrue(QueueDirective.parse(word).reset());
    }

    @Test
    void parse_empty() {
        assertTrue(QueueDirective.parse("  ").isEmpty());
        assertTrue(QueueDirective.parse(null).isEmpty());
    }

    @Test
    void parse_everyInvalidTokenGetsItsOwnError() {
        QueueDirective.Args args = QueueDirective.parse("collect debounce:bogus cap:zero drop:maybe");

        assertEquals(List.of(
                "Invalid debounce \"bogus\". Use ms/s/m (e.g. debounce:1500ms, debounce:2s).",
                "Invalid cap \"zero\". Use a positive integer (e.g. cap:10).",
                "Invalid drop policy \"maybe\". Use drop:old, drop:new, or drop:summarize."),
                args.errors());
    }

    @Test
    void parse_unknownMode_isAnError() {
        QueueDirective.Args args = QueueDirective.parse("sometimes");

        assertEquals(List.of("Unrecognized queue mode \"sometimes\". "
                + "Valid modes: steer, followup, collect, steer+backlog, interrupt."), args.errors());
    }

    @ParameterizedTest
    @ValueSource(strings = { "cap:0", "cap:-1", "cap:2.5", "cap:" })
    void parse_nonPositiveCap_isRejected(String token) {
        QueueDirective.Args args = QueueDirective.parse(token);

        assertNull(args.cap());
        assertEquals(1, args.errors().size());
        assertTrue(args.errors().get(0).startsWith("Invalid cap"));
    }
}

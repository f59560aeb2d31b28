package com.vidnyan.storygraph.adapter.out.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentListScannerTest {

    @Test
    void split_ShouldIgnoreCommasInsideStringsAndParens() {
        List<String> parts = ArgumentListScanner.split("\"a, b\", c=(1, 2), d='x'");

        assertEquals(List.of("\"a, b\"", "c=(1, 2)", "d='x'"), parts);
    }

    @Test
    void split_ShouldDropEmptyArguments() {
        assertEquals(List.of("a", "b"), ArgumentListScanner.split("a,, b,"));
        assertTrue(ArgumentListScanner.split("").isEmpty());
    }

    @Test
    void split_ShouldHonourEscapedQuotes() {
        List<String> parts = ArgumentListScanner.split("\"say \\\"hi, there\\\"\", x=1");

        assertEquals(2, parts.size());
        assertEquals("x=1", parts.get(1));
    }

    @Test
    void findClosingParen_ShouldSkipNestedAndQuotedParens() {
        String text = "(\"a)\", (b))";

        assertEquals(10, ArgumentListScanner.findClosingParen(text, 1));
    }

    @Test
    void findClosingParen_ShouldReturnLengthWhenUnclosed() {
        assertEquals(4, ArgumentListScanner.findClosingParen("(abc", 1));
    }

    @Test
    void parse_ShouldSeparatePositionalAndKeywordArguments() {
        ArgumentListScanner.Arguments args = ArgumentListScanner.parse("\"Eileen\", color=\"#ff0000\", slow=True");

        assertEquals(List.of("\"Eileen\""), args.positional());
        assertEquals("\"#ff0000\"", args.keyword("color"));
        assertEquals("True", args.keyword("slow"));
        assertNull(args.keyword("image"));
    }

    @Test
    void unquote_ShouldStripOnePairOfQuotes() {
        assertEquals("x", ArgumentListScanner.unquote("'x'"));
        assertEquals("Eileen", ArgumentListScanner.unquote(" \"Eileen\" "));
        assertEquals("None", ArgumentListScanner.unquote("None"));
        assertNull(ArgumentListScanner.unquote(null));
        assertNull(ArgumentListScanner.unquote(""));
    }
}

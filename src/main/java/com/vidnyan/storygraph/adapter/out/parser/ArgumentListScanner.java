package com.vidnyan.storygraph.adapter.out.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits constructor argument lists such as {@code "Eileen", color="#c8ffc8", image=("a", "b")}.
 * Tracks quote state (with backslash escapes) and parenthesis depth; only commas
 * at depth 0 outside a string separate arguments. Never throws on malformed input.
 */
final class ArgumentListScanner {

    private static final Pattern KEYWORD_ARG = Pattern.compile("^\\s*([a-zA-Z0-9_]+)\\s*=\\s*([\\s\\S]+)\\s*$");

    private ArgumentListScanner() {
    }

    /**
     * Positional and keyword arguments of one call.
     */
    record Arguments(List<String> positional, Map<String, String> keywords) {

        String keyword(String name) {
            return keywords.get(name);
        }
    }

    /**
     * Find the index of the parenthesis closing the one opened just before {@code from}.
     * Returns the text length when the list is never closed.
     */
    static int findClosingParen(String text, int from) {
        int depth = 0;
        char quote = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote && text.charAt(i - 1) != '\\') {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return text.length();
    }

    /**
     * Split an argument list at top-level commas. Empty arguments are dropped.
     */
    static List<String> split(String args) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;

        for (int i = 0; i < args.length(); i++) {
            char c = args.charAt(i);
            if (quote != 0) {
                if (c == quote && (i == 0 || args.charAt(i - 1) != '\\')) {
                    quote = 0;
                }
            } else {
                if (c == '"' || c == '\'') quote = c;
                if (c == '(') depth++;
                if (c == ')') depth--;
            }

            if (c == ',' && depth == 0 && quote == 0) {
                parts.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString().trim());
        parts.removeIf(String::isEmpty);
        return parts;
    }

    static Arguments parse(String args) {
        List<String> positional = new ArrayList<>();
        Map<String, String> keywords = new LinkedHashMap<>();

        for (String arg : split(args)) {
            Matcher m = KEYWORD_ARG.matcher(arg);
            if (m.matches()) {
                keywords.put(m.group(1), m.group(2));
            } else {
                positional.add(arg);
            }
        }
        return new Arguments(positional, keywords);
    }

    /**
     * Strip one pair of matching surrounding quotes, if present.
     */
    static String unquote(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() >= 2
                && ((trimmed.startsWith("\"") && trimmed.endsWith("\""))
                    || (trimmed.startsWith("'") && trimmed.endsWith("'")))) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }
}

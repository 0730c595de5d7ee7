package com.txt2tex;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders lexer and parser failures compiler-style: the message, the offending
 * source line with its neighbours, a caret under the column and, for common
 * mistakes, a hint.
 */
public class ErrorFormatter {
    private static final Map<Pattern, String> HINTS = new LinkedHashMap<>();

    static {
        hint("Expected 'end'", "Did you forget 'end' before starting a new block?");
        hint("Expected closing '==='", "Section markers must match: === Title ===");
        hint("Expected closing '\\*\\*'", "Solution markers must match: ** Solution N **");
        hint("after expression", "Check for missing operators or extra characters");
        hint("Unexpected character", "This character is not valid in txt2tex notation");
        hint("concatenation needs spaces", "Write sequence concatenation with spaces: <a> ^ <b>");
        hint("Expected identifier|Expected variable", "A variable or type name is required here");
        hint("Expected ':'", "Declarations need a colon between name and type");
        hint("Expected '\\)'|Expected '\\}'|Expected '\\]'|Expected '>'",
                "Make sure all brackets, braces and parentheses are balanced");
        hint("dedent", "Each proof has one conclusion; indent supporting lines beneath it");
        hint("Nesting exceeds", "Split the expression into smaller definitions");
    }

    private static void hint(String regex, String text) {
        HINTS.put(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), text);
    }

    private final String[] lines;
    private final int contextLines;

    public ErrorFormatter(String source) {
        this(source, 1);
    }

    public ErrorFormatter(String source, int contextLines) {
        this.lines = source.split("\r?\n", -1);
        this.contextLines = contextLines;
    }

    public String format(LexerException e) {
        return format(e.getRawMessage(), e.getLine(), e.getColumn());
    }

    public String format(ParseException e) {
        return format(e.getRawMessage(), e.getLine(), e.getColumn());
    }

    public String format(String message, int line, int column) {
        StringBuilder sb = new StringBuilder();
        sb.append("Error: ").append(message).append("\n\n");
        appendContext(sb, line, column);
        String hint = hintFor(message);
        if (hint != null) {
            sb.append("\n\nHint: ").append(hint);
        }
        return sb.toString();
    }

    static String hintFor(String message) {
        for (Map.Entry<Pattern, String> entry : HINTS.entrySet()) {
            if (entry.getKey().matcher(message).find()) {
                return entry.getValue();
            }
        }
        return null;
    }

    private void appendContext(StringBuilder sb, int line, int column) {
        int errorIndex = line - 1;
        int start = Math.max(0, errorIndex - contextLines);
        int end = Math.min(lines.length, errorIndex + contextLines + 1);
        int width = String.valueOf(end).length();
        String gutter = " ".repeat(width) + " | ";

        for (int i = start; i < end; i++) {
            if (i > start) {
                sb.append('\n');
            }
            sb.append(String.format("%" + width + "d | ", i + 1)).append(lines[i]);
            if (i == errorIndex) {
                sb.append('\n').append(gutter).append(" ".repeat(Math.max(0, column - 1))).append('^');
            }
        }
    }
}

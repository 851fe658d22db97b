package com.example.laborhours.export.core;

import com.example.laborhours.export.model.PlaceholderKind;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits cell text into placeholder tokens.
 *
 * Grammar:
 *   {{field}}        scalar, may sit inside surrounding text
 *   {{list:field}}   list head, expected alone in its cell
 *   {{/list}}        list terminator, expected alone in its cell
 * Whitespace inside the braces is ignored. Empty braces and an unclosed "{{"
 * are treated as literal text.
 */
public final class PlaceholderTokenizer {
    public static final String OPEN = "{{";
    public static final String CLOSE = "}}";
    public static final String LIST_PREFIX = "list:";
    public static final String TERMINATOR = "/list";

    private PlaceholderTokenizer() {
    }

    @Value
    public static class Token {
        /** Token text including the braces, exactly as it appears in the cell */
        String rawText;
        PlaceholderKind kind;
        /** Null for terminators */
        String fieldKey;
        int start;
        int end;
    }

    public static boolean mayContainPlaceholder(String text) {
        return text != null && text.contains(OPEN);
    }

    public static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        if (!mayContainPlaceholder(text)) {
            return tokens;
        }
        int from = 0;
        while (true) {
            int open = text.indexOf(OPEN, from);
            if (open < 0) {
                break;
            }
            int close = text.indexOf(CLOSE, open + OPEN.length());
            if (close < 0) {
                break;
            }
            int end = close + CLOSE.length();
            String inner = text.substring(open + OPEN.length(), close).trim();
            if (!inner.isEmpty()) {
                tokens.add(classify(text.substring(open, end), inner, open, end));
            }
            from = end;
        }
        return tokens;
    }

    private static Token classify(String raw, String inner, int start, int end) {
        if (inner.equals(TERMINATOR)) {
            return new Token(raw, PlaceholderKind.LIST_TERMINATOR, null, start, end);
        }
        if (inner.startsWith(LIST_PREFIX)) {
            String field = inner.substring(LIST_PREFIX.length()).trim();
            return new Token(raw, PlaceholderKind.LIST_HEAD, field, start, end);
        }
        return new Token(raw, PlaceholderKind.SCALAR, inner, start, end);
    }
}

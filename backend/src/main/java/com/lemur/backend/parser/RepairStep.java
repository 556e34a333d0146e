package com.lemur.backend.parser;

import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-to-text fixes for the ways generated JSON usually goes wrong. Each step is pure
 * and is applied in declaration order by {@link #applyAll(String)}.
 */
public enum RepairStep implements UnaryOperator<String> {

    /**
     * {@code \\"} becomes {@code \"} and {@code \\'} becomes {@code \'}.
     */
    COLLAPSE_DOUBLE_ESCAPES {
        @Override
        public String apply(String text) {
            return text.replace("\\\\\"", "\\\"").replace("\\\\'", "\\'");
        }
    },

    /**
     * Inside every string literal, drop a backslash that precedes anything outside the
     * JSON escape set.
     */
    STRIP_ILLEGAL_ESCAPES {
        @Override
        public String apply(String text) {
            StringBuilder out = new StringBuilder(text.length());
            boolean inString = false;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (!inString) {
                    out.append(c);
                    inString = c == '"';
                    continue;
                }
                if (c == '\\' && i + 1 < text.length()) {
                    char next = text.charAt(++i);
                    if (LEGAL_ESCAPES.indexOf(next) >= 0) {
                        out.append(c);
                    }
                    out.append(next);
                    continue;
                }
                out.append(c);
                if (c == '"') {
                    inString = false;
                }
            }
            return out.toString();
        }
    },

    /**
     * When the text looks like it carries host-language calls or several objects, keep only
     * the first balanced top-level object and drop {@code .replace(..)} and
     * {@code .split(..).join(..)} suffixes trailing a string literal.
     */
    TRUNCATE_TO_FIRST_OBJECT {
        @Override
        public String apply(String text) {
            if (!hasCallSuffix(text) && countTopLevelObjects(text) <= 1) {
                return text;
            }
            return stripCallSuffixes(firstBalancedObject(text));
        }
    };

    private static final String LEGAL_ESCAPES = "\"\\/bfnrtu";
    private static final List<String> CALL_MARKERS = List.of(".replace(", ".split(", ".join(");
    private static final Pattern CALL_SUFFIX =
            Pattern.compile("\\.split\\([^)]+\\)\\.join\\([^)]+\\)|\\.replace\\([^)]+\\)");

    /**
     * Run every step in order.
     */
    public static String applyAll(String text) {
        String result = text;
        for (RepairStep step : values()) {
            result = step.apply(result);
        }
        return result;
    }

    static boolean hasCallSuffix(String text) {
        return CALL_MARKERS.stream().anyMatch(text::contains);
    }

    /**
     * Number of objects opened at depth zero, ignoring braces inside string literals.
     */
    static int countTopLevelObjects(String text) {
        int count = 0;
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                if (depth == 0) {
                    count++;
                }
                depth++;
            } else if (c == '}' && depth > 0) {
                depth--;
            }
        }
        return count;
    }

    /**
     * Everything from the first line starting with '{' up to the brace that brings the depth
     * back to zero. Returns the input unchanged when no line starts an object.
     */
    static String firstBalancedObject(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder out = new StringBuilder();
        boolean started = false;
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;

        for (String line : lines) {
            if (!started) {
                if (!line.strip().startsWith("{")) {
                    continue;
                }
                started = true;
            } else {
                out.append('\n');
            }

            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                out.append(c);
                if (inString) {
                    if (escaped) {
                        escaped = false;
                    } else if (c == '\\') {
                        escaped = true;
                    } else if (c == '"') {
                        inString = false;
                    }
                    continue;
                }
                if (c == '"') {
                    inString = true;
                } else if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return out.toString();
                    }
                }
            }
        }
        return started ? out.toString() : text;
    }

    /**
     * Remove call chains that directly follow the closing quote of a string literal.
     */
    static String stripCallSuffixes(String text) {
        StringBuilder out = new StringBuilder(text.length());
        Matcher suffix = CALL_SUFFIX.matcher(text);
        boolean inString = false;
        boolean escaped = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i++);
            out.append(c);
            if (!inString) {
                inString = c == '"';
                continue;
            }
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                inString = false;
                while (suffix.region(i, text.length()).lookingAt()) {
                    i = suffix.end();
                }
            }
        }
        return out.toString();
    }
}

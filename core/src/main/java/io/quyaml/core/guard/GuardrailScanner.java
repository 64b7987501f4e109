package io.quyaml.core.guard;

import io.quyaml.core.error.GuardrailViolationException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Pre-parse guardrail over raw document text. Rejects documents that are
 * oversized, nested deeper than the configured limit, or that use YAML
 * features outside the QuYAML subset: anchors ({@code &name}), aliases
 * ({@code *name}), custom tags ({@code !tag}) and merge keys ({@code <<:}).
 *
 * <p>
 * The scan is line based. Comments and quoted scalars are skipped, and a
 * marker only counts where YAML would read it as a node property or alias,
 * i.e. at the start of a node. A {@code *} inside a plain scalar such as
 * {@code ry(2 *pi) 0} is arithmetic, not an alias.
 *
 * <p>
 * Thread-safe and stateless apart from its immutable limits.
 */
public final class GuardrailScanner {

    private final GuardrailLimits limits;

    public GuardrailScanner(GuardrailLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
    }

    public GuardrailLimits limits() {
        return limits;
    }

    /**
     * Scans the given document text.
     *
     * @param text raw document text
     * @throws GuardrailViolationException naming the first violated limit or
     *                                     forbidden feature
     */
    public void scan(String text) {
        Objects.requireNonNull(text, "text must not be null");

        int size = text.getBytes(StandardCharsets.UTF_8).length;
        if (size > limits.maxBytes()) {
            throw new GuardrailViolationException(
                    "QuYAML document too large: " + size + " bytes exceeds the limit of " + limits.maxBytes(), null);
        }

        String[] lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            scanLine(lines[i], i + 1);
        }
    }

    private void scanLine(String line, int lineNumber) {
        String location = "line " + lineNumber;
        StringBuilder prefix = new StringBuilder(line.length());
        int pos = 0;
        int length = line.length();
        boolean hasContent = false;

        while (pos < length) {
            char ch = line.charAt(pos);

            if (ch == '#' && (pos == 0 || Character.isWhitespace(line.charAt(pos - 1)))) {
                break;
            }
            if ((ch == '\'' || ch == '"') && isNodeStart(prefix)) {
                int end = skipQuoted(line, pos);
                // Blank the quoted scalar so later markers see a non-empty node before them.
                prefix.append('x');
                hasContent = true;
                pos = end;
                continue;
            }
            if (isNodeStart(prefix)) {
                rejectMarker(line, pos, location);
            }
            if (!Character.isWhitespace(ch)) {
                hasContent = true;
            }
            prefix.append(ch);
            pos++;
        }

        if (hasContent) {
            int leading = 0;
            while (leading < length && line.charAt(leading) == ' ') {
                leading++;
            }
            int depth = leading / 2;
            if (depth > limits.maxNesting()) {
                throw new GuardrailViolationException(
                        "QuYAML nesting too deep: depth " + depth + " exceeds the limit of " + limits.maxNesting()
                                + " on " + location,
                        location);
            }
        }
    }

    private static void rejectMarker(String line, int pos, String location) {
        char ch = line.charAt(pos);
        if (ch == '&' && followedByName(line, pos + 1)) {
            throw new GuardrailViolationException(
                    "YAML anchors (&name) are not allowed in QuYAML for safety (" + location + ")", location);
        }
        if (ch == '*' && followedByName(line, pos + 1)) {
            throw new GuardrailViolationException(
                    "YAML aliases (*name) are not allowed in QuYAML for safety (" + location + ")", location);
        }
        if (ch == '!' && pos + 1 < line.length() && !Character.isWhitespace(line.charAt(pos + 1))) {
            throw new GuardrailViolationException(
                    "YAML custom tags (!tag) are not allowed in QuYAML for safety (" + location + ")", location);
        }
        if (ch == '<' && line.startsWith("<<", pos)) {
            int next = pos + 2;
            while (next < line.length() && line.charAt(next) == ' ') {
                next++;
            }
            if (next < line.length() && line.charAt(next) == ':') {
                throw new GuardrailViolationException(
                        "YAML merge keys (<<:) are not allowed in QuYAML for safety (" + location + ")", location);
            }
        }
    }

    private static boolean followedByName(String line, int pos) {
        if (pos >= line.length()) {
            return false;
        }
        char c = line.charAt(pos);
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    /**
     * Returns {@code true} if the next character on the line would start a new
     * YAML node: line start, after a sequence entry or mapping indicator, or
     * after a flow collection delimiter.
     */
    private static boolean isNodeStart(CharSequence prefix) {
        int end = prefix.length();
        int trimmed = end;
        while (trimmed > 0 && Character.isWhitespace(prefix.charAt(trimmed - 1))) {
            trimmed--;
        }
        if (trimmed == 0) {
            return true;
        }
        char last = prefix.charAt(trimmed - 1);
        if (last == '[' || last == '{' || last == ',') {
            return true;
        }
        boolean separated = trimmed < end;
        if (!separated) {
            return false;
        }
        if (last == ':' || last == '?') {
            return true;
        }
        if (last == '-') {
            boolean indicator = trimmed == 1 || Character.isWhitespace(prefix.charAt(trimmed - 2));
            return indicator && isNodeStart(prefix.subSequence(0, trimmed - 1));
        }
        return false;
    }

    /** Returns the index just past the closing quote, or the line length if unterminated. */
    private static int skipQuoted(String line, int start) {
        char quote = line.charAt(start);
        int pos = start + 1;
        while (pos < line.length()) {
            char c = line.charAt(pos);
            if (quote == '"' && c == '\\') {
                pos += 2;
                continue;
            }
            if (c == quote) {
                if (quote == '\'' && pos + 1 < line.length() && line.charAt(pos + 1) == '\'') {
                    pos += 2;
                    continue;
                }
                return pos + 1;
            }
            pos++;
        }
        return line.length();
    }
}

/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.compiler.parser;

import com.rerand.api.CompileFlag;
import com.rerand.api.exceptions.PatternCompileException;
import com.rerand.runtime.model.CodePointRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser from pattern text to a {@link RegexNode} tree.
 *
 * <h2>Grammar</h2>
 * <pre>
 * union   := concat ('|' concat)*
 * concat  := repeat*
 * repeat  := atom (('*' | '+' | '?' | '{' n (',' m?)? '}') '?'?)?
 * atom    := '(' group ')' | '[' class ']' | '.' | '\' escape | literal
 * </pre>
 *
 * <p>Anchors are accepted only at the pattern boundaries ({@code ^} or {@code \A}
 * first, {@code $} or {@code \z} last) because generated strings are always
 * whole matches. Backreferences, lookaround, word boundaries and Unicode
 * property classes are rejected.
 *
 * <p>Instances are single-use and not thread-safe.
 */
public final class PatternParser {

    /** Largest count accepted in a {@code {n,m}} repetition. */
    public static final int MAX_REPEAT = 1000;

    private static final List<CodePointRange> DIGITS = List.of(new CodePointRange('0', '9'));
    private static final List<CodePointRange> WORD = List.of(
            new CodePointRange('0', '9'), new CodePointRange('A', 'Z'),
            CodePointRange.of('_'), new CodePointRange('a', 'z'));
    private static final List<CodePointRange> SPACE = List.of(
            new CodePointRange('\t', '\n'), new CodePointRange('\f', '\r'), CodePointRange.of(' '));

    private static final Map<String, List<CodePointRange>> POSIX_CLASSES = Map.ofEntries(
            Map.entry("alnum", List.of(new CodePointRange('0', '9'), new CodePointRange('A', 'Z'),
                    new CodePointRange('a', 'z'))),
            Map.entry("alpha", List.of(new CodePointRange('A', 'Z'), new CodePointRange('a', 'z'))),
            Map.entry("ascii", List.of(new CodePointRange(0, 0x7F))),
            Map.entry("blank", List.of(CodePointRange.of('\t'), CodePointRange.of(' '))),
            Map.entry("cntrl", List.of(new CodePointRange(0, 0x1F), CodePointRange.of(0x7F))),
            Map.entry("digit", DIGITS),
            Map.entry("graph", List.of(new CodePointRange('!', '~'))),
            Map.entry("lower", List.of(new CodePointRange('a', 'z'))),
            Map.entry("print", List.of(new CodePointRange(' ', '~'))),
            Map.entry("punct", List.of(new CodePointRange('!', '/'), new CodePointRange(':', '@'),
                    new CodePointRange('[', '`'), new CodePointRange('{', '~'))),
            Map.entry("space", List.of(new CodePointRange('\t', '\r'), CodePointRange.of(' '))),
            Map.entry("upper", List.of(new CodePointRange('A', 'Z'))),
            Map.entry("word", WORD),
            Map.entry("xdigit", List.of(new CodePointRange('0', '9'), new CodePointRange('A', 'F'),
                    new CodePointRange('a', 'f'))));

    private final String pattern;
    private final boolean literalPattern;
    private int pos;
    private int depth;
    private int groupCount;

    // current inline flag state; saved and restored around groups
    private boolean caseInsensitive;
    private boolean dotAll;

    public PatternParser(String pattern, Set<CompileFlag> flags) {
        this.pattern = pattern;
        this.literalPattern = flags.contains(CompileFlag.LITERAL);
        this.caseInsensitive = flags.contains(CompileFlag.CASE_INSENSITIVE);
        this.dotAll = flags.contains(CompileFlag.DOT_MATCHES_NEWLINE);
    }

    /**
     * Parses the whole pattern.
     *
     * @throws PatternCompileException on any syntax error
     */
    public RegexNode parse() {
        if (literalPattern) {
            List<RegexNode> items = new ArrayList<>();
            while (more()) {
                items.add(literal(next()));
            }
            return sequence(items);
        }
        RegexNode node = parseUnion();
        if (more()) {
            throw error(pos, "unexpected ')'");
        }
        return node;
    }

    /**
     * Number of capturing groups seen by {@link #parse()}.
     */
    public int groupCount() {
        return groupCount;
    }

    private RegexNode parseUnion() {
        List<RegexNode> alternatives = new ArrayList<>();
        alternatives.add(parseConcat());
        while (match('|')) {
            alternatives.add(parseConcat());
        }
        return alternatives.size() == 1 ? alternatives.get(0) : new RegexNode.Alternate(alternatives);
    }

    private RegexNode parseConcat() {
        List<RegexNode> items = new ArrayList<>();
        while (more() && !peek("|)")) {
            RegexNode item = parseRepeat();
            if (item != null) {
                items.add(item);
            }
        }
        return sequence(items);
    }

    private RegexNode parseRepeat() {
        RegexNode node = parseAtom();
        if (node == null) {
            if (more() && peek("*+?")) {
                throw error(pos, "missing argument to repetition operator");
            }
            return null;
        }
        boolean repeated = false;
        while (more()) {
            int quantifierPos = pos;
            int min;
            int max;
            if (match('*')) {
                min = 0;
                max = RegexNode.Repeat.UNBOUNDED;
            } else if (match('+')) {
                min = 1;
                max = RegexNode.Repeat.UNBOUNDED;
            } else if (match('?')) {
                min = 0;
                max = 1;
            } else if (isRepeatCountAhead()) {
                next();
                min = readCount();
                max = min;
                if (match(',')) {
                    max = peek("}") ? RegexNode.Repeat.UNBOUNDED : readCount();
                }
                next();
                if (min > MAX_REPEAT || max > MAX_REPEAT
                        || (max != RegexNode.Repeat.UNBOUNDED && min > max)) {
                    throw error(quantifierPos, "invalid repeat count");
                }
            } else {
                break;
            }
            if (repeated) {
                throw error(quantifierPos, "invalid nested repetition operator");
            }
            boolean greedy = !match('?');
            node = new RegexNode.Repeat(node, min, max, greedy);
            repeated = true;
        }
        return node;
    }

    /**
     * Returns the parsed atom, or null for tokens that produce nothing
     * (boundary anchors and flag-only groups).
     */
    private RegexNode parseAtom() {
        int start = pos;
        int c = next();
        switch (c) {
            case '(':
                return parseGroup(start);
            case '[':
                return parseClass(start);
            case '.':
                return new RegexNode.AnyChar(dotAll);
            case '^':
                if (start == 0) {
                    return null;
                }
                throw error(start, "'^' is only supported at the start of the pattern");
            case '$':
                if (!more() && depth == 0) {
                    return null;
                }
                throw error(start, "'$' is only supported at the end of the pattern");
            case '\\':
                return parseEscape(start);
            case '*':
            case '+':
            case '?':
                throw error(start, "missing argument to repetition operator");
            case '{':
                pos = start;
                if (isRepeatCountAhead()) {
                    throw error(start, "missing argument to repetition operator");
                }
                pos = start + 1;
                return literal('{');
            default:
                return literal(c);
        }
    }

    private RegexNode parseGroup(int start) {
        int captureIndex = -1;
        boolean savedCaseInsensitive = caseInsensitive;
        boolean savedDotAll = dotAll;

        if (match('?')) {
            if (peek("=!") || lookingAt("<=") || lookingAt("<!")) {
                throw error(start, "lookaround is not supported");
            }
            if (match('<') || (match('P') && expect('<', start))) {
                readGroupName(start);
                captureIndex = ++groupCount;
            } else if (!match(':')) {
                if (parseFlags(start)) {
                    // (?flags) applies to the rest of the enclosing group
                    return null;
                }
            }
        } else {
            captureIndex = ++groupCount;
        }

        depth++;
        RegexNode body = parseUnion();
        if (!match(')')) {
            throw error(start, "missing closing )");
        }
        depth--;
        caseInsensitive = savedCaseInsensitive;
        dotAll = savedDotAll;
        return captureIndex > 0 ? new RegexNode.Group(body, captureIndex) : body;
    }

    /**
     * Parses the flags of {@code (?is-i)} or {@code (?i:}. Returns true when the
     * group ended with ')' (flags only), false when a ':' opened a scoped group.
     */
    private boolean parseFlags(int start) {
        boolean negate = false;
        boolean sawFlag = false;
        boolean ci = caseInsensitive;
        boolean da = dotAll;
        while (true) {
            if (!more()) {
                throw error(start, "missing closing )");
            }
            int c = next();
            switch (c) {
                case 'i':
                    ci = !negate;
                    sawFlag = true;
                    break;
                case 's':
                    da = !negate;
                    sawFlag = true;
                    break;
                case '-':
                    if (negate) {
                        throw error(pos - 1, "invalid or unsupported flag group");
                    }
                    negate = true;
                    sawFlag = false;
                    break;
                case ')':
                case ':':
                    if (!sawFlag) {
                        throw error(start, "invalid or unsupported flag group");
                    }
                    caseInsensitive = ci;
                    dotAll = da;
                    return c == ')';
                default:
                    throw error(pos - Character.charCount(c), "invalid or unsupported flag group");
            }
        }
    }

    private void readGroupName(int start) {
        int nameStart = pos;
        while (more() && !peek(">")) {
            int c = next();
            if (!Character.isLetterOrDigit(c) && c != '_') {
                throw error(start, "invalid named capture");
            }
        }
        if (pos == nameStart || !match('>')) {
            throw error(start, "invalid named capture");
        }
    }

    private RegexNode parseEscape(int start) {
        if (!more()) {
            throw error(start, "trailing backslash at end of expression");
        }
        int c = next();
        switch (c) {
            case 'A':
                if (start == 0) {
                    return null;
                }
                throw error(start, "'\\A' is only supported at the start of the pattern");
            case 'z':
                if (!more() && depth == 0) {
                    return null;
                }
                throw error(start, "'\\z' is only supported at the end of the pattern");
            case 'b':
            case 'B':
                throw error(start, "word boundaries are not supported");
            case 'p':
            case 'P':
                throw error(start, "Unicode property classes are not supported");
            case 'Q':
                return parseQuoted();
            case 'd':
            case 'D':
            case 'w':
            case 'W':
            case 's':
            case 'S':
                return new RegexNode.CharClass(perlClass(c));
            default:
                if (c >= '1' && c <= '9') {
                    throw error(start, "backreferences are not supported");
                }
                return literal(escapedCodePoint(c, start));
        }
    }

    private RegexNode parseQuoted() {
        List<RegexNode> items = new ArrayList<>();
        while (more() && !lookingAt("\\E")) {
            items.add(literal(next()));
        }
        if (lookingAt("\\E")) {
            pos += 2;
        }
        return sequence(items);
    }

    private RegexNode parseClass(int start) {
        CharClassBuilder builder = new CharClassBuilder();
        boolean negated = match('^');
        boolean first = true;
        while (true) {
            if (!more()) {
                throw error(start, "missing closing ]");
            }
            if (!first && match(']')) {
                break;
            }
            first = false;

            if (lookingAt("[:") && parsePosixClass(builder)) {
                continue;
            }
            int itemPos = pos;
            int low;
            if (match('\\')) {
                if (!more()) {
                    throw error(itemPos, "trailing backslash at end of expression");
                }
                int e = next();
                if ("dDwWsS".indexOf(e) >= 0) {
                    builder.addAll(perlClass(e));
                    continue;
                }
                low = classEscape(e, itemPos);
            } else {
                low = next();
            }
            int high = low;
            if (lookingAt("-") && !lookingAt("-]") && pos + 1 < pattern.length()) {
                next();
                int rangePos = pos;
                if (match('\\')) {
                    if (!more()) {
                        throw error(rangePos, "trailing backslash at end of expression");
                    }
                    int e = next();
                    if ("dDwWsS".indexOf(e) >= 0) {
                        throw error(itemPos, "invalid character class range");
                    }
                    high = classEscape(e, rangePos);
                } else {
                    high = next();
                }
                if (high < low) {
                    throw error(itemPos, "invalid character class range");
                }
            }
            builder.addRange(low, high);
        }

        if (caseInsensitive) {
            builder.foldCase();
        }
        List<CodePointRange> ranges = builder.build();
        if (negated) {
            ranges = new CharClassBuilder().addNegated(ranges).build();
        }
        return new RegexNode.CharClass(ranges);
    }

    private int classEscape(int c, int escapePos) {
        if (c == 'p' || c == 'P') {
            throw error(escapePos, "Unicode property classes are not supported");
        }
        return escapedCodePoint(c, escapePos);
    }

    /**
     * Parses {@code [:name:]} or {@code [:^name:]}. Returns false, consuming
     * nothing, when the text is not a POSIX class.
     */
    private boolean parsePosixClass(CharClassBuilder builder) {
        int end = pattern.indexOf(":]", pos + 2);
        if (end < 0) {
            return false;
        }
        String name = pattern.substring(pos + 2, end);
        boolean negated = name.startsWith("^");
        List<CodePointRange> ranges = POSIX_CLASSES.get(negated ? name.substring(1) : name);
        if (ranges == null) {
            throw error(pos, "invalid character class range");
        }
        if (negated) {
            builder.addNegated(ranges);
        } else {
            builder.addAll(ranges);
        }
        pos = end + 2;
        return true;
    }

    private int escapedCodePoint(int c, int escapePos) {
        switch (c) {
            case 't':
                return '\t';
            case 'n':
                return '\n';
            case 'r':
                return '\r';
            case 'f':
                return '\f';
            case 'v':
                return 0x0B;
            case 'a':
                return 0x07;
            case 'e':
                return 0x1B;
            case 'x':
                if (match('{')) {
                    int value = readHex(escapePos, Integer.MAX_VALUE);
                    if (!match('}')) {
                        throw error(escapePos, "invalid escape sequence");
                    }
                    return value;
                }
                return readHex(escapePos, 2);
            case 'u':
                return readHex(escapePos, 4);
            default:
                if (c < 0x80 && !Character.isLetterOrDigit(c)) {
                    return c;
                }
                throw error(escapePos, "invalid escape sequence");
        }
    }

    /**
     * Reads exactly {@code digits} hex digits, or as many as present when
     * {@code digits} is unbounded.
     */
    private int readHex(int escapePos, int digits) {
        int start = pos;
        long value = 0;
        while (more() && pos - start < digits && Character.digit(pattern.charAt(pos), 16) >= 0) {
            value = value * 16 + Character.digit(pattern.charAt(pos), 16);
            if (value > Character.MAX_CODE_POINT) {
                throw error(escapePos, "invalid escape sequence");
            }
            pos++;
        }
        int read = pos - start;
        if (read == 0 || (digits != Integer.MAX_VALUE && read != digits)) {
            throw error(escapePos, "invalid escape sequence");
        }
        return (int) value;
    }

    private List<CodePointRange> perlClass(int c) {
        List<CodePointRange> ranges = switch (Character.toLowerCase(c)) {
            case 'd' -> DIGITS;
            case 'w' -> WORD;
            default -> SPACE;
        };
        return Character.isUpperCase(c) ? new CharClassBuilder().addNegated(ranges).build() : ranges;
    }

    private RegexNode literal(int codePoint) {
        if (caseInsensitive) {
            List<CodePointRange> variants = CharClassBuilder.caseVariants(codePoint);
            if (variants.size() > 1 || variants.get(0).width() > 1) {
                return new RegexNode.CharClass(variants);
            }
        }
        return new RegexNode.Literal(codePoint);
    }

    private static RegexNode sequence(List<RegexNode> items) {
        return switch (items.size()) {
            case 0 -> new RegexNode.Empty();
            case 1 -> items.get(0);
            default -> new RegexNode.Concat(items);
        };
    }

    private boolean isRepeatCountAhead() {
        int i = pos;
        if (i >= pattern.length() || pattern.charAt(i) != '{') {
            return false;
        }
        i++;
        int digits = 0;
        while (i < pattern.length() && Character.isDigit(pattern.charAt(i))) {
            i++;
            digits++;
        }
        if (digits == 0) {
            return false;
        }
        if (i < pattern.length() && pattern.charAt(i) == ',') {
            i++;
            while (i < pattern.length() && Character.isDigit(pattern.charAt(i))) {
                i++;
            }
        }
        return i < pattern.length() && pattern.charAt(i) == '}';
    }

    private int readCount() {
        int start = pos;
        while (more() && Character.isDigit(pattern.charAt(pos))) {
            pos++;
        }
        if (pos - start > 4) {
            throw error(start, "invalid repeat count");
        }
        return Integer.parseInt(pattern.substring(start, pos));
    }

    private boolean expect(int c, int start) {
        if (!match(c)) {
            throw error(start, "invalid or unsupported group syntax");
        }
        return true;
    }

    private boolean peek(String s) {
        return more() && s.indexOf(pattern.codePointAt(pos)) != -1;
    }

    private boolean lookingAt(String s) {
        return pattern.startsWith(s, pos);
    }

    private boolean match(int c) {
        if (pos >= pattern.length()) {
            return false;
        }
        if (pattern.codePointAt(pos) == c) {
            pos += Character.charCount(c);
            return true;
        }
        return false;
    }

    private boolean more() {
        return pos < pattern.length();
    }

    private int next() {
        if (!more()) {
            throw error(pos, "unexpected end of pattern");
        }
        int ch = pattern.codePointAt(pos);
        pos += Character.charCount(ch);
        return ch;
    }

    private PatternCompileException error(int offset, String reason) {
        return new PatternCompileException(pattern, offset, reason);
    }
}

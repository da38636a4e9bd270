package asttab.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Recursive descent parser for the Python expression subset used by builder expressions.
///
/// Supported:
/// - names, `a.b` member access and calls with positional, `name=value` and `**value` arguments
/// - list, tuple and dict displays, trailing commas included, and parenthesised grouping
/// - `str` and `bytes` literals with Python escape sequences, prefixes `b`, `r`, `u`,
///   triple quotes and implicit concatenation of adjacent literals
/// - decimal, hex, octal and binary integers, floats and imaginary numbers
/// - prefix `-` and `+`
///
/// Both the compact output of [BuilderExpressionPrinter] and the multi-line output of
/// [ExpressionFormatter] parse back to the same tree.
public final class BuilderExpressionParser {

    private static final Logger LOG = Logger.getLogger(BuilderExpressionParser.class.getName());

    private static final Pattern NUMBER = Pattern.compile(
            "0[xX][0-9a-fA-F_]+|0[oO][0-7_]+|0[bB][01_]+"
                    + "|[0-9][0-9_]*(\\.[0-9_]*)?([eE][+-]?[0-9_]+)?[jJ]?"
                    + "|\\.[0-9][0-9_]*([eE][+-]?[0-9_]+)?[jJ]?");
    private static final Pattern STRING_PREFIX = Pattern.compile("[bBrRuU]|[bB][rR]|[rR][bB]");

    private final String text;
    private int pos;

    private BuilderExpressionParser(String text) {
        this.text = text;
        this.pos = 0;
    }

    /// Parses a builder expression.
    /// @param text builder expression text
    /// @return the expression tree
    /// @throws NullPointerException if text is null
    /// @throws BuilderSyntaxException if the text is not a valid expression
    public static BuilderAst parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        LOG.fine(() -> "Parsing builder expression of " + text.length() + " chars");
        final var parser = new BuilderExpressionParser(text);
        final BuilderAst expr = parser.expression();
        parser.skipWhitespace();
        if (parser.pos < text.length()) {
            throw parser.error("Unexpected trailing input");
        }
        return expr;
    }

    private BuilderSyntaxException error(String message) {
        return new BuilderSyntaxException(message, text, pos);
    }

    private void skipWhitespace() {
        while (pos < text.length()) {
            final char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < text.length() && text.charAt(pos + 1) == '\n') {
                pos += 2;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#') {
                while (pos < text.length() && text.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                break;
            }
        }
    }

    private boolean peekIs(char c) {
        return pos < text.length() && text.charAt(pos) == c;
    }

    private void expect(char c) {
        skipWhitespace();
        if (pos >= text.length()) {
            throw error("Unexpected end of input, expected '" + c + "'");
        }
        if (text.charAt(pos) != c) {
            throw error("Expected '" + c + "'");
        }
        pos++;
    }

    // ------------------------------------------------------------- expressions

    private BuilderAst expression() {
        skipWhitespace();
        if (peekIs('-') || peekIs('+')) {
            final char op = text.charAt(pos++);
            return new BuilderAst.UnaryOperation(op, expression());
        }
        if (peekIs('*')) {
            throw error("Starred expressions are not supported");
        }
        return postfix();
    }

    private BuilderAst postfix() {
        BuilderAst expr = primary();
        while (true) {
            skipWhitespace();
            if (peekIs('.')) {
                pos++;
                skipWhitespace();
                expr = new BuilderAst.MemberAccess(expr, identifier());
            } else if (peekIs('(')) {
                expr = call(expr);
            } else {
                return expr;
            }
        }
    }

    private BuilderAst primary() {
        skipWhitespace();
        if (pos >= text.length()) {
            throw error("Unexpected end of input, expected an expression");
        }
        final char c = text.charAt(pos);
        if (c == '\'' || c == '"') {
            return strings();
        }
        if (Character.isDigit(c) || (c == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
            return number();
        }
        if (isIdentifierStart(c)) {
            final int start = pos;
            final String name = identifier();
            if (pos < text.length() && (text.charAt(pos) == '\'' || text.charAt(pos) == '"')
                    && STRING_PREFIX.matcher(name).matches()) {
                pos = start;
                return strings();
            }
            return switch (name) {
                case "True", "False" -> new BuilderAst.Literal(BuilderAst.LiteralKind.BOOLEAN, name);
                case "None" -> new BuilderAst.Literal(BuilderAst.LiteralKind.NONE, name);
                default -> new BuilderAst.Identifier(name);
            };
        }
        if (c == '[') {
            pos++;
            return new BuilderAst.ListLiteral(elements(']'));
        }
        if (c == '(') {
            return parenthesised();
        }
        if (c == '{') {
            return mapping();
        }
        throw error("Expected an expression");
    }

    private String identifier() {
        if (pos >= text.length() || !isIdentifierStart(text.charAt(pos))) {
            throw error("Expected an identifier");
        }
        final int start = pos;
        while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            pos++;
        }
        return text.substring(start, pos);
    }

    /// Comma separated expressions up to `close`; a trailing comma is allowed.
    private List<BuilderAst> elements(char close) {
        final List<BuilderAst> elements = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (peekIs(close)) {
                break;
            }
            elements.add(expression());
            skipWhitespace();
            if (peekIs(',')) {
                pos++;
                continue;
            }
            break;
        }
        expect(close);
        return elements;
    }

    private BuilderAst parenthesised() {
        pos++; // (
        skipWhitespace();
        if (peekIs(')')) {
            pos++;
            return new BuilderAst.TupleLiteral(List.of());
        }
        final BuilderAst first = expression();
        skipWhitespace();
        if (peekIs(')')) {
            pos++;
            return first;
        }
        expect(',');
        final List<BuilderAst> elements = new ArrayList<>();
        elements.add(first);
        elements.addAll(elements(')'));
        return new BuilderAst.TupleLiteral(elements);
    }

    private BuilderAst mapping() {
        pos++; // {
        final List<BuilderAst.MappingEntry> entries = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (peekIs('}')) {
                break;
            }
            if (text.startsWith("**", pos)) {
                pos += 2;
                entries.add(new BuilderAst.MappingEntry(null, expression()));
            } else {
                final BuilderAst key = expression();
                skipWhitespace();
                if (!peekIs(':')) {
                    throw error("Expected ':' in dict display (set displays are not supported)");
                }
                pos++;
                entries.add(new BuilderAst.MappingEntry(key, expression()));
            }
            skipWhitespace();
            if (peekIs(',')) {
                pos++;
                continue;
            }
            break;
        }
        expect('}');
        return new BuilderAst.MappingLiteral(entries);
    }

    private BuilderAst call(BuilderAst callee) {
        pos++; // (
        final List<BuilderAst> positional = new ArrayList<>();
        final List<BuilderAst.KeywordArgument> keywords = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (peekIs(')')) {
                break;
            }
            if (text.startsWith("**", pos)) {
                pos += 2;
                keywords.add(new BuilderAst.KeywordArgument(null, expression()));
            } else {
                final String keyword = keywordName();
                if (keyword != null) {
                    keywords.add(new BuilderAst.KeywordArgument(keyword, expression()));
                } else if (!keywords.isEmpty()) {
                    throw error("Positional argument follows keyword argument");
                } else {
                    positional.add(expression());
                }
            }
            skipWhitespace();
            if (peekIs(',')) {
                pos++;
                continue;
            }
            break;
        }
        expect(')');
        return new BuilderAst.Call(callee, positional, keywords);
    }

    /// Consumes `name =` and returns the name, or restores the cursor and returns null.
    private String keywordName() {
        if (pos >= text.length() || !isIdentifierStart(text.charAt(pos))) {
            return null;
        }
        final int start = pos;
        final String name = identifier();
        skipWhitespace();
        if (peekIs('=') && !text.startsWith("==", pos)) {
            pos++;
            return name;
        }
        pos = start;
        return null;
    }

    // ---------------------------------------------------------------- literals

    private BuilderAst number() {
        final Matcher m = NUMBER.matcher(text).region(pos, text.length());
        if (!m.lookingAt()) {
            throw error("Malformed number");
        }
        final String lexeme = m.group().replace("_", "");
        pos = m.end();
        if (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            throw error("Invalid number literal");
        }
        final char last = lexeme.charAt(lexeme.length() - 1);
        if (last == 'j' || last == 'J') {
            return new BuilderAst.Literal(BuilderAst.LiteralKind.IMAGINARY, lexeme);
        }
        if (lexeme.length() > 1 && lexeme.charAt(0) == '0' && "xXoObB".indexOf(lexeme.charAt(1)) >= 0) {
            final int radix = switch (Character.toLowerCase(lexeme.charAt(1))) {
                case 'x' -> 16;
                case 'o' -> 8;
                default -> 2;
            };
            return new BuilderAst.Literal(BuilderAst.LiteralKind.INTEGER,
                    new BigInteger(lexeme.substring(2), radix).toString());
        }
        if (lexeme.indexOf('.') >= 0 || lexeme.indexOf('e') >= 0 || lexeme.indexOf('E') >= 0) {
            return new BuilderAst.Literal(BuilderAst.LiteralKind.FLOAT, lexeme);
        }
        return new BuilderAst.Literal(BuilderAst.LiteralKind.INTEGER, lexeme);
    }

    /// One or more adjacent string literals, concatenated.
    private BuilderAst strings() {
        final var value = new StringBuilder();
        Boolean bytes = null;
        while (true) {
            final int start = pos;
            int prefixEnd = pos;
            while (prefixEnd < text.length() && "bBrRuU".indexOf(text.charAt(prefixEnd)) >= 0) {
                prefixEnd++;
            }
            final String prefix = text.substring(pos, prefixEnd).toLowerCase();
            if (!prefix.isEmpty() && !STRING_PREFIX.matcher(prefix).matches()) {
                throw error("Unsupported string prefix: " + prefix);
            }
            pos = prefixEnd;
            final boolean isBytes = prefix.indexOf('b') >= 0;
            if (bytes != null && bytes != isBytes) {
                pos = start;
                throw error("Cannot mix bytes and str literals");
            }
            bytes = isBytes;
            stringBody(value, isBytes, prefix.indexOf('r') >= 0);

            final int afterLiteral = pos;
            skipWhitespace();
            if (!startsStringLiteral()) {
                pos = afterLiteral;
                break;
            }
        }
        return new BuilderAst.Literal(
                bytes ? BuilderAst.LiteralKind.BYTES : BuilderAst.LiteralKind.STRING, value.toString());
    }

    private boolean startsStringLiteral() {
        int p = pos;
        while (p < text.length() && p - pos < 2 && "bBrRuU".indexOf(text.charAt(p)) >= 0) {
            p++;
        }
        return p < text.length() && (text.charAt(p) == '\'' || text.charAt(p) == '"')
                && (p == pos || STRING_PREFIX.matcher(text.substring(pos, p)).matches());
    }

    private void stringBody(StringBuilder out, boolean bytes, boolean raw) {
        final int open = pos;
        final char quote = text.charAt(pos);
        final boolean triple = text.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;
        while (true) {
            if (pos >= text.length()) {
                pos = open;
                throw error("Unterminated string literal");
            }
            final char c = text.charAt(pos);
            if (c == quote && (!triple || text.startsWith(String.valueOf(quote).repeat(3), pos))) {
                pos += triple ? 3 : 1;
                return;
            }
            if (c == '\n' && !triple) {
                pos = open;
                throw error("Unterminated string literal");
            }
            if (bytes && c > 0x7f) {
                throw error("bytes can only contain ASCII literal characters");
            }
            if (c == '\\' && pos + 1 < text.length()) {
                if (raw) {
                    out.append(c).append(text.charAt(pos + 1));
                    pos += 2;
                } else {
                    escape(out, bytes);
                }
                continue;
            }
            out.append(c);
            pos++;
        }
    }

    private void escape(StringBuilder out, boolean bytes) {
        final char e = text.charAt(pos + 1);
        pos += 2;
        switch (e) {
            case '\n' -> { }
            case '\\', '\'', '"' -> out.append(e);
            case 'a' -> out.append('\u0007');
            case 'b' -> out.append('\b');
            case 'f' -> out.append('\f');
            case 'n' -> out.append('\n');
            case 'r' -> out.append('\r');
            case 't' -> out.append('\t');
            case 'v' -> out.append('\u000b');
            case '0', '1', '2', '3', '4', '5', '6', '7' -> {
                int value = e - '0';
                for (int i = 0; i < 2 && pos < text.length() && text.charAt(pos) >= '0' && text.charAt(pos) <= '7'; i++) {
                    value = value * 8 + (text.charAt(pos++) - '0');
                }
                out.append((char) (bytes ? value & 0xff : value));
            }
            case 'x' -> out.append((char) hex(2));
            case 'u' -> {
                if (bytes) {
                    out.append('\\').append(e);
                } else {
                    out.appendCodePoint(hex(4));
                }
            }
            case 'U' -> {
                if (bytes) {
                    out.append('\\').append(e);
                } else {
                    out.appendCodePoint(hex(8));
                }
            }
            case 'N' -> {
                if (bytes) {
                    out.append('\\').append(e);
                } else {
                    out.appendCodePoint(namedCharacter());
                }
            }
            default -> out.append('\\').append(e);
        }
    }

    /// Reads exactly `digits` hex digits at the cursor as a code point.
    private int hex(int digits) {
        if (pos + digits > text.length()) {
            throw error("Truncated escape sequence");
        }
        final String hex = text.substring(pos, pos + digits);
        long value = 0;
        for (int i = 0; i < digits; i++) {
            final char c = hex.charAt(i);
            final int digit = c < 0x80 ? Character.digit(c, 16) : -1;
            if (digit < 0) {
                throw error("Invalid escape sequence \\" + text.charAt(pos - 1) + hex);
            }
            value = value * 16 + digit;
        }
        if (value > Character.MAX_CODE_POINT) {
            throw error("Invalid escape sequence \\" + text.charAt(pos - 1) + hex + " (code point out of range)");
        }
        pos += digits;
        return (int) value;
    }

    private int namedCharacter() {
        if (!peekIs('{')) {
            throw error("Malformed \\N character escape");
        }
        final int close = text.indexOf('}', pos);
        if (close < 0) {
            throw error("Malformed \\N character escape");
        }
        final String name = text.substring(pos + 1, close);
        try {
            final int cp = Character.codePointOf(name);
            pos = close + 1;
            return cp;
        } catch (IllegalArgumentException ex) {
            throw error("Unknown Unicode character name: " + name);
        }
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}

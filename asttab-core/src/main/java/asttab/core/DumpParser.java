package asttab.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static asttab.core.DumpParseException.Reason;

/// Recursive descent parser for the text produced by Python's `ast.dump(tree, indent=4)`.
///
/// Grammar:
/// ```
/// value  := node | list | tuple | string | atom
/// node   := IDENT "(" (field ("," field)*)? ")"
/// field  := IDENT "=" value
/// list   := "[" (value ("," value)*)? "]"
/// tuple  := "(" (value ("," value)*)? ")"
/// string := "'" chars "'" | '"' chars '"'      (optionally prefixed with b)
/// atom   := True | False | None | Ellipsis | INTEGER | FLOAT | IMAGINARY
/// ```
/// Infinite numbers, dumped as `inf` and `infj`, come back as the overflowing
/// literals `1e309` and `1e309j`.
///
/// The production is chosen by the first non-whitespace character. Whitespace,
/// newlines included, is insignificant between tokens.
///
/// A field list that continues with neither `name=` nor `)` is rejected, as is any
/// non-whitespace text after the top-level value.
public final class DumpParser {

    private static final Logger LOG = Logger.getLogger(DumpParser.class.getName());

    private static final Pattern NODE_START = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*\\(");
    private static final Pattern FIELD_START = Pattern.compile("([A-Za-z_]+)=");
    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern FLOAT = Pattern.compile("[+-]?([0-9]+\\.[0-9]*([eE][+-]?[0-9]+)?|[0-9]+[eE][+-]?[0-9]+)");
    private static final Pattern IMAGINARY = Pattern.compile("[+-]?[0-9]+(\\.[0-9]*)?([eE][+-]?[0-9]+)?[jJ]");
    /// `repr` of an infinite float or imaginary part; rebuilt from a literal that overflows.
    private static final Pattern OVERFLOW = Pattern.compile("[+-]?infj?");
    private static final String OVERFLOWING_FLOAT = "1e309";

    private final String text;
    private int pos;

    private DumpParser(String text) {
        this.text = text;
        this.pos = 0;
    }

    /// Parses dump text and returns the compact builder expression that rebuilds it,
    /// using the default `ast` constructor namespace.
    /// @param text dump text
    /// @return builder expression such as `ast.Module(body=[], type_ignores=[])`
    /// @throws DumpParseException if the text is malformed
    public static String parse(String text) {
        return BuilderExpressionGenerator.standard().render(parseValue(text));
    }

    /// Parses dump text into its structural value.
    /// @param text dump text
    /// @return the parsed value
    /// @throws NullPointerException if text is null
    /// @throws DumpParseException if the text is malformed
    public static DumpValue parseValue(String text) {
        Objects.requireNonNull(text, "text must not be null");
        LOG.fine(() -> "Parsing dump text of " + text.length() + " chars");
        final var parser = new DumpParser(text);
        final DumpValue value = parser.value();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw parser.error(Reason.EXPECTED_TOKEN, "end of input");
        }
        return value;
    }

    // ------------------------------------------------------------------ cursor

    private boolean atEnd() {
        return pos >= text.length();
    }

    private char peek() {
        return text.charAt(pos);
    }

    private boolean peekIs(char c) {
        return pos < text.length() && text.charAt(pos) == c;
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private void expect(char c) {
        if (atEnd()) {
            throw error(Reason.UNEXPECTED_END, null);
        }
        if (peek() != c) {
            throw error(Reason.EXPECTED_TOKEN, "'" + c + "'");
        }
        pos++;
    }

    private Matcher lookingAt(Pattern pattern) {
        final Matcher m = pattern.matcher(text).region(pos, text.length());
        return m.lookingAt() ? m : null;
    }

    private DumpParseException error(Reason reason, String detail) {
        return new DumpParseException(reason, detail, text, pos);
    }

    // ------------------------------------------------------------- productions

    private DumpValue value() {
        skipWhitespace();
        if (atEnd()) {
            throw error(Reason.UNEXPECTED_END, null);
        }
        final char c = peek();
        if (lookingAt(NODE_START) != null) {
            return node();
        }
        if (c == '[') {
            return sequence('[', ']', DumpValue.SequenceKind.LIST);
        }
        if (c == '(') {
            return sequence('(', ')', DumpValue.SequenceKind.TUPLE);
        }
        if (isQuote(c)) {
            return string(false);
        }
        if ((c == 'b' || c == 'B') && pos + 1 < text.length() && isQuote(text.charAt(pos + 1))) {
            pos++;
            return string(true);
        }
        return atom();
    }

    private DumpValue.Node node() {
        final Matcher m = lookingAt(NODE_START);
        final String name = text.substring(pos, m.end() - 1);
        pos = m.end();
        LOG.finer(() -> "Node " + name + " at " + pos);

        final List<DumpValue.Field> fields = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (peekIs(')')) {
                break;
            }
            if (atEnd()) {
                throw error(Reason.UNEXPECTED_END, null);
            }
            final Matcher field = lookingAt(FIELD_START);
            if (field == null) {
                throw error(Reason.EXPECTED_TOKEN, "field name or ')'");
            }
            final String fieldName = field.group(1);
            pos = field.end();
            fields.add(new DumpValue.Field(fieldName, value()));

            skipWhitespace();
            if (peekIs(',')) {
                pos++;
                continue;
            }
            break;
        }
        expect(')');
        return new DumpValue.Node(name, fields);
    }

    private DumpValue.Sequence sequence(char open, char close, DumpValue.SequenceKind kind) {
        expect(open);
        final List<DumpValue> elements = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (peekIs(close)) {
                break;
            }
            elements.add(value());
            skipWhitespace();
            if (peekIs(',')) {
                pos++;
                continue;
            }
            break;
        }
        expect(close);
        return new DumpValue.Sequence(kind, elements);
    }

    private DumpValue.StringLiteral string(boolean bytes) {
        final int open = pos;
        final char quote = peek();
        pos++;
        final int start = pos;
        while (true) {
            if (atEnd()) {
                throw new DumpParseException(Reason.UNTERMINATED_STRING, null, text, open);
            }
            if (peek() == quote) {
                break;
            }
            if (bytes && peek() > 0x7F) {
                throw error(Reason.EXPECTED_TOKEN, "ASCII character in bytes literal");
            }
            pos++;
        }
        final String raw = text.substring(start, pos);
        pos++;
        return new DumpValue.StringLiteral(raw, bytes);
    }

    private DumpValue.Atom atom() {
        final int start = pos;
        while (!atEnd() && isAtomChar(peek())) {
            pos++;
        }
        final String lexeme = text.substring(start, pos);
        if (lexeme.isEmpty()) {
            throw error(Reason.EXPECTED_TOKEN, "value");
        }
        if (lexeme.equals("True") || lexeme.equals("False")) {
            return new DumpValue.Atom(DumpValue.AtomKind.BOOLEAN, lexeme);
        }
        if (lexeme.equals("None")) {
            return new DumpValue.Atom(DumpValue.AtomKind.NONE, lexeme);
        }
        if (lexeme.equals("Ellipsis")) {
            return new DumpValue.Atom(DumpValue.AtomKind.ELLIPSIS, lexeme);
        }
        if (OVERFLOW.matcher(lexeme).matches()) {
            final String number = lexeme.replace("inf", OVERFLOWING_FLOAT);
            return new DumpValue.Atom(lexeme.endsWith("j") ? DumpValue.AtomKind.IMAGINARY : DumpValue.AtomKind.FLOAT, number);
        }
        if (INTEGER.matcher(lexeme).matches()) {
            return new DumpValue.Atom(DumpValue.AtomKind.INTEGER, lexeme);
        }
        if (FLOAT.matcher(lexeme).matches()) {
            return new DumpValue.Atom(DumpValue.AtomKind.FLOAT, lexeme);
        }
        if (IMAGINARY.matcher(lexeme).matches()) {
            return new DumpValue.Atom(DumpValue.AtomKind.IMAGINARY, lexeme);
        }
        throw new DumpParseException(Reason.UNKNOWN_ATOM, lexeme, text, start);
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    private static boolean isAtomChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                || c == '_' || c == '.' || c == '+' || c == '-';
    }
}

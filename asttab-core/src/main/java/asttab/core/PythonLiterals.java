package asttab.core;

import java.math.BigInteger;

/// Python literal spelling, matching what `repr()` prints for `str`, `bytes` and `int`.
public final class PythonLiterals {

    private PythonLiterals() {}

    /// Returns `repr(value)` for a Python `str`.
    ///
    /// Single quotes are used unless the value contains a single quote and no double
    /// quote. Backslash, the chosen quote, `\t`, `\n` and `\r` are escaped, other
    /// non-printable code points use backslash-x, backslash-u or backslash-U escapes.
    public static String repr(String value) {
        final char quote = chooseQuote(value);
        final var sb = new StringBuilder(value.length() + 2);
        sb.append(quote);
        value.codePoints().forEach(cp -> {
            if (cp == quote || cp == '\\') {
                sb.append('\\').append((char) cp);
            } else if (cp == '\t') {
                sb.append("\\t");
            } else if (cp == '\n') {
                sb.append("\\n");
            } else if (cp == '\r') {
                sb.append("\\r");
            } else if (cp < ' ' || cp == 0x7f) {
                sb.append(String.format("\\x%02x", cp));
            } else if (cp < 0x7f || isPrintable(cp)) {
                sb.appendCodePoint(cp);
            } else if (cp <= 0xff) {
                sb.append(String.format("\\x%02x", cp));
            } else if (cp <= 0xffff) {
                sb.append(String.format("\\u%04x", cp));
            } else {
                sb.append(String.format("\\U%08x", cp));
            }
        });
        sb.append(quote);
        return sb.toString();
    }

    /// Returns `repr(value)` for a Python `bytes` whose octets are held as ISO-8859-1 chars.
    public static String bytesRepr(String octets) {
        final char quote = chooseQuote(octets);
        final var sb = new StringBuilder(octets.length() + 3);
        sb.append('b').append(quote);
        for (int i = 0; i < octets.length(); i++) {
            final char c = octets.charAt(i);
            if (c > 0xff) {
                throw new IllegalArgumentException("bytes literal holds a non-octet char at index " + i);
            }
            if (c == quote || c == '\\') {
                sb.append('\\').append(c);
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c < ' ' || c >= 0x7f) {
                sb.append(String.format("\\x%02x", (int) c));
            } else {
                sb.append(c);
            }
        }
        sb.append(quote);
        return sb.toString();
    }

    /// Normalises an integer lexeme the way `repr(int(lexeme))` would, e.g. `+007` to `7`.
    public static String canonicalInteger(String lexeme) {
        return new BigInteger(lexeme).toString();
    }

    private static char chooseQuote(String value) {
        return value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
    }

    // Python treats Cc, Cf, Cs, Co, Cn, Zl, Zp and Zs other than space as non-printable.
    private static boolean isPrintable(int cp) {
        switch (Character.getType(cp)) {
            case Character.CONTROL, Character.FORMAT, Character.SURROGATE, Character.PRIVATE_USE,
                    Character.UNASSIGNED, Character.LINE_SEPARATOR, Character.PARAGRAPH_SEPARATOR -> {
                return false;
            }
            case Character.SPACE_SEPARATOR -> {
                return cp == ' ';
            }
            default -> {
                return true;
            }
        }
    }
}

package asttab.tree;

import asttab.core.PythonLiterals;

import java.util.Objects;
import java.util.regex.Pattern;

/// A scalar in a syntax tree.
///
/// For `STRING` and `BYTES` the value is the decoded content (bytes as ISO-8859-1
/// chars). For numbers it is the Python spelling, for `BOOLEAN` `True` or `False`.
public record TreeConstant(Kind kind, String value) implements TreeValue {

    public enum Kind { STRING, BYTES, INTEGER, FLOAT, IMAGINARY, BOOLEAN, NONE, ELLIPSIS }

    private static final Pattern DECIMAL = Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    public static final TreeConstant NONE = new TreeConstant(Kind.NONE, "None");
    public static final TreeConstant ELLIPSIS = new TreeConstant(Kind.ELLIPSIS, "Ellipsis");

    public TreeConstant {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public static TreeConstant string(String value) {
        return new TreeConstant(Kind.STRING, value);
    }

    public static TreeConstant integer(long value) {
        return new TreeConstant(Kind.INTEGER, Long.toString(value));
    }

    public static TreeConstant bool(boolean value) {
        return new TreeConstant(Kind.BOOLEAN, value ? "True" : "False");
    }

    public boolean isNone() {
        return kind == Kind.NONE;
    }

    public boolean isNumber() {
        return kind == Kind.INTEGER || kind == Kind.FLOAT || kind == Kind.IMAGINARY;
    }

    /// Python's `repr()` of this constant.
    public String repr() {
        return switch (kind) {
            case STRING -> PythonLiterals.repr(value);
            case BYTES -> PythonLiterals.bytesRepr(value);
            case INTEGER -> PythonLiterals.canonicalInteger(value);
            case FLOAT -> floatRepr(value, "");
            case IMAGINARY -> value.endsWith("j") || value.endsWith("J")
                    ? floatRepr(value.substring(0, value.length() - 1), "j")
                    : value;
            case BOOLEAN, NONE, ELLIPSIS -> value;
        };
    }

    /// A literal too large for a double holds an infinity, which Python prints as `inf`.
    private String floatRepr(String number, String suffix) {
        if (DECIMAL.matcher(number).matches() && Double.isInfinite(Double.parseDouble(number))) {
            return (number.startsWith("-") ? "-inf" : "inf") + suffix;
        }
        return value;
    }
}

package asttab.core;

import java.util.List;
import java.util.Objects;

/// Expression tree for builder expressions such as
/// `ast.Assign(targets=[ast.Name(id='x', ctx=ast.Store())], value=ast.Constant(value=1))`.
///
/// Only the shapes that builder expressions use are modelled:
/// - Identifier: `ast`, `Ellipsis`
/// - MemberAccess: `ast.Name`
/// - Literal: `'x'`, `b'x'`, `1`, `1.5`, `2j`, `True`, `None`
/// - ListLiteral / TupleLiteral / MappingLiteral: `[...]`, `(...)`, `{...}`
/// - Call: `callee(positional..., name=value..., **value)`
/// - UnaryOperation: `-1`; parsed and evaluated but not supported by the formatter
public sealed interface BuilderAst permits
        BuilderAst.Identifier,
        BuilderAst.MemberAccess,
        BuilderAst.Literal,
        BuilderAst.ListLiteral,
        BuilderAst.TupleLiteral,
        BuilderAst.MappingLiteral,
        BuilderAst.Call,
        BuilderAst.UnaryOperation {

    record Identifier(String name) implements BuilderAst {
        public Identifier {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record MemberAccess(BuilderAst base, String name) implements BuilderAst {
        public MemberAccess {
            Objects.requireNonNull(base, "base must not be null");
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    enum LiteralKind { STRING, BYTES, INTEGER, FLOAT, IMAGINARY, BOOLEAN, NONE }

    /// A literal constant. For `STRING` and `BYTES` the text is the decoded value
    /// (bytes as ISO-8859-1 chars); for every other kind it is the source lexeme.
    record Literal(LiteralKind kind, String text) implements BuilderAst {
        public Literal {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(text, "text must not be null");
        }

        public static Literal string(String value) {
            return new Literal(LiteralKind.STRING, value);
        }

        public static Literal integer(long value) {
            return new Literal(LiteralKind.INTEGER, Long.toString(value));
        }

        /// Returns Python's canonical spelling of this literal, as `repr()` would print it.
        public String repr() {
            return switch (kind) {
                case STRING -> PythonLiterals.repr(text);
                case BYTES -> PythonLiterals.bytesRepr(text);
                case INTEGER -> PythonLiterals.canonicalInteger(text);
                case FLOAT, IMAGINARY, BOOLEAN, NONE -> text;
            };
        }
    }

    record ListLiteral(List<BuilderAst> elements) implements BuilderAst {
        public ListLiteral {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements);
        }
    }

    record TupleLiteral(List<BuilderAst> elements) implements BuilderAst {
        public TupleLiteral {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements);
        }
    }

    /// `key: value`; a null key stands for `**value` unpacking.
    record MappingEntry(BuilderAst key, BuilderAst value) {
        public MappingEntry {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record MappingLiteral(List<MappingEntry> entries) implements BuilderAst {
        public MappingLiteral {
            Objects.requireNonNull(entries, "entries must not be null");
            entries = List.copyOf(entries);
        }
    }

    /// `name=value`; a null name stands for `**value`.
    record KeywordArgument(String name, BuilderAst value) {
        public KeywordArgument {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record Call(BuilderAst callee, List<BuilderAst> positional, List<KeywordArgument> keywords) implements BuilderAst {
        public Call {
            Objects.requireNonNull(callee, "callee must not be null");
            Objects.requireNonNull(positional, "positional must not be null");
            Objects.requireNonNull(keywords, "keywords must not be null");
            positional = List.copyOf(positional);
            keywords = List.copyOf(keywords);
        }
    }

    /// Prefix `-` or `+` applied to an operand.
    record UnaryOperation(char operator, BuilderAst operand) implements BuilderAst {
        public UnaryOperation {
            if (operator != '-' && operator != '+') {
                throw new IllegalArgumentException("Unsupported unary operator: " + operator);
            }
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }
}

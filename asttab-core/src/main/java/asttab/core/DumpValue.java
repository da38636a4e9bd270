package asttab.core;

import java.util.List;
import java.util.Objects;

/// Values read from `ast.dump` text, one record per grammar production.
///
/// A `DumpValue` only lives for the duration of a single parse call before it is
/// handed to the [BuilderExpressionGenerator].
public sealed interface DumpValue permits DumpValue.Node, DumpValue.Sequence, DumpValue.StringLiteral, DumpValue.Atom {

    /// `Name(id='x', ctx=Load())`; fields keep their source order.
    record Node(String typeName, List<Field> fields) implements DumpValue {
        public Node {
            Objects.requireNonNull(typeName, "typeName must not be null");
            Objects.requireNonNull(fields, "fields must not be null");
            fields = List.copyOf(fields);
        }
    }

    /// A single `name=value` pair inside a node.
    record Field(String name, DumpValue value) {
        public Field {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    enum SequenceKind { LIST, TUPLE }

    record Sequence(SequenceKind kind, List<DumpValue> elements) implements DumpValue {
        public Sequence {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements);
        }
    }

    /// Text between matching quotes, exactly as it appeared (no escape processing).
    record StringLiteral(String rawContent, boolean bytes) implements DumpValue {
        public StringLiteral {
            Objects.requireNonNull(rawContent, "rawContent must not be null");
        }
    }

    enum AtomKind { BOOLEAN, NONE, INTEGER, FLOAT, IMAGINARY, ELLIPSIS }

    /// Scalar leaf; `text` is the lexeme as written in the dump.
    record Atom(AtomKind kind, String text) implements DumpValue {
        public Atom {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(text, "text must not be null");
        }
    }
}

package asttab.tree;

import java.util.List;
import java.util.Objects;

/// A Python list or tuple inside a syntax tree.
public record TreeSequence(Kind kind, List<TreeValue> elements) implements TreeValue {

    public enum Kind { LIST, TUPLE }

    public TreeSequence {
        Objects.requireNonNull(kind, "kind must not be null");
        elements = List.copyOf(elements);
    }

    public static TreeSequence list(List<TreeValue> elements) {
        return new TreeSequence(Kind.LIST, elements);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }
}

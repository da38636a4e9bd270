package asttab.roundtrip;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/// Names made available to reconstructed code, each bound to a qualified import.
///
/// Reconstruction starts from an empty namespace plus these bindings; nothing else
/// leaks in.
///
/// Usage:
/// ```java
/// Bindings bindings = Bindings.standard().with("Path", "pathlib.Path");
/// ```
public final class Bindings {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern QUALIFIED = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private static final Bindings EMPTY = new Bindings(Map.of());
    private static final Bindings STANDARD = EMPTY
            .with("Any", "typing.Any")
            .with("AsyncGenerator", "collections.abc.AsyncGenerator");

    private final Map<String, String> entries;

    private Bindings(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Bindings empty() {
        return EMPTY;
    }

    /// `Any` from `typing` and `AsyncGenerator` from `collections.abc`.
    public static Bindings standard() {
        return STANDARD;
    }

    /// Returns a copy with `name` bound to the qualified import, replacing any earlier binding.
    /// @throws IllegalArgumentException if either part is not a valid Python name
    public Bindings with(String name, String qualified) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(qualified, "qualified must not be null");
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a Python identifier: '" + name + "'");
        }
        if (!QUALIFIED.matcher(qualified).matches()) {
            throw new IllegalArgumentException("Not a qualified Python name: '" + qualified + "'");
        }
        final var copy = new LinkedHashMap<>(entries);
        copy.put(name, qualified);
        return new Bindings(copy);
    }

    public Map<String, String> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /// One import statement per binding, in binding order.
    public List<String> importStatements() {
        final List<String> statements = new ArrayList<>(entries.size());
        entries.forEach((name, qualified) -> statements.add(importStatement(name, qualified)));
        return statements;
    }

    private static String importStatement(String name, String qualified) {
        final int dot = qualified.lastIndexOf('.');
        if (dot < 0) {
            return qualified.equals(name) ? "import " + qualified : "import " + qualified + " as " + name;
        }
        final String module = qualified.substring(0, dot);
        final String member = qualified.substring(dot + 1);
        return "from " + module + " import " + member + (member.equals(name) ? "" : " as " + name);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Bindings other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Bindings" + entries;
    }
}

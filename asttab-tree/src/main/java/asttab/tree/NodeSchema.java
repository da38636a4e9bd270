package asttab.tree;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Node types of a Python `ast` module and the field names each one accepts.
///
/// The schema is read from a line-oriented resource:
/// ```
/// @attributes stmt lineno col_offset end_lineno? end_col_offset?
/// stmt Assign targets* value type_comment?
/// expr_context Load
/// ```
/// The bundled resource describes Python 3.12. Another resource on the classpath can
/// be selected with the system property {@code asttab.schema.resource}.
public final class NodeSchema {

    private static final Logger LOG = Logger.getLogger(NodeSchema.class.getName());

    /// System property key for the schema resource path
    public static final String RESOURCE_PROPERTY = "asttab.schema.resource";

    /// Resource used when the property is not set
    public static final String DEFAULT_RESOURCE = "/asttab/tree/python-3.12.schema";

    /// How many values a field holds.
    public enum Cardinality { REQUIRED, OPTIONAL, SEQUENCE }

    public record FieldSpec(String name, Cardinality cardinality) {
        public FieldSpec {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(cardinality, "cardinality must not be null");
        }

        public boolean optional() {
            return cardinality == Cardinality.OPTIONAL;
        }
    }

    public record NodeType(String name, String category, List<FieldSpec> fields) {
        public NodeType {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(category, "category must not be null");
            fields = List.copyOf(fields);
        }

        public Optional<FieldSpec> field(String fieldName) {
            return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
        }
    }

    private static final class Standard {
        static final NodeSchema INSTANCE = load(System.getProperty(RESOURCE_PROPERTY, DEFAULT_RESOURCE));
    }

    private final Map<String, NodeType> types;
    private final Map<String, List<FieldSpec>> attributes;

    private NodeSchema(Map<String, NodeType> types, Map<String, List<FieldSpec>> attributes) {
        this.types = Collections.unmodifiableMap(types);
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    /// Returns the schema configured by {@code asttab.schema.resource}, loaded once.
    public static NodeSchema standard() {
        return Standard.INSTANCE;
    }

    /// Loads a schema from a classpath resource.
    /// @throws IllegalArgumentException if the resource is missing or malformed
    public static NodeSchema load(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        LOG.config(() -> "Loading node schema from " + resource);
        try (InputStream in = NodeSchema.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Schema resource not found: " + resource);
            }
            final var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            return parse(reader.lines().toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read schema resource " + resource, e);
        }
    }

    /// Parses schema lines; blank lines and `#` comments are ignored.
    /// @throws IllegalArgumentException on a malformed or duplicate entry
    public static NodeSchema parse(List<String> lines) {
        final Map<String, NodeType> types = new LinkedHashMap<>();
        final Map<String, List<FieldSpec>> attributes = new LinkedHashMap<>();
        int lineNo = 0;
        for (String raw : lines) {
            lineNo++;
            final String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            final String[] words = line.split("\\s+");
            if (words.length < 2) {
                throw new IllegalArgumentException("Schema line " + lineNo + " needs a category and a name: " + line);
            }
            if (words[0].equals("@attributes")) {
                final List<FieldSpec> specs = new ArrayList<>();
                for (int i = 2; i < words.length; i++) {
                    specs.add(fieldSpec(words[i], lineNo));
                }
                attributes.put(words[1], List.copyOf(specs));
                continue;
            }
            final List<FieldSpec> fields = new ArrayList<>();
            for (int i = 2; i < words.length; i++) {
                fields.add(fieldSpec(words[i], lineNo));
            }
            final var type = new NodeType(words[1], words[0], fields);
            if (types.putIfAbsent(type.name(), type) != null) {
                throw new IllegalArgumentException("Schema line " + lineNo + " redefines node type " + type.name());
            }
        }
        LOG.fine(() -> "Node schema holds " + types.size() + " node types");
        return new NodeSchema(types, attributes);
    }

    private static FieldSpec fieldSpec(String word, int lineNo) {
        final char last = word.charAt(word.length() - 1);
        final String name = last == '?' || last == '*' ? word.substring(0, word.length() - 1) : word;
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Schema line " + lineNo + " has an empty field name");
        }
        final Cardinality cardinality = switch (last) {
            case '?' -> Cardinality.OPTIONAL;
            case '*' -> Cardinality.SEQUENCE;
            default -> Cardinality.REQUIRED;
        };
        return new FieldSpec(name, cardinality);
    }

    public Optional<NodeType> type(String name) {
        return Optional.ofNullable(types.get(name));
    }

    public boolean contains(String name) {
        return types.containsKey(name);
    }

    /// Location attributes carried by nodes of `category`; empty if it has none.
    public List<FieldSpec> attributes(String category) {
        return attributes.getOrDefault(category, List.of());
    }

    /// Location attributes carried by nodes of type `typeName`; empty for unknown types.
    public List<FieldSpec> attributesOf(String typeName) {
        final NodeType type = types.get(typeName);
        return type == null ? List.of() : attributes(type.category());
    }

    public int size() {
        return types.size();
    }
}

package asttab.roundtrip;

import java.util.Objects;
import java.util.Optional;

/// A named callable whose defining source may or may not be retrievable.
public interface CallableHandle {

    String name();

    /// The source of the definition, or empty when it cannot be retrieved.
    Optional<String> sourceText();

    static CallableHandle of(String name, String source) {
        Objects.requireNonNull(source, "source must not be null");
        return new Simple(name, source);
    }

    /// A callable with no retrievable source, such as a builtin.
    static CallableHandle withoutSource(String name) {
        return new Simple(name, null);
    }

    record Simple(String name, String source) implements CallableHandle {
        public Simple {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Optional<String> sourceText() {
            return Optional.ofNullable(source);
        }
    }
}

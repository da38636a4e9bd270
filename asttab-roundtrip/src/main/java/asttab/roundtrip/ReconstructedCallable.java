package asttab.roundtrip;

import java.util.Objects;
import java.util.Optional;

/// A function rebuilt from a builder expression and executed by the host.
/// @param name the function's name
/// @param kind what calling it produces
/// @param source the source it was compiled from
public record ReconstructedCallable(String name, CallableKind kind, String source) implements CallableHandle {

    public ReconstructedCallable {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public Optional<String> sourceText() {
        return Optional.of(source);
    }
}

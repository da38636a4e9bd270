package asttab.roundtrip;

import java.util.List;

/// The module defines more than one top-level function, so none can be picked.
public class AmbiguousCallableException extends ReconstructionException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final List<String> candidates;

    public AmbiguousCallableException(List<String> candidates) {
        super("Expected exactly one function definition, found " + candidates.size() + ": " + candidates);
        this.candidates = List.copyOf(candidates);
    }

    public List<String> candidates() {
        return candidates;
    }
}

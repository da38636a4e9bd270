package asttab.roundtrip;

/// What kind of callable a function definition produces when executed.
public enum CallableKind {
    FUNCTION,
    GENERATOR,
    COROUTINE,
    ASYNC_GENERATOR
}

package tree.suffix;

/**
 * Failure raised while building or querying a {@link SuffixTree}. Construction is deterministic,
 * so a failure on a given input always recurs; callers should treat it as fatal to that build.
 */
public final class SuffixTreeException extends RuntimeException {

    public enum Kind {
        // label/path/length queried before a sequence was set
        UNINITIALIZED_STORE,
        // a second sequence offered to a store that already holds one
        ALREADY_BUILT,
        // symbol cannot serve as a map key (null, array, identity equality)
        UNSUPPORTED_SYMBOL,
        // internal bug in the extension step, never a user error
        STRUCTURAL_INVARIANT
    }

    private final Kind kind;

    public SuffixTreeException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    static SuffixTreeException invariant(String message) {
        return new SuffixTreeException(Kind.STRUCTURAL_INVARIANT, message);
    }
}

package tree.suffix;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Holds the input sequence once construction begins. Edge labels are (endOffset, length)
 * references into it, never copies.
 */
public final class SequenceStore<T> {

    private ObjectArrayList<T> symbols; // null until set

    public boolean isInitialized() {
        return symbols != null;
    }

    /**
     * Set the sequence. May be called once per store.
     */
    void set(List<? extends T> sequence) {
        Objects.requireNonNull(sequence, "sequence");
        if (symbols != null) {
            throw new SuffixTreeException(SuffixTreeException.Kind.ALREADY_BUILT,
                    "sequence store already holds " + symbols.size() + " symbols");
        }
        // nulls are tolerated here and rejected once used as a link key
        symbols = new ObjectArrayList<>(sequence);
    }

    public int length() {
        return initialized().size();
    }

    public T symbolAt(int offset) {
        return initialized().get(offset);
    }

    /**
     * Label of an edge ending right before {@code endOffset}: sequence[endOffset-length, endOffset).
     */
    public List<T> slice(int endOffset, int length) {
        ObjectArrayList<T> s = initialized();
        if (length < 0 || endOffset > s.size() || endOffset - length < 0) {
            throw new IndexOutOfBoundsException(
                    "slice [" + (endOffset - length) + ", " + endOffset + ") outside sequence of length " + s.size());
        }
        return Collections.unmodifiableList(s.subList(endOffset - length, endOffset));
    }

    /**
     * Read-only view of the suffix starting at {@code start}.
     */
    public List<T> suffix(int start) {
        return slice(length(), length() - start);
    }

    private ObjectArrayList<T> initialized() {
        if (symbols == null) {
            throw new SuffixTreeException(SuffixTreeException.Kind.UNINITIALIZED_STORE,
                    "no sequence has been set");
        }
        return symbols;
    }
}

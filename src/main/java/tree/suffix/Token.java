package tree.suffix;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A symbol that is either a wrapped value or a numbered terminator. Terminators equal only
 * terminators with the same number, so appending one guarantees that every suffix ends in its own
 * leaf; distinct numbers separate concatenated sequences.
 */
public final class Token<T> {

    private final T value;
    private final int terminator; // -1 for values

    private Token(T value, int terminator) {
        this.value = value;
        this.terminator = terminator;
    }

    public static <T> Token<T> of(T value) {
        return new Token<>(Objects.requireNonNull(value, "value"), -1);
    }

    public static <T> Token<T> terminator(int number) {
        if (number < 0) {
            throw new IllegalArgumentException("terminator number must be non-negative");
        }
        return new Token<>(null, number);
    }

    /**
     * Wrap every symbol and append terminator 0.
     */
    public static <T> List<Token<T>> terminate(List<? extends T> sequence) {
        List<Token<T>> out = values(sequence, sequence.size() + 1);
        out.add(terminator(0));
        return out;
    }

    public static <T> List<Token<T>> values(List<? extends T> sequence) {
        return values(sequence, sequence.size());
    }

    private static <T> List<Token<T>> values(List<? extends T> sequence, int capacity) {
        List<Token<T>> out = new ArrayList<>(capacity);
        for (T symbol : sequence) {
            out.add(of(symbol));
        }
        return out;
    }

    public boolean isTerminator() {
        return terminator >= 0;
    }

    public int terminatorNumber() {
        return terminator;
    }

    /**
     * Wrapped value; fails on terminators.
     */
    public T value() {
        if (isTerminator()) {
            throw new IllegalStateException("terminator $" + terminator + " carries no value");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token<?> other = (Token<?>) o;
        return terminator == other.terminator && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return isTerminator() ? Integer.hashCode(-1 - terminator) : value.hashCode();
    }

    @Override
    public String toString() {
        return isTerminator() ? "$" + terminator : String.valueOf(value);
    }
}

package search;

import java.util.List;

/** Longest shared run of two sequences and its first start offset in each of them. */
public record CommonSubstring<T>(List<T> symbols, int firstOffset, int secondOffset) {

    public int length() {
        return symbols.size();
    }
}

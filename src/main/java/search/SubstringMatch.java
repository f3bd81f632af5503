package search;

import java.util.List;

/** A substring of the indexed sequence together with every offset it starts at (ascending). */
public record SubstringMatch<T>(List<T> symbols, List<Integer> offsets) {

    public int length() {
        return symbols.size();
    }
}

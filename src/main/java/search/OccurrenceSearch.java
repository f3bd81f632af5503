package search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import tree.suffix.SuffixTree;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Pattern lookup on a finished suffix tree. Matching costs O(|pattern|) plus the size of the
 * subtree below the match point.
 */
public final class OccurrenceSearch {

    private OccurrenceSearch() {
    }

    /**
     * Find all starting offsets where the pattern occurs, in ascending order. We descend the tree by
     * first symbol and compare edge labels. If the pattern ends in the middle of an edge we gather
     * all suffix offsets below that edge's child.
     */
    public static <T> List<Integer> findOccurrences(SuffixTree<T> tree, List<? extends T> pattern) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(pattern, "pattern");
        if (pattern.isEmpty()) {
            return Collections.emptyList();
        }
        int node = locate(tree, pattern);
        if (node == SuffixTree.NO_NODE) {
            return Collections.emptyList();
        }
        return collectOccurrences(tree, node);
    }

    public static List<Integer> findOccurrences(SuffixTree<Character> tree, CharSequence pattern) {
        return findOccurrences(tree, SuffixTree.characters(pattern));
    }

    public static <T> boolean contains(SuffixTree<T> tree, List<? extends T> pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return pattern.isEmpty() || locate(tree, pattern) != SuffixTree.NO_NODE;
    }

    public static <T> int count(SuffixTree<T> tree, List<? extends T> pattern) {
        return findOccurrences(tree, pattern).size();
    }

    /**
     * Node at or just below the end of {@code pattern}, or NO_NODE if the pattern is absent.
     */
    static <T> int locate(SuffixTree<T> tree, List<? extends T> pattern) {
        int current = SuffixTree.ROOT;
        int patternIndex = 0;
        while (patternIndex < pattern.size()) {
            int child = tree.childByFirstSymbol(current, pattern.get(patternIndex));
            if (child == SuffixTree.NO_NODE) {
                // No outgoing edge that starts with this symbol.
                return SuffixTree.NO_NODE;
            }
            List<T> label = tree.label(tree.incomingEdge(child));
            int consumed = 0;
            while (consumed < label.size() && patternIndex < pattern.size()) {
                if (!Objects.equals(label.get(consumed), pattern.get(patternIndex))) {
                    return SuffixTree.NO_NODE;
                }
                consumed++;
                patternIndex++;
            }
            current = child;
        }
        return current;
    }

    /**
     * Start offsets of every suffix ending at or below {@code node}, ascending. Iterative to keep
     * deep trees over repetitive input off the call stack.
     */
    static List<Integer> collectOccurrences(SuffixTree<?> tree, int node) {
        IntArrayList offsets = new IntArrayList();
        IntArrayList stack = new IntArrayList();
        stack.push(node);
        while (!stack.isEmpty()) {
            int current = stack.popInt();
            int start = tree.startOffset(current);
            if (start >= 0) {
                offsets.add(start);
            }
            stack.addAll(tree.children(current));
        }
        int[] sorted = offsets.toIntArray();
        Arrays.sort(sorted);
        return IntArrayList.wrap(sorted);
    }
}

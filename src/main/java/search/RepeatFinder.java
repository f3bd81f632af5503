package search;

import org.apache.commons.math3.util.Pair;
import tree.suffix.SuffixTree;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Longest repeated substring: the deepest node below which at least two suffixes end.
 */
public final class RepeatFinder {

    private RepeatFinder() {
    }

    /**
     * Longest substring that occurs at least twice (occurrences may overlap). Among equally long
     * candidates the one occurring first wins. Empty when no symbol repeats.
     */
    public static <T> Optional<SubstringMatch<T>> longestRepeat(SuffixTree<T> tree) {
        Objects.requireNonNull(tree, "tree");
        int bestDepth = 0;
        int bestNode = SuffixTree.NO_NODE;
        List<Integer> bestOffsets = null;

        // (node, depth) frames
        ArrayDeque<Pair<Integer, Integer>> stack = new ArrayDeque<>();
        stack.push(new Pair<>(SuffixTree.ROOT, 0));
        while (!stack.isEmpty()) {
            Pair<Integer, Integer> frame = stack.pop();
            int node = frame.getFirst();
            int depth = frame.getSecond();

            if (node != SuffixTree.ROOT && repeats(tree, node) && depth >= bestDepth) {
                List<Integer> offsets = OccurrenceSearch.collectOccurrences(tree, node);
                if (depth > bestDepth || offsets.get(0) < bestOffsets.get(0)) {
                    bestDepth = depth;
                    bestNode = node;
                    bestOffsets = offsets;
                }
            }
            for (int child : tree.children(node)) {
                stack.push(new Pair<>(child, depth + tree.incomingEdge(child).getLength()));
            }
        }
        if (bestNode == SuffixTree.NO_NODE) {
            return Optional.empty();
        }
        return Optional.of(new SubstringMatch<>(tree.path(bestNode), bestOffsets));
    }

    // two or more suffixes end in the subtree
    private static boolean repeats(SuffixTree<?> tree, int node) {
        int degree = tree.outDegree(node);
        return degree >= 2 || (degree == 1 && tree.startOffset(node) >= 0);
    }
}

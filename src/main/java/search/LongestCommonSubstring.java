package search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import tree.suffix.SuffixTree;
import tree.suffix.Token;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Longest common substring of two sequences via one suffix tree over first + $0 + second + $1.
 * A node spells a common substring exactly when its subtree holds a suffix starting in each input;
 * the unique terminators keep such paths inside both inputs.
 */
public final class LongestCommonSubstring {

    private LongestCommonSubstring() {
    }

    public static <T> Optional<CommonSubstring<T>> of(List<? extends T> first, List<? extends T> second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");

        List<Token<T>> tokens = new ArrayList<>(first.size() + second.size() + 2);
        tokens.addAll(Token.values(first));
        tokens.add(Token.terminator(0));
        tokens.addAll(Token.values(second));
        tokens.add(Token.terminator(1));
        SuffixTree<Token<T>> tree = SuffixTree.of(tokens);

        int firstEnd = first.size();            // offset of $0
        int secondStart = firstEnd + 1;
        int secondEnd = secondStart + second.size();
        int nodeCount = tree.nodeCount();

        // pre-order, then walk it backwards so children are folded into parents
        int[] depth = new int[nodeCount];
        IntArrayList order = new IntArrayList(nodeCount);
        IntArrayList stack = new IntArrayList();
        stack.push(SuffixTree.ROOT);
        while (!stack.isEmpty()) {
            int node = stack.popInt();
            order.add(node);
            for (int child : tree.children(node)) {
                depth[child] = depth[node] + tree.incomingEdge(child).getLength();
                stack.push(child);
            }
        }

        int[] minFirst = new int[nodeCount];
        int[] minSecond = new int[nodeCount];
        Arrays.fill(minFirst, Integer.MAX_VALUE);
        Arrays.fill(minSecond, Integer.MAX_VALUE);
        int best = SuffixTree.NO_NODE;
        for (int i = order.size() - 1; i >= 0; i--) {
            int node = order.getInt(i);
            int start = tree.startOffset(node);
            if (start >= 0 && start < firstEnd) {
                minFirst[node] = Math.min(minFirst[node], start);
            } else if (start >= secondStart && start < secondEnd) {
                minSecond[node] = Math.min(minSecond[node], start);
            }
            if (node != SuffixTree.ROOT) {
                int parent = tree.parentOf(node);
                minFirst[parent] = Math.min(minFirst[parent], minFirst[node]);
                minSecond[parent] = Math.min(minSecond[parent], minSecond[node]);
                if (minFirst[node] != Integer.MAX_VALUE && minSecond[node] != Integer.MAX_VALUE
                        && isBetter(node, best, depth, minFirst, minSecond)) {
                    best = node;
                }
            }
        }
        if (best == SuffixTree.NO_NODE) {
            return Optional.empty();
        }

        List<T> symbols = new ArrayList<>(depth[best]);
        for (Token<T> token : tree.path(best)) {
            symbols.add(token.value());
        }
        return Optional.of(new CommonSubstring<>(symbols, minFirst[best], minSecond[best] - secondStart));
    }

    private static boolean isBetter(int node, int best, int[] depth, int[] minFirst, int[] minSecond) {
        if (best == SuffixTree.NO_NODE || depth[node] > depth[best]) {
            return true;
        }
        if (depth[node] < depth[best]) {
            return false;
        }
        if (minFirst[node] != minFirst[best]) {
            return minFirst[node] < minFirst[best];
        }
        return minSecond[node] < minSecond[best];
    }
}

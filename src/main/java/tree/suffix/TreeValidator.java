package tree.suffix;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;

import java.util.List;
import java.util.Objects;

/**
 * Checks the structural invariants of a finished tree and fails with
 * {@link SuffixTreeException.Kind#STRUCTURAL_INVARIANT} on the first violation.
 *
 * Runs in time linear in the node count. Full path recovery (path(leaf) == sequence[start:]) is
 * quadratic and left to tests; here a tagged node only has to end at the sequence end at the
 * matching depth.
 */
public final class TreeValidator {

    private TreeValidator() {
    }

    public static <T> void validate(SuffixTree<T> tree) {
        int nodeCount = tree.nodeCount();
        int n = tree.sequenceLength();

        if (tree.incomingEdge(SuffixTree.ROOT) != null) {
            throw SuffixTreeException.invariant("root has an incoming edge");
        }
        for (int id = 1; id < nodeCount; id++) {
            Edge<T> edge = tree.incomingEdge(id);
            if (edge == null) {
                throw SuffixTreeException.invariant("node " + id + " has no incoming edge");
            }
            if (edge.getChild() != id) {
                throw SuffixTreeException.invariant("edge " + edge + " is stored under node " + id);
            }
            if (edge.getLength() <= 0 || edge.getStartOffset() < 0 || edge.getEndOffset() > n) {
                throw SuffixTreeException.invariant("edge " + edge + " lies outside the sequence");
            }
            if (!Objects.equals(edge.getFirstSymbol(), tree.symbolAt(edge.getStartOffset()))) {
                throw SuffixTreeException.invariant("edge " + edge + " first symbol differs from its label");
            }
            if (!tree.children(edge.getParent()).contains(id)) {
                throw SuffixTreeException.invariant("node " + id + " missing from children of " + edge.getParent());
            }
        }

        // every node reachable exactly once; depths computed top-down
        int[] depth = new int[nodeCount];
        boolean[] seen = new boolean[nodeCount];
        IntArrayList stack = new IntArrayList();
        stack.push(SuffixTree.ROOT);
        seen[SuffixTree.ROOT] = true;
        int reached = 0;
        while (!stack.isEmpty()) {
            int node = stack.popInt();
            reached++;
            IntList children = tree.children(node);
            ObjectOpenHashSet<T> firstSymbols = new ObjectOpenHashSet<>(children.size());
            for (int i = 0; i < children.size(); i++) {
                int child = children.getInt(i);
                if (seen[child]) {
                    throw SuffixTreeException.invariant("node " + child + " reached twice");
                }
                seen[child] = true;
                Edge<T> edge = tree.incomingEdge(child);
                if (edge.getParent() != node) {
                    throw SuffixTreeException.invariant("node " + child + " listed under " + node
                            + " but its edge starts at " + edge.getParent());
                }
                if (!firstSymbols.add(edge.getFirstSymbol())) {
                    throw SuffixTreeException.invariant("node " + node + " has two edges starting with "
                            + edge.getFirstSymbol());
                }
                depth[child] = depth[node] + edge.getLength();
                stack.push(child);
            }

            int start = tree.startOffset(node);
            if (node != SuffixTree.ROOT && start < 0 && children.size() < 2) {
                throw SuffixTreeException.invariant("internal node " + node + " has " + children.size() + " children");
            }
            if (start >= 0) {
                Edge<T> edge = tree.incomingEdge(node);
                if (edge.getEndOffset() != n || depth[node] != n - start) {
                    throw SuffixTreeException.invariant("node " + node + " does not spell the suffix at " + start);
                }
            }
        }
        if (reached != nodeCount) {
            throw SuffixTreeException.invariant("only " + reached + " of " + nodeCount + " nodes reachable from the root");
        }
    }

    /**
     * True when {@code path} equals sequence[start:] for every tagged node. Quadratic.
     */
    public static <T> boolean pathsSpellSuffixes(SuffixTree<T> tree) {
        int n = tree.sequenceLength();
        for (int id = 1; id < tree.nodeCount(); id++) {
            int start = tree.startOffset(id);
            if (start < 0) {
                continue;
            }
            List<T> path = tree.path(id);
            if (path.size() != n - start) {
                return false;
            }
            for (int i = 0; i < path.size(); i++) {
                if (!Objects.equals(path.get(i), tree.symbolAt(start + i))) {
                    return false;
                }
            }
        }
        return true;
    }
}

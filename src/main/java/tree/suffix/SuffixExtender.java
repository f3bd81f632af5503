package tree.suffix;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;

/**
 * One construction step: inserts the suffix starting at a given offset into a tree that already
 * holds every later-starting suffix.
 *
 * The insertion point is found without rescanning from the root. From the previously created
 * leaf we climb until some ancestor v has a suffix link for the new suffix's first symbol a; the
 * link target w spells a + path(v), so everything up to w is already in the tree. If w has a child
 * edge continuing the suffix, the new suffix leaves that edge at a node boundary of the climbed
 * path, which we find by comparing only the first symbol of each climbed edge against the label.
 * That edge is split there, the new split node receives its own suffix link, and the leaf is
 * attached below. Total work over all steps is linear in the sequence length.
 */
final class SuffixExtender<T> {

    private final SuffixTree<T> tree;
    private final SequenceStore<T> store;
    private final SymbolGuard guard;
    private int previousLeaf;

    SuffixExtender(SuffixTree<T> tree, SymbolGuard guard) {
        this(tree, guard, SuffixTree.ROOT);
    }

    SuffixExtender(SuffixTree<T> tree, SymbolGuard guard, int previousLeaf) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.store = tree.store();
        this.guard = Objects.requireNonNull(guard, "guard");
        this.previousLeaf = previousLeaf;
    }

    int previousLeaf() {
        return previousLeaf;
    }

    /**
     * Insert sequence[start:] and return the id of its leaf.
     */
    int extend(int start) {
        final int n = store.length();
        final int suffixLength = n - start;
        final T first = store.symbolAt(start);
        guard.check(first, start);

        // climb from the previous leaf, remembering the edges passed (top of stack = highest)
        ArrayDeque<Edge<T>> climbed = new ArrayDeque<>();
        int v = previousLeaf;
        int consumed = suffixLength;
        int w = SuffixTree.NO_NODE;
        boolean anchoredAtRoot = false;
        while (w == SuffixTree.NO_NODE) {
            Edge<T> up = tree.incomingEdge(v);
            if (up == null) {
                w = SuffixTree.ROOT;
                consumed = 0;
                anchoredAtRoot = true;
                break;
            }
            consumed -= up.getLength();
            climbed.push(up);
            v = up.getParent();
            w = tree.getLink(v, first);
        }

        int u = tree.childByFirstSymbol(w, store.symbolAt(start + consumed));
        if (u != SuffixTree.NO_NODE) {
            Edge<T> edge = tree.incomingEdge(u);
            List<T> label = tree.label(edge);
            int edgeLength = edge.getLength();

            // From a link target, label[0] lines up with the top of the climbed path. From the
            // root, label[0] is the suffix's own first symbol, which the climbed path (the previous
            // suffix) does not contain.
            int j = anchoredAtRoot ? 1 : 0;
            while (!climbed.isEmpty() && j < edgeLength
                    && Objects.equals(climbed.peek().getFirstSymbol(), label.get(j))) {
                j += climbed.pop().getLength();
            }

            if (j > edgeLength) {
                throw SuffixTreeException.invariant("mismatch scan overshot edge " + edge
                        + " while inserting suffix " + start);
            }
            if (j == edgeLength) {
                // whole edge already spelled by the suffix, continue from its child
                w = u;
                consumed += edgeLength;
            } else if (climbed.isEmpty()) {
                throw SuffixTreeException.invariant("suffix " + start + " ends inside edge " + edge);
            } else {
                int linkSource = climbed.peek().getParent();
                int split = tree.splitEdge(edge, j);
                consumed += j;
                tree.setLink(linkSource, first, split);
                w = split;
            }
        }

        int leafLength = suffixLength - consumed;
        if (leafLength <= 0) {
            throw SuffixTreeException.invariant("suffix " + start + " already fully present below node " + w);
        }
        int leaf = tree.createLeaf(start);
        tree.attach(w, leaf, store.symbolAt(start + consumed), leafLength, n);
        tree.setLink(previousLeaf, first, leaf);
        previousLeaf = leaf;
        return leaf;
    }
}

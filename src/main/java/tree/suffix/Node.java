package tree.suffix;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

// Arena entry. Relations to other nodes are stored as ids, never as references.
final class Node<T> {

    final int id;

    // start offset of the suffix ending here, -1 for split nodes and the root
    final int startOffset;

    // symbol -> node id; only ever grows
    final Object2IntOpenHashMap<T> links;

    // ids of children, in attach order; fan-out is small so lookups scan
    final IntArrayList children = new IntArrayList(2);

    Node(int id, int startOffset) {
        this.id = id;
        this.startOffset = startOffset;
        this.links = new Object2IntOpenHashMap<>(2);
        this.links.defaultReturnValue(SuffixTree.NO_NODE);
    }

    void replaceChild(int oldChild, int newChild) {
        int idx = children.indexOf(oldChild);
        if (idx < 0) {
            throw SuffixTreeException.invariant("node " + id + " has no child " + oldChild);
        }
        children.set(idx, newChild);
    }
}

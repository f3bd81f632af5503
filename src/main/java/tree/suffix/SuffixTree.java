package tree.suffix;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * SuffixTree
 *
 * Edge-compressed trie of every suffix of a sequence over a generic alphabet. Any symbol type with
 * value equality and hashing works: characters, integers, coordinate pairs, records.
 *
 * Nodes live in an arena indexed by a small integer id assigned in creation order (root = 0).
 * Parent/child relations and suffix links are id-to-id mappings. Each non-root node has exactly one
 * incoming edge, stored at the child's id, so parent lookup is O(1). Edge labels are references
 * into the {@link SequenceStore}.
 *
 * The tree is grown only by {@link SuffixExtender} during construction (see
 * {@link SuffixTreeBuilder}) and is read-only afterwards. Queries on a finished tree are safe for
 * concurrent readers.
 */
public final class SuffixTree<T> {

    public static final int ROOT = 0;
    public static final int NO_NODE = -1;

    private final SequenceStore<T> store;
    private final ObjectArrayList<Node<T>> nodes = new ObjectArrayList<>();
    // indexed by child id; slot 0 (root) stays null
    private final ObjectArrayList<Edge<T>> incoming = new ObjectArrayList<>();

    SuffixTree(SequenceStore<T> store) {
        this.store = Objects.requireNonNull(store, "store");
        createNode();
    }

    /**
     * Build the suffix tree of {@code sequence} with default configuration.
     */
    public static <T> SuffixTree<T> of(List<? extends T> sequence) {
        return new SuffixTreeBuilder<T>().build(sequence);
    }

    /**
     * Build the suffix tree of a character sequence.
     */
    public static SuffixTree<Character> of(CharSequence text) {
        return of(characters(text));
    }

    /**
     * The characters of {@code text} as a symbol list.
     */
    public static List<Character> characters(CharSequence text) {
        Objects.requireNonNull(text, "text");
        List<Character> symbols = new ArrayList<>(text.length());
        for (int i = 0; i < text.length(); i++) {
            symbols.add(text.charAt(i));
        }
        return symbols;
    }

    void ensureCapacity(int expectedNodes) {
        nodes.ensureCapacity(expectedNodes);
        incoming.ensureCapacity(expectedNodes);
    }

    // ---------------------------------------------------------------------------------------
    // Node table and suffix link index
    // ---------------------------------------------------------------------------------------

    /**
     * Allocate the next sequential id with an empty link table.
     */
    int createNode() {
        return addNode(-1);
    }

    /**
     * Allocate a node tagged with the start offset of the suffix it terminates.
     */
    int createLeaf(int startOffset) {
        return addNode(startOffset);
    }

    private int addNode(int startOffset) {
        int id = nodes.size();
        nodes.add(new Node<>(id, startOffset));
        incoming.add(null);
        return id;
    }

    /**
     * Record or overwrite the suffix link of {@code node} for {@code symbol}.
     */
    void setLink(int node, T symbol, int target) {
        checkNode(target);
        node(node).links.put(symbol, target);
    }

    /**
     * Suffix link of {@code node} for {@code symbol}, or {@link #NO_NODE}. Absence is the common
     * case while walking the tree, not an error.
     */
    public int getLink(int node, T symbol) {
        return node(node).links.getInt(symbol);
    }

    // ---------------------------------------------------------------------------------------
    // Edge structure
    // ---------------------------------------------------------------------------------------

    /**
     * Create a new edge from {@code parent} to the fresh node {@code child}.
     */
    Edge<T> attach(int parent, int child, T firstSymbol, int length, int endOffset) {
        checkNode(parent);
        checkNode(child);
        if (child == ROOT || incoming.get(child) != null) {
            throw SuffixTreeException.invariant("node " + child + " already has a parent");
        }
        if (childByFirstSymbol(parent, firstSymbol) != NO_NODE) {
            throw SuffixTreeException.invariant(
                    "node " + parent + " already has an edge starting with " + firstSymbol);
        }
        if (length <= 0 || endOffset - length < 0 || endOffset > store.length()) {
            throw SuffixTreeException.invariant(
                    "edge [" + (endOffset - length) + ", " + endOffset + ") outside the sequence");
        }
        Edge<T> edge = new Edge<>(parent, child, firstSymbol, length, endOffset);
        incoming.set(child, edge);
        node(parent).children.add(child);
        return edge;
    }

    /**
     * Child of {@code parent} whose edge starts with {@code symbol}, or {@link #NO_NODE}.
     */
    public int childByFirstSymbol(int parent, T symbol) {
        IntList children = node(parent).children;
        for (int i = 0; i < children.size(); i++) {
            int child = children.getInt(i);
            if (Objects.equals(incoming.get(child).getFirstSymbol(), symbol)) {
                return child;
            }
        }
        return NO_NODE;
    }

    /**
     * Parent of {@code node}, or {@link #NO_NODE} for the root.
     */
    public int parentOf(int node) {
        Edge<T> edge = incomingEdge(node);
        return edge == null ? NO_NODE : edge.getParent();
    }

    /**
     * Edge ending at {@code node}, null for the root.
     */
    public Edge<T> incomingEdge(int node) {
        checkNode(node);
        return incoming.get(node);
    }

    /**
     * Insert a new internal node {@code cutLength} symbols along {@code edge}. The two resulting
     * labels concatenate to exactly the original one.
     *
     * @return id of the new node
     */
    int splitEdge(Edge<T> edge, int cutLength) {
        int parent = edge.getParent();
        int child = edge.getChild();
        if (incoming.get(child) != edge) {
            throw SuffixTreeException.invariant("edge " + edge + " is no longer part of the tree");
        }
        if (cutLength <= 0 || cutLength >= edge.getLength()) {
            throw SuffixTreeException.invariant(
                    "cannot split edge of length " + edge.getLength() + " at " + cutLength);
        }
        int cutOffset = edge.getStartOffset() + cutLength;
        int mid = createNode();

        // parent -> mid keeps the first symbol, mid -> child keeps the original end
        Edge<T> upper = new Edge<>(parent, mid, edge.getFirstSymbol(), cutLength, cutOffset);
        Edge<T> lower = new Edge<>(mid, child, store.symbolAt(cutOffset),
                edge.getLength() - cutLength, edge.getEndOffset());

        node(parent).replaceChild(child, mid);
        incoming.set(mid, upper);
        incoming.set(child, lower);
        node(mid).children.add(child);
        return mid;
    }

    // ---------------------------------------------------------------------------------------
    // Query layer
    // ---------------------------------------------------------------------------------------

    /**
     * Symbols on {@code edge}.
     */
    public List<T> label(Edge<T> edge) {
        return store.slice(edge.getEndOffset(), edge.getLength());
    }

    /**
     * Sum of edge lengths from the root to {@code node}.
     */
    public int length(int node) {
        requireSequence();
        int total = 0;
        for (Edge<T> e = incomingEdge(node); e != null; e = incoming.get(e.getParent())) {
            total += e.getLength();
        }
        return total;
    }

    /**
     * Concatenated edge labels from the root to {@code node}.
     */
    public List<T> path(int node) {
        requireSequence();
        ArrayDeque<Edge<T>> edges = new ArrayDeque<>();
        int total = 0;
        for (Edge<T> e = incomingEdge(node); e != null; e = incoming.get(e.getParent())) {
            edges.push(e);
            total += e.getLength();
        }
        List<T> out = new ArrayList<>(total);
        for (Edge<T> e : edges) {
            out.addAll(label(e));
        }
        return out;
    }

    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Nodes that terminate a suffix and have no children.
     */
    public int leafCount() {
        int count = 0;
        for (int id = 1; id < nodes.size(); id++) {
            if (nodes.get(id).children.isEmpty()) {
                count++;
            }
        }
        return count;
    }

    public int outDegree(int node) {
        return node(node).children.size();
    }

    public boolean isLeaf(int node) {
        return node != ROOT && outDegree(node) == 0;
    }

    /**
     * Start offset of the suffix ending at {@code node}, -1 for split nodes and the root.
     */
    public int startOffset(int node) {
        return node(node).startOffset;
    }

    public IntList children(int node) {
        return IntLists.unmodifiable(node(node).children);
    }

    /**
     * Every current edge, ordered by child id.
     */
    public List<Edge<T>> edges() {
        return Collections.unmodifiableList(
                incoming.stream().filter(Objects::nonNull).collect(Collectors.toList()));
    }

    public int sequenceLength() {
        return store.length();
    }

    public T symbolAt(int offset) {
        return store.symbolAt(offset);
    }

    SequenceStore<T> store() {
        return store;
    }

    private void requireSequence() {
        if (!store.isInitialized()) {
            throw new SuffixTreeException(SuffixTreeException.Kind.UNINITIALIZED_STORE,
                    "no sequence has been set");
        }
    }

    private Node<T> node(int id) {
        checkNode(id);
        return nodes.get(id);
    }

    private void checkNode(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IllegalArgumentException("unknown node " + id + " (tree has " + nodes.size() + " nodes)");
        }
    }
}

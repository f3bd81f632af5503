package tree.suffix;

import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tree.suffix.SuffixTree.NO_NODE;
import static tree.suffix.SuffixTree.ROOT;
import static tree.suffix.TestSequences.chars;

class SuffixTreeTest {

    private SuffixTree<Character> tree;

    @BeforeEach
    void setUp() {
        SequenceStore<Character> store = new SequenceStore<>();
        store.set(chars("ABCAB"));
        tree = new SuffixTree<>(store);
    }

    @Test
    @DisplayName("should allocate sequential ids starting after the root")
    void shouldAllocateSequentialIds() {
        assertThat(tree.nodeCount()).isEqualTo(1);
        assertThat(tree.createNode()).isEqualTo(1);
        assertThat(tree.createLeaf(3)).isEqualTo(2);
        assertThat(tree.startOffset(1)).isEqualTo(-1);
        assertThat(tree.startOffset(2)).isEqualTo(3);
        assertThat(tree.parentOf(ROOT)).isEqualTo(NO_NODE);
    }

    @Test
    @DisplayName("should treat a missing suffix link as absent rather than an error")
    void shouldReturnNoNodeForMissingLink() {
        int leaf = tree.createLeaf(0);

        assertThat(tree.getLink(ROOT, 'A')).isEqualTo(NO_NODE);
        tree.setLink(ROOT, 'A', leaf);
        assertThat(tree.getLink(ROOT, 'A')).isEqualTo(leaf);
        assertThat(tree.getLink(ROOT, 'B')).isEqualTo(NO_NODE);
    }

    @Test
    @DisplayName("should overwrite a suffix link for the same symbol")
    void shouldOverwriteLink() {
        int a = tree.createNode();
        int b = tree.createNode();
        tree.setLink(ROOT, 'A', a);
        tree.setLink(ROOT, 'A', b);

        assertThat(tree.getLink(ROOT, 'A')).isEqualTo(b);
    }

    @Test
    @DisplayName("should find children by the first symbol of their edge")
    void shouldFindChildByFirstSymbol() {
        int ab = tree.createLeaf(0);
        tree.attach(ROOT, ab, 'A', 5, 5);
        int b = tree.createLeaf(1);
        tree.attach(ROOT, b, 'B', 4, 5);

        assertThat(tree.childByFirstSymbol(ROOT, 'A')).isEqualTo(ab);
        assertThat(tree.childByFirstSymbol(ROOT, 'B')).isEqualTo(b);
        assertThat(tree.childByFirstSymbol(ROOT, 'C')).isEqualTo(NO_NODE);
        assertThat(tree.parentOf(b)).isEqualTo(ROOT);
        assertThat(tree.outDegree(ROOT)).isEqualTo(2);
        assertThat(tree.isLeaf(ab)).isTrue();
        assertThat(tree.isLeaf(ROOT)).isFalse();
        assertThat(tree.leafCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject a second edge with the same first symbol from one parent")
    void shouldRejectDuplicateFirstSymbol() {
        tree.attach(ROOT, tree.createLeaf(0), 'A', 5, 5);
        int other = tree.createLeaf(3);

        assertThatThrownBy(() -> tree.attach(ROOT, other, 'A', 2, 5))
                .isInstanceOf(SuffixTreeException.class)
                .extracting(e -> ((SuffixTreeException) e).getKind())
                .isEqualTo(SuffixTreeException.Kind.STRUCTURAL_INVARIANT);
    }

    @Test
    @DisplayName("should reject attaching a node that already has a parent")
    void shouldRejectSecondParent() {
        int leaf = tree.createLeaf(0);
        tree.attach(ROOT, leaf, 'A', 5, 5);
        int mid = tree.createNode();
        tree.attach(ROOT, mid, 'B', 1, 2);

        assertThatThrownBy(() -> tree.attach(mid, leaf, 'C', 3, 5))
                .isInstanceOf(SuffixTreeException.class);
    }

    @Test
    @DisplayName("should split an edge so the two new labels concatenate to the original")
    void shouldSplitEdgePreservingLabel() {
        int leaf = tree.createLeaf(0);
        Edge<Character> original = tree.attach(ROOT, leaf, 'A', 5, 5);
        List<Character> originalLabel = new ArrayList<>(tree.label(original));

        int mid = tree.splitEdge(original, 2);

        Edge<Character> upper = tree.incomingEdge(mid);
        Edge<Character> lower = tree.incomingEdge(leaf);
        List<Character> joined = new ArrayList<>(tree.label(upper));
        joined.addAll(tree.label(lower));

        assertThat(joined).isEqualTo(originalLabel);
        assertThat(tree.label(upper)).containsExactly('A', 'B');
        assertThat(tree.label(lower)).containsExactly('C', 'A', 'B');
        assertThat(upper.getFirstSymbol()).isEqualTo('A');
        assertThat(lower.getFirstSymbol()).isEqualTo('C');
        assertThat(lower.getEndOffset()).isEqualTo(original.getEndOffset());
        assertThat(tree.parentOf(leaf)).isEqualTo(mid);
        assertThat(tree.parentOf(mid)).isEqualTo(ROOT);
        assertThat(tree.children(ROOT).toIntArray()).containsExactly(mid);
        assertThat(tree.children(mid).toIntArray()).containsExactly(leaf);
        assertThat(tree.childByFirstSymbol(ROOT, 'A')).isEqualTo(mid);
        assertThat(tree.path(leaf)).isEqualTo(chars("ABCAB"));
    }

    @Test
    @DisplayName("should reject split offsets outside the edge")
    void shouldRejectSplitOutsideEdge() {
        Edge<Character> edge = tree.attach(ROOT, tree.createLeaf(0), 'A', 5, 5);

        assertThatThrownBy(() -> tree.splitEdge(edge, 0))
                .isInstanceOf(SuffixTreeException.class)
                .extracting(e -> ((SuffixTreeException) e).getKind())
                .isEqualTo(SuffixTreeException.Kind.STRUCTURAL_INVARIANT);
        assertThatThrownBy(() -> tree.splitEdge(edge, 5))
                .isInstanceOf(SuffixTreeException.class);
        assertThat(tree.nodeCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject splitting an edge that was already replaced")
    void shouldRejectSplittingStaleEdge() {
        Edge<Character> edge = tree.attach(ROOT, tree.createLeaf(0), 'A', 5, 5);
        tree.splitEdge(edge, 1);

        assertThatThrownBy(() -> tree.splitEdge(edge, 2))
                .isInstanceOf(SuffixTreeException.class);
    }

    @Test
    @DisplayName("should sum edge lengths from the root")
    void shouldComputeLengthFromRoot() {
        int mid = tree.createNode();
        tree.attach(ROOT, mid, 'A', 2, 2);
        int leaf = tree.createLeaf(0);
        tree.attach(mid, leaf, 'C', 3, 5);

        assertThat(tree.length(ROOT)).isZero();
        assertThat(tree.length(mid)).isEqualTo(2);
        assertThat(tree.length(leaf)).isEqualTo(5);
        assertThat(tree.path(ROOT)).isEmpty();
        assertThat(tree.path(leaf)).containsExactly('A', 'B', 'C', 'A', 'B');
        assertThat(tree.edges()).hasSize(2);
    }

    @Test
    @DisplayName("should refuse label, path and length queries before a sequence is set")
    void shouldRefuseQueriesOnUninitializedStore() {
        SuffixTree<Character> empty = new SuffixTree<>(new SequenceStore<>());

        assertThatThrownBy(() -> empty.path(ROOT))
                .isInstanceOf(SuffixTreeException.class)
                .extracting(e -> ((SuffixTreeException) e).getKind())
                .isEqualTo(SuffixTreeException.Kind.UNINITIALIZED_STORE);
        assertThatThrownBy(() -> empty.length(ROOT))
                .isInstanceOf(SuffixTreeException.class);
        assertThatThrownBy(empty::sequenceLength)
                .isInstanceOf(SuffixTreeException.class);
    }

    @Test
    @DisplayName("should reject unknown node ids")
    void shouldRejectUnknownNodes() {
        assertThatThrownBy(() -> tree.parentOf(7)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tree.getLink(-1, 'A')).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should list children in attach order behind a read-only view")
    void shouldExposeReadOnlyChildren() {
        int first = tree.createLeaf(0);
        int second = tree.createLeaf(1);
        tree.attach(ROOT, first, 'A', 5, 5);
        tree.attach(ROOT, second, 'B', 4, 5);

        IntList children = tree.children(ROOT);

        assertThat(children.toIntArray()).containsExactly(first, second);
        assertThat(children.getInt(1)).isEqualTo(second);
        assertThat(tree.outDegree(ROOT)).isEqualTo(2);
        assertThatThrownBy(() -> children.add(first)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> children.removeInt(0)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should convert character sequences to symbol lists")
    void shouldConvertCharacters() {
        assertThat(SuffixTree.characters("AB$")).containsExactly('A', 'B', '$');
        assertThat(SuffixTree.characters(new StringBuilder("xy"))).containsExactly('x', 'y');
        assertThat(SuffixTree.characters("")).isEmpty();
        assertThatThrownBy(() -> SuffixTree.characters(null)).isInstanceOf(NullPointerException.class);
    }
}

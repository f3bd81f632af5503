package tree.suffix;

/**
 * Directed parent to child edge. The label is not stored; it is
 * sequence[endOffset - length, endOffset).
 */
public final class Edge<T> {
    private final int parent;
    private final int child;
    private final T firstSymbol;
    private final int length;
    private final int endOffset;

    Edge(int parent, int child, T firstSymbol, int length, int endOffset) {
        this.parent = parent;
        this.child = child;
        this.firstSymbol = firstSymbol;
        this.length = length;
        this.endOffset = endOffset;
    }

    public int getParent() {
        return parent;
    }

    public int getChild() {
        return child;
    }

    public T getFirstSymbol() {
        return firstSymbol;
    }

    public int getLength() {
        return length;
    }

    /**
     * Exclusive end of this edge's label in the sequence.
     */
    public int getEndOffset() {
        return endOffset;
    }

    public int getStartOffset() {
        return endOffset - length;
    }

    @Override
    public String toString() {
        return parent + "->" + child + " [" + getStartOffset() + ", " + endOffset + ")";
    }
}

package tree.suffix;

import utilities.MemUtil;
import utilities.TreeLogger;

import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Drives construction of one {@link SuffixTree}. Suffixes are inserted from the shortest,
 * sequence-final one towards the full sequence: step i inserts sequence[n - i:], one symbol longer
 * and starting one position earlier than the step before, so links set by earlier steps shorten
 * the climb of later ones.
 *
 * A builder owns exactly one tree and accepts exactly one sequence. Use {@link #build(List)} for
 * the whole run, or {@link #start(List)} followed by {@link #extendNext()} to observe the tree
 * between steps.
 */
public final class SuffixTreeBuilder<T> {

    private final SuffixTreeConfiguration config;
    private final SequenceStore<T> store = new SequenceStore<>();
    private final SuffixTree<T> tree;

    private SuffixExtender<T> extender;
    private int processed;
    private boolean finished;
    private long startNanos;

    public SuffixTreeBuilder() {
        this(SuffixTreeConfiguration.defaults());
    }

    public SuffixTreeBuilder(SuffixTreeConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
        this.tree = new SuffixTree<>(store);
    }

    /**
     * The tree under construction. Before {@link #start(List)} it holds only the root and its
     * label/path/length queries fail with {@link SuffixTreeException.Kind#UNINITIALIZED_STORE}.
     */
    public SuffixTree<T> tree() {
        return tree;
    }

    public SuffixTree<T> build(List<? extends T> sequence) {
        start(sequence);
        return finish();
    }

    /**
     * Fix the sequence for this builder. Fails with {@link SuffixTreeException.Kind#ALREADY_BUILT}
     * on a second call.
     */
    public void start(List<? extends T> sequence) {
        Objects.requireNonNull(sequence, "sequence");
        if (sequence.size() > config.maxLength()) {
            throw new IllegalArgumentException("sequence length " + sequence.size()
                    + " exceeds configured maximum " + config.maxLength());
        }
        store.set(sequence);
        int n = store.length();
        tree.ensureCapacity(2 * n + 1);
        extender = new SuffixExtender<>(tree, new SymbolGuard(config.requireValueEquality()));
        processed = 0;

        if (config.warnOnRepeatedTerminal() && hasRepeatedTerminal()) {
            TreeLogger.warning("Final symbol " + store.symbolAt(n - 1) + " also occurs earlier in the sequence;"
                    + " some suffixes will end at internal nodes and the tree will have fewer than " + n + " leaves");
        }
        TreeLogger.debug("Building suffix tree over " + n + " symbols");
        startNanos = System.nanoTime();
    }

    public boolean hasNext() {
        return extender != null && processed < store.length();
    }

    /**
     * Insert the next (one symbol longer) suffix.
     *
     * @return id of the new leaf
     */
    public int extendNext() {
        if (extender == null) {
            throw new SuffixTreeException(SuffixTreeException.Kind.UNINITIALIZED_STORE,
                    "start(sequence) has not been called");
        }
        int n = store.length();
        if (processed >= n) {
            throw new NoSuchElementException("all " + n + " suffixes have been inserted");
        }
        int start = n - processed - 1;
        int leaf;
        try {
            leaf = extender.extend(start);
        } catch (SuffixTreeException e) {
            TreeLogger.error("Suffix tree construction aborted at offset " + start + ": " + e.getMessage());
            throw e;
        }
        processed++;
        return leaf;
    }

    /**
     * Number of suffixes inserted so far.
     */
    public int processed() {
        return processed;
    }

    /**
     * Insert every remaining suffix and return the finished tree.
     */
    public SuffixTree<T> finish() {
        if (extender == null) {
            throw new SuffixTreeException(SuffixTreeException.Kind.UNINITIALIZED_STORE,
                    "start(sequence) has not been called");
        }
        while (hasNext()) {
            extendNext();
        }
        if (!finished) {
            finished = true;
            if (config.verifyInvariants()) {
                TreeValidator.validate(tree);
            }
            double elapsedMs = (System.nanoTime() - startNanos) / 1_000_000.0;
            TreeLogger.debug(String.format(Locale.ROOT,
                    "Built suffix tree: symbols=%d nodes=%d leaves=%d in %.3f ms",
                    store.length(), tree.nodeCount(), tree.leafCount(), elapsedMs));
            if (config.reportMemory()) {
                TreeLogger.info(new MemUtil().jolMemoryReport(tree, false));
            }
        }
        return tree;
    }

    private boolean hasRepeatedTerminal() {
        int n = store.length();
        if (n < 2) {
            return false;
        }
        T last = store.symbolAt(n - 1);
        for (int i = 0; i < n - 1; i++) {
            if (Objects.equals(store.symbolAt(i), last)) {
                return true;
            }
        }
        return false;
    }
}

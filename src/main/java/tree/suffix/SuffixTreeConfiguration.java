package tree.suffix;

// Immutable configuration for constructing suffix trees.
public final class SuffixTreeConfiguration {

    // node ids are ints and a tree over n symbols holds up to 2n + 1 nodes
    public static final int MAX_SUPPORTED_LENGTH = (Integer.MAX_VALUE - 1) / 2;

    private static final SuffixTreeConfiguration DEFAULTS = builder().build();

    private final boolean requireValueEquality;
    private final boolean verifyInvariants;
    private final boolean reportMemory;
    private final boolean warnOnRepeatedTerminal;
    private final int maxLength;

    private SuffixTreeConfiguration(Builder builder) {
        this.requireValueEquality = builder.requireValueEquality;
        this.verifyInvariants = builder.verifyInvariants;
        this.reportMemory = builder.reportMemory;
        this.warnOnRepeatedTerminal = builder.warnOnRepeatedTerminal;
        this.maxLength = builder.maxLength;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static SuffixTreeConfiguration defaults() { return DEFAULTS; }

    private void validate() {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive");
        }
        if (maxLength > MAX_SUPPORTED_LENGTH) {
            throw new IllegalArgumentException("maxLength must be at most " + MAX_SUPPORTED_LENGTH);
        }
    }

    public boolean requireValueEquality() { return requireValueEquality; }
    public boolean verifyInvariants() { return verifyInvariants; }
    public boolean reportMemory() { return reportMemory; }
    public boolean warnOnRepeatedTerminal() { return warnOnRepeatedTerminal; }
    public int maxLength() { return maxLength; }

    public static final class Builder {
        private boolean requireValueEquality = true;
        private boolean verifyInvariants;
        private boolean reportMemory;
        private boolean warnOnRepeatedTerminal = true;
        private int maxLength = MAX_SUPPORTED_LENGTH;

        private Builder() {
        }

        public Builder requireValueEquality(boolean requireValueEquality) {
            this.requireValueEquality = requireValueEquality;
            return this;
        }

        public Builder verifyInvariants(boolean verifyInvariants) {
            this.verifyInvariants = verifyInvariants;
            return this;
        }

        public Builder reportMemory(boolean reportMemory) {
            this.reportMemory = reportMemory;
            return this;
        }

        public Builder warnOnRepeatedTerminal(boolean warnOnRepeatedTerminal) {
            this.warnOnRepeatedTerminal = warnOnRepeatedTerminal;
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public SuffixTreeConfiguration build() {
            return new SuffixTreeConfiguration(this);
        }
    }
}

package utilities;

import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;
import tree.suffix.SuffixTree;

import java.util.Locale;

public class MemUtil {

    // Retained size of the tree: arena, edges, link tables and the stored sequence.
    public long footprintBytes(SuffixTree<?> tree) {
        return GraphLayout.parseInstance(tree).totalSize();
    }

    // JOL report for a suffix tree, optionally with the class-by-class footprint table.
    public String jolMemoryReport(SuffixTree<?> tree, boolean includeFootprintTable) {
        return jolMemoryReportWithTotal(tree, includeFootprintTable).report();
    }

    // Like jolMemoryReport but also returns the total size.
    public MemoryUsageReport jolMemoryReportWithTotal(SuffixTree<?> tree, boolean includeFootprintTable) {
        StringBuilder sb = new StringBuilder(4_096);

        // VM details (useful to interpret alignment, header sizes, and compressed oops status)
        sb.append("=== JOL / VM details ===\n");
        sb.append(VM.current().details()).append('\n');

        GraphLayout total = GraphLayout.parseInstance(tree);
        long totalBytes = total.totalSize();
        sb.append("\n=== Suffix tree (tree as root) ===\n");
        sb.append("Symbols           : ").append(tree.sequenceLength()).append('\n');
        sb.append("Nodes             : ").append(tree.nodeCount()).append('\n');
        sb.append("Total bytes       : ").append(totalBytes).append(" B\n");
        sb.append("Total bytes (MiB) : ")
                .append(String.format(Locale.ROOT, "%.3f", totalBytes / (1024.0 * 1024.0)))
                .append(" MiB\n");
        if (tree.nodeCount() > 0) {
            sb.append("Bytes per node    : ")
                    .append(String.format(Locale.ROOT, "%.1f", (double) totalBytes / tree.nodeCount()))
                    .append('\n');
        }

        if (includeFootprintTable) {
            sb.append("\n--- Class footprint ---\n");
            sb.append(total.toFootprint()).append('\n');
        }
        return new MemoryUsageReport(sb.toString(), totalBytes);
    }
}

package utilities;

/** Human-readable JOL report of a suffix tree together with its retained size. */
public record MemoryUsageReport(String report, long totalBytes) {

    public double totalMiB() {
        return totalBytes / (1024.0 * 1024.0);
    }
}

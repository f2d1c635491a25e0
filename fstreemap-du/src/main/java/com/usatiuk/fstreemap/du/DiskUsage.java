package com.usatiuk.fstreemap.du;

import com.usatiuk.fstreemap.Directory;
import com.usatiuk.fstreemap.FsTreeMap;
import com.usatiuk.fstreemap.ValueAdder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * A {@code du}-like report of directory sizes for a tree holding file sizes.
 */
public class DiskUsage {
    private static final Logger LOGGER = Logger.getLogger(DiskUsage.class.getName());

    private final List<DiskUsageEntry> _entries;

    private DiskUsage(List<DiskUsageEntry> entries) {
        _entries = entries;
    }

    /**
     * Compute the size of every directory in the tree.
     *
     * @param tree the tree with file sizes as values
     * @return the report, with directories in depth-first order, root first
     */
    public static DiskUsage of(FsTreeMap<Long> tree) {
        var entries = new ArrayList<DiskUsageEntry>();
        collect(tree.root(), List.of(), entries);
        LOGGER.fine(() -> "Computed sizes of " + entries.size() + " directories");
        return new DiskUsage(List.copyOf(entries));
    }

    /**
     * Add the entries of a directory and its subdirectories, parents first
     *
     * @return the total size of the directory
     */
    private static long collect(Directory<Long> dir, List<String> segments, List<DiskUsageEntry> out) {
        int index = out.size();
        out.add(null);
        long total = 0;
        for (var child : dir.children()) {
            if (child instanceof Directory<Long> sub)
                total += collect(sub, append(segments, sub.name()), out);
            else
                total += child.getValue(ValueAdder.LONG);
        }
        out.set(index, new DiskUsageEntry(segments, total));
        return total;
    }

    private static List<String> append(List<String> segments, String name) {
        var ret = new ArrayList<String>(segments.size() + 1);
        ret.addAll(segments);
        ret.add(name);
        return ret;
    }

    public List<DiskUsageEntry> entries() {
        return _entries;
    }

    public long totalSize() {
        return _entries.get(0).size();
    }

    /**
     * Find the directories not bigger than the limit.
     *
     * @param limit the maximum size, inclusive
     * @return the matching directories, in report order
     */
    public List<DiskUsageEntry> directoriesAtMost(long limit) {
        return _entries.stream().filter(e -> e.size() <= limit).toList();
    }

    /**
     * Find the smallest directory that is at least as big as required.
     *
     * @param required the minimum size, inclusive
     * @return the first smallest matching directory in report order, or empty if none is big enough
     */
    public Optional<DiskUsageEntry> smallestAtLeast(long required) {
        return _entries.stream()
                .filter(e -> e.size() >= required)
                .min(Comparator.comparingLong(DiskUsageEntry::size));
    }

    /**
     * Get the biggest directories, ties kept in report order.
     *
     * @param n how many directories to return
     * @return up to n directories, biggest first
     * @throws IllegalArgumentException if n is negative
     */
    public List<DiskUsageEntry> largest(int n) {
        if (n < 0)
            throw new IllegalArgumentException("Negative directory count: " + n);
        return _entries.stream()
                .sorted(Comparator.comparingLong(DiskUsageEntry::size).reversed())
                .limit(n)
                .toList();
    }

    /**
     * Format the report like {@code du}, one {@code size<TAB>path} line per directory, root shown as {@code .}
     *
     * @return the formatted report
     */
    public String format() {
        return _entries.stream()
                .map(e -> e.size() + "\t" + e.path().orElse("."))
                .collect(Collectors.joining("\n", "", "\n"));
    }
}

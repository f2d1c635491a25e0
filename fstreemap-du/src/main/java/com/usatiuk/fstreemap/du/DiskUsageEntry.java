package com.usatiuk.fstreemap.du;

import java.util.List;
import java.util.Optional;

/**
 * Total size of a directory.
 *
 * @param segments the names leading to the directory from the root, empty for the root itself
 * @param size     the total of all file sizes under the directory
 */
public record DiskUsageEntry(List<String> segments, long size) {
    public DiskUsageEntry {
        segments = List.copyOf(segments);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /**
     * Get the path of the directory, usable with {@link com.usatiuk.fstreemap.FsTreeMap#getNode(String)}.
     *
     * @return the {@code /}-joined path, or empty for the root, which has no path
     */
    public Optional<String> path() {
        if (isRoot())
            return Optional.empty();
        return Optional.of(String.join("/", segments));
    }
}

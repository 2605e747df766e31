package com.adlanda.contextassembler.model;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, deduplicated list of project-relative paths.
 *
 * All paths use '/' as separator and carry no leading "./" or "/".
 * {@link #of(Collection)} keeps the first occurrence of a path and drops later duplicates;
 * the constructor expects already-unique paths and rejects duplicates.
 */
public final class FileTree {

    private final List<String> paths;
    private final Map<String, Integer> positions;

    /**
     * @param paths relative paths in scan order, without duplicates
     * @throws IllegalArgumentException if a path occurs more than once
     */
    public FileTree(List<String> paths) {
        this.paths = List.copyOf(paths);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < this.paths.size(); i++) {
            if (index.putIfAbsent(this.paths.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate path in file tree: " + this.paths.get(i));
            }
        }
        this.positions = Map.copyOf(index);
    }

    /**
     * Builds a tree from raw paths, normalizing separators and dropping duplicates.
     */
    public static FileTree of(Collection<String> rawPaths) {
        Set<String> unique = new LinkedHashSet<>();
        for (String raw : rawPaths) {
            String normalized = normalize(raw);
            if (!normalized.isEmpty()) {
                unique.add(normalized);
            }
        }
        return new FileTree(List.copyOf(unique));
    }

    public static FileTree empty() {
        return new FileTree(List.of());
    }

    /**
     * Converts a path to the canonical form used throughout the pipeline.
     */
    public static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String p = path.trim().replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        while (p.contains("//")) {
            p = p.replace("//", "/");
        }
        return p;
    }

    /**
     * Number of directories above the file ("a/b/c.txt" has depth 2).
     */
    public static int depth(String path) {
        int depth = 0;
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == '/') {
                depth++;
            }
        }
        return depth;
    }

    /**
     * Relative paths in scan order.
     */
    public List<String> paths() {
        return paths;
    }

    public boolean contains(String path) {
        return path != null && positions.containsKey(path);
    }

    /**
     * @return position of the path in scan order, or -1 if absent
     */
    public int indexOf(String path) {
        if (path == null) {
            return -1;
        }
        return positions.getOrDefault(path, -1);
    }

    public int size() {
        return paths.size();
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof FileTree other && paths.equals(other.paths);
    }

    @Override
    public int hashCode() {
        return paths.hashCode();
    }

    @Override
    public String toString() {
        return "FileTree[paths=" + paths + "]";
    }
}

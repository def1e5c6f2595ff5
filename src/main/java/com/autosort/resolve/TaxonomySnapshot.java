package com.autosort.resolve;

import com.autosort.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Point-in-time view of existing directory names under a scan root. Children are read once per
 * ancestor and cached for the rest of the scan; directories created later in the same scan are
 * not seen. Read failures yield an empty child list.
 */
public class TaxonomySnapshot {

    private final Path root;
    private final DirectoryTree tree;
    private final Map<Path, List<String>> children = new ConcurrentHashMap<>();

    public TaxonomySnapshot(Path root, DirectoryTree tree) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.tree = Objects.requireNonNull(tree, "tree");
        for (String child : childrenOf(this.root)) {
            childrenOf(this.root.resolve(child));
        }
    }

    public Path getRoot() {
        return root;
    }

    public String getRootName() {
        Path name = root.getFileName();
        return name != null ? name.toString() : root.toString();
    }

    public List<String> childrenOf(Path dir) {
        Path key = dir.toAbsolutePath().normalize();
        return children.computeIfAbsent(key, this::read);
    }

    /**
     * Top-level folders (capped) with a capped list of their children, for prompts.
     */
    public Map<String, List<String>> sample(int maxParents, int maxChildren) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (String parent : childrenOf(root)) {
            if (out.size() >= maxParents) {
                break;
            }
            List<String> kids = childrenOf(root.resolve(parent));
            out.put(parent, new ArrayList<>(kids.subList(0, Math.min(maxChildren, kids.size()))));
        }
        return out;
    }

    /**
     * Directory names down to {@code maxDepth} levels below the root.
     */
    public List<String> directoryNames(int maxDepth) {
        List<String> names = new ArrayList<>();
        collect(root, 1, maxDepth, names);
        return names;
    }

    private void collect(Path dir, int depth, int maxDepth, List<String> names) {
        if (depth > maxDepth) {
            return;
        }
        for (String child : childrenOf(dir)) {
            names.add(child);
            collect(dir.resolve(child), depth + 1, maxDepth, names);
        }
    }

    private List<String> read(Path dir) {
        try {
            return Collections.unmodifiableList(new ArrayList<>(tree.listSubdirectories(dir)));
        } catch (IOException | RuntimeException e) {
            logWarning("Could not list " + dir + ": " + e.getMessage());
            return List.of();
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[TaxonomySnapshot] " + message);
        }
    }
}

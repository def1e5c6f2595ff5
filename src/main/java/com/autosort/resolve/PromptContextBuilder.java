package com.autosort.resolve;

import com.autosort.AppLogger;
import com.autosort.models.PromptContext;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the bounded file description sent with each oracle call.
 */
public class PromptContextBuilder {

    static final int MAX_PARENTS = 12;
    static final int MAX_CHILDREN = 8;
    static final int MAX_SIBLINGS = 12;

    public PromptContext build(ResolutionSession session, Path file) {
        Path root = session.getRoot();
        Path absolute = file.toAbsolutePath().normalize();
        String name = absolute.getFileName() != null ? absolute.getFileName().toString() : absolute.toString();
        Path parent = absolute.getParent() != null ? absolute.getParent() : root;

        String relativeParent = "";
        int depth = 1;
        if (absolute.startsWith(root)) {
            Path rel = root.relativize(absolute);
            depth = rel.getNameCount();
            Path relParent = rel.getParent();
            relativeParent = relParent != null ? relParent.toString().replace('\\', '/') : "";
        }
        String parentName = parent.getFileName() != null ? parent.getFileName().toString() : session.getRootName();
        String ancestors = relativeParent.isEmpty()
            ? session.getRootName()
            : session.getRootName() + "/" + relativeParent;

        long size = 0;
        try {
            size = Files.size(absolute);
        } catch (IOException ignored) {
            // missing or unreadable files are described with size 0
        }

        return PromptContext.builder()
            .rootName(session.getRootName())
            .fileName(name)
            .extension(FileCategories.extension(name))
            .sizeBytes(size)
            .category(FileCategories.categorize(absolute))
            .projectType(session.getProjectType())
            .fileHint(FileCategories.hint(name, size, parentName, ancestors))
            .parentDir(relativeParent)
            .depth(depth)
            .taxonomySample(session.getSnapshot().sample(MAX_PARENTS, MAX_CHILDREN))
            .siblingFiles(siblingFiles(session, parent, name))
            .siblingDirs(cap(session.getSnapshot().childrenOf(parent), MAX_SIBLINGS))
            .namingConvention(session.getGuardrails().getNamingConvention())
            .build();
    }

    private List<String> siblingFiles(ResolutionSession session, Path parent, String self) {
        List<String> out = new ArrayList<>();
        try {
            for (String name : session.getTree().listFiles(parent)) {
                if (!name.equals(self)) {
                    out.add(name);
                }
                if (out.size() >= MAX_SIBLINGS) {
                    break;
                }
            }
        } catch (IOException | RuntimeException e) {
            AppLogger logger = AppLogger.get();
            if (logger != null) {
                logger.warn("[PromptContextBuilder] Could not list files in " + parent + ": " + e.getMessage());
            }
        }
        return out;
    }

    private static List<String> cap(List<String> names, int max) {
        return new ArrayList<>(names.subList(0, Math.min(max, names.size())));
    }
}

package com.autosort.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded description of one file and its surroundings, handed to the oracle.
 */
public final class PromptContext {

    private final String rootName;
    private final String fileName;
    private final String extension;
    private final long sizeBytes;
    private final String category;
    private final String projectType;
    private final String fileHint;
    private final String parentDir;
    private final int depth;
    private final Map<String, List<String>> taxonomySample;
    private final List<String> siblingFiles;
    private final List<String> siblingDirs;
    private final NamingConvention namingConvention;

    private PromptContext(Builder b) {
        this.rootName = b.rootName;
        this.fileName = b.fileName;
        this.extension = b.extension;
        this.sizeBytes = b.sizeBytes;
        this.category = b.category;
        this.projectType = b.projectType;
        this.fileHint = b.fileHint;
        this.parentDir = b.parentDir;
        this.depth = b.depth;
        this.taxonomySample = Collections.unmodifiableMap(new LinkedHashMap<>(b.taxonomySample));
        this.siblingFiles = List.copyOf(b.siblingFiles);
        this.siblingDirs = List.copyOf(b.siblingDirs);
        this.namingConvention = b.namingConvention;
    }

    public String getRootName() {
        return rootName;
    }

    public String getFileName() {
        return fileName;
    }

    public String getExtension() {
        return extension;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public String getCategory() {
        return category;
    }

    public String getProjectType() {
        return projectType;
    }

    public String getFileHint() {
        return fileHint;
    }

    public String getParentDir() {
        return parentDir;
    }

    public int getDepth() {
        return depth;
    }

    public Map<String, List<String>> getTaxonomySample() {
        return taxonomySample;
    }

    public List<String> getSiblingFiles() {
        return siblingFiles;
    }

    public List<String> getSiblingDirs() {
        return siblingDirs;
    }

    public NamingConvention getNamingConvention() {
        return namingConvention;
    }

    /**
     * Short display string, e.g. {@code docs | python | depth:3}.
     */
    public String summary() {
        List<String> parts = new ArrayList<>();
        if (category != null && !"unknown".equals(category)) {
            parts.add(category);
        }
        if (projectType != null && !"unknown".equals(projectType)) {
            parts.add(projectType);
        }
        if (depth > 2) {
            parts.add("depth:" + depth);
        }
        return String.join(" | ", parts);
    }

    /**
     * Fields persisted with a cached suggestion.
     */
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("filename", fileName);
        snapshot.put("extension", extension);
        snapshot.put("parentDir", parentDir);
        snapshot.put("depth", depth);
        snapshot.put("fileCategory", category);
        snapshot.put("projectType", projectType);
        snapshot.put("folderPattern", namingConvention.name().toLowerCase());
        snapshot.put("summary", summary());
        return snapshot;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String rootName = "";
        private String fileName = "";
        private String extension = "";
        private long sizeBytes;
        private String category = "unknown";
        private String projectType = "unknown";
        private String fileHint = "";
        private String parentDir = "";
        private int depth;
        private Map<String, List<String>> taxonomySample = new LinkedHashMap<>();
        private List<String> siblingFiles = new ArrayList<>();
        private List<String> siblingDirs = new ArrayList<>();
        private NamingConvention namingConvention = NamingConvention.UNKNOWN;

        public Builder rootName(String rootName) {
            this.rootName = rootName;
            return this;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder extension(String extension) {
            this.extension = extension;
            return this;
        }

        public Builder sizeBytes(long sizeBytes) {
            this.sizeBytes = sizeBytes;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder projectType(String projectType) {
            this.projectType = projectType;
            return this;
        }

        public Builder fileHint(String fileHint) {
            this.fileHint = fileHint;
            return this;
        }

        public Builder parentDir(String parentDir) {
            this.parentDir = parentDir;
            return this;
        }

        public Builder depth(int depth) {
            this.depth = depth;
            return this;
        }

        public Builder taxonomySample(Map<String, List<String>> taxonomySample) {
            if (taxonomySample != null) {
                this.taxonomySample = taxonomySample;
            }
            return this;
        }

        public Builder siblingFiles(List<String> siblingFiles) {
            if (siblingFiles != null) {
                this.siblingFiles = siblingFiles;
            }
            return this;
        }

        public Builder siblingDirs(List<String> siblingDirs) {
            if (siblingDirs != null) {
                this.siblingDirs = siblingDirs;
            }
            return this;
        }

        public Builder namingConvention(NamingConvention namingConvention) {
            if (namingConvention != null) {
                this.namingConvention = namingConvention;
            }
            return this;
        }

        public PromptContext build() {
            return new PromptContext(this);
        }
    }
}
